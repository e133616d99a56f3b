package io.github.simbo1905.j2py;

import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelTokenBufferTest extends J2pyLoggingConfig {
    private static final Logger LOG = Logger.getLogger(ChannelTokenBufferTest.class.getName());

    private static ChannelTokenBuffer buffer(String source) {
        return new ChannelTokenBuffer(new JavaTokenizer(source));
    }

    @Test
    void lookaheadSkipsHiddenTokens() {
        LOG.info(() -> "TEST: lookaheadSkipsHiddenTokens");
        final var tokens = buffer("a /* one */ b // two\n c");

        assertThat(tokens.lookahead(1).text()).isEqualTo("a");
        assertThat(tokens.lookahead(2).text()).isEqualTo("b");
        assertThat(tokens.lookahead(3).text()).isEqualTo("c");
        assertThat(tokens.lookahead(4).kind()).isEqualTo(TokenKind.EOF);
        assertThat(tokens.hiddenSkipped()).isEqualTo(2);
    }

    @Test
    void lookaheadZeroIsNull() {
        LOG.info(() -> "TEST: lookaheadZeroIsNull");
        assertThat(buffer("x").lookahead(0)).isNull();
    }

    @Test
    void negativeLookaheadIsRejected() {
        LOG.info(() -> "TEST: negativeLookaheadIsRejected");
        assertThatThrownBy(() -> buffer("x").lookahead(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void lookaheadPastEndRepeatsEof() {
        LOG.info(() -> "TEST: lookaheadPastEndRepeatsEof");
        final var tokens = buffer("x");
        assertThat(tokens.lookahead(5).kind()).isEqualTo(TokenKind.EOF);
        assertThat(tokens.lookahead(2)).isEqualTo(tokens.lookahead(9));
    }

    @Test
    void consumingEofFails() {
        LOG.info(() -> "TEST: consumingEofFails");
        final var tokens = buffer("x");
        tokens.consume();
        assertThat(tokens.lookahead(1).kind()).isEqualTo(TokenKind.EOF);
        assertThatThrownBy(tokens::consume)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("cannot consume EOF");
    }

    @Provide
    Arbitrary<String> sources() {
        return Arbitraries.strings()
                .withChars("ab01 \n/*;{}()=+\"".toCharArray())
                .ofMaxLength(60);
    }

    /// lookahead(k) before consuming equals lookahead(1) after consuming k-1 tokens.
    @Property(tries = 200)
    void lookaheadAgreesWithConsumption(@ForAll("sources") String source) {
        final List<Token> visible = new JavaTokenizer(source).tokenize().stream()
                .filter(t -> !t.isHidden())
                .collect(Collectors.toList());
        final var tokens = buffer(source);
        for (int i = 0; i < visible.size(); i++) {
            for (int k = 1; k <= 3; k++) {
                final Token expected = i + k - 1 < visible.size()
                        ? visible.get(i + k - 1)
                        : visible.get(visible.size() - 1);
                assertThat(tokens.lookahead(k)).isEqualTo(expected);
            }
            if (visible.get(i).kind() != TokenKind.EOF) {
                tokens.consume();
            }
        }
    }
}
