package io.github.simbo1905.j2py;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// `TokenBuffer` that pulls lazily from a `JavaTokenizer` and exposes only default-channel
/// tokens. Hidden tokens (comments) are still drawn from the tokenizer so position
/// bookkeeping advances, but are never returned by `lookahead`.
public final class ChannelTokenBuffer implements TokenBuffer {

    private final JavaTokenizer tokenizer;
    private final List<Token> window = new ArrayList<>();
    private int hiddenSkipped;

    public ChannelTokenBuffer(JavaTokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer must not be null");
    }

    @Override
    public Token lookahead(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("lookahead distance must not be negative: " + k);
        }
        if (k == 0) {
            return null;
        }
        fill(k);
        return window.get(k - 1);
    }

    @Override
    public void consume() {
        fill(1);
        final Token next = window.get(0);
        if (next.kind() == TokenKind.EOF) {
            throw new IllegalStateException("cannot consume EOF");
        }
        window.remove(0);
    }

    /// Number of hidden-channel tokens drawn from the tokenizer so far.
    public int hiddenSkipped() {
        return hiddenSkipped;
    }

    private void fill(int k) {
        while (window.size() < k) {
            if (!window.isEmpty() && window.get(window.size() - 1).kind() == TokenKind.EOF) {
                // EOF is sticky: pad instead of asking the tokenizer again
                window.add(window.get(window.size() - 1));
                continue;
            }
            final Token token = tokenizer.nextToken();
            if (token.isHidden()) {
                hiddenSkipped++;
                continue;
            }
            window.add(token);
        }
    }
}
