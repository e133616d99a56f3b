package io.github.simbo1905.j2py;

import java.util.Objects;

/// A classified, positioned lexical unit.
///
/// `start` is inclusive and `stop` exclusive, so `text` equals `input.substring(start, stop)`.
/// `line` is 1-based and `column` 0-based, both describing the first character.
public record Token(TokenKind kind, String text, Channel channel, int start, int stop, int line, int column) {

    /// Visibility of a token to grammar rules.
    public enum Channel {
        DEFAULT,
        /// Comments: invisible to the parser, still part of the position bookkeeping.
        HIDDEN
    }

    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(channel, "channel must not be null");
        if (start < 0 || stop < start) {
            throw new IllegalArgumentException("invalid token span [" + start + ", " + stop + ")");
        }
    }

    public boolean isHidden() {
        return channel == Channel.HIDDEN;
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + line + ":" + column;
    }
}
