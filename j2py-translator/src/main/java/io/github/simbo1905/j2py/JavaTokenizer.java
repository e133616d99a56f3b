package io.github.simbo1905.j2py;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Hand-written scanner for the supported Java subset.
///
/// Tokens are produced on demand by `nextToken()`. The scanner tries, in order:
/// whitespace (skipped without a token), `//` and `/* */` comments (hidden channel),
/// string literals, char literals, numbers, identifiers and keywords, symbols (longest
/// match first) and finally a single-character UNKNOWN token, so it can never stall.
/// Once the input is exhausted every call returns the same EOF token.
public final class JavaTokenizer {

    private static final Logger LOG = Logger.getLogger(JavaTokenizer.class.getName());

    private final String input;
    private int pos;
    private int line = 1;
    private int column;
    private Token eof;

    public JavaTokenizer(String input) {
        this.input = Objects.requireNonNull(input, "input must not be null");
    }

    /// Returns the next token, or the (stable) EOF token at the end of input.
    public Token nextToken() {
        while (true) {
            if (pos >= input.length()) {
                return emitEof();
            }

            final int ws = scanWhitespace();
            if (ws > 0) {
                advancePosition(ws);
                continue;
            }

            int len = scanComment();
            if (len > 0) {
                return emit(TokenKind.COMMENT, len, Token.Channel.HIDDEN);
            }
            len = scanQuoted('"');
            if (len > 0) {
                return emit(TokenKind.STRING, len, Token.Channel.DEFAULT);
            }
            len = scanCharLiteral();
            if (len > 0) {
                return emit(TokenKind.CHAR, len, Token.Channel.DEFAULT);
            }
            len = scanNumber();
            if (len > 0) {
                return emit(TokenKind.NUMBER, len, Token.Channel.DEFAULT);
            }
            len = scanIdentifier();
            if (len > 0) {
                final var word = input.substring(pos, pos + len);
                return emit(TokenKind.keywordOrIdentifier(word), len, Token.Channel.DEFAULT);
            }
            for (TokenKind symbol : TokenKind.symbolsLongestFirst()) {
                if (input.startsWith(symbol.spelling(), pos)) {
                    return emit(symbol, symbol.spelling().length(), Token.Channel.DEFAULT);
                }
            }

            final char unknown = input.charAt(pos);
            LOG.finer(() -> "Unrecognized character '" + unknown + "' at line " + line + " column " + column);
            return emit(TokenKind.UNKNOWN, 1, Token.Channel.DEFAULT);
        }
    }

    /// Drains the tokenizer, returning every token up to and including EOF.
    public List<Token> tokenize() {
        final var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.kind() != TokenKind.EOF);
        return tokens;
    }

    private Token emit(TokenKind kind, int length, Token.Channel channel) {
        final var text = input.substring(pos, pos + length);
        final var token = new Token(kind, text, channel, pos, pos + length, line, column);
        advancePosition(length);
        return token;
    }

    private Token emitEof() {
        if (eof == null) {
            eof = new Token(TokenKind.EOF, "", Token.Channel.DEFAULT, input.length(), input.length(), line, column);
            LOG.finest(() -> "EOF at line " + line + " column " + column);
        }
        return eof;
    }

    private void advancePosition(int length) {
        final int end = pos + length;
        final int lastNewline = input.lastIndexOf('\n', end - 1);
        if (lastNewline >= pos) {
            for (int i = pos; i < end; i++) {
                if (input.charAt(i) == '\n') {
                    line++;
                }
            }
            column = end - lastNewline - 1;
        } else {
            column += length;
        }
        pos = end;
    }

    private int scanWhitespace() {
        int i = pos;
        while (i < input.length()) {
            final char c = input.charAt(i);
            if (c != ' ' && c != '\t' && c != '\r' && c != '\n') {
                break;
            }
            i++;
        }
        return i - pos;
    }

    private int scanComment() {
        if (!input.startsWith("/", pos) || pos + 1 >= input.length()) {
            return 0;
        }
        final char next = input.charAt(pos + 1);
        if (next == '/') {
            final int nl = input.indexOf('\n', pos);
            return (nl < 0 ? input.length() : nl) - pos;
        }
        if (next == '*') {
            final int close = input.indexOf("*/", pos + 2);
            // unterminated block comments are left to the symbol rules
            return close < 0 ? 0 : close + 2 - pos;
        }
        return 0;
    }

    /// Scans `q ... q` honouring backslash escapes; returns 0 when unterminated.
    private int scanQuoted(char q) {
        if (input.charAt(pos) != q) {
            return 0;
        }
        int i = pos + 1;
        while (i < input.length()) {
            final char c = input.charAt(i);
            if (c == '\\') {
                if (i + 1 >= input.length()) {
                    return 0;
                }
                i += 2;
                continue;
            }
            if (c == q) {
                return i + 1 - pos;
            }
            i++;
        }
        return 0;
    }

    private int scanCharLiteral() {
        if (input.charAt(pos) != '\'') {
            return 0;
        }
        int i = pos + 1;
        if (i >= input.length()) {
            return 0;
        }
        final char c = input.charAt(i);
        if (c == '\\') {
            i += 2;
        } else if (c == '\'') {
            return 0;
        } else {
            i += 1;
        }
        if (i < input.length() && input.charAt(i) == '\'') {
            return i + 1 - pos;
        }
        return 0;
    }

    private int scanNumber() {
        int i = digitsFrom(pos);
        if (i == pos) {
            return 0;
        }
        if (i + 1 < input.length() && input.charAt(i) == '.' && isDigit(input.charAt(i + 1))) {
            i = digitsFrom(i + 1);
        }
        if (i < input.length() && (input.charAt(i) == 'e' || input.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < input.length() && (input.charAt(j) == '+' || input.charAt(j) == '-')) {
                j++;
            }
            final int expEnd = digitsFrom(j);
            if (expEnd > j) {
                i = expEnd;
            }
        }
        return i - pos;
    }

    private int digitsFrom(int from) {
        int i = from;
        while (i < input.length() && isDigit(input.charAt(i))) {
            i++;
        }
        return i;
    }

    private int scanIdentifier() {
        if (!isIdentifierStart(input.charAt(pos))) {
            return 0;
        }
        int i = pos + 1;
        while (i < input.length() && (isIdentifierStart(input.charAt(i)) || isDigit(input.charAt(i)))) {
            i++;
        }
        return i - pos;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
}
