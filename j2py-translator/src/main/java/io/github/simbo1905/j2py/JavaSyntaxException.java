package io.github.simbo1905.j2py;

/// Structural syntax error raised by `JavaParser`.
/// Carries the expected and actual token kinds plus the position of the offending token.
/// This is a runtime exception: a failed parse aborts the whole `parse()` call.
public class JavaSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final TokenKind expected;
    private final TokenKind actual;
    private final int line;
    private final int column;
    private final String construct;

    /// Creates an error for a token that did not match the expected kind.
    public JavaSyntaxException(TokenKind expected, Token actual) {
        this(expected, actual, null);
    }

    /// Creates an error for a construct (class, block, switch) left open at end of input.
    /// @param construct human readable name of the unclosed construct, e.g. `class 'Demo'`
    public JavaSyntaxException(TokenKind expected, Token actual, String construct) {
        super(formatMessage(expected, actual, construct));
        this.expected = expected;
        this.actual = actual.kind();
        this.line = actual.line();
        this.column = actual.column();
        this.construct = construct;
    }

    public TokenKind expected() {
        return expected;
    }

    /// The kind found instead, EOF when input ran out.
    public TokenKind actual() {
        return actual;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /// The unclosed construct, or null for a plain token mismatch.
    public String construct() {
        return construct;
    }

    private static String formatMessage(TokenKind expected, Token actual, String construct) {
        final var sb = new StringBuilder();
        if (construct != null) {
            sb.append("Unclosed ").append(construct).append(": ");
        }
        sb.append("expected ").append(expected).append(", got ");
        if (actual.kind() == TokenKind.EOF) {
            sb.append("EOF");
        } else {
            sb.append(actual.kind()).append(" '").append(actual.text()).append("'");
        }
        sb.append(" at line ").append(actual.line()).append(", column ").append(actual.column());
        return sb.toString();
    }
}
