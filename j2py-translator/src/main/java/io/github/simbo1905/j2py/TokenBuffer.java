package io.github.simbo1905.j2py;

/// Bounded forward lookahead over a token stream, as consumed by `JavaParser`.
public interface TokenBuffer {

    /// Returns the k-th upcoming token without consuming it.
    /// `k == 1` is the next unconsumed token; `k == 0` is defined as no token and yields null.
    /// Lookahead past the end of input yields the EOF token.
    /// @throws IllegalArgumentException if k is negative
    Token lookahead(int k);

    /// Advances past exactly one token.
    /// @throws IllegalStateException if the next token is EOF
    void consume();
}
