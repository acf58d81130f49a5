package org.typeweave.compiler.frontend.lexer;

/**
 * A single token produced by the {@link Scanner}.
 *
 * @param kind             The token kind.
 * @param text             The exact source text of the token.
 * @param start            The start offset in the source (inclusive).
 * @param end              The end offset in the source (exclusive).
 * @param isCustomOperator True if the token was recognized from a registered custom operator symbol.
 */
public record Token(TokenKind kind, String text, int start, int end, boolean isCustomOperator) {

    public Token(TokenKind kind, String text, int start, int end) {
        this(kind, text, start, end, false);
    }

    /**
     * Returns a copy of this token moved by {@code delta} characters.
     * @param delta The offset shift.
     * @return The shifted token.
     */
    public Token shift(int delta) {
        if (delta == 0) {
            return this;
        }
        return new Token(kind, text, start + delta, end + delta, isCustomOperator);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }
}
