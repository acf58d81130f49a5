package org.typeweave.compiler.frontend.lexer;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A read-only cursor over the tokens of one source text.
 * <p>
 * Syntax extensions use it for structural lookahead. The static predicates define where the
 * textual extent of an operand must stop.
 */
public class TokenStream {

    private static final Set<TokenKind> BOUNDARY_KINDS = EnumSet.of(
            TokenKind.SEMICOLON,
            TokenKind.COMMA,
            TokenKind.QUESTION,
            TokenKind.ARROW,
            TokenKind.RETURN,
            TokenKind.THROW,
            TokenKind.YIELD,
            TokenKind.CASE,
            TokenKind.DEFAULT,
            TokenKind.CONST,
            TokenKind.LET,
            TokenKind.VAR);

    private final List<Token> tokens;
    private final String source;
    private int current = 0;

    public TokenStream(List<Token> tokens, String source) {
        this.tokens = List.copyOf(tokens);
        this.source = source;
    }

    /**
     * Scans the source and wraps the result.
     * @param source  The source text.
     * @param options The scanner options.
     * @return A stream positioned at the first token.
     */
    public static TokenStream of(String source, ScannerOptions options) {
        return new TokenStream(Scanner.tokenize(source, options), source);
    }

    /**
     * @return The token at the cursor, or null at the end.
     */
    public Token peek() {
        return lookahead(0);
    }

    /**
     * Returns the token {@code n} positions after the cursor without moving it.
     * @param n The distance from the cursor, 0 for the current token.
     * @return The token, or null if it lies past the end.
     */
    public Token lookahead(int n) {
        int index = current + n;
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    /**
     * Returns the token at the cursor and moves past it.
     * @return The consumed token, or null at the end.
     */
    public Token advance() {
        Token token = peek();
        if (token != null) {
            current++;
        }
        return token;
    }

    public boolean isAtEnd() {
        return current >= tokens.size();
    }

    public int position() {
        return current;
    }

    /**
     * Moves the cursor to an absolute token index.
     * @param index The new position.
     */
    public void seek(int index) {
        if (index < 0 || index > tokens.size()) {
            throw new IllegalArgumentException("Token index out of range: " + index);
        }
        this.current = index;
    }

    public Token get(int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    public int size() {
        return tokens.size();
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public String source() {
        return source;
    }

    /**
     * Checks whether the token at an index ends an operand.
     * <p>
     * An {@code =} directly attached to a preceding {@code >} is part of a {@code >=} comparison,
     * which the scanner splits because {@code >} is always a single token.
     * @param index The token index.
     * @return true if the token is a boundary.
     */
    public boolean isBoundary(int index) {
        return isBoundaryAt(tokens, index);
    }

    /**
     * Index-based variant of {@link #isBoundary(int)} for callers that own a mutable token list.
     * @param tokens The tokens.
     * @param index  The token index; positions outside the list count as boundaries.
     * @return true if the token is a boundary.
     */
    public static boolean isBoundaryAt(List<Token> tokens, int index) {
        if (index < 0 || index >= tokens.size()) {
            return true;
        }
        Token token = tokens.get(index);
        if (token.kind() == TokenKind.EQUALS && index > 0) {
            Token previous = tokens.get(index - 1);
            if (previous.kind() == TokenKind.GREATER_THAN && previous.end() == token.start()) {
                return false;
            }
        }
        return isBoundaryToken(token);
    }

    /**
     * Checks whether a token delimits an expression: statement terminators, separators,
     * assignments, arrows, declaration and control keywords, and both halves of a conditional.
     * {@code ?.} and {@code ??} are distinct kinds and do not delimit.
     * @param token The token.
     * @return true if the token is a boundary.
     */
    public static boolean isBoundaryToken(Token token) {
        if (token.isCustomOperator()) {
            return false;
        }
        if (BOUNDARY_KINDS.contains(token.kind()) || token.kind().isAssignment()) {
            return true;
        }
        return token.kind() == TokenKind.COLON;
    }

    public static boolean isOpenBracket(Token token) {
        return switch (token.kind()) {
            case OPEN_PAREN, OPEN_BRACE, OPEN_BRACKET, TEMPLATE_HEAD -> true;
            default -> false;
        };
    }

    public static boolean isCloseBracket(Token token) {
        return switch (token.kind()) {
            case CLOSE_PAREN, CLOSE_BRACE, CLOSE_BRACKET, TEMPLATE_TAIL -> true;
            default -> false;
        };
    }

    /**
     * Finds the index of the bracket that closes the one at {@code openIndex}.
     * Template substitutions count as one bracket pair from head to tail.
     * @param openIndex Index of an opening bracket.
     * @return The index of the matching closer, or -1 if it is missing.
     */
    public int findMatchingClose(int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (isOpenBracket(t)) {
                depth++;
            } else if (isCloseBracket(t)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
                if (depth < 0) {
                    return -1;
                }
            }
        }
        return -1;
    }

    /**
     * Finds the index of the bracket that opens the one at {@code closeIndex}.
     * @param closeIndex Index of a closing bracket.
     * @return The index of the matching opener, or -1 if it is missing.
     */
    public int findMatchingOpen(int closeIndex) {
        int depth = 0;
        for (int i = closeIndex; i >= 0; i--) {
            Token t = tokens.get(i);
            if (isCloseBracket(t)) {
                depth++;
            } else if (isOpenBracket(t)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
                if (depth < 0) {
                    return -1;
                }
            }
        }
        return -1;
    }

    /**
     * Finds the index of the {@code >} that closes the {@code <} at {@code openIndex}, counting
     * only angle brackets at the same paren/brace/bracket depth.
     * @param openIndex Index of a {@code <} token.
     * @return The index of the matching {@code >}, or -1.
     */
    public int findMatchingAngle(int openIndex) {
        int angle = 0;
        int nested = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (isOpenBracket(t)) {
                nested++;
            } else if (isCloseBracket(t)) {
                nested--;
                if (nested < 0) {
                    return -1;
                }
            } else if (nested == 0 && t.kind() == TokenKind.LESS_THAN) {
                angle++;
            } else if (nested == 0 && t.kind() == TokenKind.GREATER_THAN) {
                angle--;
                if (angle == 0) {
                    return i;
                }
            } else if (nested == 0 && (t.kind() == TokenKind.SEMICOLON || t.kind() == TokenKind.LESS_LESS)) {
                return -1;
            }
        }
        return -1;
    }

    /**
     * Returns the index of the first token whose start is at or after the given offset.
     * @param offset A source offset.
     * @return The token index, or {@link #size()} if no token starts there.
     */
    public int indexAtOrAfter(int offset) {
        int lo = 0;
        int hi = tokens.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (tokens.get(mid).start() < offset) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * @return The source text spanned by tokens {@code from} through {@code to} inclusive.
     */
    public String textBetween(int from, int to) {
        return source.substring(tokens.get(from).start(), tokens.get(to).end());
    }
}
