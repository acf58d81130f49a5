package org.typeweave.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests cursor movement, boundary classification and bracket matching of the token stream.
 */
public class TokenStreamTest {

    @Test
    @Tag("unit")
    void cursorOperationsWalkTheTokens() {
        TokenStream stream = TokenStream.of("f(a, b)", ScannerOptions.defaults());

        assertThat(stream.peek().text()).isEqualTo("f");
        assertThat(stream.lookahead(2).text()).isEqualTo("a");
        assertThat(stream.advance().text()).isEqualTo("f");
        assertThat(stream.peek().kind()).isEqualTo(TokenKind.OPEN_PAREN);
        assertThat(stream.lookahead(10)).isNull();

        stream.seek(stream.size());
        assertThat(stream.isAtEnd()).isTrue();
        assertThat(stream.advance()).isNull();
        assertThatThrownBy(() -> stream.seek(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void boundaryTokensEndOperands() {
        TokenStream stream = TokenStream.of("x = a |> b; return c", ScannerOptions.defaults());

        assertThat(stream.isBoundary(1)).as("assignment").isTrue();
        assertThat(stream.isBoundary(3)).as("custom operator").isFalse();
        assertThat(stream.isBoundary(5)).as("semicolon").isTrue();
        assertThat(stream.isBoundary(6)).as("return").isTrue();
        assertThat(stream.isBoundary(-1)).as("before start").isTrue();
        assertThat(stream.isBoundary(stream.size())).as("past end").isTrue();
    }

    @Test
    @Tag("unit")
    void conditionalDelimitsButOptionalChainingAndCoalescingDoNot() {
        TokenStream stream = TokenStream.of("c ? a?.b : d ?? e", ScannerOptions.defaults());

        assertThat(stream.isBoundary(1)).as("?").isTrue();
        assertThat(stream.isBoundary(3)).as("?.").isFalse();
        assertThat(stream.isBoundary(5)).as(":").isTrue();
        assertThat(stream.isBoundary(7)).as("??").isFalse();
    }

    @Test
    @Tag("unit")
    void equalsAttachedToGreaterThanIsAComparison() {
        TokenStream stream = TokenStream.of("a >= b", ScannerOptions.defaults());

        // '>' '=' are scanned separately; the '=' is not an assignment here
        assertThat(stream.get(2).kind()).isEqualTo(TokenKind.EQUALS);
        assertThat(stream.isBoundary(2)).isFalse();
    }

    @Test
    @Tag("unit")
    void matchesNestedBracketsInBothDirections() {
        TokenStream stream = TokenStream.of("f(g[1], { k: (2) })", ScannerOptions.defaults());

        int close = stream.findMatchingClose(1);

        assertThat(close).isEqualTo(stream.size() - 1);
        assertThat(stream.findMatchingOpen(close)).isEqualTo(1);
        assertThat(stream.textBetween(1, close)).isEqualTo("(g[1], { k: (2) })");
    }

    @Test
    @Tag("unit")
    void unmatchedBracketYieldsMinusOne() {
        TokenStream stream = TokenStream.of("f(a, b", ScannerOptions.defaults());

        assertThat(stream.findMatchingClose(1)).isEqualTo(-1);
    }

    @Test
    @Tag("unit")
    void angleMatchingIgnoresAnglesInsideOtherBrackets() {
        TokenStream stream = TokenStream.of("Map<K, Fn<(a: X<Y>) => Z>>", ScannerOptions.defaults());

        assertThat(stream.findMatchingAngle(1)).isEqualTo(stream.size() - 1);
        assertThat(TokenStream.of("a < b; c > d", ScannerOptions.defaults()).findMatchingAngle(1)).isEqualTo(-1);
    }

    @Test
    @Tag("unit")
    void indexAtOrAfterFindsFirstTokenFromOffset() {
        TokenStream stream = TokenStream.of("aa  bb cc", ScannerOptions.defaults());

        assertThat(stream.indexAtOrAfter(0)).isEqualTo(0);
        assertThat(stream.indexAtOrAfter(2)).isEqualTo(1);
        assertThat(stream.indexAtOrAfter(100)).isEqualTo(3);
    }
}
