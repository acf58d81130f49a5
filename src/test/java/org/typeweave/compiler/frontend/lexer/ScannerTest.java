package org.typeweave.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the host-language scanner, in particular the recognition of custom operator symbols.
 */
public class ScannerTest {

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).toList();
    }

    @Test
    @Tag("unit")
    void scansDeclarationWithKeywordsAndLiterals() {
        List<Token> tokens = Scanner.tokenize("const x: number = 42; // done", ScannerOptions.defaults());

        assertThat(kinds(tokens)).containsExactly(
                TokenKind.CONST, TokenKind.IDENTIFIER, TokenKind.COLON, TokenKind.IDENTIFIER,
                TokenKind.EQUALS, TokenKind.NUMBER, TokenKind.SEMICOLON);
        assertThat(tokens.get(5).text()).isEqualTo("42");
        assertThat(tokens.get(5).start()).isEqualTo(18);
        assertThat(tokens.get(5).end()).isEqualTo(20);
    }

    @Test
    @Tag("unit")
    void customSymbolIsOneTokenEvenWhenHostWouldSplitIt() {
        // Arrange
        ScannerOptions options = new ScannerOptions(List.of(CustomOperatorDef.of("|>")), FileVariant.STANDARD);

        // Act
        List<Token> tokens = Scanner.tokenize("a |> b", options);

        // Assert
        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(1).kind()).isEqualTo(TokenKind.CUSTOM_OPERATOR);
        assertThat(tokens.get(1).isCustomOperator()).isTrue();
        assertThat(tokens.get(1).text()).isEqualTo("|>");
    }

    @Test
    @Tag("unit")
    void withoutRegistrationTheSymbolSplitsIntoHostPunctuators() {
        List<Token> tokens = Scanner.tokenize("a |> b", new ScannerOptions(List.of(), FileVariant.STANDARD));

        assertThat(kinds(tokens)).containsExactly(
                TokenKind.IDENTIFIER, TokenKind.BAR, TokenKind.GREATER_THAN, TokenKind.IDENTIFIER);
    }

    @Test
    @Tag("unit")
    void longerBuiltinPunctuatorWinsOverShorterCustomSymbol() {
        ScannerOptions options = new ScannerOptions(List.of(CustomOperatorDef.of("+")), FileVariant.STANDARD);

        List<Token> tokens = Scanner.tokenize("i++ + j += 1", options);

        assertThat(kinds(tokens)).containsExactly(
                TokenKind.IDENTIFIER, TokenKind.PLUS_PLUS, TokenKind.CUSTOM_OPERATOR,
                TokenKind.IDENTIFIER, TokenKind.PLUS_EQUALS, TokenKind.NUMBER);
    }

    @Test
    @Tag("unit")
    void greaterThanIsAlwaysASingleToken() {
        List<Token> tokens = Scanner.tokenize("Array<Array<T>>", ScannerOptions.defaults());

        assertThat(kinds(tokens)).containsExactly(
                TokenKind.IDENTIFIER, TokenKind.LESS_THAN, TokenKind.IDENTIFIER, TokenKind.LESS_THAN,
                TokenKind.IDENTIFIER, TokenKind.GREATER_THAN, TokenKind.GREATER_THAN);
    }

    @Test
    @Tag("unit")
    void templateSubstitutionsProduceHeadMiddleAndTail() {
        List<Token> tokens = Scanner.tokenize("`a${x}b${ {y: 1}.y }c`", ScannerOptions.defaults());

        assertThat(kinds(tokens)).startsWith(TokenKind.TEMPLATE_HEAD, TokenKind.IDENTIFIER, TokenKind.TEMPLATE_MIDDLE);
        assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(TokenKind.TEMPLATE_TAIL);
        assertThat(tokens.get(tokens.size() - 1).text()).isEqualTo("}c`");
    }

    @Test
    @Tag("unit")
    void slashAfterOperandIsDivisionAndOtherwiseRegex() {
        List<Token> division = Scanner.tokenize("a / b / c", ScannerOptions.defaults());
        List<Token> regex = Scanner.tokenize("x = /ab+c/gi.test(s)", ScannerOptions.defaults());

        assertThat(kinds(division)).containsExactly(
                TokenKind.IDENTIFIER, TokenKind.SLASH, TokenKind.IDENTIFIER, TokenKind.SLASH, TokenKind.IDENTIFIER);
        assertThat(regex.get(2).kind()).isEqualTo(TokenKind.REGEX);
        assertThat(regex.get(2).text()).isEqualTo("/ab+c/gi");
    }

    @Test
    @Tag("unit")
    void markupVariantScansClosingTagOpener() {
        List<Token> markup = Scanner.tokenize("</div>", ScannerOptions.forFile(List.of(), "view.tsx"));
        List<Token> standard = Scanner.tokenize("a </b", ScannerOptions.forFile(List.of(), "view.ts"));

        assertThat(markup.get(0).kind()).isEqualTo(TokenKind.LESS_SLASH);
        assertThat(standard.get(1).kind()).isEqualTo(TokenKind.LESS_THAN);
    }

    @Test
    @Tag("unit")
    void lexicalProblemsAreCollectedNotThrown() {
        Scanner scanner = new Scanner("const s = \"open\nconst t = `never closed", ScannerOptions.defaults());

        List<Token> tokens = scanner.scanTokens();

        assertThat(tokens).isNotEmpty();
        assertThat(scanner.hasErrors()).isTrue();
        assertThat(scanner.getErrors()).extracting(ScanError::message)
                .contains("Unterminated string literal", "Unterminated template literal");
    }

    @Test
    @Tag("unit")
    void nativePunctuatorsIncludeComposedGreaterThanForms() {
        assertThat(Scanner.isNativePunctuator("**")).isTrue();
        assertThat(Scanner.isNativePunctuator(">>>=")).isTrue();
        assertThat(Scanner.isNativePunctuator("|>")).isFalse();
        assertThat(Scanner.isNativePunctuator("::")).isFalse();
    }
}
