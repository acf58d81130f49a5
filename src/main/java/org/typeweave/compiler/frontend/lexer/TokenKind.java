package org.typeweave.compiler.frontend.lexer;

/**
 * Token kinds of the host language, plus the synthetic {@link #CUSTOM_OPERATOR} marker.
 * <p>
 * Keywords that downstream passes inspect have their own kind; all other reserved words
 * are reported as {@link #KEYWORD}.
 */
public enum TokenKind {
    // Literals and names
    IDENTIFIER,
    NUMBER,
    STRING,
    REGEX,
    NO_SUBSTITUTION_TEMPLATE,
    TEMPLATE_HEAD,
    TEMPLATE_MIDDLE,
    TEMPLATE_TAIL,
    PRIVATE_NAME,

    // Keywords with structural meaning
    CONST, LET, VAR,
    RETURN, THROW, YIELD, CASE, DEFAULT,
    TYPE, INTERFACE, CLASS, FUNCTION, ENUM, NAMESPACE, DECLARE,
    IMPORT, EXPORT, FROM,
    EXTENDS, IMPLEMENTS, NEW, TYPEOF, KEYOF, AS, IN, INSTANCEOF,
    KEYWORD,

    // Brackets
    OPEN_PAREN, CLOSE_PAREN,
    OPEN_BRACE, CLOSE_BRACE,
    OPEN_BRACKET, CLOSE_BRACKET,

    // Punctuation
    DOT, DOT_DOT_DOT, QUESTION_DOT,
    SEMICOLON, COMMA, COLON, QUESTION, AT, HASH,
    ARROW,
    LESS_THAN, GREATER_THAN, LESS_EQUALS,
    LESS_SLASH,
    EQUALS_EQUALS, EXCLAMATION_EQUALS, EQUALS_EQUALS_EQUALS, EXCLAMATION_EQUALS_EQUALS,
    PLUS, MINUS, ASTERISK, ASTERISK_ASTERISK, SLASH, PERCENT,
    PLUS_PLUS, MINUS_MINUS,
    LESS_LESS,
    AMPERSAND, BAR, CARET, EXCLAMATION, TILDE,
    AMPERSAND_AMPERSAND, BAR_BAR, QUESTION_QUESTION,

    // Assignment
    EQUALS,
    PLUS_EQUALS, MINUS_EQUALS, ASTERISK_EQUALS, ASTERISK_ASTERISK_EQUALS, SLASH_EQUALS, PERCENT_EQUALS,
    LESS_LESS_EQUALS, AMPERSAND_EQUALS, BAR_EQUALS, CARET_EQUALS,
    AMPERSAND_AMPERSAND_EQUALS, BAR_BAR_EQUALS, QUESTION_QUESTION_EQUALS,

    // Synthetic
    CUSTOM_OPERATOR,
    UNKNOWN;

    /**
     * @return true if this kind is a simple or compound assignment.
     */
    public boolean isAssignment() {
        return switch (this) {
            case EQUALS, PLUS_EQUALS, MINUS_EQUALS, ASTERISK_EQUALS, ASTERISK_ASTERISK_EQUALS, SLASH_EQUALS,
                 PERCENT_EQUALS, LESS_LESS_EQUALS, AMPERSAND_EQUALS, BAR_EQUALS, CARET_EQUALS,
                 AMPERSAND_AMPERSAND_EQUALS, BAR_BAR_EQUALS, QUESTION_QUESTION_EQUALS -> true;
            default -> false;
        };
    }

    /**
     * @return true if this kind is a reserved word.
     */
    public boolean isKeyword() {
        return ordinal() >= CONST.ordinal() && ordinal() <= KEYWORD.ordinal();
    }
}
