package org.typeweave.compiler.macro;

/**
 * Coarse syntactic categories of {@link SyntaxNode}s.
 */
public enum NodeKind {
    IDENTIFIER,
    STRING_LITERAL,
    NUMERIC_LITERAL,
    BOOLEAN_LITERAL,
    CALL,
    ARRAY_LITERAL,
    OBJECT_LITERAL,
    EXPRESSION,
    STATEMENT
}
