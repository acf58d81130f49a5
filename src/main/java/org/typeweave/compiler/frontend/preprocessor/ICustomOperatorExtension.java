package org.typeweave.compiler.frontend.preprocessor;

/**
 * A syntax extension that introduces an infix operator the host grammar does not know.
 */
public interface ICustomOperatorExtension extends ISyntaxExtension {

    /**
     * @return The operator symbol as it appears in source, e.g. {@code |>}.
     */
    String symbol();

    /**
     * @return The precedence rank; higher binds tighter.
     */
    int precedence();

    Associativity associativity();

    /**
     * Builds the host-language replacement for one operator application.
     * @param left  The trimmed source text of the left operand.
     * @param right The trimmed source text of the right operand.
     * @return The text that replaces {@code left symbol right}.
     */
    String transform(String left, String right);
}
