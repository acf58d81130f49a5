package org.typeweave.compiler.macro;

import java.util.List;

/**
 * A call of a registered macro.
 *
 * @param callee    The macro name as written.
 * @param arguments The argument expressions.
 * @param node      The whole call expression.
 */
public record CallSite(String callee, List<SyntaxNode> arguments, SyntaxNode node) {

    public CallSite {
        arguments = List.copyOf(arguments);
    }

    public SyntaxNode argument(int index) {
        if (index < 0 || index >= arguments.size()) {
            throw new IllegalArgumentException("Macro '" + callee + "' expects an argument at position " + index
                    + " but got " + arguments.size() + " argument(s)");
        }
        return arguments.get(index);
    }
}
