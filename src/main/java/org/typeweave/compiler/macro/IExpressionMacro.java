package org.typeweave.compiler.macro;

/**
 * A macro that rewrites calls of its name into another expression.
 */
public interface IExpressionMacro {

    /**
     * @return The callee name this macro expands.
     */
    String name();

    /**
     * Expands one call.
     * @param call    The call site.
     * @param context The capabilities available during expansion.
     * @return The replacement expression, or null to leave the call untouched.
     */
    SyntaxNode expand(CallSite call, MacroContext context);
}
