package org.typeweave.compiler.macro;

import org.typeweave.compiler.check.PropertyInfo;
import org.typeweave.compiler.host.SourceFile;

import java.util.List;

/**
 * The capabilities a macro may use while expanding a call.
 */
public interface MacroContext {

    NodeFactory nodeFactory();

    /**
     * @return The type of an expression node, or {@code "unknown"}.
     */
    String typeOf(SyntaxNode node);

    /**
     * @return The members of a named object type, empty if unknown.
     */
    List<PropertyInfo> propertiesOf(String typeName);

    /**
     * Generates an identifier that occurs nowhere in the file and was not handed out before.
     * @param base A readable stem.
     * @return The identifier.
     */
    String uniqueName(String base);

    /**
     * Parses a single expression.
     * @throws IllegalArgumentException if the code is not a well-formed expression.
     */
    SyntaxNode parseExpression(String code);

    /**
     * Parses a statement list.
     * @throws IllegalArgumentException if the code is not well-formed.
     */
    List<SyntaxNode> parseStatements(String code);

    void reportError(SyntaxNode node, String message);

    void reportWarning(SyntaxNode node, String message);

    SourceFile sourceFile();
}
