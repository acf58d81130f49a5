package org.typeweave.compiler.check;

import java.util.List;

/**
 * The type queries available to macros.
 */
public interface ITypeChecker {

    /** The type text reported when an expression cannot be typed. */
    String UNKNOWN = "unknown";

    /**
     * Computes the type of an expression as it appears in a file.
     * @param fileName   The file the expression occurs in.
     * @param expression The expression text.
     * @return The type text, or {@link #UNKNOWN}.
     */
    String typeOfExpression(String fileName, String expression);

    /**
     * Enumerates the members of a named object type.
     * @param typeName The type name, optionally with type arguments, which are ignored.
     * @return The members in declaration order, empty if the type is unknown.
     */
    List<PropertyInfo> getPropertiesOfType(String typeName);

    /**
     * @return true if a type with this name is declared anywhere in the program.
     */
    boolean isKnownType(String typeName);
}
