package org.typeweave.compiler.check;

/**
 * A member of a declared object type.
 *
 * @param name     The member name.
 * @param type     The declared type text; for methods, the return type.
 * @param optional true if declared with {@code ?}.
 * @param method   true if declared with a parameter list.
 */
public record PropertyInfo(String name, String type, boolean optional, boolean method) {
}
