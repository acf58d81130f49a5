package org.typeweave.compiler.frontend.lexer;

/**
 * A lexical problem found while scanning.
 *
 * @param message The description.
 * @param start   The offset where the problem starts.
 * @param end     The offset where the problem ends.
 */
public record ScanError(String message, int start, int end) {
}
