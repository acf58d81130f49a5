package org.typeweave.compiler.frontend.preprocessor;

/**
 * Operator associativity.
 */
public enum Associativity {
    LEFT,
    RIGHT
}
