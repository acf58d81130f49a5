package org.typeweave.compiler.frontend.preprocessor;

/**
 * Base interface for all preprocessor syntax extensions.
 * An extension is registered under a unique name and is either structural
 * ({@link IStructuralExtension}) or declares a custom operator ({@link ICustomOperatorExtension}).
 */
public interface ISyntaxExtension {

    /**
     * @return The unique registration name of this extension.
     */
    String name();
}
