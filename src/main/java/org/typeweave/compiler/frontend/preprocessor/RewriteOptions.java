package org.typeweave.compiler.frontend.preprocessor;

/**
 * Options passed to every structural extension.
 *
 * @param fileName The name of the file being rewritten, may be null for anonymous sources.
 * @param mode     The output flavor.
 */
public record RewriteOptions(String fileName, RewriteMode mode) {

    public RewriteOptions {
        mode = mode == null ? RewriteMode.MACRO : mode;
    }
}
