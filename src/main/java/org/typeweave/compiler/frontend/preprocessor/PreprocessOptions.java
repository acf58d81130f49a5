package org.typeweave.compiler.frontend.preprocessor;

import java.util.List;

/**
 * Options for one preprocessing run.
 *
 * @param extensions            Names of the registered extensions to enable, or null for all of them.
 * @param customExtensions      Additional caller-supplied extensions, run after the registered ones.
 * @param fileName              The file name, used to pick the grammar variant; may be null.
 * @param mode                  The output flavor.
 * @param maxOperatorIterations The safety cap on operator rewrite iterations.
 */
public record PreprocessOptions(List<String> extensions,
                                List<ISyntaxExtension> customExtensions,
                                String fileName,
                                RewriteMode mode,
                                int maxOperatorIterations) {

    public static final int DEFAULT_MAX_OPERATOR_ITERATIONS = 1000;

    public PreprocessOptions {
        extensions = extensions == null ? null : List.copyOf(extensions);
        customExtensions = customExtensions == null ? List.of() : List.copyOf(customExtensions);
        mode = mode == null ? RewriteMode.MACRO : mode;
        if (maxOperatorIterations <= 0) {
            throw new IllegalArgumentException("maxOperatorIterations must be positive: " + maxOperatorIterations);
        }
    }

    public static PreprocessOptions defaults() {
        return new PreprocessOptions(null, List.of(), null, RewriteMode.MACRO, DEFAULT_MAX_OPERATOR_ITERATIONS);
    }

    public PreprocessOptions withExtensions(List<String> names) {
        return new PreprocessOptions(names, customExtensions, fileName, mode, maxOperatorIterations);
    }

    public PreprocessOptions withCustomExtensions(List<ISyntaxExtension> custom) {
        return new PreprocessOptions(extensions, custom, fileName, mode, maxOperatorIterations);
    }

    public PreprocessOptions withFileName(String name) {
        return new PreprocessOptions(extensions, customExtensions, name, mode, maxOperatorIterations);
    }

    public PreprocessOptions withMode(RewriteMode newMode) {
        return new PreprocessOptions(extensions, customExtensions, fileName, newMode, maxOperatorIterations);
    }

    public PreprocessOptions withMaxOperatorIterations(int max) {
        return new PreprocessOptions(extensions, customExtensions, fileName, mode, max);
    }
}
