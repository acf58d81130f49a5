package org.typeweave.config;

import com.typesafe.config.Config;
import org.typeweave.compiler.frontend.preprocessor.PreprocessOptions;
import org.typeweave.compiler.frontend.preprocessor.RewriteMode;
import org.typeweave.compiler.host.HostOptions;
import org.typeweave.compiler.macro.MacroRegistry;
import org.typeweave.compiler.pipeline.PipelineOptions;

import java.util.List;
import java.util.Locale;

/**
 * Typed view of the {@code typeweave} configuration block.
 *
 * @param extensions            Names of the enabled built-in syntax extensions.
 * @param mode                  The rewrite mode.
 * @param maxOperatorIterations The operator rewrite iteration cap.
 * @param cacheMaxSize          The bound of the transformed cache tier.
 * @param preprocessExtensions  File suffixes eligible for preprocessing.
 * @param excludedPathSegments  Path segments never preprocessed.
 * @param declarationSuffix     Suffix of declaration files.
 * @param maxExpansionPasses    The macro expansion pass limit.
 */
public record PipelineConfig(List<String> extensions, RewriteMode mode, int maxOperatorIterations, int cacheMaxSize,
                             List<String> preprocessExtensions, List<String> excludedPathSegments,
                             String declarationSuffix, int maxExpansionPasses) {

    public static final String ROOT = "typeweave";

    public PipelineConfig {
        extensions = List.copyOf(extensions);
        preprocessExtensions = List.copyOf(preprocessExtensions);
        excludedPathSegments = List.copyOf(excludedPathSegments);
        if (maxOperatorIterations < 1) {
            throw new IllegalArgumentException("max-operator-iterations must be positive: " + maxOperatorIterations);
        }
        if (cacheMaxSize < 1) {
            throw new IllegalArgumentException("cache.max-size must be positive: " + cacheMaxSize);
        }
        if (maxExpansionPasses < 1) {
            throw new IllegalArgumentException("max-expansion-passes must be positive: " + maxExpansionPasses);
        }
    }

    /**
     * Reads the {@code typeweave} block of a resolved configuration.
     * @param root The resolved configuration, including reference defaults.
     * @return The typed configuration.
     * @throws IllegalArgumentException if a value is out of range or the mode is unknown.
     */
    public static PipelineConfig fromConfig(Config root) {
        Config config = root.getConfig(ROOT);
        Config preprocessor = config.getConfig("preprocessor");
        Config host = config.getConfig("host");
        return new PipelineConfig(
                preprocessor.getStringList("extensions"),
                parseMode(preprocessor.getString("mode")),
                preprocessor.getInt("max-operator-iterations"),
                config.getInt("cache.max-size"),
                host.getStringList("preprocess-extensions"),
                host.getStringList("excluded-path-segments"),
                host.getString("declaration-suffix"),
                config.getInt("macros.max-expansion-passes"));
    }

    /**
     * Builds session options for the configured settings.
     * @param macros    The macros to expand.
     * @param rootFiles The program root files.
     * @return The options.
     */
    public PipelineOptions toPipelineOptions(MacroRegistry macros, List<String> rootFiles) {
        PreprocessOptions preprocess = PreprocessOptions.defaults()
                .withExtensions(extensions)
                .withMode(mode)
                .withMaxOperatorIterations(maxOperatorIterations);
        HostOptions hostOptions = new HostOptions(preprocessExtensions, excludedPathSegments, declarationSuffix);
        return new PipelineOptions(preprocess, hostOptions, cacheMaxSize, maxExpansionPasses, macros, rootFiles);
    }

    private static RewriteMode parseMode(String value) {
        try {
            return RewriteMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown rewrite mode '" + value + "', expected macro or format", e);
        }
    }
}
