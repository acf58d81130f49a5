package org.typeweave.compiler.pipeline;

import org.typeweave.compiler.frontend.preprocessor.PreprocessOptions;
import org.typeweave.compiler.host.HostOptions;
import org.typeweave.compiler.macro.MacroRegistry;
import org.typeweave.config.ConfigLoader;
import org.typeweave.config.PipelineConfig;

import java.util.List;

/**
 * Settings of one build session.
 *
 * @param preprocessOptions  The preprocessing options; the file name is set per file.
 * @param hostOptions        Which files are preprocessed.
 * @param cacheMaxSize       The bound of the transformed cache tier.
 * @param maxExpansionPasses The macro expansion pass limit.
 * @param macros             The macros to expand.
 * @param rootFiles          The root files of the program.
 */
public record PipelineOptions(PreprocessOptions preprocessOptions, HostOptions hostOptions, int cacheMaxSize,
                              int maxExpansionPasses, MacroRegistry macros, List<String> rootFiles) {

    public PipelineOptions {
        if (preprocessOptions == null || hostOptions == null || macros == null) {
            throw new IllegalArgumentException("Pipeline options must not contain null components");
        }
        if (cacheMaxSize < 1) {
            throw new IllegalArgumentException("cacheMaxSize must be at least 1: " + cacheMaxSize);
        }
        if (maxExpansionPasses < 1) {
            throw new IllegalArgumentException("maxExpansionPasses must be at least 1: " + maxExpansionPasses);
        }
        rootFiles = rootFiles == null ? List.of() : List.copyOf(rootFiles);
    }

    /**
     * Options from {@code reference.conf} with system property and environment overrides applied,
     * no macros and no root files.
     * @throws IllegalArgumentException if an overridden value is out of range.
     */
    public static PipelineOptions defaults() {
        return PipelineConfig.fromConfig(ConfigLoader.loadDefaults()).toPipelineOptions(new MacroRegistry(), List.of());
    }

    public PipelineOptions withPreprocessOptions(PreprocessOptions options) {
        return new PipelineOptions(options, hostOptions, cacheMaxSize, maxExpansionPasses, macros, rootFiles);
    }

    public PipelineOptions withMacros(MacroRegistry registry) {
        return new PipelineOptions(preprocessOptions, hostOptions, cacheMaxSize, maxExpansionPasses, registry, rootFiles);
    }

    public PipelineOptions withRootFiles(List<String> roots) {
        return new PipelineOptions(preprocessOptions, hostOptions, cacheMaxSize, maxExpansionPasses, macros, roots);
    }

    public PipelineOptions withCacheMaxSize(int maxSize) {
        return new PipelineOptions(preprocessOptions, hostOptions, maxSize, maxExpansionPasses, macros, rootFiles);
    }
}
