package org.typeweave.compiler.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.typeweave.compiler.cache.CacheStats;
import org.typeweave.compiler.cache.ContentHasher;
import org.typeweave.compiler.cache.PreprocessedCacheEntry;
import org.typeweave.compiler.cache.TransformCache;
import org.typeweave.compiler.cache.TransformedCacheEntry;
import org.typeweave.compiler.check.Program;
import org.typeweave.compiler.diagnostics.Diagnostic;
import org.typeweave.compiler.diagnostics.DiagnosticsEngine;
import org.typeweave.compiler.frontend.preprocessor.PreProcessor;
import org.typeweave.compiler.host.FileSystemCompilerHost;
import org.typeweave.compiler.host.ICompilerHost;
import org.typeweave.compiler.host.SourceFile;
import org.typeweave.compiler.host.SyntaxValidator;
import org.typeweave.compiler.host.VirtualCompilerHost;
import org.typeweave.compiler.macro.ExpansionResult;
import org.typeweave.compiler.macro.MacroExpander;
import org.typeweave.compiler.sourcemap.SourceMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A build session: preprocesses files through a {@link VirtualCompilerHost}, expands macros against a
 * {@link Program} over the preprocessed text and caches the results incrementally.
 * <p>
 * A cached transformation is reused while the file's content hash and the hashes of every file of its
 * program are unchanged. Invalidating a file also drops the cached transformations of everything that
 * imports it, directly or transitively.
 * <p>
 * Not thread-safe; one session is meant to be driven by one build thread.
 */
public class TransformationPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransformationPipeline.class);

    public static final String PHASE = "pipeline";

    private final PipelineOptions options;
    private final TransformCache cache;
    private final VirtualCompilerHost host;
    private final MacroExpander expander;
    private Program program;

    /**
     * Creates a session reading files from the working directory.
     * @param options The session options.
     */
    public TransformationPipeline(PipelineOptions options) {
        this(new FileSystemCompilerHost(), options);
    }

    /**
     * Creates a session over an arbitrary delegate host.
     * @param delegate The host serving real files.
     * @param options  The session options.
     */
    public TransformationPipeline(ICompilerHost delegate, PipelineOptions options) {
        this.options = options;
        this.cache = new TransformCache(options.cacheMaxSize());
        PreProcessor preProcessor = new PreProcessor();
        SyntaxValidator validator = new SyntaxValidator(preProcessor.operatorDefinitions(options.preprocessOptions()));
        this.host = new VirtualCompilerHost(delegate, preProcessor, options.preprocessOptions(),
                options.hostOptions(), validator, cache);
        this.expander = new MacroExpander(options.macros(), validator, options.maxExpansionPasses());
    }

    /**
     * Transforms an in-memory snippet with default options.
     * @param code     The source text.
     * @param fileName The name the snippet is known by; its suffix picks the grammar variant.
     * @return The result.
     */
    public static TransformResult transformCode(String code, String fileName) {
        try (TransformationPipeline pipeline = new TransformationPipeline(PipelineOptions.defaults())) {
            pipeline.addVirtualFile(fileName, code);
            return pipeline.transform(fileName);
        }
    }

    public void addVirtualFile(String fileName, String content) {
        host.addVirtualFile(fileName, content);
        invalidate(fileName);
    }

    /**
     * Transforms one file, reusing the cached result when it is still valid.
     * @param fileName The file name.
     * @return The result; a missing file yields an unchanged empty result with an error diagnostic.
     */
    public TransformResult transform(String fileName) {
        String canonical = host.getCanonicalFileName(fileName);
        String original = host.readOriginal(canonical);
        if (original == null) {
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            diagnostics.reportError("File not found: " + fileName, canonical, -1, 0, PHASE);
            return new TransformResult(canonical, "", "", null, false, diagnostics.getDiagnostics(), Set.of());
        }
        if (!shouldTransform(canonical)) {
            return new TransformResult(canonical, original, original, null, false, List.of(), Set.of());
        }

        String contentHash = ContentHasher.hash(original);
        if (cache.isTransformedValid(canonical, contentHash, this::currentHash)) {
            log.debug("Transform cache hit for {}", canonical);
            return cache.getTransformed(canonical).result();
        }

        // preprocess before the program sees the file; the program is complete before hashes are recorded
        SourceFile sourceFile = host.getSourceFile(canonical);
        Program fileProgram = Program.create(host, List.of(canonical));

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        for (Diagnostic d : sourceFile.parseDiagnostics()) {
            diagnostics.report(toOriginal(d, sourceFile.map()));
        }

        ExpansionResult expansion = expander.expand(sourceFile, fileProgram.getTypeChecker());
        for (Diagnostic d : expansion.diagnostics()) {
            diagnostics.report(toOriginal(d, sourceFile.map()));
        }

        String code = expansion.code();
        boolean changed = !code.equals(original);
        SourceMap map = changed ? SourceMap.compose(sourceFile.map(), expansion.map()) : null;

        Set<String> dependencies = fileProgram.getImports(canonical);
        Map<String, String> dependencyHashes = new LinkedHashMap<>();
        for (SourceFile dependency : fileProgram.getSourceFiles()) {
            if (!dependency.fileName().equals(canonical)) {
                String hash = currentHash(dependency.fileName());
                if (hash != null) {
                    dependencyHashes.put(dependency.fileName(), hash);
                }
            }
        }

        TransformResult result = new TransformResult(canonical, original, code, map, changed,
                diagnostics.getDiagnostics(), dependencies);
        cache.setTransformed(canonical, new TransformedCacheEntry(result, contentHash, dependencies, dependencyHashes));
        if (result.hasErrors()) {
            log.warn("Transformed {} with errors: {}", canonical, diagnostics.summary());
        } else {
            log.debug("Transformed {} (changed: {}, {} macro expansion(s))", canonical, changed, expansion.expansions());
        }
        return result;
    }

    /**
     * Transforms every eligible file of the program built from the root files.
     * @return The results by canonical file name, in load order.
     */
    public Map<String, TransformResult> transformAll() {
        Map<String, TransformResult> results = new LinkedHashMap<>();
        for (SourceFile file : getProgram().getSourceFiles()) {
            if (shouldTransform(file.fileName())) {
                results.put(file.fileName(), transform(file.fileName()));
            }
        }
        for (String missing : getProgram().getMissingFiles()) {
            results.put(missing, transform(missing));
        }
        return results;
    }

    /**
     * Drops the cached state of a file and of every file that transitively imports it.
     * @param fileName The file name.
     * @return The canonical names of the dependents whose transformations were dropped.
     */
    public Set<String> invalidate(String fileName) {
        String canonical = host.getCanonicalFileName(fileName);
        host.invalidate(canonical);
        Set<String> dependents = cache.invalidate(canonical);
        program = null;
        return dependents;
    }

    public void invalidateAll() {
        host.invalidateAll();
        cache.clear();
        program = null;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    /**
     * @return The preprocessing of a file, or null if it does not exist or is not eligible.
     */
    public PreprocessedCacheEntry getPreprocessedFile(String fileName) {
        return host.getPreprocessedFile(fileName);
    }

    public boolean shouldTransform(String fileName) {
        return host.shouldPreprocess(fileName);
    }

    /**
     * @return The program over the configured root files, created on first use and after invalidation.
     */
    public Program getProgram() {
        if (program == null) {
            program = Program.create(host, options.rootFiles());
        }
        return program;
    }

    public VirtualCompilerHost getHost() {
        return host;
    }

    @Override
    public void close() {
        CacheStats stats = cache.getStats();
        log.debug("Closing pipeline session: {} hit(s), {} miss(es), {} eviction(s)",
                stats.hits(), stats.misses(), stats.evictions());
        invalidateAll();
    }

    private String currentHash(String fileName) {
        String content = host.readOriginal(fileName);
        return content == null ? null : ContentHasher.hash(content);
    }

    /**
     * Moves a diagnostic positioned in served text to the file content.
     */
    private static Diagnostic toOriginal(Diagnostic diagnostic, SourceMap map) {
        if (map == null || diagnostic.start() < 0) {
            return diagnostic;
        }
        int start = map.originalOffsetFor(diagnostic.start());
        int end = map.originalOffsetFor(diagnostic.start() + diagnostic.length());
        return new Diagnostic(diagnostic.severity(), diagnostic.message(), diagnostic.fileName(), start,
                Math.max(0, end - start), diagnostic.phase());
    }
}
