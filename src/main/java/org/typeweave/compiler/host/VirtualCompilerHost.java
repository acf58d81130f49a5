package org.typeweave.compiler.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.typeweave.compiler.cache.ContentHasher;
import org.typeweave.compiler.cache.PreprocessedCacheEntry;
import org.typeweave.compiler.cache.TransformCache;
import org.typeweave.compiler.diagnostics.Diagnostic;
import org.typeweave.compiler.frontend.preprocessor.PreProcessor;
import org.typeweave.compiler.frontend.preprocessor.PreprocessOptions;
import org.typeweave.compiler.frontend.preprocessor.PreprocessResult;
import org.typeweave.compiler.sourcemap.SourceMap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A compiler host that serves preprocessed text in place of file content, so the type checker only ever
 * sees valid host-language syntax.
 * <p>
 * Eligible files are preprocessed on first request and cached in the preprocessed tier of the shared
 * {@link TransformCache}, validated by content hash on every later request. Files the preprocessor
 * leaves unchanged are served as-is. Ineligible files (declaration files, excluded paths, other suffixes)
 * come from the delegate untouched. In-memory files added with {@link #addVirtualFile} take precedence
 * over the delegate.
 * <p>
 * Preprocessed output that still fails syntax validation is not thrown; the errors are attached to the
 * {@link SourceFile} as parse diagnostics.
 */
public class VirtualCompilerHost implements ICompilerHost {

    private static final Logger log = LoggerFactory.getLogger(VirtualCompilerHost.class);

    private final ICompilerHost delegate;
    private final PreProcessor preProcessor;
    private final PreprocessOptions preprocessOptions;
    private final HostOptions hostOptions;
    private final SyntaxValidator validator;
    private final TransformCache cache;

    private final Map<String, String> virtualFiles = new LinkedHashMap<>();
    private final Map<String, List<Diagnostic>> parseDiagnostics = new HashMap<>();
    private final Map<String, String> diagnosedHashes = new HashMap<>();

    /**
     * Creates a host.
     * @param delegate          The host serving real files.
     * @param preProcessor      The preprocessor.
     * @param preprocessOptions The preprocessing options; the file name is set per file.
     * @param hostOptions       The eligibility rules.
     * @param validator         The validator for served text.
     * @param cache             The cache whose preprocessed tier this host uses.
     */
    public VirtualCompilerHost(ICompilerHost delegate, PreProcessor preProcessor, PreprocessOptions preprocessOptions,
                               HostOptions hostOptions, SyntaxValidator validator, TransformCache cache) {
        this.delegate = delegate;
        this.preProcessor = preProcessor;
        this.preprocessOptions = preprocessOptions;
        this.hostOptions = hostOptions;
        this.validator = validator;
        this.cache = cache;
    }

    /**
     * Adds or replaces an in-memory file.
     * @param fileName The file name.
     * @param content  The file content.
     */
    public void addVirtualFile(String fileName, String content) {
        if (content == null) {
            throw new IllegalArgumentException("Virtual file content must not be null: " + fileName);
        }
        virtualFiles.put(getCanonicalFileName(fileName), content);
    }

    /**
     * Removes an in-memory file and its cached preprocessing.
     * @return true if the file existed.
     */
    public boolean removeVirtualFile(String fileName) {
        String canonical = getCanonicalFileName(fileName);
        invalidate(canonical);
        return virtualFiles.remove(canonical) != null;
    }

    public boolean isVirtualFile(String fileName) {
        return virtualFiles.containsKey(getCanonicalFileName(fileName));
    }

    public Set<String> getVirtualFileNames() {
        return Set.copyOf(virtualFiles.keySet());
    }

    /**
     * Reads the raw content of a file, in-memory files first.
     * @return The content, or null if the file does not exist.
     */
    public String readOriginal(String fileName) {
        String canonical = getCanonicalFileName(fileName);
        String virtual = virtualFiles.get(canonical);
        return virtual != null ? virtual : delegate.readFile(fileName);
    }

    /**
     * @return true if the file is eligible for preprocessing.
     */
    public boolean shouldPreprocess(String fileName) {
        return hostOptions.shouldPreprocess(getCanonicalFileName(fileName));
    }

    /**
     * Returns the preprocessing of a file, computing it if the cached entry is missing or stale.
     * @param fileName The file name.
     * @return The entry, or null if the file does not exist or is not eligible.
     */
    public PreprocessedCacheEntry getPreprocessedFile(String fileName) {
        String canonical = getCanonicalFileName(fileName);
        if (!hostOptions.shouldPreprocess(canonical)) {
            return null;
        }
        String content = readOriginal(fileName);
        if (content == null) {
            cache.removePreprocessed(canonical);
            return null;
        }
        String hash = ContentHasher.hash(content);
        if (cache.isPreprocessedValid(canonical, hash)) {
            log.debug("Preprocessed cache hit for {}", canonical);
            return cache.getPreprocessed(canonical);
        }

        PreprocessResult result = preProcessor.preprocess(content, preprocessOptions.withFileName(canonical));
        PreprocessedCacheEntry entry = new PreprocessedCacheEntry(content, result.code(), result.map(), hash);
        cache.setPreprocessed(canonical, entry);
        parseDiagnostics.remove(canonical);
        log.debug("Preprocessed {} (changed: {})", canonical, result.changed());
        return entry;
    }

    @Override
    public SourceFile getSourceFile(String fileName) {
        String canonical = getCanonicalFileName(fileName);
        PreprocessedCacheEntry entry = getPreprocessedFile(fileName);
        if (entry != null) {
            List<Diagnostic> diagnostics = diagnose(canonical, entry);
            return new SourceFile(canonical, entry.code(), entry.changed(), diagnostics, entry.map());
        }
        String virtual = virtualFiles.get(canonical);
        if (virtual != null) {
            return SourceFile.plain(canonical, virtual);
        }
        return delegate.getSourceFile(fileName);
    }

    @Override
    public String readFile(String fileName) {
        PreprocessedCacheEntry entry = getPreprocessedFile(fileName);
        return entry != null ? entry.code() : readOriginal(fileName);
    }

    @Override
    public boolean fileExists(String fileName) {
        return virtualFiles.containsKey(getCanonicalFileName(fileName)) || delegate.fileExists(fileName);
    }

    @Override
    public String getCurrentDirectory() {
        return delegate.getCurrentDirectory();
    }

    @Override
    public String getCanonicalFileName(String fileName) {
        return delegate.getCanonicalFileName(fileName);
    }

    /**
     * @return The parse diagnostics of the served text of a file, empty if it was not validated yet.
     */
    public List<Diagnostic> getParseDiagnostics(String fileName) {
        return parseDiagnostics.getOrDefault(getCanonicalFileName(fileName), List.of());
    }

    /**
     * @return The raw content of a file whose preprocessing changed it, or null.
     */
    public String getOriginalContent(String fileName) {
        PreprocessedCacheEntry entry = cache.getPreprocessed(getCanonicalFileName(fileName));
        return entry != null && entry.changed() ? entry.original() : null;
    }

    /**
     * @return The source map of a file whose preprocessing changed it, or null.
     */
    public SourceMap getSourceMap(String fileName) {
        PreprocessedCacheEntry entry = cache.getPreprocessed(getCanonicalFileName(fileName));
        return entry != null ? entry.map() : null;
    }

    /**
     * @return true if the file has a cached preprocessing that differs from its content.
     */
    public boolean hasPreprocessed(String fileName) {
        PreprocessedCacheEntry entry = cache.getPreprocessed(getCanonicalFileName(fileName));
        return entry != null && entry.changed();
    }

    /**
     * @return The names of all files with a cached preprocessing.
     */
    public List<String> getCachedFileNames() {
        List<String> names = new ArrayList<>(cache.getPreprocessedFileNames());
        names.sort(String::compareTo);
        return names;
    }

    public void invalidate(String fileName) {
        String canonical = getCanonicalFileName(fileName);
        cache.removePreprocessed(canonical);
        parseDiagnostics.remove(canonical);
        diagnosedHashes.remove(canonical);
    }

    public void invalidateAll() {
        for (String name : cache.getPreprocessedFileNames()) {
            cache.removePreprocessed(name);
        }
        parseDiagnostics.clear();
        diagnosedHashes.clear();
    }

    private List<Diagnostic> diagnose(String canonical, PreprocessedCacheEntry entry) {
        if (entry.contentHash().equals(diagnosedHashes.get(canonical)) && parseDiagnostics.containsKey(canonical)) {
            return parseDiagnostics.get(canonical);
        }
        List<Diagnostic> diagnostics = validator.validate(entry.code(), canonical);
        if (!diagnostics.isEmpty()) {
            if (entry.changed()) {
                log.warn("Preprocessed output of {} still has {} syntax error(s); first: {}",
                        canonical, diagnostics.size(), diagnostics.get(0).message());
            } else {
                log.debug("{} has {} syntax error(s)", canonical, diagnostics.size());
            }
        }
        parseDiagnostics.put(canonical, diagnostics);
        diagnosedHashes.put(canonical, entry.contentHash());
        return diagnostics;
    }
}
