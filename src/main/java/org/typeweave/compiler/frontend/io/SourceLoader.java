package org.typeweave.compiler.frontend.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes file loading for the compiler host: supports local filesystem paths and
 * {@code classpath:} resources. Line endings are normalized to {@code \n}; the content is
 * otherwise returned exactly as stored.
 */
public final class SourceLoader {

    public static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The canonical name used for cache keys and diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Checks whether the given path string names a classpath resource.
     */
    public static boolean isClasspath(String path) {
        return path != null && path.startsWith(CLASSPATH_PREFIX);
    }

    /**
     * Loads a file named either by a filesystem path or a {@code classpath:} location.
     *
     * @param name The file name.
     * @return The loaded content.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult load(String name) throws IOException {
        if (isClasspath(name)) {
            LoadResult result = loadClasspath(name.substring(CLASSPATH_PREFIX.length()));
            return new LoadResult(result.content(), name);
        }
        return loadFile(Path.of(name));
    }

    /**
     * Loads content from a local filesystem path.
     *
     * @param resolvedPath The fully resolved path.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path resolvedPath) throws IOException {
        String logicalName = resolvedPath.normalize().toString().replace('\\', '/');
        String content = normalizeLineEndings(Files.readString(resolvedPath, StandardCharsets.UTF_8));
        return new LoadResult(content, logicalName);
    }

    /**
     * Loads content from a classpath resource.
     *
     * @param resourcePath The classpath resource path.
     * @return The loaded content and the resource path as logical name.
     * @throws IOException If the resource is not found or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        String path = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            return new LoadResult(normalizeLineEndings(content), resourcePath);
        }
    }

    /**
     * Checks whether a file or classpath resource exists without reading it.
     */
    public static boolean exists(String name) {
        if (isClasspath(name)) {
            String path = name.substring(CLASSPATH_PREFIX.length());
            path = path.startsWith("/") ? path.substring(1) : path;
            return Thread.currentThread().getContextClassLoader().getResource(path) != null;
        }
        return Files.isRegularFile(Path.of(name));
    }

    public static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
