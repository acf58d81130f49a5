package org.typeweave.compiler.host;

import java.util.List;

/**
 * Decides which files the virtual host preprocesses.
 *
 * @param preprocessExtensions  File name suffixes eligible for preprocessing.
 * @param excludedPathSegments  Path segments whose files are always delegated untouched.
 * @param declarationSuffix     Suffix of declaration files, always delegated untouched.
 */
public record HostOptions(List<String> preprocessExtensions, List<String> excludedPathSegments,
                          String declarationSuffix) {

    public HostOptions {
        preprocessExtensions = List.copyOf(preprocessExtensions);
        excludedPathSegments = List.copyOf(excludedPathSegments);
    }

    public static HostOptions defaults() {
        return new HostOptions(List.of(".ts", ".tsx", ".js", ".jsx"), List.of("node_modules"), ".d.ts");
    }

    /**
     * @param fileName A canonical file name.
     * @return true if the file should be served preprocessed.
     */
    public boolean shouldPreprocess(String fileName) {
        String normalized = fileName.replace('\\', '/');
        for (String segment : excludedPathSegments) {
            if (normalized.contains("/" + segment + "/") || normalized.startsWith(segment + "/")) {
                return false;
            }
        }
        if (declarationSuffix != null && !declarationSuffix.isEmpty() && normalized.endsWith(declarationSuffix)) {
            return false;
        }
        return preprocessExtensions.stream().anyMatch(normalized::endsWith);
    }
}
