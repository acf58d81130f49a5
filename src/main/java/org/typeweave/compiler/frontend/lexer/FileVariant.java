package org.typeweave.compiler.frontend.lexer;

import java.util.Locale;

/**
 * Grammar dialect used for scanning. Markup files embed element syntax.
 */
public enum FileVariant {
    STANDARD,
    MARKUP;

    /**
     * Selects the variant from a file name: {@code .tsx} and {@code .jsx} files use {@link #MARKUP}.
     * @param fileName The file name, may be null.
     * @return The variant.
     */
    public static FileVariant fromFileName(String fileName) {
        if (fileName != null) {
            String lower = fileName.toLowerCase(Locale.ROOT);
            if (lower.endsWith(".tsx") || lower.endsWith(".jsx")) {
                return MARKUP;
            }
        }
        return STANDARD;
    }
}
