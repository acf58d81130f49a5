package org.typeweave.compiler.frontend.lexer;

import java.util.List;

/**
 * Options for one scanning pass.
 *
 * @param customOperators The operator symbols to recognize as single tokens.
 * @param fileVariant     The grammar dialect.
 */
public record ScannerOptions(List<CustomOperatorDef> customOperators, FileVariant fileVariant) {

    /** Operators recognized when the caller registers none. */
    public static final List<CustomOperatorDef> DEFAULT_CUSTOM_OPERATORS =
            List.of(CustomOperatorDef.of("|>"), CustomOperatorDef.of("::"));

    public ScannerOptions {
        customOperators = customOperators == null ? DEFAULT_CUSTOM_OPERATORS : List.copyOf(customOperators);
        fileVariant = fileVariant == null ? FileVariant.STANDARD : fileVariant;
    }

    public static ScannerOptions defaults() {
        return new ScannerOptions(null, FileVariant.STANDARD);
    }

    /**
     * Creates options for a named file, deriving the variant from its extension.
     * @param customOperators The operator definitions, or null for the defaults.
     * @param fileName        The file name.
     * @return The options.
     */
    public static ScannerOptions forFile(List<CustomOperatorDef> customOperators, String fileName) {
        return new ScannerOptions(customOperators, FileVariant.fromFileName(fileName));
    }
}
