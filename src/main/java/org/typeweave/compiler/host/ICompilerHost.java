package org.typeweave.compiler.host;

/**
 * The file access a type checker needs: source file resolution, raw reads and existence checks.
 */
public interface ICompilerHost {

    /**
     * Resolves a source file for the type checker.
     * @param fileName The file name.
     * @return The source file, or null if it does not exist.
     */
    SourceFile getSourceFile(String fileName);

    /**
     * @return The raw text of a file, or null if it does not exist.
     */
    String readFile(String fileName);

    boolean fileExists(String fileName);

    String getCurrentDirectory();

    /**
     * @return The name used as cache and graph key for a file.
     */
    String getCanonicalFileName(String fileName);
}
