package org.typeweave.compiler.frontend.preprocessor;

import org.typeweave.compiler.frontend.lexer.TokenStream;

import java.util.List;

/**
 * A syntax extension that scans the token stream of a file and proposes text replacements.
 * Implementations must be stateless; they are invoked once per file per preprocessing run.
 */
public interface IStructuralExtension extends ISyntaxExtension {

    /**
     * Computes the replacements for one file.
     * @param stream  A fresh token stream over {@code source}.
     * @param source  The source text the stream was scanned from.
     * @param options The rewrite options of the current run.
     * @return The replacements in source coordinates, possibly empty. Must not overlap each other.
     */
    List<Replacement> rewrite(TokenStream stream, String source, RewriteOptions options);
}
