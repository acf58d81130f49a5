package org.typeweave.compiler.frontend.preprocessor;

/**
 * Output flavor of a preprocessing run.
 */
public enum RewriteMode {
    /** Produces plain host-language text for compilation and macro expansion. */
    MACRO,
    /** Leaves marker comments where syntax was removed so a formatter can restore it. */
    FORMAT
}
