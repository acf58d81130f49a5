package org.typeweave.compiler.macro;

/**
 * A text-backed syntax node. Nodes taken from a file carry their offsets in that file; synthesized
 * nodes have {@code start == end == -1}.
 *
 * @param kind  The category.
 * @param text  The exact source text.
 * @param start The start offset, or -1.
 * @param end   The end offset, or -1.
 */
public record SyntaxNode(NodeKind kind, String text, int start, int end) {

    public SyntaxNode {
        if (kind == null || text == null) {
            throw new IllegalArgumentException("Syntax node kind and text must not be null");
        }
    }

    public static SyntaxNode synthetic(NodeKind kind, String text) {
        return new SyntaxNode(kind, text, -1, -1);
    }

    public boolean isSynthetic() {
        return start < 0;
    }

    public int length() {
        return isSynthetic() ? 0 : end - start;
    }
}
