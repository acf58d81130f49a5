package org.typeweave.compiler.frontend.preprocessor;

/**
 * A half-open source range and its substitute text. {@code start == end} denotes a pure insertion.
 *
 * @param start The start offset (inclusive).
 * @param end   The end offset (exclusive).
 * @param text  The substitute text.
 */
public record Replacement(int start, int end, String text) {

    public Replacement {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid replacement range [" + start + ", " + end + ")");
        }
        if (text == null) {
            throw new IllegalArgumentException("Replacement text must not be null");
        }
    }

    public boolean isInsertion() {
        return start == end;
    }

    /**
     * Checks whether two replacements cannot both be applied. Insertions conflict only with a range
     * that strictly contains their position.
     * @param other The other replacement.
     * @return true if they conflict.
     */
    public boolean overlaps(Replacement other) {
        if (isInsertion() && other.isInsertion()) {
            return false;
        }
        if (isInsertion()) {
            return other.start < start && start < other.end;
        }
        if (other.isInsertion()) {
            return start < other.start && other.start < end;
        }
        return start < other.end && other.start < end;
    }
}
