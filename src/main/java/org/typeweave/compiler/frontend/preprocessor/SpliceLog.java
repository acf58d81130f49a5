package org.typeweave.compiler.frontend.preprocessor;

import java.util.ArrayList;
import java.util.List;

/**
 * Records successive splices into a text and expresses their net effect as replacements over the
 * text as it was before the first splice.
 * <p>
 * The current text is modelled as a sequence of pieces. An original piece refers to an untouched range
 * of the base text; a synthetic piece holds generated text together with the base range it replaced.
 * A splice that cuts into a synthetic piece absorbs the whole piece, so every synthetic piece always
 * maps to one contiguous base range.
 */
class SpliceLog {

    private record Piece(int baseStart, int baseEnd, String text) {
        boolean synthetic() {
            return text != null;
        }

        int length() {
            return synthetic() ? text.length() : baseEnd - baseStart;
        }
    }

    private final String base;
    private final List<Piece> pieces = new ArrayList<>();

    SpliceLog(String base) {
        this.base = base;
        if (!base.isEmpty()) {
            pieces.add(new Piece(0, base.length(), null));
        }
    }

    /**
     * Replaces the current-text range {@code [start, end)} with new text.
     * @param start The start offset in the current text.
     * @param end   The end offset in the current text, greater than {@code start}.
     * @param text  The substitute text.
     */
    void splice(int start, int end, String text) {
        if (end <= start) {
            throw new IllegalArgumentException("Splice range must not be empty: [" + start + ", " + end + ")");
        }
        int position = 0;
        int first = -1;
        int last = -1;
        int firstStart = 0;
        int lastStart = 0;
        for (int i = 0; i < pieces.size(); i++) {
            int length = pieces.get(i).length();
            int pieceEnd = position + length;
            if (first < 0 && start < pieceEnd) {
                first = i;
                firstStart = position;
            }
            if (start < pieceEnd && end > position) {
                last = i;
                lastStart = position;
            }
            position = pieceEnd;
        }
        if (first < 0 || last < 0 || end > position) {
            throw new IllegalArgumentException("Splice range [" + start + ", " + end + ") exceeds text of length "
                    + position);
        }

        Piece head = pieces.get(first);
        Piece tail = pieces.get(last);
        List<Piece> replacement = new ArrayList<>(3);

        int baseStart;
        String prefix = "";
        if (head.synthetic()) {
            baseStart = head.baseStart();
            prefix = head.text().substring(0, start - firstStart);
        } else {
            baseStart = head.baseStart() + (start - firstStart);
            if (baseStart > head.baseStart()) {
                replacement.add(new Piece(head.baseStart(), baseStart, null));
            }
        }

        int baseEnd;
        String suffix = "";
        Piece rightRemnant = null;
        if (tail.synthetic()) {
            baseEnd = tail.baseEnd();
            suffix = tail.text().substring(end - lastStart);
        } else {
            baseEnd = tail.baseStart() + (end - lastStart);
            if (baseEnd < tail.baseEnd()) {
                rightRemnant = new Piece(baseEnd, tail.baseEnd(), null);
            }
        }

        replacement.add(new Piece(baseStart, baseEnd, prefix + text + suffix));
        if (rightRemnant != null) {
            replacement.add(rightRemnant);
        }

        pieces.subList(first, last + 1).clear();
        pieces.addAll(first, replacement);
    }

    /**
     * @return The current text.
     */
    String currentText() {
        StringBuilder sb = new StringBuilder();
        for (Piece piece : pieces) {
            sb.append(piece.synthetic() ? piece.text() : base.substring(piece.baseStart(), piece.baseEnd()));
        }
        return sb.toString();
    }

    /**
     * @return The net effect of all splices as non-overlapping replacements over the base text, in order.
     */
    List<Replacement> toReplacements() {
        List<Replacement> replacements = new ArrayList<>();
        for (Piece piece : pieces) {
            if (piece.synthetic()) {
                replacements.add(new Replacement(piece.baseStart(), piece.baseEnd(), piece.text()));
            }
        }
        return replacements;
    }
}
