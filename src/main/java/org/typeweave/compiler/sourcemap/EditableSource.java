package org.typeweave.compiler.sourcemap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * An original text plus a set of non-overlapping edits expressed in original coordinates.
 * <p>
 * Edits are recorded, not applied, so the original positions stay valid for every later edit.
 * {@link #toString()} renders the edited text and {@link #generateMap(String, String)} produces the
 * matching high-resolution {@link SourceMap}.
 */
public class EditableSource {

    /**
     * One recorded edit. {@code start == end} denotes an insertion.
     */
    public record Edit(int start, int end, String text) {
        boolean isInsertion() {
            return start == end;
        }
    }

    private final String original;
    private final List<Edit> edits = new ArrayList<>();

    public EditableSource(String original) {
        this.original = original;
    }

    public String original() {
        return original;
    }

    /**
     * Replaces the original range {@code [start, end)} with new text.
     * @param start The start offset (inclusive).
     * @param end   The end offset (exclusive), greater than {@code start}.
     * @param text  The replacement.
     * @return this, for chaining.
     * @throws IllegalArgumentException if the range is empty or outside the text.
     * @throws IllegalStateException    if the range overlaps an earlier edit.
     */
    public EditableSource overwrite(int start, int end, String text) {
        checkRange(start, end);
        if (start == end) {
            throw new IllegalArgumentException("Cannot overwrite an empty range at " + start);
        }
        for (Edit edit : edits) {
            boolean overlaps = edit.isInsertion()
                    ? edit.start() > start && edit.start() < end
                    : edit.start() < end && start < edit.end();
            if (overlaps) {
                throw new IllegalStateException("Edit [" + start + ", " + end + ") overlaps ["
                        + edit.start() + ", " + edit.end() + ")");
            }
        }
        edits.add(new Edit(start, end, text));
        return this;
    }

    /**
     * Inserts text at an original position. Several insertions at one position are kept in call order.
     * @param position The original offset.
     * @param text     The text to insert.
     * @return this, for chaining.
     * @throws IllegalStateException if the position lies strictly inside an overwritten range.
     */
    public EditableSource insert(int position, String text) {
        checkRange(position, position);
        for (Edit edit : edits) {
            if (!edit.isInsertion() && edit.start() < position && position < edit.end()) {
                throw new IllegalStateException("Insertion at " + position + " falls inside edited range ["
                        + edit.start() + ", " + edit.end() + ")");
            }
        }
        edits.add(new Edit(position, position, text));
        return this;
    }

    /**
     * Applies a replacement as an overwrite, an insertion, or a deletion.
     * @param start The start offset.
     * @param end   The end offset.
     * @param text  The substitute text.
     * @return this, for chaining.
     */
    public EditableSource replace(int start, int end, String text) {
        return start == end ? insert(start, text) : overwrite(start, end, text);
    }

    public boolean hasChanged() {
        return edits.stream().anyMatch(e -> !e.isInsertion() || !e.text().isEmpty());
    }

    /**
     * @return The recorded edits sorted by position, insertions first at equal starts.
     */
    public List<Edit> sortedEdits() {
        List<Edit> sorted = new ArrayList<>(edits);
        // stable sort keeps the call order of insertions at one position
        sorted.sort(Comparator.comparingInt(Edit::start).thenComparingInt(e -> e.isInsertion() ? 0 : 1));
        return sorted;
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder(original.length());
        int position = 0;
        for (Edit edit : sortedEdits()) {
            out.append(original, position, edit.start());
            out.append(edit.text());
            position = edit.end();
        }
        out.append(original, position, original.length());
        return out.toString();
    }

    /**
     * Builds the high-resolution map from the edited text back to the original: one segment per
     * unchanged character, and for replacement text one segment at its start and one after each
     * line break inside it, all pointing at the start of the replaced range.
     * @param file   The generated file name.
     * @param source The original file name.
     * @return The source map.
     */
    public SourceMap generateMap(String file, String source) {
        List<int[]> segments = new ArrayList<>();
        StringBuilder generated = new StringBuilder(original.length());
        int position = 0;
        for (Edit edit : sortedEdits()) {
            appendUnchanged(generated, segments, position, edit.start());
            String text = edit.text();
            if (!text.isEmpty()) {
                int base = generated.length();
                segments.add(new int[]{base, edit.start()});
                for (int i = 0; i < text.length() - 1; i++) {
                    if (text.charAt(i) == '\n') {
                        segments.add(new int[]{base + i + 1, edit.start()});
                    }
                }
                generated.append(text);
            }
            position = edit.end();
        }
        appendUnchanged(generated, segments, position, original.length());

        int[] gen = new int[segments.size()];
        int[] orig = new int[segments.size()];
        for (int i = 0; i < gen.length; i++) {
            gen[i] = segments.get(i)[0];
            orig[i] = segments.get(i)[1];
        }
        return new SourceMap(file, source, original, generated.toString(), gen, orig);
    }

    private void appendUnchanged(StringBuilder generated, List<int[]> segments, int from, int to) {
        for (int i = from; i < to; i++) {
            segments.add(new int[]{generated.length(), i});
            generated.append(original.charAt(i));
        }
    }

    private void checkRange(int start, int end) {
        if (start < 0 || end > original.length() || start > end) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ") for text of length "
                    + original.length());
        }
    }
}
