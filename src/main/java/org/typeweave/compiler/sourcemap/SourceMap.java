package org.typeweave.compiler.sourcemap;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.Arrays;

/**
 * An offset mapping table from a generated text back to the original text it was produced from.
 * <p>
 * The table is a sorted list of segments {@code (generatedOffset, originalOffset)}. A generated
 * offset resolves through the last segment at or before it: unchanged text carries one segment per
 * character and maps exactly, replaced text maps to the start of the original span it replaced.
 * The original content is kept so the map can be exported as a content-inclusive version 3 source map.
 */
public final class SourceMap {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final String file;
    private final String source;
    private final String originalContent;
    private final String generatedContent;
    private final int[] generatedOffsets;
    private final int[] originalOffsets;

    /**
     * Creates a map from parallel segment arrays sorted by generated offset.
     * @param file             The generated file name.
     * @param source           The original file name.
     * @param originalContent  The original text.
     * @param generatedContent The generated text.
     * @param generatedOffsets Segment start offsets in the generated text, ascending.
     * @param originalOffsets  The original offset of each segment.
     */
    public SourceMap(String file, String source, String originalContent, String generatedContent,
                     int[] generatedOffsets, int[] originalOffsets) {
        if (generatedOffsets.length != originalOffsets.length) {
            throw new IllegalArgumentException("Segment arrays differ in length");
        }
        this.file = file;
        this.source = source;
        this.originalContent = originalContent;
        this.generatedContent = generatedContent;
        this.generatedOffsets = generatedOffsets.clone();
        this.originalOffsets = originalOffsets.clone();
    }

    public String file() {
        return file;
    }

    public String source() {
        return source;
    }

    public String originalContent() {
        return originalContent;
    }

    public String generatedContent() {
        return generatedContent;
    }

    public int segmentCount() {
        return generatedOffsets.length;
    }

    /**
     * Resolves a generated offset to the original offset it was produced from.
     * @param generatedOffset An offset in the generated text.
     * @return The original offset, clamped to the original text.
     */
    public int originalOffsetFor(int generatedOffset) {
        if (generatedOffset >= generatedContent.length()) {
            return originalContent.length();
        }
        int index = Arrays.binarySearch(generatedOffsets, generatedOffset);
        if (index < 0) {
            index = -index - 2;
        } else {
            // several segments may share a generated offset; the first one wins
            while (index > 0 && generatedOffsets[index - 1] == generatedOffset) {
                index--;
            }
        }
        if (index < 0) {
            return 0;
        }
        return Math.min(originalOffsets[index], originalContent.length());
    }

    /**
     * Chains two maps. {@code first} maps an intermediate text back to the original, {@code second}
     * maps the final text back to the intermediate one. The result maps the final text straight to
     * the original.
     * @param first  The earlier map, may be null.
     * @param second The later map, may be null.
     * @return The composed map, the non-null argument if only one is present, or null if both are.
     */
    public static SourceMap compose(SourceMap first, SourceMap second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        int[] originals = new int[second.originalOffsets.length];
        for (int i = 0; i < originals.length; i++) {
            originals[i] = first.originalOffsetFor(second.originalOffsets[i]);
        }
        return new SourceMap(second.file, first.source, first.originalContent, second.generatedContent,
                second.generatedOffsets, originals);
    }

    /**
     * Encodes the segments as a version 3 {@code mappings} string.
     * @return The Base64 VLQ mappings.
     */
    public String mappings() {
        LineIndex generatedLines = new LineIndex(generatedContent);
        LineIndex originalLines = new LineIndex(originalContent);
        StringBuilder out = new StringBuilder();

        int currentLine = 0;
        int previousGeneratedColumn = 0;
        int previousOriginalLine = 0;
        int previousOriginalColumn = 0;
        boolean firstInLine = true;

        for (int i = 0; i < generatedOffsets.length; i++) {
            int genOffset = generatedOffsets[i];
            if (i > 0 && genOffset == generatedOffsets[i - 1]) {
                continue;
            }
            int line = generatedLines.lineOf(genOffset);
            while (currentLine < line) {
                out.append(';');
                currentLine++;
                previousGeneratedColumn = 0;
                firstInLine = true;
            }
            if (!firstInLine) {
                out.append(',');
            }
            int column = generatedLines.columnOf(genOffset);
            int origLine = originalLines.lineOf(originalOffsets[i]);
            int origColumn = originalLines.columnOf(originalOffsets[i]);

            Vlq.encode(out, column - previousGeneratedColumn);
            Vlq.encode(out, 0);
            Vlq.encode(out, origLine - previousOriginalLine);
            Vlq.encode(out, origColumn - previousOriginalColumn);

            previousGeneratedColumn = column;
            previousOriginalLine = origLine;
            previousOriginalColumn = origColumn;
            firstInLine = false;
        }
        return out.toString();
    }

    /**
     * Builds the version 3 JSON object for this map.
     * @return The JSON tree.
     */
    public JsonObject toJsonObject() {
        JsonObject json = new JsonObject();
        json.addProperty("version", 3);
        json.addProperty("file", file);
        JsonArray sources = new JsonArray();
        sources.add(source);
        json.add("sources", sources);
        JsonArray contents = new JsonArray();
        contents.add(originalContent);
        json.add("sourcesContent", contents);
        json.add("names", new JsonArray());
        json.addProperty("mappings", mappings());
        return json;
    }

    public String toJson() {
        return GSON.toJson(toJsonObject());
    }

    /**
     * Creates a map where every generated character maps to the same original offset.
     * @param file             The generated file name.
     * @param source           The original file name.
     * @param originalContent  The original text.
     * @param generatedContent The generated text.
     * @return A map with one segment per generated line, each pointing at the original start.
     */
    public static SourceMap coarse(String file, String source, String originalContent, String generatedContent) {
        LineIndex lines = new LineIndex(generatedContent);
        int[] gen = new int[lines.lineCount()];
        int[] orig = new int[lines.lineCount()];
        for (int i = 0; i < gen.length; i++) {
            gen[i] = lines.lineStart(i);
        }
        return new SourceMap(file, source, originalContent, generatedContent, gen, orig);
    }
}
