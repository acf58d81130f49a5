package org.typeweave.compiler.sourcemap;

import java.util.ArrayList;
import java.util.List;

/**
 * Base64 variable-length quantity encoding used by the {@code mappings} field of version 3 source maps.
 */
public final class Vlq {

    private static final String BASE64 = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";
    private static final int SHIFT = 5;
    private static final int MASK = (1 << SHIFT) - 1;
    private static final int CONTINUATION = 1 << SHIFT;

    private Vlq() {}

    /**
     * Appends the encoding of one signed value.
     * @param out   The target buffer.
     * @param value The value.
     */
    public static void encode(StringBuilder out, int value) {
        int vlq = value < 0 ? ((-value) << 1) | 1 : value << 1;
        do {
            int digit = vlq & MASK;
            vlq >>>= SHIFT;
            if (vlq > 0) {
                digit |= CONTINUATION;
            }
            out.append(BASE64.charAt(digit));
        } while (vlq > 0);
    }

    public static String encode(int value) {
        StringBuilder sb = new StringBuilder();
        encode(sb, value);
        return sb.toString();
    }

    /**
     * Decodes all values of one segment.
     * @param segment The encoded segment, e.g. {@code "AAgBC"}.
     * @return The decoded values.
     * @throws IllegalArgumentException if the segment contains a non-Base64 character or ends mid-value.
     */
    public static List<Integer> decode(String segment) {
        List<Integer> values = new ArrayList<>();
        int shift = 0;
        int value = 0;
        boolean pending = false;
        for (int i = 0; i < segment.length(); i++) {
            int digit = BASE64.indexOf(segment.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid VLQ character: '" + segment.charAt(i) + "'");
            }
            value += (digit & MASK) << shift;
            if ((digit & CONTINUATION) != 0) {
                shift += SHIFT;
                pending = true;
            } else {
                boolean negative = (value & 1) == 1;
                int magnitude = value >>> 1;
                values.add(negative ? -magnitude : magnitude);
                value = 0;
                shift = 0;
                pending = false;
            }
        }
        if (pending) {
            throw new IllegalArgumentException("Truncated VLQ segment: " + segment);
        }
        return values;
    }
}
