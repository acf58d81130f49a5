package org.typeweave.compiler.cache;

import java.nio.charset.StandardCharsets;

/**
 * Fast non-cryptographic content digest (64-bit FNV-1a over UTF-8 bytes) used to detect
 * changed file text. Not suitable for anything security related.
 */
public final class ContentHasher {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private ContentHasher() {}

    /**
     * @param content The text to hash.
     * @return The digest as 16 lowercase hex characters.
     */
    public static String hash(String content) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : content.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return String.format("%016x", hash);
    }
}
