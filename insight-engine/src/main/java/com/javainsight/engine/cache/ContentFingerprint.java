package com.javainsight.engine.cache;

/**
 * Cheap content identity for cache invalidation. Not suitable for anything security related.
 */
public final class ContentFingerprint {

    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private ContentFingerprint() {}

    /** 32-bit FNV-1a over the UTF-16 code units of {@code text}. */
    public static int hash(String text) {
        int hash = FNV_OFFSET_BASIS;
        for (int i = 0; i < text.length(); i++) {
            hash ^= text.charAt(i);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    /** Byte length of {@code text} encoded as UTF-8, computed without allocating. */
    public static long utf8Size(String text) {
        long size = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch < 0x80) {
                size += 1;
            } else if (ch < 0x800) {
                size += 2;
            } else if (Character.isHighSurrogate(ch) && i + 1 < text.length()
                    && Character.isLowSurrogate(text.charAt(i + 1))) {
                size += 4;
                i++;
            } else {
                size += 3;
            }
        }
        return size;
    }
}
