package com.example.property.common.util;

import org.springframework.lang.NonNull;

/**
 * Builds namespaced cache keys. The fingerprint part is stripped of delimiters and whitespace.
 */
public final class CacheKeyUtils {

    private CacheKeyUtils() {}

    @NonNull
    public static String sanitize(@NonNull String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key cannot be null or blank");
        }
        return key.replaceAll("[:\\s]", "_");
    }

    @NonNull
    public static String namespaced(@NonNull String prefix, @NonNull String key) {
        return prefix + sanitize(key);
    }
}
