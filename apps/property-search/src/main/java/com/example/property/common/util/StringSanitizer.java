package com.example.property.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

public final class StringSanitizer {

    private static final int DEFAULT_LOG_MAX_LENGTH = 64;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }
}
