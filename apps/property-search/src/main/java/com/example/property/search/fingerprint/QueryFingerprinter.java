package com.example.property.search.fingerprint;

import com.example.property.search.model.NumericRange;
import com.example.property.search.model.QueryFingerprint;
import com.example.property.search.model.SearchFilters;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives a stable key from search filters.
 * Keys are sorted, text is trimmed, whitespace-collapsed and lower-cased,
 * and absent values are rendered as {@value NumericRange#OPEN_BOUND}, so equivalent filters
 * always produce the same fingerprint.
 */
@Component
public class QueryFingerprinter {

    static final String PREFIX = "q1-";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public QueryFingerprint fingerprint(SearchFilters filters) {
        SearchFilters source = filters != null ? filters : SearchFilters.builder().build();
        String canonical = canonicalForm(source);
        return new QueryFingerprint(PREFIX + sha256Hex(canonical), canonical);
    }

    String canonicalForm(SearchFilters filters) {
        Map<String, String> parts = new TreeMap<>();
        parts.put("city", text(filters.city()));
        parts.put("state", text(filters.state()));
        parts.put("neighborhood", text(filters.neighborhood()));
        parts.put("price", filters.price().canonical());
        parts.put("size", filters.size().canonical());
        parts.put("bedrooms", filters.bedrooms() == null ? NumericRange.OPEN_BOUND : filters.bedrooms().toString());
        parts.put("type", text(filters.propertyType()));
        parts.put("sort", filters.sort().key());
        parts.put("page", Integer.toString(filters.page()));
        parts.put("pageSize", Integer.toString(filters.pageSize()));
        return parts.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("|"));
    }

    private static String text(String value) {
        if (value == null) {
            return NumericRange.OPEN_BOUND;
        }
        String normalized = WHITESPACE.matcher(value.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? NumericRange.OPEN_BOUND : normalized;
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
