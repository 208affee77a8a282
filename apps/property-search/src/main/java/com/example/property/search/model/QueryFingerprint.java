package com.example.property.search.model;

/**
 * Cache and single-flight key for a search. {@code canonical} is the normalized
 * filter string the digest was computed from, kept for logging.
 */
public record QueryFingerprint(String value, String canonical) {

    @Override
    public String toString() {
        return value;
    }
}
