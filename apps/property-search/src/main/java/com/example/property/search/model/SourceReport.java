package com.example.property.search.model;

import com.example.property.search.exception.FailureKind;

/**
 * Per-source summary attached to a result set. {@code failureKind} is null for a source that answered.
 */
public record SourceReport(
        String source,
        boolean succeeded,
        FailureKind failureKind,
        int recordCount,
        String detail
) {
    public static SourceReport success(String source, int recordCount) {
        return new SourceReport(source, true, null, recordCount, null);
    }

    public static SourceReport failure(String source, FailureKind kind, String detail) {
        return new SourceReport(source, false, kind, 0, detail);
    }
}
