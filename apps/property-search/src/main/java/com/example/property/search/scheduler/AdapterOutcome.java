package com.example.property.search.scheduler;

import com.example.property.search.adapter.AdapterResult;
import com.example.property.search.exception.FailureKind;
import com.example.property.search.model.SourceReport;

/**
 * What one adapter produced in a scheduler run: either a result or an error, never both.
 */
public record AdapterOutcome(String source, AdapterResult result, AdapterError error) {

    public record AdapterError(FailureKind kind, String detail) {
    }

    public static AdapterOutcome success(String source, AdapterResult result) {
        return new AdapterOutcome(source, result, null);
    }

    public static AdapterOutcome failure(String source, FailureKind kind, String detail) {
        return new AdapterOutcome(source, null, new AdapterError(kind, detail));
    }

    public boolean isSuccess() {
        return result != null;
    }

    public SourceReport toReport() {
        return isSuccess()
                ? SourceReport.success(source, result.records().size())
                : SourceReport.failure(source, error.kind(), error.detail());
    }
}
