package com.example.property.search.exception;

/**
 * Classification of a source failure. Only {@link #TIMEOUT} and {@link #TRANSIENT} are retried.
 */
public enum FailureKind {
    TIMEOUT,
    TRANSIENT,
    PERMANENT;

    public boolean isRetryable() {
        return this != PERMANENT;
    }
}
