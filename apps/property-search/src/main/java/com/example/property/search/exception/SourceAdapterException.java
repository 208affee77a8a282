package com.example.property.search.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * A listing source could not produce a result.
 */
@Getter
public class SourceAdapterException extends RuntimeException {

    private final String source;
    private final FailureKind kind;

    public SourceAdapterException(String source, FailureKind kind, String message) {
        super(message);
        this.source = source;
        this.kind = kind;
    }

    public SourceAdapterException(String source, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.kind = kind;
    }

    public static SourceAdapterException timeout(String source, Duration timeout) {
        return new SourceAdapterException(source, FailureKind.TIMEOUT,
                "no response within " + timeout.toMillis() + "ms");
    }

    public static SourceAdapterException transientFailure(String source, String message) {
        return new SourceAdapterException(source, FailureKind.TRANSIENT, message);
    }

    public static SourceAdapterException transientFailure(String source, String message, Throwable cause) {
        return new SourceAdapterException(source, FailureKind.TRANSIENT, message, cause);
    }

    public static SourceAdapterException permanent(String source, String message) {
        return new SourceAdapterException(source, FailureKind.PERMANENT, message);
    }
}
