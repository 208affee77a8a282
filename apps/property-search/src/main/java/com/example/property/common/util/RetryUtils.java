package com.example.property.common.util;

import com.example.property.search.exception.FailureKind;
import com.example.property.search.exception.SourceAdapterException;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Retry conditions for source fetches.
 * Timeouts, connection failures, HTTP 429 and 5xx are transient; everything else is permanent.
 */
public final class RetryUtils {

    private RetryUtils() {}

    public static boolean isTransient(@NonNull Throwable throwable) {
        return classify(throwable).isRetryable();
    }

    @NonNull
    public static FailureKind classify(@NonNull Throwable throwable) {
        if (throwable instanceof SourceAdapterException ex) {
            return ex.getKind();
        }
        if (throwable instanceof TimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (throwable instanceof WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            return status == 429 || ex.getStatusCode().is5xxServerError()
                    ? FailureKind.TRANSIENT
                    : FailureKind.PERMANENT;
        }
        if (throwable instanceof WebClientRequestException) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }

    /**
     * Predicate for {@code Retry.filter()}.
     */
    @NonNull
    public static Predicate<Throwable> transientPredicate() {
        return RetryUtils::isTransient;
    }
}
