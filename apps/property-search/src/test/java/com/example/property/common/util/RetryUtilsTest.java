package com.example.property.common.util;

import com.example.property.search.exception.FailureKind;
import com.example.property.search.exception.SourceAdapterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetryUtils")
class RetryUtilsTest {

    @ParameterizedTest(name = "HTTP {0} -> {1}")
    @CsvSource({
            "429, TRANSIENT",
            "500, TRANSIENT",
            "502, TRANSIENT",
            "400, PERMANENT",
            "403, PERMANENT",
            "404, PERMANENT"
    })
    @DisplayName("should classify response status codes")
    void shouldClassifyResponses(int status, FailureKind expected) {
        WebClientResponseException ex = WebClientResponseException.create(status, "status " + status,
                HttpHeaders.EMPTY, new byte[0], null);

        assertThat(RetryUtils.classify(ex)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should treat timeouts and connection failures as retryable")
    void shouldRetryTransportFailures() {
        WebClientRequestException connectionRefused = new WebClientRequestException(
                new IOException("Connection refused"), HttpMethod.GET, URI.create("http://localhost:1/"), HttpHeaders.EMPTY);

        assertThat(RetryUtils.classify(new TimeoutException())).isEqualTo(FailureKind.TIMEOUT);
        assertThat(RetryUtils.isTransient(connectionRefused)).isTrue();
        assertThat(RetryUtils.transientPredicate().test(new TimeoutException())).isTrue();
    }

    @Test
    @DisplayName("should honor the kind carried by a source adapter exception")
    void shouldUseAdapterExceptionKind() {
        assertThat(RetryUtils.isTransient(SourceAdapterException.permanent("zap", "blocked"))).isFalse();
        assertThat(RetryUtils.isTransient(SourceAdapterException.transientFailure("zap", "rate limited"))).isTrue();
    }

    @Test
    @DisplayName("should not retry unexpected errors")
    void shouldNotRetryUnknownErrors() {
        assertThat(RetryUtils.isTransient(new IllegalStateException("boom"))).isFalse();
    }
}
