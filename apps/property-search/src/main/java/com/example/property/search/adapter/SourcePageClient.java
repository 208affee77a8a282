package com.example.property.search.adapter;

import com.example.property.common.util.StringSanitizer;
import com.example.property.config.SourceWebClientConfig;
import com.example.property.search.exception.SourceAdapterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Fetches a results page as HTML and maps transport failures to {@link SourceAdapterException}s:
 * 429 and 5xx are transient, 403 and other 4xx are permanent, connection errors are transient.
 */
@Slf4j
@Component
public class SourcePageClient {

    private final WebClient webClient;

    public SourcePageClient(@Qualifier(SourceWebClientConfig.SOURCE_WEBCLIENT) WebClient webClient) {
        this.webClient = webClient;
    }

    public Mono<String> fetchPage(String source, String url, Duration timeout) {
        log.debug("Fetching {} page: {}", source, StringSanitizer.forLog(url, 256));
        return webClient.get()
                .uri(URI.create(url))
                .retrieve()
                .onStatus(status -> status.value() == 429, response -> Mono.error(
                        SourceAdapterException.transientFailure(source, "rate limited (HTTP 429)")))
                .onStatus(status -> status.value() == 403, response -> Mono.error(
                        SourceAdapterException.permanent(source, "blocked (HTTP 403)")))
                .onStatus(HttpStatusCode::is5xxServerError, response -> Mono.error(
                        SourceAdapterException.transientFailure(source,
                                "server error (HTTP " + response.statusCode().value() + ")")))
                .onStatus(HttpStatusCode::is4xxClientError, response -> Mono.error(
                        SourceAdapterException.permanent(source,
                                "request rejected (HTTP " + response.statusCode().value() + ")")))
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> SourceAdapterException.timeout(source, timeout))
                .onErrorMap(WebClientRequestException.class, e -> SourceAdapterException.transientFailure(
                        source, "connection failed: " + e.getMessage(), e))
                .switchIfEmpty(Mono.error(() -> SourceAdapterException.permanent(source, "empty response body")));
    }
}
