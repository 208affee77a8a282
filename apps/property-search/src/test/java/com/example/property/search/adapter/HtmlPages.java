package com.example.property.search.adapter;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Serves canned pages through a WebClient exchange function and records requested URLs.
 */
final class HtmlPages {

    private final List<String> requestedUrls = new CopyOnWriteArrayList<>();

    static String load(String name) {
        try (InputStream in = HtmlPages.class.getResourceAsStream("/pages/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test page: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    WebClient serving(HttpStatus status, String body) {
        return WebClient.builder()
                .exchangeFunction((ClientRequest request) -> {
                    requestedUrls.add(request.url().toString());
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE + ";charset=UTF-8")
                            .body(body)
                            .build());
                })
                .build();
    }

    List<String> requestedUrls() {
        return requestedUrls;
    }
}
