package com.example.property.search;

import com.example.property.search.model.ResultSet;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-flight token for one fingerprint. The leader completes it once; every caller,
 * including late joiners, receives the same result instance.
 */
final class InFlightAssembly {

    private final String fingerprint;
    private final Sinks.One<ResultSet> sink = Sinks.one();
    private final AtomicInteger waiters = new AtomicInteger();

    InFlightAssembly(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    String fingerprint() {
        return fingerprint;
    }

    Mono<ResultSet> result() {
        return sink.asMono();
    }

    void join() {
        waiters.incrementAndGet();
    }

    int waiters() {
        return waiters.get();
    }

    // Only the leader's subscription emits, so a failed tryEmit means the token is already terminated
    void complete(ResultSet resultSet) {
        sink.tryEmitValue(resultSet);
    }

    void fail(Throwable error) {
        sink.tryEmitError(error);
    }

    void completeEmpty() {
        sink.tryEmitEmpty();
    }
}
