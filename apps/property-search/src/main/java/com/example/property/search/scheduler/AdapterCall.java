package com.example.property.search.scheduler;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One queued adapter fetch. The caller waits on {@link #result()}; cancelling the caller
 * cancels the fetch, whether it is still queued or already running.
 */
final class AdapterCall {

    private final String source;
    private final Mono<AdapterOutcome> work;
    private final Sinks.One<AdapterOutcome> result = Sinks.one();
    private final Sinks.Empty<Void> cancelled = Sinks.empty();
    private final AtomicBoolean abandoned = new AtomicBoolean();

    AdapterCall(String source, Mono<AdapterOutcome> work) {
        this.source = source;
        this.work = work;
    }

    String source() {
        return source;
    }

    Mono<AdapterOutcome> result() {
        return result.asMono().doOnCancel(this::cancel);
    }

    void cancel() {
        abandoned.set(true);
        cancelled.tryEmitEmpty();
    }

    /**
     * Runs the fetch while holding a worker slot. Completes when the fetch ends or the caller cancels.
     */
    Mono<Void> execute() {
        if (abandoned.get()) {
            return Mono.empty();
        }
        return work
                .takeUntilOther(cancelled.asMono())
                .doOnNext(result::tryEmitValue)
                .onErrorResume(e -> {
                    result.tryEmitError(e);
                    return Mono.empty();
                })
                .doFinally(signal -> result.tryEmitEmpty())
                .then();
    }
}
