package com.example.property.util;

import com.example.property.search.adapter.AdapterResult;
import com.example.property.search.adapter.SourceAdapter;
import com.example.property.search.exception.FailureKind;
import com.example.property.search.exception.SourceAdapterException;
import com.example.property.search.model.ListingRecord;
import com.example.property.search.model.SearchFilters;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Scripted source adapter. The script receives the 1-based attempt number.
 */
public class StubSourceAdapter implements SourceAdapter {

    private final String name;
    private final IntFunction<Mono<AdapterResult>> script;
    private final AtomicInteger calls = new AtomicInteger();

    public StubSourceAdapter(String name, IntFunction<Mono<AdapterResult>> script) {
        this.name = name;
        this.script = script;
    }

    public static StubSourceAdapter returning(String name, List<ListingRecord> records) {
        return new StubSourceAdapter(name, attempt -> Mono.just(result(name, records)));
    }

    public static StubSourceAdapter delayed(String name, Duration delay, List<ListingRecord> records) {
        return new StubSourceAdapter(name, attempt -> Mono.delay(delay).thenReturn(result(name, records)));
    }

    public static StubSourceAdapter failing(String name, FailureKind kind) {
        return new StubSourceAdapter(name, attempt ->
                Mono.error(new SourceAdapterException(name, kind, name + " failed with " + kind)));
    }

    public static StubSourceAdapter hanging(String name) {
        return new StubSourceAdapter(name, attempt -> Mono.never());
    }

    public static AdapterResult result(String name, List<ListingRecord> records) {
        return new AdapterResult(name, records, Instant.parse("2024-05-01T12:00:00Z"));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<AdapterResult> fetch(SearchFilters filters, Duration timeout) {
        return script.apply(calls.incrementAndGet());
    }

    public int calls() {
        return calls.get();
    }
}
