package com.example.property.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Counters for the search pipeline: cache tiers, per-source outcomes, fallbacks and single-flight joins.
 * Exposed via Micrometer for Prometheus scraping.
 */
@Slf4j
@Service
public class SearchMetricsService {

    private static final String METRIC_PREFIX = "property.search";

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public SearchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("Search metrics service initialized");
    }

    public void recordCacheHit(String tier) {
        counter("cache.hits", "Number of listing cache hits", "tier", tier).increment();
    }

    public void recordCacheMiss() {
        counter("cache.misses", "Number of listing cache misses (both tiers)", "tier", "all").increment();
    }

    /**
     * A cache operation on the given tier failed or timed out and was skipped.
     */
    public void recordCacheDegraded(String tier, String operation) {
        counter("cache.degraded", "Cache operations skipped because a tier was unavailable",
                "tier", tier, "operation", operation).increment();
    }

    public void recordAdapterOutcome(String source, String outcome) {
        counter("adapter.outcomes", "Source fetch outcomes", "source", source, "outcome", outcome).increment();
    }

    public void recordFallback(String reason) {
        counter("fallbacks", "Searches answered with synthetic listings", "reason", reason).increment();
    }

    public void recordSingleFlightJoin() {
        counter("singleflight.joins", "Searches that joined an in-flight assembly").increment();
    }

    public void registerSizeGauge(String tier, Supplier<Number> sizeSupplier) {
        Gauge.builder(METRIC_PREFIX + ".cache.size", sizeSupplier, s -> s.get().doubleValue())
                .description("Entries held by a listing cache tier")
                .tags(Tags.of("tier", tier))
                .strongReference(true)
                .register(meterRegistry);
        log.debug("Registered size gauge for listing cache tier: {}", tier);
    }

    private Counter counter(String name, String description, String... tags) {
        String key = name + ":" + String.join(",", tags);
        return counters.computeIfAbsent(key, k ->
                Counter.builder(METRIC_PREFIX + "." + name)
                        .description(description)
                        .tags(tags)
                        .register(meterRegistry)
        );
    }
}
