package com.example.property.search;

import com.example.property.common.util.StringSanitizer;
import com.example.property.config.properties.PipelineProperties;
import com.example.property.observability.SearchMetricsService;
import com.example.property.search.adapter.SourceAdapter;
import com.example.property.search.cache.TieredListingCache;
import com.example.property.search.fallback.FallbackListingGenerator;
import com.example.property.search.fingerprint.QueryFingerprinter;
import com.example.property.search.fingerprint.SearchFilterValidator;
import com.example.property.search.merge.ListingMerger;
import com.example.property.search.model.CacheHealth;
import com.example.property.search.model.Provenance;
import com.example.property.search.model.QueryFingerprint;
import com.example.property.search.model.ResultSet;
import com.example.property.search.model.SearchFilters;
import com.example.property.search.persistence.ListingPersistence;
import com.example.property.search.scheduler.AdapterOutcome;
import com.example.property.search.scheduler.FetchScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for listing searches.
 *
 * <p>Flow: validate, fingerprint, check the tiered cache; on a miss, run at most one assembly per
 * fingerprint (fetch, merge, fallback when empty), cache it with a provenance-dependent TTL and hand
 * live listings to background persistence. Concurrent callers for the same fingerprint share the
 * in-flight assembly and receive the same result instance.
 *
 * <p>Only {@link com.example.property.search.exception.InvalidSearchException} reaches callers;
 * every other failure degrades to cached, partial or synthetic results.
 */
@Slf4j
@Service
public class SearchCoordinator {

    private final SearchFilterValidator validator;
    private final QueryFingerprinter fingerprinter;
    private final TieredListingCache cache;
    private final FetchScheduler scheduler;
    private final ListingMerger merger;
    private final FallbackListingGenerator fallbackGenerator;
    private final List<SourceAdapter> adapters;
    private final ListingPersistence persistence;
    private final PipelineProperties properties;
    private final SearchMetricsService metrics;

    private final ConcurrentHashMap<String, InFlightAssembly> inFlight = new ConcurrentHashMap<>();

    public SearchCoordinator(
            SearchFilterValidator validator,
            QueryFingerprinter fingerprinter,
            TieredListingCache cache,
            FetchScheduler scheduler,
            ListingMerger merger,
            FallbackListingGenerator fallbackGenerator,
            List<SourceAdapter> adapters,
            ListingPersistence persistence,
            PipelineProperties properties,
            SearchMetricsService metrics) {
        this.validator = validator;
        this.fingerprinter = fingerprinter;
        this.cache = cache;
        this.scheduler = scheduler;
        this.merger = merger;
        this.fallbackGenerator = fallbackGenerator;
        this.adapters = List.copyOf(adapters);
        this.persistence = persistence;
        this.properties = properties;
        this.metrics = metrics;
        log.info("Search coordinator ready with sources: {}",
                this.adapters.stream().map(SourceAdapter::name).toList());
    }

    public Mono<ResultSet> search(SearchFilters filters) {
        return Mono.fromCallable(() -> {
                    validator.validate(filters);
                    return fingerprinter.fingerprint(filters);
                })
                .flatMap(fingerprint -> cache.get(fingerprint.value())
                        .switchIfEmpty(Mono.defer(() -> joinOrLead(fingerprint, filters))));
    }

    public Mono<CacheHealth> cacheHealth() {
        return cache.healthCheck();
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private Mono<ResultSet> joinOrLead(QueryFingerprint fingerprint, SearchFilters filters) {
        InFlightAssembly candidate = new InFlightAssembly(fingerprint.value());
        InFlightAssembly existing = inFlight.putIfAbsent(fingerprint.value(), candidate);
        if (existing != null) {
            existing.join();
            metrics.recordSingleFlightJoin();
            log.debug("Joining in-flight assembly for {} ({} waiting)", existing.fingerprint(), existing.waiters());
            return existing.result();
        }
        lead(candidate, fingerprint, filters);
        return candidate.result();
    }

    /**
     * Runs the assembly detached from any caller, so a cancelled caller never cancels it.
     */
    private void lead(InFlightAssembly token, QueryFingerprint fingerprint, SearchFilters filters) {
        cache.get(fingerprint.value())
                .switchIfEmpty(Mono.defer(() -> assembleAndCache(fingerprint, filters)))
                .doFinally(signal -> inFlight.remove(fingerprint.value(), token))
                .subscribe(token::complete, error -> {
                    log.error("Assembly for {} failed: {}", fingerprint, error.getMessage(), error);
                    token.fail(error);
                }, token::completeEmpty);
    }

    private Mono<ResultSet> assembleAndCache(QueryFingerprint fingerprint, SearchFilters filters) {
        long started = System.nanoTime();
        return scheduler.run(fingerprint, filters, adapters, properties.globalBudget())
                .map(outcomes -> mergeOrFallback(fingerprint, filters, outcomes))
                .onErrorResume(e -> {
                    log.error("Unexpected assembly failure for {}, serving fallback listings: {}",
                            fingerprint, e.getMessage(), e);
                    metrics.recordFallback("error");
                    return Mono.fromCallable(() -> fallbackGenerator.generate(filters, fingerprint, List.of()));
                })
                .flatMap(resultSet -> cache.set(fingerprint.value(), resultSet, ttlFor(resultSet.provenance()))
                        .thenReturn(resultSet))
                .doOnNext(resultSet -> {
                    handOffToPersistence(resultSet);
                    log.info("Assembled {} listings for {} (city={}, provenance={}) in {}ms",
                            resultSet.listings().size(), fingerprint, StringSanitizer.forLog(filters.city()),
                            resultSet.provenance().label(), (System.nanoTime() - started) / 1_000_000);
                });
    }

    private ResultSet mergeOrFallback(QueryFingerprint fingerprint, SearchFilters filters, List<AdapterOutcome> outcomes) {
        ResultSet merged = merger.merge(fingerprint.value(), outcomes, filters);
        if (!merged.isEmpty()) {
            return merged;
        }
        long failed = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
        String reason = outcomes.isEmpty() || failed == outcomes.size() ? "all_sources_failed" : "no_results";
        log.warn("No live listings for {} ({} of {} sources failed), serving fallback listings",
                fingerprint, failed, outcomes.size());
        metrics.recordFallback(reason);
        return fallbackGenerator.generate(filters, fingerprint, merged.sources());
    }

    private void handOffToPersistence(ResultSet resultSet) {
        if (resultSet.isSynthetic()) {
            return;
        }
        try {
            persistence.persistAsync(resultSet);
        } catch (RuntimeException e) {
            log.warn("Listing persistence hand-off failed for {}: {}", resultSet.fingerprint(), e.getMessage());
        }
    }

    Duration ttlFor(Provenance provenance) {
        return provenance == Provenance.SYNTHETIC ? properties.ttl().fallback() : properties.ttl().live();
    }
}
