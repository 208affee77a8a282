package com.example.property.search.cache;

import com.example.property.config.properties.ListingCacheProperties;
import com.example.property.observability.SearchMetricsService;
import com.example.property.search.model.CacheHealth;
import com.example.property.search.model.ResultSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Two-tier listing cache: an optional remote primary tier in front of an in-process secondary tier.
 *
 * <p>Reads try the primary tier (bounded by a short timeout) and fall through to the secondary tier
 * on a miss, an error or a timeout. Writes go to both tiers and succeed if either accepts.
 * Tier failures are logged as degraded mode and never reach the caller.
 */
@Slf4j
@Component
public class TieredListingCache {

    @Nullable
    private final ListingCacheStore primary;
    private final ListingCacheStore secondary;
    private final Duration primaryTimeout;
    private final Clock clock;
    private final SearchMetricsService metrics;

    public TieredListingCache(
            List<ListingCacheStore> stores,
            ListingCacheProperties properties,
            Clock clock,
            SearchMetricsService metrics) {
        this.primary = stores.stream().filter(s -> s.tier() == CacheTier.PRIMARY).findFirst().orElse(null);
        this.secondary = stores.stream().filter(s -> s.tier() == CacheTier.SECONDARY).findFirst()
                .orElseThrow(() -> new IllegalStateException("A secondary listing cache tier is required"));
        this.primaryTimeout = properties.primary().timeout();
        this.clock = clock;
        this.metrics = metrics;
        log.info("Listing cache tiers: primary={}, secondary={}",
                primary == null ? "disabled" : primary.getClass().getSimpleName(),
                secondary.getClass().getSimpleName());
    }

    /**
     * Looks up a result set; empty means a miss on every reachable tier.
     */
    public Mono<ResultSet> get(String key) {
        Mono<CacheEntry> fromSecondary = Mono.defer(() -> readSecondary(key));
        Mono<CacheEntry> lookup = primary == null
                ? fromSecondary
                : readPrimary(key).switchIfEmpty(fromSecondary);

        return lookup
                .doOnNext(entry -> {
                    metrics.recordCacheHit(entry.tier().tagValue());
                    log.debug("Listing cache hit ({}) for {}", entry.tier().tagValue(), key);
                })
                .map(CacheEntry::resultSet)
                .switchIfEmpty(Mono.defer(() -> {
                    metrics.recordCacheMiss();
                    log.debug("Listing cache miss for {}", key);
                    return Mono.empty();
                }));
    }

    /**
     * Writes to every tier. Returns true when at least one tier accepted the entry.
     * Empty live result sets are refused.
     */
    public Mono<Boolean> set(String key, ResultSet resultSet, Duration ttl) {
        if (resultSet.isEmpty() && !resultSet.isSynthetic()) {
            log.warn("Refusing to cache an empty live result set for {}", key);
            return Mono.just(false);
        }
        CacheEntry entry = new CacheEntry(key, resultSet, clock.instant(), ttl, null);

        Mono<Boolean> primaryWrite = primary == null
                ? Mono.just(false)
                : primary.put(entry)
                        .timeout(primaryTimeout)
                        .defaultIfEmpty(false)
                        .onErrorResume(e -> {
                            log.warn("Primary listing cache write failed for {} (degraded mode): {}",
                                    key, e.getMessage());
                            metrics.recordCacheDegraded(CacheTier.PRIMARY.tagValue(), "write");
                            return Mono.just(false);
                        });

        Mono<Boolean> secondaryWrite = secondary.put(entry)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Secondary listing cache write failed for {}: {}", key, e.getMessage());
                    metrics.recordCacheDegraded(CacheTier.SECONDARY.tagValue(), "write");
                    return Mono.just(false);
                });

        return Mono.zip(primaryWrite, secondaryWrite)
                .map(written -> {
                    boolean stored = written.getT1() || written.getT2();
                    if (stored) {
                        log.debug("Cached {} listings for {} (ttl {}, primary={}, secondary={})",
                                resultSet.listings().size(), key, ttl, written.getT1(), written.getT2());
                    } else {
                        log.warn("No listing cache tier accepted the entry for {}", key);
                    }
                    return stored;
                });
    }

    public Mono<CacheHealth> healthCheck() {
        Mono<Boolean> primaryUp = primary == null ? Mono.just(false) : ping(primary, primaryTimeout);
        Mono<Boolean> secondaryUp = ping(secondary, primaryTimeout);
        return Mono.zip(primaryUp, secondaryUp)
                .map(up -> new CacheHealth(up.getT1(), up.getT2()));
    }

    public boolean hasPrimary() {
        return primary != null;
    }

    private Mono<CacheEntry> readPrimary(String key) {
        return primary.get(key)
                .timeout(primaryTimeout)
                .onErrorResume(e -> {
                    log.warn("Primary listing cache unavailable, reading secondary (degraded mode): {}",
                            e.getMessage());
                    metrics.recordCacheDegraded(CacheTier.PRIMARY.tagValue(), "read");
                    return Mono.empty();
                });
    }

    private Mono<CacheEntry> readSecondary(String key) {
        return secondary.get(key)
                .onErrorResume(e -> {
                    log.warn("Secondary listing cache read failed for {}: {}", key, e.getMessage());
                    metrics.recordCacheDegraded(CacheTier.SECONDARY.tagValue(), "read");
                    return Mono.empty();
                });
    }

    private static Mono<Boolean> ping(ListingCacheStore store, Duration timeout) {
        return store.ping()
                .timeout(timeout)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.debug("Listing cache tier {} ping failed: {}", store.tier(), e.getMessage());
                    return Mono.just(false);
                });
    }
}
