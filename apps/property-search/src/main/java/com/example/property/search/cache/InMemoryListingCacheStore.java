package com.example.property.search.cache;

import com.example.property.config.properties.ListingCacheProperties;
import com.example.property.observability.SearchMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * In-process secondary tier backed by Caffeine.
 * Entries carry their own TTL; reads re-check expiry against the injected clock
 * and a scheduled sweep drops expired entries.
 */
@Slf4j
@Component
public class InMemoryListingCacheStore implements ListingCacheStore {

    private final Cache<String, CacheEntry> cache;
    private final Clock clock;

    public InMemoryListingCacheStore(ListingCacheProperties properties, Clock clock, SearchMetricsService metrics) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.secondary().maxEntries())
                .expireAfter(new EntryTtlExpiry())
                .build();
        metrics.registerSizeGauge(tier().tagValue(), cache::estimatedSize);
        log.info("Initialized in-memory listing cache (max {} entries)", properties.secondary().maxEntries());
    }

    @Override
    public CacheTier tier() {
        return CacheTier.SECONDARY;
    }

    @Override
    public Mono<CacheEntry> get(String key) {
        return Mono.fromCallable(() -> {
            CacheEntry entry = cache.getIfPresent(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpiredAt(clock.instant())) {
                cache.invalidate(key);
                log.debug("Expired in-memory listing entry: {}", key);
                return null;
            }
            return entry.withTier(CacheTier.SECONDARY);
        });
    }

    @Override
    public Mono<Boolean> put(CacheEntry entry) {
        return Mono.fromCallable(() -> {
            cache.put(entry.fingerprint(), entry.withTier(CacheTier.SECONDARY));
            return true;
        });
    }

    @Override
    public Mono<Boolean> ping() {
        return Mono.just(true);
    }

    @Scheduled(fixedDelayString = "${app.cache.secondary.sweep-interval:PT1M}")
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : cache.asMap().entrySet()) {
            if (e.getValue().isExpiredAt(now) && cache.asMap().remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired listing entries, {} remain", removed, cache.estimatedSize());
        }
        return removed;
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    // Upper bound only; the clock check on read is authoritative
    private static final class EntryTtlExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
