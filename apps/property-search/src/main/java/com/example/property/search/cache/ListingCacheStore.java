package com.example.property.search.cache;

import reactor.core.publisher.Mono;

/**
 * One tier of the listing cache. Implementations may fail; {@link TieredListingCache} absorbs the failures.
 */
public interface ListingCacheStore {

    CacheTier tier();

    /**
     * Returns the entry for {@code key}, or empty if absent or expired.
     */
    Mono<CacheEntry> get(String key);

    /**
     * Stores the entry under its fingerprint until its TTL elapses.
     */
    Mono<Boolean> put(CacheEntry entry);

    Mono<Boolean> ping();
}
