package com.example.property.search.cache;

import com.example.property.search.model.ResultSet;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached result set with its write time and TTL. Expiry is evaluated against the caller's clock.
 */
public record CacheEntry(
        String fingerprint,
        ResultSet resultSet,
        Instant createdAt,
        Duration ttl,
        CacheTier tier
) {
    @JsonIgnore
    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt());
    }

    public CacheEntry withTier(CacheTier newTier) {
        return newTier == tier ? this : new CacheEntry(fingerprint, resultSet, createdAt, ttl, newTier);
    }
}
