package com.example.property.search.cache;

import com.example.property.common.util.CacheKeyUtils;
import com.example.property.config.ListingCacheConfig;
import com.example.property.config.properties.ListingCacheProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Primary tier backed by Redis. Values are JSON; Redis enforces the TTL and reads re-check it.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.cache.primary.enabled", havingValue = "true")
public class RedisListingCacheStore implements ListingCacheStore {

    private final ReactiveRedisTemplate<String, CacheEntry> redisTemplate;
    private final String keyPrefix;
    private final Clock clock;

    public RedisListingCacheStore(
            @Qualifier(ListingCacheConfig.LISTING_CACHE_TEMPLATE) ReactiveRedisTemplate<String, CacheEntry> redisTemplate,
            ListingCacheProperties properties,
            Clock clock) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = properties.primary().keyPrefix();
        this.clock = clock;
        log.info("Initialized Redis listing cache with key prefix '{}'", keyPrefix);
    }

    @Override
    public CacheTier tier() {
        return CacheTier.PRIMARY;
    }

    @Override
    public Mono<CacheEntry> get(String key) {
        return redisTemplate.opsForValue()
                .get(keyFor(key))
                .filter(entry -> !entry.isExpiredAt(clock.instant()))
                .map(entry -> entry.withTier(CacheTier.PRIMARY))
                .doOnNext(entry -> log.debug("Redis hit for listing key: {}", key));
    }

    @Override
    public Mono<Boolean> put(CacheEntry entry) {
        return redisTemplate.opsForValue()
                .set(keyFor(entry.fingerprint()), entry.withTier(CacheTier.PRIMARY), entry.ttl())
                .doOnSuccess(stored -> log.debug("Stored listing key {} in Redis (ttl {})",
                        entry.fingerprint(), entry.ttl()));
    }

    @Override
    public Mono<Boolean> ping() {
        return redisTemplate.execute(connection -> connection.ping())
                .next()
                .map("PONG"::equalsIgnoreCase);
    }

    private String keyFor(String key) {
        return CacheKeyUtils.namespaced(keyPrefix, key);
    }
}
