package com.example.property.search.indicator;

import com.example.property.search.cache.TieredListingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reports both listing cache tiers via /actuator/health/listingCache.
 * A down primary tier is reported as degraded, not down, because reads fall back to the secondary tier.
 */
@Slf4j
@Component("listingCacheHealthIndicator")
public class ListingCacheHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final TieredListingCache cache;

    public ListingCacheHealthIndicator(TieredListingCache cache) {
        this.cache = cache;
    }

    @Override
    public Mono<Health> health() {
        return cache.healthCheck()
                .map(health -> {
                    Health.Builder builder = health.secondaryUp() ? Health.up() : Health.down();
                    builder.withDetail("primary", !cache.hasPrimary()
                            ? "disabled"
                            : health.primaryUp() ? "connected" : "unavailable");
                    builder.withDetail("secondary", health.secondaryUp() ? "available" : "unavailable");
                    builder.withDetail("degraded", cache.hasPrimary() && !health.primaryUp());
                    return builder.build();
                })
                .timeout(HEALTH_CHECK_TIMEOUT)
                .onErrorResume(e -> {
                    log.warn("Listing cache health check failed: {}", e.getMessage());
                    return Mono.just(Health.down().withDetail("error", e.getMessage()).build());
                });
    }
}
