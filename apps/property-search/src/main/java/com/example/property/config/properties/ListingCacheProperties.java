package com.example.property.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tiered listing cache settings.
 * The primary (Redis) tier is optional; the secondary (in-process) tier is always present.
 */
@ConfigurationProperties(prefix = "app.cache")
public record ListingCacheProperties(
        PrimaryProperties primary,
        SecondaryProperties secondary
) {
    public ListingCacheProperties {
        if (primary == null) {
            primary = PrimaryProperties.defaults();
        }
        if (secondary == null) {
            secondary = SecondaryProperties.defaults();
        }
    }

    public static ListingCacheProperties defaults() {
        return new ListingCacheProperties(PrimaryProperties.defaults(), SecondaryProperties.defaults());
    }

    public record PrimaryProperties(boolean enabled, Duration timeout, String keyPrefix) {
        public PrimaryProperties {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                timeout = Duration.ofMillis(500);
            }
            if (keyPrefix == null || keyPrefix.isBlank()) {
                keyPrefix = "listings:";
            }
        }

        public static PrimaryProperties defaults() {
            return new PrimaryProperties(false, Duration.ofMillis(500), "listings:");
        }
    }

    public record SecondaryProperties(int maxEntries, Duration sweepInterval) {
        public SecondaryProperties {
            if (maxEntries <= 0) {
                maxEntries = 1000;
            }
            if (sweepInterval == null || sweepInterval.isZero() || sweepInterval.isNegative()) {
                sweepInterval = Duration.ofMinutes(1);
            }
        }

        public static SecondaryProperties defaults() {
            return new SecondaryProperties(1000, Duration.ofMinutes(1));
        }
    }
}
