package com.example.property.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Fetch pipeline settings: per-adapter timeout, global budget, concurrency cap,
 * retry policy, cache TTLs by provenance and dedup tolerances.
 */
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
        Duration adapterTimeout,
        Duration globalBudget,
        int concurrencyLimit,
        RetryProperties retry,
        TtlProperties ttl,
        DedupProperties dedup
) {
    private static final Duration DEFAULT_ADAPTER_TIMEOUT = Duration.ofSeconds(3);
    private static final Duration DEFAULT_GLOBAL_BUDGET = Duration.ofSeconds(8);
    private static final int DEFAULT_CONCURRENCY_LIMIT = 4;

    public PipelineProperties {
        if (adapterTimeout == null || adapterTimeout.isZero() || adapterTimeout.isNegative()) {
            adapterTimeout = DEFAULT_ADAPTER_TIMEOUT;
        }
        if (globalBudget == null || globalBudget.isZero() || globalBudget.isNegative()) {
            globalBudget = DEFAULT_GLOBAL_BUDGET;
        }
        if (concurrencyLimit <= 0) {
            concurrencyLimit = DEFAULT_CONCURRENCY_LIMIT;
        }
        if (retry == null) {
            retry = RetryProperties.defaults();
        }
        if (ttl == null) {
            ttl = TtlProperties.defaults();
        }
        if (dedup == null) {
            dedup = DedupProperties.defaults();
        }
        if (adapterTimeout.compareTo(globalBudget) >= 0) {
            throw new IllegalArgumentException(
                    "app.pipeline.adapter-timeout (" + adapterTimeout
                            + ") must be shorter than app.pipeline.global-budget (" + globalBudget + ")");
        }
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(DEFAULT_ADAPTER_TIMEOUT, DEFAULT_GLOBAL_BUDGET, DEFAULT_CONCURRENCY_LIMIT,
                RetryProperties.defaults(), TtlProperties.defaults(), DedupProperties.defaults());
    }

    /**
     * Retry policy for transient adapter failures. {@code maxAttempts} counts the first attempt.
     */
    public record RetryProperties(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        public RetryProperties {
            if (maxAttempts <= 0) {
                maxAttempts = 3;
            }
            if (initialBackoff == null || initialBackoff.isNegative()) {
                initialBackoff = Duration.ofMillis(200);
            }
            if (maxBackoff == null) {
                maxBackoff = Duration.ofSeconds(2);
            }
            if (maxBackoff.compareTo(initialBackoff) < 0) {
                maxBackoff = initialBackoff;
            }
        }

        public static RetryProperties defaults() {
            return new RetryProperties(3, Duration.ofMillis(200), Duration.ofSeconds(2));
        }
    }

    public record TtlProperties(Duration live, Duration fallback) {
        public TtlProperties {
            if (live == null || live.isZero() || live.isNegative()) {
                live = Duration.ofMinutes(5);
            }
            if (fallback == null || fallback.isZero() || fallback.isNegative()) {
                fallback = Duration.ofMinutes(1);
            }
        }

        public static TtlProperties defaults() {
            return new TtlProperties(Duration.ofMinutes(5), Duration.ofMinutes(1));
        }
    }

    // Relative tolerances used when two records carry no comparable source id
    public record DedupProperties(double priceTolerance, double sizeTolerance) {
        public DedupProperties {
            if (priceTolerance <= 0) {
                priceTolerance = 0.02;
            }
            if (sizeTolerance <= 0) {
                sizeTolerance = 0.05;
            }
        }

        public static DedupProperties defaults() {
            return new DedupProperties(0.02, 0.05);
        }
    }
}
