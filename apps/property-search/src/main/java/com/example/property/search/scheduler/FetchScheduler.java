package com.example.property.search.scheduler;

import com.example.property.common.util.RetryUtils;
import com.example.property.config.properties.PipelineProperties;
import com.example.property.observability.SearchMetricsService;
import com.example.property.search.adapter.AdapterResult;
import com.example.property.search.adapter.SourceAdapter;
import com.example.property.search.exception.FailureKind;
import com.example.property.search.exception.SourceAdapterException;
import com.example.property.search.model.QueryFingerprint;
import com.example.property.search.model.SearchFilters;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs source adapters concurrently under a concurrency cap, a per-attempt timeout,
 * transient-failure retries and a hard global budget.
 *
 * <p>The cap is shared by every run: adapter calls go through one FIFO queue drained by a fixed
 * number of worker slots, so concurrent searches never exceed it together.
 *
 * <p>Always completes with exactly one outcome per adapter, in the order the adapters were given.
 * Adapters still running or queued when the budget elapses are cancelled and reported as
 * {@link FailureKind#TIMEOUT}.
 */
@Component
public class FetchScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(FetchScheduler.class);
    private static final Duration EMIT_TIMEOUT = Duration.ofSeconds(1);

    private final Duration adapterTimeout;
    private final int concurrencyLimit;
    private final PipelineProperties.RetryProperties retry;
    private final Clock clock;
    private final SearchMetricsService metrics;

    private final Sinks.Many<AdapterCall> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicInteger running = new AtomicInteger();
    private final Disposable workers;

    public FetchScheduler(PipelineProperties properties, Clock clock, SearchMetricsService metrics) {
        this.adapterTimeout = properties.adapterTimeout();
        this.concurrencyLimit = properties.concurrencyLimit();
        this.retry = properties.retry();
        this.clock = clock;
        this.metrics = metrics;
        this.workers = queue.asFlux()
                .flatMap(this::runQueued, concurrencyLimit)
                .subscribe();
        LOG.info("Fetch scheduler started with {} worker slots", concurrencyLimit);
    }

    @PreDestroy
    public void shutdown() {
        queue.tryEmitComplete();
        workers.dispose();
        LOG.info("Fetch scheduler stopped");
    }

    public Mono<List<AdapterOutcome>> run(QueryFingerprint fingerprint,
                                          SearchFilters filters,
                                          List<SourceAdapter> adapters,
                                          Duration globalBudget) {
        if (adapters.isEmpty()) {
            return Mono.just(List.of());
        }
        return Mono.defer(() -> {
            AtomicReferenceArray<AdapterOutcome> completed = new AtomicReferenceArray<>(adapters.size());
            long started = System.nanoTime();

            // Calls are enqueued in index order, so adapters beyond the cap wait their turn
            return Flux.range(0, adapters.size())
                    .flatMap(i -> submit(adapters.get(i), filters)
                            .doOnNext(outcome -> completed.set(i, outcome)), adapters.size())
                    .take(globalBudget)
                    .then(Mono.fromSupplier(() -> collect(adapters, completed, globalBudget)))
                    .doOnNext(outcomes -> LOG.debug("Fetch for {} finished in {}ms: {}/{} sources answered",
                            fingerprint, (System.nanoTime() - started) / 1_000_000,
                            outcomes.stream().filter(AdapterOutcome::isSuccess).count(), outcomes.size()));
        });
    }

    private Mono<AdapterOutcome> submit(SourceAdapter adapter, SearchFilters filters) {
        return Mono.defer(() -> {
            AdapterCall call = new AdapterCall(adapter.name(), execute(adapter, filters));
            queue.emitNext(call, Sinks.EmitFailureHandler.busyLooping(EMIT_TIMEOUT));
            return call.result();
        });
    }

    private Mono<Void> runQueued(AdapterCall call) {
        return Mono.defer(() -> {
                    LOG.debug("Worker slot taken by {} ({} running)", call.source(), running.incrementAndGet());
                    return call.execute();
                })
                .doFinally(signal -> running.decrementAndGet());
    }

    private Mono<AdapterOutcome> execute(SourceAdapter adapter, SearchFilters filters) {
        String source = adapter.name();
        return Mono.defer(() -> adapter.fetch(filters, adapterTimeout))
                .timeout(adapterTimeout)
                .onErrorMap(TimeoutException.class, e -> SourceAdapterException.timeout(source, adapterTimeout))
                .retryWhen(Retry.backoff(retry.maxAttempts() - 1L, retry.initialBackoff())
                        .maxBackoff(retry.maxBackoff())
                        .filter(RetryUtils.transientPredicate())
                        .doBeforeRetry(signal -> LOG.warn("Retrying {} (attempt {}/{}): {}",
                                source, signal.totalRetries() + 2, retry.maxAttempts(),
                                signal.failure().getMessage()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .defaultIfEmpty(AdapterResult.empty(source, clock.instant()))
                .map(result -> {
                    metrics.recordAdapterOutcome(source, "success");
                    LOG.debug("{} returned {} listings", source, result.records().size());
                    return AdapterOutcome.success(source, result);
                })
                .onErrorResume(e -> {
                    FailureKind kind = RetryUtils.classify(e);
                    metrics.recordAdapterOutcome(source, kind.name().toLowerCase(Locale.ROOT));
                    LOG.warn("Source {} failed ({}): {}", source, kind, e.getMessage());
                    return Mono.just(AdapterOutcome.failure(source, kind, e.getMessage()));
                });
    }

    private List<AdapterOutcome> collect(List<SourceAdapter> adapters,
                                         AtomicReferenceArray<AdapterOutcome> completed,
                                         Duration globalBudget) {
        List<AdapterOutcome> outcomes = new ArrayList<>(adapters.size());
        for (int i = 0; i < adapters.size(); i++) {
            AdapterOutcome outcome = completed.get(i);
            if (outcome == null) {
                String source = adapters.get(i).name();
                metrics.recordAdapterOutcome(source, "budget_exceeded");
                LOG.warn("Source {} cancelled: global fetch budget of {}ms elapsed", source, globalBudget.toMillis());
                outcome = AdapterOutcome.failure(source, FailureKind.TIMEOUT,
                        "cancelled after global budget of " + globalBudget.toMillis() + "ms");
            }
            outcomes.add(outcome);
        }
        return outcomes;
    }
}
