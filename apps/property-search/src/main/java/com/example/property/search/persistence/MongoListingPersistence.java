package com.example.property.search.persistence;

import com.example.property.config.properties.PersistenceProperties;
import com.example.property.search.model.ListingRecord;
import com.example.property.search.model.ResultSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Upserts the live listings of a result set into MongoDB, keyed by source and source id.
 * Runs fire-and-forget on the bounded elastic scheduler.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.persistence.enabled", havingValue = "true")
public class MongoListingPersistence implements ListingPersistence {

    private final ListingRepository repository;
    private final int maxBatch;
    private final Clock clock;

    public MongoListingPersistence(ListingRepository repository, PersistenceProperties properties, Clock clock) {
        this.repository = repository;
        this.maxBatch = properties.maxBatch();
        this.clock = clock;
        log.info("MongoDB listing persistence enabled (max batch {})", maxBatch);
    }

    @Override
    public void persistAsync(ResultSet resultSet) {
        List<ListingDocument> documents = toDocuments(resultSet);
        if (documents.isEmpty()) {
            log.debug("No persistable listings in {}", resultSet.fingerprint());
            return;
        }
        repository.saveAll(documents)
                .count()
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        saved -> log.debug("Persisted {} listings for {}", saved, resultSet.fingerprint()),
                        error -> log.warn("Failed to persist listings for {}: {}",
                                resultSet.fingerprint(), error.getMessage())
                );
    }

    List<ListingDocument> toDocuments(ResultSet resultSet) {
        Instant seenAt = clock.instant();
        return resultSet.listings().stream()
                .filter(record -> !record.isSynthetic())
                .filter(record -> record.sourceId() != null)
                .limit(maxBatch)
                .map((ListingRecord record) -> ListingDocument.from(record, resultSet.fingerprint(), seenAt))
                .toList();
    }
}
