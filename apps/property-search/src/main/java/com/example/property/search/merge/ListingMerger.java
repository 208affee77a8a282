package com.example.property.search.merge;

import com.example.property.config.properties.PipelineProperties;
import com.example.property.search.adapter.ListingTextParser;
import com.example.property.search.model.ListingRecord;
import com.example.property.search.model.Provenance;
import com.example.property.search.model.ResultSet;
import com.example.property.search.model.ResultStatistics;
import com.example.property.search.model.SearchFilters;
import com.example.property.search.model.SourceReport;
import com.example.property.search.scheduler.AdapterOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines adapter outcomes into one ordered, deduplicated result set.
 *
 * <p>Records are put into a canonical order before deduplication, so the result does not depend on
 * the order in which sources completed, and merging an already merged set changes nothing.
 */
@Slf4j
@Component
public class ListingMerger {

    static final Comparator<ListingRecord> CANONICAL_ORDER = Comparator
            .comparing(ListingRecord::source)
            .thenComparing(ListingRecord::sourceId, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(ListingRecord::url, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(ListingRecord::title, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(ListingRecord::price, Comparator.nullsLast(Comparator.<Long>naturalOrder()))
            .thenComparing(ListingRecord::address, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(ListingRecord::fetchedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private static final Comparator<ListingRecord> TIE_BREAK = Comparator
            .comparing(ListingRecord::sourceId, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(ListingRecord::source)
            .thenComparing(ListingRecord::url, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final ListingSimilarity similarity;
    private final Clock clock;

    public ListingMerger(PipelineProperties properties, Clock clock) {
        this.similarity = new ListingSimilarity(
                properties.dedup().priceTolerance(), properties.dedup().sizeTolerance());
        this.clock = clock;
    }

    public ResultSet merge(String fingerprint, List<AdapterOutcome> outcomes, SearchFilters filters) {
        List<ListingRecord> candidates = outcomes.stream()
                .filter(AdapterOutcome::isSuccess)
                .flatMap(outcome -> outcome.result().records().stream())
                .filter(record -> matchesFilters(record, filters))
                .toList();

        boolean anyFailed = outcomes.stream().anyMatch(outcome -> !outcome.isSuccess());
        Provenance provenance = anyFailed ? Provenance.PARTIAL_LIVE : Provenance.LIVE;
        List<SourceReport> reports = outcomes.stream().map(AdapterOutcome::toReport).toList();

        ResultSet resultSet = assemble(fingerprint, candidates, filters, provenance, reports);
        log.debug("Merged {} candidate listings into {} for {}", candidates.size(),
                resultSet.listings().size(), fingerprint);
        return resultSet;
    }

    /**
     * Deduplicates, sorts, caps to the requested page size and computes statistics over
     * already-filtered records. The statistics keep the number of matches before the cap.
     */
    public ResultSet assemble(String fingerprint,
                              List<ListingRecord> records,
                              SearchFilters filters,
                              Provenance provenance,
                              List<SourceReport> sources) {
        List<ListingRecord> canonical = new ArrayList<>(records);
        canonical.sort(CANONICAL_ORDER);

        List<ListingRecord> unique = deduplicate(canonical);
        unique.sort(filters.sort().comparator().thenComparing(TIE_BREAK));

        List<ListingRecord> page = unique.size() > filters.pageSize() && filters.pageSize() > 0
                ? List.copyOf(unique.subList(0, filters.pageSize()))
                : unique;
        return new ResultSet(fingerprint, page, ResultStatistics.of(page, unique.size()),
                provenance, sources, clock.instant());
    }

    List<ListingRecord> deduplicate(List<ListingRecord> canonical) {
        List<ListingRecord> kept = new ArrayList<>();
        Map<String, Integer> indexById = new HashMap<>();

        for (ListingRecord record : canonical) {
            int match = -1;
            if (record.sourceId() != null) {
                match = indexById.getOrDefault(record.sourceId(), -1);
            }
            if (match < 0) {
                for (int i = 0; i < kept.size(); i++) {
                    if (similarity.isSameListing(kept.get(i), record)) {
                        match = i;
                        break;
                    }
                }
            }
            if (match < 0) {
                kept.add(record);
                if (record.sourceId() != null) {
                    indexById.put(record.sourceId(), kept.size() - 1);
                }
                continue;
            }
            ListingRecord winner = preferred(kept.get(match), record);
            kept.set(match, winner);
            if (winner.sourceId() != null) {
                indexById.putIfAbsent(winner.sourceId(), match);
            }
        }
        return kept;
    }

    // More populated fields wins, then the newer fetch; on a full tie the canonical-first record stays
    static ListingRecord preferred(ListingRecord current, ListingRecord candidate) {
        int byFields = Integer.compare(candidate.descriptiveFieldCount(), current.descriptiveFieldCount());
        if (byFields != 0) {
            return byFields > 0 ? candidate : current;
        }
        Instant currentAt = current.fetchedAt();
        Instant candidateAt = candidate.fetchedAt();
        if (candidateAt != null && (currentAt == null || candidateAt.isAfter(currentAt))) {
            return candidate;
        }
        return current;
    }

    static boolean matchesFilters(ListingRecord record, SearchFilters filters) {
        if (!filters.price().contains(record.price()) || !filters.size().contains(record.sizeSqm())) {
            return false;
        }
        if (filters.bedrooms() != null && record.bedrooms() != null && !filters.bedrooms().equals(record.bedrooms())) {
            return false;
        }
        if (filters.city() != null && record.city() != null
                && !ListingTextParser.slug(filters.city()).equals(ListingTextParser.slug(record.city()))) {
            return false;
        }
        if (filters.neighborhood() != null && record.neighborhood() != null
                && !ListingTextParser.slug(record.neighborhood()).contains(ListingTextParser.slug(filters.neighborhood()))) {
            return false;
        }
        String wantedType = ListingTextParser.canonicalPropertyType(filters.propertyType());
        String recordType = ListingTextParser.canonicalPropertyType(record.propertyType());
        return wantedType == null || recordType == null || wantedType.equals(recordType);
    }
}
