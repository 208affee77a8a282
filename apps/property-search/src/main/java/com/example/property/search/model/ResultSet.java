package com.example.property.search.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Merged, deduplicated and sorted listings for one query fingerprint.
 */
public record ResultSet(
        String fingerprint,
        List<ListingRecord> listings,
        ResultStatistics statistics,
        Provenance provenance,
        List<SourceReport> sources,
        Instant assembledAt
) {
    public ResultSet {
        listings = listings == null ? List.of() : List.copyOf(listings);
        sources = sources == null ? List.of() : List.copyOf(sources);
        if (statistics == null) {
            statistics = ResultStatistics.of(listings);
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return listings.isEmpty();
    }

    @JsonIgnore
    public boolean isSynthetic() {
        return provenance == Provenance.SYNTHETIC;
    }
}
