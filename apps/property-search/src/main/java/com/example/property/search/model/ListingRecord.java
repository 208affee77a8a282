package com.example.property.search.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.time.Instant;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * A single listing as extracted from a source (or synthesized by the fallback generator).
 * {@code sourceId} is prefixed with the source name, so ids from different sites never collide.
 */
@Builder(toBuilder = true)
public record ListingRecord(
        String source,
        String sourceId,
        String url,
        String title,
        Long price,
        Integer sizeSqm,
        Integer bedrooms,
        Integer bathrooms,
        String propertyType,
        String address,
        String neighborhood,
        String city,
        Instant fetchedAt,
        ListingOrigin origin
) {
    public ListingRecord {
        Objects.requireNonNull(source, "source");
        if (origin == null) {
            origin = ListingOrigin.LIVE;
        }
    }

    /**
     * Number of populated descriptive fields; the richer duplicate wins during dedup.
     */
    public int descriptiveFieldCount() {
        return (int) Stream.of(url, title, price, sizeSqm, bedrooms, bathrooms,
                        propertyType, address, neighborhood, city)
                .filter(Objects::nonNull)
                .count();
    }

    @JsonIgnore
    public boolean isSynthetic() {
        return origin == ListingOrigin.SYNTHETIC;
    }
}
