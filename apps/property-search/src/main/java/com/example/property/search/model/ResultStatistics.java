package com.example.property.search.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Aggregates over a final listing set. Averages skip records missing the field
 * and are null when no record carries it. {@code totalMatches} counts the matching listings
 * before the page-size cap.
 */
public record ResultStatistics(
        int count,
        int totalMatches,
        Long minPrice,
        Long maxPrice,
        Double averagePrice,
        Double averageSize,
        Double averagePricePerSqm,
        Map<String, Long> countsByType
) {
    public ResultStatistics {
        countsByType = countsByType == null ? Map.of() : Map.copyOf(countsByType);
    }

    public static ResultStatistics of(List<ListingRecord> listings) {
        return of(listings, listings.size());
    }

    public static ResultStatistics of(List<ListingRecord> listings, int totalMatches) {
        List<Long> prices = listings.stream().map(ListingRecord::price).filter(Objects::nonNull).toList();
        List<Integer> sizes = listings.stream().map(ListingRecord::sizeSqm).filter(Objects::nonNull).toList();
        List<Double> pricePerSqm = listings.stream()
                .filter(r -> r.price() != null && r.sizeSqm() != null && r.sizeSqm() > 0)
                .map(r -> (double) r.price() / r.sizeSqm())
                .toList();

        Map<String, Long> byType = listings.stream()
                .map(ListingRecord::propertyType)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));

        return new ResultStatistics(
                listings.size(),
                Math.max(totalMatches, listings.size()),
                prices.stream().min(Long::compare).orElse(null),
                prices.stream().max(Long::compare).orElse(null),
                prices.isEmpty() ? null : round(prices.stream().mapToLong(Long::longValue).average().orElse(0)),
                sizes.isEmpty() ? null : round(sizes.stream().mapToInt(Integer::intValue).average().orElse(0)),
                pricePerSqm.isEmpty() ? null : round(pricePerSqm.stream().mapToDouble(Double::doubleValue).average().orElse(0)),
                byType
        );
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
