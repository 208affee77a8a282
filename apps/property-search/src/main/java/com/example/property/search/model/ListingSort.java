package com.example.property.search.model;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Result ordering. Records missing the sort field go last in every order.
 */
public enum ListingSort {

    PRICE_ASC("price_asc", Comparator.comparing(ListingRecord::price,
            Comparator.nullsLast(Comparator.<Long>naturalOrder()))),
    PRICE_DESC("price_desc", Comparator.comparing(ListingRecord::price,
            Comparator.nullsLast(Comparator.<Long>reverseOrder()))),
    SIZE_ASC("size_asc", Comparator.comparing(ListingRecord::sizeSqm,
            Comparator.nullsLast(Comparator.<Integer>naturalOrder()))),
    SIZE_DESC("size_desc", Comparator.comparing(ListingRecord::sizeSqm,
            Comparator.nullsLast(Comparator.<Integer>reverseOrder()))),
    NEWEST("newest", Comparator.comparing(ListingRecord::fetchedAt,
            Comparator.nullsLast(Comparator.<java.time.Instant>reverseOrder())));

    private final String key;
    private final Comparator<ListingRecord> comparator;

    ListingSort(String key, Comparator<ListingRecord> comparator) {
        this.key = key;
        this.comparator = comparator;
    }

    public String key() {
        return key;
    }

    public Comparator<ListingRecord> comparator() {
        return comparator;
    }

    public static Optional<ListingSort> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(sort -> sort.key.equals(normalized))
                .findFirst();
    }
}
