package com.example.property.search.model;

import lombok.Builder;

/**
 * A listing search request. Blank strings are treated as absent;
 * page, page size, sort and state fall back to their defaults.
 */
@Builder(toBuilder = true)
public record SearchFilters(
        String city,
        String state,
        String neighborhood,
        NumericRange price,
        NumericRange size,
        Integer bedrooms,
        String propertyType,
        ListingSort sort,
        int page,
        int pageSize
) {
    public static final String DEFAULT_STATE = "SP";
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    public SearchFilters {
        city = blankToNull(city);
        state = blankToNull(state);
        if (state == null) {
            state = DEFAULT_STATE;
        }
        neighborhood = blankToNull(neighborhood);
        propertyType = blankToNull(propertyType);
        if (price == null) {
            price = NumericRange.unbounded();
        }
        if (size == null) {
            size = NumericRange.unbounded();
        }
        if (sort == null) {
            sort = ListingSort.PRICE_ASC;
        }
        if (page == 0) {
            page = DEFAULT_PAGE;
        }
        if (pageSize == 0) {
            pageSize = DEFAULT_PAGE_SIZE;
        }
    }

    public static SearchFilters forCity(String city) {
        return SearchFilters.builder().city(city).build();
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
