package com.example.property.search.fingerprint;

import com.example.property.search.exception.InvalidSearchException;
import com.example.property.search.model.NumericRange;
import com.example.property.search.model.SearchFilters;
import org.springframework.stereotype.Component;

@Component
public class SearchFilterValidator {

    static final int MAX_BEDROOMS = 20;
    // Listing sizes are whole square meters held in an int
    static final long MAX_SIZE_SQM = Integer.MAX_VALUE;

    public void validate(SearchFilters filters) {
        if (filters == null) {
            throw new InvalidSearchException("filters", "search filters are required");
        }
        if (filters.city() == null) {
            throw new InvalidSearchException("city", "city is required");
        }
        validateRange("price", filters.price());
        validateRange("size", filters.size());
        if ((filters.size().hasMin() && filters.size().min() > MAX_SIZE_SQM)
                || (filters.size().hasMax() && filters.size().max() > MAX_SIZE_SQM)) {
            throw new InvalidSearchException("size", "size bounds must not exceed " + MAX_SIZE_SQM + " m²");
        }
        if (filters.bedrooms() != null && (filters.bedrooms() < 0 || filters.bedrooms() > MAX_BEDROOMS)) {
            throw new InvalidSearchException("bedrooms", "bedrooms must be between 0 and " + MAX_BEDROOMS);
        }
        if (filters.page() < 1) {
            throw new InvalidSearchException("page", "page must be at least 1");
        }
        if (filters.pageSize() < 1 || filters.pageSize() > SearchFilters.MAX_PAGE_SIZE) {
            throw new InvalidSearchException("pageSize",
                    "pageSize must be between 1 and " + SearchFilters.MAX_PAGE_SIZE);
        }
    }

    private static void validateRange(String field, NumericRange range) {
        if (range.hasMin() && range.min() < 0) {
            throw new InvalidSearchException(field, field + " minimum must not be negative");
        }
        if (range.hasMax() && range.max() < 0) {
            throw new InvalidSearchException(field, field + " maximum must not be negative");
        }
        if (range.hasMin() && range.hasMax() && range.min() > range.max()) {
            throw new InvalidSearchException(field,
                    field + " minimum (" + range.min() + ") is greater than maximum (" + range.max() + ")");
        }
    }
}
