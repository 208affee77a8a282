package com.example.property.search.adapter;

import com.example.property.search.model.SearchFilters;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * A listing source. Implementations fail with
 * {@link com.example.property.search.exception.SourceAdapterException} carrying the failure kind.
 */
public interface SourceAdapter {

    String name();

    Mono<AdapterResult> fetch(SearchFilters filters, Duration timeout);
}
