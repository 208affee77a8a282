package com.example.property.search.adapter;

import com.example.property.search.model.ListingRecord;

import java.time.Instant;
import java.util.List;

public record AdapterResult(String source, List<ListingRecord> records, Instant fetchedAt) {

    public AdapterResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static AdapterResult empty(String source, Instant fetchedAt) {
        return new AdapterResult(source, List.of(), fetchedAt);
    }
}
