package com.example.property.search.controller;

import com.example.property.search.model.ResultSet;

import java.time.Instant;

public record SearchResponse(String status, ResultSet data, Meta meta) {

    public record Meta(Instant timestamp, long responseTimeMs, String provenance, int count, int total) {
    }

    public static SearchResponse of(ResultSet resultSet, Instant timestamp, long responseTimeMs) {
        return new SearchResponse("success", resultSet,
                new Meta(timestamp, responseTimeMs, resultSet.provenance().label(),
                        resultSet.listings().size(), resultSet.statistics().totalMatches()));
    }
}
