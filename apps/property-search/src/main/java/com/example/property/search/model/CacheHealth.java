package com.example.property.search.model;

public record CacheHealth(boolean primaryUp, boolean secondaryUp) {

    public boolean degraded() {
        return !primaryUp;
    }
}
