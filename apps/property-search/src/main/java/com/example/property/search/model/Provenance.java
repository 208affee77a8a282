package com.example.property.search.model;

/**
 * Where a result set came from.
 */
public enum Provenance {
    /** Every source answered. */
    LIVE("live"),
    /** At least one source answered and at least one failed. */
    PARTIAL_LIVE("partial-live"),
    /** No live listings; generated from reference market data. */
    SYNTHETIC("synthetic");

    private final String label;

    Provenance(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
