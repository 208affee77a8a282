package com.example.property.search.cache;

import java.util.Locale;

public enum CacheTier {
    PRIMARY,
    SECONDARY;

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
