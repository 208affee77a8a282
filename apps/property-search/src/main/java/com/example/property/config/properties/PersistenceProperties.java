package com.example.property.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Background persistence of live listings into MongoDB.
 */
@ConfigurationProperties(prefix = "app.persistence")
public record PersistenceProperties(
        boolean enabled,
        int maxBatch
) {
    public PersistenceProperties {
        if (maxBatch <= 0) {
            maxBatch = 50;
        }
    }

    public static PersistenceProperties defaults() {
        return new PersistenceProperties(false, 50);
    }
}
