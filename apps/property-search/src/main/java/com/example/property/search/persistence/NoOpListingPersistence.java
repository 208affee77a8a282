package com.example.property.search.persistence;

import com.example.property.search.model.ResultSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(name = "app.persistence.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpListingPersistence implements ListingPersistence {

    @Override
    public void persistAsync(ResultSet resultSet) {
        log.trace("Listing persistence disabled; skipping {}", resultSet.fingerprint());
    }
}
