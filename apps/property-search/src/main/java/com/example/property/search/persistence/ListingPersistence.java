package com.example.property.search.persistence;

import com.example.property.search.model.ResultSet;

/**
 * Stores live listings outside the request path. Implementations return immediately and never throw;
 * failures are logged only.
 */
public interface ListingPersistence {

    void persistAsync(ResultSet resultSet);
}
