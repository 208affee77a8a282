package com.example.property.search.persistence;

import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

// ID format: "{source}:{sourceId}"
@Repository
public interface ListingRepository extends ReactiveMongoRepository<ListingDocument, String> {
}
