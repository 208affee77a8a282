package com.example.property;

import com.example.property.search.SearchCoordinator;
import com.example.property.search.adapter.SourceAdapter;
import com.example.property.search.persistence.ListingPersistence;
import com.example.property.search.persistence.NoOpListingPersistence;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class PropertySearchApplicationTests {

    @Autowired
    private SearchCoordinator coordinator;

    @Autowired
    private List<SourceAdapter> adapters;

    @Autowired
    private ListingPersistence persistence;

    @Test
    void contextLoads() {
        assertThat(coordinator).isNotNull();
        assertThat(adapters).extracting(SourceAdapter::name).containsExactlyInAnyOrder("zap", "vivareal");
        assertThat(persistence).isInstanceOf(NoOpListingPersistence.class);
    }
}
