package com.example.property.search.fallback;

import com.example.property.config.properties.FallbackProperties;
import com.example.property.config.properties.PipelineProperties;
import com.example.property.search.fingerprint.QueryFingerprinter;
import com.example.property.search.merge.ListingMerger;
import com.example.property.search.model.ListingOrigin;
import com.example.property.search.model.ListingRecord;
import com.example.property.search.model.NumericRange;
import com.example.property.search.model.Provenance;
import com.example.property.search.model.ResultSet;
import com.example.property.search.model.SearchFilters;
import com.example.property.util.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FallbackListingGenerator")
class FallbackListingGeneratorTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
    private final QueryFingerprinter fingerprinter = new QueryFingerprinter();
    private final FallbackListingGenerator generator = new FallbackListingGenerator(
            FallbackProperties.defaults(),
            new ListingMerger(PipelineProperties.defaults(), clock),
            clock);

    private ResultSet generate(SearchFilters filters) {
        return generator.generate(filters, fingerprinter.fingerprint(filters), List.of());
    }

    @Test
    @DisplayName("should produce between eight and fifteen synthetic listings")
    void shouldRespectCountBounds() {
        ResultSet result = generate(SearchFilters.forCity("São Paulo"));

        assertThat(result.listings()).hasSizeBetween(8, 15);
        assertThat(result.provenance()).isEqualTo(Provenance.SYNTHETIC);
        assertThat(result.isSynthetic()).isTrue();
        assertThat(result.listings()).allSatisfy(listing -> {
            assertThat(listing.origin()).isEqualTo(ListingOrigin.SYNTHETIC);
            assertThat(listing.source()).isEqualTo(FallbackListingGenerator.SOURCE);
            assertThat(listing.city()).isEqualTo("São Paulo");
        });
    }

    @Test
    @DisplayName("should return the same listings for the same query")
    void shouldBeDeterministic() {
        SearchFilters filters = SearchFilters.forCity("Rio de Janeiro");

        assertThat(generate(filters).listings()).isEqualTo(generate(filters).listings());
    }

    @Test
    @DisplayName("should give every listing a distinct source id")
    void shouldUseDistinctIds() {
        List<ListingRecord> listings = generate(SearchFilters.forCity("Salvador")).listings();

        assertThat(listings).extracting(ListingRecord::sourceId).doesNotHaveDuplicates();
    }

    @Nested
    @DisplayName("filter compliance")
    class FilterCompliance {

        @Test
        @DisplayName("should keep prices and sizes inside the requested ranges")
        void shouldHonorRanges() {
            SearchFilters filters = SearchFilters.builder()
                    .city("São Paulo")
                    .price(NumericRange.between(500_000L, 700_000L))
                    .size(NumericRange.between(60L, 90L))
                    .build();

            assertThat(generate(filters).listings()).allSatisfy(listing -> {
                assertThat(listing.price()).isBetween(500_000L, 700_000L);
                assertThat(listing.sizeSqm()).isBetween(60, 90);
            });
        }

        @Test
        @DisplayName("should stay inside a requested price range above the city reference band")
        void shouldHonorRangeOutsideReferenceBand() {
            SearchFilters filters = SearchFilters.builder()
                    .city("Fortaleza")
                    .price(NumericRange.between(5_000_000L, 6_000_000L))
                    .build();

            assertThat(generate(filters).listings())
                    .allSatisfy(listing -> assertThat(listing.price()).isBetween(5_000_000L, 6_000_000L));
        }

        @Test
        @DisplayName("should keep sizes positive for a minimum near the largest listing size")
        void shouldHonorHugeSizeMinimum() {
            SearchFilters filters = SearchFilters.builder()
                    .city("São Paulo")
                    .size(NumericRange.atLeast(2_000_000_000L))
                    .build();

            assertThat(generate(filters).listings())
                    .isNotEmpty()
                    .allSatisfy(listing -> assertThat(listing.sizeSqm())
                            .isBetween(2_000_000_000, Integer.MAX_VALUE));
        }

        @Test
        @DisplayName("should use the requested bedrooms, neighborhood and type")
        void shouldHonorExactFilters() {
            SearchFilters filters = SearchFilters.builder()
                    .city("São Paulo")
                    .neighborhood("Moema")
                    .bedrooms(3)
                    .propertyType("casa")
                    .build();

            assertThat(generate(filters).listings()).allSatisfy(listing -> {
                assertThat(listing.bedrooms()).isEqualTo(3);
                assertThat(listing.neighborhood()).isEqualTo("Moema");
                assertThat(listing.propertyType()).isEqualTo("house");
                assertThat(listing.title()).startsWith("Casa com 3 quartos");
            });
        }

        @Test
        @DisplayName("should order listings by the requested sort")
        void shouldSortByPrice() {
            List<ListingRecord> listings = generate(SearchFilters.forCity("Brasília")).listings();

            assertThat(listings).extracting(ListingRecord::price).isSorted();
        }
    }

    @Test
    @DisplayName("should fall back to the default city reference for unknown cities")
    void shouldUseDefaultReferenceForUnknownCity() {
        ResultSet result = generate(SearchFilters.forCity("Cidade Inexistente"));

        assertThat(result.listings()).isNotEmpty().allSatisfy(listing -> {
            assertThat(listing.city()).isEqualTo("Cidade Inexistente");
            assertThat(listing.neighborhood()).isIn("Vila Madalena", "Pinheiros", "Jardins");
        });
    }

    @Test
    @DisplayName("should widen the reference window when the requested range does not overlap it")
    void shouldComputeWindow() {
        assertThat(FallbackListingGenerator.window(100, 200, NumericRange.between(120L, 150L)))
                .containsExactly(120, 150);
        assertThat(FallbackListingGenerator.window(100, 200, NumericRange.atLeast(500)))
                .containsExactly(500, 750);
        assertThat(FallbackListingGenerator.window(100, 200, NumericRange.atMost(50)))
                .containsExactly(25, 50);
        assertThat(FallbackListingGenerator.window(100, 200, NumericRange.unbounded()))
                .containsExactly(100, 200);
    }
}
