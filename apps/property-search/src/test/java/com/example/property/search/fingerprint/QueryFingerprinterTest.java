package com.example.property.search.fingerprint;

import com.example.property.search.model.ListingSort;
import com.example.property.search.model.NumericRange;
import com.example.property.search.model.QueryFingerprint;
import com.example.property.search.model.SearchFilters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryFingerprinter")
class QueryFingerprinterTest {

    private final QueryFingerprinter fingerprinter = new QueryFingerprinter();

    @Nested
    @DisplayName("equivalent filters")
    class EquivalentFilters {

        @Test
        @DisplayName("should ignore case and surrounding whitespace in text fields")
        void shouldNormalizeText() {
            SearchFilters a = SearchFilters.builder().city("São Paulo").neighborhood("Pinheiros").build();
            SearchFilters b = SearchFilters.builder().city("  são   paulo ").neighborhood("PINHEIROS ").build();

            assertThat(fingerprinter.fingerprint(a)).isEqualTo(fingerprinter.fingerprint(b));
        }

        @Test
        @DisplayName("should treat blank strings as absent")
        void shouldTreatBlankAsAbsent() {
            SearchFilters a = SearchFilters.builder().city("Rio de Janeiro").build();
            SearchFilters b = SearchFilters.builder().city("Rio de Janeiro").neighborhood("   ").propertyType("").build();

            assertThat(fingerprinter.fingerprint(a).value()).isEqualTo(fingerprinter.fingerprint(b).value());
        }

        @Test
        @DisplayName("should treat defaults and explicit default values the same")
        void shouldApplyDefaults() {
            SearchFilters implicit = SearchFilters.forCity("Salvador");
            SearchFilters explicit = SearchFilters.builder()
                    .city("Salvador")
                    .state("sp")
                    .sort(ListingSort.PRICE_ASC)
                    .page(1)
                    .pageSize(20)
                    .price(NumericRange.unbounded())
                    .build();

            assertThat(fingerprinter.fingerprint(implicit)).isEqualTo(fingerprinter.fingerprint(explicit));
        }

        @Test
        @DisplayName("should not depend on parameter insertion order")
        void shouldBeIndependentOfParameterOrder() {
            SearchFilterParser parser = new SearchFilterParser();
            Map<String, String> first = new LinkedHashMap<>();
            first.put("city", "Fortaleza");
            first.put("min_price", "100000");
            first.put("bedrooms", "2");
            Map<String, String> second = new LinkedHashMap<>();
            second.put("bedrooms", "2");
            second.put("minPrice", "100000");
            second.put("city", "fortaleza");

            assertThat(fingerprinter.fingerprint(parser.parse(first)))
                    .isEqualTo(fingerprinter.fingerprint(parser.parse(second)));
        }
    }

    @Nested
    @DisplayName("distinct filters")
    class DistinctFilters {

        @Test
        @DisplayName("should differ when a range bound differs")
        void shouldDifferOnRange() {
            SearchFilters a = SearchFilters.builder().city("São Paulo").price(NumericRange.between(100L, 200L)).build();
            SearchFilters b = SearchFilters.builder().city("São Paulo").price(NumericRange.between(100L, 300L)).build();

            assertThat(fingerprinter.fingerprint(a)).isNotEqualTo(fingerprinter.fingerprint(b));
        }

        @Test
        @DisplayName("should distinguish an open bound from zero")
        void shouldDistinguishOpenBoundFromZero() {
            SearchFilters open = SearchFilters.builder().city("São Paulo").price(NumericRange.atMost(500L)).build();
            SearchFilters zero = SearchFilters.builder().city("São Paulo").price(NumericRange.between(0L, 500L)).build();

            assertThat(fingerprinter.fingerprint(open)).isNotEqualTo(fingerprinter.fingerprint(zero));
        }

        @Test
        @DisplayName("should differ by page")
        void shouldDifferByPage() {
            SearchFilters first = SearchFilters.builder().city("Recife").page(1).build();
            SearchFilters second = SearchFilters.builder().city("Recife").page(2).build();

            assertThat(fingerprinter.fingerprint(first)).isNotEqualTo(fingerprinter.fingerprint(second));
        }
    }

    @Test
    @DisplayName("should produce a prefixed hex digest and keep the canonical form")
    void shouldProduceDigest() {
        QueryFingerprint fingerprint = fingerprinter.fingerprint(SearchFilters.forCity("Brasília"));

        assertThat(fingerprint.value()).startsWith(QueryFingerprinter.PREFIX).hasSize(QueryFingerprinter.PREFIX.length() + 64);
        assertThat(fingerprint.canonical()).contains("city=brasília").contains("price=*..*");
    }

    @Test
    @DisplayName("should accept null filters")
    void shouldAcceptNull() {
        assertThat(fingerprinter.fingerprint(null).value()).startsWith(QueryFingerprinter.PREFIX);
    }
}
