package com.example.property.search.fingerprint;

import com.example.property.search.exception.InvalidSearchException;
import com.example.property.search.model.ListingSort;
import com.example.property.search.model.SearchFilters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SearchFilterParser")
class SearchFilterParserTest {

    private final SearchFilterParser parser = new SearchFilterParser();

    @Test
    @DisplayName("should parse range strings and explicit bounds")
    void shouldParseRanges() {
        SearchFilters filters = parser.parse(Map.of(
                "city", "São Paulo",
                "price", "300000-500000",
                "area", "60+",
                "max_size", "120"));

        assertThat(filters.price().min()).isEqualTo(300_000L);
        assertThat(filters.price().max()).isEqualTo(500_000L);
        assertThat(filters.size().min()).isEqualTo(60L);
        assertThat(filters.size().max()).isEqualTo(120L);
    }

    @Test
    @DisplayName("should let explicit bounds override a range side")
    void shouldOverrideRangeSide() {
        SearchFilters filters = parser.parse(Map.of("city", "Rio", "price", "100-900", "maxPrice", "500"));

        assertThat(filters.price().min()).isEqualTo(100L);
        assertThat(filters.price().max()).isEqualTo(500L);
    }

    @Test
    @DisplayName("should accept Portuguese aliases and paging keys")
    void shouldAcceptAliases() {
        SearchFilters filters = parser.parse(Map.of(
                "city", "Salvador",
                "quartos", "3",
                "bairro", "Barra",
                "per_page", "50",
                "page", "2",
                "sort", "price-desc"));

        assertThat(filters.bedrooms()).isEqualTo(3);
        assertThat(filters.neighborhood()).isEqualTo("Barra");
        assertThat(filters.pageSize()).isEqualTo(50);
        assertThat(filters.page()).isEqualTo(2);
        assertThat(filters.sort()).isEqualTo(ListingSort.PRICE_DESC);
    }

    @Test
    @DisplayName("should apply defaults for missing optional parameters")
    void shouldApplyDefaults() {
        SearchFilters filters = parser.parse(Map.of("city", "Fortaleza", "unknown", "x"));

        assertThat(filters.state()).isEqualTo(SearchFilters.DEFAULT_STATE);
        assertThat(filters.page()).isEqualTo(1);
        assertThat(filters.pageSize()).isEqualTo(20);
        assertThat(filters.sort()).isEqualTo(ListingSort.PRICE_ASC);
        assertThat(filters.price().hasMin()).isFalse();
    }

    @Test
    @DisplayName("should reject unparseable numbers")
    void shouldRejectUnparseableNumbers() {
        assertThatThrownBy(() -> parser.parse(Map.of("city", "Rio", "min_price", "cheap")))
                .isInstanceOf(InvalidSearchException.class)
                .extracting("field").isEqualTo("minPrice");
    }

    @Test
    @DisplayName("should reject malformed ranges")
    void shouldRejectMalformedRange() {
        assertThatThrownBy(() -> parser.parse(Map.of("city", "Rio", "price", "100~200")))
                .isInstanceOf(InvalidSearchException.class)
                .extracting("field").isEqualTo("price");
    }

    @Test
    @DisplayName("should reject an unknown sort key")
    void shouldRejectUnknownSort() {
        assertThatThrownBy(() -> parser.parse(Map.of("city", "Rio", "sort", "random")))
                .isInstanceOf(InvalidSearchException.class)
                .extracting("field").isEqualTo("sort");
    }

    @Test
    @DisplayName("should reject page zero")
    void shouldRejectPageZero() {
        assertThatThrownBy(() -> parser.parse(Map.of("city", "Rio", "page", "0")))
                .isInstanceOf(InvalidSearchException.class)
                .extracting("field").isEqualTo("page");
    }
}
