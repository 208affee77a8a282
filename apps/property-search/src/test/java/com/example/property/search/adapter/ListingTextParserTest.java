package com.example.property.search.adapter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ListingTextParser")
class ListingTextParserTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(delimiter = '|', value = {
            "R$ 1.250.000|1250000",
            "R$ 450 mil|450000",
            "R$ 1,2 mi|1200000",
            "A partir de R$ 890.000 Condomínio R$ 1.200|890000",
            "650000|650000"
    })
    @DisplayName("should parse Brazilian price formats")
    void shouldParsePrices(String text, long expected) {
        assertThat(ListingTextParser.parsePrice(text)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should return null for prices on request")
    void shouldReturnNullForPriceOnRequest() {
        assertThat(ListingTextParser.parsePrice("Sob consulta")).isNull();
        assertThat(ListingTextParser.parsePrice("Consulte o preço")).isNull();
        assertThat(ListingTextParser.parsePrice("")).isNull();
    }

    @Test
    @DisplayName("should build accent-free slugs")
    void shouldSlugify() {
        assertThat(ListingTextParser.slug("São Paulo")).isEqualTo("sao-paulo");
        assertThat(ListingTextParser.slug("  Brasília ")).isEqualTo("brasilia");
        assertThat(ListingTextParser.slug("Belo   Horizonte")).isEqualTo("belo-horizonte");
    }

    @Test
    @DisplayName("should extract features from card text")
    void shouldExtractFeatures() {
        String text = "72 m² 3 quartos 2 banheiros 1 vaga";

        assertThat(ListingTextParser.extractInt(text, ListingTextParser.AREA)).isEqualTo(72);
        assertThat(ListingTextParser.extractInt(text, ListingTextParser.BEDROOMS)).isEqualTo(3);
        assertThat(ListingTextParser.extractInt(text, ListingTextParser.BATHROOMS)).isEqualTo(2);
        assertThat(ListingTextParser.extractInt("sem dados", ListingTextParser.AREA)).isNull();
    }

    @Test
    @DisplayName("should extract the neighborhood from an address")
    void shouldExtractNeighborhood() {
        assertThat(ListingTextParser.extractNeighborhood(
                "Rua Harmonia, 123 - Vila Madalena, São Paulo - SP", "São Paulo")).isEqualTo("Vila Madalena");
        assertThat(ListingTextParser.extractNeighborhood("Pinheiros, São Paulo", "São Paulo")).isEqualTo("Pinheiros");
        assertThat(ListingTextParser.extractNeighborhood(null, "São Paulo")).isNull();
    }

    @Test
    @DisplayName("should extract listing ids from listing URLs")
    void shouldExtractListingIds() {
        assertThat(ListingTextParser.extractListingId(
                "https://www.vivareal.com.br/imovel/apartamento-2-quartos-pinheiros-65m2-venda-RS650000-id-2654321987/"))
                .isEqualTo("2654321987");
        assertThat(ListingTextParser.extractListingId("https://www.zapimoveis.com.br/imovel/venda-casa-2601234567/"))
                .isEqualTo("2601234567");
        assertThat(ListingTextParser.extractListingId("https://example.com/listing")).isNull();
    }

    @Test
    @DisplayName("should map Portuguese property types")
    void shouldMapPropertyTypes() {
        assertThat(ListingTextParser.canonicalPropertyType("Apartamento com 2 quartos")).isEqualTo("apartment");
        assertThat(ListingTextParser.canonicalPropertyType("Casa")).isEqualTo("house");
        assertThat(ListingTextParser.canonicalPropertyType("house")).isEqualTo("house");
        assertThat(ListingTextParser.canonicalPropertyType("Galpão")).isNull();
        assertThat(ListingTextParser.siteTypeSlug("apartment")).isEqualTo("apartamento");
    }
}
