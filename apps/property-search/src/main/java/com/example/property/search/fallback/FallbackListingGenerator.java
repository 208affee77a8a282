package com.example.property.search.fallback;

import com.example.property.config.properties.FallbackProperties;
import com.example.property.config.properties.FallbackProperties.CityReference;
import com.example.property.search.adapter.ListingTextParser;
import com.example.property.search.merge.ListingMerger;
import com.example.property.search.model.ListingOrigin;
import com.example.property.search.model.ListingRecord;
import com.example.property.search.model.NumericRange;
import com.example.property.search.model.Provenance;
import com.example.property.search.model.QueryFingerprint;
import com.example.property.search.model.ResultSet;
import com.example.property.search.model.SearchFilters;
import com.example.property.search.model.SourceReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthesizes plausible listings from per-city reference data when no source returned anything.
 *
 * <p>Every generated record satisfies the requested filters. With deterministic generation the random
 * source is seeded from the query fingerprint, so a repeated query yields the same listings.
 */
@Slf4j
@Component
public class FallbackListingGenerator {

    public static final String SOURCE = "fallback";

    static final double MIN_PRICE_FACTOR = 0.6;
    static final double MAX_PRICE_FACTOR = 2.5;
    static final long MIN_SIZE = 45;
    static final long MAX_SIZE = 220;
    static final List<String> PROPERTY_TYPES = List.of("apartment", "house", "condo");

    private final FallbackProperties properties;
    private final ListingMerger merger;
    private final Clock clock;

    public FallbackListingGenerator(FallbackProperties properties, ListingMerger merger, Clock clock) {
        this.properties = properties;
        this.merger = merger;
        this.clock = clock;
    }

    public ResultSet generate(SearchFilters filters, QueryFingerprint fingerprint, List<SourceReport> sources) {
        Random random = properties.deterministic() ? new Random(seedFor(fingerprint)) : new Random();
        CityReference reference = properties.referenceFor(ListingTextParser.slug(filters.city()));
        String city = filters.city() != null ? filters.city() : reference.displayName();
        Instant now = clock.instant();

        long[] priceWindow = window(
                Math.round(reference.basePrice() * MIN_PRICE_FACTOR),
                Math.round(reference.basePrice() * MAX_PRICE_FACTOR),
                filters.price());
        long[] sizeWindow = window(MIN_SIZE, MAX_SIZE, filters.size());
        sizeWindow[1] = Math.min(sizeWindow[1], Integer.MAX_VALUE);
        sizeWindow[0] = Math.min(sizeWindow[0], sizeWindow[1]);
        String requestedType = ListingTextParser.canonicalPropertyType(filters.propertyType());

        int count = properties.minCount() + random.nextInt(properties.maxCount() - properties.minCount() + 1);
        List<ListingRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String neighborhood = filters.neighborhood() != null
                    ? filters.neighborhood()
                    : reference.neighborhoods().get(i % reference.neighborhoods().size());
            int bedrooms = filters.bedrooms() != null ? filters.bedrooms() : 1 + random.nextInt(4);
            String type = requestedType != null
                    ? requestedType
                    : PROPERTY_TYPES.get(random.nextInt(PROPERTY_TYPES.size()));
            long price = roundedWithin(draw(random, priceWindow), 1_000, priceWindow);
            int size = Math.toIntExact(draw(random, sizeWindow));

            records.add(ListingRecord.builder()
                    .source(SOURCE)
                    .sourceId(SOURCE + "-" + shortId(fingerprint) + "-" + i)
                    .title(titleFor(type, bedrooms, neighborhood))
                    .price(price)
                    .sizeSqm(size)
                    .bedrooms(bedrooms)
                    .bathrooms(Math.max(1, Math.min(bedrooms, 1 + random.nextInt(3))))
                    .propertyType(type)
                    .address(neighborhood + ", " + city)
                    .neighborhood(neighborhood)
                    .city(city)
                    .fetchedAt(now)
                    .origin(ListingOrigin.SYNTHETIC)
                    .build());
        }

        log.warn("Generated {} synthetic listings for {} from {} reference data",
                records.size(), fingerprint, reference.displayName());
        return merger.assemble(fingerprint.value(), records, filters, Provenance.SYNTHETIC, sources);
    }

    /**
     * Intersects the reference band with the requested range. When they do not overlap,
     * draws stay inside the requested range.
     */
    static long[] window(long referenceLow, long referenceHigh, NumericRange requested) {
        long low = requested.hasMin() ? Math.max(referenceLow, requested.min()) : referenceLow;
        long high = requested.hasMax() ? Math.min(referenceHigh, requested.max()) : referenceHigh;
        if (low <= high) {
            return new long[]{low, high};
        }
        if (requested.hasMin() && requested.min() > referenceHigh) {
            long from = requested.min();
            long to = requested.hasMax() ? requested.max() : from + from / 2;
            return new long[]{from, Math.max(from, to)};
        }
        long to = requested.max();
        long from = requested.hasMin() ? requested.min() : to / 2;
        return new long[]{Math.min(from, to), to};
    }

    private static long draw(Random random, long[] window) {
        long span = window[1] - window[0];
        return window[0] + (long) Math.floor(random.nextDouble() * (span + 1));
    }

    private static long roundedWithin(long value, long step, long[] window) {
        long rounded = Math.round((double) value / step) * step;
        if (rounded < window[0] || rounded > window[1]) {
            return value;
        }
        return rounded;
    }

    private static long seedFor(QueryFingerprint fingerprint) {
        long seed = 1125899906842597L;
        for (char c : fingerprint.value().toCharArray()) {
            seed = 31 * seed + c;
        }
        return seed;
    }

    private static String shortId(QueryFingerprint fingerprint) {
        String value = fingerprint.value();
        return value.substring(Math.max(0, value.length() - 12));
    }

    private static String titleFor(String type, int bedrooms, String neighborhood) {
        String label = switch (type) {
            case "house" -> "Casa";
            case "condo" -> "Casa em condomínio";
            case "penthouse" -> "Cobertura";
            case "studio" -> "Studio";
            case "loft" -> "Loft";
            case "land" -> "Terreno";
            default -> "Apartamento";
        };
        return label + " com " + bedrooms + (bedrooms == 1 ? " quarto" : " quartos") + " em " + neighborhood;
    }
}
