package com.example.property.search.persistence;

import com.example.property.search.model.ListingRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

// ID format: "{source}:{sourceId}"
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "listings")
public class ListingDocument {

    @Id
    private String id;

    private String source;
    private String sourceId;
    private String url;
    private String title;
    private Long price;
    private Integer sizeSqm;
    private Integer bedrooms;
    private Integer bathrooms;
    private String propertyType;
    private String address;
    private String neighborhood;

    @Indexed
    private String city;

    private String lastFingerprint;
    private Instant fetchedAt;
    private Instant lastSeenAt;

    public static String idFor(ListingRecord record) {
        return record.source() + ":" + record.sourceId();
    }

    public static ListingDocument from(ListingRecord record, String fingerprint, Instant seenAt) {
        return ListingDocument.builder()
                .id(idFor(record))
                .source(record.source())
                .sourceId(record.sourceId())
                .url(record.url())
                .title(record.title())
                .price(record.price())
                .sizeSqm(record.sizeSqm())
                .bedrooms(record.bedrooms())
                .bathrooms(record.bathrooms())
                .propertyType(record.propertyType())
                .address(record.address())
                .neighborhood(record.neighborhood())
                .city(record.city())
                .lastFingerprint(fingerprint)
                .fetchedAt(record.fetchedAt())
                .lastSeenAt(seenAt)
                .build();
    }
}
