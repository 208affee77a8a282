package com.example.property.search.adapter;

import com.example.property.search.exception.SourceAdapterException;
import com.example.property.search.model.ListingOrigin;
import com.example.property.search.model.ListingRecord;
import com.example.property.search.model.SearchFilters;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Extracts {@link ListingRecord}s from a source results page with Jsoup.
 *
 * <p>A page with no cards is either a genuine "no results" page (empty list) or a markup change,
 * which is reported as a permanent failure so it is not retried.
 */
@Slf4j
public class ListingCardParser {

    private static final Pattern NO_RESULTS = Pattern.compile(
            "nenhum (im[óo]vel|resultado) encontrado|n[ãa]o encontramos (im[óo]veis|resultados)");

    private final String source;
    private final CardSelectors selectors;

    public ListingCardParser(String source, CardSelectors selectors) {
        this.source = source;
        this.selectors = selectors;
    }

    public List<ListingRecord> parse(String html, String pageUrl, SearchFilters filters, Instant fetchedAt, int maxCards) {
        Document document = Jsoup.parse(html, pageUrl);
        Elements cards = selectCards(document);
        if (cards.isEmpty()) {
            String text = document.text().toLowerCase(Locale.ROOT);
            if (NO_RESULTS.matcher(text).find()) {
                log.debug("{} reported no results for {}", source, pageUrl);
                return List.of();
            }
            throw SourceAdapterException.permanent(source,
                    "no listing cards found; page markup may have changed");
        }

        List<ListingRecord> records = new ArrayList<>();
        int skipped = 0;
        for (Element card : cards) {
            if (records.size() >= maxCards) {
                break;
            }
            ListingRecord record = toRecord(card, filters, fetchedAt);
            if (record == null) {
                skipped++;
            } else {
                records.add(record);
            }
        }
        log.debug("{} parsed {} listings ({} cards skipped) from {}", source, records.size(), skipped, pageUrl);
        return records;
    }

    private ListingRecord toRecord(Element card, SearchFilters filters, Instant fetchedAt) {
        String title = text(card, selectors.title());
        String priceText = text(card, selectors.price());
        String cardText = card.text();
        Long price = ListingTextParser.parsePrice(priceText != null ? priceText : cardText);
        if (title == null && price == null) {
            return null;
        }

        Element link = card.selectFirst(selectors.link());
        String url = link != null ? ListingTextParser.cleanText(link.absUrl("href")) : null;
        String nativeId = ListingTextParser.cleanText(card.attr("data-id"));
        if (nativeId == null) {
            nativeId = ListingTextParser.extractListingId(url);
        }

        String features = text(card, selectors.features());
        String featureText = features != null ? features : cardText;
        String address = text(card, selectors.address());
        String propertyType = ListingTextParser.canonicalPropertyType(title);
        if (propertyType == null) {
            propertyType = ListingTextParser.canonicalPropertyType(filters.propertyType());
        }

        return ListingRecord.builder()
                .source(source)
                .sourceId(nativeId == null ? null : source + "-" + nativeId)
                .url(url)
                .title(title)
                .price(price)
                .sizeSqm(ListingTextParser.extractInt(featureText, ListingTextParser.AREA))
                .bedrooms(ListingTextParser.extractInt(featureText, ListingTextParser.BEDROOMS))
                .bathrooms(ListingTextParser.extractInt(featureText, ListingTextParser.BATHROOMS))
                .propertyType(propertyType)
                .address(address)
                .neighborhood(ListingTextParser.extractNeighborhood(address, filters.city()))
                .city(filters.city())
                .fetchedAt(fetchedAt)
                .origin(ListingOrigin.LIVE)
                .build();
    }

    private Elements selectCards(Document document) {
        for (String selector : selectors.cards()) {
            Elements cards = document.select(selector);
            if (!cards.isEmpty()) {
                return cards;
            }
        }
        return new Elements();
    }

    private static String text(Element card, String selector) {
        if (selector == null) {
            return null;
        }
        Element element = card.selectFirst(selector);
        return element == null ? null : ListingTextParser.cleanText(element.text());
    }
}
