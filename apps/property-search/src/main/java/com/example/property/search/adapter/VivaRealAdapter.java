package com.example.property.search.adapter;

import com.example.property.config.properties.SourceProperties;
import com.example.property.search.model.ListingRecord;
import com.example.property.search.model.SearchFilters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * VivaReal results pages: {@code /venda/{state}/{city}/[type/]}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.sources.vivareal.enabled", havingValue = "true", matchIfMissing = true)
public class VivaRealAdapter implements SourceAdapter {

    public static final String SOURCE = "vivareal";

    static final CardSelectors SELECTORS = new CardSelectors(
            List.of("[data-cy=rp-property-cd]", "article.property-card__container",
                    ".js-property-card", "article"),
            "a.property-card__content-link, a[href]",
            ".property-card__title, [data-cy=rp-cardProperty-location-txt], h2, h3",
            ".property-card__price, [data-cy=rp-cardProperty-price-txt], [class*=price]",
            ".property-card__address, [data-cy=rp-cardProperty-street-txt], address",
            ".property-card__details, ul.property-card__details"
    );

    private final SourcePageClient pageClient;
    private final ListingCardParser cardParser;
    private final SourceProperties.Site site;
    private final Clock clock;

    public VivaRealAdapter(SourcePageClient pageClient, SourceProperties sourceProperties, Clock clock) {
        this.pageClient = pageClient;
        this.site = sourceProperties.vivareal();
        this.clock = clock;
        this.cardParser = new ListingCardParser(SOURCE, SELECTORS);
    }

    @Override
    public String name() {
        return SOURCE;
    }

    @Override
    public Mono<AdapterResult> fetch(SearchFilters filters, Duration timeout) {
        String url = buildSearchUrl(filters);
        return pageClient.fetchPage(SOURCE, url, timeout)
                .map(html -> {
                    List<ListingRecord> records =
                            cardParser.parse(html, url, filters, clock.instant(), site.maxCards());
                    log.debug("VivaReal returned {} listings for {}", records.size(), filters.city());
                    return new AdapterResult(SOURCE, records, clock.instant());
                });
    }

    String buildSearchUrl(SearchFilters filters) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(site.baseUrl())
                .path("/venda/" + filters.state().toLowerCase(Locale.ROOT)
                        + "/" + ListingTextParser.slug(filters.city()) + "/");
        String typeSlug = ListingTextParser.siteTypeSlug(filters.propertyType());
        if (typeSlug != null) {
            builder.path(typeSlug + "_residencial/");
        }
        if (filters.price().hasMin()) {
            builder.queryParam("preco-minimo", filters.price().min());
        }
        if (filters.price().hasMax()) {
            builder.queryParam("preco-maximo", filters.price().max());
        }
        if (filters.bedrooms() != null) {
            builder.queryParam("quartos", filters.bedrooms());
        }
        if (filters.size().hasMin()) {
            builder.queryParam("area-util-minima", filters.size().min());
        }
        if (filters.size().hasMax()) {
            builder.queryParam("area-util-maxima", filters.size().max());
        }
        if (filters.page() > 1) {
            builder.queryParam("pagina", filters.page());
        }
        return builder.build().toUriString();
    }
}
