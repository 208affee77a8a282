package com.example.property.search.adapter;

import com.example.property.config.properties.SourceProperties;
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
 * ZAP Imóveis results pages: {@code /venda/{state}+{city}/[type/]}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.sources.zap.enabled", havingValue = "true", matchIfMissing = true)
public class ZapImoveisAdapter implements SourceAdapter {

    public static final String SOURCE = "zap";

    static final CardSelectors SELECTORS = new CardSelectors(
            List.of("div[data-testid=property-card]", "[data-cy=rp-property-cd]",
                    ".result-card", ".listing-card", "article"),
            "a[href]",
            "[data-cy=rp-cardProperty-location-txt], .card-title, h2, h3",
            "[data-cy=rp-cardProperty-price-txt], .listing-price, [class*=price]",
            "[data-cy=rp-cardProperty-street-txt], .listing-address, address, [class*=address]",
            ".listing-features, [class*=amenities]"
    );

    private final SourcePageClient pageClient;
    private final ListingCardParser cardParser;
    private final SourceProperties.Site site;
    private final Clock clock;

    public ZapImoveisAdapter(SourcePageClient pageClient, SourceProperties sourceProperties, Clock clock) {
        this.pageClient = pageClient;
        this.site = sourceProperties.zap();
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
                .map(html -> new AdapterResult(SOURCE,
                        cardParser.parse(html, url, filters, clock.instant(), site.maxCards()),
                        clock.instant()))
                .doOnNext(result -> log.debug("ZAP returned {} listings for {}",
                        result.records().size(), filters.city()));
    }

    String buildSearchUrl(SearchFilters filters) {
        String location = filters.state().toLowerCase(Locale.ROOT) + "+" + ListingTextParser.slug(filters.city());
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(site.baseUrl())
                .path("/venda/" + location + "/");
        String typeSlug = ListingTextParser.siteTypeSlug(filters.propertyType());
        if (typeSlug != null) {
            builder.path(typeSlug + "/");
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
            builder.queryParam("area-minima", filters.size().min());
        }
        if (filters.size().hasMax()) {
            builder.queryParam("area-maxima", filters.size().max());
        }
        if (filters.page() > 1) {
            builder.queryParam("pagina", filters.page());
        }
        return builder.build().toUriString();
    }
}
