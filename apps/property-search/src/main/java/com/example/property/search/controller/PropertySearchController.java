package com.example.property.search.controller;

import com.example.property.search.SearchCoordinator;
import com.example.property.search.fingerprint.SearchFilterParser;
import com.example.property.search.model.CacheHealth;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/properties")
@RequiredArgsConstructor
public class PropertySearchController {

    private final SearchCoordinator coordinator;
    private final SearchFilterParser filterParser;
    private final Clock clock;

    /**
     * Searches listings. Accepts city, state, neighborhood, price/size ranges or min/max bounds,
     * bedrooms, propertyType, sort, page and pageSize.
     */
    @GetMapping("/search")
    public Mono<SearchResponse> search(@RequestParam Map<String, String> params) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return Mono.fromCallable(() -> filterParser.parse(params))
                    .flatMap(coordinator::search)
                    .map(resultSet -> SearchResponse.of(resultSet, clock.instant(),
                            (System.nanoTime() - started) / 1_000_000));
        });
    }

    @GetMapping("/cache/health")
    public Mono<CacheHealth> cacheHealth() {
        return coordinator.cacheHealth();
    }
}
