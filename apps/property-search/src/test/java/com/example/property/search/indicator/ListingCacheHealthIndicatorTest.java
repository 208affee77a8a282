package com.example.property.search.indicator;

import com.example.property.search.cache.TieredListingCache;
import com.example.property.search.model.CacheHealth;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ListingCacheHealthIndicator")
class ListingCacheHealthIndicatorTest {

    @Mock
    private TieredListingCache cache;

    @InjectMocks
    private ListingCacheHealthIndicator indicator;

    @Test
    @DisplayName("should stay up but flag degradation when the primary tier is unreachable")
    void shouldReportDegraded() {
        when(cache.healthCheck()).thenReturn(Mono.just(new CacheHealth(false, true)));
        when(cache.hasPrimary()).thenReturn(true);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("primary", "unavailable")
                            .containsEntry("degraded", true);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report a disabled primary tier without degradation")
    void shouldReportDisabledPrimary() {
        when(cache.healthCheck()).thenReturn(Mono.just(new CacheHealth(false, true)));
        when(cache.hasPrimary()).thenReturn(false);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("primary", "disabled")
                            .containsEntry("degraded", false);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report down when the check itself fails")
    void shouldReportDownOnError() {
        when(cache.healthCheck()).thenReturn(Mono.error(new IllegalStateException("boom")));

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }
}
