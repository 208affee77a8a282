package com.example.property.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Listing source sites and the shared HTTP client settings used to reach them.
 */
@ConfigurationProperties(prefix = "app.sources")
public record SourceProperties(
        String userAgent,
        int maxInMemorySize,
        Duration connectTimeout,
        Site zap,
        Site vivareal
) {
    private static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/120.0.0.0 Safari/537.36";

    private static final String ZAP_BASE_URL = "https://www.zapimoveis.com.br";
    private static final String VIVAREAL_BASE_URL = "https://www.vivareal.com.br";

    public SourceProperties {
        if (userAgent == null || userAgent.isBlank()) {
            userAgent = DEFAULT_USER_AGENT;
        }
        if (maxInMemorySize <= 0) {
            maxInMemorySize = 5 * 1024 * 1024;
        }
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            connectTimeout = Duration.ofSeconds(2);
        }
        zap = withDefaultUrl(zap, ZAP_BASE_URL);
        vivareal = withDefaultUrl(vivareal, VIVAREAL_BASE_URL);
    }

    public static SourceProperties defaults() {
        return new SourceProperties(DEFAULT_USER_AGENT, 5 * 1024 * 1024, Duration.ofSeconds(2), null, null);
    }

    private static Site withDefaultUrl(Site site, String baseUrl) {
        if (site == null) {
            return new Site(true, baseUrl, 40);
        }
        if (site.baseUrl() == null || site.baseUrl().isBlank()) {
            return new Site(site.enabled(), baseUrl, site.maxCards());
        }
        return site;
    }

    public record Site(Boolean enabled, String baseUrl, int maxCards) {
        public Site {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (baseUrl != null && baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }
            if (maxCards <= 0) {
                maxCards = 40;
            }
        }
    }
}
