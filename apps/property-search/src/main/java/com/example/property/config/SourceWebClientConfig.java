package com.example.property.config;

import com.example.property.config.properties.SourceProperties;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * WebClient used to fetch listing pages from source sites.
 * Sends browser-like headers; per-request deadlines are applied by the callers.
 */
@Configuration
public class SourceWebClientConfig {

    /**
     * Bean qualifier for the listing source WebClient.
     */
    public static final String SOURCE_WEBCLIENT = "sourceWebClient";

    @Bean(SOURCE_WEBCLIENT)
    public WebClient sourceWebClient(WebClient.Builder webClientBuilder, SourceProperties sourceProperties) {

        ConnectionProvider connectionProvider = ConnectionProvider.builder("listing-sources-pool")
                .maxConnections(50)
                .pendingAcquireMaxCount(200)
                .pendingAcquireTimeout(Duration.ofSeconds(5))
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) sourceProperties.connectTimeout().toMillis())
                .followRedirect(true)
                .compress(true)
                .keepAlive(true);

        return webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(sourceProperties.maxInMemorySize()))
                .defaultHeader(HttpHeaders.USER_AGENT, sourceProperties.userAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.TEXT_HTML_VALUE + ",application/xhtml+xml;q=0.9,*/*;q=0.8")
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "pt-BR,pt;q=0.9,en;q=0.8")
                .defaultHeader(HttpHeaders.CACHE_CONTROL, "no-cache")
                .build();
    }
}
