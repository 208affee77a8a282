package com.example.property.config;

import com.example.property.search.cache.CacheEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis template for the primary listing cache tier.
 * Values are serialized as typed JSON with the application ObjectMapper, so no class metadata is stored.
 */
@Configuration
@ConditionalOnProperty(name = "app.cache.primary.enabled", havingValue = "true")
public class ListingCacheConfig {

    public static final String LISTING_CACHE_TEMPLATE = "listingCacheTemplate";

    @Bean(LISTING_CACHE_TEMPLATE)
    public ReactiveRedisTemplate<String, CacheEntry> listingCacheTemplate(
            ReactiveRedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper) {

        StringRedisSerializer keySerializer = new StringRedisSerializer();
        Jackson2JsonRedisSerializer<CacheEntry> valueSerializer =
                new Jackson2JsonRedisSerializer<>(objectMapper, CacheEntry.class);

        RedisSerializationContext<String, CacheEntry> serializationContext =
                RedisSerializationContext.<String, CacheEntry>newSerializationContext(keySerializer)
                        .key(keySerializer)
                        .value(valueSerializer)
                        .hashKey(keySerializer)
                        .hashValue(valueSerializer)
                        .build();

        return new ReactiveRedisTemplate<>(connectionFactory, serializationContext);
    }
}
