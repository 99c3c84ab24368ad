package com.deskpilot.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QueryEmbeddingCacheConfig {
    @Bean
    public Cache<String, float[]> queryEmbeddingCache(
            @Value("${deskpilot.embedding.query-cache.max-size:1000}") long maxSize,
            @Value("${deskpilot.embedding.query-cache.ttl-seconds:600}") long ttlSeconds) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofSeconds(ttlSeconds))
            .build();
    }
}
