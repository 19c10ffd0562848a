package com.poolpulse.indexer.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CacheConfig {

    /**
     * Unit USD prices keyed by (token pair, quote side).
     */
    @Bean
    public Cache<String, Double> usdPriceCache(PoolPulseProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(properties.getValuation().getCacheTtlMinutes()))
                .maximumSize(properties.getValuation().getCacheMaxSize())
                .build();
    }
}
