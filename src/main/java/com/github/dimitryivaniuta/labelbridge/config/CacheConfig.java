package com.github.dimitryivaniuta.labelbridge.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.labelbridge.cache.TtlCaffeineCacheManager;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Local Caffeine caches. TTL and size per cache via name convention "cacheName:ttl=30:max=1000".
 */
@Configuration
public class CacheConfig {

    @Bean
    public CacheManager cacheManager() {
        return new TtlCaffeineCacheManager(() ->
                Caffeine.newBuilder()
                        .expireAfterAccess(Duration.ofMinutes(10)) // fallback when no :ttl= suffix
                        .recordStats(),
                50_000
        );
    }
}
