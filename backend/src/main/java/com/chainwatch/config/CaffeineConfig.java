package com.chainwatch.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String ETH_PRICE_CACHE = "ethPriceCache";
    /** Contract address to its creation (creator, tx hash). Creation never changes. */
    public static final String CONTRACT_CREATION_CACHE = "contractCreationCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(ETH_PRICE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.MINUTES)
                .maximumSize(10)
                .build());
        manager.registerCustomCache(CONTRACT_CREATION_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}
