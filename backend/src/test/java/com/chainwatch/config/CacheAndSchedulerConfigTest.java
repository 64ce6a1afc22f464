package com.chainwatch.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        SchedulerConfig.class,
        ClockConfig.class
})
class CacheAndSchedulerConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Autowired
    Clock clock;

    @Test
    @DisplayName("both Caffeine caches are created and usable")
    void cachesCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.ETH_PRICE_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.CONTRACT_CREATION_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.CONTRACT_CREATION_CACHE).put("0xpair", "0xcreator");
        assertThat(cacheManager.getCache(CaffeineConfig.CONTRACT_CREATION_CACHE).get("0xpair").get())
                .isEqualTo("0xcreator");
    }

    @Test
    @DisplayName("scheduler pool is created and configured")
    void schedulerPoolCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(3);
    }

    @Test
    @DisplayName("clock runs in UTC")
    void clockIsUtc() {
        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    }
}
