package com.gt.practice.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

@Configuration
@EnableCaching
@EnableScheduling
public class CachingConfig {

    private static final Logger log = LoggerFactory.getLogger(CachingConfig.class);

    public static final String CONTENT_POOLS = "content_pools";
    private static final long CACHE_EVICT_SCHEDULE_MS = 15 * 60 * 1000;

    @Bean
    public CacheManager getContentCacheManager() {
        return new ConcurrentMapCacheManager(CONTENT_POOLS);
    }

    @CacheEvict(allEntries = true, value = {CONTENT_POOLS})
    @Scheduled(fixedDelay = CACHE_EVICT_SCHEDULE_MS, initialDelay = CACHE_EVICT_SCHEDULE_MS)
    public void reportContentCacheEvict() {
        log.info("Flushing " + CONTENT_POOLS + " cache.");
    }
}
