package com.gt.studyplanner.conf;

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

    // last good snapshots, kept as the fallback for history loads that time out
    public static final String SNAPSHOTS = "snapshots";
    private static final long CACHE_EVICT_SCHEDULE_MS = 6 * 60 * 60 * 1000;

    @Bean
    public CacheManager getSnapshotCacheManager() {
        return new ConcurrentMapCacheManager(SNAPSHOTS);
    }

    @CacheEvict(allEntries = true, value = {SNAPSHOTS})
    @Scheduled(fixedDelay = CACHE_EVICT_SCHEDULE_MS, initialDelay = CACHE_EVICT_SCHEDULE_MS)
    public void reportSnapshotCacheEvict() {
        log.info("Flushing " + SNAPSHOTS + " cache.");
    }
}
