package com.georep.lookup.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Periodically drops expired lookups so coordinates that are never queried
 * again do not stay in memory. Off unless
 * {@code lookup.cache.sweep.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "lookup.cache.sweep", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class LookupCacheSweeper {

    private final LookupCache lookupCache;

    @Scheduled(fixedRateString = "${lookup.cache.sweep.interval-seconds:300}",
               initialDelayString = "${lookup.cache.sweep.interval-seconds:300}",
               timeUnit = TimeUnit.SECONDS)
    public void sweep() {
        int removed = lookupCache.purgeExpired();
        if (removed > 0) {
            log.info("Cache sweep removed {} expired lookups, {} remain", removed, lookupCache.size());
        }
    }
}
