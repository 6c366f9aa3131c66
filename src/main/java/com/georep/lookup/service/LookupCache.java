package com.georep.lookup.service;

import com.georep.lookup.dto.LookupResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * In-process TTL cache for coordinate lookups.
 *
 * Cache Strategy:
 * - Key: coordinates formatted with six decimals ({@link #keyOf})
 * - Freshness: checked on every read against the injected {@link Clock}
 * - Eviction: lazy, an expired entry is removed when it is next read;
 *   {@link #purgeExpired()} exists for an optional scheduled sweep
 * - Concurrency: two threads missing on the same key may both compute and
 *   both store; the results are identical so the last write wins
 */
@Slf4j
public class LookupCache {

    private static final String KEY_FORMAT = "%.6f:%.6f";

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    public LookupCache(Clock clock, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        this.clock = clock;
        this.ttl = ttl;
    }

    public static String keyOf(double latitude, double longitude) {
        return String.format(Locale.ROOT, KEY_FORMAT, latitude, longitude);
    }

    public LookupResult getOrCompute(double latitude, double longitude, Supplier<LookupResult> compute) {
        return getOrCompute(keyOf(latitude, longitude), ttl, compute);
    }

    /**
     * Returns the cached value for {@code key} if it is younger than
     * {@code ttl}, otherwise computes, stores and returns a new one.
     * Exceptions from {@code compute} propagate and nothing is stored.
     */
    public LookupResult getOrCompute(String key, Duration ttl, Supplier<LookupResult> compute) {
        Instant now = clock.instant();

        CacheEntry entry = entries.get(key);
        if (entry != null) {
            if (entry.isFresh(now, ttl)) {
                hits.increment();
                return entry.value();
            }
            if (entries.remove(key, entry)) {
                evictions.increment();
                log.debug("Evicted expired lookup: {}", key);
            }
        }

        misses.increment();
        LookupResult value = compute.get();
        entries.put(key, new CacheEntry(value, now));
        return value;
    }

    /**
     * Removes every entry older than the configured TTL.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (!e.getValue().isFresh(now, ttl) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        evictions.add(removed);
        return removed;
    }

    /**
     * Drops every entry and resets the hit, miss and eviction counters.
     */
    public void clear() {
        int size = entries.size();
        entries.clear();
        hits.reset();
        misses.reset();
        evictions.reset();
        log.info("Cleared lookup cache ({} entries)", size);
    }

    public int size() {
        return entries.size();
    }

    public Duration ttl() {
        return ttl;
    }

    public CacheStats stats() {
        return new CacheStats(entries.size(), hits.sum(), misses.sum(), evictions.sum());
    }

    private record CacheEntry(LookupResult value, Instant insertedAt) {
        boolean isFresh(Instant now, Duration ttl) {
            return Duration.between(insertedAt, now).compareTo(ttl) < 0;
        }
    }

    /**
     * Cache statistics record for monitoring.
     */
    public record CacheStats(int size, long hits, long misses, long evictions) {
        public double hitRate() {
            long lookups = hits + misses;
            if (lookups == 0) return 0.0;
            return (double) hits / lookups * 100.0;
        }
    }
}
