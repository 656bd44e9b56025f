package org.carball.probe.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.carball.probe.model.QueryResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local query result cache with per-entry TTL and a size bound, backed by Caffeine.
 *
 * <p>Entries hold deep copies in both directions, so callers can never mutate cached state.
 * Time comes from the injected {@link Clock}. Counters only ever increase.
 */
@Slf4j
public class ResultCache {

    private final Clock clock;
    private final Duration defaultTtl;
    private final int maxItems;
    private final Cache<CacheKey, CacheEntry> entries;
    private final AtomicLong bypassed = new AtomicLong();

    public ResultCache(Clock clock, Duration defaultTtl, int maxItems) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.maxItems = Math.max(1, maxItems);

        Instant origin = clock.instant();
        Ticker ticker = () -> Duration.between(origin, clock.instant()).toNanos();

        this.entries = Caffeine.newBuilder()
                .maximumSize(this.maxItems)
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener(ResultCache::onRemoval)
                .recordStats()
                .build();

        log.debug("Result cache initialized (ttl={}s, maxItems={})", defaultTtl.getSeconds(), this.maxItems);
    }

    /**
     * A cached result together with how long it has been cached.
     */
    public record Hit(QueryResult result, Duration age) {
    }

    private record CacheEntry(QueryResult result, Instant createdAt, Duration ttl) {
    }

    // An entry is still served at exactly its TTL and expires one nanosecond later
    private static final class EntryExpiry implements Expiry<CacheKey, CacheEntry> {

        @Override
        public long expireAfterCreate(CacheKey key, CacheEntry entry, long currentTime) {
            return lifetime(entry.ttl());
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CacheEntry entry, long currentTime, long currentDuration) {
            return lifetime(entry.ttl());
        }

        @Override
        public long expireAfterRead(CacheKey key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long lifetime(Duration ttl) {
            try {
                return Math.addExact(ttl.toNanos(), 1L);
            } catch (ArithmeticException e) {
                return Long.MAX_VALUE;
            }
        }
    }

    private static void onRemoval(CacheKey key, CacheEntry entry, RemovalCause cause) {
        if (key == null) {
            return;
        }
        if (cause == RemovalCause.EXPIRED) {
            log.debug("Cache entry expired: {}", key.normalizedText());
        } else if (cause == RemovalCause.SIZE) {
            log.debug("Evicted cache entry over the size bound: {}", key.normalizedText());
        }
    }

    public boolean isEnabled() {
        return !defaultTtl.isNegative() && !defaultTtl.isZero();
    }

    /**
     * Returns a copy of the cached result, or empty on a miss or an expired entry.
     */
    public Optional<Hit> get(CacheKey key) {
        CacheEntry entry = entries.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(entry.createdAt(), clock.instant());
        return Optional.of(new Hit(entry.result().copy(), age));
    }

    public void put(CacheKey key, QueryResult result) {
        put(key, result, defaultTtl);
    }

    /**
     * Stores a copy of the result. A non-positive TTL stores nothing.
     */
    public void put(CacheKey key, QueryResult result, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            return;
        }
        entries.put(key, new CacheEntry(result.copy(), clock.instant(), ttl));
    }

    /**
     * Counts a lookup that skipped the cache entirely.
     */
    public void recordBypass() {
        bypassed.incrementAndGet();
    }

    public boolean invalidate(CacheKey key) {
        return entries.asMap().remove(key) != null;
    }

    /**
     * Drops every entry. Counters are kept.
     */
    public int clear() {
        int removed = liveEntries();
        entries.invalidateAll();
        entries.cleanUp();
        return removed;
    }

    /**
     * Removes expired entries and returns how many were dropped.
     */
    public int sweepExpired() {
        long before = entries.estimatedSize();
        int live = liveEntries();
        return (int) Math.max(0L, before - live);
    }

    public CacheStats stats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats counters = entries.stats();
        return new CacheStats(counters.hitCount(), counters.missCount(), bypassed.get(),
                liveEntries(), maxItems, defaultTtl.getSeconds());
    }

    // Caffeine reclaims expired entries on its own timer granularity; the map view already hides them
    private int liveEntries() {
        entries.cleanUp();
        int live = 0;
        for (CacheKey ignored : entries.asMap().keySet()) {
            live++;
        }
        return live;
    }
}
