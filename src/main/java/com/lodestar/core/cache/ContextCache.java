package com.lodestar.core.cache;

import com.lodestar.core.metrics.ContextMetrics;
import com.lodestar.core.model.SelectedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded LRU memo of selections.
 * <p>
 * Lookups share the read lock and record access through atomic counters; inserts, evictions
 * and invalidations take the write lock. Concurrent puts for one key resolve last-write-wins.
 * A hit returns the cached instance itself, so callers can verify that nothing was recomputed.
 */
public class ContextCache {

    private static final Logger log = LoggerFactory.getLogger(ContextCache.class);

    private final Map<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong ticks = new AtomicLong();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder invalidations = new LongAdder();

    private final CacheSettings settings;
    private final Clock clock;
    private final ContextMetrics metrics;

    public ContextCache() {
        this(CacheSettings.defaults(), Clock.systemUTC(), null);
    }

    public ContextCache(CacheSettings settings, Clock clock) {
        this(settings, clock, null);
    }

    /**
     * @param metrics optional, may be null
     */
    public ContextCache(CacheSettings settings, Clock clock, ContextMetrics metrics) {
        this.settings = settings;
        this.clock = clock;
        this.metrics = metrics;
    }

    public Optional<SelectedContext> get(CacheKey key) {
        CacheEntry entry;
        boolean expired = false;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
            if (entry != null && isExpired(entry, clock.instant())) {
                expired = true;
            } else if (entry != null) {
                entry.touch(ticks.incrementAndGet());
                hits.increment();
                return Optional.of(entry.value());
            }
            misses.increment();
        } finally {
            lock.readLock().unlock();
        }
        if (expired) {
            removeExpired(key, entry);
        }
        return Optional.empty();
    }

    public void put(CacheKey key, SelectedContext value) {
        lock.writeLock().lock();
        try {
            if (!entries.containsKey(key) && entries.size() >= settings.maxEntries()) {
                evictLeastRecentlyUsed();
            }
            entries.put(key, new CacheEntry(key, value, clock.instant(), ticks.incrementAndGet()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the live entry for {@code key} without counting an access, mainly for diagnostics.
     * An expired entry is reported as absent, matching what {@link #get} would return.
     */
    public Optional<CacheEntry> peek(CacheKey key) {
        lock.readLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null || isExpired(entry, clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean invalidate(CacheKey key) {
        lock.writeLock().lock();
        try {
            boolean removed = entries.remove(key) != null;
            if (removed) {
                invalidations.increment();
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops every entry computed for a project other than {@code currentProjectFingerprint}.
     *
     * @return number of entries removed
     */
    public int invalidateOtherProjects(String currentProjectFingerprint) {
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.keySet().removeIf(k -> !k.projectFingerprint().equals(currentProjectFingerprint));
            int removed = before - entries.size();
            invalidations.add(removed);
            if (removed > 0) {
                log.info("Invalidated {} cached selections of stale project snapshots", removed);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes expired entries.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        if (!settings.expires()) {
            return 0;
        }
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            int before = entries.size();
            entries.values().removeIf(e -> isExpired(e, now));
            int removed = before - entries.size();
            recordEvictions(removed);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            invalidations.add(entries.size());
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        return entries.size();
    }

    public CacheStatistics statistics() {
        lock.readLock().lock();
        try {
            return new CacheStatistics(hits.sum(), misses.sum(), evictions.sum(), invalidations.sum(), entries.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void removeExpired(CacheKey key, CacheEntry entry) {
        lock.writeLock().lock();
        try {
            if (entries.remove(key, entry)) {
                log.debug("Expired cached selection for strategy {}", key.strategy().label());
                recordEvictions(1);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void evictLeastRecentlyUsed() {
        CacheEntry oldest = null;
        for (CacheEntry candidate : entries.values()) {
            if (oldest == null || candidate.lastAccessTick() < oldest.lastAccessTick()) {
                oldest = candidate;
            }
        }
        if (oldest != null && entries.remove(oldest.key(), oldest)) {
            log.debug("Evicted least recently used selection (accessed {} times)", oldest.accessCount());
            recordEvictions(1);
        }
    }

    private void recordEvictions(int count) {
        if (count <= 0) {
            return;
        }
        evictions.add(count);
        if (metrics != null) {
            for (int i = 0; i < count; i++) {
                metrics.recordCacheEviction();
            }
        }
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        if (!settings.expires()) {
            return false;
        }
        return Duration.between(entry.createdAt(), now).compareTo(settings.ttl()) > 0;
    }
}
