package com.lodestar.core.cache;

import com.lodestar.core.model.SelectedContext;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A cached selection with its bookkeeping. Access counters are atomic so concurrent readers
 * can record hits while holding only the shared lock.
 */
public final class CacheEntry {

    private final CacheKey key;
    private final SelectedContext value;
    private final Instant createdAt;
    private final AtomicLong accessCount = new AtomicLong();
    private final AtomicLong lastAccessTick;

    CacheEntry(CacheKey key, SelectedContext value, Instant createdAt, long tick) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.lastAccessTick = new AtomicLong(tick);
    }

    void touch(long tick) {
        accessCount.incrementAndGet();
        lastAccessTick.accumulateAndGet(tick, Math::max);
    }

    public CacheKey key() {
        return key;
    }

    public SelectedContext value() {
        return value;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public long accessCount() {
        return accessCount.get();
    }

    public long lastAccessTick() {
        return lastAccessTick.get();
    }
}
