package com.lodestar.core.cache;

import com.lodestar.core.config.ConfigurationException;

import java.time.Duration;

/**
 * @param maxEntries capacity; the least recently used entry is evicted beyond it
 * @param ttl        entry lifetime; zero disables expiry
 */
public record CacheSettings(int maxEntries, Duration ttl) {

    public CacheSettings {
        if (maxEntries <= 0) {
            throw new ConfigurationException("cache maxEntries must be positive, got " + maxEntries);
        }
        if (ttl == null || ttl.isNegative()) {
            throw new ConfigurationException("cache ttl must be >= 0, got " + ttl);
        }
    }

    public static CacheSettings defaults() {
        return new CacheSettings(1000, Duration.ofMinutes(30));
    }

    public boolean expires() {
        return !ttl.isZero();
    }
}
