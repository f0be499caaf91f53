package com.lodestar.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContextMetricsTest {

    private SimpleMeterRegistry registry;
    private ContextMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ContextMetrics(registry);
    }

    @Test
    @DisplayName("recordSelectionDuration creates a timer per strategy")
    void recordSelectionDuration() {
        metrics.recordSelectionDuration("relevance", 12);
        metrics.recordSelectionDuration("relevance", 8);
        metrics.recordSelectionDuration("balanced", 3);

        var relevance = registry.find("lodestar.selection.duration").tag("strategy", "relevance").timer();
        var balanced = registry.find("lodestar.selection.duration").tag("strategy", "balanced").timer();
        assertNotNull(relevance);
        assertNotNull(balanced);
        assertEquals(2, relevance.count());
        assertEquals(1, balanced.count());
    }

    @Test
    @DisplayName("recordSelection tracks tokens and files, and counts empty selections")
    void recordSelection() {
        metrics.recordSelection("compactness", 500, 2);
        metrics.recordSelection("compactness", 0, 0);

        var tokens = registry.find("lodestar.selection.tokens").tag("strategy", "compactness").summary();
        var files = registry.find("lodestar.selection.files").tag("strategy", "compactness").summary();
        var empty = registry.find("lodestar.selection.empty").tag("strategy", "compactness").counter();

        assertNotNull(tokens);
        assertEquals(2, tokens.count());
        assertEquals(500.0, tokens.totalAmount());
        assertEquals(2.0, files.totalAmount());
        assertNotNull(empty);
        assertEquals(1.0, empty.count());
    }

    @Test
    @DisplayName("recordCacheLookup increments the hit or miss counter")
    void recordCacheLookup() {
        metrics.recordCacheLookup(true);
        metrics.recordCacheLookup(false);
        metrics.recordCacheLookup(false);

        assertEquals(1.0, registry.find("lodestar.cache.lookups").tag("result", "hit").counter().count());
        assertEquals(2.0, registry.find("lodestar.cache.lookups").tag("result", "miss").counter().count());
    }

    @Test
    @DisplayName("recordCacheEviction increments the eviction counter")
    void recordCacheEviction() {
        metrics.recordCacheEviction();
        var counter = registry.find("lodestar.cache.evictions").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordAdaptiveRetry and recordPartialFailure tag by reason and stage")
    void retriesAndFailures() {
        metrics.recordAdaptiveRetry("underuse");
        metrics.recordAdaptiveRetry("empty");
        metrics.recordAdaptiveRetry("underuse");
        metrics.recordPartialFailure("graph");

        assertEquals(2.0, registry.find("lodestar.adaptive.retries").tag("reason", "underuse").counter().count());
        assertEquals(1.0, registry.find("lodestar.adaptive.retries").tag("reason", "empty").counter().count());
        assertEquals(1.0, registry.find("lodestar.analysis.failures").tag("stage", "graph").counter().count());
        assertNull(registry.find("lodestar.analysis.failures").tag("stage", "scoring").counter());
    }
}
