package com.lodestar.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for context selection.
 */
@Service
public class ContextMetrics {

    private final MeterRegistry registry;

    public ContextMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSelectionDuration(String strategy, long ms) {
        Timer.builder("lodestar.selection.duration")
                .tag("strategy", strategy)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records the size of a returned selection.
     *
     * @param strategy strategy label
     * @param tokens   total tokens selected
     * @param files    number of files selected
     */
    public void recordSelection(String strategy, int tokens, int files) {
        DistributionSummary.builder("lodestar.selection.tokens")
                .description("Tokens per returned selection")
                .tag("strategy", strategy)
                .register(registry)
                .record(tokens);

        DistributionSummary.builder("lodestar.selection.files")
                .description("Files per returned selection")
                .tag("strategy", strategy)
                .register(registry)
                .record(files);

        if (files == 0) {
            Counter.builder("lodestar.selection.empty")
                    .tag("strategy", strategy)
                    .register(registry)
                    .increment();
        }
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("lodestar.cache.lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordCacheEviction() {
        Counter.builder("lodestar.cache.evictions")
                .register(registry)
                .increment();
    }

    /**
     * Records one adaptive re-selection.
     *
     * @param reason "quality", "underuse" or "empty"
     */
    public void recordAdaptiveRetry(String reason) {
        Counter.builder("lodestar.adaptive.retries")
                .description("Adaptive re-selections by trigger")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records a file whose analysis failed and was treated as zero contribution.
     *
     * @param stage "scoring" or "graph"
     */
    public void recordPartialFailure(String stage) {
        Counter.builder("lodestar.analysis.failures")
                .description("Files skipped after a per-file analysis failure")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }
}
