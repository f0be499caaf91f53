package com.lodestar.core.engine;

import com.lodestar.core.cache.CacheKey;
import com.lodestar.core.cache.CacheStatistics;
import com.lodestar.core.cache.ContextBudget;
import com.lodestar.core.cache.ContextCache;
import com.lodestar.core.cache.Fingerprints;
import com.lodestar.core.logging.MdcContext;
import com.lodestar.core.metrics.ContextMetrics;
import com.lodestar.core.model.ContextConstraints;
import com.lodestar.core.model.ProjectSnapshot;
import com.lodestar.core.model.SelectedContext;
import com.lodestar.core.model.Task;
import com.lodestar.core.optimizer.ContextSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for context selection: consults the cache, delegates misses to the optimizer,
 * and records metrics. Empty selections are never cached.
 */
public class ContextEngine implements ContextSelector {

    private static final Logger log = LoggerFactory.getLogger(ContextEngine.class);

    private final ContextSelector optimizer;
    private final ContextCache cache;
    private final ContextMetrics metrics;

    public ContextEngine(ContextSelector optimizer, ContextCache cache, ContextMetrics metrics) {
        this.optimizer = optimizer;
        this.cache = cache;
        this.metrics = metrics;
    }

    @Override
    public SelectedContext select(ProjectSnapshot snapshot, Task task, ContextConstraints constraints) {
        ContextConstraints effective = constraints.resolveFor(task.type());
        String selectionId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setSelection(selectionId, task.type().name().toLowerCase(Locale.ROOT), effective.strategy().label());
        long start = System.currentTimeMillis();
        try {
            CacheKey key = keyFor(snapshot, task, effective);
            Optional<SelectedContext> cached = cache.get(key);
            metrics.recordCacheLookup(cached.isPresent());
            if (cached.isPresent()) {
                log.debug("Cache hit: {} files, {} tokens", cached.get().totalFiles(), cached.get().totalTokens());
                return cached.get();
            }

            SelectedContext result = optimizer.select(snapshot, task, constraints);
            if (!result.isEmpty()) {
                cache.put(key, result);
            }
            metrics.recordSelection(result.strategy().label(), result.totalTokens(), result.totalFiles());
            return result;
        } finally {
            metrics.recordSelectionDuration(effective.strategy().label(), System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    /**
     * True when a selection for these arguments is currently cached. Does not count as an access.
     */
    public boolean isCached(ProjectSnapshot snapshot, Task task, ContextConstraints constraints) {
        return cache.peek(keyFor(snapshot, task, constraints.resolveFor(task.type()))).isPresent();
    }

    /**
     * Drops cached selections computed for any snapshot other than {@code current}.
     */
    public int invalidateStaleSelections(ProjectSnapshot current) {
        return cache.invalidateOtherProjects(Fingerprints.project(current));
    }

    public CacheStatistics cacheStatistics() {
        return cache.statistics();
    }

    public void clearCache() {
        cache.clear();
    }

    private static CacheKey keyFor(ProjectSnapshot snapshot, Task task, ContextConstraints effective) {
        return new CacheKey(
                Fingerprints.project(snapshot),
                Fingerprints.task(task),
                effective.strategy(),
                ContextBudget.of(effective));
    }
}
