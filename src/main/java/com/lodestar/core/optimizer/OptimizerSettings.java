package com.lodestar.core.optimizer;

import com.lodestar.core.config.ConfigurationException;

import java.time.Duration;

/**
 * Engine-wide tunables of {@link ContextOptimizer}.
 *
 * @param freshnessBias   weight of freshness against relevance in the freshness strategy, in [0,1]
 * @param freshWindow     files modified within this window count as fully fresh
 * @param dependencyDepth how many import levels the dependency strategy follows from a picked file
 */
public record OptimizerSettings(
    double freshnessBias,
    Duration freshWindow,
    int dependencyDepth
) {

    public OptimizerSettings {
        if (freshnessBias < 0 || freshnessBias > 1 || Double.isNaN(freshnessBias)) {
            throw new ConfigurationException("freshnessBias must be in [0,1], got " + freshnessBias);
        }
        if (freshWindow == null || freshWindow.isNegative()) {
            throw new ConfigurationException("freshWindow must be >= 0, got " + freshWindow);
        }
        if (dependencyDepth < 0) {
            throw new ConfigurationException("dependencyDepth must be >= 0, got " + dependencyDepth);
        }
    }

    public static OptimizerSettings defaults() {
        return new OptimizerSettings(0.3, Duration.ofHours(24), 2);
    }
}
