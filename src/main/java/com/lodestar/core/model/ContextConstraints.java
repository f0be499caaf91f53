package com.lodestar.core.model;

import com.lodestar.core.config.ConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Limits and policy for a single selection.
 *
 * @param maxTokens       hard token budget; only must-include files may push the total above it
 * @param maxFiles        maximum number of files in the selection
 * @param strategy        ordering policy used while packing
 * @param overrides       optional per-task-type overrides of the fields above
 * @param failWhenEmpty   when true, an empty selection raises
 *                        {@link com.lodestar.core.optimizer.BudgetInfeasibleException} instead of being returned
 * @param filter          which files may be packed besides the must-includes
 * @param dependencyDepth import levels the dependency strategy follows, or null for the optimizer's setting
 */
public record ContextConstraints(
    int maxTokens,
    int maxFiles,
    SelectionStrategy strategy,
    Map<TaskType, TaskOverride> overrides,
    boolean failWhenEmpty,
    CandidateFilter filter,
    Integer dependencyDepth
) {

    public ContextConstraints {
        if (maxTokens <= 0) {
            throw new ConfigurationException("maxTokens must be positive, got " + maxTokens);
        }
        if (maxFiles <= 0) {
            throw new ConfigurationException("maxFiles must be positive, got " + maxFiles);
        }
        if (dependencyDepth != null && dependencyDepth < 0) {
            throw new ConfigurationException("dependencyDepth must be >= 0, got " + dependencyDepth);
        }
        strategy = strategy != null ? strategy : SelectionStrategy.BALANCED;
        overrides = overrides == null || overrides.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(overrides));
        filter = filter != null ? filter : CandidateFilter.NONE;
    }

    public ContextConstraints(int maxTokens, int maxFiles, SelectionStrategy strategy,
                              Map<TaskType, TaskOverride> overrides, boolean failWhenEmpty) {
        this(maxTokens, maxFiles, strategy, overrides, failWhenEmpty, CandidateFilter.NONE, null);
    }

    public static ContextConstraints of(int maxTokens, int maxFiles, SelectionStrategy strategy) {
        return new ContextConstraints(maxTokens, maxFiles, strategy, Map.of(), false);
    }

    public ContextConstraints withStrategy(SelectionStrategy newStrategy) {
        return new ContextConstraints(maxTokens, maxFiles, newStrategy, overrides, failWhenEmpty, filter, dependencyDepth);
    }

    public ContextConstraints withMaxTokens(int newMaxTokens) {
        return new ContextConstraints(newMaxTokens, maxFiles, strategy, overrides, failWhenEmpty, filter, dependencyDepth);
    }

    public ContextConstraints withFilter(CandidateFilter newFilter) {
        return new ContextConstraints(maxTokens, maxFiles, strategy, overrides, failWhenEmpty, newFilter, dependencyDepth);
    }

    public ContextConstraints withDependencyDepth(Integer depth) {
        return new ContextConstraints(maxTokens, maxFiles, strategy, overrides, failWhenEmpty, filter, depth);
    }

    public ContextConstraints withOverride(TaskType type, TaskOverride override) {
        var copy = new EnumMap<TaskType, TaskOverride>(TaskType.class);
        copy.putAll(overrides);
        copy.put(type, override);
        return new ContextConstraints(maxTokens, maxFiles, strategy, copy, failWhenEmpty, filter, dependencyDepth);
    }

    public ContextConstraints failingWhenEmpty() {
        return new ContextConstraints(maxTokens, maxFiles, strategy, overrides, true, filter, dependencyDepth);
    }

    /**
     * Applies the override registered for {@code type}, if any, and drops the override table.
     */
    public ContextConstraints resolveFor(TaskType type) {
        TaskOverride override = overrides.get(type);
        if (override == null) {
            return overrides.isEmpty() ? this
                    : new ContextConstraints(maxTokens, maxFiles, strategy, Map.of(), failWhenEmpty, filter, dependencyDepth);
        }
        return new ContextConstraints(
                override.maxTokens() != null ? override.maxTokens() : maxTokens,
                override.maxFiles() != null ? override.maxFiles() : maxFiles,
                override.strategy() != null ? override.strategy() : strategy,
                Map.of(),
                failWhenEmpty,
                filter,
                dependencyDepth);
    }

    /**
     * Per-task-type replacement values; null fields keep the base value.
     */
    public record TaskOverride(Integer maxTokens, Integer maxFiles, SelectionStrategy strategy) {
        public TaskOverride {
            if (maxTokens != null && maxTokens <= 0) {
                throw new ConfigurationException("override maxTokens must be positive, got " + maxTokens);
            }
            if (maxFiles != null && maxFiles <= 0) {
                throw new ConfigurationException("override maxFiles must be positive, got " + maxFiles);
            }
        }
    }
}
