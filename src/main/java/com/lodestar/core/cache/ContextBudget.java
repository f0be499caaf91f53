package com.lodestar.core.cache;

import com.lodestar.core.model.CandidateFilter;
import com.lodestar.core.model.ContextConstraints;

import java.util.Objects;

/**
 * The budget and candidate-policy part of a cache key.
 *
 * @param maxTokens       token budget the selection was made under
 * @param maxFiles        file budget the selection was made under
 * @param filter          candidate filter the selection was made under
 * @param dependencyDepth dependency depth requested by the constraints, null for the default
 */
public record ContextBudget(int maxTokens, int maxFiles, CandidateFilter filter, Integer dependencyDepth) {

    public ContextBudget {
        Objects.requireNonNull(filter, "filter");
    }

    public ContextBudget(int maxTokens, int maxFiles) {
        this(maxTokens, maxFiles, CandidateFilter.NONE, null);
    }

    public static ContextBudget of(ContextConstraints constraints) {
        return new ContextBudget(constraints.maxTokens(), constraints.maxFiles(), constraints.filter(),
                constraints.dependencyDepth());
    }
}
