package com.lodestar.core.cache;

import com.lodestar.core.model.SelectionStrategy;

import java.util.Objects;

/**
 * Identifies a memoised selection.
 *
 * @param projectFingerprint fingerprint of the snapshot, see {@link Fingerprints#project}
 * @param taskFingerprint    fingerprint of the task, see {@link Fingerprints#task}
 * @param strategy           strategy the selection was made with
 * @param budget             token and file budget the selection was made under
 */
public record CacheKey(
    String projectFingerprint,
    String taskFingerprint,
    SelectionStrategy strategy,
    ContextBudget budget
) {

    public CacheKey {
        Objects.requireNonNull(projectFingerprint, "projectFingerprint");
        Objects.requireNonNull(taskFingerprint, "taskFingerprint");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(budget, "budget");
    }
}
