package com.lodestar.core.optimizer;

import com.lodestar.core.compression.CompressionEstimate;
import com.lodestar.core.model.SelectedContext;

import java.util.Optional;

/**
 * Result of {@link BudgetFitter#fit}.
 *
 * @param selection   the last selection made, carrying a reason for every tightening step
 * @param tokenBudget budget the selection was fitted to
 * @param compression estimate used when tightening alone could not reach the budget, else null
 */
public record BudgetFit(SelectedContext selection, int tokenBudget, CompressionEstimate compression) {

    public boolean withinBudget() {
        return selection.totalTokens() <= tokenBudget;
    }

    public Optional<CompressionEstimate> compressionNeeded() {
        return Optional.ofNullable(compression);
    }
}
