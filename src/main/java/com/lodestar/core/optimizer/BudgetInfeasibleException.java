package com.lodestar.core.optimizer;

/**
 * Thrown when a caller asked for a non-empty selection and no file fits the token budget.
 * Never retried internally.
 */
public class BudgetInfeasibleException extends RuntimeException {

    private final int maxTokens;
    private final int smallestFileTokens;

    public BudgetInfeasibleException(int maxTokens, int smallestFileTokens) {
        super(smallestFileTokens < 0
                ? "No files to select from within a budget of " + maxTokens + " tokens"
                : "No file fits within " + maxTokens + " tokens; the smallest file needs " + smallestFileTokens);
        this.maxTokens = maxTokens;
        this.smallestFileTokens = smallestFileTokens;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    /** Token count of the smallest file, or -1 when the snapshot has no files. */
    public int getSmallestFileTokens() {
        return smallestFileTokens;
    }
}
