package com.lodestar.core.adaptive;

import com.lodestar.core.config.ConfigurationException;

/**
 * Thresholds of {@link AdaptiveContextManager}.
 *
 * @param maxAttempts         selections per {@code adapt} call, including the first
 * @param underuseRatio       a selection using fewer than this share of the target tokens is retried
 * @param budgetLoosenFactor  share of the target added to the budget on each loosening
 * @param maxBudgetMultiplier loosened budgets never exceed this multiple of the target
 * @param qualityThreshold    average quality below this triggers a loosened retry
 * @param minSamples          outcomes needed before a task-type profile influences selection
 * @param learningRate        weight of the newest outcome in the profile's moving averages
 * @param defaultMaxFiles     file budget when no profile applies
 * @param maxBudgetAdjustment largest change learned outcomes may make to a predicted budget
 */
public record AdaptiveSettings(
    int maxAttempts,
    double underuseRatio,
    double budgetLoosenFactor,
    double maxBudgetMultiplier,
    double qualityThreshold,
    int minSamples,
    double learningRate,
    int defaultMaxFiles,
    int maxBudgetAdjustment
) {

    public AdaptiveSettings {
        if (maxAttempts < 1) {
            throw new ConfigurationException("adaptive maxAttempts must be >= 1, got " + maxAttempts);
        }
        requireFraction("underuseRatio", underuseRatio);
        if (budgetLoosenFactor <= 0) {
            throw new ConfigurationException("adaptive budgetLoosenFactor must be positive, got " + budgetLoosenFactor);
        }
        if (maxBudgetMultiplier < 1.0) {
            throw new ConfigurationException("adaptive maxBudgetMultiplier must be >= 1, got " + maxBudgetMultiplier);
        }
        requireFraction("qualityThreshold", qualityThreshold);
        if (minSamples < 1) {
            throw new ConfigurationException("adaptive minSamples must be >= 1, got " + minSamples);
        }
        if (learningRate <= 0 || learningRate > 1) {
            throw new ConfigurationException("adaptive learningRate must be in (0,1], got " + learningRate);
        }
        if (defaultMaxFiles <= 0) {
            throw new ConfigurationException("adaptive defaultMaxFiles must be positive, got " + defaultMaxFiles);
        }
        if (maxBudgetAdjustment < 0) {
            throw new ConfigurationException("adaptive maxBudgetAdjustment must be >= 0, got " + maxBudgetAdjustment);
        }
    }

    public static AdaptiveSettings defaults() {
        return new AdaptiveSettings(3, 0.5, 0.25, 1.5, 0.7, 5, 0.1, 50, 4000);
    }

    private static void requireFraction(String name, double value) {
        if (value < 0 || value > 1 || Double.isNaN(value)) {
            throw new ConfigurationException("adaptive " + name + " must be in [0,1], got " + value);
        }
    }
}
