package com.lodestar.core.adaptive;

import com.lodestar.core.model.SelectionStrategy;
import com.lodestar.core.model.TaskType;

import java.time.Instant;

/**
 * What has been learned about one task type, as exponential moving averages over outcomes.
 *
 * @param taskType           the task type
 * @param sampleCount        outcomes recorded
 * @param avgQuality         moving average of quality scores
 * @param successRate        moving average of success (1) and failure (0)
 * @param optimalTokenBudget moving average of token totals of successful high-quality selections, 0 if none
 * @param typicalFileCount   moving average of selected file counts
 * @param preferredStrategy  strategy of the last outcome that beat the average quality, or null
 * @param lastUpdated        time of the last recorded outcome, null before the first
 * @param missRate           moving average of the share of needed files the selections lacked
 * @param wasteRate          moving average of the share of selected files that went unused
 */
public record TaskProfile(
    TaskType taskType,
    int sampleCount,
    double avgQuality,
    double successRate,
    int optimalTokenBudget,
    int typicalFileCount,
    SelectionStrategy preferredStrategy,
    Instant lastUpdated,
    double missRate,
    double wasteRate
) {

    public static TaskProfile empty(TaskType taskType) {
        return new TaskProfile(taskType, 0, 0.0, 0.0, 0, 0, null, null, 0.0, 0.0);
    }

    public boolean isTrained(int minSamples) {
        return sampleCount >= minSamples;
    }

    /**
     * Folds one outcome into the profile. The first outcome seeds every average directly.
     */
    TaskProfile update(SelectionOutcome outcome, double alpha, double qualityThreshold, Instant now) {
        boolean first = sampleCount == 0;
        double quality = outcome.qualityScore();
        double success = outcome.success() ? 1.0 : 0.0;
        int tokens = outcome.selection().totalTokens();
        int files = outcome.selection().totalFiles();

        double newQuality = first ? quality : alpha * quality + (1 - alpha) * avgQuality;
        double newSuccess = first ? success : alpha * success + (1 - alpha) * successRate;
        double newMiss = first ? outcome.missRate() : alpha * outcome.missRate() + (1 - alpha) * missRate;
        double newWaste = first ? outcome.wasteRate() : alpha * outcome.wasteRate() + (1 - alpha) * wasteRate;

        int newBudget = optimalTokenBudget;
        if (outcome.success() && quality > qualityThreshold) {
            newBudget = optimalTokenBudget == 0 ? tokens : (int) (alpha * tokens + (1 - alpha) * optimalTokenBudget);
        }
        int newFiles = first || typicalFileCount == 0 ? files : (int) (alpha * files + (1 - alpha) * typicalFileCount);

        SelectionStrategy newPreferred = preferredStrategy;
        if (outcome.success() && (first || quality > avgQuality)) {
            newPreferred = outcome.selection().strategy();
        }
        return new TaskProfile(taskType, sampleCount + 1, newQuality, newSuccess, newBudget, newFiles,
                newPreferred, now, newMiss, newWaste);
    }
}
