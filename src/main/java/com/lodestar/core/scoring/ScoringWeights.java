package com.lodestar.core.scoring;

import com.lodestar.core.config.ConfigurationException;

/**
 * Weights of the eight relevance factors. Validated once at construction: every weight is
 * non-negative and together they sum to 1.0.
 *
 * @param keywordMatch  task keywords found in the path or file name
 * @param pathRelevance conventional core directories versus vendored, test and doc paths
 * @param fileType      task type x file kind preference
 * @param recency       exponential decay with file age
 * @param size          closeness to the optimal file size
 * @param dependency    graph centrality and affinity to other relevant files
 * @param taskType      task-specific path patterns
 * @param language      task type x language preference
 */
public record ScoringWeights(
    double keywordMatch,
    double pathRelevance,
    double fileType,
    double recency,
    double size,
    double dependency,
    double taskType,
    double language
) {

    static final double SUM_TOLERANCE = 1e-6;

    public ScoringWeights {
        double[] all = {keywordMatch, pathRelevance, fileType, recency, size, dependency, taskType, language};
        double sum = 0;
        for (double w : all) {
            if (w < 0 || Double.isNaN(w) || Double.isInfinite(w)) {
                throw new ConfigurationException("Scoring weights must be finite and non-negative, got " + w);
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ConfigurationException(String.format("Scoring weights must sum to 1.0, got %.6f", sum));
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.25, 0.15, 0.20, 0.10, 0.05, 0.10, 0.10, 0.05);
    }
}
