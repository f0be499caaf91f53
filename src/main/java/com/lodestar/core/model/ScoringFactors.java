package com.lodestar.core.model;

/**
 * Per-factor breakdown of a relevance score. Every component is in [0,1].
 */
public record ScoringFactors(
    double keywordMatch,
    double pathRelevance,
    double fileType,
    double recency,
    double size,
    double dependency,
    double taskType,
    double language
) {

    public static final ScoringFactors ZERO = new ScoringFactors(0, 0, 0, 0, 0, 0, 0, 0);

    public ScoringFactors withDependency(double newDependency) {
        return new ScoringFactors(keywordMatch, pathRelevance, fileType, recency, size,
                newDependency, taskType, language);
    }
}
