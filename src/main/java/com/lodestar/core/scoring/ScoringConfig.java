package com.lodestar.core.scoring;

import com.lodestar.core.config.ConfigurationException;

import java.time.Duration;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tunables of {@link WeightedRelevanceScorer}.
 *
 * @param weights               factor weights
 * @param recencyHalfLife       age at which the recency factor drops to 0.5
 * @param optimalTokens         file size (tokens) with the best size factor
 * @param sizePenalty           slope of the penalty for files above the optimal size
 * @param minSizeScore          floor of the size factor
 * @param centralityTopFraction share of files treated as high scorers when computing graph affinity
 * @param stopWords             words ignored when extracting keywords from a description
 */
public record ScoringConfig(
    ScoringWeights weights,
    Duration recencyHalfLife,
    int optimalTokens,
    double sizePenalty,
    double minSizeScore,
    double centralityTopFraction,
    Set<String> stopWords
) {

    public static final Set<String> DEFAULT_STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "were", "been",
            "be", "have", "has", "had", "do", "does", "did", "will", "would",
            "should", "could", "may", "might", "must", "can", "this", "that",
            "these", "those", "i", "you", "he", "she", "it", "we", "they");

    public ScoringConfig {
        if (weights == null) {
            throw new ConfigurationException("Scoring weights are required");
        }
        if (recencyHalfLife == null || recencyHalfLife.isNegative() || recencyHalfLife.isZero()) {
            throw new ConfigurationException("recencyHalfLife must be positive, got " + recencyHalfLife);
        }
        if (optimalTokens <= 0) {
            throw new ConfigurationException("optimalTokens must be positive, got " + optimalTokens);
        }
        if (sizePenalty < 0) {
            throw new ConfigurationException("sizePenalty must be >= 0, got " + sizePenalty);
        }
        if (minSizeScore < 0 || minSizeScore > 1) {
            throw new ConfigurationException("minSizeScore must be in [0,1], got " + minSizeScore);
        }
        if (centralityTopFraction <= 0 || centralityTopFraction > 1) {
            throw new ConfigurationException("centralityTopFraction must be in (0,1], got " + centralityTopFraction);
        }
        stopWords = stopWords != null
                ? stopWords.stream().map(String::toLowerCase).collect(Collectors.toUnmodifiableSet())
                : DEFAULT_STOP_WORDS;
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(ScoringWeights.defaults(), Duration.ofDays(7), 500, 0.5, 0.3, 0.2, DEFAULT_STOP_WORDS);
    }

    public ScoringConfig withWeights(ScoringWeights newWeights) {
        return new ScoringConfig(newWeights, recencyHalfLife, optimalTokens, sizePenalty, minSizeScore,
                centralityTopFraction, stopWords);
    }
}
