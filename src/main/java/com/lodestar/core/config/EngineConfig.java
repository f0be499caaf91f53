package com.lodestar.core.config;

import com.lodestar.core.adaptive.AdaptiveContextManager;
import com.lodestar.core.adaptive.AdaptiveSettings;
import com.lodestar.core.cache.CacheSettings;
import com.lodestar.core.cache.ContextCache;
import com.lodestar.core.compression.CompressionEstimator;
import com.lodestar.core.engine.ContextEngine;
import com.lodestar.core.graph.DependencyGraphBuilder;
import com.lodestar.core.graph.ImportResolver;
import com.lodestar.core.graph.MetadataImportResolver;
import com.lodestar.core.metrics.ContextMetrics;
import com.lodestar.core.model.CandidateFilter;
import com.lodestar.core.model.ContextConstraints;
import com.lodestar.core.model.FileKind;
import com.lodestar.core.model.SelectionStrategy;
import com.lodestar.core.optimizer.BudgetFitter;
import com.lodestar.core.optimizer.ContextOptimizer;
import com.lodestar.core.optimizer.OptimizerSettings;
import com.lodestar.core.scoring.ScoringConfig;
import com.lodestar.core.scoring.ScoringWeights;
import com.lodestar.core.scoring.WeightedRelevanceScorer;
import com.lodestar.core.tokens.HeuristicTokenCounter;
import com.lodestar.core.tokens.TokenCounter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the selection engine from {@link LodestarProperties}.
 * Every component is constructed here and passed down; nothing is looked up globally.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenCounter tokenCounter() {
        return new HeuristicTokenCounter();
    }

    @Bean
    public ImportResolver importResolver() {
        return new MetadataImportResolver();
    }

    @Bean
    public DependencyGraphBuilder dependencyGraphBuilder(ImportResolver importResolver) {
        return new DependencyGraphBuilder(importResolver);
    }

    @Bean
    public ScoringConfig scoringConfig(LodestarProperties properties) {
        return toScoringConfig(properties.getScoring());
    }

    @Bean
    public WeightedRelevanceScorer relevanceScorer(ScoringConfig scoringConfig, Clock clock, ContextMetrics metrics) {
        return new WeightedRelevanceScorer(scoringConfig, clock, metrics);
    }

    @Bean
    public ContextOptimizer contextOptimizer(WeightedRelevanceScorer relevanceScorer, LodestarProperties properties,
                                             Clock clock) {
        return new ContextOptimizer(relevanceScorer, toOptimizerSettings(properties.getOptimizer()), clock);
    }

    @Bean
    public ContextCache contextCache(LodestarProperties properties, Clock clock, ContextMetrics metrics) {
        var cache = properties.getCache();
        return new ContextCache(new CacheSettings(cache.getMaxEntries(), cache.getTtl()), clock, metrics);
    }

    @Bean
    public ContextEngine contextEngine(ContextOptimizer contextOptimizer, ContextCache contextCache,
                                       ContextMetrics metrics) {
        return new ContextEngine(contextOptimizer, contextCache, metrics);
    }

    @Bean
    public AdaptiveContextManager adaptiveContextManager(ContextEngine contextEngine, LodestarProperties properties,
                                                         Clock clock, ContextMetrics metrics) {
        return new AdaptiveContextManager(contextEngine,
                toAdaptiveSettings(properties.getAdaptive(), properties.getOptimizer()), clock, metrics);
    }

    @Bean
    public CompressionEstimator compressionEstimator() {
        return new CompressionEstimator();
    }

    @Bean
    public BudgetFitter budgetFitter(ContextEngine contextEngine, CompressionEstimator compressionEstimator) {
        return new BudgetFitter(contextEngine, compressionEstimator);
    }

    /**
     * Constraints used when a caller does not supply its own.
     */
    @Bean
    public ContextConstraints defaultConstraints(LodestarProperties properties) {
        var optimizer = properties.getOptimizer();
        return new ContextConstraints(optimizer.getMaxTokens(), optimizer.getMaxFiles(),
                parseStrategy(optimizer.getStrategy()), Map.of(), false, toCandidateFilter(optimizer), null);
    }

    static CandidateFilter toCandidateFilter(LodestarProperties.Optimizer optimizer) {
        return new CandidateFilter(optimizer.getMinRelevanceScore(), optimizer.isIncludeTests(),
                optimizer.isIncludeDocs(), optimizer.getExcludedPatterns(), parseKinds(optimizer.getPreferredKinds()));
    }

    static Set<FileKind> parseKinds(List<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        var kinds = EnumSet.noneOf(FileKind.class);
        for (String value : values) {
            kinds.add(FileKind.parse(value));
        }
        return kinds;
    }

    static ScoringConfig toScoringConfig(LodestarProperties.Scoring scoring) {
        var w = scoring.getWeights();
        var weights = new ScoringWeights(w.getKeywordMatch(), w.getPathRelevance(), w.getFileType(), w.getRecency(),
                w.getSize(), w.getDependency(), w.getTaskType(), w.getLanguage());
        Set<String> stopWords = scoring.getStopWords() == null || scoring.getStopWords().isEmpty()
                ? ScoringConfig.DEFAULT_STOP_WORDS
                : Set.copyOf(scoring.getStopWords());
        return new ScoringConfig(weights, scoring.getRecencyHalfLife(), scoring.getOptimalTokens(),
                scoring.getSizePenalty(), scoring.getMinSizeScore(), scoring.getCentralityTopFraction(), stopWords);
    }

    static OptimizerSettings toOptimizerSettings(LodestarProperties.Optimizer optimizer) {
        return new OptimizerSettings(optimizer.getFreshnessBias(), optimizer.getFreshWindow(),
                optimizer.getDependencyDepth());
    }

    static AdaptiveSettings toAdaptiveSettings(LodestarProperties.Adaptive adaptive,
                                               LodestarProperties.Optimizer optimizer) {
        return new AdaptiveSettings(adaptive.getMaxAttempts(), adaptive.getUnderuseRatio(),
                adaptive.getBudgetLoosenFactor(), adaptive.getMaxBudgetMultiplier(), adaptive.getQualityThreshold(),
                adaptive.getMinSamples(), adaptive.getLearningRate(), optimizer.getMaxFiles(),
                adaptive.getMaxBudgetAdjustment());
    }

    static SelectionStrategy parseStrategy(String value) {
        try {
            return SelectionStrategy.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown selection strategy '" + value + "'", e);
        }
    }
}
