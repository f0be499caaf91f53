package com.lodestar.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalised settings of the selection engine, bound from {@code lodestar.*}.
 * Values are plain mutable beans; {@link EngineConfig} turns them into validated settings records.
 */
@Component
@ConfigurationProperties(prefix = "lodestar")
public class LodestarProperties {

    private Scoring scoring = new Scoring();
    private Optimizer optimizer = new Optimizer();
    private Cache cache = new Cache();
    private Adaptive adaptive = new Adaptive();

    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring scoring) { this.scoring = scoring; }
    public Optimizer getOptimizer() { return optimizer; }
    public void setOptimizer(Optimizer optimizer) { this.optimizer = optimizer; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Adaptive getAdaptive() { return adaptive; }
    public void setAdaptive(Adaptive adaptive) { this.adaptive = adaptive; }

    public static class Scoring {
        private Weights weights = new Weights();
        private Duration recencyHalfLife = Duration.ofDays(7);
        private int optimalTokens = 500;
        private double sizePenalty = 0.5;
        private double minSizeScore = 0.3;
        private double centralityTopFraction = 0.2;
        /** Empty means the built-in English stop words. */
        private List<String> stopWords = new ArrayList<>();

        public Weights getWeights() { return weights; }
        public void setWeights(Weights weights) { this.weights = weights; }
        public Duration getRecencyHalfLife() { return recencyHalfLife; }
        public void setRecencyHalfLife(Duration recencyHalfLife) { this.recencyHalfLife = recencyHalfLife; }
        public int getOptimalTokens() { return optimalTokens; }
        public void setOptimalTokens(int optimalTokens) { this.optimalTokens = optimalTokens; }
        public double getSizePenalty() { return sizePenalty; }
        public void setSizePenalty(double sizePenalty) { this.sizePenalty = sizePenalty; }
        public double getMinSizeScore() { return minSizeScore; }
        public void setMinSizeScore(double minSizeScore) { this.minSizeScore = minSizeScore; }
        public double getCentralityTopFraction() { return centralityTopFraction; }
        public void setCentralityTopFraction(double centralityTopFraction) { this.centralityTopFraction = centralityTopFraction; }
        public List<String> getStopWords() { return stopWords; }
        public void setStopWords(List<String> stopWords) { this.stopWords = stopWords; }
    }

    public static class Weights {
        private double keywordMatch = 0.25;
        private double pathRelevance = 0.15;
        private double fileType = 0.20;
        private double recency = 0.10;
        private double size = 0.05;
        private double dependency = 0.10;
        private double taskType = 0.10;
        private double language = 0.05;

        public double getKeywordMatch() { return keywordMatch; }
        public void setKeywordMatch(double keywordMatch) { this.keywordMatch = keywordMatch; }
        public double getPathRelevance() { return pathRelevance; }
        public void setPathRelevance(double pathRelevance) { this.pathRelevance = pathRelevance; }
        public double getFileType() { return fileType; }
        public void setFileType(double fileType) { this.fileType = fileType; }
        public double getRecency() { return recency; }
        public void setRecency(double recency) { this.recency = recency; }
        public double getSize() { return size; }
        public void setSize(double size) { this.size = size; }
        public double getDependency() { return dependency; }
        public void setDependency(double dependency) { this.dependency = dependency; }
        public double getTaskType() { return taskType; }
        public void setTaskType(double taskType) { this.taskType = taskType; }
        public double getLanguage() { return language; }
        public void setLanguage(double language) { this.language = language; }
    }

    public static class Optimizer {
        private int maxTokens = 8000;
        private int maxFiles = 50;
        private String strategy = "balanced";
        private double freshnessBias = 0.3;
        private Duration freshWindow = Duration.ofHours(24);
        private int dependencyDepth = 2;
        private double minRelevanceScore = 0.0;
        private boolean includeTests = true;
        private boolean includeDocs = true;
        private List<String> excludedPatterns = new ArrayList<>();
        private List<String> preferredKinds = new ArrayList<>();

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
        public int getMaxFiles() { return maxFiles; }
        public void setMaxFiles(int maxFiles) { this.maxFiles = maxFiles; }
        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public double getFreshnessBias() { return freshnessBias; }
        public void setFreshnessBias(double freshnessBias) { this.freshnessBias = freshnessBias; }
        public Duration getFreshWindow() { return freshWindow; }
        public void setFreshWindow(Duration freshWindow) { this.freshWindow = freshWindow; }
        public int getDependencyDepth() { return dependencyDepth; }
        public void setDependencyDepth(int dependencyDepth) { this.dependencyDepth = dependencyDepth; }
        public double getMinRelevanceScore() { return minRelevanceScore; }
        public void setMinRelevanceScore(double minRelevanceScore) { this.minRelevanceScore = minRelevanceScore; }
        public boolean isIncludeTests() { return includeTests; }
        public void setIncludeTests(boolean includeTests) { this.includeTests = includeTests; }
        public boolean isIncludeDocs() { return includeDocs; }
        public void setIncludeDocs(boolean includeDocs) { this.includeDocs = includeDocs; }
        public List<String> getExcludedPatterns() { return excludedPatterns; }
        public void setExcludedPatterns(List<String> excludedPatterns) { this.excludedPatterns = excludedPatterns; }
        public List<String> getPreferredKinds() { return preferredKinds; }
        public void setPreferredKinds(List<String> preferredKinds) { this.preferredKinds = preferredKinds; }
    }

    public static class Cache {
        private int maxEntries = 1000;
        private Duration ttl = Duration.ofMinutes(30);

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
    }

    public static class Adaptive {
        private int maxAttempts = 3;
        private double underuseRatio = 0.5;
        private double budgetLoosenFactor = 0.25;
        private double maxBudgetMultiplier = 1.5;
        private double qualityThreshold = 0.7;
        private int minSamples = 5;
        private double learningRate = 0.1;
        private int maxBudgetAdjustment = 4000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public double getUnderuseRatio() { return underuseRatio; }
        public void setUnderuseRatio(double underuseRatio) { this.underuseRatio = underuseRatio; }
        public double getBudgetLoosenFactor() { return budgetLoosenFactor; }
        public void setBudgetLoosenFactor(double budgetLoosenFactor) { this.budgetLoosenFactor = budgetLoosenFactor; }
        public double getMaxBudgetMultiplier() { return maxBudgetMultiplier; }
        public void setMaxBudgetMultiplier(double maxBudgetMultiplier) { this.maxBudgetMultiplier = maxBudgetMultiplier; }
        public double getQualityThreshold() { return qualityThreshold; }
        public void setQualityThreshold(double qualityThreshold) { this.qualityThreshold = qualityThreshold; }
        public int getMinSamples() { return minSamples; }
        public void setMinSamples(int minSamples) { this.minSamples = minSamples; }
        public double getLearningRate() { return learningRate; }
        public void setLearningRate(double learningRate) { this.learningRate = learningRate; }
        public int getMaxBudgetAdjustment() { return maxBudgetAdjustment; }
        public void setMaxBudgetAdjustment(int maxBudgetAdjustment) { this.maxBudgetAdjustment = maxBudgetAdjustment; }
    }
}
