package com.lodestar.core.scoring;

import com.lodestar.core.graph.DependencyEdge;
import com.lodestar.core.graph.DependencyGraph;
import com.lodestar.core.metrics.ContextMetrics;
import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.PartialAnalysisException;
import com.lodestar.core.model.ScoredFile;
import com.lodestar.core.model.ScoringFactors;
import com.lodestar.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Weighted sum of eight normalised factors, clamped to [0,1].
 * <p>
 * With a dependency graph, scoring runs in two phases. Phase one scores every file with the
 * dependency weight left out and the remaining weights renormalised. The top
 * {@link ScoringConfig#centralityTopFraction()} of files become high scorers. Phase two sets
 * each file's dependency factor to half its degree centrality plus half its affinity, the
 * strength-weighted phase-one score of adjacent high scorers normalised by the largest
 * affinity in the snapshot, and computes the final score with all eight weights.
 * <p>
 * A file whose factors cannot be computed is logged, scored 0, and carries the failure note;
 * the other files are unaffected.
 * <p>
 * A must-include entry gives full keyword match only to the one file it resolves to among the
 * scored files ({@link Task#resolveMustInclude}); a file scored alone is judged by itself.
 */
public class WeightedRelevanceScorer implements RelevanceScorer {

    private static final Logger log = LoggerFactory.getLogger(WeightedRelevanceScorer.class);

    private static final double LN2 = Math.log(2);

    private final ScoringConfig config;
    private final KeywordExtractor keywordExtractor;
    private final Clock clock;
    private final ContextMetrics metrics;

    public WeightedRelevanceScorer(ScoringConfig config) {
        this(config, Clock.systemUTC(), null);
    }

    public WeightedRelevanceScorer(ScoringConfig config, Clock clock) {
        this(config, clock, null);
    }

    /**
     * @param metrics optional, may be null
     */
    public WeightedRelevanceScorer(ScoringConfig config, Clock clock, ContextMetrics metrics) {
        this.config = config;
        this.keywordExtractor = new KeywordExtractor(config.stopWords());
        this.clock = clock;
        this.metrics = metrics;
    }

    public ScoringConfig config() {
        return config;
    }

    @Override
    public double score(FileRecord file, Task task) {
        return scoreSafely(file, task, taskKeywords(task), named(List.of(file), task), clock.instant(), false).score();
    }

    @Override
    public ScoringFactors factors(FileRecord file, Task task) {
        return scoreSafely(file, task, taskKeywords(task), named(List.of(file), task), clock.instant(), false).factors();
    }

    @Override
    public List<ScoredFile> scoreAll(Collection<FileRecord> files, Task task) {
        List<String> keywords = taskKeywords(task);
        Set<String> named = named(files, task);
        Instant now = clock.instant();
        var scored = new ArrayList<ScoredFile>(files.size());
        for (FileRecord file : files) {
            scored.add(scoreSafely(file, task, keywords, named, now, false));
        }
        scored.sort(ScoredFile.BY_SCORE_THEN_PATH);
        return List.copyOf(scored);
    }

    @Override
    public List<ScoredFile> scoreAll(Collection<FileRecord> files, Task task, DependencyGraph graph) {
        if (graph == null) {
            return scoreAll(files, task);
        }
        List<String> keywords = taskKeywords(task);
        Set<String> named = named(files, task);
        Instant now = clock.instant();

        // Phase 1: everything but the dependency factor.
        var phaseOne = new ArrayList<ScoredFile>(files.size());
        for (FileRecord file : files) {
            phaseOne.add(scoreSafely(file, task, keywords, named, now, true));
        }
        phaseOne.sort(ScoredFile.BY_SCORE_THEN_PATH);

        Map<String, Double> highScorers = highScorers(phaseOne);
        Map<String, Double> affinity = affinity(phaseOne, graph, highScorers);

        // Phase 2: fold in centrality and affinity.
        var result = new ArrayList<ScoredFile>(phaseOne.size());
        for (ScoredFile first : phaseOne) {
            if (first.failure() != null) {
                result.add(first);
                continue;
            }
            double dependency = 0.5 * graph.centrality(first.path()) + 0.5 * affinity.getOrDefault(first.path(), 0.0);
            ScoringFactors factors = first.factors().withDependency(clamp(dependency));
            result.add(new ScoredFile(first.file(), weightedSum(factors, false), factors));
        }
        result.sort(ScoredFile.BY_SCORE_THEN_PATH);
        if (log.isDebugEnabled()) {
            log.debug("Scored {} files two-phase, {} high scorers", result.size(), highScorers.size());
        }
        return List.copyOf(result);
    }

    private static Set<String> named(Collection<FileRecord> files, Task task) {
        if (!task.hasMustInclude()) {
            return Set.of();
        }
        return task.resolveMustInclude(files.stream().map(FileRecord::path).toList());
    }

    private ScoredFile scoreSafely(FileRecord file, Task task, List<String> keywords, Set<String> named,
                                   Instant now, boolean withoutDependency) {
        try {
            ScoringFactors factors = computeFactors(file, task, keywords, named, now);
            return new ScoredFile(file, weightedSum(factors, withoutDependency), factors);
        } catch (PartialAnalysisException e) {
            log.warn("Scoring failed for {}, treating it as irrelevant: {}", file.path(), e.getMessage());
            if (metrics != null) {
                metrics.recordPartialFailure("scoring");
            }
            return ScoredFile.failed(file, e.getMessage());
        }
    }

    private Map<String, Double> highScorers(List<ScoredFile> ranked) {
        List<ScoredFile> eligible = ranked.stream().filter(sf -> sf.failure() == null).toList();
        if (eligible.isEmpty()) {
            return Map.of();
        }
        int count = Math.max(1, (int) Math.ceil(eligible.size() * config.centralityTopFraction()));
        var top = new HashMap<String, Double>();
        for (ScoredFile sf : eligible.subList(0, Math.min(count, eligible.size()))) {
            top.put(sf.path(), sf.score());
        }
        return top;
    }

    private static Map<String, Double> affinity(List<ScoredFile> files, DependencyGraph graph,
                                                Map<String, Double> highScorers) {
        var raw = new HashMap<String, Double>();
        double max = 0.0;
        for (ScoredFile sf : files) {
            String path = sf.path();
            double sum = 0.0;
            for (DependencyEdge edge : graph.edgesFrom(path)) {
                sum += adjacentContribution(path, edge.to(), edge.strength(), highScorers);
            }
            for (DependencyEdge edge : graph.edgesTo(path)) {
                sum += adjacentContribution(path, edge.from(), edge.strength(), highScorers);
            }
            raw.put(path, sum);
            max = Math.max(max, sum);
        }
        if (max <= 0.0) {
            return Map.of();
        }
        final double normaliser = max;
        raw.replaceAll((path, sum) -> sum / normaliser);
        return raw;
    }

    private static double adjacentContribution(String self, String other, double strength,
                                               Map<String, Double> highScorers) {
        if (other.equals(self)) {
            return 0.0;
        }
        Double score = highScorers.get(other);
        return score != null ? strength * score : 0.0;
    }

    private ScoringFactors computeFactors(FileRecord file, Task task, List<String> keywords, Set<String> named,
                                          Instant now) {
        return new ScoringFactors(
                keywordMatch(file, keywords, named),
                ScoringTables.pathRelevance(file.path(), task.type()),
                ScoringTables.fileType(task.type(), file.kind()),
                recency(file, now),
                size(file),
                0.0,
                ScoringTables.taskType(file.path(), task.type()),
                ScoringTables.language(file.language(), task.type()));
    }

    private double weightedSum(ScoringFactors f, boolean withoutDependency) {
        ScoringWeights w = config.weights();
        double sum = f.keywordMatch() * w.keywordMatch()
                + f.pathRelevance() * w.pathRelevance()
                + f.fileType() * w.fileType()
                + f.recency() * w.recency()
                + f.size() * w.size()
                + f.taskType() * w.taskType()
                + f.language() * w.language();
        if (withoutDependency) {
            double remaining = 1.0 - w.dependency();
            return remaining > 0 ? clamp(sum / remaining) : 0.0;
        }
        return clamp(sum + f.dependency() * w.dependency());
    }

    private List<String> taskKeywords(Task task) {
        if (!task.keywords().isEmpty()) {
            var lowered = new LinkedHashSet<String>();
            for (String keyword : task.keywords()) {
                String k = keyword.trim().toLowerCase(Locale.ROOT);
                if (!k.isEmpty()) {
                    lowered.add(k);
                }
            }
            return List.copyOf(lowered);
        }
        return keywordExtractor.extract(task.description());
    }

    double keywordMatch(FileRecord file, List<String> taskKeywords, Set<String> named) {
        if (named.contains(file.path())) {
            return 1.0;
        }
        List<String> tags = tags(file);
        Set<String> keywords = new LinkedHashSet<>(taskKeywords);
        if (keywords.isEmpty()) {
            return ScoringTables.NEUTRAL;
        }
        String path = file.path().toLowerCase(Locale.ROOT);
        String fileName = file.fileName().toLowerCase(Locale.ROOT);
        Set<String> tagSet = new HashSet<>(tags);
        int matches = 0;
        for (String keyword : keywords) {
            if (fileName.contains(keyword)) {
                matches += 2;
            }
            if (path.contains(keyword) || tagSet.contains(keyword)) {
                matches += 1;
            }
        }
        return Math.min(1.0, matches / (keywords.size() * 2.0));
    }

    private static List<String> tags(FileRecord file) {
        Object raw = file.metadata().get(FileRecord.METADATA_TAGS);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof Collection<?> values)) {
            throw new PartialAnalysisException(file.path(),
                    "tags metadata of " + file.path() + " is not a list: " + raw.getClass().getSimpleName());
        }
        var tags = new ArrayList<String>(values.size());
        for (Object value : values) {
            if (!(value instanceof String tag)) {
                throw new PartialAnalysisException(file.path(),
                        "tags metadata of " + file.path() + " contains a non-string entry: " + value);
            }
            tags.add(tag.toLowerCase(Locale.ROOT));
        }
        return tags;
    }

    double recency(FileRecord file, Instant now) {
        Duration age = Duration.between(file.lastModified(), now);
        if (age.isNegative()) {
            return 1.0;
        }
        double halfLifeMillis = config.recencyHalfLife().toMillis();
        return Math.exp(-LN2 * age.toMillis() / halfLifeMillis);
    }

    double size(FileRecord file) {
        double optimal = config.optimalTokens();
        double actual = file.tokenCount();
        if (actual <= optimal) {
            return actual / optimal;
        }
        double oversize = actual - optimal;
        return Math.max(config.minSizeScore(), 1.0 - (oversize / optimal) * config.sizePenalty());
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
