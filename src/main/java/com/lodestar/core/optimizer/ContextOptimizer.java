package com.lodestar.core.optimizer;

import com.lodestar.core.graph.DependencyGraph;
import com.lodestar.core.model.CandidateFilter;
import com.lodestar.core.model.ContextConstraints;
import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.ProjectSnapshot;
import com.lodestar.core.model.ScoredFile;
import com.lodestar.core.model.SelectedContext;
import com.lodestar.core.model.SelectionStrategy;
import com.lodestar.core.model.Task;
import com.lodestar.core.scoring.RelevanceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Packs the most useful files of a snapshot into a token and file budget.
 * <p>
 * Files are scored, ordered by the requested {@link SelectionStrategy}, and added greedily.
 * A file that would exceed the token budget is skipped, never truncated. Must-include files
 * are pinned first in the order the task lists them and may push the total over budget.
 * The constraints' {@link CandidateFilter} decides which other files may be packed at all.
 * Every adjustment is reported as an adaptation reason on the result.
 */
public class ContextOptimizer implements ContextSelector {

    private static final Logger log = LoggerFactory.getLogger(ContextOptimizer.class);

    static final String REASON_MUST_INCLUDE = "must_include";
    static final String REASON_DEPENDENCY_EXPANSION = "dependency_expansion";

    /** Candidates with equal strategy scores: shorter path first, then lexical order. */
    private static final Comparator<Candidate> CANDIDATE_ORDER =
            Comparator.comparingDouble(Candidate::strategyScore).reversed()
                    .thenComparingInt((Candidate c) -> c.path().length())
                    .thenComparing(Candidate::path);

    private final RelevanceScorer scorer;
    private final OptimizerSettings settings;
    private final Clock clock;

    public ContextOptimizer(RelevanceScorer scorer) {
        this(scorer, OptimizerSettings.defaults(), Clock.systemUTC());
    }

    public ContextOptimizer(RelevanceScorer scorer, OptimizerSettings settings, Clock clock) {
        this.scorer = scorer;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public SelectedContext select(ProjectSnapshot snapshot, Task task, ContextConstraints constraints) {
        ContextConstraints effective = constraints.resolveFor(task.type());
        SelectionStrategy strategy = effective.strategy();
        var reasons = new ArrayList<String>();
        if (constraints.overrides().containsKey(task.type())) {
            reasons.add(String.format("Applied %s task override: max %d tokens, max %d files, %s strategy",
                    task.type().name().toLowerCase(Locale.ROOT), effective.maxTokens(), effective.maxFiles(), strategy.label()));
        }

        List<ScoredFile> scored = scorer.scoreAll(snapshot.files(), task, snapshot.graph());
        for (ScoredFile sf : scored) {
            sf.failureReason().ifPresent(failure ->
                    reasons.add("Scoring failed for " + sf.path() + ", treated as zero relevance: " + failure));
        }

        List<Candidate> candidates = order(scored, strategy, snapshot.graph());
        var packer = new Packer(effective, reasons);

        pinMustIncludes(task, candidates, packer);

        Set<String> rejected = applyFilter(effective.filter(), candidates, packer, reasons);
        int depth = effective.dependencyDepth() != null ? effective.dependencyDepth() : settings.dependencyDepth();

        for (Candidate candidate : candidates) {
            if (packer.full()) {
                break;
            }
            if (packer.contains(candidate.path()) || rejected.contains(candidate.path())) {
                continue;
            }
            if (!packer.fits(candidate.file())) {
                log.debug("Skipping {} ({} tokens): over budget", candidate.path(), candidate.file().tokenCount());
                continue;
            }
            packer.add(candidate.scored(), inclusionReason(strategy));
            if (strategy == SelectionStrategy.DEPENDENCY) {
                expandDependencies(candidate, snapshot.graph(), scored, packer, depth, rejected);
            }
        }

        if (packer.selected.isEmpty()) {
            int smallest = candidates.stream()
                    .filter(c -> !rejected.contains(c.path()))
                    .mapToInt(c -> c.file().tokenCount())
                    .min().orElse(-1);
            if (effective.failWhenEmpty()) {
                throw new BudgetInfeasibleException(effective.maxTokens(), smallest);
            }
            if (smallest >= 0) {
                reasons.add("No file fits within " + effective.maxTokens() + " tokens (smallest file: "
                        + smallest + " tokens)");
            }
            log.info("Empty selection for {} task: {} files, budget {} tokens",
                    task.type(), snapshot.fileCount(), effective.maxTokens());
            return SelectedContext.empty(strategy, reasons);
        }

        SelectedContext result = packer.build(strategy);
        log.info("Selected {} of {} files ({} / {} tokens) with {} strategy",
                result.totalFiles(), snapshot.fileCount(), result.totalTokens(), effective.maxTokens(), strategy.label());
        return result;
    }

    private void pinMustIncludes(Task task, List<Candidate> candidates, Packer packer) {
        for (String wanted : task.mustInclude()) {
            Optional<Candidate> match = findMustInclude(wanted, candidates);
            if (match.isEmpty()) {
                packer.reasons.add("Must-include file " + wanted + " is not in the snapshot");
                continue;
            }
            Candidate candidate = match.get();
            if (packer.contains(candidate.path())) {
                continue;
            }
            if (packer.full()) {
                packer.reasons.add("Must-include file " + candidate.path() + " dropped: max files ("
                        + packer.constraints.maxFiles() + ") reached");
                continue;
            }
            boolean fits = packer.fits(candidate.file());
            packer.add(candidate.scored(), REASON_MUST_INCLUDE);
            if (!fits) {
                packer.reasons.add("Must-include file " + candidate.path() + " pushes the total to "
                        + packer.tokens + " tokens, over the budget of " + packer.constraints.maxTokens());
            }
        }
    }

    private static Optional<Candidate> findMustInclude(String wanted, List<Candidate> candidates) {
        var byPath = new LinkedHashMap<String, Candidate>();
        for (Candidate candidate : candidates) {
            byPath.put(candidate.path(), candidate);
        }
        return Task.resolve(wanted, byPath.keySet()).map(byPath::get);
    }

    /**
     * Paths the filter leaves out. Pinned must-includes are never among them.
     */
    private static Set<String> applyFilter(CandidateFilter filter, List<Candidate> candidates, Packer packer,
                                           List<String> reasons) {
        if (filter.admitsAll()) {
            return Set.of();
        }
        var rejected = new LinkedHashSet<String>();
        for (Candidate candidate : candidates) {
            if (packer.contains(candidate.path())) {
                continue;
            }
            Optional<String> why = filter.rejection(candidate.scored());
            if (why.isPresent()) {
                log.debug("Filtered out {}: {}", candidate.path(), why.get());
                rejected.add(candidate.path());
            }
        }
        if (!rejected.isEmpty()) {
            reasons.add("Candidate filter left out " + rejected.size() + " of " + candidates.size() + " files");
        }
        return rejected;
    }

    /**
     * Breadth-first over direct dependencies of {@code root}, up to {@code maxDepth} levels.
     * Filtered files are walked through but never added.
     */
    private void expandDependencies(Candidate root, DependencyGraph graph, List<ScoredFile> scored, Packer packer,
                                    int maxDepth, Set<String> rejected) {
        if (maxDepth == 0) {
            return;
        }
        Map<String, ScoredFile> byPath = new LinkedHashMap<>();
        for (ScoredFile sf : scored) {
            byPath.put(sf.path(), sf);
        }
        var queue = new ArrayDeque<String>();
        var depths = new LinkedHashMap<String, Integer>();
        queue.add(root.path());
        depths.put(root.path(), 0);
        while (!queue.isEmpty() && !packer.full()) {
            String current = queue.poll();
            int depth = depths.get(current);
            if (depth >= maxDepth) {
                continue;
            }
            for (String dependency : graph.dependenciesOf(current)) {
                if (depths.containsKey(dependency)) {
                    continue;
                }
                depths.put(dependency, depth + 1);
                queue.add(dependency);
                ScoredFile dep = byPath.get(dependency);
                if (dep == null || packer.contains(dependency) || rejected.contains(dependency) || packer.full()) {
                    continue;
                }
                if (!packer.fits(dep.file())) {
                    log.debug("Dependency {} of {} does not fit the remaining budget", dependency, current);
                    continue;
                }
                packer.add(dep, REASON_DEPENDENCY_EXPANSION);
                packer.reasons.add("Pulled in " + dependency + " as a dependency of " + current
                        + (depth + 1 > 1 ? " (depth " + (depth + 1) + ")" : ""));
            }
        }
    }

    List<Candidate> order(List<ScoredFile> scored, SelectionStrategy strategy, DependencyGraph graph) {
        Instant now = clock.instant();
        double maxCompactness = scored.stream().mapToDouble(ContextOptimizer::compactness).max().orElse(0.0);
        var candidates = new ArrayList<Candidate>(scored.size());
        for (ScoredFile sf : scored) {
            double value = switch (strategy) {
                case RELEVANCE -> sf.score();
                case DEPENDENCY -> 0.7 * sf.score() + 0.3 * graph.centrality(sf.path());
                case FRESHNESS -> (1 - settings.freshnessBias()) * sf.score()
                        + settings.freshnessBias() * freshness(sf, now);
                case COMPACTNESS -> compactness(sf);
                case BALANCED -> 0.5 * sf.score()
                        + 0.5 * (maxCompactness > 0 ? compactness(sf) / maxCompactness : 0.0);
            };
            candidates.add(new Candidate(sf, value));
        }
        candidates.sort(CANDIDATE_ORDER);
        return candidates;
    }

    private double freshness(ScoredFile sf, Instant now) {
        Duration age = Duration.between(sf.file().lastModified(), now);
        if (age.compareTo(settings.freshWindow()) <= 0) {
            return 1.0;
        }
        return sf.factors().recency();
    }

    private static double compactness(ScoredFile sf) {
        return sf.score() / Math.max(sf.file().tokenCount(), 1);
    }

    private static String inclusionReason(SelectionStrategy strategy) {
        return switch (strategy) {
            case RELEVANCE -> "relevance_score";
            case DEPENDENCY -> "dependency_centrality";
            case FRESHNESS -> "freshness_bias";
            case COMPACTNESS -> "information_density";
            case BALANCED -> "balanced_strategy";
        };
    }

    record Candidate(ScoredFile scored, double strategyScore) {
        String path() {
            return scored.path();
        }

        FileRecord file() {
            return scored.file();
        }
    }

    /** Running totals of one selection. */
    private static final class Packer {

        private final ContextConstraints constraints;
        private final List<String> reasons;
        private final List<ScoredFile> selected = new ArrayList<>();
        private final Map<String, String> inclusion = new LinkedHashMap<>();
        private int tokens;

        Packer(ContextConstraints constraints, List<String> reasons) {
            this.constraints = constraints;
            this.reasons = reasons;
        }

        boolean full() {
            return selected.size() >= constraints.maxFiles();
        }

        boolean contains(String path) {
            return inclusion.containsKey(path);
        }

        boolean fits(FileRecord file) {
            return (long) tokens + file.tokenCount() <= constraints.maxTokens();
        }

        void add(ScoredFile file, String reason) {
            selected.add(file);
            inclusion.put(file.path(), reason);
            tokens += file.file().tokenCount();
        }

        SelectedContext build(SelectionStrategy strategy) {
            double meanScore = selected.stream().mapToDouble(ScoredFile::score).average().orElse(0.0);
            return new SelectedContext(
                    selected.stream().map(ScoredFile::file).toList(),
                    tokens,
                    selected.size(),
                    strategy,
                    reasons,
                    inclusion,
                    meanScore);
        }
    }
}
