package com.lodestar.core.adaptive;

import com.lodestar.core.metrics.ContextMetrics;
import com.lodestar.core.model.ContextConstraints;
import com.lodestar.core.model.ProjectSnapshot;
import com.lodestar.core.model.SelectedContext;
import com.lodestar.core.model.SelectionStrategy;
import com.lodestar.core.model.Task;
import com.lodestar.core.model.TaskType;
import com.lodestar.core.optimizer.ContextSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wraps a {@link ContextSelector} and re-selects when the first result looks wrong.
 * <p>
 * The first attempt uses the task type's learned or default strategy at the soft token target.
 * A retry follows when earlier outcomes for the task type averaged below the quality threshold
 * or lacked more than {@value #MISS_RATE_THRESHOLD} of the files their tasks needed (budget
 * loosened once), when nothing fit (budget loosened), or when the selection used less than
 * {@link AdaptiveSettings#underuseRatio()} of the target (next fallback strategy). Attempts are
 * bounded by {@link AdaptiveSettings#maxAttempts()}; the attempt with the most tokens is returned,
 * carrying a reason for every adjustment.
 * <p>
 * Profiles live in memory only and are lost on restart.
 */
public class AdaptiveContextManager {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveContextManager.class);

    /** Above this average share of missing files, earlier selections count as too tight. */
    static final double MISS_RATE_THRESHOLD = 0.25;

    private static final List<SelectionStrategy> FALLBACK_CHAIN =
            List.of(SelectionStrategy.COMPACTNESS, SelectionStrategy.BALANCED);

    private static final Map<TaskType, SelectionStrategy> DEFAULT_STRATEGIES = new EnumMap<>(TaskType.class);

    static {
        DEFAULT_STRATEGIES.put(TaskType.FEATURE, SelectionStrategy.RELEVANCE);
        DEFAULT_STRATEGIES.put(TaskType.TEST, SelectionStrategy.RELEVANCE);
        DEFAULT_STRATEGIES.put(TaskType.DOCUMENTATION, SelectionStrategy.RELEVANCE);
        DEFAULT_STRATEGIES.put(TaskType.DEBUG, SelectionStrategy.DEPENDENCY);
        DEFAULT_STRATEGIES.put(TaskType.REFACTOR, SelectionStrategy.DEPENDENCY);
        DEFAULT_STRATEGIES.put(TaskType.GENERAL, SelectionStrategy.BALANCED);
    }

    private final ContextSelector selector;
    private final AdaptiveSettings settings;
    private final Clock clock;
    private final ContextMetrics metrics;
    private final Map<TaskType, TaskProfile> profiles = new ConcurrentHashMap<>();

    public AdaptiveContextManager(ContextSelector selector, AdaptiveSettings settings) {
        this(selector, settings, Clock.systemUTC(), null);
    }

    /**
     * @param metrics optional, may be null
     */
    public AdaptiveContextManager(ContextSelector selector, AdaptiveSettings settings, Clock clock,
                                  ContextMetrics metrics) {
        this.selector = selector;
        this.settings = settings;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * @throws IllegalArgumentException if {@code softTokenTarget} is not positive
     */
    public SelectedContext adapt(ProjectSnapshot snapshot, Task task, int softTokenTarget) {
        if (softTokenTarget <= 0) {
            throw new IllegalArgumentException("softTokenTarget must be positive, got " + softTokenTarget);
        }
        TaskProfile profile = profile(task.type());
        boolean trained = profile.isTrained(settings.minSamples());
        var reasons = new ArrayList<String>();

        SelectionStrategy strategy = initialStrategy(task.type(), profile, reasons);
        int maxFiles = maxFiles(profile, reasons);
        int budget = softTokenTarget;
        int budgetCap = Math.max(softTokenTarget, (int) (softTokenTarget * settings.maxBudgetMultiplier()));
        boolean lowQuality = trained && profile.avgQuality() < settings.qualityThreshold();
        boolean missingFiles = trained && profile.missRate() > MISS_RATE_THRESHOLD;
        boolean qualityRetryDone = false;
        Set<SelectionStrategy> tried = EnumSet.of(strategy);

        var attempts = new ArrayList<SelectedContext>();
        attempts.add(selector.select(snapshot, task, ContextConstraints.of(budget, maxFiles, strategy)));

        while (attempts.size() < settings.maxAttempts()) {
            SelectedContext last = attempts.get(attempts.size() - 1);
            if ((lowQuality || missingFiles) && !qualityRetryDone) {
                qualityRetryDone = true;
                int loosened = loosen(budget, softTokenTarget, budgetCap);
                if (loosened == budget) {
                    continue;
                }
                if (lowQuality) {
                    reasons.add(String.format(Locale.ROOT,
                            "Budget loosened from %d to %d tokens: prior %s outcomes averaged %.2f quality",
                            budget, loosened, label(task.type()), profile.avgQuality()));
                    recordRetry("quality");
                } else {
                    reasons.add(String.format(Locale.ROOT,
                            "Budget loosened from %d to %d tokens: prior %s selections lacked %.0f%% of the files their tasks used",
                            budget, loosened, label(task.type()), profile.missRate() * 100));
                    recordRetry("missing_files");
                }
                budget = loosened;
            } else if (last.isEmpty()) {
                int loosened = loosen(budget, softTokenTarget, budgetCap);
                if (loosened == budget) {
                    break;
                }
                reasons.add("Nothing fit within " + budget + " tokens; budget loosened to " + loosened);
                budget = loosened;
                recordRetry("empty");
            } else if (last.totalTokens() < settings.underuseRatio() * softTokenTarget) {
                SelectionStrategy next = nextFallback(tried);
                if (next == null) {
                    break;
                }
                reasons.add(String.format(Locale.ROOT,
                        "Only %d of %d target tokens used with %s strategy; retrying with %s",
                        last.totalTokens(), softTokenTarget, strategy.label(), next.label()));
                strategy = next;
                tried.add(next);
                recordRetry("underuse");
            } else {
                break;
            }
            attempts.add(selector.select(snapshot, task, ContextConstraints.of(budget, maxFiles, strategy)));
        }

        int bestIndex = 0;
        for (int i = 1; i < attempts.size(); i++) {
            if (attempts.get(i).totalTokens() > attempts.get(bestIndex).totalTokens()) {
                bestIndex = i;
            }
        }
        SelectedContext best = attempts.get(bestIndex);
        if (attempts.size() > 1) {
            reasons.add(String.format(Locale.ROOT, "Kept attempt %d of %d (%s strategy, %d tokens)",
                    bestIndex + 1, attempts.size(), best.strategy().label(), best.totalTokens()));
        }
        log.info("Adaptive selection for {} task: {} attempt(s), returning {} files / {} tokens",
                label(task.type()), attempts.size(), best.totalFiles(), best.totalTokens());
        return best.withAdditionalReasons(reasons);
    }

    /**
     * Folds feedback about a finished task into its task type's profile.
     */
    public TaskProfile recordOutcome(SelectionOutcome outcome) {
        TaskProfile updated = profiles.compute(outcome.taskType(), (type, current) ->
                (current != null ? current : TaskProfile.empty(type))
                        .update(outcome, settings.learningRate(), settings.qualityThreshold(), clock.instant()));
        log.debug("Recorded {} outcome: success={}, quality={}, samples={}",
                label(outcome.taskType()), outcome.success(), outcome.qualityScore(), updated.sampleCount());
        return updated;
    }

    /**
     * Infers an outcome from what the agent reported and folds it into the task type's profile.
     */
    public TaskProfile recordExecution(TaskType taskType, SelectedContext selection, ExecutionReport report) {
        SelectionOutcome outcome = SelectionOutcome.fromExecution(taskType, selection, report);
        if (!outcome.missingFiles().isEmpty()) {
            log.debug("{} task used {} file(s) outside its selection: {}",
                    label(taskType), outcome.missingFiles().size(), outcome.missingFiles());
        }
        return recordOutcome(outcome);
    }

    /**
     * Suggests a token budget from the project's size, blended with the learned optimal budget
     * once the task type has enough samples.
     */
    public int predictBudget(Task task, ProjectSnapshot snapshot) {
        int base = 8000;
        if (snapshot.totalTokens() > 200_000) {
            base = 12_000;
        } else if (snapshot.totalTokens() < 50_000) {
            base = 4000;
        }
        TaskProfile profile = profile(task.type());
        if (profile.isTrained(settings.minSamples()) && profile.optimalTokenBudget() > 0) {
            double weight = Math.min(1.0, profile.sampleCount() / 20.0);
            int blended = (int) (base * (1 - weight) + profile.optimalTokenBudget() * weight);
            int adjustment = Math.max(-settings.maxBudgetAdjustment(), Math.min(settings.maxBudgetAdjustment(), blended - base));
            base += adjustment;
        }
        return Math.max(1, base);
    }

    public TaskProfile profile(TaskType taskType) {
        return profiles.getOrDefault(taskType, TaskProfile.empty(taskType));
    }

    public Map<TaskType, TaskProfile> profiles() {
        return Map.copyOf(profiles);
    }

    static SelectionStrategy defaultStrategy(TaskType taskType) {
        return DEFAULT_STRATEGIES.getOrDefault(taskType, SelectionStrategy.BALANCED);
    }

    private SelectionStrategy initialStrategy(TaskType taskType, TaskProfile profile, List<String> reasons) {
        if (profile.isTrained(settings.minSamples())
                && profile.successRate() > settings.qualityThreshold()
                && profile.preferredStrategy() != null) {
            reasons.add(String.format(Locale.ROOT, "Strategy set to %s from %d prior outcomes (%.0f%% success)",
                    profile.preferredStrategy().label(), profile.sampleCount(), profile.successRate() * 100));
            return profile.preferredStrategy();
        }
        return defaultStrategy(taskType);
    }

    private int maxFiles(TaskProfile profile, List<String> reasons) {
        if (profile.isTrained(settings.minSamples()) && profile.typicalFileCount() > 0) {
            int learned = Math.max(10, Math.min(100, (int) (profile.typicalFileCount() * 1.2)));
            if (learned != settings.defaultMaxFiles()) {
                reasons.add("Max files set to " + learned + " from a typical selection of "
                        + profile.typicalFileCount() + " files");
            }
            return learned;
        }
        return settings.defaultMaxFiles();
    }

    private int loosen(int budget, int target, int cap) {
        int step = Math.max(1, (int) Math.round(target * settings.budgetLoosenFactor()));
        return Math.min(cap, budget + step);
    }

    private static SelectionStrategy nextFallback(Set<SelectionStrategy> tried) {
        for (SelectionStrategy candidate : FALLBACK_CHAIN) {
            if (!tried.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private void recordRetry(String reason) {
        if (metrics != null) {
            metrics.recordAdaptiveRetry(reason);
        }
    }

    private static String label(TaskType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }
}
