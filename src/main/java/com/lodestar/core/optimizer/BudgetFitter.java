package com.lodestar.core.optimizer;

import com.lodestar.core.compression.CompressionEstimate;
import com.lodestar.core.compression.CompressionEstimator;
import com.lodestar.core.compression.CompressionStrategy;
import com.lodestar.core.model.CandidateFilter;
import com.lodestar.core.model.ContextConstraints;
import com.lodestar.core.model.ProjectSnapshot;
import com.lodestar.core.model.SelectedContext;
import com.lodestar.core.model.SelectionStrategy;
import com.lodestar.core.model.Task;
import com.lodestar.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Selects under a lean policy for a tight token budget, tightening step by step while the
 * selection stays over it.
 * <p>
 * The first pass leaves out files scoring under {@value #INITIAL_MIN_SCORE}, and tests and
 * documentation unless the task is about them, and follows dependencies two levels deep.
 * Only must-include files can push a selection over its budget, so the later steps run when
 * they do: raise the score floor to {@value #TIGHT_MIN_SCORE}, then follow one dependency
 * level, then estimate how much compression the selection needs.
 */
public class BudgetFitter {

    private static final Logger log = LoggerFactory.getLogger(BudgetFitter.class);

    static final double INITIAL_MIN_SCORE = 0.1;
    static final double TIGHT_MIN_SCORE = 0.3;
    static final int MAX_FILES = 100;

    private final ContextSelector selector;
    private final CompressionEstimator compressionEstimator;

    public BudgetFitter(ContextSelector selector, CompressionEstimator compressionEstimator) {
        this.selector = selector;
        this.compressionEstimator = compressionEstimator;
    }

    public BudgetFit fit(ProjectSnapshot snapshot, Task task, int tokenBudget, SelectionStrategy strategy) {
        if (tokenBudget <= 0) {
            throw new IllegalArgumentException("tokenBudget must be positive, got " + tokenBudget);
        }
        var filter = new CandidateFilter(INITIAL_MIN_SCORE, task.type() == TaskType.TEST,
                task.type() == TaskType.DOCUMENTATION, List.of(), null);
        var constraints = new ContextConstraints(tokenBudget, MAX_FILES, strategy, Map.of(), false, filter, 2);
        var reasons = new ArrayList<String>();

        SelectedContext selection = selector.select(snapshot, task, constraints);
        if (selection.totalTokens() > tokenBudget) {
            constraints = constraints.withFilter(filter.withMinRelevanceScore(TIGHT_MIN_SCORE));
            reasons.add(String.format(Locale.ROOT, "Selection of %d tokens exceeds a budget of %d; minimum relevance raised to %.2f",
                    selection.totalTokens(), tokenBudget, TIGHT_MIN_SCORE));
            selection = selector.select(snapshot, task, constraints);
        }
        if (selection.totalTokens() > tokenBudget) {
            constraints = constraints.withDependencyDepth(1);
            reasons.add("Still " + selection.totalTokens() + " tokens; dependency depth reduced to 1");
            selection = selector.select(snapshot, task, constraints);
        }

        CompressionEstimate compression = null;
        if (selection.totalTokens() > tokenBudget) {
            SelectedContext overBudget = selection;
            compression = compressionEstimator.gentlestFitting(overBudget, tokenBudget)
                    .orElseGet(() -> compressionEstimator.estimate(overBudget, CompressionStrategy.SUMMARY));
            reasons.add(String.format(Locale.ROOT,
                    "Still %d tokens over a budget of %d; %s compression would bring it to about %d tokens",
                    selection.totalTokens() - tokenBudget, tokenBudget, compression.strategy().label(),
                    compression.estimatedTokens()));
        }
        log.info("Fitted {} task to {} tokens: {} files, {} tokens{}",
                task.type().name().toLowerCase(Locale.ROOT), tokenBudget, selection.totalFiles(),
                selection.totalTokens(), compression != null ? ", compression " + compression.strategy().label() : "");
        return new BudgetFit(selection.withAdditionalReasons(reasons), tokenBudget, compression);
    }
}
