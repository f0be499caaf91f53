package com.lodestar.dispatch.cli;

import com.lodestar.core.adaptive.AdaptiveContextManager;
import com.lodestar.core.compression.CompressionEstimate;
import com.lodestar.core.compression.CompressionEstimator;
import com.lodestar.core.compression.CompressionStrategy;
import com.lodestar.core.config.ConfigurationException;
import com.lodestar.core.engine.ContextEngine;
import com.lodestar.core.model.CandidateFilter;
import com.lodestar.core.model.ContextConstraints;
import com.lodestar.core.model.FileKind;
import com.lodestar.core.model.ProjectSnapshot;
import com.lodestar.core.model.SelectedContext;
import com.lodestar.core.model.SelectionStrategy;
import com.lodestar.core.model.Task;
import com.lodestar.core.model.TaskType;
import com.lodestar.core.optimizer.BudgetFit;
import com.lodestar.core.optimizer.BudgetFitter;
import com.lodestar.core.optimizer.BudgetInfeasibleException;
import com.lodestar.snapshot.ProjectSnapshotProvider;
import com.lodestar.snapshot.SnapshotException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * CLI command: lodestar select &lt;manifest&gt; -d "&lt;task&gt;"
 * <p>
 * Loads a project manifest and prints the files chosen for the task, with the reason
 * each file was included and every adjustment made on the way. With {@code --fit} or
 * {@code --compression} it also prints how far compression would shrink the selection.
 */
@Command(name = "select", mixinStandardHelpOptions = true, description = "Select context files for a task")
@Component
public class SelectCommand implements Runnable {

    @Parameters(index = "0", description = "Path to the project manifest (JSON)")
    private String manifest;

    @Option(names = {"--type", "-t"},
            description = "Task type: general, debug, refactor, feature, test, documentation",
            defaultValue = "general")
    private String type;

    @Option(names = {"--description", "-d"}, description = "Task description", defaultValue = "")
    private String description;

    @Option(names = {"--keyword", "-k"}, description = "Explicit keyword (repeatable)")
    private List<String> keywords = new ArrayList<>();

    @Option(names = {"--must-include", "-i"}, description = "Path that must be selected (repeatable)")
    private List<String> mustInclude = new ArrayList<>();

    @Option(names = "--max-tokens", description = "Token budget (default from configuration)")
    private Integer maxTokens;

    @Option(names = "--max-files", description = "Maximum number of files (default from configuration)")
    private Integer maxFiles;

    @Option(names = {"--strategy", "-s"},
            description = "relevance, dependency, freshness, compactness, balanced")
    private String strategy;

    @Option(names = "--min-score", description = "Leave out files scoring below this relevance, 0 to 1")
    private Double minScore;

    @Option(names = {"--exclude", "-x"}, description = "Leave out paths containing this text (repeatable)")
    private List<String> excluded = new ArrayList<>();

    @Option(names = "--no-tests", description = "Leave out test files")
    private boolean noTests;

    @Option(names = "--no-docs", description = "Leave out documentation")
    private boolean noDocs;

    @Option(names = "--prefer-kind", description = "Only pack files of this kind: source, test, config, doc (repeatable)")
    private List<String> preferredKinds = new ArrayList<>();

    @Option(names = "--depth", description = "Import levels the dependency strategy follows")
    private Integer depth;

    @Option(names = "--adaptive", description = "Let the adaptive manager pick strategy and retries")
    private boolean adaptive;

    @Option(names = "--fit", description = "Tighten a lean selection step by step until it fits the token budget")
    private boolean fit;

    @Option(names = {"--compression", "-c"},
            description = "Estimate the selection compressed: none, summary, snippet, minify, semantic")
    private String compression;

    @Option(names = "--fail-when-empty", description = "Fail instead of returning an empty selection")
    private boolean failWhenEmpty;

    @Option(names = "--json", description = "Print the selection as JSON")
    private boolean json;

    private final ProjectSnapshotProvider snapshotProvider;
    private final ContextEngine contextEngine;
    private final AdaptiveContextManager adaptiveManager;
    private final BudgetFitter budgetFitter;
    private final CompressionEstimator compressionEstimator;
    private final ContextConstraints defaultConstraints;

    public SelectCommand(ProjectSnapshotProvider snapshotProvider, ContextEngine contextEngine,
                         AdaptiveContextManager adaptiveManager, BudgetFitter budgetFitter,
                         CompressionEstimator compressionEstimator, ContextConstraints defaultConstraints) {
        this.snapshotProvider = snapshotProvider;
        this.contextEngine = contextEngine;
        this.adaptiveManager = adaptiveManager;
        this.budgetFitter = budgetFitter;
        this.compressionEstimator = compressionEstimator;
        this.defaultConstraints = defaultConstraints;
    }

    @Override
    public void run() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        Task task;
        ContextConstraints constraints;
        CompressionStrategy compressionStrategy;
        try {
            if (adaptive && fit) {
                throw new IllegalArgumentException("--adaptive and --fit cannot be combined");
            }
            task = new Task(TaskType.fromString(type), description, keywords, mustInclude);
            constraints = buildConstraints();
            compressionStrategy = compression != null ? CompressionStrategy.fromString(compression) : null;
        } catch (IllegalArgumentException | ConfigurationException e) {
            ConsoleOutput.error("Invalid arguments: " + e.getMessage());
            return;
        }

        ProjectSnapshot snapshot;
        try {
            snapshot = snapshotProvider.snapshot(manifest);
        } catch (SnapshotException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        SelectedContext context;
        CompressionEstimate estimate = null;
        try {
            if (fit) {
                BudgetFit result = budgetFitter.fit(snapshot, task, constraints.maxTokens(), constraints.strategy());
                context = result.selection();
                estimate = result.compression();
            } else if (adaptive) {
                context = adaptiveManager.adapt(snapshot, task, constraints.maxTokens());
            } else {
                context = contextEngine.select(snapshot, task, constraints);
            }
        } catch (BudgetInfeasibleException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        if (compressionStrategy != null) {
            estimate = compressionEstimator.estimate(context, compressionStrategy);
        }

        if (json) {
            if (estimate == null) {
                ConsoleOutput.json(context);
            } else {
                var body = new LinkedHashMap<String, Object>();
                body.put("selection", context);
                body.put("compression", estimate);
                ConsoleOutput.json(body);
            }
            return;
        }
        ConsoleOutput.info(String.format("Project: %s (%d files, %d tokens)",
                snapshot.rootId(), snapshot.fileCount(), snapshot.totalTokens()));
        ConsoleOutput.selection(context);
        if (estimate != null) {
            ConsoleOutput.compression(estimate, constraints.maxTokens());
        }
    }

    private ContextConstraints buildConstraints() {
        return new ContextConstraints(
                maxTokens != null ? maxTokens : defaultConstraints.maxTokens(),
                maxFiles != null ? maxFiles : defaultConstraints.maxFiles(),
                strategy != null ? SelectionStrategy.fromString(strategy) : defaultConstraints.strategy(),
                defaultConstraints.overrides(),
                failWhenEmpty || defaultConstraints.failWhenEmpty(),
                buildFilter(),
                depth != null ? depth : defaultConstraints.dependencyDepth());
    }

    /**
     * Command-line filter options narrow the configured filter; excluded patterns add up.
     */
    private CandidateFilter buildFilter() {
        CandidateFilter base = defaultConstraints.filter();
        var patterns = new ArrayList<>(base.excludedPatterns());
        patterns.addAll(excluded);
        Set<FileKind> kinds = base.preferredKinds();
        if (!preferredKinds.isEmpty()) {
            var parsed = EnumSet.noneOf(FileKind.class);
            preferredKinds.forEach(kind -> parsed.add(FileKind.parse(kind)));
            kinds = parsed;
        }
        return new CandidateFilter(
                minScore != null ? minScore : base.minRelevanceScore(),
                base.includeTests() && !noTests,
                base.includeDocs() && !noDocs,
                patterns,
                kinds);
    }
}
