package com.lodestar.dispatch.cli;

import com.lodestar.core.model.ProjectSnapshot;
import com.lodestar.core.model.ScoredFile;
import com.lodestar.core.model.Task;
import com.lodestar.core.model.TaskType;
import com.lodestar.core.scoring.RelevanceScorer;
import com.lodestar.snapshot.ProjectSnapshotProvider;
import com.lodestar.snapshot.SnapshotException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CLI command: lodestar score &lt;manifest&gt; -d "&lt;task&gt;"
 * <p>
 * Prints every file's relevance score with its per-factor breakdown, best first.
 */
@Command(name = "score", mixinStandardHelpOptions = true, description = "Show relevance scores for a task")
@Component
public class ScoreCommand implements Runnable {

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

    @Option(names = {"--top", "-n"}, description = "Only show the N best files (0 = all)", defaultValue = "0")
    private int top;

    @Option(names = "--json", description = "Print the scores as JSON")
    private boolean json;

    private final ProjectSnapshotProvider snapshotProvider;
    private final RelevanceScorer scorer;

    public ScoreCommand(ProjectSnapshotProvider snapshotProvider, RelevanceScorer scorer) {
        this.snapshotProvider = snapshotProvider;
        this.scorer = scorer;
    }

    @Override
    public void run() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        Task task;
        try {
            task = new Task(TaskType.fromString(type), description, keywords, List.of());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid task type: " + type);
            return;
        }

        ProjectSnapshot snapshot;
        try {
            snapshot = snapshotProvider.snapshot(manifest);
        } catch (SnapshotException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        List<ScoredFile> scored = scorer.scoreAll(snapshot.files(), task, snapshot.graph());
        if (top > 0 && scored.size() > top) {
            scored = scored.subList(0, top);
        }

        if (json) {
            ConsoleOutput.json(scored);
            return;
        }
        ConsoleOutput.info("Scoring " + snapshot.fileCount() + " files for " + task.type().name().toLowerCase(Locale.ROOT)
                + " task");
        System.out.println(ConsoleOutput.RULE);
        System.out.println("  SCORE  KW   PATH TYPE REC  SIZE DEP  TASK LANG  FILE");
        for (ScoredFile file : scored) {
            ConsoleOutput.scoreRow(file);
        }
    }
}
