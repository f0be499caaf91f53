package com.lodestar.dispatch.cli;

import com.lodestar.core.model.ProjectSnapshot;
import com.lodestar.core.model.StructuralSummary;
import com.lodestar.snapshot.ProjectSnapshotProvider;
import com.lodestar.snapshot.SnapshotException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;

/**
 * CLI command: lodestar inspect &lt;manifest&gt;
 * <p>
 * Shows the structural summary of a project: languages, entry points, core files,
 * complexity metrics and recommendations.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a project manifest")
@Component
public class InspectCommand implements Runnable {

    @Parameters(index = "0", description = "Path to the project manifest (JSON)")
    private String manifest;

    private final ProjectSnapshotProvider snapshotProvider;

    public InspectCommand(ProjectSnapshotProvider snapshotProvider) {
        this.snapshotProvider = snapshotProvider;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        ProjectSnapshot snapshot;
        try {
            snapshot = snapshotProvider.snapshot(manifest);
        } catch (SnapshotException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        StructuralSummary summary = snapshot.summary();

        System.out.println();
        System.out.println("PROJECT " + snapshot.rootId());
        System.out.println(ConsoleOutput.RULE);
        System.out.println("  Files:        " + snapshot.fileCount());
        System.out.println("  Tokens:       " + snapshot.totalTokens());
        System.out.println("  Edges:        " + snapshot.graph().edges().size());
        System.out.println("  Languages:    " + formatLanguages(snapshot));

        printList("ENTRY POINTS", summary.entryPoints());
        printList("CORE FILES", summary.coreFiles());
        printList("TEST FILES", summary.testFiles());
        printList("CONFIG FILES", summary.configFiles());

        System.out.println();
        System.out.println("  METRICS:");
        summary.complexityMetrics().forEach((name, value) ->
                System.out.println(String.format(Locale.ROOT, "    %-22s %.2f", name, value)));

        if (!summary.recommendations().isEmpty()) {
            System.out.println();
            System.out.println("  RECOMMENDATIONS:");
            summary.recommendations().forEach(ConsoleOutput::reason);
        }
    }

    private static String formatLanguages(ProjectSnapshot snapshot) {
        if (snapshot.languageCounts().isEmpty()) {
            return "none";
        }
        var parts = new StringBuilder();
        snapshot.languageCounts().forEach((language, count) -> {
            if (parts.length() > 0) {
                parts.append(", ");
            }
            parts.append(language).append(" (").append(count).append(")");
        });
        return parts.toString();
    }

    private static void printList(String title, List<String> paths) {
        if (paths.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.println("  " + title + ":");
        paths.forEach(path -> System.out.println("    " + path));
    }
}
