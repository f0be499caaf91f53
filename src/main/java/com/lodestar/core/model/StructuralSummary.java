package com.lodestar.core.model;

import com.lodestar.core.graph.DependencyGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derived overview of a snapshot's structure, used for diagnostics and the {@code inspect} command.
 *
 * @param entryPoints       source files that start the program (main files, {@code cmd/} packages)
 * @param testFiles         files classified as tests
 * @param configFiles       files classified as configuration
 * @param coreFiles         the most depended-upon files, most central first
 * @param complexityMetrics named numeric metrics (file and token totals, averages, edge density)
 * @param recommendations   human-readable hints about the project
 */
public record StructuralSummary(
    List<String> entryPoints,
    List<String> testFiles,
    List<String> configFiles,
    List<String> coreFiles,
    Map<String, Double> complexityMetrics,
    List<String> recommendations
) {

    /** Above this many tokens the project is reported as large. */
    public static final int LARGE_CODEBASE_TOKENS = 100_000;

    static final int MAX_CORE_FILES = 10;

    private static final Set<String> ENTRY_POINT_STEMS = Set.of("main", "index", "app", "server", "__main__");

    public StructuralSummary {
        entryPoints = entryPoints != null ? List.copyOf(entryPoints) : List.of();
        testFiles = testFiles != null ? List.copyOf(testFiles) : List.of();
        configFiles = configFiles != null ? List.copyOf(configFiles) : List.of();
        coreFiles = coreFiles != null ? List.copyOf(coreFiles) : List.of();
        complexityMetrics = complexityMetrics != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(complexityMetrics))
                : Map.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public static StructuralSummary of(List<FileRecord> files, DependencyGraph graph) {
        var entryPoints = new ArrayList<String>();
        var testFiles = new ArrayList<String>();
        var configFiles = new ArrayList<String>();
        long totalTokens = 0;

        for (FileRecord file : files) {
            totalTokens += file.tokenCount();
            switch (file.kind()) {
                case TEST -> testFiles.add(file.path());
                case CONFIG -> configFiles.add(file.path());
                case SOURCE -> {
                    if (isEntryPoint(file)) {
                        entryPoints.add(file.path());
                    }
                }
                default -> { }
            }
        }

        List<String> coreFiles = files.stream()
                .map(FileRecord::path)
                .filter(p -> !graph.dependentsOf(p).isEmpty())
                .sorted(Comparator.comparingDouble((String p) -> graph.centrality(p)).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .limit(MAX_CORE_FILES)
                .toList();

        var metrics = new LinkedHashMap<String, Double>();
        metrics.put("total_files", (double) files.size());
        metrics.put("total_tokens", (double) totalTokens);
        metrics.put("avg_tokens_per_file", files.isEmpty() ? 0.0 : (double) totalTokens / files.size());
        metrics.put("max_tokens_per_file",
                (double) files.stream().mapToInt(FileRecord::tokenCount).max().orElse(0));
        metrics.put("dependency_edges", (double) graph.edges().size());
        metrics.put("edges_per_file", files.isEmpty() ? 0.0 : (double) graph.edges().size() / files.size());

        var recommendations = new ArrayList<String>();
        if (totalTokens > LARGE_CODEBASE_TOKENS) {
            recommendations.add("Large codebase detected - context optimization recommended");
        }
        if (!files.isEmpty() && testFiles.isEmpty()) {
            recommendations.add("No test files found - test tasks will fall back to source files");
        }
        if (files.size() > 1 && graph.edges().isEmpty()) {
            recommendations.add("No dependencies resolved - dependency strategy will behave like relevance");
        }

        return new StructuralSummary(entryPoints, testFiles, configFiles, coreFiles, metrics, recommendations);
    }

    private static boolean isEntryPoint(FileRecord file) {
        String path = file.path().replace('\\', '/');
        if (path.startsWith("cmd/") || path.contains("/cmd/")) {
            return true;
        }
        String name = file.fileName();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return ENTRY_POINT_STEMS.contains(stem.toLowerCase(Locale.ROOT)) || stem.endsWith("Application");
    }
}
