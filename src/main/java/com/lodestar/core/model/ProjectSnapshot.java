package com.lodestar.core.model;

import com.lodestar.core.graph.DependencyGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * An immutable view of a project at one point in time.
 * <p>
 * Built by a {@code ProjectSnapshotProvider}; the engine only reads it and may share a
 * snapshot between concurrent selections.
 *
 * @param rootId         identifier of the project root (a path or a logical name)
 * @param files          files in provider order, paths unique
 * @param totalTokens    sum of all files' token counts
 * @param languageCounts number of files per language tag, sorted by language
 * @param graph          dependency graph whose nodes are exactly the snapshot's paths
 * @param summary        derived structural summary
 */
public record ProjectSnapshot(
    String rootId,
    List<FileRecord> files,
    long totalTokens,
    Map<String, Integer> languageCounts,
    DependencyGraph graph,
    StructuralSummary summary
) {

    public ProjectSnapshot {
        Objects.requireNonNull(rootId, "rootId");
        files = files != null ? List.copyOf(files) : List.of();
        languageCounts = languageCounts != null
                ? Collections.unmodifiableMap(new TreeMap<>(languageCounts))
                : Map.of();
        graph = graph != null ? graph : DependencyGraph.isolated(files.stream().map(FileRecord::path).toList());
        summary = summary != null ? summary : StructuralSummary.of(files, graph);
    }

    /**
     * Creates a snapshot with an edge-free graph.
     */
    public static ProjectSnapshot of(String rootId, List<FileRecord> files) {
        return of(rootId, files, null);
    }

    /**
     * Creates a snapshot and computes its aggregates.
     *
     * @throws IllegalArgumentException if two files share a path, or the graph has a node
     *                                  that is not one of the files
     */
    public static ProjectSnapshot of(String rootId, List<FileRecord> files, DependencyGraph graph) {
        var byPath = new LinkedHashMap<String, FileRecord>();
        var languages = new TreeMap<String, Integer>();
        long tokens = 0;
        for (FileRecord file : files) {
            if (byPath.putIfAbsent(file.path(), file) != null) {
                throw new IllegalArgumentException("Duplicate file path in snapshot " + rootId + ": " + file.path());
            }
            tokens += file.tokenCount();
            languages.merge(file.language(), 1, Integer::sum);
        }
        DependencyGraph effective = graph != null ? graph : DependencyGraph.isolated(byPath.keySet());
        for (String node : effective.nodes().keySet()) {
            if (!byPath.containsKey(node)) {
                throw new IllegalArgumentException("Dependency graph references " + node
                        + " which is not part of snapshot " + rootId);
            }
        }
        List<FileRecord> ordered = List.copyOf(byPath.values());
        return new ProjectSnapshot(rootId, ordered, tokens, languages, effective,
                StructuralSummary.of(ordered, effective));
    }

    public int fileCount() {
        return files.size();
    }

    public Optional<FileRecord> file(String path) {
        return files.stream().filter(f -> f.path().equals(path)).findFirst();
    }

    public List<FileRecord> filesOfKind(FileKind kind) {
        return files.stream().filter(f -> f.kind() == kind).toList();
    }
}
