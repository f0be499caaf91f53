package com.lodestar.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The engine's output: the files chosen for a task, in the order they should be presented.
 * <p>
 * Instances are immutable. Callers that adjust a selection (the adaptive manager) derive a
 * new instance via {@link #withAdditionalReasons(List)}.
 *
 * @param files             selected files in presentation order
 * @param totalTokens       sum of the selected files' token counts
 * @param totalFiles        number of selected files
 * @param strategy          strategy used to order the candidates
 * @param adaptationReasons human-readable notes on every adjustment made while selecting
 * @param inclusionReasons  why each path was included, keyed by path
 * @param selectionScore    mean relevance score of the selected files, 0 when empty
 */
public record SelectedContext(
    List<FileRecord> files,
    int totalTokens,
    int totalFiles,
    SelectionStrategy strategy,
    List<String> adaptationReasons,
    Map<String, String> inclusionReasons,
    double selectionScore
) {

    public SelectedContext {
        files = files != null ? List.copyOf(files) : List.of();
        adaptationReasons = adaptationReasons != null ? List.copyOf(adaptationReasons) : List.of();
        inclusionReasons = inclusionReasons != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(inclusionReasons))
                : Map.of();
    }

    public static SelectedContext empty(SelectionStrategy strategy, List<String> reasons) {
        return new SelectedContext(List.of(), 0, 0, strategy, reasons, Map.of(), 0.0);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public List<String> paths() {
        return files.stream().map(FileRecord::path).toList();
    }

    public boolean contains(String path) {
        return files.stream().anyMatch(f -> f.path().equals(path));
    }

    public double averageTokensPerFile() {
        return totalFiles == 0 ? 0.0 : (double) totalTokens / totalFiles;
    }

    public SelectedContext withAdditionalReasons(List<String> reasons) {
        if (reasons == null || reasons.isEmpty()) {
            return this;
        }
        var merged = new ArrayList<>(adaptationReasons);
        merged.addAll(reasons);
        return new SelectedContext(files, totalTokens, totalFiles, strategy, merged, inclusionReasons, selectionScore);
    }
}
