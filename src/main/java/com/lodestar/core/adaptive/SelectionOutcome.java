package com.lodestar.core.adaptive;

import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.SelectedContext;
import com.lodestar.core.model.TaskType;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Feedback about how well a selection served its task.
 *
 * @param taskType         type of the task the selection was made for
 * @param selection        the selection that was used
 * @param success          whether the task was completed
 * @param qualityScore     quality of the result in [0,1]
 * @param missingFiles     files the task needed that the selection lacked
 * @param unnecessaryFiles selected files the task never used
 */
public record SelectionOutcome(
    TaskType taskType,
    SelectedContext selection,
    boolean success,
    double qualityScore,
    List<String> missingFiles,
    List<String> unnecessaryFiles
) {

    public SelectionOutcome {
        Objects.requireNonNull(taskType, "taskType");
        Objects.requireNonNull(selection, "selection");
        if (qualityScore < 0 || qualityScore > 1 || Double.isNaN(qualityScore)) {
            throw new IllegalArgumentException("qualityScore must be in [0,1], got " + qualityScore);
        }
        missingFiles = missingFiles != null ? List.copyOf(missingFiles) : List.of();
        unnecessaryFiles = unnecessaryFiles != null ? List.copyOf(unnecessaryFiles) : List.of();
    }

    /**
     * Explicit feedback without file-level detail.
     */
    public SelectionOutcome(TaskType taskType, SelectedContext selection, boolean success, double qualityScore) {
        this(taskType, selection, success, qualityScore, List.of(), List.of());
    }

    /**
     * Infers an outcome from an execution report. Quality comes from
     * {@link ExecutionReport#inferredQuality()}; success means the task completed. Files the agent
     * accessed outside the selection are missing, and selected files it never accessed are
     * unnecessary. A report without accessed files says nothing about either.
     */
    public static SelectionOutcome fromExecution(TaskType taskType, SelectedContext selection, ExecutionReport report) {
        Objects.requireNonNull(report, "report");
        if (report.filesAccessed().isEmpty()) {
            return new SelectionOutcome(taskType, selection,
                    report.status() == ExecutionReport.CompletionStatus.SUCCESS, report.inferredQuality());
        }
        Set<String> selected = new LinkedHashSet<>(selection.paths());
        Set<String> accessed = new LinkedHashSet<>(report.filesAccessed());

        var missing = accessed.stream().filter(path -> !selected.contains(path)).toList();
        var unnecessary = selection.files().stream()
                .map(FileRecord::path)
                .filter(path -> !accessed.contains(path))
                .toList();
        return new SelectionOutcome(taskType, selection, report.status() == ExecutionReport.CompletionStatus.SUCCESS,
                report.inferredQuality(), missing, unnecessary);
    }

    /**
     * Share of the files the task needed that were not selected, in [0,1].
     * Needed files are the selected ones that were used plus the missing ones.
     */
    public double missRate() {
        int needed = selection.totalFiles() - unnecessaryFiles.size() + missingFiles.size();
        return needed <= 0 ? 0.0 : (double) missingFiles.size() / needed;
    }

    /**
     * Share of the selected files the task never used, in [0,1].
     */
    public double wasteRate() {
        return selection.totalFiles() == 0 ? 0.0 : (double) unnecessaryFiles.size() / selection.totalFiles();
    }
}
