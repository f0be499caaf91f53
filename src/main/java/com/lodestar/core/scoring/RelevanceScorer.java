package com.lodestar.core.scoring;

import com.lodestar.core.graph.DependencyGraph;
import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.ScoredFile;
import com.lodestar.core.model.ScoringFactors;
import com.lodestar.core.model.Task;

import java.util.Collection;
import java.util.List;

/**
 * Computes how relevant each file is to a task.
 */
public interface RelevanceScorer {

    /**
     * Aggregate relevance in [0,1], without graph information.
     */
    double score(FileRecord file, Task task);

    /**
     * The per-factor breakdown behind {@link #score(FileRecord, Task)}.
     */
    ScoringFactors factors(FileRecord file, Task task);

    /**
     * Scores every file without graph information.
     *
     * @return scored files, highest score first, ties by path
     */
    List<ScoredFile> scoreAll(Collection<FileRecord> files, Task task);

    /**
     * Scores every file in two phases so the dependency factor reflects the file's
     * connection to other relevant files in {@code graph}.
     *
     * @return scored files, highest score first, ties by path
     */
    List<ScoredFile> scoreAll(Collection<FileRecord> files, Task task, DependencyGraph graph);
}
