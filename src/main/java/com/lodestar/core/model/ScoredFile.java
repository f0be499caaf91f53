package com.lodestar.core.model;

import java.util.Comparator;
import java.util.Optional;

/**
 * A file together with its aggregate relevance score and the factors behind it.
 *
 * @param file    the scored file
 * @param score   aggregate score in [0,1]
 * @param factors per-factor breakdown, kept for diagnostics
 * @param failure description of a scoring failure, or null when scoring succeeded
 */
public record ScoredFile(
    FileRecord file,
    double score,
    ScoringFactors factors,
    String failure
) {

    /** Score descending, then path ascending. */
    public static final Comparator<ScoredFile> BY_SCORE_THEN_PATH =
            Comparator.comparingDouble(ScoredFile::score).reversed()
                    .thenComparing(sf -> sf.file().path());

    public ScoredFile(FileRecord file, double score, ScoringFactors factors) {
        this(file, score, factors, null);
    }

    public static ScoredFile failed(FileRecord file, String failure) {
        return new ScoredFile(file, 0.0, ScoringFactors.ZERO, failure);
    }

    public String path() {
        return file.path();
    }

    public Optional<String> failureReason() {
        return Optional.ofNullable(failure);
    }
}
