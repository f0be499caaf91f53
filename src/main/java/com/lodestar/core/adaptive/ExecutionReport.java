package com.lodestar.core.adaptive;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * What an agent reported after working on a task with a selection: how it ended, how long it
 * took, and which files it actually touched.
 *
 * @param status            how the task ended
 * @param duration          wall-clock time spent on the task
 * @param tokensConsumed    tokens the agent spent, 0 when unknown
 * @param filesAccessed     files the agent read, in access order; empty when not tracked
 * @param filesModified     files the agent changed
 * @param errors            errors encountered along the way
 * @param iterations        attempts the agent needed
 * @param userInterventions times a user had to step in
 */
public record ExecutionReport(
    CompletionStatus status,
    Duration duration,
    int tokensConsumed,
    List<String> filesAccessed,
    List<String> filesModified,
    List<String> errors,
    int iterations,
    int userInterventions
) {

    public enum CompletionStatus {
        SUCCESS,
        PARTIAL,
        FAILED;

        public static CompletionStatus fromString(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Completion status must not be blank");
            }
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public ExecutionReport {
        Objects.requireNonNull(status, "status");
        duration = duration != null ? duration : Duration.ZERO;
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative, got " + duration);
        }
        if (tokensConsumed < 0 || iterations < 0 || userInterventions < 0) {
            throw new IllegalArgumentException("token, iteration and intervention counts must be >= 0");
        }
        filesAccessed = filesAccessed != null ? filesAccessed.stream().filter(Objects::nonNull).toList() : List.of();
        filesModified = filesModified != null ? filesModified.stream().filter(Objects::nonNull).toList() : List.of();
        errors = errors != null ? errors.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public static ExecutionReport of(CompletionStatus status, Duration duration, List<String> filesAccessed) {
        return new ExecutionReport(status, duration, 0, filesAccessed, List.of(), List.of(), 1, 0);
    }

    /**
     * Quality implied by the way the task went, in [0,1].
     * <p>
     * Starts from the completion status (0.8 success, 0.5 partial, 0.2 failed); a run under five
     * minutes adds 0.1 and one over thirty minutes takes 0.2; an error-free run adds 0.1, otherwise
     * each error takes 0.05; more than five iterations take 0.1; more than three user
     * interventions take 0.15.
     */
    public double inferredQuality() {
        double quality = switch (status) {
            case SUCCESS -> 0.8;
            case PARTIAL -> 0.5;
            case FAILED -> 0.2;
        };
        if (duration.compareTo(Duration.ofMinutes(5)) < 0) {
            quality += 0.1;
        } else if (duration.compareTo(Duration.ofMinutes(30)) > 0) {
            quality -= 0.2;
        }
        quality += errors.isEmpty() ? 0.1 : -0.05 * errors.size();
        if (iterations > 5) {
            quality -= 0.1;
        }
        if (userInterventions > 3) {
            quality -= 0.15;
        }
        return Math.max(0.0, Math.min(1.0, quality));
    }
}
