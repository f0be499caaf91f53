package com.lodestar.core.adaptive;

import com.lodestar.core.adaptive.ExecutionReport.CompletionStatus;
import com.lodestar.core.model.SelectedContext;
import com.lodestar.core.model.SelectionStrategy;
import com.lodestar.core.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.lodestar.core.Fixtures.file;
import static org.junit.jupiter.api.Assertions.*;

class SelectionOutcomeTest {

    private static final SelectedContext AUTH_AND_README = new SelectedContext(
            List.of(file("auth.go", 400), file("README.md", 200)), 600, 2,
            SelectionStrategy.RELEVANCE, List.of(), Map.of(), 0.6);

    private static ExecutionReport report(CompletionStatus status, Duration duration, List<String> errors,
                                          int iterations, int interventions) {
        return new ExecutionReport(status, duration, 0, List.of(), List.of(), errors, iterations, interventions);
    }

    // ── Quality inference ────────────────────────────────────────────

    @Nested
    @DisplayName("Quality inference")
    class QualityInference {

        @Test
        @DisplayName("a quick clean success scores full quality")
        void quickSuccess() {
            assertEquals(1.0, report(CompletionStatus.SUCCESS, Duration.ofMinutes(3), List.of(), 2, 0)
                    .inferredQuality(), 1e-9);
        }

        @Test
        @DisplayName("a partial run with one error loses a little")
        void partialWithError() {
            assertEquals(0.45, report(CompletionStatus.PARTIAL, Duration.ofMinutes(10), List.of("boom"), 1, 0)
                    .inferredQuality(), 1e-9);
        }

        @Test
        @DisplayName("a long failing run with many retries bottoms out at zero")
        void failureClamped() {
            var report = report(CompletionStatus.FAILED, Duration.ofMinutes(40), List.of("a", "b", "c"), 6, 4);
            assertEquals(0.0, report.inferredQuality(), 1e-9);
        }

        @Test
        @DisplayName("a success that took over thirty minutes is marked down")
        void slowSuccess() {
            assertEquals(0.7, report(CompletionStatus.SUCCESS, Duration.ofMinutes(31), List.of(), 1, 0)
                    .inferredQuality(), 1e-9);
        }

        @Test
        @DisplayName("status parsing is case-insensitive and rejects blanks")
        void statusParsing() {
            assertEquals(CompletionStatus.PARTIAL, CompletionStatus.fromString(" Partial "));
            assertThrows(IllegalArgumentException.class, () -> CompletionStatus.fromString(""));
            assertThrows(IllegalArgumentException.class, () -> CompletionStatus.fromString("done"));
        }
    }

    // ── File inference ───────────────────────────────────────────────

    @Nested
    @DisplayName("File inference")
    class FileInference {

        @Test
        @DisplayName("accessed files outside the selection are missing, unused selected files are unnecessary")
        void missingAndUnnecessary() {
            var report = ExecutionReport.of(CompletionStatus.SUCCESS, Duration.ofMinutes(2),
                    List.of("auth.go", "db.go", "auth.go"));

            var outcome = SelectionOutcome.fromExecution(TaskType.FEATURE, AUTH_AND_README, report);

            assertTrue(outcome.success());
            assertEquals(List.of("db.go"), outcome.missingFiles());
            assertEquals(List.of("README.md"), outcome.unnecessaryFiles());
            assertEquals(0.5, outcome.missRate(), 1e-9);
            assertEquals(0.5, outcome.wasteRate(), 1e-9);
        }

        @Test
        @DisplayName("a report without accessed files infers no file-level signal")
        void untracked() {
            var report = ExecutionReport.of(CompletionStatus.FAILED, Duration.ofMinutes(2), List.of());

            var outcome = SelectionOutcome.fromExecution(TaskType.FEATURE, AUTH_AND_README, report);

            assertFalse(outcome.success());
            assertTrue(outcome.missingFiles().isEmpty());
            assertTrue(outcome.unnecessaryFiles().isEmpty());
            assertEquals(0.0, outcome.missRate());
            assertEquals(0.0, outcome.wasteRate());
        }

        @Test
        @DisplayName("negative counts are rejected")
        void invalidReport() {
            assertThrows(IllegalArgumentException.class, () -> new ExecutionReport(CompletionStatus.SUCCESS,
                    Duration.ZERO, -1, List.of(), List.of(), List.of(), 1, 0));
            assertThrows(IllegalArgumentException.class, () -> new ExecutionReport(CompletionStatus.SUCCESS,
                    Duration.ofSeconds(-1), 0, List.of(), List.of(), List.of(), 1, 0));
        }
    }
}
