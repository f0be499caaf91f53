package com.lodestar.core.optimizer;

import com.lodestar.core.Fixtures;
import com.lodestar.core.graph.DependencyGraphBuilder;
import com.lodestar.core.model.CandidateFilter;
import com.lodestar.core.model.ContextConstraints;
import com.lodestar.core.model.FileKind;
import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.ProjectSnapshot;
import com.lodestar.core.model.ScoredFile;
import com.lodestar.core.model.SelectedContext;
import com.lodestar.core.model.SelectionStrategy;
import com.lodestar.core.model.Task;
import com.lodestar.core.model.TaskType;
import com.lodestar.core.scoring.ScoringConfig;
import com.lodestar.core.scoring.WeightedRelevanceScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.lodestar.core.Fixtures.NOW;
import static com.lodestar.core.Fixtures.file;
import static com.lodestar.core.Fixtures.fileWithImports;
import static org.junit.jupiter.api.Assertions.*;

class ContextOptimizerTest {

    private final Fixtures.MutableClock clock = Fixtures.clock();
    private final WeightedRelevanceScorer scorer = new WeightedRelevanceScorer(ScoringConfig.defaults(), clock);
    private final ContextOptimizer optimizer = new ContextOptimizer(scorer, OptimizerSettings.defaults(), clock);

    private static final Task ADD_AUTH = new Task(TaskType.FEATURE, "add auth middleware", List.of("auth"), List.of());

    private static ContextConstraints budget(int maxTokens, SelectionStrategy strategy) {
        return ContextConstraints.of(maxTokens, 50, strategy);
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Auth project scenarios
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Auth project")
    class AuthScenarios {

        @Test
        @DisplayName("relevance picks auth.go, then auth_test.go, then README.md")
        void relevanceOrder() {
            SelectedContext all = optimizer.select(Fixtures.authProject(), ADD_AUTH, budget(2000, SelectionStrategy.RELEVANCE));
            assertEquals(List.of("auth.go", "auth_test.go", "README.md"), all.paths());

            SelectedContext tight = optimizer.select(Fixtures.authProject(), ADD_AUTH, budget(500, SelectionStrategy.RELEVANCE));
            assertEquals(List.of("auth.go"), tight.paths());
            assertEquals(400, tight.totalTokens());
            assertEquals(1, tight.totalFiles());
            assertEquals("relevance_score", tight.inclusionReasons().get("auth.go"));
            assertEquals(0.74, tight.selectionScore(), 1e-9);
        }

        @Test
        @DisplayName("a budget below every file returns an empty selection, not an error")
        void emptySelection() {
            SelectedContext result = optimizer.select(Fixtures.authProject(), ADD_AUTH, budget(50, SelectionStrategy.RELEVANCE));

            assertTrue(result.isEmpty());
            assertEquals(0, result.totalTokens());
            assertEquals(0.0, result.selectionScore());
            assertTrue(result.adaptationReasons().contains("No file fits within 50 tokens (smallest file: 200 tokens)"));
        }

        @Test
        @DisplayName("a must-include file is selected even when it alone exceeds the budget")
        void mustIncludeOverBudget() {
            var task = ADD_AUTH.withMustInclude(List.of("README.md"));
            SelectedContext result = optimizer.select(Fixtures.authProject(), task, budget(50, SelectionStrategy.RELEVANCE));

            assertEquals(List.of("README.md"), result.paths());
            assertEquals(200, result.totalTokens());
            assertEquals("must_include", result.inclusionReasons().get("README.md"));
            assertTrue(result.adaptationReasons().stream().anyMatch(r -> r.contains("over the budget of 50")));
        }

        @Test
        @DisplayName("failWhenEmpty turns an empty selection into BudgetInfeasibleException")
        void failWhenEmpty() {
            var e = assertThrows(BudgetInfeasibleException.class, () -> optimizer.select(
                    Fixtures.authProject(), ADD_AUTH, budget(50, SelectionStrategy.RELEVANCE).failingWhenEmpty()));
            assertEquals(50, e.getMaxTokens());
            assertEquals(200, e.getSmallestFileTokens());
        }

        @Test
        @DisplayName("compactness averages no more tokens per file than relevance")
        void compactnessVersusRelevance() {
            var snapshot = Fixtures.authProject();
            SelectedContext relevance = optimizer.select(snapshot, ADD_AUTH, budget(500, SelectionStrategy.RELEVANCE));
            SelectedContext compact = optimizer.select(snapshot, ADD_AUTH, budget(500, SelectionStrategy.COMPACTNESS));

            assertEquals(List.of("auth_test.go", "README.md"), compact.paths());
            assertTrue(compact.averageTokensPerFile() <= relevance.averageTokensPerFile());
            assertEquals("information_density", compact.inclusionReasons().get("README.md"));
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Budget invariants
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Budgets")
    class Budgets {

        private final ProjectSnapshot manyFiles = ProjectSnapshot.of("many", IntStream.range(0, 20)
                .mapToObj(i -> file("internal/pkg" + i + "/file" + i + ".go", 50 + i))
                .toList());

        @Test
        @DisplayName("never exceeds max files or max tokens for any strategy")
        void limits() {
            for (SelectionStrategy strategy : SelectionStrategy.values()) {
                var result = optimizer.select(manyFiles, Task.of(TaskType.GENERAL, "pkg"),
                        ContextConstraints.of(400, 5, strategy));
                assertTrue(result.totalFiles() <= 5, strategy + " selected " + result.totalFiles());
                assertTrue(result.totalTokens() <= 400, strategy + " used " + result.totalTokens());
                assertFalse(result.isEmpty());
                assertEquals(result.files().stream().mapToInt(FileRecord::tokenCount).sum(), result.totalTokens());
            }
        }

        @Test
        @DisplayName("skips a relevant file that does not fit and takes a smaller one")
        void skipsOversized() {
            var snapshot = ProjectSnapshot.of("p", List.of(file("auth.go", 10_000), file("util.go", 10)));
            var result = optimizer.select(snapshot, ADD_AUTH, budget(100, SelectionStrategy.RELEVANCE));
            assertEquals(List.of("util.go"), result.paths());
        }

        @Test
        @DisplayName("must-include files count toward max files")
        void mustIncludeMaxFiles() {
            var task = ADD_AUTH.withMustInclude(List.of("README.md", "auth_test.go"));
            var result = optimizer.select(Fixtures.authProject(), task, ContextConstraints.of(5000, 1, SelectionStrategy.RELEVANCE));

            assertEquals(List.of("README.md"), result.paths());
            assertTrue(result.adaptationReasons().contains("Must-include file auth_test.go dropped: max files (1) reached"));
        }

        @Test
        @DisplayName("unknown must-include paths are reported, suffixes resolve")
        void mustIncludeResolution() {
            var snapshot = ProjectSnapshot.of("p", List.of(file("docs/README.md", 20), file("main.go", 20)));
            var task = Task.of(TaskType.GENERAL, "").withMustInclude(List.of("README.md", "missing.go"));
            var result = optimizer.select(snapshot, task, budget(1000, SelectionStrategy.RELEVANCE));

            assertEquals("docs/README.md", result.paths().get(0));
            assertEquals("must_include", result.inclusionReasons().get("docs/README.md"));
            assertTrue(result.adaptationReasons().contains("Must-include file missing.go is not in the snapshot"));
        }

        @Test
        @DisplayName("task overrides replace the budget and are reported")
        void overrides() {
            var constraints = budget(5000, SelectionStrategy.BALANCED)
                    .withOverride(TaskType.FEATURE, new ContextConstraints.TaskOverride(500, null, SelectionStrategy.RELEVANCE));
            var result = optimizer.select(Fixtures.authProject(), ADD_AUTH, constraints);

            assertEquals(List.of("auth.go"), result.paths());
            assertEquals(SelectionStrategy.RELEVANCE, result.strategy());
            assertEquals("Applied feature task override: max 500 tokens, max 50 files, relevance strategy",
                    result.adaptationReasons().get(0));
        }

        @Test
        @DisplayName("an empty snapshot yields an empty selection")
        void emptySnapshot() {
            var result = optimizer.select(ProjectSnapshot.of("empty", List.of()), ADD_AUTH, budget(100, SelectionStrategy.RELEVANCE));
            assertTrue(result.isEmpty());
            var e = assertThrows(BudgetInfeasibleException.class, () -> optimizer.select(
                    ProjectSnapshot.of("empty", List.of()), ADD_AUTH, budget(100, SelectionStrategy.RELEVANCE).failingWhenEmpty()));
            assertEquals(-1, e.getSmallestFileTokens());
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Strategies
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Strategies")
    class Strategies {

        @Test
        @DisplayName("dependency strategy pulls in imports up to two levels deep")
        void dependencyExpansion() {
            var files = List.of(
                    fileWithImports("internal/auth/handler.go", 100, "internal/db/store.go"),
                    fileWithImports("internal/db/store.go", 100, "internal/db/conn.go"),
                    file("internal/db/conn.go", 100),
                    file("docs/notes.md", 100));
            var snapshot = ProjectSnapshot.of("svc", files, new DependencyGraphBuilder().build(files));
            var task = new Task(TaskType.FEATURE, "", List.of("handler"), List.of());

            var result = optimizer.select(snapshot, task, budget(1000, SelectionStrategy.DEPENDENCY));

            assertEquals(List.of("internal/auth/handler.go", "internal/db/store.go", "internal/db/conn.go", "docs/notes.md"),
                    result.paths());
            assertEquals("dependency_centrality", result.inclusionReasons().get("internal/auth/handler.go"));
            assertEquals("dependency_expansion", result.inclusionReasons().get("internal/db/store.go"));
            assertTrue(result.adaptationReasons().contains(
                    "Pulled in internal/db/store.go as a dependency of internal/auth/handler.go"));
            assertTrue(result.adaptationReasons().contains(
                    "Pulled in internal/db/conn.go as a dependency of internal/db/store.go (depth 2)"));
        }

        @Test
        @DisplayName("freshness strategy lifts recently modified files")
        void freshness() {
            var stale = FileRecord.of("auth_old.go", 100, NOW.minus(Duration.ofDays(30)));
            var fresh = file("b.go", 100);
            var snapshot = ProjectSnapshot.of("p", List.of(stale, fresh));

            assertEquals(List.of("auth_old.go", "b.go"),
                    optimizer.select(snapshot, ADD_AUTH, budget(1000, SelectionStrategy.RELEVANCE)).paths());
            var result = optimizer.select(snapshot, ADD_AUTH, budget(1000, SelectionStrategy.FRESHNESS));
            assertEquals(List.of("b.go", "auth_old.go"), result.paths());
            assertEquals("freshness_bias", result.inclusionReasons().get("b.go"));
        }

        @Test
        @DisplayName("balanced strategy labels its picks")
        void balanced() {
            var result = optimizer.select(Fixtures.authProject(), ADD_AUTH, budget(2000, SelectionStrategy.BALANCED));
            assertEquals(3, result.totalFiles());
            assertEquals(SelectionStrategy.BALANCED, result.strategy());
            assertTrue(result.inclusionReasons().values().stream().allMatch("balanced_strategy"::equals));
        }

        @Test
        @DisplayName("scoring failures are reported and the file ranks last")
        void scoringFailure() {
            var broken = file("auth_broken.go", 10).withMetadata(Map.of(FileRecord.METADATA_TAGS, 7));
            var snapshot = ProjectSnapshot.of("p", List.of(broken, file("auth.go", 400)));
            var result = optimizer.select(snapshot, ADD_AUTH, budget(1000, SelectionStrategy.RELEVANCE));

            assertEquals(List.of("auth.go", "auth_broken.go"), result.paths());
            assertTrue(result.adaptationReasons().get(0).startsWith("Scoring failed for auth_broken.go"));
        }

        @Test
        @DisplayName("selection is deterministic")
        void deterministic() {
            var snapshot = Fixtures.authProject();
            for (SelectionStrategy strategy : SelectionStrategy.values()) {
                assertEquals(optimizer.select(snapshot, ADD_AUTH, budget(600, strategy)),
                        optimizer.select(snapshot, ADD_AUTH, budget(600, strategy)));
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Candidate filter
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Candidate filter")
    class Filters {

        private ContextConstraints filtered(CandidateFilter filter) {
            return budget(2000, SelectionStrategy.RELEVANCE).withFilter(filter);
        }

        private ProjectSnapshot dependencyChain() {
            var files = List.of(
                    fileWithImports("internal/auth/handler.go", 100, "internal/db/store.go"),
                    fileWithImports("internal/db/store.go", 100, "internal/db/conn.go"),
                    file("internal/db/conn.go", 100),
                    file("docs/notes.md", 100));
            return ProjectSnapshot.of("svc", files, new DependencyGraphBuilder().build(files));
        }

        @Test
        @DisplayName("files under the minimum relevance score are left out")
        void minRelevanceScore() {
            var snapshot = Fixtures.authProject();
            Map<String, Double> scores = scorer.scoreAll(snapshot.files(), ADD_AUTH, snapshot.graph()).stream()
                    .collect(Collectors.toMap(ScoredFile::path, ScoredFile::score));
            double top = scores.get("auth.go");
            double next = scores.get("auth_test.go");
            assertTrue(top > next);

            var result = optimizer.select(snapshot, ADD_AUTH, filtered(CandidateFilter.NONE.withMinRelevanceScore((top + next) / 2)));

            assertEquals(List.of("auth.go"), result.paths());
            assertTrue(result.adaptationReasons().contains("Candidate filter left out 2 of 3 files"));
        }

        @Test
        @DisplayName("test files are left out when tests are excluded")
        void excludeTests() {
            var result = optimizer.select(Fixtures.authProject(), ADD_AUTH,
                    filtered(new CandidateFilter(0.0, false, true, List.of(), null)));
            assertEquals(List.of("auth.go", "README.md"), result.paths());
        }

        @Test
        @DisplayName("documentation is left out when docs are excluded")
        void excludeDocs() {
            var result = optimizer.select(Fixtures.authProject(), ADD_AUTH,
                    filtered(new CandidateFilter(0.0, true, false, List.of(), null)));
            assertEquals(List.of("auth.go", "auth_test.go"), result.paths());
            assertTrue(result.adaptationReasons().contains("Candidate filter left out 1 of 3 files"));
        }

        @Test
        @DisplayName("paths containing an excluded pattern are left out")
        void excludedPatterns() {
            var result = optimizer.select(Fixtures.authProject(), ADD_AUTH,
                    filtered(new CandidateFilter(0.0, true, true, List.of("_test", "vendor/"), null)));
            assertEquals(List.of("auth.go", "README.md"), result.paths());
        }

        @Test
        @DisplayName("preferred kinds restrict packing to those kinds")
        void preferredKinds() {
            var result = optimizer.select(Fixtures.authProject(), ADD_AUTH,
                    filtered(new CandidateFilter(0.0, true, true, List.of(), Set.of(FileKind.SOURCE))));
            assertEquals(List.of("auth.go"), result.paths());
        }

        @Test
        @DisplayName("must-include files bypass every filter")
        void mustIncludeBypassesFilter() {
            var task = new Task(TaskType.FEATURE, "add auth middleware", List.of("auth"), List.of("README.md"));
            var filter = new CandidateFilter(0.9, false, false, List.of("README"), Set.of(FileKind.SOURCE));

            var result = optimizer.select(Fixtures.authProject(), task, filtered(filter));

            assertEquals(List.of("README.md"), result.paths());
            assertEquals("must_include", result.inclusionReasons().get("README.md"));
            assertTrue(result.adaptationReasons().contains("Candidate filter left out 2 of 3 files"));
        }

        @Test
        @DisplayName("a filter that admits everything adds no reason")
        void noFilterNoReason() {
            var result = optimizer.select(Fixtures.authProject(), ADD_AUTH, filtered(CandidateFilter.NONE));
            assertEquals(3, result.totalFiles());
            assertTrue(result.adaptationReasons().stream().noneMatch(r -> r.startsWith("Candidate filter")));
        }

        @Test
        @DisplayName("an empty filtered selection reports the smallest admitted file")
        void emptyAfterFilter() {
            var snapshot = ProjectSnapshot.of("p", List.of(file("tiny_test.go", 10), file("big.go", 500)));
            var constraints = ContextConstraints.of(100, 10, SelectionStrategy.RELEVANCE)
                    .withFilter(new CandidateFilter(0.0, false, true, List.of(), null));

            var result = optimizer.select(snapshot, ADD_AUTH, constraints);

            assertTrue(result.isEmpty());
            assertTrue(result.adaptationReasons().contains("No file fits within 100 tokens (smallest file: 500 tokens)"));
        }

        @Test
        @DisplayName("a dependency depth of 1 stops expansion after direct imports")
        void dependencyDepthOverride() {
            var task = new Task(TaskType.FEATURE, "", List.of("handler"), List.of());
            var constraints = budget(1000, SelectionStrategy.DEPENDENCY).withDependencyDepth(1);

            var result = optimizer.select(dependencyChain(), task, constraints);

            assertEquals("dependency_expansion", result.inclusionReasons().get("internal/db/store.go"));
            assertEquals("dependency_centrality", result.inclusionReasons().get("internal/db/conn.go"));
            assertTrue(result.adaptationReasons().stream().noneMatch(r -> r.endsWith("(depth 2)")));
        }

        @Test
        @DisplayName("filtered dependencies are walked through but never added")
        void filteredDependency() {
            var task = new Task(TaskType.FEATURE, "", List.of("handler"), List.of());
            var constraints = budget(1000, SelectionStrategy.DEPENDENCY)
                    .withFilter(new CandidateFilter(0.0, true, true, List.of("store.go"), null));

            var result = optimizer.select(dependencyChain(), task, constraints);

            assertFalse(result.paths().contains("internal/db/store.go"));
            assertEquals("dependency_expansion", result.inclusionReasons().get("internal/db/conn.go"));
            assertTrue(result.adaptationReasons().contains(
                    "Pulled in internal/db/conn.go as a dependency of internal/db/store.go (depth 2)"));
        }
    }
}
