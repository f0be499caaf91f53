package com.lodestar.core.scoring;

import com.lodestar.core.Fixtures;
import com.lodestar.core.graph.DependencyEdge;
import com.lodestar.core.graph.DependencyGraph;
import com.lodestar.core.metrics.ContextMetrics;
import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.ScoredFile;
import com.lodestar.core.model.Task;
import com.lodestar.core.model.TaskType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.lodestar.core.Fixtures.NOW;
import static com.lodestar.core.Fixtures.file;
import static org.junit.jupiter.api.Assertions.*;

class WeightedRelevanceScorerTest {

    private final WeightedRelevanceScorer scorer =
            new WeightedRelevanceScorer(ScoringConfig.defaults(), Fixtures.clock());

    private static final Task ADD_AUTH = new Task(TaskType.FEATURE, "add auth middleware", List.of("auth"), List.of());

    private static ScoredFile find(List<ScoredFile> scored, String path) {
        return scored.stream().filter(s -> s.path().equals(path)).findFirst().orElseThrow();
    }

    // ── Aggregate score ─────────────────────────────────────────────────

    @Nested
    @DisplayName("Aggregate score")
    class Aggregate {

        @Test
        @DisplayName("auth project ranks source, then test, then README")
        void authRanking() {
            List<ScoredFile> scored = scorer.scoreAll(Fixtures.authProject().files(), ADD_AUTH);

            assertEquals(List.of("auth.go", "auth_test.go", "README.md"),
                    scored.stream().map(ScoredFile::path).toList());
            assertEquals(0.74, scored.get(0).score(), 1e-9);
            assertEquals(0.61, scored.get(1).score(), 1e-9);
            assertEquals(0.30, scored.get(2).score(), 1e-9);
        }

        @Test
        @DisplayName("scores stay within [0,1] for every task type")
        void bounds() {
            var files = List.of(
                    file("vendor/github.com/x/y.go", 20_000),
                    file("internal/errors/log.go", 0),
                    file("docs/guide.md", 500),
                    file("src/test/java/FooTest.java", 120),
                    FileRecord.of("config/app.yaml", 30, NOW.plus(Duration.ofDays(3))));
            for (TaskType type : TaskType.values()) {
                var task = new Task(type, "debug error log in guide for foo", List.of(), List.of("guide.md"));
                for (ScoredFile sf : scorer.scoreAll(files, task)) {
                    assertTrue(sf.score() >= 0.0 && sf.score() <= 1.0, sf.path() + " scored " + sf.score());
                }
            }
        }

        @Test
        @DisplayName("scoreAll is deterministic")
        void deterministic() {
            var files = Fixtures.authProject().files();
            assertEquals(scorer.scoreAll(files, ADD_AUTH), scorer.scoreAll(files, ADD_AUTH));
        }

        @Test
        @DisplayName("equal scores are ordered by path")
        void tieBreak() {
            var scored = scorer.scoreAll(List.of(file("b.go", 100), file("a.go", 100)), Task.of(TaskType.GENERAL, ""));
            assertEquals(List.of("a.go", "b.go"), scored.stream().map(ScoredFile::path).toList());
        }

        @Test
        @DisplayName("score matches the first entry of scoreAll")
        void singleScore() {
            assertEquals(0.74, scorer.score(file("auth.go", 400), ADD_AUTH), 1e-9);
        }
    }

    // ── Individual factors ──────────────────────────────────────────────

    @Nested
    @DisplayName("Factors")
    class Factors {

        @Test
        @DisplayName("keyword factor counts file name hits double")
        void keywords() {
            var task = new Task(TaskType.FEATURE, "", List.of("auth", "Session"), List.of());
            // session: file name (2) + path (1) of 4 possible
            assertEquals(0.75, scorer.factors(file("lib/session.go", 10), task).keywordMatch(), 1e-9);
            assertEquals(1.0, scorer.factors(file("auth/session_store.go", 10), task).keywordMatch(), 1e-9);
            assertEquals(0.25, scorer.factors(file("auth/store.go", 10), task).keywordMatch(), 1e-9);
            assertEquals(0.0, scorer.factors(file("db/store.go", 10), task).keywordMatch());
        }

        @Test
        @DisplayName("keywords come from the description when none are given")
        void descriptionKeywords() {
            var task = Task.of(TaskType.FEATURE, "the session cache");
            assertEquals(0.75, scorer.factors(file("pkg/session.go", 10), task).keywordMatch(), 1e-9);
            assertEquals(0.5, scorer.factors(file("pkg/session.go", 10), Task.of(TaskType.FEATURE, "")).keywordMatch());
        }

        @Test
        @DisplayName("tags metadata counts as a keyword hit")
        void tags() {
            var tagged = file("internal/handlers.go", 10).withMetadata(Map.of(FileRecord.METADATA_TAGS, List.of("Auth")));
            assertEquals(0.5, scorer.factors(tagged, ADD_AUTH).keywordMatch(), 1e-9);
        }

        @Test
        @DisplayName("must-include files get a full keyword factor")
        void mustInclude() {
            var task = ADD_AUTH.withMustInclude(List.of("README.md"));
            assertEquals(1.0, scorer.factors(file("README.md", 200), task).keywordMatch());
        }

        @Test
        @DisplayName("a must-include entry gives the full keyword factor only to the file it resolves to")
        void mustIncludeResolvesOnePath() {
            var task = ADD_AUTH.withMustInclude(List.of("README.md"));
            var files = List.of(file("README.md", 200), file("docs/README.md", 200), file("vendor/lib/README.md", 200));

            List<ScoredFile> plain = scorer.scoreAll(files, task);
            List<ScoredFile> twoPhase = scorer.scoreAll(files, task,
                    DependencyGraph.isolated(files.stream().map(FileRecord::path).toList()));

            for (List<ScoredFile> scored : List.of(plain, twoPhase)) {
                assertEquals(1.0, find(scored, "README.md").factors().keywordMatch());
                assertEquals(0.0, find(scored, "docs/README.md").factors().keywordMatch());
                assertEquals(0.0, find(scored, "vendor/lib/README.md").factors().keywordMatch());
            }
        }

        @Test
        @DisplayName("without an exact match the shortest suffix match is the named file")
        void mustIncludeShortestSuffix() {
            var task = ADD_AUTH.withMustInclude(List.of("README.md"));
            List<ScoredFile> scored = scorer.scoreAll(
                    List.of(file("vendor/lib/README.md", 200), file("docs/README.md", 200)), task);

            assertEquals(1.0, find(scored, "docs/README.md").factors().keywordMatch());
            assertEquals(0.0, find(scored, "vendor/lib/README.md").factors().keywordMatch());
        }

        @Test
        @DisplayName("path factor prefers core directories and penalises tests, docs and vendor code")
        void path() {
            var feature = Task.of(TaskType.FEATURE, "");
            assertEquals(0.9, scorer.factors(file("cmd/server/main.go", 10), feature).pathRelevance());
            assertEquals(0.8, scorer.factors(file("internal/x.go", 10), feature).pathRelevance());
            assertEquals(0.7, scorer.factors(file("pkg/x.go", 10), feature).pathRelevance());
            assertEquals(0.2, scorer.factors(file("test/x_test.go", 10), feature).pathRelevance());
            assertEquals(0.3, scorer.factors(file("docs/guide.md", 10), feature).pathRelevance());
            assertEquals(0.1, scorer.factors(file("vendor/x/y.go", 10), feature).pathRelevance());
            assertEquals(0.5, scorer.factors(file("docs/guide.md", 10),
                    Task.of(TaskType.DOCUMENTATION, "")).pathRelevance());
        }

        @Test
        @DisplayName("recency halves every half-life and future timestamps count as fresh")
        void recency() {
            assertEquals(1.0, scorer.factors(file("a.go", 10), ADD_AUTH).recency(), 1e-9);
            var weekOld = FileRecord.of("a.go", 10, NOW.minus(Duration.ofDays(7)));
            assertEquals(0.5, scorer.factors(weekOld, ADD_AUTH).recency(), 1e-9);
            var future = FileRecord.of("a.go", 10, NOW.plus(Duration.ofHours(1)));
            assertEquals(1.0, scorer.factors(future, ADD_AUTH).recency());
        }

        @Test
        @DisplayName("size peaks at the optimal token count with a floor for large files")
        void size() {
            assertEquals(0.0, scorer.factors(file("a.go", 0), ADD_AUTH).size());
            assertEquals(0.5, scorer.factors(file("a.go", 250), ADD_AUTH).size(), 1e-9);
            assertEquals(1.0, scorer.factors(file("a.go", 500), ADD_AUTH).size(), 1e-9);
            assertEquals(0.5, scorer.factors(file("a.go", 1000), ADD_AUTH).size(), 1e-9);
            assertEquals(0.3, scorer.factors(file("a.go", 5000), ADD_AUTH).size(), 1e-9);
        }

        @Test
        @DisplayName("task type patterns reward matching paths")
        void taskPatterns() {
            assertEquals(0.8, scorer.factors(file("internal/errors.go", 10), Task.of(TaskType.DEBUG, "")).taskType());
            assertEquals(1.0, scorer.factors(file("auth_test.go", 10), Task.of(TaskType.TEST, "")).taskType());
            assertEquals(0.8, scorer.factors(file("api/handler.go", 10), Task.of(TaskType.REFACTOR, "")).taskType());
            assertEquals(0.5, scorer.factors(file("api/handler.go", 10), Task.of(TaskType.FEATURE, "")).taskType());
        }

        @Test
        @DisplayName("language preference depends on the task")
        void language() {
            assertEquals(0.9, scorer.factors(file("a.go", 10), ADD_AUTH).language());
            assertEquals(1.0, scorer.factors(file("a.md", 10), Task.of(TaskType.DOCUMENTATION, "")).language());
            assertEquals(0.5, scorer.factors(file("a.sh", 10), ADD_AUTH).language());
        }
    }

    // ── Two-phase dependency factor ─────────────────────────────────────

    @Nested
    @DisplayName("Dependency factor")
    class Dependency {

        private final List<FileRecord> files = List.of(
                file("auth.go", 100), file("main.go", 100), file("util.go", 100));

        private final DependencyGraph graph = new DependencyGraph(
                List.of("auth.go", "main.go", "util.go"),
                List.of(DependencyEdge.imports("main.go", "auth.go")));

        @Test
        @DisplayName("neighbours of high scorers gain affinity, isolated files get nothing")
        void affinity() {
            var scored = scorer.scoreAll(files, ADD_AUTH, graph);

            // main.go: centrality 1/6, full affinity to auth.go
            assertEquals(0.5 / 6 + 0.5, find(scored, "main.go").factors().dependency(), 1e-9);
            // auth.go: centrality 2/6, its only neighbour is not a high scorer
            assertEquals(1.0 / 6, find(scored, "auth.go").factors().dependency(), 1e-9);
            assertEquals(0.0, find(scored, "util.go").factors().dependency());
        }

        @Test
        @DisplayName("the graph raises connected files above their graph-free score")
        void raisesConnected() {
            double without = find(scorer.scoreAll(files, ADD_AUTH), "main.go").score();
            double with = find(scorer.scoreAll(files, ADD_AUTH, graph), "main.go").score();
            assertTrue(with > without);
            assertEquals(find(scorer.scoreAll(files, ADD_AUTH), "util.go").score(),
                    find(scorer.scoreAll(files, ADD_AUTH, graph), "util.go").score(), 1e-9);
        }

        @Test
        @DisplayName("an edge-free graph leaves scores unchanged")
        void isolatedGraph() {
            var isolated = DependencyGraph.isolated(List.of("auth.go", "main.go", "util.go"));
            assertEquals(scorer.scoreAll(files, ADD_AUTH), scorer.scoreAll(files, ADD_AUTH, isolated));
        }
    }

    // ── Partial failures ────────────────────────────────────────────────

    @Nested
    @DisplayName("Partial failures")
    class Failures {

        @Test
        @DisplayName("malformed tags zero one file and are counted, the rest are scored")
        void malformedTags() {
            var registry = new SimpleMeterRegistry();
            var counted = new WeightedRelevanceScorer(ScoringConfig.defaults(), Fixtures.clock(),
                    new ContextMetrics(registry));
            var broken = file("auth_broken.go", 100).withMetadata(Map.of(FileRecord.METADATA_TAGS, "auth"));

            var scored = counted.scoreAll(List.of(broken, file("auth.go", 400)), ADD_AUTH, DependencyGraph.isolated(
                    List.of("auth_broken.go", "auth.go")));

            ScoredFile failed = find(scored, "auth_broken.go");
            assertEquals(0.0, failed.score());
            assertTrue(failed.failureReason().isPresent());
            assertEquals(0.74, find(scored, "auth.go").score(), 1e-9);
            assertEquals(1.0, registry.find("lodestar.analysis.failures").tag("stage", "scoring").counter().count());
        }
    }
}
