package com.lodestar.core.model;

import com.lodestar.core.graph.DependencyEdge;
import com.lodestar.core.graph.DependencyGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

import static com.lodestar.core.Fixtures.file;
import static org.junit.jupiter.api.Assertions.*;

class ProjectSnapshotTest {

    @Test
    @DisplayName("aggregates tokens and language counts, keeping file order")
    void aggregates() {
        var snapshot = ProjectSnapshot.of("demo", List.of(
                file("main.go", 100),
                file("README.md", 50),
                file("auth.go", 25)));

        assertEquals(175, snapshot.totalTokens());
        assertEquals(3, snapshot.fileCount());
        assertEquals(2, snapshot.languageCounts().get("go"));
        assertEquals(1, snapshot.languageCounts().get("markdown"));
        assertEquals(List.of("main.go", "README.md", "auth.go"),
                snapshot.files().stream().map(FileRecord::path).toList());
        assertTrue(snapshot.file("auth.go").isPresent());
        assertTrue(snapshot.file("missing.go").isEmpty());
        assertEquals(1, snapshot.filesOfKind(FileKind.DOC).size());
    }

    @Test
    @DisplayName("rejects duplicate paths")
    void duplicates() {
        assertThrows(IllegalArgumentException.class, () -> ProjectSnapshot.of("demo", List.of(
                file("main.go", 10), file("main.go", 20))));
    }

    @Test
    @DisplayName("rejects a graph with nodes outside the snapshot")
    void foreignGraphNode() {
        var graph = DependencyGraph.isolated(List.of("main.go", "other.go"));
        assertThrows(IllegalArgumentException.class,
                () -> ProjectSnapshot.of("demo", List.of(file("main.go", 10)), graph));
    }

    @Test
    @DisplayName("summary lists entry points, tests, configs and core files")
    void summary() {
        var files = List.of(
                file("cmd/server/main.go", 100),
                file("internal/auth/auth.go", 200),
                file("internal/auth/auth_test.go", 150),
                file("config/app.yaml", 20));
        var graph = new DependencyGraph(files.stream().map(FileRecord::path).toList(), List.of(
                DependencyEdge.imports("cmd/server/main.go", "internal/auth/auth.go")));
        var summary = ProjectSnapshot.of("svc", files, graph).summary();

        assertEquals(List.of("cmd/server/main.go"), summary.entryPoints());
        assertEquals(List.of("internal/auth/auth_test.go"), summary.testFiles());
        assertEquals(List.of("config/app.yaml"), summary.configFiles());
        assertEquals(List.of("internal/auth/auth.go"), summary.coreFiles());
        assertEquals(4.0, summary.complexityMetrics().get("total_files"));
        assertEquals(117.5, summary.complexityMetrics().get("avg_tokens_per_file"));
        assertEquals(1.0, summary.complexityMetrics().get("dependency_edges"));
        assertTrue(summary.recommendations().isEmpty());
    }

    @Test
    @DisplayName("summary recommends optimization for large projects without tests or edges")
    void recommendations() {
        var files = IntStream.range(0, 30)
                .mapToObj(i -> FileRecord.of("pkg/file" + i + ".go", 5000, Instant.EPOCH))
                .toList();
        var summary = ProjectSnapshot.of("big", files).summary();

        assertEquals(3, summary.recommendations().size());
        assertTrue(summary.recommendations().get(0).startsWith("Large codebase detected"));
        assertTrue(summary.recommendations().get(1).startsWith("No test files found"));
        assertTrue(summary.recommendations().get(2).startsWith("No dependencies resolved"));
    }
}
