package com.lodestar.core.compression;

import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.SelectedContext;
import com.lodestar.core.model.SelectionStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.lodestar.core.Fixtures.file;
import static org.junit.jupiter.api.Assertions.*;

class CompressionEstimatorTest {

    private final CompressionEstimator estimator = new CompressionEstimator();

    private static SelectedContext selection(FileRecord... files) {
        int tokens = 0;
        for (FileRecord f : files) {
            tokens += f.tokenCount();
        }
        return new SelectedContext(List.of(files), tokens, files.length, SelectionStrategy.RELEVANCE,
                List.of(), Map.of(), 0.5);
    }

    @Test
    @DisplayName("per-file estimates round up")
    void estimate() {
        var estimate = estimator.estimate(selection(file("a.go", 100), file("b.go", 55)), CompressionStrategy.SUMMARY);

        assertEquals(155, estimate.originalTokens());
        assertEquals(30 + 17, estimate.estimatedTokens());
        assertEquals(108, estimate.tokenSavings());
        assertEquals(47.0 / 155, estimate.ratio(), 1e-9);
        assertEquals(0.6 - (1 - 47.0 / 155) * 0.2, estimate.qualityEstimate(), 1e-9);
    }

    @Test
    @DisplayName("no compression keeps every token at full quality")
    void none() {
        var estimate = estimator.estimate(selection(file("a.go", 100)), CompressionStrategy.NONE);
        assertEquals(100, estimate.estimatedTokens());
        assertEquals(1.0, estimate.ratio());
        assertEquals(1.0, estimate.qualityEstimate());
    }

    @Test
    @DisplayName("an empty selection has ratio 1")
    void empty() {
        var estimate = estimator.estimate(SelectedContext.empty(SelectionStrategy.RELEVANCE, List.of()),
                CompressionStrategy.SNIPPET);
        assertEquals(0, estimate.estimatedTokens());
        assertEquals(1.0, estimate.ratio());
    }

    @Test
    @DisplayName("estimates are ordered by expected quality")
    void ordering() {
        var strategies = estimator.estimateAll(selection(file("a.go", 200))).stream()
                .map(CompressionEstimate::strategy)
                .toList();
        assertEquals(List.of(CompressionStrategy.NONE, CompressionStrategy.MINIFY, CompressionStrategy.SEMANTIC,
                CompressionStrategy.SNIPPET, CompressionStrategy.SUMMARY), strategies);
    }

    @Test
    @DisplayName("the gentlest fitting strategy keeps the most quality")
    void gentlestFitting() {
        var selection = selection(file("a.go", 200));
        assertEquals(CompressionStrategy.NONE, estimator.gentlestFitting(selection, 200).orElseThrow().strategy());
        assertEquals(CompressionStrategy.MINIFY, estimator.gentlestFitting(selection, 199).orElseThrow().strategy());
        assertEquals(CompressionStrategy.SEMANTIC, estimator.gentlestFitting(selection, 100).orElseThrow().strategy());
        assertEquals(CompressionStrategy.SUMMARY, estimator.gentlestFitting(selection, 60).orElseThrow().strategy());
        assertTrue(estimator.gentlestFitting(selection, 59).isEmpty());
    }

    @Test
    @DisplayName("strategy names parse leniently")
    void parsing() {
        assertEquals(CompressionStrategy.SEMANTIC, CompressionStrategy.fromString(" Semantic "));
        assertEquals("minify", CompressionStrategy.MINIFY.label());
        var e = assertThrows(IllegalArgumentException.class, () -> CompressionStrategy.fromString("zip"));
        assertTrue(e.getMessage().startsWith("Unknown compression strategy 'zip'"));
        assertThrows(IllegalArgumentException.class, () -> CompressionStrategy.fromString(" "));
    }
}
