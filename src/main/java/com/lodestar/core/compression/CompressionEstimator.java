package com.lodestar.core.compression;

import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.SelectedContext;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Estimates what compressing a selection would save, without reading any file content.
 * Loading and actually compressing text is left to whoever assembles the prompt.
 */
public class CompressionEstimator {

    public CompressionEstimate estimate(SelectedContext selection, CompressionStrategy strategy) {
        int original = selection.totalTokens();
        int estimated = 0;
        for (FileRecord file : selection.files()) {
            estimated += (int) Math.ceil(file.tokenCount() * strategy.typicalRatio());
        }
        double ratio = original == 0 ? 1.0 : (double) estimated / original;
        return new CompressionEstimate(strategy, original, estimated, ratio,
                Math.max(0.0, Math.min(1.0, strategy.qualityAt(ratio))));
    }

    /**
     * Estimates for every strategy, highest expected quality first.
     */
    public List<CompressionEstimate> estimateAll(SelectedContext selection) {
        return Arrays.stream(CompressionStrategy.values())
                .map(strategy -> estimate(selection, strategy))
                .sorted(Comparator.comparingDouble(CompressionEstimate::qualityEstimate).reversed())
                .toList();
    }

    /**
     * The estimate with the highest expected quality that fits {@code tokenBudget}, if any.
     */
    public Optional<CompressionEstimate> gentlestFitting(SelectedContext selection, int tokenBudget) {
        return estimateAll(selection).stream()
                .filter(estimate -> estimate.fits(tokenBudget))
                .findFirst();
    }
}
