package com.lodestar.core.compression;

/**
 * Expected effect of compressing a selection, computed from token counts alone.
 *
 * @param strategy         compression strategy estimated
 * @param originalTokens   tokens of the selection as selected
 * @param estimatedTokens  tokens expected after compression
 * @param ratio            estimated over original tokens, 1 for an empty selection
 * @param qualityEstimate  expected usefulness relative to the full text, in [0,1]
 */
public record CompressionEstimate(
    CompressionStrategy strategy,
    int originalTokens,
    int estimatedTokens,
    double ratio,
    double qualityEstimate
) {

    public int tokenSavings() {
        return originalTokens - estimatedTokens;
    }

    public boolean fits(int tokenBudget) {
        return estimatedTokens <= tokenBudget;
    }
}
