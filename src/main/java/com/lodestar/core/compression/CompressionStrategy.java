package com.lodestar.core.compression;

import java.util.Locale;

/**
 * Ways a downstream assembler can shrink selected files, with the share of tokens each
 * typically keeps.
 */
public enum CompressionStrategy {
    /** Full file text. */
    NONE(1.0),
    /** Declarations only: package, types and function signatures. */
    SUMMARY(0.3),
    /** Imports plus the blocks that matter to the task, with a little surrounding context. */
    SNIPPET(0.4),
    /** Comments and redundant whitespace stripped. */
    MINIFY(0.8),
    /** Package line, grouped imports, type definitions and signatures. */
    SEMANTIC(0.5);

    private final double typicalRatio;

    CompressionStrategy(double typicalRatio) {
        this.typicalRatio = typicalRatio;
    }

    /** Compressed tokens over original tokens for a typical file. */
    public double typicalRatio() {
        return typicalRatio;
    }

    /**
     * Expected usefulness of the compressed text relative to the full text, in [0,1].
     * Lossier strategies lose more as the ratio drops.
     */
    public double qualityAt(double ratio) {
        return switch (this) {
            case NONE -> 1.0;
            case MINIFY -> 0.95;
            case SNIPPET -> 0.8 - (1.0 - ratio) * 0.3;
            case SUMMARY -> 0.6 - (1.0 - ratio) * 0.2;
            case SEMANTIC -> 0.75 - (1.0 - ratio) * 0.25;
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CompressionStrategy fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Compression strategy must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CompressionStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown compression strategy '" + value
                + "', expected one of none, summary, snippet, minify, semantic");
    }
}
