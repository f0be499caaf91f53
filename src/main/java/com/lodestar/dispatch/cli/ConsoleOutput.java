package com.lodestar.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lodestar.core.compression.CompressionEstimate;
import com.lodestar.core.model.ScoredFile;
import com.lodestar.core.model.SelectedContext;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Lodestar CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LODESTAR v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LODESTAR]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void reason(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) ~|@ " + message));
    }

    public static void selectedFile(String path, int tokens, String why) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) +|@ " + path + " @|faint (" + tokens + " tokens, " + why + ")|@"));
    }

    public static void selection(SelectedContext context) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Selected Context|@"));
        System.out.println("  Strategy: " + context.strategy().label());
        System.out.println("  Files:    " + context.totalFiles());
        System.out.println("  Tokens:   " + context.totalTokens());
        System.out.println(String.format(Locale.ROOT, "  Score:    %.3f", context.selectionScore()));
        if (!context.isEmpty()) {
            System.out.println();
            for (var file : context.files()) {
                selectedFile(file.path(), file.tokenCount(),
                        context.inclusionReasons().getOrDefault(file.path(), "-"));
            }
        }
        if (!context.adaptationReasons().isEmpty()) {
            System.out.println();
            System.out.println("  ADAPTATIONS:");
            context.adaptationReasons().forEach(ConsoleOutput::reason);
        }
    }

    public static void compression(CompressionEstimate estimate, int tokenBudget) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Compression (" + estimate.strategy().label() + ")|@"));
        System.out.println(String.format(Locale.ROOT, "  Tokens:   %d -> ~%d (ratio %.2f)",
                estimate.originalTokens(), estimate.estimatedTokens(), estimate.ratio()));
        System.out.println(String.format(Locale.ROOT, "  Quality:  %.2f", estimate.qualityEstimate()));
        String verdict = estimate.fits(tokenBudget)
                ? "@|fg(green) fits|@ a budget of " + tokenBudget
                : "@|fg(red) exceeds|@ a budget of " + tokenBudget;
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  Budget:   " + verdict));
    }

    public static void scoreRow(ScoredFile scored) {
        var f = scored.factors();
        String score = String.format(Locale.ROOT, "%.3f", scored.score());
        String colored = scored.score() >= 0.6 ? "@|fg(green) " + score + "|@"
                : scored.score() >= 0.4 ? "@|fg(yellow) " + score + "|@"
                : "@|fg(red) " + score + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                "  %s  %.2f %.2f %.2f %.2f %.2f %.2f %.2f %.2f  %s%s",
                colored, f.keywordMatch(), f.pathRelevance(), f.fileType(), f.recency(), f.size(),
                f.dependency(), f.taskType(), f.language(), scored.path(),
                scored.failureReason().map(r -> " @|fg(red) [" + r + "]|@").orElse(""))));
    }

    /**
     * Prints {@code value} as indented JSON, ISO-8601 timestamps.
     */
    public static void json(Object value) {
        try {
            System.out.println(JSON.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render JSON: " + e.getMessage(), e);
        }
    }
}
