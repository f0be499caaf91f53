package com.lodestar.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A single file of an analysed project, as produced by the snapshot provider.
 *
 * @param path         project-relative path, unique within a snapshot
 * @param sizeBytes    size on disk in bytes
 * @param tokenCount   estimated model tokens for the whole file
 * @param lastModified last modification instant
 * @param kind         coarse file classification
 * @param language     language tag (e.g. "go", "java", "markdown"), never null
 * @param metadata     free-form analyzer metadata; see {@link #METADATA_IMPORTS} and {@link #METADATA_TAGS}
 */
public record FileRecord(
    String path,
    long sizeBytes,
    int tokenCount,
    Instant lastModified,
    FileKind kind,
    String language,
    Map<String, Object> metadata
) {

    /** Metadata key holding the file's import specifiers (a list of strings). */
    public static final String METADATA_IMPORTS = "imports";

    /** Metadata key holding extra keywords describing the file (a list of strings). */
    public static final String METADATA_TAGS = "tags";

    private static final Map<String, String> LANGUAGE_BY_EXTENSION = Map.ofEntries(
            Map.entry("go", "go"),
            Map.entry("js", "javascript"), Map.entry("jsx", "javascript"),
            Map.entry("ts", "typescript"), Map.entry("tsx", "typescript"),
            Map.entry("py", "python"),
            Map.entry("java", "java"),
            Map.entry("kt", "kotlin"),
            Map.entry("c", "c++"), Map.entry("cc", "c++"), Map.entry("cpp", "c++"), Map.entry("cxx", "c++"),
            Map.entry("h", "c++"), Map.entry("hpp", "c++"),
            Map.entry("rs", "rust"),
            Map.entry("md", "markdown"), Map.entry("mdx", "markdown"),
            Map.entry("yml", "yaml"), Map.entry("yaml", "yaml"),
            Map.entry("json", "json"),
            Map.entry("xml", "xml"),
            Map.entry("sh", "shell")
    );

    public FileRecord {
        Objects.requireNonNull(path, "path");
        if (path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0 for " + path);
        }
        if (tokenCount < 0) {
            throw new IllegalArgumentException("tokenCount must be >= 0 for " + path);
        }
        lastModified = lastModified != null ? lastModified : Instant.EPOCH;
        kind = kind != null ? kind : FileKind.UNKNOWN;
        language = language != null && !language.isBlank() ? language.toLowerCase(Locale.ROOT) : "unknown";
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Convenience factory that derives kind and language from the path.
     */
    public static FileRecord of(String path, int tokenCount, Instant lastModified) {
        return new FileRecord(path, tokenCount * 4L, tokenCount, lastModified,
                FileKind.detect(path), languageOf(path), Map.of());
    }

    /**
     * Maps a path's extension to a language tag, "unknown" when unrecognised.
     */
    public static String languageOf(String path) {
        if (path == null) {
            return "unknown";
        }
        String name = path.substring(path.replace('\\', '/').lastIndexOf('/') + 1);
        return LANGUAGE_BY_EXTENSION.getOrDefault(FileKind.extensionOf(name), "unknown");
    }

    /** The final path segment. */
    public String fileName() {
        String normalized = path.replace('\\', '/');
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }

    /** The directory part of the path, empty for files at the project root. */
    public String directory() {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? "" : normalized.substring(0, slash);
    }

    public FileRecord withMetadata(Map<String, Object> newMetadata) {
        return new FileRecord(path, sizeBytes, tokenCount, lastModified, kind, language, newMetadata);
    }
}
