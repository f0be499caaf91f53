package com.lodestar.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lodestar.core.graph.DependencyGraphBuilder;
import com.lodestar.core.graph.GraphBuildResult;
import com.lodestar.core.metrics.ContextMetrics;
import com.lodestar.core.model.FileKind;
import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.ProjectSnapshot;
import com.lodestar.core.tokens.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * Reads a JSON manifest into a {@link ProjectSnapshot}.
 * <p>
 * The manifest is produced by an external analyzer; this class never walks a directory.
 * Missing kinds and languages are derived from the path, missing token counts from the
 * optional {@code content} field (or the byte size when there is no content). Import
 * specifiers are resolved into a dependency graph; files whose imports cannot be resolved
 * stay in the snapshot as isolated nodes.
 */
@Service
public class JsonSnapshotProvider implements ProjectSnapshotProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonSnapshotProvider.class);

    /** Rough bytes-per-token ratio used when neither tokens nor content are given. */
    static final int BYTES_PER_TOKEN = 4;

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final DependencyGraphBuilder graphBuilder;
    private final TokenCounter tokenCounter;
    private final ContextMetrics metrics;

    @Autowired
    public JsonSnapshotProvider(DependencyGraphBuilder graphBuilder, TokenCounter tokenCounter,
                                ContextMetrics metrics) {
        this.graphBuilder = graphBuilder;
        this.tokenCounter = tokenCounter;
        this.metrics = metrics;
    }

    public JsonSnapshotProvider(DependencyGraphBuilder graphBuilder, TokenCounter tokenCounter) {
        this(graphBuilder, tokenCounter, null);
    }

    /**
     * @param source path of the manifest file
     */
    @Override
    public ProjectSnapshot snapshot(String source) {
        Path path = Path.of(source);
        if (!Files.isRegularFile(path)) {
            throw new SnapshotException("Manifest not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            SnapshotManifest manifest = mapper.readValue(in, SnapshotManifest.class);
            String root = manifest.root() != null && !manifest.root().isBlank()
                    ? manifest.root()
                    : path.toAbsolutePath().getParent().toString();
            return toSnapshot(root, manifest);
        } catch (IOException e) {
            throw new SnapshotException("Failed to read manifest " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a manifest held in memory.
     */
    public ProjectSnapshot parse(String json, String defaultRoot) {
        try {
            SnapshotManifest manifest = mapper.readValue(json, SnapshotManifest.class);
            String root = manifest.root() != null && !manifest.root().isBlank() ? manifest.root() : defaultRoot;
            return toSnapshot(root, manifest);
        } catch (IOException e) {
            throw new SnapshotException("Malformed manifest: " + e.getMessage(), e);
        }
    }

    ProjectSnapshot toSnapshot(String root, SnapshotManifest manifest) {
        var files = new ArrayList<FileRecord>(manifest.files().size());
        for (int i = 0; i < manifest.files().size(); i++) {
            SnapshotManifest.Entry entry = manifest.files().get(i);
            if (entry == null) {
                throw new SnapshotException("Manifest entry " + i + " of " + root + " is null");
            }
            files.add(toRecord(entry));
        }

        GraphBuildResult result = graphBuilder.analyze(files);
        if (result.hasFailures()) {
            result.failures().forEach((file, reason) -> {
                log.warn("Dependency analysis failed for {}: {}", file, reason);
                if (metrics != null) {
                    metrics.recordPartialFailure("graph");
                }
            });
        }

        try {
            ProjectSnapshot snapshot = ProjectSnapshot.of(root, files, result.graph());
            log.info("Loaded snapshot {}: {} files, {} tokens, {} dependency edges",
                    root, snapshot.fileCount(), snapshot.totalTokens(), snapshot.graph().edges().size());
            return snapshot;
        } catch (IllegalArgumentException e) {
            throw new SnapshotException(e.getMessage(), e);
        }
    }

    private FileRecord toRecord(SnapshotManifest.Entry entry) {
        if (entry.path() == null || entry.path().isBlank()) {
            throw new SnapshotException("Manifest entry without a path");
        }
        String language = entry.language() != null && !entry.language().isBlank()
                ? entry.language()
                : FileRecord.languageOf(entry.path());
        FileKind kind = entry.kind() != null && !entry.kind().isBlank()
                ? FileKind.fromString(entry.kind())
                : FileKind.detect(entry.path());

        long size = entry.size() != null ? entry.size()
                : entry.content() != null ? entry.content().length() : 0L;
        int tokens;
        if (entry.tokens() != null) {
            tokens = entry.tokens();
        } else if (entry.content() != null) {
            tokens = tokenCounter.count(entry.content(), language);
        } else {
            tokens = (int) Math.min(Integer.MAX_VALUE, size / BYTES_PER_TOKEN);
        }

        var metadata = new LinkedHashMap<String, Object>();
        if (entry.metadata() != null) {
            metadata.putAll(entry.metadata());
        }
        if (entry.imports() != null && !entry.imports().isEmpty()) {
            metadata.put(FileRecord.METADATA_IMPORTS, entry.imports().stream().filter(Objects::nonNull).toList());
        }

        try {
            return new FileRecord(entry.path(), size, tokens, entry.lastModified(), kind, language, metadata);
        } catch (IllegalArgumentException e) {
            throw new SnapshotException("Invalid manifest entry " + entry.path() + ": " + e.getMessage(), e);
        }
    }
}
