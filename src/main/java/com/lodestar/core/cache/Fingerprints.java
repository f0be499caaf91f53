package com.lodestar.core.cache;

import com.lodestar.core.graph.DependencyEdge;
import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.ProjectSnapshot;
import com.lodestar.core.model.Task;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 fingerprints used as cache key components.
 */
public final class Fingerprints {

    private Fingerprints() {}

    /**
     * Hashes the root id; per file, path, size, tokens, modification time, kind, language and
     * metadata (keys sorted); and every dependency edge with its type and strength.
     * File order matters; the same provider output always yields the same fingerprint.
     */
    public static String project(ProjectSnapshot snapshot) {
        MessageDigest digest = sha256();
        update(digest, snapshot.rootId());
        for (FileRecord file : snapshot.files()) {
            update(digest, file.path());
            update(digest, Long.toString(file.sizeBytes()));
            update(digest, Integer.toString(file.tokenCount()));
            update(digest, Long.toString(file.lastModified().toEpochMilli()));
            update(digest, file.kind().name());
            update(digest, file.language());
            updateMetadata(digest, file.metadata());
        }
        for (DependencyEdge edge : snapshot.graph().edges()) {
            update(digest, edge.from());
            update(digest, edge.to());
            update(digest, edge.type().name());
            update(digest, Double.toString(edge.strength()));
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Hashes the task type, the whitespace-normalised lower-case description, the sorted
     * lower-case keywords, and the must-include list in order.
     */
    public static String task(Task task) {
        MessageDigest digest = sha256();
        update(digest, task.type().name());
        update(digest, task.description().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT));
        List<String> keywords = task.keywords().stream()
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .sorted()
                .toList();
        update(digest, String.join(",", keywords));
        update(digest, String.join(",", task.mustInclude()));
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void updateMetadata(MessageDigest digest, Map<String, Object> metadata) {
        update(digest, Integer.toString(metadata.size()));
        for (Map.Entry<String, Object> entry : new TreeMap<>(metadata).entrySet()) {
            update(digest, entry.getKey());
            update(digest, String.valueOf(canonical(entry.getValue())));
        }
    }

    /** Nested maps are rendered with sorted keys so equal metadata always hashes alike. */
    private static Object canonical(Object value) {
        if (value instanceof Map<?, ?> map) {
            var sorted = new TreeMap<String, Object>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonical(v)));
            return sorted;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(Fingerprints::canonical).toList();
        }
        return value;
    }

    private static void update(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
