package com.lodestar.core.model;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A coding task that context is being selected for.
 *
 * @param type        task type tag
 * @param description free-text description of the task
 * @param keywords    explicit keywords; when empty, keywords are extracted from the description
 * @param mustInclude paths that must appear in the selection regardless of score or budget
 */
public record Task(
    TaskType type,
    String description,
    List<String> keywords,
    List<String> mustInclude
) {

    public Task {
        type = type != null ? type : TaskType.GENERAL;
        description = description != null ? description : "";
        keywords = keywords != null ? keywords.stream().filter(Objects::nonNull).toList() : List.of();
        mustInclude = mustInclude != null ? mustInclude.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public static Task of(TaskType type, String description) {
        return new Task(type, description, List.of(), List.of());
    }

    public Task withKeywords(List<String> newKeywords) {
        return new Task(type, description, newKeywords, mustInclude);
    }

    public Task withMustInclude(List<String> paths) {
        return new Task(type, description, keywords, paths);
    }

    public boolean hasMustInclude() {
        return !mustInclude.isEmpty();
    }

    /**
     * True when {@code path} is named by one of the must-include entries, judging the path on
     * its own. Use {@link #resolveMustInclude} when the other project paths are known.
     */
    public boolean isMustInclude(String path) {
        return mustInclude.stream().anyMatch(entry -> pathMatches(path, entry));
    }

    /**
     * The paths among {@code paths} that the must-include entries name, one per entry,
     * in entry order. See {@link #resolve}.
     */
    public Set<String> resolveMustInclude(Collection<String> paths) {
        var resolved = new LinkedHashSet<String>();
        for (String entry : mustInclude) {
            resolve(entry, paths).ifPresent(resolved::add);
        }
        return resolved;
    }

    /**
     * The single path an entry names: the path equal to it, otherwise the shortest path it is a
     * suffix of (lexical order breaks ties).
     */
    public static Optional<String> resolve(String entry, Collection<String> paths) {
        if (paths.contains(entry)) {
            return Optional.of(entry);
        }
        return paths.stream()
                .filter(path -> pathMatches(path, entry))
                .min(Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()));
    }

    /**
     * A path matches an entry when they are equal or the path ends with {@code "/" + entry}.
     * Backslashes and leading {@code ./} are ignored on both sides.
     */
    public static boolean pathMatches(String path, String entry) {
        String p = normalize(path);
        String wanted = normalize(entry);
        return !wanted.isEmpty() && (p.equals(wanted) || p.endsWith("/" + wanted));
    }

    private static String normalize(String path) {
        String p = path.trim().replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        return p;
    }
}
