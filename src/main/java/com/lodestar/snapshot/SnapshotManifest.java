package com.lodestar.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * On-disk description of a project, as written by an external analyzer.
 * Only {@code files[].path} is mandatory; everything else is derived when missing.
 *
 * @param root  project root identifier
 * @param files one entry per file
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotManifest(
    String root,
    List<Entry> files
) {

    public SnapshotManifest {
        files = files != null ? files : List.of();
    }

    /**
     * @param path         project-relative path
     * @param size         size in bytes
     * @param tokens       token estimate; counted from {@code content} when absent
     * @param lastModified ISO-8601 instant
     * @param kind         source, test, config, doc
     * @param language     language tag
     * @param imports      import specifiers, copied into the {@code imports} metadata entry
     * @param metadata     extra analyzer metadata such as {@code tags}
     * @param content      optional file text, used only to count tokens
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
        String path,
        Long size,
        Integer tokens,
        Instant lastModified,
        String kind,
        String language,
        List<String> imports,
        Map<String, Object> metadata,
        String content
    ) {}
}
