package com.lodestar.core.graph;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A built graph plus the files whose relationships could not be resolved.
 *
 * @param graph    the dependency graph; failed files are present as isolated nodes
 * @param failures failure message keyed by file path, sorted by path
 */
public record GraphBuildResult(
    DependencyGraph graph,
    Map<String, String> failures
) {

    public GraphBuildResult {
        failures = failures != null ? Collections.unmodifiableMap(new TreeMap<>(failures)) : Map.of();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
