package com.lodestar.core.graph;

import java.util.List;

/**
 * A file in the dependency graph.
 *
 * @param path         file path
 * @param dependencies paths this file depends on (outgoing edges), sorted
 * @param dependents   paths that depend on this file (incoming edges), sorted
 */
public record DependencyNode(
    String path,
    List<String> dependencies,
    List<String> dependents
) {

    public DependencyNode {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        dependents = dependents != null ? List.copyOf(dependents) : List.of();
    }

    public boolean isIsolated() {
        return dependencies.isEmpty() && dependents.isEmpty();
    }
}
