package com.lodestar.core.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable import/reference graph over the files of one snapshot.
 * <p>
 * Every edge endpoint is guaranteed to be a node; construction fails otherwise.
 * Instances are safe to share between concurrent selections.
 */
public final class DependencyGraph {

    private static final Comparator<DependencyEdge> EDGE_ORDER =
            Comparator.comparing(DependencyEdge::from)
                    .thenComparing(DependencyEdge::to)
                    .thenComparing(DependencyEdge::type);

    private static final DependencyGraph EMPTY = new DependencyGraph(List.of(), List.of());

    private final Map<String, DependencyNode> nodes;
    private final List<DependencyEdge> edges;
    private final Map<String, List<DependencyEdge>> outgoing;
    private final Map<String, List<DependencyEdge>> incoming;

    /**
     * @param nodePaths every file path in the snapshot
     * @param edges     relationships between those paths
     * @throws IllegalArgumentException if an edge references a path not in {@code nodePaths}
     */
    public DependencyGraph(Collection<String> nodePaths, Collection<DependencyEdge> edges) {
        var paths = new TreeSet<>(nodePaths);
        var sortedEdges = new ArrayList<>(edges);
        sortedEdges.sort(EDGE_ORDER);

        var out = new TreeMap<String, List<DependencyEdge>>();
        var in = new TreeMap<String, List<DependencyEdge>>();
        for (String path : paths) {
            out.put(path, new ArrayList<>());
            in.put(path, new ArrayList<>());
        }
        for (DependencyEdge edge : sortedEdges) {
            if (!paths.contains(edge.from()) || !paths.contains(edge.to())) {
                throw new IllegalArgumentException("Edge " + edge.from() + " -> " + edge.to()
                        + " references a file that is not a node");
            }
            out.get(edge.from()).add(edge);
            in.get(edge.to()).add(edge);
        }

        var nodeMap = new LinkedHashMap<String, DependencyNode>();
        for (String path : paths) {
            nodeMap.put(path, new DependencyNode(path,
                    out.get(path).stream().map(DependencyEdge::to).distinct().toList(),
                    in.get(path).stream().map(DependencyEdge::from).distinct().sorted().toList()));
        }

        this.nodes = Collections.unmodifiableMap(nodeMap);
        this.edges = List.copyOf(sortedEdges);
        this.outgoing = freeze(out);
        this.incoming = freeze(in);
    }

    public static DependencyGraph empty() {
        return EMPTY;
    }

    /**
     * A graph with the given nodes and no edges.
     */
    public static DependencyGraph isolated(Collection<String> nodePaths) {
        return new DependencyGraph(nodePaths, List.of());
    }

    public Map<String, DependencyNode> nodes() {
        return nodes;
    }

    public List<DependencyEdge> edges() {
        return edges;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String path) {
        return nodes.containsKey(path);
    }

    public Optional<DependencyNode> node(String path) {
        return Optional.ofNullable(nodes.get(path));
    }

    public List<String> dependenciesOf(String path) {
        DependencyNode node = nodes.get(path);
        return node != null ? node.dependencies() : List.of();
    }

    public List<String> dependentsOf(String path) {
        DependencyNode node = nodes.get(path);
        return node != null ? node.dependents() : List.of();
    }

    public List<DependencyEdge> edgesFrom(String path) {
        return outgoing.getOrDefault(path, List.of());
    }

    public List<DependencyEdge> edgesTo(String path) {
        return incoming.getOrDefault(path, List.of());
    }

    /**
     * Degree centrality weighting incoming edges double: {@code (2*in + out) / (3*(n-1))},
     * capped at 1. Files that many others depend on are the most central.
     * Unknown paths and single-node graphs score 0.
     */
    public double centrality(String path) {
        DependencyNode node = nodes.get(path);
        if (node == null || nodes.size() <= 1) {
            return 0.0;
        }
        double in = node.dependents().size();
        double out = node.dependencies().size();
        return Math.min(1.0, (in * 2 + out) / (3.0 * (nodes.size() - 1)));
    }

    private static Map<String, List<DependencyEdge>> freeze(Map<String, List<DependencyEdge>> source) {
        var copy = new LinkedHashMap<String, List<DependencyEdge>>();
        source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}
