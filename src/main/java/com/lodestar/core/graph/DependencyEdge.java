package com.lodestar.core.graph;

import java.util.Objects;

/**
 * A directed relationship {@code from -> to}, meaning {@code from} needs {@code to}.
 *
 * @param from     path of the depending file
 * @param to       path of the file depended upon
 * @param type     relationship kind
 * @param strength weight in [0,1]
 */
public record DependencyEdge(
    String from,
    String to,
    EdgeType type,
    double strength
) {

    public DependencyEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(type, "type");
        if (strength < 0.0 || strength > 1.0 || Double.isNaN(strength)) {
            throw new IllegalArgumentException("edge strength must be in [0,1], got " + strength);
        }
    }

    public static DependencyEdge imports(String from, String to) {
        return new DependencyEdge(from, to, EdgeType.IMPORT, 1.0);
    }
}
