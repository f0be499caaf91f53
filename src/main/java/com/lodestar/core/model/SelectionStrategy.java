package com.lodestar.core.model;

import java.util.Locale;

/**
 * Ordering policy applied while packing files into the token budget.
 */
public enum SelectionStrategy {
    /** Pure relevance score order. */
    RELEVANCE,
    /** Relevance re-ranked by graph centrality, with direct dependencies pulled in. */
    DEPENDENCY,
    /** Relevance blended with file freshness. */
    FRESHNESS,
    /** Relevance per token, favouring many small files. */
    COMPACTNESS,
    /** Equal blend of relevance and compactness. */
    BALANCED;

    public static SelectionStrategy fromString(String value) {
        if (value == null || value.isBlank()) {
            return BALANCED;
        }
        return SelectionStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
