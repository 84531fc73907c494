package com.z254.horizon.domain.model;

import java.util.List;
import java.util.Set;

/**
 * Read-only view of the pattern relationship graph.
 */
public record PatternGraph(Set<String> nodes, List<PatternEdge> edges) {

    /**
     * Ratio of edges to the number of possible undirected edges.
     */
    public double complexity() {
        int n = nodes.size();
        if (n < 2) {
            return 0.0;
        }
        double maxEdges = n * (n - 1) / 2.0;
        return edges.size() / maxEdges;
    }
}
