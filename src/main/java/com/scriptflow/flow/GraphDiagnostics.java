package com.scriptflow.flow;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory findings over one graph, recomputed from scratch on every build.
 */
public class GraphDiagnostics {
    private final List<String> orphanNodeIds;
    private final List<String> invalidTargetNodeIds;
    private final List<List<String>> cycles;

    public GraphDiagnostics(List<String> orphanNodeIds, List<String> invalidTargetNodeIds, List<List<String>> cycles) {
        this.orphanNodeIds = orphanNodeIds != null ? orphanNodeIds : new ArrayList<>();
        this.invalidTargetNodeIds = invalidTargetNodeIds != null ? invalidTargetNodeIds : new ArrayList<>();
        this.cycles = cycles != null ? cycles : new ArrayList<>();
    }

    public List<String> getOrphanNodeIds() {
        return orphanNodeIds;
    }

    public List<String> getInvalidTargetNodeIds() {
        return invalidTargetNodeIds;
    }

    public List<List<String>> getCycles() {
        return cycles;
    }

    public boolean isClean() {
        return orphanNodeIds.isEmpty() && invalidTargetNodeIds.isEmpty() && cycles.isEmpty();
    }
}
