package com.scriptflow.flow;

import com.scriptflow.models.FlowEdge;
import com.scriptflow.models.FlowGraph;
import com.scriptflow.models.FlowNode;

import java.util.List;

/**
 * What the graph surface renders: statement-backed nodes merged with the
 * pending ones, positioned, plus the soundness report for that graph.
 */
public class FlowView {

    private final FlowGraph graph;
    private final GraphDiagnostics diagnostics;

    public FlowView(FlowGraph graph, GraphDiagnostics diagnostics) {
        this.graph = graph;
        this.diagnostics = diagnostics;
    }

    public List<FlowNode> getNodes() {
        return graph.getNodes();
    }

    public List<FlowEdge> getEdges() {
        return graph.getEdges();
    }

    public GraphDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
