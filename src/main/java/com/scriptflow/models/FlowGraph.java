package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowGraph {

    private List<FlowNode> nodes = new ArrayList<>();
    private List<FlowEdge> edges = new ArrayList<>();

    public FlowGraph() {
    }

    public FlowGraph(List<FlowNode> nodes, List<FlowEdge> edges) {
        setNodes(nodes);
        setEdges(edges);
    }

    public List<FlowNode> getNodes() {
        return nodes;
    }

    public void setNodes(List<FlowNode> nodes) {
        this.nodes = nodes != null ? nodes : new ArrayList<>();
    }

    public List<FlowEdge> getEdges() {
        return edges;
    }

    public void setEdges(List<FlowEdge> edges) {
        this.edges = edges != null ? edges : new ArrayList<>();
    }

    public FlowNode findNode(String nodeId) {
        if (nodeId == null) {
            return null;
        }
        for (FlowNode node : nodes) {
            if (nodeId.equals(node.getId())) {
                return node;
            }
        }
        return null;
    }

    /**
     * Copy with the given extra nodes and edges appended. Edges whose id is
     * already present are skipped.
     */
    public FlowGraph merge(List<FlowNode> extraNodes, List<FlowEdge> extraEdges) {
        List<FlowNode> mergedNodes = new ArrayList<>(nodes);
        if (extraNodes != null) {
            mergedNodes.addAll(extraNodes);
        }
        List<FlowEdge> mergedEdges = new ArrayList<>(edges);
        if (extraEdges != null) {
            for (FlowEdge edge : extraEdges) {
                boolean duplicate = false;
                for (FlowEdge existing : mergedEdges) {
                    if (existing.getId().equals(edge.getId())) {
                        duplicate = true;
                        break;
                    }
                }
                if (!duplicate) {
                    mergedEdges.add(edge);
                }
            }
        }
        return new FlowGraph(mergedNodes, mergedEdges);
    }
}
