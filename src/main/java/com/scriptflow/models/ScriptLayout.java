package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted editor state of one script, stored apart from its forest. Flow
 * positions are keyed by flow node id; block positions, collapsed and
 * selected entries by statement id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScriptLayout {

    private Map<String, NodePosition> nodePositions = new LinkedHashMap<>();
    private Map<String, NodePosition> blockPositions = new LinkedHashMap<>();
    private List<String> collapsed = new ArrayList<>();
    private List<String> selected = new ArrayList<>();
    private long updatedAt;

    public ScriptLayout() {
    }

    public Map<String, NodePosition> getNodePositions() {
        return nodePositions;
    }

    public void setNodePositions(Map<String, NodePosition> nodePositions) {
        this.nodePositions = nodePositions != null ? nodePositions : new LinkedHashMap<>();
    }

    public Map<String, NodePosition> getBlockPositions() {
        return blockPositions;
    }

    public void setBlockPositions(Map<String, NodePosition> blockPositions) {
        this.blockPositions = blockPositions != null ? blockPositions : new LinkedHashMap<>();
    }

    public List<String> getCollapsed() {
        return collapsed;
    }

    public void setCollapsed(List<String> collapsed) {
        this.collapsed = collapsed != null ? collapsed : new ArrayList<>();
    }

    public List<String> getSelected() {
        return selected;
    }

    public void setSelected(List<String> selected) {
        this.selected = selected != null ? selected : new ArrayList<>();
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * Drops statement-keyed entries whose statement no longer exists.
     * Returns true when anything was removed.
     */
    public boolean retainStatements(Collection<String> statementIds) {
        boolean changed = blockPositions.keySet().retainAll(statementIds);
        changed |= collapsed.retainAll(statementIds);
        changed |= selected.retainAll(statementIds);
        return changed;
    }

    /**
     * Drops flow positions whose node is no longer in the graph.
     */
    public boolean retainNodes(Collection<String> nodeIds) {
        return nodePositions.keySet().retainAll(nodeIds);
    }
}
