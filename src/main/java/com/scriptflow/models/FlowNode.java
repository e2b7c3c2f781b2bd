package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Flow-graph projection of one statement, or of a run of statements for
 * dialogue blocks. Ids are derived from the first statement's id so rebuilds
 * yield the same node set. Pending nodes have no statement yet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowNode {

    private String id;
    private FlowNodeType type;
    private String statementId;
    private List<String> statementIds = new ArrayList<>();
    private String labelName;
    private FlowNodeData data = new FlowNodeData();
    private NodePosition position;
    private boolean pending;

    public FlowNode() {
    }

    public FlowNode(String id, FlowNodeType type, String statementId) {
        this.id = id;
        this.type = type;
        this.statementId = statementId;
        if (statementId != null && !statementId.isEmpty()) {
            this.statementIds.add(statementId);
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public FlowNodeType getType() {
        return type;
    }

    public void setType(FlowNodeType type) {
        this.type = type;
    }

    public String getStatementId() {
        return statementId;
    }

    public void setStatementId(String statementId) {
        this.statementId = statementId;
    }

    public List<String> getStatementIds() {
        return statementIds;
    }

    public void setStatementIds(List<String> statementIds) {
        this.statementIds = statementIds != null ? statementIds : new ArrayList<>();
    }

    public String getLabelName() {
        return labelName;
    }

    public void setLabelName(String labelName) {
        this.labelName = labelName;
    }

    public FlowNodeData getData() {
        return data;
    }

    public void setData(FlowNodeData data) {
        this.data = data != null ? data : new FlowNodeData();
    }

    public NodePosition getPosition() {
        return position;
    }

    public void setPosition(NodePosition position) {
        this.position = position;
    }

    public boolean isPending() {
        return pending;
    }

    public void setPending(boolean pending) {
        this.pending = pending;
    }

    @Override
    public String toString() {
        return "FlowNode{" + id + ", " + type + "}";
    }
}
