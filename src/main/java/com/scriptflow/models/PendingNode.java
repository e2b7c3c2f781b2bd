package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A flow node drawn in the graph surface that has no statement yet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PendingNode {

    private String id;
    private FlowNodeType type;
    private PendingNodeStatus status = PendingNodeStatus.CREATED;
    private FlowNodeData data = new FlowNodeData();
    private NodePosition position;
    private String sourceNodeId;
    private String sourceHandle;
    private String statementId;
    private String labelName;
    private long createdAt;

    public PendingNode() {
    }

    public PendingNode(String id, FlowNodeType type, FlowNodeData data, NodePosition position) {
        this.id = id;
        this.type = type;
        this.data = data != null ? data : new FlowNodeData();
        this.position = position;
        this.createdAt = System.currentTimeMillis();
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

    public PendingNodeStatus getStatus() {
        return status;
    }

    public void setStatus(PendingNodeStatus status) {
        this.status = status;
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

    public String getSourceNodeId() {
        return sourceNodeId;
    }

    public void setSourceNodeId(String sourceNodeId) {
        this.sourceNodeId = sourceNodeId;
    }

    public String getSourceHandle() {
        return sourceHandle;
    }

    public void setSourceHandle(String sourceHandle) {
        this.sourceHandle = sourceHandle;
    }

    public String getStatementId() {
        return statementId;
    }

    public void setStatementId(String statementId) {
        this.statementId = statementId;
    }

    public String getLabelName() {
        return labelName;
    }

    public void setLabelName(String labelName) {
        this.labelName = labelName;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public PendingNode copy() {
        PendingNode copy = new PendingNode(id, type, data.copy(),
            position != null ? new NodePosition(position.getX(), position.getY()) : null);
        copy.status = status;
        copy.sourceNodeId = sourceNodeId;
        copy.sourceHandle = sourceHandle;
        copy.statementId = statementId;
        copy.labelName = labelName;
        copy.createdAt = createdAt;
        return copy;
    }

    /**
     * Graph view of this entry, for merging into a built graph.
     */
    public FlowNode toFlowNode() {
        FlowNode node = new FlowNode(id, type, null);
        node.setData(data.copy());
        node.setPosition(position);
        node.setLabelName(labelName);
        node.setPending(true);
        return node;
    }

    @Override
    public String toString() {
        return "PendingNode{" + id + ", " + type + ", " + status + "}";
    }
}
