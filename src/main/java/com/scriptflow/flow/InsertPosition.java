package com.scriptflow.flow;

/**
 * Where a node sits in its label's flow: the owning label and its nearest
 * neighbours along incoming and sequence edges.
 */
public class InsertPosition {
    private final String labelName;
    private final String afterNodeId;
    private final String beforeNodeId;

    public InsertPosition(String labelName, String afterNodeId, String beforeNodeId) {
        this.labelName = labelName;
        this.afterNodeId = afterNodeId;
        this.beforeNodeId = beforeNodeId;
    }

    public String getLabelName() {
        return labelName;
    }

    public String getAfterNodeId() {
        return afterNodeId;
    }

    public String getBeforeNodeId() {
        return beforeNodeId;
    }
}
