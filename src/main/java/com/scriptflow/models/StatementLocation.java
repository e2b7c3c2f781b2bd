package com.scriptflow.models;

/**
 * Where a statement sits: its parent container (null at the top level), its
 * index in that container's sequence and the name of the label that owns it.
 */
public class StatementLocation {
    private final String parentId;
    private final int index;
    private final String labelName;

    public StatementLocation(String parentId, int index, String labelName) {
        this.parentId = parentId;
        this.index = index;
        this.labelName = labelName;
    }

    public String getParentId() {
        return parentId;
    }

    public int getIndex() {
        return index;
    }

    public String getLabelName() {
        return labelName;
    }

    public boolean isTopLevel() {
        return parentId == null;
    }

    @Override
    public String toString() {
        return "StatementLocation{parent=" + parentId + ", index=" + index + ", label=" + labelName + "}";
    }
}
