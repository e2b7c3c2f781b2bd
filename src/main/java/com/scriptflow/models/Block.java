package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Block-editor projection of one statement. The block id is regenerated on
 * every build; {@code statementId} is the stable key. An empty
 * {@code statementId} marks a block that is not backed by a statement
 * (template contents).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Block {

    private String id;
    private StatementKind type;
    private BlockCategory category;
    private String statementId;
    private boolean container;
    private List<BlockSlot> slots = new ArrayList<>();
    private List<Block> children = new ArrayList<>();
    private boolean collapsed;
    private boolean selected;
    private boolean hasError;

    public Block() {
    }

    public Block(String id, StatementKind type, String statementId) {
        this.id = id;
        this.type = type;
        this.category = type != null ? type.getCategory() : null;
        this.statementId = statementId != null ? statementId : "";
        this.container = type != null && type.isContainer();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public StatementKind getType() {
        return type;
    }

    public void setType(StatementKind type) {
        this.type = type;
    }

    public BlockCategory getCategory() {
        return category;
    }

    public void setCategory(BlockCategory category) {
        this.category = category;
    }

    public String getStatementId() {
        return statementId;
    }

    public void setStatementId(String statementId) {
        this.statementId = statementId;
    }

    public boolean isContainer() {
        return container;
    }

    public void setContainer(boolean container) {
        this.container = container;
    }

    public List<BlockSlot> getSlots() {
        return slots;
    }

    public void setSlots(List<BlockSlot> slots) {
        this.slots = slots != null ? slots : new ArrayList<>();
    }

    public List<Block> getChildren() {
        return children;
    }

    public void setChildren(List<Block> children) {
        this.children = children != null ? children : new ArrayList<>();
    }

    public boolean isCollapsed() {
        return collapsed;
    }

    public void setCollapsed(boolean collapsed) {
        this.collapsed = collapsed;
    }

    public boolean isSelected() {
        return selected;
    }

    public void setSelected(boolean selected) {
        this.selected = selected;
    }

    public boolean isHasError() {
        return hasError;
    }

    public void setHasError(boolean hasError) {
        this.hasError = hasError;
    }

    public BlockSlot getSlot(String name) {
        for (BlockSlot slot : slots) {
            if (slot.getName().equals(name)) {
                return slot;
            }
        }
        return null;
    }

    public Object getSlotValue(String name) {
        BlockSlot slot = getSlot(name);
        return slot != null ? slot.getValue() : null;
    }

    @Override
    public String toString() {
        return "Block{" + type + ", statement=" + statementId + ", children=" + children.size() + "}";
    }
}
