package com.scriptflow.blocks;

/**
 * One advisory diagnostic on a block slot.
 */
public class ValidationIssue {

    public enum Type {
        REQUIRED,
        INVALID_TARGET,
        SYNTAX,
        RULE
    }

    private final Type type;
    private final String statementId;
    private final String blockId;
    private final String slotName;
    private final String message;

    public ValidationIssue(Type type, String statementId, String blockId, String slotName, String message) {
        this.type = type;
        this.statementId = statementId;
        this.blockId = blockId;
        this.slotName = slotName;
        this.message = message;
    }

    public Type getType() {
        return type;
    }

    public String getStatementId() {
        return statementId;
    }

    public String getBlockId() {
        return blockId;
    }

    public String getSlotName() {
        return slotName;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return type + " " + statementId + "." + slotName + ": " + message;
    }
}
