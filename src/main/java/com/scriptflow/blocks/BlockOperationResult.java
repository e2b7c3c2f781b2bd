package com.scriptflow.blocks;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.scriptflow.models.ScriptForest;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a block operation. On failure {@link #getForest()} is the
 * unchanged input forest.
 */
public class BlockOperationResult {
    private final boolean success;
    private final ScriptForest forest;
    private final OperationFailure reason;
    private final String message;
    private final String statementId;
    private final List<String> affectedIds;

    private BlockOperationResult(boolean success, ScriptForest forest, OperationFailure reason,
                                 String message, String statementId, List<String> affectedIds) {
        this.success = success;
        this.forest = forest;
        this.reason = reason;
        this.message = message;
        this.statementId = statementId;
        this.affectedIds = affectedIds != null ? affectedIds : Collections.emptyList();
    }

    public static BlockOperationResult ok(ScriptForest forest, String statementId) {
        return new BlockOperationResult(true, forest, null, null, statementId, null);
    }

    public static BlockOperationResult ok(ScriptForest forest, String statementId, List<String> affectedIds) {
        return new BlockOperationResult(true, forest, null, null, statementId, affectedIds);
    }

    public static BlockOperationResult failure(OperationFailure reason, ScriptForest unchanged, String message) {
        return new BlockOperationResult(false, unchanged, reason, message, null, null);
    }

    public boolean isSuccess() {
        return success;
    }

    @JsonIgnore
    public ScriptForest getForest() {
        return forest;
    }

    public OperationFailure getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    /**
     * The statement created, moved or updated; the first pasted statement for
     * pastes.
     */
    public String getStatementId() {
        return statementId;
    }

    /**
     * Ids of every statement removed by a delete.
     */
    public List<String> getAffectedIds() {
        return affectedIds;
    }

    @Override
    public String toString() {
        if (success) {
            return "BlockOperationResult{success, statement=" + statementId + "}";
        }
        return "BlockOperationResult{" + reason + ": " + message + "}";
    }
}
