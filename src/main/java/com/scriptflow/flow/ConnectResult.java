package com.scriptflow.flow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.scriptflow.blocks.OperationFailure;
import com.scriptflow.models.ScriptForest;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of drawing an edge in the flow surface. A connection either only
 * stages the edge in the pending pool or also writes statements into the
 * forest; {@link #isFolded()} tells which.
 */
public class ConnectResult {
    private final boolean success;
    private final boolean folded;
    private final ScriptForest forest;
    private final OperationFailure reason;
    private final String message;
    private final List<String> statementIds;
    private final String labelName;

    private ConnectResult(boolean success, boolean folded, ScriptForest forest, OperationFailure reason,
                          String message, List<String> statementIds, String labelName) {
        this.success = success;
        this.folded = folded;
        this.forest = forest;
        this.reason = reason;
        this.message = message;
        this.statementIds = statementIds != null ? statementIds : Collections.emptyList();
        this.labelName = labelName;
    }

    public static ConnectResult staged(ScriptForest unchanged) {
        return new ConnectResult(true, false, unchanged, null, null, null, null);
    }

    public static ConnectResult folded(ScriptForest forest, List<String> statementIds, String labelName) {
        return new ConnectResult(true, true, forest, null, null, statementIds, labelName);
    }

    public static ConnectResult failure(OperationFailure reason, ScriptForest unchanged, String message) {
        return new ConnectResult(false, false, unchanged, reason, message, null, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFolded() {
        return folded;
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
     * Top-level ids of the statements written into the forest, in order.
     */
    public List<String> getStatementIds() {
        return statementIds;
    }

    public String getLabelName() {
        return labelName;
    }
}
