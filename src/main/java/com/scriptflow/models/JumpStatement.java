package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Transfers control to the label named by {@code target}. Targets are plain
 * label names resolved by lookup, never by a drawn edge.
 */
public class JumpStatement extends Statement {

    private final String target;

    @JsonCreator
    public JumpStatement(@JsonProperty("id") String id,
                         @JsonProperty("target") String target) {
        super(id);
        this.target = target != null ? target : "";
    }

    public JumpStatement(String target) {
        this(null, target);
    }

    public String getTarget() {
        return target;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.JUMP;
    }

    @Override
    protected Statement withId(String newId) {
        return new JumpStatement(newId, target);
    }
}
