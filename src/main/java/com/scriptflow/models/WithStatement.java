package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Standalone transition directive.
 */
public class WithStatement extends Statement {

    private final String transition;

    @JsonCreator
    public WithStatement(@JsonProperty("id") String id,
                         @JsonProperty("transition") String transition) {
        super(id);
        this.transition = transition != null ? transition : "";
    }

    public String getTransition() {
        return transition;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.WITH;
    }

    @Override
    protected Statement withId(String newId) {
        return new WithStatement(newId, transition);
    }
}
