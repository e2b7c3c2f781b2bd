package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class CallStatement extends Statement {

    private final String target;
    private final String arguments;

    @JsonCreator
    public CallStatement(@JsonProperty("id") String id,
                         @JsonProperty("target") String target,
                         @JsonProperty("arguments") String arguments) {
        super(id);
        this.target = target != null ? target : "";
        this.arguments = arguments;
    }

    public String getTarget() {
        return target;
    }

    public String getArguments() {
        return arguments;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.CALL;
    }

    @Override
    protected Statement withId(String newId) {
        return new CallStatement(newId, target, arguments);
    }
}
