package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class ReturnStatement extends Statement {

    private final String value;

    @JsonCreator
    public ReturnStatement(@JsonProperty("id") String id,
                           @JsonProperty("value") String value) {
        super(id);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.RETURN;
    }

    @Override
    protected Statement withId(String newId) {
        return new ReturnStatement(newId, value);
    }
}
