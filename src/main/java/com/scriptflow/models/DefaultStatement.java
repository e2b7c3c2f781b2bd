package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class DefaultStatement extends Statement {

    private final String name;
    private final String value;

    @JsonCreator
    public DefaultStatement(@JsonProperty("id") String id,
                            @JsonProperty("name") String name,
                            @JsonProperty("value") String value) {
        super(id);
        this.name = name != null ? name : "";
        this.value = value != null ? value : "";
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.DEFAULT;
    }

    @Override
    protected Statement withId(String newId) {
        return new DefaultStatement(newId, name, value);
    }
}
