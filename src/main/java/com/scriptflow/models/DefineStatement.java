package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class DefineStatement extends Statement {

    private final String name;
    private final String value;
    private final String store;

    @JsonCreator
    public DefineStatement(@JsonProperty("id") String id,
                           @JsonProperty("name") String name,
                           @JsonProperty("value") String value,
                           @JsonProperty("store") String store) {
        super(id);
        this.name = name != null ? name : "";
        this.value = value != null ? value : "";
        this.store = store;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public String getStore() {
        return store;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.DEFINE;
    }

    @Override
    protected Statement withId(String newId) {
        return new DefineStatement(newId, name, value, store);
    }
}
