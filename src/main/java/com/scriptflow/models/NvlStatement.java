package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class NvlStatement extends Statement {

    public static final List<String> ACTIONS = List.of("show", "hide", "clear");

    private final String action;

    @JsonCreator
    public NvlStatement(@JsonProperty("id") String id,
                        @JsonProperty("action") String action) {
        super(id);
        this.action = action != null ? action : "clear";
    }

    public String getAction() {
        return action;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.NVL;
    }

    @Override
    protected Statement withId(String newId) {
        return new NvlStatement(newId, action);
    }
}
