package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FlowEdgeType {
    SEQUENCE("sequence"),
    CHOICE("choice"),
    CONDITION("condition");

    private final String tag;

    FlowEdgeType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
