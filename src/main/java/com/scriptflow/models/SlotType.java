package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SlotType {
    TEXT("text"),
    MULTILINE("multiline"),
    SELECT("select"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    TARGET("target"),
    EXPRESSION("expression"),
    CODE("code");

    private final String tag;

    SlotType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
