package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BlockCategory {
    SCENE("scene"),
    DIALOGUE("dialogue"),
    FLOW("flow"),
    AUDIO("audio"),
    ADVANCED("advanced");

    private final String tag;

    BlockCategory(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
