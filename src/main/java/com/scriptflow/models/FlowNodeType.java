package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FlowNodeType {
    SCENE("scene"),
    DIALOGUE_BLOCK("dialogue-block"),
    MENU("menu"),
    CONDITION("condition"),
    JUMP("jump"),
    CALL("call"),
    RETURN("return");

    private final String tag;

    FlowNodeType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static FlowNodeType fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        String normalized = tag.trim().toLowerCase();
        for (FlowNodeType type : values()) {
            if (type.tag.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown flow node type: " + tag);
    }
}
