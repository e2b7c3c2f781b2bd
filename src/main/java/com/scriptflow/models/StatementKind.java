package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of statement kinds. The tag is the wire name used in persisted
 * forests, block type tags and API payloads.
 */
public enum StatementKind {
    LABEL("label", BlockCategory.FLOW),
    DIALOGUE("dialogue", BlockCategory.DIALOGUE),
    SCENE("scene", BlockCategory.SCENE),
    SHOW("show", BlockCategory.SCENE),
    HIDE("hide", BlockCategory.SCENE),
    WITH("with", BlockCategory.SCENE),
    MENU("menu", BlockCategory.DIALOGUE),
    CHOICE("choice", BlockCategory.DIALOGUE),
    JUMP("jump", BlockCategory.FLOW),
    CALL("call", BlockCategory.FLOW),
    RETURN("return", BlockCategory.FLOW),
    IF("if", BlockCategory.FLOW),
    BRANCH("branch", BlockCategory.FLOW),
    SET("set", BlockCategory.ADVANCED),
    RAW_CODE("rawcode", BlockCategory.ADVANCED),
    PLAY("play", BlockCategory.AUDIO),
    STOP("stop", BlockCategory.AUDIO),
    PAUSE("pause", BlockCategory.SCENE),
    NVL("nvl", BlockCategory.DIALOGUE),
    DEFINE("define", BlockCategory.ADVANCED),
    DEFAULT("default", BlockCategory.ADVANCED);

    private final String tag;
    private final BlockCategory category;

    StatementKind(String tag, BlockCategory category) {
        this.tag = tag;
        this.category = category;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public BlockCategory getCategory() {
        return category;
    }

    /**
     * Kinds that own a body, a choice list or a branch list.
     */
    public boolean isContainer() {
        return this == LABEL || this == MENU || this == CHOICE || this == IF || this == BRANCH;
    }

    @JsonCreator
    public static StatementKind fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        String normalized = tag.trim().toLowerCase();
        for (StatementKind kind : values()) {
            if (kind.tag.equals(normalized) || kind.name().equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown statement kind: " + tag);
    }
}
