package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A spoken or narrated line. A null speaker means narration.
 */
public class DialogueStatement extends Statement {

    private final String speaker;
    private final String text;
    private final String attributes;

    @JsonCreator
    public DialogueStatement(@JsonProperty("id") String id,
                             @JsonProperty("speaker") String speaker,
                             @JsonProperty("text") String text,
                             @JsonProperty("attributes") String attributes) {
        super(id);
        this.speaker = speaker;
        this.text = text != null ? text : "";
        this.attributes = attributes;
    }

    public DialogueStatement(String speaker, String text) {
        this(null, speaker, text, null);
    }

    public String getSpeaker() {
        return speaker;
    }

    public String getText() {
        return text;
    }

    public String getAttributes() {
        return attributes;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.DIALOGUE;
    }

    @Override
    protected Statement withId(String newId) {
        return new DialogueStatement(newId, speaker, text, attributes);
    }
}
