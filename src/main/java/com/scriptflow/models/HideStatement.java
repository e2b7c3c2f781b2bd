package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class HideStatement extends Statement {

    private final String character;

    @JsonCreator
    public HideStatement(@JsonProperty("id") String id,
                         @JsonProperty("character") String character) {
        super(id);
        this.character = character != null ? character : "";
    }

    public String getCharacter() {
        return character;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.HIDE;
    }

    @Override
    protected Statement withId(String newId) {
        return new HideStatement(newId, character);
    }
}
