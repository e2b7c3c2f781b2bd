package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class ShowStatement extends Statement {

    private final String character;
    private final String position;
    private final String expression;

    @JsonCreator
    public ShowStatement(@JsonProperty("id") String id,
                         @JsonProperty("character") String character,
                         @JsonProperty("position") String position,
                         @JsonProperty("expression") String expression) {
        super(id);
        this.character = character != null ? character : "";
        this.position = position;
        this.expression = expression;
    }

    public String getCharacter() {
        return character;
    }

    public String getPosition() {
        return position;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.SHOW;
    }

    @Override
    protected Statement withId(String newId) {
        return new ShowStatement(newId, character, position, expression);
    }
}
