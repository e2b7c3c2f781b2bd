package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One menu option: caption, optional guard condition and its own body.
 */
public class ChoiceStatement extends Statement {

    private final String text;
    private final String condition;
    private final List<Statement> body;

    @JsonCreator
    public ChoiceStatement(@JsonProperty("id") String id,
                           @JsonProperty("text") String text,
                           @JsonProperty("condition") String condition,
                           @JsonProperty("body") List<Statement> body) {
        super(id);
        this.text = text != null ? text : "";
        this.condition = condition;
        this.body = freeze(body);
    }

    public ChoiceStatement(String text, List<Statement> body) {
        this(null, text, null, body);
    }

    public String getText() {
        return text;
    }

    public String getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.CHOICE;
    }

    @Override
    public List<Statement> childStatements() {
        return body;
    }

    @Override
    public ChoiceStatement withChildStatements(List<Statement> children) {
        return new ChoiceStatement(getId(), text, condition, children);
    }

    @Override
    public boolean accepts(StatementKind childKind) {
        return acceptsInBody(childKind);
    }

    @Override
    protected Statement withId(String newId) {
        return new ChoiceStatement(newId, text, condition, body);
    }
}
