package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One arm of an {@link IfStatement}. A null condition marks the else arm.
 */
public class BranchStatement extends Statement {

    private final String condition;
    private final List<Statement> body;

    @JsonCreator
    public BranchStatement(@JsonProperty("id") String id,
                           @JsonProperty("condition") String condition,
                           @JsonProperty("body") List<Statement> body) {
        super(id);
        this.condition = condition;
        this.body = freeze(body);
    }

    public BranchStatement(String condition, List<Statement> body) {
        this(null, condition, body);
    }

    public String getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.BRANCH;
    }

    @Override
    public List<Statement> childStatements() {
        return body;
    }

    @Override
    public BranchStatement withChildStatements(List<Statement> children) {
        return new BranchStatement(getId(), condition, children);
    }

    @Override
    public boolean accepts(StatementKind childKind) {
        return acceptsInBody(childKind);
    }

    @Override
    protected Statement withId(String newId) {
        return new BranchStatement(newId, condition, body);
    }
}
