package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Named entry point owning an ordered body. Labels only live at the top
 * level of a {@link ScriptForest}.
 */
public class LabelStatement extends Statement {

    private final String name;
    private final String parameters;
    private final List<Statement> body;

    @JsonCreator
    public LabelStatement(@JsonProperty("id") String id,
                          @JsonProperty("name") String name,
                          @JsonProperty("parameters") String parameters,
                          @JsonProperty("body") List<Statement> body) {
        super(id);
        this.name = name != null ? name : "";
        this.parameters = parameters;
        this.body = freeze(body);
    }

    public LabelStatement(String name, List<Statement> body) {
        this(null, name, null, body);
    }

    public String getName() {
        return name;
    }

    public String getParameters() {
        return parameters;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.LABEL;
    }

    @Override
    public List<Statement> childStatements() {
        return body;
    }

    @Override
    public LabelStatement withChildStatements(List<Statement> children) {
        return new LabelStatement(getId(), name, parameters, children);
    }

    @Override
    public boolean accepts(StatementKind childKind) {
        return acceptsInBody(childKind);
    }

    @Override
    protected Statement withId(String newId) {
        return new LabelStatement(newId, name, parameters, body);
    }

    @Override
    public String toString() {
        return "label " + name + "{" + getId() + ", " + body.size() + " statements}";
    }
}
