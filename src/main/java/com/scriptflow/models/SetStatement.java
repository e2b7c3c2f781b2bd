package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Variable assignment. The value is an opaque expression.
 */
public class SetStatement extends Statement {

    public static final List<String> OPERATORS = List.of("=", "+=", "-=", "*=", "/=");

    private final String variable;
    private final String operator;
    private final String value;

    @JsonCreator
    public SetStatement(@JsonProperty("id") String id,
                        @JsonProperty("variable") String variable,
                        @JsonProperty("operator") String operator,
                        @JsonProperty("value") String value) {
        super(id);
        this.variable = variable != null ? variable : "";
        this.operator = operator != null ? operator : "=";
        this.value = value != null ? value : "";
    }

    public String getVariable() {
        return variable;
    }

    public String getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.SET;
    }

    @Override
    protected Statement withId(String newId) {
        return new SetStatement(newId, variable, operator, value);
    }
}
