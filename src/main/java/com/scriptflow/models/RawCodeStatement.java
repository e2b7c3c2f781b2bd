package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inline code kept verbatim.
 */
public class RawCodeStatement extends Statement {

    private final String code;

    @JsonCreator
    public RawCodeStatement(@JsonProperty("id") String id,
                            @JsonProperty("code") String code) {
        super(id);
        this.code = code != null ? code : "";
    }

    public String getCode() {
        return code;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.RAW_CODE;
    }

    @Override
    protected Statement withId(String newId) {
        return new RawCodeStatement(newId, code);
    }
}
