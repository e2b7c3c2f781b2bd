package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Waits for {@code duration} seconds, or for a click when the duration is null.
 */
public class PauseStatement extends Statement {

    private final Double duration;

    @JsonCreator
    public PauseStatement(@JsonProperty("id") String id,
                          @JsonProperty("duration") Double duration) {
        super(id);
        this.duration = duration;
    }

    public Double getDuration() {
        return duration;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.PAUSE;
    }

    @Override
    protected Statement withId(String newId) {
        return new PauseStatement(newId, duration);
    }
}
