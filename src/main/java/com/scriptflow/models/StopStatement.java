package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class StopStatement extends Statement {

    private final String channel;
    private final Double fadeOut;

    @JsonCreator
    public StopStatement(@JsonProperty("id") String id,
                         @JsonProperty("channel") String channel,
                         @JsonProperty("fadeOut") Double fadeOut) {
        super(id);
        this.channel = channel != null ? channel : "music";
        this.fadeOut = fadeOut;
    }

    public String getChannel() {
        return channel;
    }

    public Double getFadeOut() {
        return fadeOut;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.STOP;
    }

    @Override
    protected Statement withId(String newId) {
        return new StopStatement(newId, channel, fadeOut);
    }
}
