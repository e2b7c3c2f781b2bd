package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class PlayStatement extends Statement {

    public static final List<String> CHANNELS = List.of("music", "sound", "voice");

    private final String channel;
    private final String file;
    private final Double fadeIn;
    private final boolean loop;

    @JsonCreator
    public PlayStatement(@JsonProperty("id") String id,
                         @JsonProperty("channel") String channel,
                         @JsonProperty("file") String file,
                         @JsonProperty("fadeIn") Double fadeIn,
                         @JsonProperty("loop") boolean loop) {
        super(id);
        this.channel = channel != null ? channel : "music";
        this.file = file != null ? file : "";
        this.fadeIn = fadeIn;
        this.loop = loop;
    }

    public String getChannel() {
        return channel;
    }

    public String getFile() {
        return file;
    }

    public Double getFadeIn() {
        return fadeIn;
    }

    public boolean isLoop() {
        return loop;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.PLAY;
    }

    @Override
    protected Statement withId(String newId) {
        return new PlayStatement(newId, channel, file, fadeIn, loop);
    }
}
