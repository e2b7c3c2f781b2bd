package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class SceneStatement extends Statement {

    private final String image;
    private final String transition;
    private final String layer;

    @JsonCreator
    public SceneStatement(@JsonProperty("id") String id,
                          @JsonProperty("image") String image,
                          @JsonProperty("transition") String transition,
                          @JsonProperty("layer") String layer) {
        super(id);
        this.image = image != null ? image : "";
        this.transition = transition;
        this.layer = layer;
    }

    public SceneStatement(String image) {
        this(null, image, null, null);
    }

    public String getImage() {
        return image;
    }

    public String getTransition() {
        return transition;
    }

    public String getLayer() {
        return layer;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.SCENE;
    }

    @Override
    protected Statement withId(String newId) {
        return new SceneStatement(newId, image, transition, layer);
    }
}
