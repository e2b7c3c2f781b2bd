package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowEdge {

    private String id;
    private String source;
    private String target;
    private String sourceHandle;
    private FlowEdgeType type;

    public FlowEdge() {
    }

    public FlowEdge(String source, String target, String sourceHandle, FlowEdgeType type) {
        this.id = edgeId(source, target, sourceHandle);
        this.source = source;
        this.target = target;
        this.sourceHandle = sourceHandle;
        this.type = type;
    }

    public static FlowEdge sequence(String source, String target) {
        return new FlowEdge(source, target, null, FlowEdgeType.SEQUENCE);
    }

    public static String edgeId(String source, String target, String sourceHandle) {
        String id = "e-" + source + "-" + target;
        if (sourceHandle != null && !sourceHandle.isEmpty()) {
            id += "-" + sourceHandle;
        }
        return id;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getSourceHandle() {
        return sourceHandle;
    }

    public void setSourceHandle(String sourceHandle) {
        this.sourceHandle = sourceHandle;
    }

    public FlowEdgeType getType() {
        return type;
    }

    public void setType(FlowEdgeType type) {
        this.type = type;
    }

    @Override
    public String toString() {
        return source + " -> " + target + (sourceHandle != null ? " [" + sourceHandle + "]" : "");
    }
}
