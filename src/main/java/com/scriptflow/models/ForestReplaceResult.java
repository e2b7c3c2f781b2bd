package com.scriptflow.models;

/**
 * Outcome of a pure forest rewrite. When {@code found} is false the forest is
 * the unchanged input.
 */
public class ForestReplaceResult {
    private final ScriptForest forest;
    private final boolean found;

    private ForestReplaceResult(ScriptForest forest, boolean found) {
        this.forest = forest;
        this.found = found;
    }

    public static ForestReplaceResult replaced(ScriptForest forest) {
        return new ForestReplaceResult(forest, true);
    }

    public static ForestReplaceResult notFound(ScriptForest unchanged) {
        return new ForestReplaceResult(unchanged, false);
    }

    public ScriptForest getForest() {
        return forest;
    }

    public boolean isFound() {
        return found;
    }
}
