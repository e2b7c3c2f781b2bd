package com.scriptflow;

import com.scriptflow.models.ScriptForest;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Undo and redo stacks of forest snapshots for one script. Forests are
 * immutable, so a snapshot is just the previous instance.
 */
public class EditHistory {

    public static final int DEFAULT_MAX_SIZE = 100;

    private final Deque<ScriptForest> past = new ArrayDeque<>();
    private final Deque<ScriptForest> future = new ArrayDeque<>();
    private final int maxSize;

    public EditHistory() {
        this(DEFAULT_MAX_SIZE);
    }

    public EditHistory(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("History size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /**
     * Records the forest an edit replaced. A new edit discards the redo stack,
     * and the oldest snapshot goes once the cap is reached.
     */
    public void record(ScriptForest previous) {
        push(past, previous);
        future.clear();
    }

    /**
     * The forest {@link #undo} would return, or null when there is none.
     */
    public ScriptForest peekUndo() {
        return past.peek();
    }

    public ScriptForest peekRedo() {
        return future.peek();
    }

    /**
     * Steps back one edit, keeping {@code current} for redo. Returns null
     * and changes nothing when there is no edit to undo.
     */
    public ScriptForest undo(ScriptForest current) {
        if (past.isEmpty()) {
            return null;
        }
        push(future, current);
        return past.pop();
    }

    public ScriptForest redo(ScriptForest current) {
        if (future.isEmpty()) {
            return null;
        }
        push(past, current);
        return future.pop();
    }

    public boolean canUndo() {
        return !past.isEmpty();
    }

    public boolean canRedo() {
        return !future.isEmpty();
    }

    public int undoCount() {
        return past.size();
    }

    public int redoCount() {
        return future.size();
    }

    public void clear() {
        past.clear();
        future.clear();
    }

    private void push(Deque<ScriptForest> stack, ScriptForest forest) {
        stack.push(forest);
        while (stack.size() > maxSize) {
            stack.removeLast();
        }
    }
}
