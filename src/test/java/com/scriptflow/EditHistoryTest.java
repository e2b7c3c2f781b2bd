package com.scriptflow;

import com.scriptflow.models.LabelStatement;
import com.scriptflow.models.ScriptForest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditHistoryTest {

    private static ScriptForest forest(String labelName) {
        return ScriptForest.of(new LabelStatement(labelName, Collections.emptyList()));
    }

    @Test
    void undoThenRedoWalksTheSnapshots() {
        EditHistory history = new EditHistory();
        ScriptForest first = forest("a");
        ScriptForest second = forest("b");
        ScriptForest third = forest("c");
        history.record(first);
        history.record(second);

        assertSame(second, history.undo(third));
        assertSame(first, history.undo(second));
        assertFalse(history.canUndo());
        assertNull(history.undo(first));
        assertEquals(2, history.redoCount());

        assertSame(second, history.peekRedo());
        assertSame(second, history.redo(first));
        assertSame(third, history.redo(second));
        assertNull(history.redo(third));
        assertEquals(2, history.undoCount());
    }

    @Test
    void newEditClearsRedo() {
        EditHistory history = new EditHistory();
        ScriptForest first = forest("a");
        ScriptForest second = forest("b");
        history.record(first);
        history.undo(second);
        assertTrue(history.canRedo());

        history.record(first);

        assertFalse(history.canRedo());
        assertNull(history.peekRedo());
        assertEquals(1, history.undoCount());
    }

    @Test
    void oldestSnapshotsFallOffAtTheCap() {
        EditHistory history = new EditHistory();
        List<ScriptForest> recorded = new ArrayList<>();
        for (int i = 0; i < EditHistory.DEFAULT_MAX_SIZE + 5; i++) {
            ScriptForest forest = forest("label_" + i);
            recorded.add(forest);
            history.record(forest);
        }

        assertEquals(EditHistory.DEFAULT_MAX_SIZE, history.undoCount());
        ScriptForest current = forest("current");
        ScriptForest last = null;
        while (history.canUndo()) {
            last = history.undo(current);
        }
        assertSame(recorded.get(5), last);
    }

    @Test
    void sizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new EditHistory(0));
    }
}
