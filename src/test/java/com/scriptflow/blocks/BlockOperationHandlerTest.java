package com.scriptflow.blocks;

import com.scriptflow.models.ChoiceStatement;
import com.scriptflow.models.DialogueStatement;
import com.scriptflow.models.IfStatement;
import com.scriptflow.models.JumpStatement;
import com.scriptflow.models.LabelStatement;
import com.scriptflow.models.MenuStatement;
import com.scriptflow.models.ScriptForest;
import com.scriptflow.models.SetStatement;
import com.scriptflow.models.Statement;
import com.scriptflow.models.StatementKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockOperationHandlerTest {

    private final BlockOperationHandler handler = new BlockOperationHandler();

    private DialogueStatement d1;
    private JumpStatement j1;
    private LabelStatement start;

    private ScriptForest startForest() {
        d1 = new DialogueStatement("d1", "e", "Hello", null);
        j1 = new JumpStatement("j1", "missing");
        start = new LabelStatement("start", List.of(d1, j1));
        return ScriptForest.of(start);
    }

    private static List<String> bodyIds(ScriptForest forest, String labelName) {
        List<String> ids = new ArrayList<>();
        for (Statement statement : forest.findLabel(labelName).orElseThrow().getBody()) {
            ids.add(statement.getId());
        }
        return ids;
    }

    @Test
    void moveIntoNonContainerFailsAndKeepsForest() {
        ScriptForest forest = startForest();

        BlockOperationResult result = handler.moveBlock(forest, "d1", "j1", 0);

        assertFalse(result.isSuccess());
        assertEquals(OperationFailure.INVALID_CONTAINER, result.getReason());
        assertSame(forest, result.getForest());
        assertEquals(List.of("d1", "j1"), bodyIds(forest, "start"));
    }

    @Test
    void deletingMenuRemovesWholeSubtree() {
        DialogueStatement left = new DialogueStatement(null, "left");
        DialogueStatement right = new DialogueStatement(null, "right");
        ChoiceStatement c1 = new ChoiceStatement("A", List.of(left));
        ChoiceStatement c2 = new ChoiceStatement("B", List.of(right));
        MenuStatement menu = new MenuStatement(List.of(c1, c2));
        ScriptForest forest = ScriptForest.of(new LabelStatement("start", List.of(menu)));

        BlockOperationResult result = handler.deleteBlock(forest, menu.getId());

        assertTrue(result.isSuccess());
        assertEquals(List.of(menu.getId(), c1.getId(), left.getId(), c2.getId(), right.getId()),
            result.getAffectedIds());
        for (String id : result.getAffectedIds()) {
            assertFalse(result.getForest().contains(id));
        }
        assertEquals(1, result.getForest().countStatements());
    }

    @Test
    void deleteUnknownIsNotFound() {
        ScriptForest forest = startForest();
        BlockOperationResult result = handler.deleteBlock(forest, "ghost");
        assertEquals(OperationFailure.NOT_FOUND, result.getReason());
        assertSame(forest, result.getForest());
    }

    @Test
    void addBlockInsertsDefaultStatement() {
        ScriptForest forest = startForest();

        BlockOperationResult result = handler.addBlock(forest, StatementKind.DIALOGUE, start.getId(), 1);

        assertTrue(result.isSuccess());
        List<String> ids = bodyIds(result.getForest(), "start");
        assertEquals(3, ids.size());
        assertEquals(result.getStatementId(), ids.get(1));
        DialogueStatement created = (DialogueStatement) result.getForest().findById(ids.get(1)).orElseThrow();
        assertEquals("New dialogue", created.getText());
    }

    @Test
    void addMenuStartsWithOneChoice() {
        ScriptForest forest = startForest();

        BlockOperationResult result = handler.addBlock(forest, StatementKind.MENU, start.getId(), 0);

        MenuStatement menu = (MenuStatement) result.getForest().findById(result.getStatementId()).orElseThrow();
        assertEquals(1, menu.getChoices().size());
        assertEquals("Choice 1", menu.getChoices().get(0).getText());
    }

    @Test
    void addBlockRejectsWrongContainer() {
        ScriptForest forest = startForest();

        assertEquals(OperationFailure.INVALID_CONTAINER,
            handler.addBlock(forest, StatementKind.CHOICE, start.getId(), 0).getReason());
        assertEquals(OperationFailure.INVALID_CONTAINER,
            handler.addBlock(forest, StatementKind.DIALOGUE, "d1", 0).getReason());
        assertEquals(OperationFailure.NOT_FOUND,
            handler.addBlock(forest, StatementKind.DIALOGUE, "nowhere", 0).getReason());
        assertEquals(OperationFailure.VALIDATION_FAILED,
            handler.addBlock(forest, null, start.getId(), 0).getReason());
    }

    @Test
    void moveDownwardWithinSequenceUsesDropPosition() {
        DialogueStatement a = new DialogueStatement("a", null, "A", null);
        DialogueStatement b = new DialogueStatement("b", null, "B", null);
        DialogueStatement c = new DialogueStatement("c", null, "C", null);
        LabelStatement label = new LabelStatement("start", List.of(a, b, c));
        ScriptForest forest = ScriptForest.of(label);

        BlockOperationResult down = handler.moveBlock(forest, "a", label.getId(), 2);
        assertEquals(List.of("b", "a", "c"), bodyIds(down.getForest(), "start"));

        BlockOperationResult toEnd = handler.moveBlock(forest, "a", label.getId(), 3);
        assertEquals(List.of("b", "c", "a"), bodyIds(toEnd.getForest(), "start"));

        BlockOperationResult up = handler.moveBlock(forest, "c", label.getId(), 0);
        assertEquals(List.of("c", "a", "b"), bodyIds(up.getForest(), "start"));
    }

    @Test
    void moveIsAtomicAndKeepsIdentity() {
        DialogueStatement inner = new DialogueStatement("inner", null, "x", null);
        ChoiceStatement choice = new ChoiceStatement("c1", "Pick", null, List.of());
        MenuStatement menu = new MenuStatement("m1", null, List.of(choice));
        LabelStatement label = new LabelStatement("start", List.of(inner, menu));
        ScriptForest forest = ScriptForest.of(label);

        BlockOperationResult result = handler.moveBlock(forest, "inner", "c1", 0);

        assertTrue(result.isSuccess());
        ScriptForest next = result.getForest();
        assertEquals(forest.countStatements(), next.countStatements());
        assertEquals("c1", next.findLocation("inner").orElseThrow().getParentId());
        assertSame(inner, next.findById("inner").orElseThrow());
        assertEquals("start", next.findLocation("inner").orElseThrow().getLabelName());
        // original untouched
        assertEquals(label.getId(), forest.findLocation("inner").orElseThrow().getParentId());
    }

    @Test
    void moveIntoOwnSubtreeWouldCreateCycle() {
        DialogueStatement inner = new DialogueStatement("inner", null, "x", null);
        ChoiceStatement choice = new ChoiceStatement("c1", "Pick", null, List.of(inner));
        MenuStatement menu = new MenuStatement("m1", null, List.of(choice));
        ScriptForest forest = ScriptForest.of(new LabelStatement("start", List.of(menu)));

        BlockOperationResult intoChild = handler.moveBlock(forest, "m1", "c1", 0);
        assertEquals(OperationFailure.WOULD_CREATE_CYCLE, intoChild.getReason());
        assertSame(forest, intoChild.getForest());

        BlockOperationResult intoSelf = handler.moveBlock(forest, "c1", "c1", 0);
        assertEquals(OperationFailure.WOULD_CREATE_CYCLE, intoSelf.getReason());
    }

    @Test
    void moveAcrossLabelsRequiresTheCrossLabelOperation() {
        ScriptForest forest = startForest();
        LabelStatement other = new LabelStatement("other", List.of());
        forest = forest.addLabel(other);

        BlockOperationResult plain = handler.moveBlock(forest, "d1", other.getId(), 0);
        assertEquals(OperationFailure.INVALID_CONTAINER, plain.getReason());

        BlockOperationResult across = handler.moveBlockAcrossLabels(forest, "d1", "start", "other", null, 0);
        assertTrue(across.isSuccess());
        assertEquals(List.of("j1"), bodyIds(across.getForest(), "start"));
        assertEquals(List.of("d1"), bodyIds(across.getForest(), "other"));
    }

    @Test
    void moveAcrossLabelsIntoNestedChoiceLeavesOneCopy() {
        ChoiceStatement stay = new ChoiceStatement("c1", "Stay", null, List.of(
            new DialogueStatement("x1", null, "first", null),
            new DialogueStatement("x2", null, "second", null)));
        ScriptForest forest = startForest()
            .addLabel(new LabelStatement("other", List.of(new MenuStatement("m1", null, List.of(stay)))));

        BlockOperationResult result = handler.moveBlockAcrossLabels(forest, "d1", "start", "other", "c1", 1);

        assertTrue(result.isSuccess());
        ScriptForest moved = result.getForest();
        assertEquals(List.of("j1"), bodyIds(moved, "start"));
        List<String> choiceBody = new ArrayList<>();
        for (Statement statement : moved.findById("c1").orElseThrow().childStatements()) {
            choiceBody.add(statement.getId());
        }
        assertEquals(List.of("x1", "d1", "x2"), choiceBody);
        int occurrences = 0;
        for (Statement root : moved.getStatements()) {
            for (String id : moved.collectIds(root.getId())) {
                if (id.equals("d1")) {
                    occurrences++;
                }
            }
        }
        assertEquals(1, occurrences);
        assertEquals(forest.countStatements(), moved.countStatements());
    }

    @Test
    void moveAcrossLabelsChecksMembership() {
        ScriptForest forest = startForest().addLabel(new LabelStatement("other", List.of()));

        assertEquals(OperationFailure.INVALID_CONTAINER,
            handler.moveBlockAcrossLabels(forest, "d1", "other", "start", null, 0).getReason());
        assertEquals(OperationFailure.NOT_FOUND,
            handler.moveBlockAcrossLabels(forest, "d1", "start", "nope", null, 0).getReason());
        assertEquals(OperationFailure.INVALID_CONTAINER,
            handler.moveBlockAcrossLabels(forest, "d1", "start", "other", "j1", 0).getReason());
    }

    @Test
    void editsOnlyTouchThePathToTheTarget() {
        ScriptForest forest = startForest();
        LabelStatement other = new LabelStatement("other", List.of(new DialogueStatement(null, "untouched")));
        forest = forest.addLabel(other);

        BlockOperationResult result = handler.updateSlot(forest, "d1", "text", "Changed");

        assertTrue(result.isSuccess());
        assertSame(other, result.getForest().findLabel("other").orElseThrow());
        assertSame(j1, result.getForest().findById("j1").orElseThrow());
        DialogueStatement changed = (DialogueStatement) result.getForest().findById("d1").orElseThrow();
        assertEquals("Changed", changed.getText());
        assertEquals("e", changed.getSpeaker());
    }

    @Test
    void updateSlotValidates() {
        ScriptForest forest = startForest();

        assertEquals(OperationFailure.VALIDATION_FAILED,
            handler.updateSlot(forest, "d1", "colour", "red").getReason());
        assertEquals(OperationFailure.NOT_FOUND,
            handler.updateSlot(forest, "zzz", "text", "x").getReason());

        ScriptForest withSet = forest.insert(start.getId(), 0,
            new SetStatement("s1", "score", "=", "0")).getForest();
        BlockOperationResult badOperator = handler.updateSlot(withSet, "s1", "operator", "%=");
        assertEquals(OperationFailure.VALIDATION_FAILED, badOperator.getReason());
        assertSame(withSet, badOperator.getForest());
    }

    @Test
    void renamingLabelToExistingNameFails() {
        ScriptForest forest = startForest().addLabel(new LabelStatement("other", List.of()));

        BlockOperationResult result = handler.updateSlot(forest, start.getId(), "name", "other");

        assertEquals(OperationFailure.VALIDATION_FAILED, result.getReason());
        assertTrue(handler.updateSlot(forest, start.getId(), "name", "start").isSuccess());
    }

    @Test
    void copyAndPasteGiveFreshIdentities() {
        ChoiceStatement choice = new ChoiceStatement("c1", "Pick", null, List.of(new DialogueStatement(null, "x")));
        MenuStatement menu = new MenuStatement("m1", null, List.of(choice));
        LabelStatement label = new LabelStatement("start", List.of(menu));
        ScriptForest forest = ScriptForest.of(label);

        StatementClipboard clipboard = handler.copyBlock(forest, "m1").orElseThrow();
        assertEquals("start", clipboard.getSourceLabel());

        BlockOperationResult pasted = handler.pasteBlock(forest, clipboard, label.getId(), 1);

        assertTrue(pasted.isSuccess());
        assertEquals(6, pasted.getForest().countStatements());
        assertNotEquals("m1", pasted.getStatementId());
        assertEquals(StatementKind.MENU, pasted.getForest().findById(pasted.getStatementId()).orElseThrow().getKind());
        assertTrue(handler.copyBlock(forest, "nothing").isEmpty());
    }

    @Test
    void pasteChecksContainer() {
        ScriptForest forest = startForest();
        StatementClipboard clipboard = handler.copyBlock(forest, "d1").orElseThrow();
        IfStatement check = new IfStatement("if1", List.of());
        ScriptForest withIf = forest.insert(start.getId(), 0, check).getForest();

        assertEquals(OperationFailure.INVALID_CONTAINER, handler.pasteBlock(withIf, clipboard, "if1", 0).getReason());
        assertEquals(OperationFailure.VALIDATION_FAILED, handler.pasteBlock(forest, null, start.getId(), 0).getReason());
    }
}
