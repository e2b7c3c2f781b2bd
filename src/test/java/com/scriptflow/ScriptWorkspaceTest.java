package com.scriptflow;

import com.scriptflow.blocks.BlockOperationResult;
import com.scriptflow.blocks.OperationFailure;
import com.scriptflow.flow.ConnectResult;
import com.scriptflow.flow.FlowView;
import com.scriptflow.models.Block;
import com.scriptflow.models.DialogueStatement;
import com.scriptflow.models.FlowNode;
import com.scriptflow.models.FlowNodeType;
import com.scriptflow.models.LabelStatement;
import com.scriptflow.models.MenuStatement;
import com.scriptflow.models.NodePosition;
import com.scriptflow.models.PendingNode;
import com.scriptflow.models.ScriptForest;
import com.scriptflow.models.ScriptLayout;
import com.scriptflow.models.Statement;
import com.scriptflow.models.StatementKind;
import com.scriptflow.storage.JsonStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptWorkspaceTest {

    @TempDir
    Path workspacePath;

    private TemplateRegistry templates;
    private ScriptWorkspace workspace;

    @BeforeEach
    void setUp() {
        templates = new TemplateRegistry(AppConfig.templatesFile(workspacePath), JsonStorage.mapper());
        templates.load();
        workspace = new ScriptWorkspace(workspacePath, templates);
    }

    private String startId(String script) throws Exception {
        return workspace.getForest(script).findLabel(ScriptWorkspace.START_LABEL).orElseThrow().getId();
    }

    private static List<Statement> body(ScriptForest forest, String labelName) {
        return forest.findLabel(labelName).orElseThrow().getBody();
    }

    private static FlowNode node(FlowView view, String nodeId) {
        for (FlowNode node : view.getNodes()) {
            if (node.getId().equals(nodeId)) {
                return node;
            }
        }
        return null;
    }

    @Test
    void scriptsAreCreatedListedAndDeleted() throws Exception {
        ScriptForest forest = workspace.createScript("intro");
        workspace.createScript("chapter1");

        assertEquals(List.of(ScriptWorkspace.START_LABEL), forest.getLabelNames());
        assertEquals(List.of("chapter1", "intro"), workspace.listScripts());
        assertThrows(IllegalArgumentException.class, () -> workspace.createScript("intro"));
        assertThrows(IllegalArgumentException.class, () -> workspace.getForest("../secrets"));
        assertThrows(FileNotFoundException.class, () -> workspace.getForest("missing"));

        assertTrue(workspace.deleteScript("intro"));
        assertFalse(workspace.deleteScript("intro"));
        assertEquals(List.of("chapter1"), workspace.listScripts());
        assertThrows(FileNotFoundException.class, () -> workspace.getForest("intro"));
    }

    @Test
    void editsArePersistedAndReloaded() throws Exception {
        workspace.createScript("intro");
        BlockOperationResult added = workspace.addBlock("intro", StatementKind.DIALOGUE, startId("intro"),
            Integer.MAX_VALUE);
        assertTrue(added.isSuccess());
        assertTrue(workspace.updateSlot("intro", added.getStatementId(), "text", "Hello").isSuccess());

        ScriptWorkspace reopened = new ScriptWorkspace(workspacePath, templates);
        List<Statement> body = body(reopened.getForest("intro"), ScriptWorkspace.START_LABEL);
        assertEquals(1, body.size());
        assertEquals(added.getStatementId(), body.get(0).getId());
        assertEquals("Hello", ((DialogueStatement) body.get(0)).getText());
    }

    @Test
    void failedEditLeavesDocumentUntouched() throws Exception {
        workspace.createScript("intro");
        ScriptForest before = workspace.getForest("intro");

        BlockOperationResult result = workspace.deleteBlock("intro", "ghost");

        assertEquals(OperationFailure.NOT_FOUND, result.getReason());
        assertSame(before, workspace.getForest("intro"));
    }

    @Test
    void failedWriteKeepsEditOutOfMemory() throws Exception {
        workspace.createScript("intro");
        String start = startId("intro");
        ScriptForest before = workspace.getForest("intro");
        PendingNode pending = workspace.createPendingNode("intro", FlowNodeType.DIALOGUE_BLOCK, null);
        Path blocked = AppConfig.scriptsDirectory(workspacePath).resolve("intro.json.tmp");
        Files.createDirectories(blocked);

        assertThrows(IOException.class, () -> workspace.addBlock("intro", StatementKind.DIALOGUE, start, 0));
        assertThrows(IOException.class, () -> workspace.connect("intro", "scene-" + start, null, pending.getId()));

        assertSame(before, workspace.getForest("intro"));
        assertEquals(0, workspace.undoCount("intro"));
        assertTrue(node(workspace.flow("intro"), pending.getId()).isPending());

        Files.delete(blocked);
        assertTrue(workspace.addBlock("intro", StatementKind.DIALOGUE, start, 0).isSuccess());
        assertEquals(1, body(workspace.getForest("intro"), ScriptWorkspace.START_LABEL).size());
    }

    @Test
    void undoAndRedoRestoreEarlierForests() throws Exception {
        workspace.createScript("intro");
        ScriptForest empty = workspace.getForest("intro");
        String added = workspace.addBlock("intro", StatementKind.DIALOGUE, startId("intro"), 0).getStatementId();
        workspace.updateSlot("intro", added, "text", "Hello");
        ScriptForest edited = workspace.getForest("intro");
        assertEquals(2, workspace.undoCount("intro"));

        workspace.undo("intro");
        assertSame(empty, workspace.undo("intro"));
        assertNull(workspace.undo("intro"));
        assertEquals(2, workspace.redoCount("intro"));
        ScriptWorkspace reopened = new ScriptWorkspace(workspacePath, templates);
        assertTrue(body(reopened.getForest("intro"), ScriptWorkspace.START_LABEL).isEmpty());

        workspace.redo("intro");
        assertSame(edited, workspace.redo("intro"));
        assertNull(workspace.redo("intro"));

        workspace.undo("intro");
        assertEquals(1, workspace.redoCount("intro"));
        workspace.addLabel("intro", "ending");
        assertEquals(0, workspace.redoCount("intro"));
        assertNull(workspace.redo("intro"));
    }

    @Test
    void deletedStatementsTakeTheirNodePositionsAlong() throws Exception {
        workspace.createScript("intro");
        String added = workspace.addBlock("intro", StatementKind.JUMP, startId("intro"), 0).getStatementId();
        String nodeId = "jump-" + added;
        assertTrue(workspace.updateNodePosition("intro", nodeId, new NodePosition(7, 8)));

        assertTrue(workspace.deleteBlock("intro", added).isSuccess());

        assertFalse(workspace.getLayout("intro").getNodePositions().containsKey(nodeId));
        ScriptWorkspace reopened = new ScriptWorkspace(workspacePath, templates);
        assertFalse(reopened.getLayout("intro").getNodePositions().containsKey(nodeId));
    }

    @Test
    void labelsAreAddedAndRemoved() throws Exception {
        workspace.createScript("intro");

        assertTrue(workspace.addLabel("intro", "ending").isSuccess());
        assertEquals(OperationFailure.VALIDATION_FAILED, workspace.addLabel("intro", "ending").getReason());
        assertEquals(OperationFailure.VALIDATION_FAILED, workspace.addLabel("intro", "has space").getReason());
        assertEquals(List.of("start", "ending"), workspace.getForest("intro").getLabelNames());
        assertNotNull(workspace.labelBlocks("intro", "ending"));

        assertTrue(workspace.removeLabel("intro", "ending").isSuccess());
        assertEquals(OperationFailure.NOT_FOUND, workspace.removeLabel("intro", "ending").getReason());
        assertNull(workspace.labelBlocks("intro", "ending"));
    }

    @Test
    void templatesAndClipboardInsertFreshStatements() throws Exception {
        workspace.createScript("intro");
        String start = startId("intro");

        assertTrue(workspace.applyTemplate("intro", "builtin-choice-branch", start, Integer.MAX_VALUE).isSuccess());
        Statement menu = body(workspace.getForest("intro"), "start").get(0);
        assertTrue(menu instanceof MenuStatement);
        assertThrows(IllegalArgumentException.class,
            () -> workspace.applyTemplate("intro", "missing", start, 0));

        assertTrue(workspace.copyBlock("intro", menu.getId()));
        assertFalse(workspace.copyBlock("intro", "ghost"));
        workspace.createScript("other");
        assertTrue(workspace.pasteBlock("other", startId("other"), 0).isSuccess());
        Statement pasted = body(workspace.getForest("other"), "start").get(0);
        assertEquals(StatementKind.MENU, pasted.getKind());
        assertNotEquals(menu.getId(), pasted.getId());
    }

    @Test
    void connectingPendingNodeMovesItIntoScriptAndLayout() throws Exception {
        workspace.createScript("intro");
        String sceneId = "scene-" + startId("intro");
        PendingNode pending = workspace.createPendingNode("intro", FlowNodeType.DIALOGUE_BLOCK, new NodePosition(10, 20));

        FlowView staged = workspace.flow("intro");
        assertNotNull(node(staged, pending.getId()));
        assertTrue(node(staged, pending.getId()).isPending());

        ConnectResult result = workspace.connect("intro", sceneId, null, pending.getId());

        assertTrue(result.isFolded());
        String statementId = result.getStatementIds().get(0);
        FlowView view = workspace.flow("intro");
        assertNull(node(view, pending.getId()));
        FlowNode folded = node(view, "dialogue-" + statementId);
        assertNotNull(folded);
        assertEquals(10.0, folded.getPosition().getX());
        assertEquals(20.0, folded.getPosition().getY());
        assertTrue(view.getDiagnostics().getOrphanNodeIds().isEmpty());
        assertFalse(workspace.removePendingNode("intro", pending.getId()));

        ScriptWorkspace reopened = new ScriptWorkspace(workspacePath, templates);
        assertNotNull(reopened.getLayout("intro").getNodePositions().get("dialogue-" + statementId));
    }

    @Test
    void rejectedConnectionKeepsPendingNode() throws Exception {
        workspace.createScript("intro");
        PendingNode pending = workspace.createPendingNode("intro", FlowNodeType.MENU, null);

        ConnectResult result = workspace.connect("intro", pending.getId(), null, "scene-" + startId("intro"));

        assertFalse(result.isSuccess());
        assertEquals(OperationFailure.VALIDATION_FAILED, result.getReason());
        assertNotNull(node(workspace.flow("intro"), pending.getId()));
        assertThrows(IllegalArgumentException.class, () -> workspace.createPendingNode("intro", null, null));
    }

    @Test
    void nodePositionsAndDeletion() throws Exception {
        workspace.createScript("intro");
        String added = workspace.addBlock("intro", StatementKind.DIALOGUE, startId("intro"), 0).getStatementId();
        String nodeId = "dialogue-" + added;

        assertTrue(workspace.updateNodePosition("intro", nodeId, new NodePosition(3, 4)));
        assertFalse(workspace.updateNodePosition("intro", "ghost", new NodePosition(3, 4)));
        assertEquals(3.0, workspace.getLayout("intro").getNodePositions().get(nodeId).getX());

        assertTrue(workspace.deleteNode("intro", nodeId).isSuccess());
        assertTrue(body(workspace.getForest("intro"), "start").isEmpty());
        assertNull(workspace.getLayout("intro").getNodePositions().get(nodeId));
    }

    @Test
    void savedLayoutDropsUnknownStatements() throws Exception {
        workspace.createScript("intro");
        String start = startId("intro");
        ScriptLayout layout = new ScriptLayout();
        layout.setCollapsed(new ArrayList<>(List.of(start, "ghost")));

        ScriptLayout saved = workspace.saveLayout("intro", layout);

        assertEquals(List.of(start), saved.getCollapsed());
        Block root = workspace.blocks("intro").get(0);
        assertTrue(root.isCollapsed());
        assertEquals(start, root.getStatementId());
    }

    @Test
    void validationReportsBrokenJumps() throws Exception {
        workspace.createScript("intro");
        String jump = workspace.addBlock("intro", StatementKind.JUMP, startId("intro"), 0).getStatementId();
        workspace.updateSlot("intro", jump, "target", "nowhere");

        assertFalse(workspace.validate("intro").isEmpty());
        LabelStatement start = workspace.getForest("intro").findLabel("start").orElseThrow();
        assertEquals(jump, start.getBody().get(0).getId());
        assertTrue(workspace.blocks("intro").get(0).getChildren().get(0).isHasError());
    }
}
