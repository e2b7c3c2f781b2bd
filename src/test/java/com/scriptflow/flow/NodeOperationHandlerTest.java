package com.scriptflow.flow;

import com.scriptflow.blocks.BlockOperationHandler;
import com.scriptflow.blocks.BlockOperationResult;
import com.scriptflow.blocks.OperationFailure;
import com.scriptflow.models.ChoiceStatement;
import com.scriptflow.models.DialogueStatement;
import com.scriptflow.models.FlowGraph;
import com.scriptflow.models.FlowNodeData;
import com.scriptflow.models.FlowNodeType;
import com.scriptflow.models.JumpStatement;
import com.scriptflow.models.LabelStatement;
import com.scriptflow.models.MenuStatement;
import com.scriptflow.models.NodePosition;
import com.scriptflow.models.PendingNode;
import com.scriptflow.models.PendingNodeStatus;
import com.scriptflow.models.ScriptForest;
import com.scriptflow.models.Statement;
import com.scriptflow.models.StatementKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeOperationHandlerTest {

    private final NodeOperationHandler handler = new NodeOperationHandler(new BlockOperationHandler());
    private final FlowGraphBuilder builder = new FlowGraphBuilder();

    private ScriptForest forest() {
        MenuStatement menu = new MenuStatement("m1", null, List.of(
            new ChoiceStatement("c1", "Stay", null, List.of(new DialogueStatement("inside", null, "ok", null)))));
        return ScriptForest.of(
            new LabelStatement("L", "start", null, List.of(
                new DialogueStatement("d1", "e", "Hello", null),
                new DialogueStatement("d2", null, "World", null),
                menu)),
            new LabelStatement("E", "ending", null, List.of(new DialogueStatement("e1", null, "Bye", null))));
    }

    private static List<String> bodyKinds(ScriptForest forest, String containerId) {
        List<String> kinds = new ArrayList<>();
        for (Statement statement : forest.findById(containerId).orElseThrow().childStatements()) {
            kinds.add(statement.getKind().getTag());
        }
        return kinds;
    }

    @Test
    void createdNodesGetTypeDefaults() {
        PendingNodePool pool = new PendingNodePool();

        PendingNode menu = handler.createNode(pool, FlowNodeType.MENU, new NodePosition(1, 2));
        PendingNode scene = handler.createNode(pool, FlowNodeType.SCENE, null);
        PendingNode jump = handler.createNode(pool, FlowNodeType.JUMP, null);

        assertEquals(3, pool.size());
        assertEquals(2, menu.getData().getChoices().size());
        assertEquals("Choice 1", menu.getData().getChoices().get(0).getText());
        assertEquals(NodeOperationHandler.DEFAULT_LABEL, scene.getData().getLabel());
        assertEquals("", jump.getData().getTarget());
        assertEquals(PendingNodeStatus.CREATED, menu.getStatus());
    }

    @Test
    void dialogueTargetFoldsAfterSourceRun() {
        ScriptForest forest = forest();
        FlowGraph graph = builder.build(forest);
        PendingNodePool pool = new PendingNodePool();
        PendingNode target = handler.createNode(pool, FlowNodeType.DIALOGUE_BLOCK, null);

        ConnectResult result = handler.connect(forest, graph, pool, "dialogue-d1", null, target.getId());

        assertTrue(result.isSuccess());
        assertTrue(result.isFolded());
        assertEquals("start", result.getLabelName());
        ScriptForest next = result.getForest();
        assertEquals(List.of("dialogue", "dialogue", "dialogue", "menu"), bodyKinds(next, "L"));
        String inserted = result.getStatementIds().get(0);
        assertEquals(2, next.findLocation(inserted).orElseThrow().getIndex());
        assertEquals("New dialogue", ((DialogueStatement) next.findById(inserted).orElseThrow()).getText());
        assertEquals(PendingNodeStatus.SYNCED, target.getStatus());
        assertEquals(inserted, target.getStatementId());
    }

    @Test
    void menuPortTargetGoesToStartOfChoiceBody() {
        ScriptForest forest = forest();
        PendingNodePool pool = new PendingNodePool();
        PendingNode target = handler.createNode(pool, FlowNodeType.JUMP, null);
        pool.updateData(target.getId(), targetData("ending"));

        ConnectResult result = handler.connect(forest, builder.build(forest), pool,
            "menu-m1", FlowGraphBuilder.choicePort("c1"), target.getId());

        assertTrue(result.isFolded());
        assertEquals(List.of("jump", "dialogue"), bodyKinds(result.getForest(), "c1"));
        JumpStatement jump = (JumpStatement) result.getForest().findById(result.getStatementIds().get(0)).orElseThrow();
        assertEquals("ending", jump.getTarget());
    }

    @Test
    void sceneSourceInsertsAtStartOfLabel() {
        ScriptForest forest = forest();
        PendingNodePool pool = new PendingNodePool();
        PendingNode target = handler.createNode(pool, FlowNodeType.MENU, null);

        ConnectResult result = handler.connect(forest, builder.build(forest), pool, "scene-E", null, target.getId());

        assertEquals(List.of("menu", "dialogue"), bodyKinds(result.getForest(), "E"));
        MenuStatement menu = (MenuStatement) result.getForest().findById(result.getStatementIds().get(0)).orElseThrow();
        assertEquals(2, menu.getChoices().size());
        assertEquals("ending", result.getLabelName());
    }

    @Test
    void sceneToSceneAppendsJump() {
        ScriptForest forest = forest();

        ConnectResult result = handler.connect(forest, builder.build(forest), new PendingNodePool(),
            "scene-E", null, "scene-L");

        assertEquals(List.of("dialogue", "jump"), bodyKinds(result.getForest(), "E"));
        JumpStatement jump = (JumpStatement) result.getForest().findById(result.getStatementIds().get(0)).orElseThrow();
        assertEquals("start", jump.getTarget());
    }

    @Test
    void pendingSceneTargetCreatesLabelAndJump() {
        ScriptForest forest = forest();
        PendingNodePool pool = new PendingNodePool();
        PendingNode scene = handler.createNode(pool, FlowNodeType.SCENE, null);
        FlowNodeData name = new FlowNodeData();
        name.setLabel("ending");
        pool.updateData(scene.getId(), name);

        ConnectResult result = handler.connect(forest, builder.build(forest), pool, "dialogue-e1", null, scene.getId());

        ScriptForest next = result.getForest();
        assertEquals(List.of("start", "ending", "ending_2"), next.getLabelNames());
        assertEquals(List.of("dialogue", "jump"), bodyKinds(next, "E"));
        assertEquals(PendingNodeStatus.SYNCED, scene.getStatus());
        assertEquals("ending_2", scene.getLabelName());
        assertEquals(next.findLabel("ending_2").orElseThrow().getId(), scene.getStatementId());
    }

    @Test
    void pendingSceneSourceMaterializesLabel() {
        ScriptForest forest = forest();
        PendingNodePool pool = new PendingNodePool();
        PendingNode scene = handler.createNode(pool, FlowNodeType.SCENE, null);
        PendingNode line = handler.createNode(pool, FlowNodeType.DIALOGUE_BLOCK, null);

        ConnectResult result = handler.connect(forest, builder.build(forest), pool, scene.getId(), null, line.getId());

        assertTrue(result.isFolded());
        LabelStatement created = result.getForest().findLabel(NodeOperationHandler.DEFAULT_LABEL).orElseThrow();
        assertEquals(1, created.getBody().size());
        assertEquals(StatementKind.DIALOGUE, created.getBody().get(0).getKind());
        assertEquals(PendingNodeStatus.SYNCED, scene.getStatus());
        assertEquals(PendingNodeStatus.SYNCED, line.getStatus());
    }

    @Test
    void pendingChainIsStagedWithoutCountingAsConnected() {
        ScriptForest forest = forest();
        PendingNodePool pool = new PendingNodePool();
        PendingNode first = handler.createNode(pool, FlowNodeType.DIALOGUE_BLOCK, null);
        PendingNode second = handler.createNode(pool, FlowNodeType.RETURN, null);

        ConnectResult staged = handler.connect(forest, builder.build(forest), pool, first.getId(), null, second.getId());
        assertTrue(staged.isSuccess());
        assertFalse(staged.isFolded());
        assertSame(forest, staged.getForest());
        assertEquals(first.getId(), second.getSourceNodeId());
        assertEquals(PendingNodeStatus.CREATED, second.getStatus());

        ConnectResult folded = handler.connect(forest, builder.build(forest), pool, "dialogue-d1", null, first.getId());
        assertTrue(folded.isFolded());
        assertTrue(handler.refreshOrphans(builder.build(folded.getForest()), pool).isEmpty());
        assertEquals(PendingNodeStatus.CREATED, second.getStatus());
    }

    @Test
    void connectedEntriesBecomeOrphansWhenTheirSourceDisappears() {
        ScriptForest forest = forest();
        PendingNodePool pool = new PendingNodePool();
        PendingNode hanging = handler.createNode(pool, FlowNodeType.DIALOGUE_BLOCK, null);
        pool.updateConnection(hanging.getId(), "scene-L", null);

        assertTrue(handler.refreshOrphans(builder.build(forest), pool).isEmpty());
        assertEquals(PendingNodeStatus.CONNECTED, hanging.getStatus());

        ScriptForest withoutStart = forest.removeLabel("L").getForest();
        assertEquals(List.of(hanging.getId()), handler.refreshOrphans(builder.build(withoutStart), pool));
        assertEquals(PendingNodeStatus.ORPHAN, hanging.getStatus());
    }

    @Test
    void neverConnectedNodesStayCreated() {
        ScriptForest forest = forest();
        PendingNodePool pool = new PendingNodePool();
        PendingNode loose = handler.createNode(pool, FlowNodeType.DIALOGUE_BLOCK, null);

        assertTrue(handler.refreshOrphans(builder.build(forest), pool).isEmpty());
        assertEquals(PendingNodeStatus.CREATED, loose.getStatus());
    }

    @Test
    void rejectedConnectionsLeaveEverythingUnchanged() {
        ScriptForest forest = forest();
        FlowGraph graph = builder.build(forest);
        PendingNodePool pool = new PendingNodePool();
        PendingNode loose = handler.createNode(pool, FlowNodeType.DIALOGUE_BLOCK, null);

        assertEquals(OperationFailure.NOT_FOUND,
            handler.connect(forest, graph, pool, "ghost", null, loose.getId()).getReason());
        assertEquals(OperationFailure.WOULD_CREATE_CYCLE,
            handler.connect(forest, graph, pool, loose.getId(), null, loose.getId()).getReason());
        assertEquals(OperationFailure.VALIDATION_FAILED,
            handler.connect(forest, graph, pool, "dialogue-d1", null, "menu-m1").getReason());
        ConnectResult fromPending = handler.connect(forest, graph, pool, loose.getId(), null, "scene-L");
        assertEquals(OperationFailure.VALIDATION_FAILED, fromPending.getReason());
        assertSame(forest, fromPending.getForest());
        assertEquals(PendingNodeStatus.CREATED, loose.getStatus());
    }

    @Test
    void deletingBuiltRunRemovesAllItsStatements() {
        ScriptForest forest = forest();
        FlowGraph graph = builder.build(forest);

        BlockOperationResult result = handler.deleteNode(forest, graph, new PendingNodePool(), "dialogue-d1");

        assertTrue(result.isSuccess());
        assertEquals(List.of("d1", "d2"), result.getAffectedIds());
        assertEquals(List.of("menu"), bodyKinds(result.getForest(), "L"));
        assertEquals(OperationFailure.NOT_FOUND,
            handler.deleteNode(forest, graph, new PendingNodePool(), "ghost").getReason());
    }

    @Test
    void deletingPendingNodeOnlyTouchesPool() {
        ScriptForest forest = forest();
        PendingNodePool pool = new PendingNodePool();
        PendingNode node = handler.createNode(pool, FlowNodeType.CALL, null);

        BlockOperationResult result = handler.deleteNode(forest, builder.build(forest), pool, node.getId());

        assertTrue(result.isSuccess());
        assertSame(forest, result.getForest());
        assertFalse(pool.isPending(node.getId()));
    }

    @Test
    void uniqueLabelNamesAvoidCollisions() {
        ScriptForest forest = forest().addLabel(new LabelStatement("ending_2", List.of()));
        assertEquals("ending_3", NodeOperationHandler.uniqueLabelName(forest, "ending"));
        assertEquals("fresh", NodeOperationHandler.uniqueLabelName(forest, " fresh "));
        assertEquals(NodeOperationHandler.DEFAULT_LABEL, NodeOperationHandler.uniqueLabelName(forest, "  "));
    }

    private static FlowNodeData targetData(String target) {
        FlowNodeData data = new FlowNodeData();
        data.setTarget(target);
        return data;
    }
}
