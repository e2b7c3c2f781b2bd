package com.scriptflow.flow;

import com.scriptflow.models.CallStatement;
import com.scriptflow.models.DialogueStatement;
import com.scriptflow.models.FlowEdge;
import com.scriptflow.models.FlowGraph;
import com.scriptflow.models.FlowNode;
import com.scriptflow.models.FlowNodeType;
import com.scriptflow.models.JumpStatement;
import com.scriptflow.models.LabelStatement;
import com.scriptflow.models.ScriptForest;
import com.scriptflow.models.Statement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeConnectionResolverTest {

    private final FlowGraphBuilder builder = new FlowGraphBuilder();

    private FlowGraph startGraph() {
        LabelStatement start = new LabelStatement("L", "start", null, List.of(
            new DialogueStatement("d1", "e", "Hello", null),
            new JumpStatement("j1", "missing")));
        return builder.build(ScriptForest.of(start));
    }

    private static FlowNode node(String id, FlowNodeType type) {
        FlowNode node = new FlowNode(id, type, null);
        node.setPending(true);
        return node;
    }

    @Test
    void builtNodesAreReachableAndBadJumpIsReported() {
        NodeConnectionResolver resolver = new NodeConnectionResolver(startGraph());

        assertEquals(List.of(), resolver.getOrphanNodes());
        assertEquals(List.of("jump-j1"), resolver.getNodesWithInvalidTargets());
        assertTrue(resolver.hasInvalidTarget("jump-j1"));
        assertEquals("start", resolver.resolveNodeLabel("jump-j1"));
        assertFalse(resolver.hasCycle());
    }

    @Test
    void orphanStatusAgreesWithLabelResolution() {
        FlowGraph graph = startGraph().merge(
            List.of(node("p1", FlowNodeType.DIALOGUE_BLOCK), node("p2", FlowNodeType.MENU),
                node("p3", FlowNodeType.RETURN)),
            List.of(FlowEdge.sequence("p1", "p2"), FlowEdge.sequence("jump-j1", "p3")));
        NodeConnectionResolver resolver = new NodeConnectionResolver(graph);

        List<String> orphans = resolver.getOrphanNodes();
        assertEquals(List.of("p1", "p2"), orphans);
        for (FlowNode node : graph.getNodes()) {
            boolean orphan = orphans.contains(node.getId());
            assertEquals(orphan, resolver.resolveNodeLabel(node.getId()) == null, node.getId());
            assertEquals(orphan, resolver.isOrphan(node.getId()), node.getId());
        }
        assertEquals("start", resolver.resolveNodeLabel("p3"));
    }

    @Test
    void unknownNodesAreNeitherOrphanNorLabelled() {
        NodeConnectionResolver resolver = new NodeConnectionResolver(startGraph());
        assertFalse(resolver.isOrphan("ghost"));
        assertNull(resolver.resolveNodeLabel("ghost"));
        assertTrue(resolver.getPathFromScene("ghost").isEmpty());
    }

    @Test
    void danglingEdgesAreIgnored() {
        FlowGraph graph = startGraph();
        graph.getEdges().add(FlowEdge.sequence("nowhere", "jump-j1"));
        graph.getEdges().add(FlowEdge.sequence("jump-j1", "nowhere"));

        NodeConnectionResolver resolver = new NodeConnectionResolver(graph);

        assertEquals(List.of("dialogue-d1"), resolver.getPredecessors("jump-j1"));
        assertTrue(resolver.getSuccessors("jump-j1").isEmpty());
    }

    @Test
    void invalidTargetMatchingIsExact() {
        LabelStatement start = new LabelStatement("L", "start", null, List.of(
            new JumpStatement("ok", "ending"),
            new JumpStatement("caps", "Ending"),
            new JumpStatement("space", " ending"),
            new JumpStatement("blank", "   "),
            new CallStatement("call", "ending", null)));
        LabelStatement ending = new LabelStatement("E", "ending", null, List.of());
        FlowGraph graph = builder.build(ScriptForest.of(start, ending));

        List<String> invalid = new NodeConnectionResolver(graph).getNodesWithInvalidTargets();

        assertEquals(List.of("jump-caps", "jump-space", "jump-blank"), invalid);
    }

    @Test
    void pendingSceneIsNotAValidTarget() {
        FlowNode pendingScene = node("ps", FlowNodeType.SCENE);
        pendingScene.getData().setLabel("missing");
        FlowGraph graph = startGraph().merge(List.of(pendingScene), List.of());

        NodeConnectionResolver resolver = new NodeConnectionResolver(graph);

        assertEquals(List.of("jump-j1"), resolver.getNodesWithInvalidTargets());
        assertFalse(resolver.isOrphan("ps"));
        assertEquals("missing", resolver.resolveNodeLabel("ps"));
    }

    @Test
    void sceneWithBlankNameResolvesToEmptyString() {
        FlowNode scene = node("ps", FlowNodeType.SCENE);
        FlowNode child = node("pc", FlowNodeType.DIALOGUE_BLOCK);
        FlowGraph graph = new FlowGraph(new ArrayList<>(List.of(scene, child)),
            new ArrayList<>(List.of(FlowEdge.sequence("ps", "pc"))));

        assertEquals("", new NodeConnectionResolver(graph).resolveNodeLabel("pc"));
    }

    @Test
    void navigationHelpers() {
        NodeConnectionResolver resolver = new NodeConnectionResolver(startGraph());

        assertEquals(List.of("scene-L", "dialogue-d1", "jump-j1"), resolver.getPathFromScene("jump-j1"));
        assertTrue(resolver.hasPath("scene-L", "jump-j1"));
        assertFalse(resolver.hasPath("jump-j1", "scene-L"));
        assertEquals("dialogue-d1", resolver.getPredecessor("jump-j1"));
        assertEquals("jump-j1", resolver.getSuccessor("dialogue-d1", null));
        assertNull(resolver.getSuccessor("dialogue-d1", "choice-x"));
        assertTrue(resolver.isConnected("dialogue-d1"));
        assertFalse(resolver.isConnected("scene-L"));
        assertEquals("scene-L", resolver.getSceneNode("start").getId());

        InsertPosition position = resolver.determineInsertPosition("dialogue-d1");
        assertEquals("start", position.getLabelName());
        assertEquals("scene-L", position.getAfterNodeId());
        assertEquals("jump-j1", position.getBeforeNodeId());
    }

    @Test
    void findsDrawnCycles() {
        FlowGraph graph = startGraph().merge(
            List.of(node("a", FlowNodeType.DIALOGUE_BLOCK), node("b", FlowNodeType.DIALOGUE_BLOCK)),
            List.of(FlowEdge.sequence("a", "b"), FlowEdge.sequence("b", "a")));

        NodeConnectionResolver resolver = new NodeConnectionResolver(graph);

        assertEquals(List.of(List.of("a", "b")), resolver.findCycles());
        GraphDiagnostics diagnostics = resolver.diagnose();
        assertFalse(diagnostics.isClean());
        assertEquals(List.of("a", "b"), diagnostics.getOrphanNodeIds());
    }

    @Test
    void longChainsAreDiagnosedWithoutRecursion() {
        List<Statement> body = new ArrayList<>();
        for (int i = 0; i < 20000; i++) {
            body.add(new CallStatement("c" + i, "start", null));
        }
        FlowGraph graph = builder.build(ScriptForest.of(new LabelStatement("L", "start", null, body)));

        GraphDiagnostics diagnostics = NodeConnectionResolver.diagnose(graph);

        assertEquals(20001, graph.getNodes().size());
        assertTrue(diagnostics.getOrphanNodeIds().isEmpty());
        assertTrue(diagnostics.getInvalidTargetNodeIds().isEmpty());
        assertTrue(diagnostics.getCycles().isEmpty());
        assertTrue(diagnostics.isClean());
    }
}
