package com.scriptflow.flow;

import com.scriptflow.models.FlowEdge;
import com.scriptflow.models.FlowEdgeType;
import com.scriptflow.models.FlowGraph;
import com.scriptflow.models.FlowNode;
import com.scriptflow.models.FlowNodeType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Soundness analysis over one flow graph snapshot: reachability from scene
 * nodes, jump/call target validity and directed cycles. The graph may include
 * pending nodes and their drawn edges.
 *
 * <p>Every scene node is a root. A node is an orphan exactly when
 * {@link #resolveNodeLabel(String)} returns null for it: forward
 * reachability from the roots and backward search towards a root visit the
 * same set of connections.</p>
 */
public class NodeConnectionResolver {

    private final Map<String, FlowNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<FlowEdge>> outgoing = new HashMap<>();
    private final Map<String, List<FlowEdge>> incoming = new HashMap<>();

    public NodeConnectionResolver(FlowGraph graph) {
        for (FlowNode node : graph.getNodes()) {
            nodes.put(node.getId(), node);
            outgoing.put(node.getId(), new ArrayList<>());
            incoming.put(node.getId(), new ArrayList<>());
        }
        for (FlowEdge edge : graph.getEdges()) {
            // edges to or from nodes outside the graph are dangling; ignore them
            if (!nodes.containsKey(edge.getSource()) || !nodes.containsKey(edge.getTarget())) {
                continue;
            }
            outgoing.get(edge.getSource()).add(edge);
            incoming.get(edge.getTarget()).add(edge);
        }
    }

    public static GraphDiagnostics diagnose(FlowGraph graph) {
        return new NodeConnectionResolver(graph).diagnose();
    }

    public GraphDiagnostics diagnose() {
        return new GraphDiagnostics(getOrphanNodes(), getNodesWithInvalidTargets(), findCycles());
    }

    // ---- reachability ----

    /**
     * Non-scene nodes not reachable along edges from any scene node, in graph
     * order.
     */
    public List<String> getOrphanNodes() {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (FlowNode node : nodes.values()) {
            if (isRoot(node)) {
                visited.add(node.getId());
                queue.add(node.getId());
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (FlowEdge edge : outgoing.get(current)) {
                if (visited.add(edge.getTarget())) {
                    queue.add(edge.getTarget());
                }
            }
        }
        List<String> orphans = new ArrayList<>();
        for (String id : nodes.keySet()) {
            if (!visited.contains(id)) {
                orphans.add(id);
            }
        }
        return orphans;
    }

    public boolean isOrphan(String nodeId) {
        return nodes.containsKey(nodeId) && resolveNodeLabel(nodeId) == null;
    }

    /**
     * Name of the label owning {@code nodeId}: the nearest scene node found
     * walking edges backwards. Null when no scene node can be reached or the
     * node is unknown. A scene node without a name resolves to the empty
     * string, never to null.
     */
    public String resolveNodeLabel(String nodeId) {
        FlowNode scene = findOwningScene(nodeId);
        if (scene == null) {
            return null;
        }
        return labelOf(scene);
    }

    public FlowNode getSceneNode(String labelName) {
        for (FlowNode node : nodes.values()) {
            if (isRoot(node) && labelOf(node).equals(labelName)) {
                return node;
            }
        }
        return null;
    }

    /**
     * Node ids from the owning scene node down to {@code nodeId}, both
     * included. Empty when the node is an orphan.
     */
    public List<String> getPathFromScene(String nodeId) {
        if (!nodes.containsKey(nodeId)) {
            return Collections.emptyList();
        }
        Map<String, String> nextTowardsNode = new HashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(nodeId);
        queue.add(nodeId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (isRoot(nodes.get(current))) {
                List<String> path = new ArrayList<>();
                String step = current;
                while (step != null) {
                    path.add(step);
                    step = nextTowardsNode.get(step);
                }
                return path;
            }
            for (FlowEdge edge : incoming.get(current)) {
                if (visited.add(edge.getSource())) {
                    nextTowardsNode.put(edge.getSource(), current);
                    queue.add(edge.getSource());
                }
            }
        }
        return Collections.emptyList();
    }

    public boolean hasPath(String fromNodeId, String toNodeId) {
        if (!nodes.containsKey(fromNodeId) || !nodes.containsKey(toNodeId)) {
            return false;
        }
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(fromNodeId);
        queue.add(fromNodeId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(toNodeId)) {
                return true;
            }
            for (FlowEdge edge : outgoing.get(current)) {
                if (visited.add(edge.getTarget())) {
                    queue.add(edge.getTarget());
                }
            }
        }
        return false;
    }

    // ---- neighbours ----

    public boolean isConnected(String nodeId) {
        List<FlowEdge> in = incoming.get(nodeId);
        return in != null && !in.isEmpty();
    }

    public String getPredecessor(String nodeId) {
        List<FlowEdge> in = incoming.get(nodeId);
        return in == null || in.isEmpty() ? null : in.get(0).getSource();
    }

    public List<String> getPredecessors(String nodeId) {
        List<String> result = new ArrayList<>();
        List<FlowEdge> in = incoming.get(nodeId);
        if (in != null) {
            for (FlowEdge edge : in) {
                result.add(edge.getSource());
            }
        }
        return result;
    }

    /**
     * Successor through {@code sourceHandle}, or through the sequence edge
     * when the handle is null.
     */
    public String getSuccessor(String nodeId, String sourceHandle) {
        List<FlowEdge> out = outgoing.get(nodeId);
        if (out == null) {
            return null;
        }
        for (FlowEdge edge : out) {
            if (sourceHandle == null ? edge.getType() == FlowEdgeType.SEQUENCE : sourceHandle.equals(edge.getSourceHandle())) {
                return edge.getTarget();
            }
        }
        return null;
    }

    public List<String> getSuccessors(String nodeId) {
        List<String> result = new ArrayList<>();
        List<FlowEdge> out = outgoing.get(nodeId);
        if (out != null) {
            for (FlowEdge edge : out) {
                result.add(edge.getTarget());
            }
        }
        return result;
    }

    public InsertPosition determineInsertPosition(String nodeId) {
        return new InsertPosition(resolveNodeLabel(nodeId), getPredecessor(nodeId), getSuccessor(nodeId, null));
    }

    // ---- targets ----

    /**
     * Jump and call nodes whose target is blank or does not exactly match the
     * name of a statement-backed scene node.
     */
    public List<String> getNodesWithInvalidTargets() {
        Set<String> labels = new HashSet<>();
        for (FlowNode node : nodes.values()) {
            if (node.getType() == FlowNodeType.SCENE && !node.isPending()) {
                labels.add(labelOf(node));
            }
        }
        List<String> invalid = new ArrayList<>();
        for (FlowNode node : nodes.values()) {
            if (node.getType() != FlowNodeType.JUMP && node.getType() != FlowNodeType.CALL) {
                continue;
            }
            String target = node.getData().getTarget();
            if (target == null || target.trim().isEmpty() || !labels.contains(target)) {
                invalid.add(node.getId());
            }
        }
        return invalid;
    }

    public boolean hasInvalidTarget(String nodeId) {
        return getNodesWithInvalidTargets().contains(nodeId);
    }

    // ---- cycles ----

    /**
     * Directed cycles over the drawn edges, each reported once as the node
     * ids along the cycle starting at the node where it was entered.
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> done = new HashSet<>();
        for (String start : nodes.keySet()) {
            if (done.contains(start)) {
                continue;
            }
            LinkedHashSet<String> path = new LinkedHashSet<>();
            Deque<Frame> frames = new ArrayDeque<>();
            path.add(start);
            frames.push(new Frame(start, outgoing.get(start).iterator()));
            while (!frames.isEmpty()) {
                Frame frame = frames.peek();
                if (!frame.edges.hasNext()) {
                    frames.pop();
                    path.remove(frame.nodeId);
                    done.add(frame.nodeId);
                    continue;
                }
                String next = frame.edges.next().getTarget();
                if (path.contains(next)) {
                    cycles.add(cycleFrom(path, next));
                } else if (!done.contains(next)) {
                    path.add(next);
                    frames.push(new Frame(next, outgoing.get(next).iterator()));
                }
            }
        }
        return cycles;
    }

    public boolean hasCycle() {
        return !findCycles().isEmpty();
    }

    private static List<String> cycleFrom(LinkedHashSet<String> path, String entry) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String id : path) {
            if (id.equals(entry)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(id);
            }
        }
        return cycle;
    }

    private FlowNode findOwningScene(String nodeId) {
        FlowNode start = nodes.get(nodeId);
        if (start == null) {
            return null;
        }
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(nodeId);
        queue.add(nodeId);
        while (!queue.isEmpty()) {
            FlowNode current = nodes.get(queue.poll());
            if (isRoot(current)) {
                return current;
            }
            for (FlowEdge edge : incoming.get(current.getId())) {
                if (visited.add(edge.getSource())) {
                    queue.add(edge.getSource());
                }
            }
        }
        return null;
    }

    private static boolean isRoot(FlowNode node) {
        return node.getType() == FlowNodeType.SCENE;
    }

    private static String labelOf(FlowNode scene) {
        String label = scene.getData().getLabel();
        if (label == null) {
            label = scene.getLabelName();
        }
        return label != null ? label : "";
    }

    /**
     * One node on the depth-first path with the outgoing edges still to try.
     */
    private static class Frame {
        private final String nodeId;
        private final Iterator<FlowEdge> edges;

        Frame(String nodeId, Iterator<FlowEdge> edges) {
            this.nodeId = nodeId;
            this.edges = edges;
        }
    }
}
