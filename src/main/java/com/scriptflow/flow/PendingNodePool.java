package com.scriptflow.flow;

import com.scriptflow.models.FlowEdge;
import com.scriptflow.models.FlowEdgeType;
import com.scriptflow.models.FlowNode;
import com.scriptflow.models.FlowNodeData;
import com.scriptflow.models.FlowNodeType;
import com.scriptflow.models.NodePosition;
import com.scriptflow.models.PendingNode;
import com.scriptflow.models.PendingNodeStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Staging area for flow nodes that have no statement yet, keyed by node id.
 *
 * <p>Not thread-safe and not reentrant: the pool has a single owner, which
 * serializes calls. Entries are never evicted by the pool itself; a SYNCED
 * entry stays until its owner removes it.</p>
 */
public class PendingNodePool {

    public static final String ID_PREFIX = "pending-";

    private final Map<String, PendingNode> nodes = new LinkedHashMap<>();

    public static PendingNode createPendingNode(FlowNodeType type, NodePosition position, FlowNodeData data) {
        return new PendingNode(ID_PREFIX + UUID.randomUUID(), type, data, position);
    }

    /**
     * Adds or, when the id is already present, replaces in place.
     */
    public void add(PendingNode node) {
        if (node == null || node.getId() == null) {
            throw new IllegalArgumentException("Pending node id is required");
        }
        nodes.put(node.getId(), node);
    }

    public PendingNode remove(String nodeId) {
        return nodes.remove(nodeId);
    }

    public PendingNode get(String nodeId) {
        return nodes.get(nodeId);
    }

    public List<PendingNode> getAll() {
        return new ArrayList<>(nodes.values());
    }

    public boolean isPending(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public void clear() {
        nodes.clear();
    }

    /**
     * Independent copy of every entry, for edits that may still be abandoned.
     */
    public PendingNodePool copy() {
        PendingNodePool copy = new PendingNodePool();
        for (PendingNode node : nodes.values()) {
            copy.nodes.put(node.getId(), node.copy());
        }
        return copy;
    }

    public int size() {
        return nodes.size();
    }

    public boolean updateStatus(String nodeId, PendingNodeStatus status) {
        PendingNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        node.setStatus(status);
        return true;
    }

    /**
     * Records the inbound connection and forces the status to CONNECTED.
     */
    public boolean updateConnection(String nodeId, String sourceNodeId, String sourceHandle) {
        PendingNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        node.setSourceNodeId(sourceNodeId);
        node.setSourceHandle(sourceHandle);
        node.setStatus(PendingNodeStatus.CONNECTED);
        return true;
    }

    /**
     * Forces SYNCED and stamps the statement that now backs this node.
     */
    public boolean markSynced(String nodeId, String statementId, String labelName) {
        PendingNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        node.setStatementId(statementId);
        node.setLabelName(labelName);
        node.setStatus(PendingNodeStatus.SYNCED);
        return true;
    }

    /**
     * Merges the non-null fields of {@code patch} into the node payload.
     */
    public boolean updateData(String nodeId, FlowNodeData patch) {
        PendingNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        node.getData().mergeFrom(patch);
        return true;
    }

    public boolean updatePosition(String nodeId, NodePosition position) {
        PendingNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        node.setPosition(position);
        return true;
    }

    public List<PendingNode> getByStatus(PendingNodeStatus status) {
        List<PendingNode> result = new ArrayList<>();
        for (PendingNode node : nodes.values()) {
            if (node.getStatus() == status) {
                result.add(node);
            }
        }
        return result;
    }

    public List<PendingNode> getOrphanNodes() {
        return getByStatus(PendingNodeStatus.ORPHAN);
    }

    public List<PendingNode> getConnectedNodes() {
        return getByStatus(PendingNodeStatus.CONNECTED);
    }

    /**
     * Graph views of every entry not yet synced.
     */
    public List<FlowNode> toFlowNodes() {
        List<FlowNode> result = new ArrayList<>();
        for (PendingNode node : nodes.values()) {
            if (node.getStatus() != PendingNodeStatus.SYNCED) {
                result.add(node.toFlowNode());
            }
        }
        return result;
    }

    /**
     * The drawn inbound edges of every entry not yet synced.
     */
    public List<FlowEdge> toFlowEdges() {
        List<FlowEdge> result = new ArrayList<>();
        for (PendingNode node : nodes.values()) {
            if (node.getStatus() == PendingNodeStatus.SYNCED || node.getSourceNodeId() == null) {
                continue;
            }
            result.add(new FlowEdge(node.getSourceNodeId(), node.getId(), node.getSourceHandle(),
                edgeTypeFor(node.getSourceHandle())));
        }
        return result;
    }

    static FlowEdgeType edgeTypeFor(String sourceHandle) {
        if (sourceHandle == null) {
            return FlowEdgeType.SEQUENCE;
        }
        if (sourceHandle.startsWith(FlowGraphBuilder.CHOICE_PORT_PREFIX)) {
            return FlowEdgeType.CHOICE;
        }
        if (sourceHandle.startsWith(FlowGraphBuilder.BRANCH_PORT_PREFIX)) {
            return FlowEdgeType.CONDITION;
        }
        return FlowEdgeType.SEQUENCE;
    }
}
