package com.scriptflow.flow;

import com.scriptflow.blocks.BlockOperationHandler;
import com.scriptflow.blocks.BlockOperationResult;
import com.scriptflow.blocks.OperationFailure;
import com.scriptflow.models.BranchStatement;
import com.scriptflow.models.CallStatement;
import com.scriptflow.models.ChoiceStatement;
import com.scriptflow.models.DialogueStatement;
import com.scriptflow.models.FlowGraph;
import com.scriptflow.models.FlowNode;
import com.scriptflow.models.FlowNodeData;
import com.scriptflow.models.FlowNodeType;
import com.scriptflow.models.IfStatement;
import com.scriptflow.models.JumpStatement;
import com.scriptflow.models.LabelStatement;
import com.scriptflow.models.MenuStatement;
import com.scriptflow.models.NodePosition;
import com.scriptflow.models.PendingNode;
import com.scriptflow.models.PendingNodeStatus;
import com.scriptflow.models.ReturnStatement;
import com.scriptflow.models.ScriptForest;
import com.scriptflow.models.Statement;
import com.scriptflow.models.StatementLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Graph-surface edits: creating pending nodes, connecting nodes and folding
 * connected pending nodes into the forest.
 *
 * <p>Where folded statements land depends on the source of the connection:
 * a scene node inserts at the start of its label body, a menu or condition
 * port at the start of that choice or branch body, and any other node right
 * after its last statement. Connecting to a scene node, existing or pending,
 * writes a jump to that label instead.</p>
 */
public class NodeOperationHandler {

    public static final String DEFAULT_LABEL = "new_label";

    private final BlockOperationHandler blockOperations;

    public NodeOperationHandler(BlockOperationHandler blockOperations) {
        this.blockOperations = blockOperations;
    }

    /**
     * Stages a new node with type-specific default content.
     */
    public PendingNode createNode(PendingNodePool pool, FlowNodeType type, NodePosition position) {
        PendingNode node = PendingNodePool.createPendingNode(type, position, defaultData(type));
        pool.add(node);
        return node;
    }

    public ConnectResult connect(ScriptForest forest, FlowGraph graph, PendingNodePool pool,
                                 String sourceNodeId, String sourceHandle, String targetNodeId) {
        FlowNode source = lookup(graph, pool, sourceNodeId);
        FlowNode target = lookup(graph, pool, targetNodeId);
        if (source == null) {
            return ConnectResult.failure(OperationFailure.NOT_FOUND, forest, "Node not found: " + sourceNodeId);
        }
        if (target == null) {
            return ConnectResult.failure(OperationFailure.NOT_FOUND, forest, "Node not found: " + targetNodeId);
        }
        if (sourceNodeId.equals(targetNodeId)) {
            return ConnectResult.failure(OperationFailure.WOULD_CREATE_CYCLE, forest, "A node cannot connect to itself");
        }
        boolean sourcePending = pool.isPending(sourceNodeId);
        boolean targetPending = pool.isPending(targetNodeId);
        if (!targetPending && target.getType() != FlowNodeType.SCENE) {
            return ConnectResult.failure(OperationFailure.VALIDATION_FAILED, forest,
                "Node " + targetNodeId + " is already part of the script; move its blocks instead");
        }
        if (sourcePending && source.getType() != FlowNodeType.SCENE) {
            if (!targetPending) {
                return ConnectResult.failure(OperationFailure.VALIDATION_FAILED, forest,
                    "Connect node " + sourceNodeId + " to the script first");
            }
            pool.updateConnection(targetNodeId, sourceNodeId, sourceHandle);
            FlowGraph staged = graph.merge(pool.toFlowNodes(), pool.toFlowEdges());
            if (new NodeConnectionResolver(staged).isOrphan(targetNodeId)) {
                // the edge is kept, but only an edge from a reachable node counts as a connection
                pool.updateStatus(targetNodeId, PendingNodeStatus.CREATED);
            }
            return ConnectResult.staged(forest);
        }

        ScriptForest working = forest;
        Placement placement;
        String materializedSource = null;
        if (sourcePending) {
            LabelStatement label = new LabelStatement(uniqueLabelName(working, source.getData().getLabel()),
                Collections.emptyList());
            working = working.addLabel(label);
            materializedSource = label.getName();
            placement = new Placement(label.getId(), 0, label.getName());
        } else {
            Optional<Placement> after = placeAfter(working, source, sourceHandle);
            if (after.isEmpty()) {
                return ConnectResult.failure(OperationFailure.INVALID_CONTAINER, forest,
                    "Cannot attach after node " + sourceNodeId + " through " + sourceHandle);
            }
            placement = after.get();
            if (source.getType() == FlowNodeType.SCENE && target.getType() == FlowNodeType.SCENE) {
                // scene to scene: the jump closes the label body
                placement = new Placement(placement.containerId, Integer.MAX_VALUE, placement.labelName);
            }
        }

        List<Statement> inserted = new ArrayList<>();
        String syncedLabel = placement.labelName;
        String createdLabel = null;
        if (target.getType() == FlowNodeType.SCENE) {
            String targetLabel;
            if (targetPending) {
                LabelStatement label = new LabelStatement(uniqueLabelName(working, target.getData().getLabel()),
                    Collections.emptyList());
                working = working.addLabel(label);
                targetLabel = label.getName();
                createdLabel = label.getId();
            } else {
                targetLabel = target.getLabelName();
            }
            inserted.add(new JumpStatement(targetLabel));
            if (targetPending) {
                syncedLabel = targetLabel;
            }
        } else {
            inserted.addAll(statementsFor(target));
        }

        int index = placement.index;
        for (Statement statement : inserted) {
            working = working.insert(placement.containerId, index++, statement).getForest();
        }

        if (materializedSource != null) {
            Optional<LabelStatement> label = working.findLabel(materializedSource);
            pool.markSynced(sourceNodeId, label.map(Statement::getId).orElse(null), materializedSource);
        }
        if (targetPending) {
            pool.updateConnection(targetNodeId, sourceNodeId, sourceHandle);
            String backing = createdLabel != null ? createdLabel : inserted.get(0).getId();
            pool.markSynced(targetNodeId, backing, syncedLabel);
        }

        List<String> ids = new ArrayList<>();
        for (Statement statement : inserted) {
            ids.add(statement.getId());
        }
        return ConnectResult.folded(working, ids, placement.labelName);
    }

    /**
     * Deletes a pending entry, or every statement behind a built node. A scene
     * node stands for its whole label.
     */
    public BlockOperationResult deleteNode(ScriptForest forest, FlowGraph graph, PendingNodePool pool, String nodeId) {
        if (pool.isPending(nodeId)) {
            pool.remove(nodeId);
            return BlockOperationResult.ok(forest, null);
        }
        FlowNode node = graph.findNode(nodeId);
        if (node == null) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest, "Node not found: " + nodeId);
        }
        ScriptForest working = forest;
        List<String> removed = new ArrayList<>();
        for (String statementId : node.getStatementIds()) {
            BlockOperationResult result = blockOperations.deleteBlock(working, statementId);
            if (!result.isSuccess()) {
                return BlockOperationResult.failure(result.getReason(), forest, result.getMessage());
            }
            working = result.getForest();
            removed.addAll(result.getAffectedIds());
        }
        return BlockOperationResult.ok(working, node.getStatementId(), removed);
    }

    /**
     * Marks CONNECTED entries that no longer reach a scene node as ORPHAN and
     * returns their ids. Entries that were never connected stay CREATED.
     */
    public List<String> refreshOrphans(FlowGraph graph, PendingNodePool pool) {
        FlowGraph merged = graph.merge(pool.toFlowNodes(), pool.toFlowEdges());
        NodeConnectionResolver resolver = new NodeConnectionResolver(merged);
        List<String> orphaned = new ArrayList<>();
        for (String nodeId : resolver.getOrphanNodes()) {
            PendingNode node = pool.get(nodeId);
            if (node != null && node.getStatus() == PendingNodeStatus.CONNECTED) {
                pool.updateStatus(nodeId, PendingNodeStatus.ORPHAN);
                orphaned.add(nodeId);
            }
        }
        return orphaned;
    }

    public static String uniqueLabelName(ScriptForest forest, String base) {
        String root = (base == null || base.trim().isEmpty()) ? DEFAULT_LABEL : base.trim();
        if (forest.findLabel(root).isEmpty()) {
            return root;
        }
        int suffix = 2;
        while (forest.findLabel(root + "_" + suffix).isPresent()) {
            suffix++;
        }
        return root + "_" + suffix;
    }

    static FlowNodeData defaultData(FlowNodeType type) {
        FlowNodeData data = new FlowNodeData();
        switch (type) {
            case SCENE:
                data.setLabel(DEFAULT_LABEL);
                data.setPreview(new ArrayList<>());
                data.setExitType("fall-through");
                break;
            case DIALOGUE_BLOCK:
                data.setLines(new ArrayList<>(List.of(new FlowNodeData.DialogueLine(null, "New dialogue", null))));
                data.setCommands(new ArrayList<>());
                break;
            case MENU:
                data.setChoices(new ArrayList<>(List.of(
                    new FlowNodeData.Port(null, null, "Choice 1", null),
                    new FlowNodeData.Port(null, null, "Choice 2", null))));
                break;
            case CONDITION:
                data.setBranches(new ArrayList<>(List.of(
                    new FlowNodeData.Port(null, null, null, "True"),
                    new FlowNodeData.Port(null, null, null, null))));
                break;
            case JUMP:
            case CALL:
                data.setTarget("");
                break;
            case RETURN:
            default:
                break;
        }
        return data;
    }

    /**
     * Statements a pending node folds into.
     */
    static List<Statement> statementsFor(FlowNode node) {
        FlowNodeData data = node.getData();
        List<Statement> statements = new ArrayList<>();
        switch (node.getType()) {
            case DIALOGUE_BLOCK:
                if (data.getLines() != null) {
                    for (FlowNodeData.DialogueLine line : data.getLines()) {
                        statements.add(new DialogueStatement(line.getSpeaker(), line.getText()));
                    }
                }
                if (statements.isEmpty()) {
                    statements.add(new DialogueStatement(null, "New dialogue"));
                }
                break;
            case MENU: {
                List<ChoiceStatement> choices = new ArrayList<>();
                if (data.getChoices() != null) {
                    for (FlowNodeData.Port port : data.getChoices()) {
                        choices.add(new ChoiceStatement(null, port.getText(), port.getCondition(), null));
                    }
                }
                statements.add(new MenuStatement(null, data.getPrompt(), choices));
                break;
            }
            case CONDITION: {
                List<BranchStatement> branches = new ArrayList<>();
                if (data.getBranches() != null) {
                    for (FlowNodeData.Port port : data.getBranches()) {
                        branches.add(new BranchStatement(port.getCondition(), null));
                    }
                }
                statements.add(new IfStatement(branches));
                break;
            }
            case JUMP:
                statements.add(new JumpStatement(data.getTarget()));
                break;
            case CALL:
                statements.add(new CallStatement(null, data.getTarget(), data.getArguments()));
                break;
            case RETURN:
                statements.add(new ReturnStatement(null, data.getValue()));
                break;
            default:
                throw new IllegalArgumentException("Node type " + node.getType() + " does not fold into statements");
        }
        return statements;
    }

    private static FlowNode lookup(FlowGraph graph, PendingNodePool pool, String nodeId) {
        if (nodeId == null) {
            return null;
        }
        PendingNode pending = pool.get(nodeId);
        if (pending != null) {
            return pending.getStatus() == PendingNodeStatus.SYNCED ? null : pending.toFlowNode();
        }
        return graph.findNode(nodeId);
    }

    private Optional<Placement> placeAfter(ScriptForest forest, FlowNode source, String sourceHandle) {
        switch (source.getType()) {
            case SCENE: {
                Optional<StatementLocation> location = forest.findLocation(source.getStatementId());
                if (location.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new Placement(source.getStatementId(), 0, location.get().getLabelName()));
            }
            case MENU:
                if (sourceHandle != null && sourceHandle.startsWith(FlowGraphBuilder.CHOICE_PORT_PREFIX)) {
                    return intoPort(forest, source,
                        sourceHandle.substring(FlowGraphBuilder.CHOICE_PORT_PREFIX.length()));
                }
                break;
            case CONDITION:
                if (sourceHandle != null && sourceHandle.startsWith(FlowGraphBuilder.BRANCH_PORT_PREFIX)) {
                    return intoPort(forest, source,
                        sourceHandle.substring(FlowGraphBuilder.BRANCH_PORT_PREFIX.length()));
                }
                break;
            default:
                break;
        }
        List<String> statementIds = source.getStatementIds();
        if (statementIds.isEmpty()) {
            return Optional.empty();
        }
        Optional<StatementLocation> last = forest.findLocation(statementIds.get(statementIds.size() - 1));
        if (last.isEmpty() || last.get().isTopLevel()) {
            return Optional.empty();
        }
        StatementLocation location = last.get();
        return Optional.of(new Placement(location.getParentId(), location.getIndex() + 1, location.getLabelName()));
    }

    private Optional<Placement> intoPort(ScriptForest forest, FlowNode source, String portStatementId) {
        Optional<StatementLocation> location = forest.findLocation(portStatementId);
        if (location.isEmpty() || !source.getStatementId().equals(location.get().getParentId())) {
            return Optional.empty();
        }
        return Optional.of(new Placement(portStatementId, 0, location.get().getLabelName()));
    }

    private static class Placement {
        private final String containerId;
        private final int index;
        private final String labelName;

        Placement(String containerId, int index, String labelName) {
            this.containerId = containerId;
            this.index = index;
            this.labelName = labelName;
        }
    }
}
