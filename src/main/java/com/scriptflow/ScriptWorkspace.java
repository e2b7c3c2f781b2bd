package com.scriptflow;

import com.scriptflow.blocks.BlockOperationHandler;
import com.scriptflow.blocks.BlockOperationResult;
import com.scriptflow.blocks.BlockTreeBuilder;
import com.scriptflow.blocks.BlockValidator;
import com.scriptflow.blocks.OperationFailure;
import com.scriptflow.blocks.SlotDefinition;
import com.scriptflow.blocks.SlotSchemas;
import com.scriptflow.blocks.StatementClipboard;
import com.scriptflow.blocks.ValidationIssue;
import com.scriptflow.flow.ConnectResult;
import com.scriptflow.flow.FlowGraphBuilder;
import com.scriptflow.flow.FlowView;
import com.scriptflow.flow.NodeConnectionResolver;
import com.scriptflow.flow.NodeOperationHandler;
import com.scriptflow.flow.PendingNodePool;
import com.scriptflow.models.Block;
import com.scriptflow.models.FlowGraph;
import com.scriptflow.models.FlowNode;
import com.scriptflow.models.FlowNodeData;
import com.scriptflow.models.FlowNodeType;
import com.scriptflow.models.ForestReplaceResult;
import com.scriptflow.models.LabelStatement;
import com.scriptflow.models.NodePosition;
import com.scriptflow.models.PendingNode;
import com.scriptflow.models.PendingNodeStatus;
import com.scriptflow.models.ScriptForest;
import com.scriptflow.models.ScriptLayout;
import com.scriptflow.models.Statement;
import com.scriptflow.models.StatementKind;
import com.scriptflow.storage.JsonStorage;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Owns the scripts of one workspace. Each script is a forest document with its
 * layout, its pool of pending graph nodes and its edit history; every edit goes
 * through here, one at a time. An edit is committed in memory only after its
 * forest has been written to disk, so a failed write leaves the script as it was.
 */
public class ScriptWorkspace {

    public static final String START_LABEL = "start";

    private static final Pattern SCRIPT_NAME = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_-]*");
    private static final String EXTENSION = ".json";

    private final Path scriptsDir;
    private final Path layoutDir;
    private final TemplateRegistry templates;
    private final AppLogger logger = AppLogger.get();
    private final BlockTreeBuilder blockBuilder = new BlockTreeBuilder();
    private final BlockOperationHandler blockOperations = new BlockOperationHandler();
    private final NodeOperationHandler nodeOperations = new NodeOperationHandler(blockOperations);
    private final FlowGraphBuilder flowBuilder = new FlowGraphBuilder();
    private final BlockValidator validator = new BlockValidator();
    private final Map<String, ScriptDocument> documents = new HashMap<>();
    private StatementClipboard clipboard;

    public ScriptWorkspace(Path workspacePath, TemplateRegistry templates) {
        this.scriptsDir = AppConfig.scriptsDirectory(workspacePath);
        this.layoutDir = AppConfig.layoutDirectory(workspacePath);
        this.templates = templates;
    }

    // ---- scripts ----

    public synchronized List<String> listScripts() throws IOException {
        if (!Files.isDirectory(scriptsDir)) {
            return new ArrayList<>();
        }
        List<String> names = new ArrayList<>();
        try (Stream<Path> files = Files.list(scriptsDir)) {
            files.map(path -> path.getFileName().toString())
                .filter(file -> file.endsWith(EXTENSION))
                .map(file -> file.substring(0, file.length() - EXTENSION.length()))
                .sorted()
                .forEach(names::add);
        }
        return names;
    }

    /**
     * Creates a script holding a single empty {@value #START_LABEL} label.
     */
    public synchronized ScriptForest createScript(String name) throws IOException {
        checkName(name);
        if (documents.containsKey(name) || Files.exists(scriptPath(name))) {
            throw new IllegalArgumentException("Script already exists: " + name);
        }
        ScriptForest forest = ScriptForest.of(new LabelStatement(START_LABEL, Collections.emptyList()));
        ScriptDocument document = new ScriptDocument(forest, new ScriptLayout());
        JsonStorage.writeJson(scriptPath(name), forest);
        JsonStorage.writeJson(layoutPath(name), document.layout);
        documents.put(name, document);
        logger.info("[ScriptWorkspace] Created script " + name);
        return forest;
    }

    public synchronized ScriptForest getForest(String name) throws IOException {
        return open(name).forest;
    }

    public synchronized boolean deleteScript(String name) throws IOException {
        checkName(name);
        documents.remove(name);
        boolean existed = JsonStorage.delete(scriptPath(name));
        JsonStorage.delete(layoutPath(name));
        if (existed) {
            logger.info("[ScriptWorkspace] Deleted script " + name);
        }
        return existed;
    }

    // ---- labels ----

    public synchronized BlockOperationResult addLabel(String name, String labelName) throws IOException {
        return apply(name, "addLabel", forest -> {
            SlotDefinition definition = SlotSchemas.find(StatementKind.LABEL, "name");
            String error = labelName == null || labelName.isEmpty()
                ? "Label name is required" : definition.validate(labelName);
            if (error != null) {
                return BlockOperationResult.failure(OperationFailure.VALIDATION_FAILED, forest, error);
            }
            if (forest.findLabel(labelName).isPresent()) {
                return BlockOperationResult.failure(OperationFailure.VALIDATION_FAILED, forest,
                    "Label already exists: " + labelName);
            }
            LabelStatement label = new LabelStatement(labelName, Collections.emptyList());
            return BlockOperationResult.ok(forest.addLabel(label), label.getId());
        });
    }

    public synchronized BlockOperationResult removeLabel(String name, String labelName) throws IOException {
        return apply(name, "removeLabel", forest -> {
            Optional<LabelStatement> label = forest.findLabel(labelName);
            if (label.isEmpty()) {
                return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest, "Label not found: " + labelName);
            }
            List<String> removed = forest.collectIds(label.get().getId());
            ForestReplaceResult result = forest.removeLabel(labelName);
            return BlockOperationResult.ok(result.getForest(), label.get().getId(), removed);
        });
    }

    // ---- blocks ----

    /**
     * Block trees for the whole script, decorated with the stored collapsed
     * and selected state and with validation errors.
     */
    public synchronized List<Block> blocks(String name) throws IOException {
        ScriptDocument document = open(name);
        List<Block> roots = blockBuilder.buildForest(document.forest);
        decorate(document, roots);
        return roots;
    }

    /**
     * Block tree of one label, or null when the script has no such label.
     */
    public synchronized Block labelBlocks(String name, String labelName) throws IOException {
        ScriptDocument document = open(name);
        Optional<LabelStatement> label = document.forest.findLabel(labelName);
        if (label.isEmpty()) {
            return null;
        }
        Block root = blockBuilder.buildFromLabel(label.get());
        decorate(document, List.of(root));
        return root;
    }

    public synchronized List<ValidationIssue> validate(String name) throws IOException {
        ScriptDocument document = open(name);
        return validator.validate(blockBuilder.buildForest(document.forest), document.forest.getLabelNames());
    }

    public synchronized BlockOperationResult addBlock(String name, StatementKind kind, String parentId, int index)
            throws IOException {
        return apply(name, "addBlock", forest -> blockOperations.addBlock(forest, kind, parentId, index));
    }

    public synchronized BlockOperationResult moveBlock(String name, String statementId, String newParentId, int newIndex)
            throws IOException {
        return apply(name, "moveBlock", forest -> blockOperations.moveBlock(forest, statementId, newParentId, newIndex));
    }

    public synchronized BlockOperationResult moveBlockAcrossLabels(String name, String statementId, String sourceLabel,
                                                                   String targetLabel, String targetContainerId,
                                                                   int index) throws IOException {
        return apply(name, "moveBlockAcrossLabels", forest -> blockOperations.moveBlockAcrossLabels(
            forest, statementId, sourceLabel, targetLabel, targetContainerId, index));
    }

    public synchronized BlockOperationResult deleteBlock(String name, String statementId) throws IOException {
        return apply(name, "deleteBlock", forest -> blockOperations.deleteBlock(forest, statementId));
    }

    public synchronized BlockOperationResult updateSlot(String name, String statementId, String slotName, Object value)
            throws IOException {
        return apply(name, "updateSlot", forest -> blockOperations.updateSlot(forest, statementId, slotName, value));
    }

    /**
     * Copies a statement subtree to the workspace clipboard, which is shared by
     * all scripts. Returns false when the statement does not exist.
     */
    public synchronized boolean copyBlock(String name, String statementId) throws IOException {
        Optional<StatementClipboard> copied = blockOperations.copyBlock(open(name).forest, statementId);
        if (copied.isEmpty()) {
            return false;
        }
        clipboard = copied.get();
        return true;
    }

    public synchronized BlockOperationResult pasteBlock(String name, String containerId, int index) throws IOException {
        StatementClipboard current = clipboard;
        return apply(name, "pasteBlock", forest -> blockOperations.pasteBlock(forest, current, containerId, index));
    }

    /**
     * Inserts fresh statements built from a template's blocks.
     */
    public synchronized BlockOperationResult applyTemplate(String name, String templateId, String containerId, int index)
            throws IOException {
        List<Statement> statements = templates.instantiate(templateId);
        StatementClipboard contents = new StatementClipboard(statements, null);
        return apply(name, "applyTemplate", forest -> blockOperations.pasteBlock(forest, contents, containerId, index));
    }

    // ---- flow ----

    /**
     * The flow graph merged with the pending nodes, with stored positions
     * applied and diagnostics computed over the merged graph.
     */
    public synchronized FlowView flow(String name) throws IOException {
        ScriptDocument document = open(name);
        FlowGraph built = flowBuilder.build(document.forest);
        for (FlowNode node : built.getNodes()) {
            NodePosition position = document.layout.getNodePositions().get(node.getId());
            if (position != null) {
                node.setPosition(position);
            }
        }
        FlowGraph merged = built.merge(document.pool.toFlowNodes(), document.pool.toFlowEdges());
        return new FlowView(merged, NodeConnectionResolver.diagnose(merged));
    }

    public synchronized PendingNode createPendingNode(String name, FlowNodeType type, NodePosition position)
            throws IOException {
        if (type == null) {
            throw new IllegalArgumentException("Node type is required");
        }
        PendingNode node = nodeOperations.createNode(open(name).pool, type, position);
        logger.info("[ScriptWorkspace] Staged " + type.getTag() + " node " + node.getId() + " in " + name);
        return node;
    }

    /**
     * Connects two graph nodes. When the connection folds pending nodes into
     * the forest, the synced entries leave the pool, their positions move to
     * the layout under the ids of the nodes now backing them, and pending
     * entries that lost their path to a scene become orphans.
     */
    public synchronized ConnectResult connect(String name, String sourceNodeId, String sourceHandle, String targetNodeId)
            throws IOException {
        ScriptDocument document = open(name);
        FlowGraph graph = flowBuilder.build(document.forest);
        PendingNodePool working = document.pool.copy();
        ConnectResult result = nodeOperations.connect(document.forest, graph, working,
            sourceNodeId, sourceHandle, targetNodeId);
        if (!result.isSuccess()) {
            logger.warn("[ScriptWorkspace] connect " + sourceNodeId + " -> " + targetNodeId + " in " + name
                + " failed: " + result.getReason() + " " + result.getMessage());
            return result;
        }
        if (!result.isFolded()) {
            document.pool = working;
            return result;
        }
        commit(name, document, result.getForest());
        FlowGraph rebuilt = flowBuilder.build(document.forest);
        for (PendingNode synced : working.getByStatus(PendingNodeStatus.SYNCED)) {
            FlowNode backing = findBackingNode(rebuilt, synced.getStatementId());
            if (backing != null && synced.getPosition() != null) {
                document.layout.getNodePositions().put(backing.getId(), synced.getPosition());
            }
            working.remove(synced.getId());
        }
        document.pool = working;
        List<String> orphaned = nodeOperations.refreshOrphans(rebuilt, document.pool);
        if (!orphaned.isEmpty()) {
            logger.warn("[ScriptWorkspace] Pending nodes orphaned in " + name + ": " + orphaned);
        }
        syncLayout(name, document, rebuilt);
        return result;
    }

    public synchronized boolean updateNodePosition(String name, String nodeId, NodePosition position)
            throws IOException {
        ScriptDocument document = open(name);
        if (document.pool.updatePosition(nodeId, position)) {
            return true;
        }
        if (flowBuilder.build(document.forest).findNode(nodeId) == null) {
            return false;
        }
        document.layout.getNodePositions().put(nodeId, position);
        persistLayout(name, document);
        return true;
    }

    public synchronized boolean updatePendingData(String name, String nodeId, FlowNodeData patch) throws IOException {
        return open(name).pool.updateData(nodeId, patch);
    }

    public synchronized boolean removePendingNode(String name, String nodeId) throws IOException {
        return open(name).pool.remove(nodeId) != null;
    }

    /**
     * Deletes a graph node: a pending entry, or the statements behind a built
     * node.
     */
    public synchronized BlockOperationResult deleteNode(String name, String nodeId) throws IOException {
        ScriptDocument document = open(name);
        FlowGraph graph = flowBuilder.build(document.forest);
        PendingNodePool working = document.pool.copy();
        BlockOperationResult result = apply(name, "deleteNode",
            forest -> nodeOperations.deleteNode(forest, graph, working, nodeId));
        if (result.isSuccess()) {
            document.pool = working;
            nodeOperations.refreshOrphans(flowBuilder.build(document.forest), document.pool);
        }
        return result;
    }

    // ---- layout ----

    public synchronized ScriptLayout getLayout(String name) throws IOException {
        return open(name).layout;
    }

    public synchronized ScriptLayout saveLayout(String name, ScriptLayout layout) throws IOException {
        ScriptDocument document = open(name);
        ScriptLayout next = layout != null ? layout : new ScriptLayout();
        ScriptLayout previous = document.layout;
        document.layout = next;
        try {
            syncLayout(name, document, flowBuilder.build(document.forest));
        } catch (IOException e) {
            document.layout = previous;
            throw e;
        }
        return next;
    }

    // ---- history ----

    /**
     * Restores the forest as it was before the last edit. Returns the restored
     * forest, or null when there is nothing to undo. Pending nodes are kept.
     */
    public synchronized ScriptForest undo(String name) throws IOException {
        ScriptDocument document = open(name);
        ScriptForest previous = document.history.peekUndo();
        if (previous == null) {
            return null;
        }
        JsonStorage.writeJson(scriptPath(name), previous);
        document.forest = document.history.undo(document.forest);
        restored(name, document, "Undid");
        return document.forest;
    }

    public synchronized ScriptForest redo(String name) throws IOException {
        ScriptDocument document = open(name);
        ScriptForest next = document.history.peekRedo();
        if (next == null) {
            return null;
        }
        JsonStorage.writeJson(scriptPath(name), next);
        document.forest = document.history.redo(document.forest);
        restored(name, document, "Redid");
        return document.forest;
    }

    public synchronized int undoCount(String name) throws IOException {
        return open(name).history.undoCount();
    }

    public synchronized int redoCount(String name) throws IOException {
        return open(name).history.redoCount();
    }

    // ---- internals ----

    /**
     * Runs one forest operation. Success writes and then commits the new
     * forest; failure leaves the document untouched.
     */
    private BlockOperationResult apply(String name, String operation,
                                       Function<ScriptForest, BlockOperationResult> edit) throws IOException {
        ScriptDocument document = open(name);
        BlockOperationResult result = edit.apply(document.forest);
        if (!result.isSuccess()) {
            logger.warn("[ScriptWorkspace] " + operation + " on " + name + " failed: "
                + result.getReason() + " " + result.getMessage());
            return result;
        }
        if (result.getForest() != document.forest) {
            commit(name, document, result.getForest());
            syncLayout(name, document, flowBuilder.build(document.forest));
        }
        return result;
    }

    private ScriptDocument open(String name) throws IOException {
        checkName(name);
        ScriptDocument document = documents.get(name);
        if (document != null) {
            return document;
        }
        ScriptForest forest = JsonStorage.readJson(scriptPath(name), ScriptForest.class);
        if (forest == null) {
            throw new FileNotFoundException("Script not found: " + name);
        }
        ScriptLayout layout = JsonStorage.readJson(layoutPath(name), ScriptLayout.class);
        document = new ScriptDocument(forest, layout != null ? layout : new ScriptLayout());
        documents.put(name, document);
        return document;
    }

    /**
     * Writes {@code next} and only then makes it the current forest, recording
     * the replaced one for undo.
     */
    private void commit(String name, ScriptDocument document, ScriptForest next) throws IOException {
        JsonStorage.writeJson(scriptPath(name), next);
        document.history.record(document.forest);
        document.forest = next;
    }

    private void restored(String name, ScriptDocument document, String action) throws IOException {
        FlowGraph graph = flowBuilder.build(document.forest);
        List<String> orphaned = nodeOperations.refreshOrphans(graph, document.pool);
        if (!orphaned.isEmpty()) {
            logger.warn("[ScriptWorkspace] Pending nodes orphaned in " + name + ": " + orphaned);
        }
        syncLayout(name, document, graph);
        logger.info("[ScriptWorkspace] " + action + " edit in " + name + " (" + document.history.undoCount()
            + " to undo, " + document.history.redoCount() + " to redo)");
    }

    /**
     * Drops layout entries for statements and flow nodes that no longer exist,
     * then writes the layout.
     */
    private void syncLayout(String name, ScriptDocument document, FlowGraph graph) throws IOException {
        document.layout.retainStatements(allStatementIds(document.forest));
        List<String> nodeIds = new ArrayList<>();
        for (FlowNode node : graph.getNodes()) {
            nodeIds.add(node.getId());
        }
        document.layout.retainNodes(nodeIds);
        persistLayout(name, document);
    }

    private void persistLayout(String name, ScriptDocument document) throws IOException {
        document.layout.setUpdatedAt(System.currentTimeMillis());
        JsonStorage.writeJson(layoutPath(name), document.layout);
    }

    private void decorate(ScriptDocument document, List<Block> roots) {
        Set<String> collapsed = new HashSet<>(document.layout.getCollapsed());
        Set<String> selected = new HashSet<>(document.layout.getSelected());
        Deque<Block> pending = new ArrayDeque<>(roots);
        while (!pending.isEmpty()) {
            Block block = pending.pop();
            block.setCollapsed(collapsed.contains(block.getStatementId()));
            block.setSelected(selected.contains(block.getStatementId()));
            pending.addAll(block.getChildren());
        }
        List<ValidationIssue> issues = validator.validate(roots, document.forest.getLabelNames());
        validator.markErrors(roots, issues);
    }

    private static FlowNode findBackingNode(FlowGraph graph, String statementId) {
        if (statementId == null) {
            return null;
        }
        for (FlowNode node : graph.getNodes()) {
            if (statementId.equals(node.getStatementId()) || node.getStatementIds().contains(statementId)) {
                return node;
            }
        }
        return null;
    }

    private static Set<String> allStatementIds(ScriptForest forest) {
        Set<String> ids = new HashSet<>();
        for (Statement statement : forest.getStatements()) {
            ids.addAll(forest.collectIds(statement.getId()));
        }
        return ids;
    }

    private static void checkName(String name) {
        if (name == null || !SCRIPT_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid script name: " + name);
        }
    }

    private Path scriptPath(String name) {
        return scriptsDir.resolve(name + EXTENSION);
    }

    private Path layoutPath(String name) {
        return layoutDir.resolve(name + EXTENSION);
    }

    private static class ScriptDocument {
        private ScriptForest forest;
        private ScriptLayout layout;
        private PendingNodePool pool = new PendingNodePool();
        private final EditHistory history = new EditHistory();

        ScriptDocument(ScriptForest forest, ScriptLayout layout) {
            this.forest = forest;
            this.layout = layout;
        }
    }
}
