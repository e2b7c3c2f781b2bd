package com.scriptflow.blocks;

import com.scriptflow.models.ForestReplaceResult;
import com.scriptflow.models.LabelStatement;
import com.scriptflow.models.ScriptForest;
import com.scriptflow.models.Statement;
import com.scriptflow.models.StatementKind;
import com.scriptflow.models.StatementLocation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structural edits on a script forest. Every operation takes the current
 * forest and returns a {@link BlockOperationResult}; the input forest is
 * never modified, and on failure the result carries it back unchanged.
 * Moves compute removal and insertion on local values and publish only the
 * final forest.
 */
public class BlockOperationHandler {

    /**
     * Inserts a default-initialized statement of {@code kind} into the
     * sequence of {@code parentContainerId}, index clamped to its bounds.
     */
    public BlockOperationResult addBlock(ScriptForest forest, StatementKind kind, String parentContainerId, int index) {
        if (kind == null) {
            return BlockOperationResult.failure(OperationFailure.VALIDATION_FAILED, forest, "Block type is required");
        }
        Optional<Statement> parent = forest.findById(parentContainerId);
        if (parent.isEmpty()) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest,
                "Container not found: " + parentContainerId);
        }
        String rejection = checkContainer(parent.get(), kind);
        if (rejection != null) {
            return BlockOperationResult.failure(OperationFailure.INVALID_CONTAINER, forest, rejection);
        }
        Statement created = StatementFactory.create(kind);
        ForestReplaceResult inserted = forest.insert(parentContainerId, index, created);
        return BlockOperationResult.ok(inserted.getForest(), created.getId());
    }

    /**
     * Moves a statement to another position inside the same label. When the
     * statement moves downward within its own sequence, {@code newIndex} is
     * read as a drop position in the list before removal.
     */
    public BlockOperationResult moveBlock(ScriptForest forest, String statementId, String newParentContainerId, int newIndex) {
        Optional<Statement> statement = forest.findById(statementId);
        if (statement.isEmpty()) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest, "Statement not found: " + statementId);
        }
        Optional<Statement> target = forest.findById(newParentContainerId);
        if (target.isEmpty()) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest,
                "Container not found: " + newParentContainerId);
        }
        if (statementId.equals(newParentContainerId) || forest.isDescendant(statementId, newParentContainerId)) {
            return BlockOperationResult.failure(OperationFailure.WOULD_CREATE_CYCLE, forest,
                "Cannot move a block into itself or its own children");
        }
        String rejection = checkContainer(target.get(), statement.get().getKind());
        if (rejection != null) {
            return BlockOperationResult.failure(OperationFailure.INVALID_CONTAINER, forest, rejection);
        }
        StatementLocation source = forest.findLocation(statementId).orElseThrow();
        StatementLocation destination = forest.findLocation(newParentContainerId).orElseThrow();
        if (!Objects.equals(source.getLabelName(), destination.getLabelName())) {
            return BlockOperationResult.failure(OperationFailure.INVALID_CONTAINER, forest,
                "Target container belongs to another label; use a cross-label move");
        }
        return relocate(forest, statement.get(), source, newParentContainerId, newIndex);
    }

    /**
     * Moves a statement from {@code sourceLabel} into {@code targetLabel} in
     * one step. An empty {@code targetContainerId} means the target label's
     * own body.
     */
    public BlockOperationResult moveBlockAcrossLabels(ScriptForest forest, String statementId, String sourceLabel,
                                                      String targetLabel, String targetContainerId, int index) {
        Optional<LabelStatement> from = forest.findLabel(sourceLabel);
        if (from.isEmpty()) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest, "Label not found: " + sourceLabel);
        }
        Optional<LabelStatement> to = forest.findLabel(targetLabel);
        if (to.isEmpty()) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest, "Label not found: " + targetLabel);
        }
        Optional<Statement> statement = forest.findById(statementId);
        if (statement.isEmpty()) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest, "Statement not found: " + statementId);
        }
        StatementLocation source = forest.findLocation(statementId).orElseThrow();
        if (statement.get().getKind() == StatementKind.LABEL || !sourceLabel.equals(source.getLabelName())) {
            return BlockOperationResult.failure(OperationFailure.INVALID_CONTAINER, forest,
                "Statement " + statementId + " is not inside label " + sourceLabel);
        }
        String containerId = (targetContainerId == null || targetContainerId.isEmpty())
            ? to.get().getId()
            : targetContainerId;
        Optional<Statement> container = forest.findById(containerId);
        if (container.isEmpty()) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest, "Container not found: " + containerId);
        }
        if (statementId.equals(containerId) || forest.isDescendant(statementId, containerId)) {
            return BlockOperationResult.failure(OperationFailure.WOULD_CREATE_CYCLE, forest,
                "Cannot move a block into itself or its own children");
        }
        StatementLocation destination = forest.findLocation(containerId).orElseThrow();
        if (!targetLabel.equals(destination.getLabelName())) {
            return BlockOperationResult.failure(OperationFailure.INVALID_CONTAINER, forest,
                "Container " + containerId + " is not inside label " + targetLabel);
        }
        String rejection = checkContainer(container.get(), statement.get().getKind());
        if (rejection != null) {
            return BlockOperationResult.failure(OperationFailure.INVALID_CONTAINER, forest, rejection);
        }
        return relocate(forest, statement.get(), source, containerId, index);
    }

    /**
     * Removes a statement with its whole owned subtree.
     */
    public BlockOperationResult deleteBlock(ScriptForest forest, String statementId) {
        List<String> removed = forest.collectIds(statementId);
        ForestReplaceResult result = forest.remove(statementId);
        if (!result.isFound()) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest, "Statement not found: " + statementId);
        }
        return BlockOperationResult.ok(result.getForest(), statementId, removed);
    }

    public BlockOperationResult updateSlot(ScriptForest forest, String statementId, String slotName, Object value) {
        Optional<Statement> statement = forest.findById(statementId);
        if (statement.isEmpty()) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest, "Statement not found: " + statementId);
        }
        StatementKind kind = statement.get().getKind();
        SlotDefinition definition = SlotSchemas.find(kind, slotName);
        if (definition == null) {
            return BlockOperationResult.failure(OperationFailure.VALIDATION_FAILED, forest,
                "Unknown slot '" + slotName + "' for " + kind.getTag());
        }
        String error = definition.validate(value);
        if (error != null) {
            return BlockOperationResult.failure(OperationFailure.VALIDATION_FAILED, forest, error);
        }
        if (kind == StatementKind.LABEL && "name".equals(slotName)) {
            String name = value == null ? "" : String.valueOf(value);
            Optional<LabelStatement> existing = forest.findLabel(name);
            if (existing.isPresent() && !existing.get().getId().equals(statementId)) {
                return BlockOperationResult.failure(OperationFailure.VALIDATION_FAILED, forest,
                    "Label already exists: " + name);
            }
        }
        ForestReplaceResult result = forest.replaceById(statementId,
            current -> SlotBinding.write(current, slotName, value));
        return BlockOperationResult.ok(result.getForest(), statementId);
    }

    public Optional<StatementClipboard> copyBlock(ScriptForest forest, String statementId) {
        Optional<Statement> statement = forest.findById(statementId);
        if (statement.isEmpty()) {
            return Optional.empty();
        }
        String label = forest.findLocation(statementId).map(StatementLocation::getLabelName).orElse(null);
        return Optional.of(new StatementClipboard(List.of(statement.get()), label));
    }

    /**
     * Inserts fresh-identity copies of the clipboard contents, in order,
     * starting at {@code index}.
     */
    public BlockOperationResult pasteBlock(ScriptForest forest, StatementClipboard clipboard, String containerId, int index) {
        if (clipboard == null || clipboard.isEmpty()) {
            return BlockOperationResult.failure(OperationFailure.VALIDATION_FAILED, forest, "Clipboard is empty");
        }
        Optional<Statement> container = forest.findById(containerId);
        if (container.isEmpty()) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest, "Container not found: " + containerId);
        }
        for (Statement statement : clipboard.getStatements()) {
            String rejection = checkContainer(container.get(), statement.getKind());
            if (rejection != null) {
                return BlockOperationResult.failure(OperationFailure.INVALID_CONTAINER, forest, rejection);
            }
        }
        ScriptForest next = forest;
        String firstId = null;
        int position = Math.max(0, index);
        for (Statement statement : clipboard.getStatements()) {
            Statement copy = statement.copyWithFreshIds();
            next = next.insert(containerId, position++, copy).getForest();
            if (firstId == null) {
                firstId = copy.getId();
            }
        }
        return BlockOperationResult.ok(next, firstId);
    }

    private BlockOperationResult relocate(ScriptForest forest, Statement statement, StatementLocation source,
                                          String containerId, int index) {
        int target = index;
        if (containerId.equals(source.getParentId()) && source.getIndex() < index) {
            target = index - 1;
        }
        ForestReplaceResult removed = forest.remove(statement.getId());
        ForestReplaceResult inserted = removed.getForest().insert(containerId, target, statement);
        if (!removed.isFound() || !inserted.isFound()) {
            return BlockOperationResult.failure(OperationFailure.NOT_FOUND, forest, "Move target vanished: " + containerId);
        }
        return BlockOperationResult.ok(inserted.getForest(), statement.getId());
    }

    private static String checkContainer(Statement container, StatementKind childKind) {
        if (!container.isContainer()) {
            return container.getKind().getTag() + " " + container.getId() + " is not a container";
        }
        if (!container.accepts(childKind)) {
            return container.getKind().getTag() + " cannot contain " + childKind.getTag();
        }
        return null;
    }
}
