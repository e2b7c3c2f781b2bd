package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Immutable ordered top-level statement list of one script. Every rewrite
 * returns a new forest; sequences that do not lie on the path to the edited
 * statement are shared with the previous forest, not copied.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScriptForest {

    private final List<Statement> statements;

    @JsonCreator
    public ScriptForest(@JsonProperty("statements") List<Statement> statements) {
        this.statements = Statement.freeze(statements);
    }

    public static ScriptForest empty() {
        return new ScriptForest(Collections.emptyList());
    }

    public static ScriptForest of(Statement... statements) {
        List<Statement> list = new ArrayList<>();
        Collections.addAll(list, statements);
        return new ScriptForest(list);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    // ---- queries ----

    public Optional<Statement> findById(String id) {
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(find(statements, id));
    }

    public boolean contains(String id) {
        return findById(id).isPresent();
    }

    public Optional<StatementLocation> findLocation(String id) {
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(locate(statements, id, null, null));
    }

    @JsonIgnore
    public List<LabelStatement> getLabels() {
        List<LabelStatement> labels = new ArrayList<>();
        for (Statement statement : statements) {
            if (statement instanceof LabelStatement) {
                labels.add((LabelStatement) statement);
            }
        }
        return labels;
    }

    public Optional<LabelStatement> findLabel(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (LabelStatement label : getLabels()) {
            if (label.getName().equals(name)) {
                return Optional.of(label);
            }
        }
        return Optional.empty();
    }

    @JsonIgnore
    public List<String> getLabelNames() {
        List<String> names = new ArrayList<>();
        for (LabelStatement label : getLabels()) {
            names.add(label.getName());
        }
        return names;
    }

    /**
     * True when {@code id} lies strictly inside the subtree rooted at
     * {@code ancestorId}.
     */
    public boolean isDescendant(String ancestorId, String id) {
        Optional<Statement> ancestor = findById(ancestorId);
        if (ancestor.isEmpty() || ancestorId.equals(id)) {
            return false;
        }
        return find(ancestor.get().childStatements(), id) != null;
    }

    /**
     * Ids of the statement and its whole owned subtree, in pre-order.
     */
    public List<String> collectIds(String id) {
        List<String> ids = new ArrayList<>();
        findById(id).ifPresent(statement -> collect(statement, ids));
        return ids;
    }

    public int countStatements() {
        List<String> ids = new ArrayList<>();
        for (Statement statement : statements) {
            collect(statement, ids);
        }
        return ids.size();
    }

    // ---- rewrites ----

    public ForestReplaceResult replaceById(String id, UnaryOperator<Statement> patch) {
        return rewrite(id, statement -> Collections.singletonList(patch.apply(statement)));
    }

    public ForestReplaceResult remove(String id) {
        return rewrite(id, statement -> Collections.emptyList());
    }

    /**
     * Inserts into the sequence of {@code containerId}, or at the top level
     * when it is null or empty. The index is clamped to the sequence bounds.
     * Acceptance of the child kind is the caller's responsibility.
     */
    public ForestReplaceResult insert(String containerId, int index, Statement statement) {
        if (containerId == null || containerId.isEmpty()) {
            List<Statement> next = new ArrayList<>(statements);
            next.add(clamp(index, next.size()), statement);
            return ForestReplaceResult.replaced(new ScriptForest(next));
        }
        return replaceById(containerId, container -> {
            if (!container.isContainer()) {
                return container;
            }
            List<Statement> children = new ArrayList<>(container.childStatements());
            children.add(clamp(index, children.size()), statement);
            return container.withChildStatements(children);
        });
    }

    public ScriptForest addLabel(LabelStatement label) {
        List<Statement> next = new ArrayList<>(statements);
        next.add(label);
        return new ScriptForest(next);
    }

    public ForestReplaceResult removeLabel(String name) {
        Optional<LabelStatement> label = findLabel(name);
        if (label.isEmpty()) {
            return ForestReplaceResult.notFound(this);
        }
        return remove(label.get().getId());
    }

    public static int clamp(int index, int size) {
        return Math.max(0, Math.min(index, size));
    }

    private ForestReplaceResult rewrite(String id, Function<Statement, List<Statement>> replacement) {
        if (id == null || id.isEmpty()) {
            return ForestReplaceResult.notFound(this);
        }
        List<Statement> next = rewriteList(statements, id, replacement);
        if (next == null) {
            return ForestReplaceResult.notFound(this);
        }
        return ForestReplaceResult.replaced(new ScriptForest(next));
    }

    /**
     * Returns a rewritten copy of {@code items}, or null when the id is not in
     * this subtree.
     */
    private static List<Statement> rewriteList(List<Statement> items, String id,
                                               Function<Statement, List<Statement>> replacement) {
        for (int i = 0; i < items.size(); i++) {
            Statement item = items.get(i);
            if (item.getId().equals(id)) {
                List<Statement> next = new ArrayList<>(items.subList(0, i));
                next.addAll(replacement.apply(item));
                next.addAll(items.subList(i + 1, items.size()));
                return next;
            }
            if (item.isContainer()) {
                List<Statement> children = rewriteList(item.childStatements(), id, replacement);
                if (children != null) {
                    List<Statement> next = new ArrayList<>(items);
                    next.set(i, item.withChildStatements(children));
                    return next;
                }
            }
        }
        return null;
    }

    private static Statement find(List<Statement> items, String id) {
        for (Statement item : items) {
            if (item.getId().equals(id)) {
                return item;
            }
            Statement nested = find(item.childStatements(), id);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    private static StatementLocation locate(List<Statement> items, String id, String parentId, String labelName) {
        for (int i = 0; i < items.size(); i++) {
            Statement item = items.get(i);
            String owningLabel = labelName;
            if (parentId == null && item instanceof LabelStatement) {
                owningLabel = ((LabelStatement) item).getName();
            }
            if (item.getId().equals(id)) {
                return new StatementLocation(parentId, i, owningLabel);
            }
            StatementLocation nested = locate(item.childStatements(), id, item.getId(), owningLabel);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    private static void collect(Statement statement, List<String> ids) {
        ids.add(statement.getId());
        for (Statement child : statement.childStatements()) {
            collect(child, ids);
        }
    }

    @Override
    public String toString() {
        return "ScriptForest{" + statements.size() + " top-level statements}";
    }
}
