package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * One instruction of a script. Statements are immutable: every edit produces a
 * new instance that keeps the identity token of the statement it replaces.
 *
 * <p>Three containment shapes exist: a label owns a body, a menu owns choices
 * (each with a body) and an if owns branches (each with a body). They are
 * exposed uniformly through {@link #childStatements()} and
 * {@link #withChildStatements(List)} so tree walks need not switch on kind.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = LabelStatement.class, name = "label"),
    @JsonSubTypes.Type(value = DialogueStatement.class, name = "dialogue"),
    @JsonSubTypes.Type(value = SceneStatement.class, name = "scene"),
    @JsonSubTypes.Type(value = ShowStatement.class, name = "show"),
    @JsonSubTypes.Type(value = HideStatement.class, name = "hide"),
    @JsonSubTypes.Type(value = WithStatement.class, name = "with"),
    @JsonSubTypes.Type(value = MenuStatement.class, name = "menu"),
    @JsonSubTypes.Type(value = ChoiceStatement.class, name = "choice"),
    @JsonSubTypes.Type(value = JumpStatement.class, name = "jump"),
    @JsonSubTypes.Type(value = CallStatement.class, name = "call"),
    @JsonSubTypes.Type(value = ReturnStatement.class, name = "return"),
    @JsonSubTypes.Type(value = IfStatement.class, name = "if"),
    @JsonSubTypes.Type(value = BranchStatement.class, name = "branch"),
    @JsonSubTypes.Type(value = SetStatement.class, name = "set"),
    @JsonSubTypes.Type(value = RawCodeStatement.class, name = "rawcode"),
    @JsonSubTypes.Type(value = PlayStatement.class, name = "play"),
    @JsonSubTypes.Type(value = StopStatement.class, name = "stop"),
    @JsonSubTypes.Type(value = PauseStatement.class, name = "pause"),
    @JsonSubTypes.Type(value = NvlStatement.class, name = "nvl"),
    @JsonSubTypes.Type(value = DefineStatement.class, name = "define"),
    @JsonSubTypes.Type(value = DefaultStatement.class, name = "default")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class Statement {

    private final String id;

    protected Statement(String id) {
        this.id = (id == null || id.isBlank()) ? newId() : id;
    }

    public static String newId() {
        return "stmt-" + UUID.randomUUID();
    }

    public String getId() {
        return id;
    }

    @JsonIgnore
    public abstract StatementKind getKind();

    @JsonIgnore
    public boolean isContainer() {
        return getKind().isContainer();
    }

    /**
     * Ordered children of a container; empty for leaf statements.
     */
    public List<Statement> childStatements() {
        return Collections.emptyList();
    }

    /**
     * Returns a copy of this container with the given children. Callers must
     * check {@link #accepts(Statement)} for every child first.
     */
    public Statement withChildStatements(List<Statement> children) {
        throw new UnsupportedOperationException(getKind().getTag() + " is not a container");
    }

    /**
     * Whether a statement of the given kind may be placed directly in this
     * container's sequence.
     */
    public boolean accepts(StatementKind childKind) {
        return false;
    }

    public boolean accepts(Statement child) {
        return child != null && accepts(child.getKind());
    }

    /**
     * Returns a deep copy of this statement in which every statement of the
     * subtree gets a fresh identity.
     */
    public Statement copyWithFreshIds() {
        Statement copy = withId(newId());
        if (!copy.isContainer()) {
            return copy;
        }
        List<Statement> children = new ArrayList<>();
        for (Statement child : copy.childStatements()) {
            children.add(child.copyWithFreshIds());
        }
        return copy.withChildStatements(children);
    }

    /**
     * Same content, different identity. Only used for copies.
     */
    protected abstract Statement withId(String newId);

    static boolean acceptsInBody(StatementKind kind) {
        return kind != null
            && kind != StatementKind.LABEL
            && kind != StatementKind.CHOICE
            && kind != StatementKind.BRANCH;
    }

    static <T> List<T> freeze(List<? extends T> items) {
        if (items == null || items.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public String toString() {
        return getKind().getTag() + "{" + id + "}";
    }
}
