package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conditional. The first branch is the {@code if}, following branches with a
 * condition are {@code elif}s and a trailing branch without one is the
 * {@code else}.
 */
public class IfStatement extends Statement {

    private final List<BranchStatement> branches;

    @JsonCreator
    public IfStatement(@JsonProperty("id") String id,
                       @JsonProperty("branches") List<BranchStatement> branches) {
        super(id);
        this.branches = freeze(branches);
    }

    public IfStatement(List<BranchStatement> branches) {
        this(null, branches);
    }

    public List<BranchStatement> getBranches() {
        return branches;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.IF;
    }

    @Override
    public List<Statement> childStatements() {
        return Collections.unmodifiableList(new ArrayList<Statement>(branches));
    }

    @Override
    public IfStatement withChildStatements(List<Statement> children) {
        List<BranchStatement> next = new ArrayList<>();
        for (Statement child : children) {
            if (!(child instanceof BranchStatement)) {
                throw new IllegalArgumentException("If only accepts branches, got " + child.getKind().getTag());
            }
            next.add((BranchStatement) child);
        }
        return new IfStatement(getId(), next);
    }

    @Override
    public boolean accepts(StatementKind childKind) {
        return childKind == StatementKind.BRANCH;
    }

    @Override
    protected Statement withId(String newId) {
        return new IfStatement(newId, branches);
    }
}
