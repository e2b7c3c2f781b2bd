package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Player choice point. Owns an ordered list of {@link ChoiceStatement}s.
 */
public class MenuStatement extends Statement {

    private final String prompt;
    private final List<ChoiceStatement> choices;

    @JsonCreator
    public MenuStatement(@JsonProperty("id") String id,
                         @JsonProperty("prompt") String prompt,
                         @JsonProperty("choices") List<ChoiceStatement> choices) {
        super(id);
        this.prompt = prompt;
        this.choices = freeze(choices);
    }

    public MenuStatement(List<ChoiceStatement> choices) {
        this(null, null, choices);
    }

    public String getPrompt() {
        return prompt;
    }

    public List<ChoiceStatement> getChoices() {
        return choices;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.MENU;
    }

    @Override
    public List<Statement> childStatements() {
        return Collections.unmodifiableList(new ArrayList<Statement>(choices));
    }

    @Override
    public MenuStatement withChildStatements(List<Statement> children) {
        List<ChoiceStatement> next = new ArrayList<>();
        for (Statement child : children) {
            if (!(child instanceof ChoiceStatement)) {
                throw new IllegalArgumentException("Menu only accepts choices, got " + child.getKind().getTag());
            }
            next.add((ChoiceStatement) child);
        }
        return new MenuStatement(getId(), prompt, next);
    }

    @Override
    public boolean accepts(StatementKind childKind) {
        return childKind == StatementKind.CHOICE;
    }

    @Override
    protected Statement withId(String newId) {
        return new MenuStatement(newId, prompt, choices);
    }
}
