package com.scriptflow.blocks;

import com.scriptflow.models.Block;
import com.scriptflow.models.BlockSlot;
import com.scriptflow.models.SlotType;
import com.scriptflow.models.StatementKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Advisory checks over block trees. Nothing here blocks an edit; issues are
 * shown as field-level warnings.
 */
public class BlockValidator {

    public List<ValidationIssue> validate(List<Block> roots, Collection<String> labelNames) {
        Set<String> labels = labelNames != null ? new HashSet<>(labelNames) : new HashSet<>();
        List<ValidationIssue> issues = new ArrayList<>();
        for (Block root : roots) {
            validateTree(root, labels, issues);
        }
        return issues;
    }

    public List<ValidationIssue> validateBlock(Block block, Collection<String> labelNames) {
        Set<String> labels = labelNames != null ? new HashSet<>(labelNames) : new HashSet<>();
        List<ValidationIssue> issues = new ArrayList<>();
        checkSlots(block, labels, issues);
        return issues;
    }

    public Map<ValidationIssue.Type, Integer> summarize(List<ValidationIssue> issues) {
        Map<ValidationIssue.Type, Integer> summary = new EnumMap<>(ValidationIssue.Type.class);
        for (ValidationIssue issue : issues) {
            summary.merge(issue.getType(), 1, Integer::sum);
        }
        return summary;
    }

    /**
     * Marks every block that has at least one issue.
     */
    public void markErrors(List<Block> roots, List<ValidationIssue> issues) {
        Set<String> flagged = new HashSet<>();
        for (ValidationIssue issue : issues) {
            flagged.add(issue.getBlockId());
        }
        Deque<Block> pending = new ArrayDeque<>(roots);
        while (!pending.isEmpty()) {
            Block block = pending.pop();
            block.setHasError(flagged.contains(block.getId()));
            pending.addAll(block.getChildren());
        }
    }

    private void validateTree(Block block, Set<String> labels, List<ValidationIssue> issues) {
        checkSlots(block, labels, issues);
        for (Block child : block.getChildren()) {
            validateTree(child, labels, issues);
        }
    }

    private void checkSlots(Block block, Set<String> labels, List<ValidationIssue> issues) {
        for (BlockSlot slot : block.getSlots()) {
            if (slot.isEmpty()) {
                if (slot.isRequired()) {
                    issues.add(issue(ValidationIssue.Type.REQUIRED, block, slot, slot.getLabel() + " is required"));
                }
                continue;
            }
            if (slot.getRule() != null) {
                String error = slot.getRule().validate(slot.getLabel(), slot.getValue());
                if (error != null) {
                    issues.add(issue(ValidationIssue.Type.RULE, block, slot, error));
                }
            }
            if (slot.getType() == SlotType.TARGET && isJumpOrCall(block.getType())) {
                String target = String.valueOf(slot.getValue());
                if (!labels.contains(target)) {
                    issues.add(issue(ValidationIssue.Type.INVALID_TARGET, block, slot,
                        "Label '" + target + "' does not exist"));
                }
            }
            if (slot.getType() == SlotType.EXPRESSION || slot.getType() == SlotType.CODE) {
                String error = checkDelimiters(String.valueOf(slot.getValue()));
                if (error != null) {
                    issues.add(issue(ValidationIssue.Type.SYNTAX, block, slot, error));
                }
            }
        }
    }

    /**
     * Balanced (), [] and {} outside string literals, and closed quotes.
     */
    static String checkDelimiters(String source) {
        Deque<Character> open = new ArrayDeque<>();
        char quote = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"':
                case '\'':
                    quote = c;
                    break;
                case '(':
                case '[':
                case '{':
                    open.push(c);
                    break;
                case ')':
                case ']':
                case '}':
                    if (open.isEmpty() || open.pop() != matching(c)) {
                        return "Unmatched '" + c + "'";
                    }
                    break;
                default:
                    break;
            }
        }
        if (quote != 0) {
            return "Unclosed string literal";
        }
        if (!open.isEmpty()) {
            return "Unclosed '" + open.peek() + "'";
        }
        return null;
    }

    private static char matching(char closing) {
        if (closing == ')') {
            return '(';
        }
        if (closing == ']') {
            return '[';
        }
        return '{';
    }

    private static boolean isJumpOrCall(StatementKind kind) {
        return kind == StatementKind.JUMP || kind == StatementKind.CALL;
    }

    private static ValidationIssue issue(ValidationIssue.Type type, Block block, BlockSlot slot, String message) {
        return new ValidationIssue(type, block.getStatementId(), block.getId(), slot.getName(), message);
    }
}
