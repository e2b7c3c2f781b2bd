package com.scriptflow.blocks;

import com.scriptflow.models.Block;
import com.scriptflow.models.LabelStatement;
import com.scriptflow.models.ScriptForest;
import com.scriptflow.models.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Projects statements into block trees. The output depends only on the input
 * statements, apart from block ids, which are drawn fresh from the id
 * supplier on every call. UI state must be keyed by
 * {@link Block#getStatementId()}.
 */
public class BlockTreeBuilder {

    private final Supplier<String> idGenerator;

    public BlockTreeBuilder() {
        this(() -> "block-" + UUID.randomUUID());
    }

    public BlockTreeBuilder(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    /**
     * One root block per top-level statement, in forest order. Labels carry
     * their bodies as children.
     */
    public List<Block> buildForest(ScriptForest forest) {
        List<Block> roots = new ArrayList<>();
        for (Statement statement : forest.getStatements()) {
            Block block = buildBlock(statement);
            if (block != null) {
                roots.add(block);
            }
        }
        return roots;
    }

    public Block buildFromLabel(LabelStatement label) {
        return buildBlock(label);
    }

    /**
     * Returns null for statement kinds that have no block representation.
     * Every kind currently has one.
     */
    public Block buildBlock(Statement statement) {
        return build(statement, true);
    }

    /**
     * Same shape as {@link #buildBlock(Statement)} but with an empty statement
     * back-reference throughout, for template contents.
     */
    public Block buildUnbacked(Statement statement) {
        return build(statement, false);
    }

    private Block build(Statement statement, boolean backed) {
        if (statement == null) {
            return null;
        }
        Block block = new Block(idGenerator.get(), statement.getKind(), backed ? statement.getId() : "");
        Map<String, Object> values = SlotBinding.read(statement);
        for (SlotDefinition definition : SlotSchemas.forKind(statement.getKind())) {
            block.getSlots().add(definition.toSlot(values.get(definition.getName())));
        }
        if (statement.isContainer()) {
            for (Statement child : statement.childStatements()) {
                Block childBlock = build(child, backed);
                if (childBlock != null) {
                    block.getChildren().add(childBlock);
                }
            }
        }
        return block;
    }
}
