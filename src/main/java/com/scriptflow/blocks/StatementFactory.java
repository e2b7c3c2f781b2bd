package com.scriptflow.blocks;

import com.scriptflow.models.Block;
import com.scriptflow.models.BlockSlot;
import com.scriptflow.models.BranchStatement;
import com.scriptflow.models.CallStatement;
import com.scriptflow.models.ChoiceStatement;
import com.scriptflow.models.DefaultStatement;
import com.scriptflow.models.DefineStatement;
import com.scriptflow.models.DialogueStatement;
import com.scriptflow.models.HideStatement;
import com.scriptflow.models.IfStatement;
import com.scriptflow.models.JumpStatement;
import com.scriptflow.models.LabelStatement;
import com.scriptflow.models.MenuStatement;
import com.scriptflow.models.NvlStatement;
import com.scriptflow.models.PauseStatement;
import com.scriptflow.models.PlayStatement;
import com.scriptflow.models.RawCodeStatement;
import com.scriptflow.models.ReturnStatement;
import com.scriptflow.models.SceneStatement;
import com.scriptflow.models.SetStatement;
import com.scriptflow.models.ShowStatement;
import com.scriptflow.models.Statement;
import com.scriptflow.models.StatementKind;
import com.scriptflow.models.StopStatement;
import com.scriptflow.models.WithStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates new statements: default-initialized ones for the block palette and
 * ones instantiated from unbacked blocks (templates). Every statement created
 * here gets a fresh identity.
 */
public final class StatementFactory {

    private StatementFactory() {
    }

    /**
     * A new statement of {@code kind} with every slot at its schema default.
     * Menus start with one choice and ifs with one branch.
     */
    public static Statement create(StatementKind kind) {
        Statement statement = applyDefaults(blank(kind));
        if (kind == StatementKind.MENU) {
            List<Statement> choices = new ArrayList<>();
            choices.add(create(StatementKind.CHOICE));
            statement = statement.withChildStatements(choices);
        } else if (kind == StatementKind.IF) {
            List<Statement> branches = new ArrayList<>();
            branches.add(create(StatementKind.BRANCH));
            statement = statement.withChildStatements(branches);
        }
        return statement;
    }

    /**
     * Instantiates a block tree as statements. Slot values that the schema of
     * the block's kind does not declare are ignored.
     *
     * @throws IllegalArgumentException if a child block cannot be placed in
     *                                  its parent
     */
    public static Statement fromBlock(Block block) {
        if (block == null || block.getType() == null) {
            throw new IllegalArgumentException("Block type is required");
        }
        Statement statement = applyDefaults(blank(block.getType()));
        for (BlockSlot slot : block.getSlots()) {
            SlotDefinition definition = SlotSchemas.find(block.getType(), slot.getName());
            if (definition == null || slot.getValue() == null) {
                continue;
            }
            String error = definition.validate(slot.getValue());
            if (error != null) {
                throw new IllegalArgumentException(error);
            }
            statement = SlotBinding.write(statement, slot.getName(), slot.getValue());
        }
        if (statement.isContainer() && !block.getChildren().isEmpty()) {
            List<Statement> children = new ArrayList<>();
            for (Block childBlock : block.getChildren()) {
                Statement child = fromBlock(childBlock);
                if (!statement.accepts(child)) {
                    throw new IllegalArgumentException(block.getType().getTag() + " cannot contain "
                        + child.getKind().getTag());
                }
                children.add(child);
            }
            statement = statement.withChildStatements(children);
        }
        return statement;
    }

    private static Statement applyDefaults(Statement statement) {
        Statement result = statement;
        for (SlotDefinition definition : SlotSchemas.forKind(statement.getKind())) {
            if (definition.getDefaultValue() != null) {
                result = SlotBinding.write(result, definition.getName(), definition.getDefaultValue());
            }
        }
        return result;
    }

    private static Statement blank(StatementKind kind) {
        switch (kind) {
            case LABEL:
                return new LabelStatement(null, null, null, null);
            case DIALOGUE:
                return new DialogueStatement(null, null, null, null);
            case SCENE:
                return new SceneStatement(null, null, null, null);
            case SHOW:
                return new ShowStatement(null, null, null, null);
            case HIDE:
                return new HideStatement(null, null);
            case WITH:
                return new WithStatement(null, null);
            case MENU:
                return new MenuStatement(null, null, null);
            case CHOICE:
                return new ChoiceStatement(null, null, null, null);
            case JUMP:
                return new JumpStatement(null, null);
            case CALL:
                return new CallStatement(null, null, null);
            case RETURN:
                return new ReturnStatement(null, null);
            case IF:
                return new IfStatement(null, null);
            case BRANCH:
                return new BranchStatement(null, null, null);
            case SET:
                return new SetStatement(null, null, null, null);
            case RAW_CODE:
                return new RawCodeStatement(null, null);
            case PLAY:
                return new PlayStatement(null, null, null, null, false);
            case STOP:
                return new StopStatement(null, null, null);
            case PAUSE:
                return new PauseStatement(null, null);
            case NVL:
                return new NvlStatement(null, null);
            case DEFINE:
                return new DefineStatement(null, null, null, null);
            case DEFAULT:
                return new DefaultStatement(null, null, null);
            default:
                throw new IllegalArgumentException("Unsupported statement kind: " + kind);
        }
    }
}
