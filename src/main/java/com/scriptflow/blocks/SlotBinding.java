package com.scriptflow.blocks;

import com.scriptflow.models.BranchStatement;
import com.scriptflow.models.CallStatement;
import com.scriptflow.models.ChoiceStatement;
import com.scriptflow.models.DefaultStatement;
import com.scriptflow.models.DefineStatement;
import com.scriptflow.models.DialogueStatement;
import com.scriptflow.models.HideStatement;
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
import com.scriptflow.models.SlotRule;
import com.scriptflow.models.Statement;
import com.scriptflow.models.StopStatement;
import com.scriptflow.models.WithStatement;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps statement fields to slot values and back. Slot names are the ones
 * declared in {@link SlotSchemas}.
 */
public final class SlotBinding {

    private SlotBinding() {
    }

    public static Map<String, Object> read(Statement statement) {
        Map<String, Object> values = new LinkedHashMap<>();
        switch (statement.getKind()) {
            case LABEL: {
                LabelStatement label = (LabelStatement) statement;
                values.put("name", label.getName());
                values.put("parameters", label.getParameters());
                break;
            }
            case DIALOGUE: {
                DialogueStatement dialogue = (DialogueStatement) statement;
                values.put("speaker", dialogue.getSpeaker());
                values.put("text", dialogue.getText());
                values.put("attributes", dialogue.getAttributes());
                break;
            }
            case SCENE: {
                SceneStatement scene = (SceneStatement) statement;
                values.put("image", scene.getImage());
                values.put("transition", scene.getTransition());
                values.put("layer", scene.getLayer());
                break;
            }
            case SHOW: {
                ShowStatement show = (ShowStatement) statement;
                values.put("character", show.getCharacter());
                values.put("position", show.getPosition());
                values.put("expression", show.getExpression());
                break;
            }
            case HIDE:
                values.put("character", ((HideStatement) statement).getCharacter());
                break;
            case WITH:
                values.put("transition", ((WithStatement) statement).getTransition());
                break;
            case MENU:
                values.put("prompt", ((MenuStatement) statement).getPrompt());
                break;
            case CHOICE: {
                ChoiceStatement choice = (ChoiceStatement) statement;
                values.put("text", choice.getText());
                values.put("condition", choice.getCondition());
                break;
            }
            case JUMP:
                values.put("target", ((JumpStatement) statement).getTarget());
                break;
            case CALL: {
                CallStatement call = (CallStatement) statement;
                values.put("target", call.getTarget());
                values.put("arguments", call.getArguments());
                break;
            }
            case RETURN:
                values.put("value", ((ReturnStatement) statement).getValue());
                break;
            case IF:
                break;
            case BRANCH:
                values.put("condition", ((BranchStatement) statement).getCondition());
                break;
            case SET: {
                SetStatement set = (SetStatement) statement;
                values.put("variable", set.getVariable());
                values.put("operator", set.getOperator());
                values.put("value", set.getValue());
                break;
            }
            case RAW_CODE:
                values.put("code", ((RawCodeStatement) statement).getCode());
                break;
            case PLAY: {
                PlayStatement play = (PlayStatement) statement;
                values.put("channel", play.getChannel());
                values.put("file", play.getFile());
                values.put("fadein", play.getFadeIn());
                values.put("loop", play.isLoop());
                break;
            }
            case STOP: {
                StopStatement stop = (StopStatement) statement;
                values.put("channel", stop.getChannel());
                values.put("fadeout", stop.getFadeOut());
                break;
            }
            case PAUSE:
                values.put("duration", ((PauseStatement) statement).getDuration());
                break;
            case NVL:
                values.put("action", ((NvlStatement) statement).getAction());
                break;
            case DEFINE: {
                DefineStatement define = (DefineStatement) statement;
                values.put("name", define.getName());
                values.put("value", define.getValue());
                values.put("store", define.getStore());
                break;
            }
            case DEFAULT: {
                DefaultStatement def = (DefaultStatement) statement;
                values.put("name", def.getName());
                values.put("value", def.getValue());
                break;
            }
            default:
                break;
        }
        return values;
    }

    /**
     * Returns a copy of {@code statement} with one slot changed. The identity
     * and the children are kept. The value must already have passed
     * {@link SlotDefinition#validate(Object)}.
     *
     * @throws IllegalArgumentException if the kind has no such slot
     */
    public static Statement write(Statement statement, String slot, Object value) {
        String id = statement.getId();
        switch (statement.getKind()) {
            case LABEL: {
                LabelStatement s = (LabelStatement) statement;
                if ("name".equals(slot)) return new LabelStatement(id, text(value), s.getParameters(), s.getBody());
                if ("parameters".equals(slot)) return new LabelStatement(id, s.getName(), optional(value), s.getBody());
                break;
            }
            case DIALOGUE: {
                DialogueStatement s = (DialogueStatement) statement;
                if ("speaker".equals(slot)) return new DialogueStatement(id, optional(value), s.getText(), s.getAttributes());
                if ("text".equals(slot)) return new DialogueStatement(id, s.getSpeaker(), text(value), s.getAttributes());
                if ("attributes".equals(slot)) return new DialogueStatement(id, s.getSpeaker(), s.getText(), optional(value));
                break;
            }
            case SCENE: {
                SceneStatement s = (SceneStatement) statement;
                if ("image".equals(slot)) return new SceneStatement(id, text(value), s.getTransition(), s.getLayer());
                if ("transition".equals(slot)) return new SceneStatement(id, s.getImage(), optional(value), s.getLayer());
                if ("layer".equals(slot)) return new SceneStatement(id, s.getImage(), s.getTransition(), optional(value));
                break;
            }
            case SHOW: {
                ShowStatement s = (ShowStatement) statement;
                if ("character".equals(slot)) return new ShowStatement(id, text(value), s.getPosition(), s.getExpression());
                if ("position".equals(slot)) return new ShowStatement(id, s.getCharacter(), optional(value), s.getExpression());
                if ("expression".equals(slot)) return new ShowStatement(id, s.getCharacter(), s.getPosition(), optional(value));
                break;
            }
            case HIDE:
                if ("character".equals(slot)) return new HideStatement(id, text(value));
                break;
            case WITH:
                if ("transition".equals(slot)) return new WithStatement(id, text(value));
                break;
            case MENU: {
                MenuStatement s = (MenuStatement) statement;
                if ("prompt".equals(slot)) return new MenuStatement(id, optional(value), s.getChoices());
                break;
            }
            case CHOICE: {
                ChoiceStatement s = (ChoiceStatement) statement;
                if ("text".equals(slot)) return new ChoiceStatement(id, text(value), s.getCondition(), s.getBody());
                if ("condition".equals(slot)) return new ChoiceStatement(id, s.getText(), optional(value), s.getBody());
                break;
            }
            case JUMP:
                if ("target".equals(slot)) return new JumpStatement(id, text(value));
                break;
            case CALL: {
                CallStatement s = (CallStatement) statement;
                if ("target".equals(slot)) return new CallStatement(id, text(value), s.getArguments());
                if ("arguments".equals(slot)) return new CallStatement(id, s.getTarget(), optional(value));
                break;
            }
            case RETURN:
                if ("value".equals(slot)) return new ReturnStatement(id, optional(value));
                break;
            case BRANCH: {
                BranchStatement s = (BranchStatement) statement;
                if ("condition".equals(slot)) return new BranchStatement(id, optional(value), s.getBody());
                break;
            }
            case SET: {
                SetStatement s = (SetStatement) statement;
                if ("variable".equals(slot)) return new SetStatement(id, text(value), s.getOperator(), s.getValue());
                if ("operator".equals(slot)) return new SetStatement(id, s.getVariable(), text(value), s.getValue());
                if ("value".equals(slot)) return new SetStatement(id, s.getVariable(), s.getOperator(), text(value));
                break;
            }
            case RAW_CODE:
                if ("code".equals(slot)) return new RawCodeStatement(id, text(value));
                break;
            case PLAY: {
                PlayStatement s = (PlayStatement) statement;
                if ("channel".equals(slot)) return new PlayStatement(id, text(value), s.getFile(), s.getFadeIn(), s.isLoop());
                if ("file".equals(slot)) return new PlayStatement(id, s.getChannel(), text(value), s.getFadeIn(), s.isLoop());
                if ("fadein".equals(slot)) return new PlayStatement(id, s.getChannel(), s.getFile(), number(value), s.isLoop());
                if ("loop".equals(slot)) return new PlayStatement(id, s.getChannel(), s.getFile(), s.getFadeIn(), bool(value));
                break;
            }
            case STOP: {
                StopStatement s = (StopStatement) statement;
                if ("channel".equals(slot)) return new StopStatement(id, text(value), s.getFadeOut());
                if ("fadeout".equals(slot)) return new StopStatement(id, s.getChannel(), number(value));
                break;
            }
            case PAUSE:
                if ("duration".equals(slot)) return new PauseStatement(id, number(value));
                break;
            case NVL:
                if ("action".equals(slot)) return new NvlStatement(id, text(value));
                break;
            case DEFINE: {
                DefineStatement s = (DefineStatement) statement;
                if ("name".equals(slot)) return new DefineStatement(id, text(value), s.getValue(), s.getStore());
                if ("value".equals(slot)) return new DefineStatement(id, s.getName(), text(value), s.getStore());
                if ("store".equals(slot)) return new DefineStatement(id, s.getName(), s.getValue(), optional(value));
                break;
            }
            case DEFAULT: {
                DefaultStatement s = (DefaultStatement) statement;
                if ("name".equals(slot)) return new DefaultStatement(id, text(value), s.getValue());
                if ("value".equals(slot)) return new DefaultStatement(id, s.getName(), text(value));
                break;
            }
            default:
                break;
        }
        throw new IllegalArgumentException("Unknown slot '" + slot + "' for " + statement.getKind().getTag());
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    /**
     * Optional text fields store "unset" as null, never as an empty string.
     */
    private static String optional(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        return text.isEmpty() ? null : text;
    }

    private static Double number(Object value) {
        return SlotRule.asNumber(value);
    }

    private static boolean bool(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && "true".equalsIgnoreCase(String.valueOf(value));
    }
}
