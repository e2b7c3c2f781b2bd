package com.scriptflow.blocks;

import com.scriptflow.models.NvlStatement;
import com.scriptflow.models.PlayStatement;
import com.scriptflow.models.SetStatement;
import com.scriptflow.models.SlotRule;
import com.scriptflow.models.SlotType;
import com.scriptflow.models.StatementKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed, kind-indexed slot schema of every block type.
 */
public final class SlotSchemas {

    public static final List<String> TRANSITIONS = List.of(
        "dissolve", "fade", "pixellate", "move", "moveinright", "moveinleft",
        "moveintop", "moveinbottom", "moveoutright", "moveoutleft", "moveouttop",
        "moveoutbottom", "ease", "zoomin", "zoomout", "zoominout", "vpunch", "hpunch",
        "blinds", "squares", "wipeleft", "wiperight", "wipeup", "wipedown"
    );
    public static final List<String> POSITIONS = List.of(
        "left", "center", "right", "truecenter", "topleft", "topright", "bottomleft", "bottomright"
    );
    public static final List<String> LAYERS = List.of("master", "transient", "screens", "overlay");

    static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";
    static final String LABEL_NAME = "\\.?[A-Za-z_][A-Za-z0-9_.]*";

    private static final Map<StatementKind, List<SlotDefinition>> SCHEMAS = new EnumMap<>(StatementKind.class);

    static {
        define(StatementKind.LABEL,
            slot("name", "Label", SlotType.TEXT, true, false, "new_label", SlotRule.matching(LABEL_NAME)),
            slot("parameters", "Parameters", SlotType.TEXT, false, true, null, null));
        define(StatementKind.DIALOGUE,
            slot("speaker", "Speaker", SlotType.TEXT, false, false, null, null),
            slot("text", "Text", SlotType.MULTILINE, true, false, "New dialogue", null),
            slot("attributes", "Attributes", SlotType.TEXT, false, true, null, null));
        define(StatementKind.SCENE,
            slot("image", "Image", SlotType.TEXT, true, false, "bg black", null),
            slot("transition", "Transition", SlotType.SELECT, false, false, null, SlotRule.suggest(TRANSITIONS)),
            slot("layer", "Layer", SlotType.SELECT, false, true, null, SlotRule.oneOf(LAYERS)));
        define(StatementKind.SHOW,
            slot("character", "Character", SlotType.TEXT, true, false, "", null),
            slot("position", "Position", SlotType.SELECT, false, false, "center", SlotRule.suggest(POSITIONS)),
            slot("expression", "Expression", SlotType.TEXT, false, true, null, null));
        define(StatementKind.HIDE,
            slot("character", "Character", SlotType.TEXT, true, false, "", null));
        define(StatementKind.WITH,
            slot("transition", "Transition", SlotType.SELECT, true, false, "dissolve", SlotRule.suggest(TRANSITIONS)));
        define(StatementKind.MENU,
            slot("prompt", "Prompt", SlotType.TEXT, false, false, null, null));
        define(StatementKind.CHOICE,
            slot("text", "Choice", SlotType.TEXT, true, false, "Choice 1", null),
            slot("condition", "Condition", SlotType.EXPRESSION, false, false, null, null));
        define(StatementKind.JUMP,
            slot("target", "Target", SlotType.TARGET, true, false, "", null));
        define(StatementKind.CALL,
            slot("target", "Target", SlotType.TARGET, true, false, "", null),
            slot("arguments", "Arguments", SlotType.TEXT, false, true, null, null));
        define(StatementKind.RETURN,
            slot("value", "Value", SlotType.EXPRESSION, false, true, null, null));
        define(StatementKind.IF);
        define(StatementKind.BRANCH,
            slot("condition", "Condition", SlotType.EXPRESSION, false, false, "True", null));
        define(StatementKind.SET,
            slot("variable", "Variable", SlotType.TEXT, true, false, "", SlotRule.matching(IDENTIFIER)),
            slot("operator", "Operator", SlotType.SELECT, true, false, "=", SlotRule.oneOf(SetStatement.OPERATORS)),
            slot("value", "Value", SlotType.EXPRESSION, true, false, "", null));
        define(StatementKind.RAW_CODE,
            slot("code", "Code", SlotType.CODE, true, false, "", null));
        define(StatementKind.PLAY,
            slot("channel", "Channel", SlotType.SELECT, true, false, "music", SlotRule.oneOf(PlayStatement.CHANNELS)),
            slot("file", "File", SlotType.TEXT, true, false, "", null),
            slot("fadein", "Fade in", SlotType.NUMBER, false, true, null, SlotRule.range(0, 60)),
            slot("loop", "Loop", SlotType.BOOLEAN, false, true, false, null));
        define(StatementKind.STOP,
            slot("channel", "Channel", SlotType.SELECT, true, false, "music", SlotRule.oneOf(PlayStatement.CHANNELS)),
            slot("fadeout", "Fade out", SlotType.NUMBER, false, true, null, SlotRule.range(0, 60)));
        define(StatementKind.PAUSE,
            slot("duration", "Duration", SlotType.NUMBER, false, false, null, SlotRule.range(0, 3600)));
        define(StatementKind.NVL,
            slot("action", "Action", SlotType.SELECT, true, false, "clear", SlotRule.oneOf(NvlStatement.ACTIONS)));
        define(StatementKind.DEFINE,
            slot("name", "Name", SlotType.TEXT, true, false, "", SlotRule.matching(LABEL_NAME)),
            slot("value", "Value", SlotType.EXPRESSION, true, false, "", null),
            slot("store", "Store", SlotType.TEXT, false, true, null, null));
        define(StatementKind.DEFAULT,
            slot("name", "Name", SlotType.TEXT, true, false, "", SlotRule.matching(LABEL_NAME)),
            slot("value", "Value", SlotType.EXPRESSION, true, false, "", null));
    }

    private SlotSchemas() {
    }

    public static List<SlotDefinition> forKind(StatementKind kind) {
        List<SlotDefinition> schema = SCHEMAS.get(kind);
        return schema != null ? schema : Collections.emptyList();
    }

    public static SlotDefinition find(StatementKind kind, String slotName) {
        for (SlotDefinition definition : forKind(kind)) {
            if (definition.getName().equals(slotName)) {
                return definition;
            }
        }
        return null;
    }

    private static void define(StatementKind kind, SlotDefinition... slots) {
        List<SlotDefinition> list = new ArrayList<>();
        Collections.addAll(list, slots);
        SCHEMAS.put(kind, Collections.unmodifiableList(list));
    }

    private static SlotDefinition slot(String name, String label, SlotType type, boolean required,
                                       boolean advanced, Object defaultValue, SlotRule rule) {
        return new SlotDefinition(name, label, type, required, advanced, defaultValue, rule);
    }
}
