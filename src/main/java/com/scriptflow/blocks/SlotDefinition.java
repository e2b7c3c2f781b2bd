package com.scriptflow.blocks;

import com.scriptflow.models.BlockSlot;
import com.scriptflow.models.SlotRule;
import com.scriptflow.models.SlotType;

/**
 * Schema entry for one slot of a statement kind.
 */
public class SlotDefinition {

    private final String name;
    private final String label;
    private final SlotType type;
    private final boolean required;
    private final boolean advanced;
    private final Object defaultValue;
    private final SlotRule rule;

    public SlotDefinition(String name, String label, SlotType type, boolean required,
                          boolean advanced, Object defaultValue, SlotRule rule) {
        this.name = name;
        this.label = label;
        this.type = type;
        this.required = required;
        this.advanced = advanced;
        this.defaultValue = defaultValue;
        this.rule = rule;
    }

    public String getName() {
        return name;
    }

    public String getLabel() {
        return label;
    }

    public SlotType getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isAdvanced() {
        return advanced;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public SlotRule getRule() {
        return rule;
    }

    public BlockSlot toSlot(Object value) {
        return new BlockSlot(name, label, type, value, required, advanced, rule);
    }

    /**
     * Returns an error message, or null when {@code value} is acceptable for
     * this slot. Empty values pass; required slots left empty are reported by
     * {@link BlockValidator}, not rejected here.
     */
    public String validate(Object value) {
        if (value == null || (value instanceof String && ((String) value).isEmpty())) {
            return null;
        }
        switch (type) {
            case NUMBER:
                if (SlotRule.asNumber(value) == null) {
                    return label + " must be a number";
                }
                break;
            case BOOLEAN:
                if (!(value instanceof Boolean)
                    && !"true".equalsIgnoreCase(String.valueOf(value))
                    && !"false".equalsIgnoreCase(String.valueOf(value))) {
                    return label + " must be true or false";
                }
                break;
            default:
                if (!(value instanceof String) && !(value instanceof Number) && !(value instanceof Boolean)) {
                    return label + " must be a scalar value";
                }
                break;
        }
        return rule != null ? rule.validate(label, value) : null;
    }
}
