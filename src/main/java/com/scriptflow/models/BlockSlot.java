package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One named value of a block.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlockSlot {

    private String name;
    private String label;
    private SlotType type;
    private Object value;
    private boolean required;
    private boolean advanced;
    private SlotRule rule;

    public BlockSlot() {
    }

    public BlockSlot(String name, String label, SlotType type, Object value, boolean required, boolean advanced, SlotRule rule) {
        this.name = name;
        this.label = label;
        this.type = type;
        this.value = value;
        this.required = required;
        this.advanced = advanced;
        this.rule = rule;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public SlotType getType() {
        return type;
    }

    public void setType(SlotType type) {
        this.type = type;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public boolean isRequired() {
        return required;
    }

    public void setRequired(boolean required) {
        this.required = required;
    }

    public boolean isAdvanced() {
        return advanced;
    }

    public void setAdvanced(boolean advanced) {
        this.advanced = advanced;
    }

    public SlotRule getRule() {
        return rule;
    }

    public void setRule(SlotRule rule) {
        this.rule = rule;
    }

    @JsonIgnore
    public boolean isEmpty() {
        if (value == null) {
            return true;
        }
        return value instanceof String && ((String) value).trim().isEmpty();
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
