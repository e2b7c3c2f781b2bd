package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Value constraints attached to a slot. Every field is optional; an absent
 * field places no constraint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlotRule {

    private Double min;
    private Double max;
    private List<String> options;
    private boolean allowCustom;
    private String pattern;

    public SlotRule() {
    }

    public static SlotRule range(double min, double max) {
        SlotRule rule = new SlotRule();
        rule.setMin(min);
        rule.setMax(max);
        return rule;
    }

    /**
     * Value must be one of {@code options}.
     */
    public static SlotRule oneOf(List<String> options) {
        SlotRule rule = new SlotRule();
        rule.setOptions(options);
        return rule;
    }

    /**
     * {@code options} are suggestions; any value is accepted.
     */
    public static SlotRule suggest(List<String> options) {
        SlotRule rule = oneOf(options);
        rule.setAllowCustom(true);
        return rule;
    }

    public static SlotRule matching(String pattern) {
        SlotRule rule = new SlotRule();
        rule.setPattern(pattern);
        return rule;
    }

    /**
     * Returns an error message, or null when the value satisfies this rule.
     * Empty values are not checked here; required-ness is a separate flag.
     */
    public String validate(String slotName, Object value) {
        if (value == null || (value instanceof String && ((String) value).isEmpty())) {
            return null;
        }
        if (min != null || max != null) {
            Double number = asNumber(value);
            if (number == null) {
                return slotName + " must be a number";
            }
            if (min != null && number < min) {
                return slotName + " must be at least " + formatNumber(min);
            }
            if (max != null && number > max) {
                return slotName + " must be at most " + formatNumber(max);
            }
        }
        if (options != null && !options.isEmpty() && !allowCustom) {
            if (!options.contains(String.valueOf(value))) {
                return slotName + " must be one of " + String.join(", ", options);
            }
        }
        if (pattern != null && !pattern.isEmpty()) {
            if (!Pattern.compile(pattern).matcher(String.valueOf(value)).matches()) {
                return slotName + " has an invalid format";
            }
        }
        return null;
    }

    public static Double asNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    public Double getMin() {
        return min;
    }

    public void setMin(Double min) {
        this.min = min;
    }

    public Double getMax() {
        return max;
    }

    public void setMax(Double max) {
        this.max = max;
    }

    public List<String> getOptions() {
        return options;
    }

    public void setOptions(List<String> options) {
        this.options = options != null ? new ArrayList<>(options) : null;
    }

    public boolean isAllowCustom() {
        return allowCustom;
    }

    public void setAllowCustom(boolean allowCustom) {
        this.allowCustom = allowCustom;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }
}
