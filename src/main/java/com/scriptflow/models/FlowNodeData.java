package com.scriptflow.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload of a flow node. Which fields are populated depends on the node
 * type: scene nodes use label/preview/exitType, dialogue blocks use
 * lines/commands, menus use prompt/choices, conditions use branches and
 * jump/call/return nodes use target/arguments/value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowNodeData {

    private String label;
    private List<String> preview;
    private String exitType;
    private List<DialogueLine> lines;
    private List<Command> commands;
    private String prompt;
    private List<Port> choices;
    private List<Port> branches;
    private String target;
    private String arguments;
    private String value;

    public FlowNodeData() {
    }

    /**
     * Copies every non-null field of {@code patch} over this payload.
     */
    public void mergeFrom(FlowNodeData patch) {
        if (patch == null) {
            return;
        }
        if (patch.label != null) label = patch.label;
        if (patch.preview != null) preview = new ArrayList<>(patch.preview);
        if (patch.exitType != null) exitType = patch.exitType;
        if (patch.lines != null) lines = new ArrayList<>(patch.lines);
        if (patch.commands != null) commands = new ArrayList<>(patch.commands);
        if (patch.prompt != null) prompt = patch.prompt;
        if (patch.choices != null) choices = new ArrayList<>(patch.choices);
        if (patch.branches != null) branches = new ArrayList<>(patch.branches);
        if (patch.target != null) target = patch.target;
        if (patch.arguments != null) arguments = patch.arguments;
        if (patch.value != null) value = patch.value;
    }

    public FlowNodeData copy() {
        FlowNodeData copy = new FlowNodeData();
        copy.mergeFrom(this);
        return copy;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public List<String> getPreview() {
        return preview;
    }

    public void setPreview(List<String> preview) {
        this.preview = preview;
    }

    public String getExitType() {
        return exitType;
    }

    public void setExitType(String exitType) {
        this.exitType = exitType;
    }

    public List<DialogueLine> getLines() {
        return lines;
    }

    public void setLines(List<DialogueLine> lines) {
        this.lines = lines;
    }

    public List<Command> getCommands() {
        return commands;
    }

    public void setCommands(List<Command> commands) {
        this.commands = commands;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public List<Port> getChoices() {
        return choices;
    }

    public void setChoices(List<Port> choices) {
        this.choices = choices;
    }

    public List<Port> getBranches() {
        return branches;
    }

    public void setBranches(List<Port> branches) {
        this.branches = branches;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getArguments() {
        return arguments;
    }

    public void setArguments(String arguments) {
        this.arguments = arguments;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DialogueLine {
        private String speaker;
        private String text;
        private String statementId;

        public DialogueLine() {
        }

        public DialogueLine(String speaker, String text, String statementId) {
            this.speaker = speaker;
            this.text = text;
            this.statementId = statementId;
        }

        public String getSpeaker() {
            return speaker;
        }

        public void setSpeaker(String speaker) {
            this.speaker = speaker;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public String getStatementId() {
            return statementId;
        }

        public void setStatementId(String statementId) {
            this.statementId = statementId;
        }
    }

    /**
     * A non-dialogue statement folded into a dialogue block: scene, show,
     * hide, with and the other directives that do not fork control flow.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Command {
        private StatementKind kind;
        private String summary;
        private String statementId;

        public Command() {
        }

        public Command(StatementKind kind, String summary, String statementId) {
            this.kind = kind;
            this.summary = summary;
            this.statementId = statementId;
        }

        public StatementKind getKind() {
            return kind;
        }

        public void setKind(StatementKind kind) {
            this.kind = kind;
        }

        public String getSummary() {
            return summary;
        }

        public void setSummary(String summary) {
            this.summary = summary;
        }

        public String getStatementId() {
            return statementId;
        }

        public void setStatementId(String statementId) {
            this.statementId = statementId;
        }
    }

    /**
     * An outgoing port of a menu or condition node.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Port {
        private String portId;
        private String statementId;
        private String text;
        private String condition;

        public Port() {
        }

        public Port(String portId, String statementId, String text, String condition) {
            this.portId = portId;
            this.statementId = statementId;
            this.text = text;
            this.condition = condition;
        }

        public String getPortId() {
            return portId;
        }

        public void setPortId(String portId) {
            this.portId = portId;
        }

        public String getStatementId() {
            return statementId;
        }

        public void setStatementId(String statementId) {
            this.statementId = statementId;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public String getCondition() {
            return condition;
        }

        public void setCondition(String condition) {
            this.condition = condition;
        }
    }
}
