package com.scriptflow.flow;

import com.scriptflow.models.BranchStatement;
import com.scriptflow.models.CallStatement;
import com.scriptflow.models.ChoiceStatement;
import com.scriptflow.models.DefaultStatement;
import com.scriptflow.models.DefineStatement;
import com.scriptflow.models.DialogueStatement;
import com.scriptflow.models.FlowEdge;
import com.scriptflow.models.FlowEdgeType;
import com.scriptflow.models.FlowGraph;
import com.scriptflow.models.FlowNode;
import com.scriptflow.models.FlowNodeData;
import com.scriptflow.models.FlowNodeType;
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
import com.scriptflow.models.ScriptForest;
import com.scriptflow.models.SetStatement;
import com.scriptflow.models.ShowStatement;
import com.scriptflow.models.Statement;
import com.scriptflow.models.StatementKind;
import com.scriptflow.models.StopStatement;
import com.scriptflow.models.WithStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects a forest into a flow graph.
 *
 * <p>Each label becomes one scene node. Its body is walked in order: menus,
 * ifs, jumps, calls and returns each become their own node, and every run of
 * other statements between them becomes one dialogue-block node (a scene
 * statement always opens a new run). Consecutive nodes of a sequence are
 * joined by sequence edges; menus and ifs get one edge per choice or branch
 * into the first node of its body, tagged with a port id derived from the
 * choice or branch statement. Jump and call targets are not drawn.</p>
 *
 * <p>Node ids, port ids and edge ids are derived from statement ids, so the
 * same forest always yields the same graph.</p>
 */
public class FlowGraphBuilder {

    public static final String SCENE_PREFIX = "scene-";
    public static final String CHOICE_PORT_PREFIX = "choice-";
    public static final String BRANCH_PORT_PREFIX = "branch-";

    private static final int PREVIEW_LINES = 3;

    public FlowGraph build(ScriptForest forest) {
        List<FlowNode> nodes = new ArrayList<>();
        List<FlowEdge> edges = new ArrayList<>();
        for (LabelStatement label : forest.getLabels()) {
            FlowNode scene = sceneNode(label);
            nodes.add(scene);
            walk(label.getBody(), label.getName(), scene.getId(), null, FlowEdgeType.SEQUENCE, nodes, edges);
        }
        return new FlowGraph(nodes, edges);
    }

    public static String choicePort(String choiceId) {
        return CHOICE_PORT_PREFIX + choiceId;
    }

    public static String branchPort(String branchId) {
        return BRANCH_PORT_PREFIX + branchId;
    }

    /**
     * Whether the statement gets a node of its own rather than joining a
     * dialogue block.
     */
    public static boolean isForking(StatementKind kind) {
        return kind == StatementKind.MENU
            || kind == StatementKind.IF
            || kind == StatementKind.JUMP
            || kind == StatementKind.CALL
            || kind == StatementKind.RETURN;
    }

    private void walk(List<Statement> sequence, String labelName, String predecessorId, String predecessorHandle,
                      FlowEdgeType entryType, List<FlowNode> nodes, List<FlowEdge> edges) {
        String previous = predecessorId;
        String handle = predecessorHandle;
        FlowEdgeType type = entryType;
        FlowNode run = null;

        for (Statement statement : sequence) {
            if (isForking(statement.getKind())) {
                run = null;
                FlowNode node = forkingNode(statement, labelName);
                nodes.add(node);
                edges.add(new FlowEdge(previous, node.getId(), handle, type));
                previous = node.getId();
                handle = null;
                type = FlowEdgeType.SEQUENCE;

                if (statement instanceof MenuStatement) {
                    for (ChoiceStatement choice : ((MenuStatement) statement).getChoices()) {
                        walk(choice.getBody(), labelName, node.getId(), choicePort(choice.getId()),
                            FlowEdgeType.CHOICE, nodes, edges);
                    }
                } else if (statement instanceof IfStatement) {
                    for (BranchStatement branch : ((IfStatement) statement).getBranches()) {
                        walk(branch.getBody(), labelName, node.getId(), branchPort(branch.getId()),
                            FlowEdgeType.CONDITION, nodes, edges);
                    }
                }
                continue;
            }

            boolean startsRun = run == null
                || (statement.getKind() == StatementKind.SCENE && !run.getStatementIds().isEmpty());
            if (startsRun) {
                run = new FlowNode("dialogue-" + statement.getId(), FlowNodeType.DIALOGUE_BLOCK, statement.getId());
                run.getStatementIds().clear();
                run.setLabelName(labelName);
                run.getData().setLines(new ArrayList<>());
                run.getData().setCommands(new ArrayList<>());
                nodes.add(run);
                edges.add(new FlowEdge(previous, run.getId(), handle, type));
                previous = run.getId();
                handle = null;
                type = FlowEdgeType.SEQUENCE;
            }
            run.getStatementIds().add(statement.getId());
            if (statement instanceof DialogueStatement) {
                DialogueStatement dialogue = (DialogueStatement) statement;
                run.getData().getLines().add(
                    new FlowNodeData.DialogueLine(dialogue.getSpeaker(), dialogue.getText(), dialogue.getId()));
            } else {
                run.getData().getCommands().add(
                    new FlowNodeData.Command(statement.getKind(), summarize(statement), statement.getId()));
            }
        }
    }

    private FlowNode sceneNode(LabelStatement label) {
        FlowNode node = new FlowNode(SCENE_PREFIX + label.getId(), FlowNodeType.SCENE, label.getId());
        node.setLabelName(label.getName());
        FlowNodeData data = node.getData();
        data.setLabel(label.getName());
        data.setPreview(preview(label.getBody()));
        data.setExitType(exitType(label.getBody()));
        return node;
    }

    private FlowNode forkingNode(Statement statement, String labelName) {
        FlowNode node;
        switch (statement.getKind()) {
            case MENU: {
                MenuStatement menu = (MenuStatement) statement;
                node = new FlowNode("menu-" + menu.getId(), FlowNodeType.MENU, menu.getId());
                node.getData().setPrompt(menu.getPrompt());
                List<FlowNodeData.Port> ports = new ArrayList<>();
                for (ChoiceStatement choice : menu.getChoices()) {
                    ports.add(new FlowNodeData.Port(choicePort(choice.getId()), choice.getId(),
                        choice.getText(), choice.getCondition()));
                }
                node.getData().setChoices(ports);
                break;
            }
            case IF: {
                IfStatement conditional = (IfStatement) statement;
                node = new FlowNode("condition-" + conditional.getId(), FlowNodeType.CONDITION, conditional.getId());
                List<FlowNodeData.Port> ports = new ArrayList<>();
                for (BranchStatement branch : conditional.getBranches()) {
                    ports.add(new FlowNodeData.Port(branchPort(branch.getId()), branch.getId(),
                        null, branch.getCondition()));
                }
                node.getData().setBranches(ports);
                break;
            }
            case JUMP:
                node = new FlowNode("jump-" + statement.getId(), FlowNodeType.JUMP, statement.getId());
                node.getData().setTarget(((JumpStatement) statement).getTarget());
                break;
            case CALL: {
                CallStatement call = (CallStatement) statement;
                node = new FlowNode("call-" + call.getId(), FlowNodeType.CALL, call.getId());
                node.getData().setTarget(call.getTarget());
                node.getData().setArguments(call.getArguments());
                break;
            }
            case RETURN:
                node = new FlowNode("return-" + statement.getId(), FlowNodeType.RETURN, statement.getId());
                node.getData().setValue(((ReturnStatement) statement).getValue());
                break;
            default:
                throw new IllegalArgumentException("Not a forking statement: " + statement.getKind().getTag());
        }
        node.setLabelName(labelName);
        return node;
    }

    private static List<String> preview(List<Statement> body) {
        List<String> lines = new ArrayList<>();
        for (Statement statement : body) {
            if (lines.size() >= PREVIEW_LINES) {
                break;
            }
            if (statement instanceof DialogueStatement) {
                DialogueStatement dialogue = (DialogueStatement) statement;
                String speaker = dialogue.getSpeaker();
                lines.add(speaker != null && !speaker.isEmpty()
                    ? speaker + ": " + dialogue.getText()
                    : dialogue.getText());
            } else if (statement instanceof SceneStatement || statement instanceof ShowStatement) {
                lines.add(summarize(statement));
            }
        }
        return lines;
    }

    private static String exitType(List<Statement> body) {
        if (body.isEmpty()) {
            return "fall-through";
        }
        switch (body.get(body.size() - 1).getKind()) {
            case RETURN:
                return "return";
            case JUMP:
                return "jump";
            case MENU:
                return "menu";
            default:
                return "fall-through";
        }
    }

    /**
     * One-line description of a non-dialogue statement for node payloads.
     */
    static String summarize(Statement statement) {
        switch (statement.getKind()) {
            case SCENE: {
                SceneStatement scene = (SceneStatement) statement;
                return "scene " + scene.getImage()
                    + (scene.getTransition() != null ? " with " + scene.getTransition() : "");
            }
            case SHOW: {
                ShowStatement show = (ShowStatement) statement;
                return "show " + show.getCharacter()
                    + (show.getExpression() != null ? " " + show.getExpression() : "")
                    + (show.getPosition() != null ? " at " + show.getPosition() : "");
            }
            case HIDE:
                return "hide " + ((HideStatement) statement).getCharacter();
            case WITH:
                return "with " + ((WithStatement) statement).getTransition();
            case SET: {
                SetStatement set = (SetStatement) statement;
                return "$ " + set.getVariable() + " " + set.getOperator() + " " + set.getValue();
            }
            case RAW_CODE: {
                String code = ((RawCodeStatement) statement).getCode();
                int newline = code.indexOf('\n');
                return "python: " + (newline >= 0 ? code.substring(0, newline) + " ..." : code);
            }
            case PLAY: {
                PlayStatement play = (PlayStatement) statement;
                return "play " + play.getChannel() + " \"" + play.getFile() + "\"";
            }
            case STOP:
                return "stop " + ((StopStatement) statement).getChannel();
            case PAUSE: {
                Double duration = ((PauseStatement) statement).getDuration();
                return duration != null ? "pause " + duration : "pause";
            }
            case NVL:
                return "nvl " + ((NvlStatement) statement).getAction();
            case DEFINE: {
                DefineStatement define = (DefineStatement) statement;
                return "define " + define.getName() + " = " + define.getValue();
            }
            case DEFAULT: {
                DefaultStatement def = (DefaultStatement) statement;
                return "default " + def.getName() + " = " + def.getValue();
            }
            default:
                return statement.getKind().getTag();
        }
    }
}
