package com.scriptflow.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptflow.AppLogger;
import com.scriptflow.ScriptWorkspace;
import com.scriptflow.blocks.BlockOperationResult;
import com.scriptflow.flow.ConnectResult;
import com.scriptflow.models.FlowNodeData;
import com.scriptflow.models.FlowNodeType;
import com.scriptflow.models.NodePosition;
import com.scriptflow.models.PendingNode;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.FileNotFoundException;
import java.util.Map;

/**
 * Flow graph view and graph-surface edits: staging, connecting, moving and
 * deleting nodes.
 */
public class FlowController implements Controller {

    private final ScriptWorkspace workspace;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public FlowController(ScriptWorkspace workspace, ObjectMapper objectMapper) {
        this.workspace = workspace;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/scripts/{name}/flow", this::getFlow);
        app.delete("/api/scripts/{name}/nodes/{nodeId}", this::deleteNode);

        app.post("/api/scripts/{name}/pending", this::createPending);
        app.post("/api/scripts/{name}/pending/connect", this::connect);
        app.put("/api/scripts/{name}/pending/{nodeId}/position", this::updatePosition);
        app.put("/api/scripts/{name}/pending/{nodeId}/data", this::updateData);
        app.delete("/api/scripts/{name}/pending/{nodeId}", this::removePending);
    }

    private void getFlow(Context ctx) {
        try {
            ctx.json(workspace.flow(ctx.pathParam("name")));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error building flow graph: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * POST /api/scripts/{name}/pending
     * Expected body: { "type": "dialogue-block", "x": 120, "y": 80 }
     */
    private void createPending(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            String type = ScriptController.text(body, "type");
            if (type == null) {
                ctx.status(400).json(Map.of("error", "Node type is required"));
                return;
            }
            PendingNode node = workspace.createPendingNode(ctx.pathParam("name"), FlowNodeType.fromTag(type),
                position(body));
            ctx.status(201).json(node);
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * POST /api/scripts/{name}/pending/connect
     * Expected body: { "sourceNodeId", "sourceHandle" (optional), "targetNodeId" }
     */
    private void connect(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            String source = ScriptController.text(body, "sourceNodeId");
            String target = ScriptController.text(body, "targetNodeId");
            if (source == null || target == null) {
                ctx.status(400).json(Map.of("error", "Both 'sourceNodeId' and 'targetNodeId' are required"));
                return;
            }
            ConnectResult result = workspace.connect(ctx.pathParam("name"), source,
                ScriptController.text(body, "sourceHandle"), target);
            ctx.status(Controller.statusFor(result.getReason())).json(result);
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * PUT /api/scripts/{name}/pending/{nodeId}/position
     * Works for statement-backed nodes too; their positions go to the layout.
     */
    private void updatePosition(Context ctx) {
        try {
            String nodeId = ctx.pathParam("nodeId");
            NodePosition position = objectMapper.readValue(ctx.body(), NodePosition.class);
            if (!workspace.updateNodePosition(ctx.pathParam("name"), nodeId, position)) {
                ctx.status(404).json(Map.of("error", "Node not found: " + nodeId));
                return;
            }
            ctx.json(Map.of("success", true));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void updateData(Context ctx) {
        try {
            String nodeId = ctx.pathParam("nodeId");
            FlowNodeData patch = objectMapper.readValue(ctx.body(), FlowNodeData.class);
            if (!workspace.updatePendingData(ctx.pathParam("name"), nodeId, patch)) {
                ctx.status(404).json(Map.of("error", "Pending node not found: " + nodeId));
                return;
            }
            ctx.json(Map.of("success", true));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void removePending(Context ctx) {
        try {
            String nodeId = ctx.pathParam("nodeId");
            if (!workspace.removePendingNode(ctx.pathParam("name"), nodeId)) {
                ctx.status(404).json(Map.of("error", "Pending node not found: " + nodeId));
                return;
            }
            ctx.json(Map.of("success", true));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void deleteNode(Context ctx) {
        try {
            BlockOperationResult result = workspace.deleteNode(ctx.pathParam("name"), ctx.pathParam("nodeId"));
            ctx.status(Controller.statusFor(result.getReason())).json(result);
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private static NodePosition position(JsonNode body) {
        if (body == null || !body.hasNonNull("x") || !body.hasNonNull("y")) {
            return new NodePosition(0, 0);
        }
        return new NodePosition(body.get("x").asDouble(), body.get("y").asDouble());
    }
}
