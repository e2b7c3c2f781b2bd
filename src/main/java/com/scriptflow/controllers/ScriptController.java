package com.scriptflow.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptflow.AppLogger;
import com.scriptflow.ScriptWorkspace;
import com.scriptflow.blocks.BlockOperationResult;
import com.scriptflow.blocks.BlockValidator;
import com.scriptflow.blocks.ValidationIssue;
import com.scriptflow.models.Block;
import com.scriptflow.models.ScriptForest;
import com.scriptflow.models.ScriptLayout;
import com.scriptflow.models.StatementKind;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scripts, labels, block trees, block edits, layout and undo history.
 */
public class ScriptController implements Controller {

    private final ScriptWorkspace workspace;
    private final ObjectMapper objectMapper;
    private final BlockValidator validator = new BlockValidator();
    private final AppLogger logger;

    public ScriptController(ScriptWorkspace workspace, ObjectMapper objectMapper) {
        this.workspace = workspace;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/scripts", this::listScripts);
        app.post("/api/scripts", this::createScript);
        app.get("/api/scripts/{name}", this::getScript);
        app.delete("/api/scripts/{name}", this::deleteScript);

        app.post("/api/scripts/{name}/labels", this::addLabel);
        app.delete("/api/scripts/{name}/labels/{label}", this::removeLabel);

        app.get("/api/scripts/{name}/blocks", this::getBlocks);
        app.get("/api/scripts/{name}/blocks/{label}", this::getLabelBlocks);
        app.post("/api/scripts/{name}/blocks", this::addBlock);
        app.post("/api/scripts/{name}/blocks/move", this::moveBlock);
        app.post("/api/scripts/{name}/blocks/move-across", this::moveBlockAcrossLabels);
        app.post("/api/scripts/{name}/blocks/paste", this::pasteBlock);
        app.delete("/api/scripts/{name}/blocks/{statementId}", this::deleteBlock);
        app.put("/api/scripts/{name}/blocks/{statementId}/slots/{slot}", this::updateSlot);
        app.post("/api/scripts/{name}/blocks/{statementId}/copy", this::copyBlock);

        app.get("/api/scripts/{name}/validation", this::getValidation);

        app.get("/api/scripts/{name}/layout", this::getLayout);
        app.put("/api/scripts/{name}/layout", this::saveLayout);

        app.post("/api/scripts/{name}/undo", this::undo);
        app.post("/api/scripts/{name}/redo", this::redo);
    }

    private void listScripts(Context ctx) {
        try {
            ctx.json(Map.of("scripts", workspace.listScripts()));
        } catch (Exception e) {
            logger.error("Error listing scripts: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * POST /api/scripts
     * Expected body: { "name": "chapter1" }
     */
    private void createScript(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            String name = text(body, "name");
            if (name == null || name.isBlank()) {
                ctx.status(400).json(Map.of("error", "Script name is required"));
                return;
            }
            ctx.status(201).json(workspace.createScript(name.trim()));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getScript(Context ctx) {
        try {
            ctx.json(workspace.getForest(ctx.pathParam("name")));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void deleteScript(Context ctx) {
        try {
            String name = ctx.pathParam("name");
            if (!workspace.deleteScript(name)) {
                ctx.status(404).json(Map.of("error", "Script not found: " + name));
                return;
            }
            ctx.json(Map.of("success", true));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * POST /api/scripts/{name}/labels
     * Expected body: { "name": "ending" }
     */
    private void addLabel(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            respond(ctx, workspace.addLabel(ctx.pathParam("name"), text(body, "name")));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void removeLabel(Context ctx) {
        try {
            respond(ctx, workspace.removeLabel(ctx.pathParam("name"), ctx.pathParam("label")));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getBlocks(Context ctx) {
        try {
            List<Block> blocks = workspace.blocks(ctx.pathParam("name"));
            ctx.json(Map.of("blocks", blocks));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getLabelBlocks(Context ctx) {
        try {
            String label = ctx.pathParam("label");
            Block root = workspace.labelBlocks(ctx.pathParam("name"), label);
            if (root == null) {
                ctx.status(404).json(Map.of("error", "Label not found: " + label));
                return;
            }
            ctx.json(root);
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * POST /api/scripts/{name}/blocks
     * Expected body: { "kind": "dialogue", "parentId": "stmt-...", "index": 0 }
     * A missing index appends.
     */
    private void addBlock(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            String kind = text(body, "kind");
            if (kind == null) {
                ctx.status(400).json(Map.of("error", "Block kind is required"));
                return;
            }
            respond(ctx, workspace.addBlock(ctx.pathParam("name"), StatementKind.fromTag(kind),
                text(body, "parentId"), index(body)));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * POST /api/scripts/{name}/blocks/move
     * Expected body: { "statementId": "...", "parentId": "...", "index": 2 }
     */
    private void moveBlock(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            respond(ctx, workspace.moveBlock(ctx.pathParam("name"), text(body, "statementId"),
                text(body, "parentId"), index(body)));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * POST /api/scripts/{name}/blocks/move-across
     * Expected body: { "statementId", "sourceLabel", "targetLabel",
     * "containerId" (optional, defaults to the target label body), "index" }
     */
    private void moveBlockAcrossLabels(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            respond(ctx, workspace.moveBlockAcrossLabels(ctx.pathParam("name"), text(body, "statementId"),
                text(body, "sourceLabel"), text(body, "targetLabel"), text(body, "containerId"), index(body)));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void deleteBlock(Context ctx) {
        try {
            respond(ctx, workspace.deleteBlock(ctx.pathParam("name"), ctx.pathParam("statementId")));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * PUT /api/scripts/{name}/blocks/{statementId}/slots/{slot}
     * Expected body: { "value": ... } where value is a string, number,
     * boolean or null.
     */
    private void updateSlot(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            JsonNode valueNode = body.get("value");
            Object value = valueNode == null || valueNode.isNull()
                ? null : objectMapper.treeToValue(valueNode, Object.class);
            respond(ctx, workspace.updateSlot(ctx.pathParam("name"), ctx.pathParam("statementId"),
                ctx.pathParam("slot"), value));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void copyBlock(Context ctx) {
        try {
            String statementId = ctx.pathParam("statementId");
            if (!workspace.copyBlock(ctx.pathParam("name"), statementId)) {
                ctx.status(404).json(Map.of("error", "Statement not found: " + statementId));
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

    /**
     * POST /api/scripts/{name}/blocks/paste
     * Expected body: { "containerId": "...", "index": 0 }
     */
    private void pasteBlock(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            respond(ctx, workspace.pasteBlock(ctx.pathParam("name"), text(body, "containerId"), index(body)));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getValidation(Context ctx) {
        try {
            List<ValidationIssue> issues = workspace.validate(ctx.pathParam("name"));
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("issues", issues);
            response.put("summary", validator.summarize(issues));
            ctx.json(response);
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getLayout(Context ctx) {
        try {
            ctx.json(workspace.getLayout(ctx.pathParam("name")));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void saveLayout(Context ctx) {
        try {
            ScriptLayout layout = objectMapper.readValue(ctx.body(), ScriptLayout.class);
            ctx.json(workspace.saveLayout(ctx.pathParam("name"), layout));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void undo(Context ctx) {
        try {
            String name = ctx.pathParam("name");
            ScriptForest forest = workspace.undo(name);
            if (forest == null) {
                ctx.status(409).json(Map.of("error", "Nothing to undo"));
                return;
            }
            ctx.json(historyBody(name, forest));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void redo(Context ctx) {
        try {
            String name = ctx.pathParam("name");
            ScriptForest forest = workspace.redo(name);
            if (forest == null) {
                ctx.status(409).json(Map.of("error", "Nothing to redo"));
                return;
            }
            ctx.json(historyBody(name, forest));
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private Map<String, Object> historyBody(String name, ScriptForest forest) throws IOException {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("forest", forest);
        response.put("undoCount", workspace.undoCount(name));
        response.put("redoCount", workspace.redoCount(name));
        return response;
    }

    private static void respond(Context ctx, BlockOperationResult result) {
        ctx.status(Controller.statusFor(result.getReason())).json(result);
    }

    static String text(JsonNode body, String field) {
        JsonNode node = body != null ? body.get(field) : null;
        return node == null || node.isNull() ? null : node.asText();
    }

    static int index(JsonNode body) {
        JsonNode node = body != null ? body.get("index") : null;
        return node == null || node.isNull() ? Integer.MAX_VALUE : node.asInt();
    }
}
