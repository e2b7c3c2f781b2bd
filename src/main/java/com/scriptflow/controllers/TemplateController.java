package com.scriptflow.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptflow.AppLogger;
import com.scriptflow.ScriptWorkspace;
import com.scriptflow.TemplateRegistry;
import com.scriptflow.blocks.BlockOperationResult;
import com.scriptflow.models.BlockTemplate;
import com.scriptflow.models.ScriptForest;
import com.scriptflow.models.Statement;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.FileNotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Controller for block templates: listing, saving from a script, editing,
 * export/import and applying a template into a script.
 */
public class TemplateController implements Controller {

    private final TemplateRegistry registry;
    private final ScriptWorkspace workspace;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public TemplateController(TemplateRegistry registry, ScriptWorkspace workspace, ObjectMapper objectMapper) {
        this.registry = registry;
        this.workspace = workspace;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/templates", this::listTemplates);
        app.post("/api/templates", this::saveTemplate);
        app.get("/api/templates/export", this::exportTemplates);
        app.post("/api/templates/import", this::importTemplates);
        app.put("/api/templates/{id}", this::updateTemplate);
        app.delete("/api/templates/{id}", this::deleteTemplate);
        app.post("/api/templates/{id}/apply", this::applyTemplate);
    }

    private void listTemplates(Context ctx) {
        try {
            ctx.json(registry.all());
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * POST /api/templates
     * Saves statements of a script as a custom template.
     * Expected body: { "name", "description", "category", "script", "statementIds": [...] }
     */
    private void saveTemplate(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            String script = ScriptController.text(body, "script");
            JsonNode ids = body.get("statementIds");
            if (script == null || ids == null || !ids.isArray() || ids.size() == 0) {
                ctx.status(400).json(Map.of("error", "'script' and a non-empty 'statementIds' are required"));
                return;
            }
            ScriptForest forest = workspace.getForest(script);
            List<Statement> statements = new ArrayList<>();
            for (JsonNode id : ids) {
                Optional<Statement> statement = forest.findById(id.asText());
                if (statement.isEmpty()) {
                    ctx.status(404).json(Map.of("error", "Statement not found: " + id.asText()));
                    return;
                }
                statements.add(statement.get());
            }
            BlockTemplate template = registry.saveCustom(ScriptController.text(body, "name"),
                ScriptController.text(body, "description"), ScriptController.text(body, "category"), statements);
            ctx.status(201).json(template);
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error saving template: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void updateTemplate(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            JsonNode body = objectMapper.readTree(ctx.body());
            BlockTemplate template = registry.update(id, ScriptController.text(body, "name"),
                ScriptController.text(body, "description"), ScriptController.text(body, "category"));
            if (template == null) {
                ctx.status(404).json(Map.of("error", "Template not found: " + id));
                return;
            }
            ctx.json(template);
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void deleteTemplate(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            if (!registry.delete(id)) {
                ctx.status(404).json(Map.of("error", "Template not found: " + id));
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
     * POST /api/templates/{id}/apply
     * Expected body: { "script", "containerId", "index" (optional, appends) }
     */
    private void applyTemplate(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            if (registry.get(id) == null) {
                ctx.status(404).json(Map.of("error", "Template not found: " + id));
                return;
            }
            JsonNode body = objectMapper.readTree(ctx.body());
            String script = ScriptController.text(body, "script");
            if (script == null) {
                ctx.status(400).json(Map.of("error", "'script' is required"));
                return;
            }
            BlockOperationResult result = workspace.applyTemplate(script, id,
                ScriptController.text(body, "containerId"), ScriptController.index(body));
            ctx.status(Controller.statusFor(result.getReason())).json(result);
        } catch (FileNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void exportTemplates(Context ctx) {
        try {
            ctx.contentType("application/json").result(registry.exportCustom());
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * POST /api/templates/import?replace=true
     * Body: an exported template array.
     */
    private void importTemplates(Context ctx) {
        try {
            boolean replace = "true".equalsIgnoreCase(ctx.queryParam("replace"));
            int imported = registry.importTemplates(ctx.body(), replace);
            ctx.json(Map.of("imported", imported));
        } catch (Exception e) {
            ctx.status(400).json(Controller.errorBody(e));
        }
    }
}
