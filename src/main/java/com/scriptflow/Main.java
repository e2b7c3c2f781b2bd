package com.scriptflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptflow.controllers.Controller;
import com.scriptflow.controllers.FlowController;
import com.scriptflow.controllers.ScriptController;
import com.scriptflow.controllers.TemplateController;
import com.scriptflow.storage.JsonStorage;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.FileNotFoundException;
import java.util.List;
import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            ObjectMapper objectMapper = JsonStorage.mapper();
            TemplateRegistry templates = new TemplateRegistry(
                AppConfig.templatesFile(config.getWorkspacePath()), objectMapper);
            templates.load();
            ScriptWorkspace workspace = new ScriptWorkspace(config.getWorkspacePath(), templates);
            logger.info("Workspace initialized: " + config.getWorkspacePath());

            Javalin app = createApp(workspace, templates, objectMapper);
            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Workspace: " + config.getWorkspacePath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start ScriptFlow: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Javalin app with every controller and the global exception handlers
     * registered, not yet started.
     */
    static Javalin createApp(ScriptWorkspace workspace, TemplateRegistry templates, ObjectMapper objectMapper) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper));
            cfg.http.defaultContentType = "application/json";
        });

        List<Controller> controllers = List.of(
            new ScriptController(workspace, objectMapper),
            new FlowController(workspace, objectMapper),
            new TemplateController(templates, workspace, objectMapper)
        );
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }

        registerExceptionHandlers(app);
        return app;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  ScriptFlow v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        AppLogger log = AppLogger.get();

        app.exception(FileNotFoundException.class, (e, ctx) -> {
            log.warn("Not found: " + e.getMessage());
            ctx.status(404).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            log.warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Map.of("error", String.valueOf(e.getMessage())));
        });
    }
}
