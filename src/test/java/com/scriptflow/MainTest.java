package com.scriptflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptflow.storage.JsonStorage;
import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;
import okhttp3.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path workspacePath;

    private final ObjectMapper mapper = JsonStorage.mapper();
    private Javalin app;

    @BeforeEach
    void setUp() {
        TemplateRegistry templates = new TemplateRegistry(AppConfig.templatesFile(workspacePath), mapper);
        templates.load();
        app = Main.createApp(new ScriptWorkspace(workspacePath, templates), templates, mapper);
    }

    private JsonNode json(Response response) throws Exception {
        return mapper.readTree(response.body().string());
    }

    @Test
    void scriptLifecycleOverHttp() {
        JavalinTest.test(app, (server, client) -> {
            Response created = client.post("/api/scripts", "{\"name\":\"intro\"}");
            assertEquals(201, created.code());
            String labelId = json(created).get("statements").get(0).get("id").asText();

            Response duplicate = client.post("/api/scripts", "{\"name\":\"intro\"}");
            assertEquals(400, duplicate.code());

            Response added = client.post("/api/scripts/intro/blocks",
                "{\"kind\":\"dialogue\",\"parentId\":\"" + labelId + "\"}");
            assertEquals(200, added.code());
            JsonNode result = json(added);
            assertTrue(result.get("success").asBoolean());
            String statementId = result.get("statementId").asText();

            JsonNode blocks = json(client.get("/api/scripts/intro/blocks")).get("blocks");
            assertEquals(1, blocks.size());
            assertEquals(statementId, blocks.get(0).get("children").get(0).get("statementId").asText());

            JsonNode flow = json(client.get("/api/scripts/intro/flow"));
            assertEquals(2, flow.get("nodes").size());
            assertEquals(1, flow.get("edges").size());

            assertEquals(200, client.delete("/api/scripts/intro").code());
        });
    }

    @Test
    void failuresMapToStatusCodes() {
        JavalinTest.test(app, (server, client) -> {
            assertEquals(404, client.get("/api/scripts/missing/blocks").code());
            assertEquals(404, client.get("/api/scripts/missing/flow").code());

            client.post("/api/scripts", "{\"name\":\"intro\"}");
            assertEquals(404, client.delete("/api/scripts/intro/blocks/ghost").code());
            assertEquals(400, client.post("/api/scripts/intro/blocks", "{\"parentId\":\"x\"}").code());
            assertEquals(404, client.get("/api/scripts/intro/blocks/nowhere").code());
            assertEquals(201, client.post("/api/scripts/intro/pending", "{\"type\":\"menu\",\"x\":5,\"y\":6}").code());
            assertEquals(404, client.post("/api/templates/missing/apply", "{\"script\":\"intro\"}").code());
        });
    }

    @Test
    void undoAndRedoOverHttp() {
        JavalinTest.test(app, (server, client) -> {
            String labelId = json(client.post("/api/scripts", "{\"name\":\"intro\"}"))
                .get("statements").get(0).get("id").asText();
            assertEquals(409, client.post("/api/scripts/intro/undo", "{}").code());
            client.post("/api/scripts/intro/blocks", "{\"kind\":\"dialogue\",\"parentId\":\"" + labelId + "\"}");

            Response undone = client.post("/api/scripts/intro/undo", "{}");
            assertEquals(200, undone.code());
            JsonNode body = json(undone);
            assertEquals(0, body.get("forest").get("statements").get(0).get("body").size());
            assertEquals(0, body.get("undoCount").asInt());
            assertEquals(1, body.get("redoCount").asInt());

            Response redone = client.post("/api/scripts/intro/redo", "{}");
            assertEquals(200, redone.code());
            assertEquals(1, json(redone).get("forest").get("statements").get(0).get("body").size());
            assertEquals(409, client.post("/api/scripts/intro/redo", "{}").code());
            assertEquals(404, client.post("/api/scripts/missing/undo", "{}").code());
        });
    }

    @Test
    void templatesAreListed() {
        JavalinTest.test(app, (server, client) -> {
            Response response = client.get("/api/templates");
            assertEquals(200, response.code());
            assertEquals(5, json(response).size());
        });
    }
}
