package com.scriptflow;

import com.scriptflow.models.BlockTemplate;
import com.scriptflow.models.ChoiceStatement;
import com.scriptflow.models.DialogueStatement;
import com.scriptflow.models.MenuStatement;
import com.scriptflow.models.Statement;
import com.scriptflow.storage.JsonStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRegistryTest {

    @TempDir
    Path tempDir;

    private Path templatesFile;
    private TemplateRegistry registry;

    @BeforeEach
    void setUp() {
        templatesFile = tempDir.resolve(".scriptflow").resolve("templates.json");
        registry = new TemplateRegistry(templatesFile, JsonStorage.mapper());
        registry.load();
    }

    @Test
    void bundledTemplatesAreLoadedAsBuiltIn() {
        List<BlockTemplate> all = registry.all();
        assertEquals(5, all.size());
        for (BlockTemplate template : all) {
            assertTrue(template.isBuiltIn(), template.getId());
        }
        assertNotNull(registry.get("builtin-choice-branch"));
        assertTrue(registry.customTemplates().isEmpty());
    }

    @Test
    void instantiateBuildsFreshStatements() {
        List<Statement> first = registry.instantiate("builtin-choice-branch");
        List<Statement> second = registry.instantiate("builtin-choice-branch");

        assertEquals(1, first.size());
        MenuStatement menu = (MenuStatement) first.get(0);
        assertEquals("What should I do?", menu.getPrompt());
        assertEquals(2, menu.getChoices().size());
        ChoiceStatement stay = menu.getChoices().get(0);
        assertEquals("Stay", stay.getText());
        assertEquals("I decide to stay.", ((DialogueStatement) stay.getBody().get(0)).getText());
        assertNotEquals(menu.getId(), second.get(0).getId());

        assertThrows(IllegalArgumentException.class, () -> registry.instantiate("missing"));
    }

    @Test
    void customTemplatesPersistAcrossReload() throws Exception {
        DialogueStatement line = new DialogueStatement("d1", "e", "Hi", null);
        BlockTemplate saved = registry.saveCustom("Greeting", "Says hi", null, List.of(line));

        assertFalse(saved.isBuiltIn());
        assertEquals("custom", saved.getCategory());
        assertEquals("", saved.getBlocks().get(0).getStatementId());
        assertTrue(Files.exists(templatesFile));

        registry.update(saved.getId(), "Hello", null, "dialogue");

        TemplateRegistry reloaded = new TemplateRegistry(templatesFile, JsonStorage.mapper());
        reloaded.load();
        BlockTemplate restored = reloaded.get(saved.getId());
        assertNotNull(restored);
        assertEquals("Hello", restored.getName());
        assertEquals("Says hi", restored.getDescription());
        assertEquals("dialogue", restored.getCategory());

        List<Statement> statements = reloaded.instantiate(saved.getId());
        assertEquals("Hi", ((DialogueStatement) statements.get(0)).getText());
        assertNotEquals("d1", statements.get(0).getId());

        assertTrue(reloaded.delete(saved.getId()));
        assertFalse(reloaded.delete(saved.getId()));
        assertNull(reloaded.update(saved.getId(), "x", null, null));
    }

    @Test
    void builtInTemplatesAreReadOnly() {
        assertThrows(IllegalArgumentException.class,
            () -> registry.update("builtin-scene-dialogue", "Renamed", null, null));
        assertThrows(IllegalArgumentException.class, () -> registry.delete("builtin-scene-dialogue"));
        assertThrows(IllegalArgumentException.class, () -> registry.saveCustom(" ", null, null,
            List.of(new DialogueStatement(null, "x"))));
        assertThrows(IllegalArgumentException.class, () -> registry.saveCustom("Empty", null, null, List.of()));
    }

    @Test
    void importAssignsNewIds() throws Exception {
        BlockTemplate saved = registry.saveCustom("Greeting", null, "dialogue",
            List.of(new DialogueStatement(null, "Hi")));
        String exported = registry.exportCustom();

        assertEquals(1, registry.importTemplates(exported, false));
        assertEquals(2, registry.customTemplates().size());

        assertEquals(1, registry.importTemplates(exported, true));
        List<BlockTemplate> custom = registry.customTemplates();
        assertEquals(1, custom.size());
        assertNotEquals(saved.getId(), custom.get(0).getId());
        assertEquals("Greeting", custom.get(0).getName());
    }
}
