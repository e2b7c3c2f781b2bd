package com.scriptflow;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptflow.blocks.BlockTreeBuilder;
import com.scriptflow.blocks.StatementFactory;
import com.scriptflow.models.Block;
import com.scriptflow.models.BlockTemplate;
import com.scriptflow.models.Statement;
import com.scriptflow.storage.JsonStorage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Block templates: built-in ones bundled on the classpath
 * (src/main/resources/templates/builtin.json) and custom ones persisted in
 * the workspace. Constructed once at startup and passed to whoever needs it.
 */
public class TemplateRegistry {

    private static final String BUNDLED_TEMPLATES = "templates/builtin.json";

    private final Path customTemplatesFile;
    private final ObjectMapper objectMapper;
    private final BlockTreeBuilder blockBuilder;
    private final AppLogger logger = AppLogger.get();
    private final Map<String, BlockTemplate> builtIn = new LinkedHashMap<>();
    private final Map<String, BlockTemplate> custom = new LinkedHashMap<>();

    public TemplateRegistry(Path customTemplatesFile, ObjectMapper objectMapper) {
        this.customTemplatesFile = customTemplatesFile;
        this.objectMapper = objectMapper;
        this.blockBuilder = new BlockTreeBuilder(() -> "tpl-" + UUID.randomUUID());
    }

    /**
     * Loads built-in and custom templates, replacing whatever was loaded.
     */
    public synchronized void load() {
        builtIn.clear();
        custom.clear();
        loadBundled();
        loadCustom();
        logger.info("[TemplateRegistry] Loaded " + builtIn.size() + " built-in and " + custom.size() + " custom templates");
    }

    public synchronized void persist() throws IOException {
        JsonStorage.writeJsonList(customTemplatesFile, new ArrayList<>(custom.values()));
    }

    public synchronized List<BlockTemplate> all() {
        List<BlockTemplate> result = new ArrayList<>(builtIn.values());
        result.addAll(custom.values());
        return result;
    }

    public synchronized List<BlockTemplate> customTemplates() {
        return new ArrayList<>(custom.values());
    }

    public synchronized BlockTemplate get(String id) {
        BlockTemplate template = builtIn.get(id);
        return template != null ? template : custom.get(id);
    }

    /**
     * Saves statements as a new custom template. The statements are stored as
     * unbacked blocks and the original statements are left untouched.
     */
    public synchronized BlockTemplate saveCustom(String name, String description, String category,
                                                 List<Statement> statements) throws IOException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Template name is required");
        }
        if (statements == null || statements.isEmpty()) {
            throw new IllegalArgumentException("Template needs at least one block");
        }
        List<Block> blocks = new ArrayList<>();
        for (Statement statement : statements) {
            blocks.add(blockBuilder.buildUnbacked(statement));
        }
        long now = System.currentTimeMillis();
        BlockTemplate template = new BlockTemplate();
        template.setId("custom-" + UUID.randomUUID());
        template.setName(name.trim());
        template.setDescription(description);
        template.setCategory(category != null && !category.isBlank() ? category : "custom");
        template.setBlocks(blocks);
        template.setBuiltIn(false);
        template.setCreatedAt(now);
        template.setUpdatedAt(now);
        custom.put(template.getId(), template);
        persist();
        logger.info("[TemplateRegistry] Saved custom template " + template.getId() + " (" + template.getName() + ")");
        return template;
    }

    /**
     * Renames or re-describes a custom template. Null arguments keep the
     * current value.
     */
    public synchronized BlockTemplate update(String id, String name, String description, String category) throws IOException {
        if (builtIn.containsKey(id)) {
            throw new IllegalArgumentException("Built-in templates cannot be modified: " + id);
        }
        BlockTemplate template = custom.get(id);
        if (template == null) {
            return null;
        }
        if (name != null && !name.isBlank()) {
            template.setName(name.trim());
        }
        if (description != null) {
            template.setDescription(description);
        }
        if (category != null && !category.isBlank()) {
            template.setCategory(category);
        }
        template.setUpdatedAt(System.currentTimeMillis());
        persist();
        return template;
    }

    public synchronized boolean delete(String id) throws IOException {
        if (builtIn.containsKey(id)) {
            throw new IllegalArgumentException("Built-in templates cannot be deleted: " + id);
        }
        if (custom.remove(id) == null) {
            return false;
        }
        persist();
        return true;
    }

    /**
     * Fresh statements for every block of the template, in order.
     *
     * @throws IllegalArgumentException if the template does not exist or its
     *                                  blocks do not form valid statements
     */
    public synchronized List<Statement> instantiate(String id) {
        BlockTemplate template = get(id);
        if (template == null) {
            throw new IllegalArgumentException("Template not found: " + id);
        }
        List<Statement> statements = new ArrayList<>();
        for (Block block : template.getBlocks()) {
            statements.add(StatementFactory.fromBlock(block));
        }
        return statements;
    }

    public synchronized String exportCustom() throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(new ArrayList<>(custom.values()));
    }

    /**
     * Imports templates from exported JSON. Imported templates get new ids so
     * they never collide with existing ones. With {@code replace} the current
     * custom templates are dropped first. Returns the number imported.
     */
    public synchronized int importTemplates(String json, boolean replace) throws IOException {
        List<BlockTemplate> incoming = objectMapper.readValue(json, new TypeReference<List<BlockTemplate>>() {});
        if (replace) {
            custom.clear();
        }
        int imported = 0;
        long now = System.currentTimeMillis();
        for (BlockTemplate template : incoming) {
            if (template == null || template.getName() == null || template.getName().isBlank()) {
                continue;
            }
            template.setId("custom-" + UUID.randomUUID());
            template.setBuiltIn(false);
            if (template.getCreatedAt() <= 0) {
                template.setCreatedAt(now);
            }
            template.setUpdatedAt(now);
            clearBacking(template.getBlocks());
            custom.put(template.getId(), template);
            imported++;
        }
        persist();
        logger.info("[TemplateRegistry] Imported " + imported + " templates");
        return imported;
    }

    private void clearBacking(List<Block> blocks) {
        for (Block block : blocks) {
            block.setStatementId("");
            clearBacking(block.getChildren());
        }
    }

    private void loadBundled() {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(BUNDLED_TEMPLATES)) {
            if (is == null) {
                logger.warn("[TemplateRegistry] Bundled templates not found on classpath: " + BUNDLED_TEMPLATES);
                return;
            }
            BlockTemplate[] templates = objectMapper.readValue(is, BlockTemplate[].class);
            for (BlockTemplate template : templates) {
                if (template.getId() == null || template.getId().isBlank()) {
                    logger.warn("[TemplateRegistry] Bundled template without id: " + template.getName());
                    continue;
                }
                template.setBuiltIn(true);
                builtIn.put(template.getId(), template);
            }
        } catch (IOException e) {
            logger.warn("[TemplateRegistry] Failed to load bundled templates: " + e.getMessage());
        }
    }

    private void loadCustom() {
        try {
            List<BlockTemplate> templates = JsonStorage.readJsonList(customTemplatesFile, BlockTemplate[].class);
            for (BlockTemplate template : templates) {
                if (template.getId() == null || template.getId().isBlank() || builtIn.containsKey(template.getId())) {
                    logger.warn("[TemplateRegistry] Skipping custom template with missing or reserved id: "
                        + template.getName());
                    continue;
                }
                template.setBuiltIn(false);
                custom.put(template.getId(), template);
            }
        } catch (IOException e) {
            logger.warn("[TemplateRegistry] Failed to load custom templates from " + customTemplatesFile
                + ": " + e.getMessage());
        }
    }
}
