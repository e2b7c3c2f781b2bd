package com.scriptflow.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Pretty-printed JSON files. Missing files read as empty.
 */
public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static ObjectMapper mapper() {
        return mapper;
    }

    public static <T> T readJson(Path path, Class<T> clazz) throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        return mapper.readValue(path.toFile(), clazz);
    }

    public static void writeJson(Path path, Object data) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // written to a sibling temp file, then moved over the target
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), data);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    }

    public static <T> List<T> readJsonList(Path path, Class<T[]> clazz) throws IOException {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        T[] items = mapper.readValue(path.toFile(), clazz);
        if (items == null || items.length == 0) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(items));
    }

    public static void writeJsonList(Path path, List<?> data) throws IOException {
        writeJson(path, data);
    }

    public static boolean delete(Path path) throws IOException {
        return Files.deleteIfExists(path);
    }
}
