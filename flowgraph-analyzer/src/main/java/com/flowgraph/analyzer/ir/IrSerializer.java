package com.flowgraph.analyzer.ir;

import com.flowgraph.analyzer.ir.IrModel.FunctionIR;
import com.flowgraph.analyzer.ir.IrModel.ModuleIR;
import com.flowgraph.analyzer.ir.IrModel.ProjectIR;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Saves and loads IR caches: {@code functions.json} and {@code modules.json} (objects keyed
 * by id, written in id order for deterministic output) and {@code project.json}.
 *
 * A missing file loads as an empty result. An entry that does not deserialize is skipped with
 * a warning so one bad record does not discard the cache.
 */
public class IrSerializer {

    public static final String FUNCTIONS_FILE = "functions.json";
    public static final String MODULES_FILE = "modules.json";
    public static final String PROJECT_FILE = "project.json";

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public void saveFunctions(Map<String, FunctionIR> functions, Path dir) {
        write(dir.resolve(FUNCTIONS_FILE), new TreeMap<>(functions));
        System.err.println("[flowgraph] Saved " + functions.size() + " functions to " + dir.resolve(FUNCTIONS_FILE));
    }

    public Map<String, FunctionIR> loadFunctions(Path dir) {
        return loadKeyed(dir.resolve(FUNCTIONS_FILE), FunctionIR.class, "function");
    }

    public void saveModules(Map<String, ModuleIR> modules, Path dir) {
        write(dir.resolve(MODULES_FILE), new TreeMap<>(modules));
        System.err.println("[flowgraph] Saved " + modules.size() + " modules to " + dir.resolve(MODULES_FILE));
    }

    public Map<String, ModuleIR> loadModules(Path dir) {
        return loadKeyed(dir.resolve(MODULES_FILE), ModuleIR.class, "module");
    }

    public void saveProject(ProjectIR project, Path dir) {
        write(dir.resolve(PROJECT_FILE), project);
        System.err.println("[flowgraph] Saved project IR to " + dir.resolve(PROJECT_FILE));
    }

    public Optional<ProjectIR> loadProject(Path dir) {
        Path file = dir.resolve(PROJECT_FILE);
        if (!Files.exists(file)) return Optional.empty();
        JsonElement root = parse(file);
        try {
            return Optional.ofNullable(gson.fromJson(root, ProjectIR.class));
        } catch (JsonParseException e) {
            System.err.println("[flowgraph] WARNING: Failed to deserialize project: " + e.getMessage());
            return Optional.empty();
        }
    }

    private <T> Map<String, T> loadKeyed(Path file, Class<T> type, String what) {
        Map<String, T> result = new LinkedHashMap<>();
        if (!Files.exists(file)) return result;
        JsonElement root = parse(file);
        if (!root.isJsonObject()) {
            throw new SerializerException("Expected a JSON object in " + file, null);
        }
        for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject().entrySet()) {
            if (!entry.getValue().isJsonObject()) {
                System.err.println("[flowgraph] WARNING: Failed to deserialize " + what + " " + entry.getKey()
                        + ": not an object");
                continue;
            }
            try {
                result.put(entry.getKey(), gson.fromJson(entry.getValue(), type));
            } catch (JsonParseException e) {
                System.err.println("[flowgraph] WARNING: Failed to deserialize " + what + " " + entry.getKey()
                        + ": " + e.getMessage());
            }
        }
        System.err.println("[flowgraph] Loaded " + result.size() + " " + what + "s from " + file);
        return result;
    }

    private JsonElement parse(Path file) {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return JsonParser.parseReader(r);
        } catch (IOException | JsonParseException e) {
            throw new SerializerException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private void write(Path file, Object value) {
        try {
            Files.createDirectories(file.getParent());
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + file.getParent(), e);
        }
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(value, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

}
