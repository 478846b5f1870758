package com.flowgraph.analyzer.graph;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Saves and loads {@link Graph}s as
 * {@code {"nodes":[{"id":..., attr...}], "edges":[{"source":..., "target":..., attr...}]}}
 * with attributes flattened beside the id fields.
 */
public class GraphPersistence {

    public static class GraphPersistenceException extends RuntimeException {
        public GraphPersistenceException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public void save(Graph graph, Path file) {
        JsonArray nodes = new JsonArray();
        for (String id : graph.nodeIds()) {
            JsonObject n = new JsonObject();
            n.addProperty("id", id);
            JsonObject attrs = graph.attributes(id);
            for (String key : attrs.keySet()) {
                if (!key.equals("id")) n.add(key, attrs.get(key));
            }
            nodes.add(n);
        }
        JsonArray edges = new JsonArray();
        for (Graph.Edge e : graph.edges()) {
            JsonObject o = new JsonObject();
            o.addProperty("source", e.source());
            o.addProperty("target", e.target());
            for (String key : e.attributes().keySet()) {
                if (!key.equals("source") && !key.equals("target")) o.add(key, e.attributes().get(key));
            }
            edges.add(o);
        }
        JsonObject root = new JsonObject();
        root.add("nodes", nodes);
        root.add("edges", edges);

        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
        } catch (IOException e) {
            throw new GraphPersistenceException("Could not create directory: " + file.getParent(), e);
        }
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(root, w);
        } catch (IOException e) {
            throw new GraphPersistenceException("Failed to write graph " + file + ": " + e.getMessage(), e);
        }
    }

    /** @return empty when the file does not exist */
    public Optional<Graph> load(Path file) {
        if (!Files.exists(file)) return Optional.empty();
        JsonElement parsed;
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            parsed = JsonParser.parseReader(r);
        } catch (IOException | JsonParseException e) {
            throw new GraphPersistenceException("Failed to read graph " + file + ": " + e.getMessage(), e);
        }
        if (!parsed.isJsonObject()) {
            throw new GraphPersistenceException("Graph file is not a JSON object: " + file, null);
        }
        JsonObject root = parsed.getAsJsonObject();
        Graph graph = new Graph();
        for (JsonObject n : objects(root, "nodes", file)) {
            String id = requireString(n, "id", file);
            JsonObject attrs = n.deepCopy();
            attrs.remove("id");
            graph.addNode(id, attrs);
        }
        for (JsonObject e : objects(root, "edges", file)) {
            String source = requireString(e, "source", file);
            String target = requireString(e, "target", file);
            JsonObject attrs = e.deepCopy();
            attrs.remove("source");
            attrs.remove("target");
            graph.addEdge(source, target, attrs);
        }
        return Optional.of(graph);
    }

    /** Writes each graph to {@code <dir>/<name>.json}. */
    public void saveGraphs(Map<String, Graph> graphs, Path dir) {
        for (Map.Entry<String, Graph> e : graphs.entrySet()) {
            save(e.getValue(), dir.resolve(e.getKey() + ".json"));
        }
        System.err.println("[flowgraph] Saved " + graphs.size() + " graphs to " + dir);
    }

    /** Every {@code *.json} directly under {@code dir}, keyed by file stem, in name order. */
    public Map<String, Graph> loadGraphs(Path dir) {
        Map<String, Graph> graphs = new LinkedHashMap<>();
        if (!Files.isDirectory(dir)) return graphs;
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            for (Path p : stream) files.add(p);
        } catch (IOException e) {
            throw new GraphPersistenceException("Failed to list " + dir + ": " + e.getMessage(), e);
        }
        files.sort(null);
        for (Path p : files) {
            String name = p.getFileName().toString();
            load(p).ifPresent(g -> graphs.put(name.substring(0, name.length() - ".json".length()), g));
        }
        return graphs;
    }

    private static List<JsonObject> objects(JsonObject root, String key, Path file) {
        List<JsonObject> result = new ArrayList<>();
        JsonElement e = root.get(key);
        if (e == null) return result;
        if (!e.isJsonArray()) {
            throw new GraphPersistenceException("'" + key + "' is not an array in " + file, null);
        }
        for (JsonElement item : e.getAsJsonArray()) {
            if (!item.isJsonObject()) {
                throw new GraphPersistenceException("'" + key + "' holds a non-object entry in " + file, null);
            }
            result.add(item.getAsJsonObject());
        }
        return result;
    }

    private static String requireString(JsonObject o, String key, Path file) {
        JsonElement e = o.get(key);
        if (e == null || !e.isJsonPrimitive()) {
            throw new GraphPersistenceException("Missing '" + key + "' in " + file, null);
        }
        return e.getAsString();
    }
}
