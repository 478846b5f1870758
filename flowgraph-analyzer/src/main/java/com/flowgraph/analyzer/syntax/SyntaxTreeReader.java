package com.flowgraph.analyzer.syntax;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the JSON tree dumps written by the external tree-sitter extractor into {@link TreeNode}s.
 *
 * Dump shape per node: {@code type, start_byte, end_byte, start_point{row,column},
 * end_point{row,column}, text, children[]}, optionally {@code is_named} and the decoded
 * {@code function}, {@code class} and {@code namespace} summaries. Missing fields take
 * neutral defaults so a partial dump still yields a usable tree.
 */
public class SyntaxTreeReader {

    public static class SyntaxTreeReadException extends RuntimeException {
        public SyntaxTreeReadException(String message) { super(message); }
        public SyntaxTreeReadException(String message, Throwable cause) { super(message, cause); }
    }

    /**
     * @throws SyntaxTreeReadException if the file is missing, unreadable or not a JSON object
     */
    public SyntaxNode read(Path dumpFile) {
        if (!Files.isRegularFile(dumpFile)) {
            throw new SyntaxTreeReadException("Syntax tree dump not found: " + dumpFile);
        }
        try (Reader reader = Files.newBufferedReader(dumpFile, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new SyntaxTreeReadException("Failed to read syntax tree dump: " + dumpFile + ": " + e.getMessage(), e);
        }
    }

    public SyntaxNode parse(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new SyntaxTreeReadException("Invalid syntax tree JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isJsonObject()) {
            throw new SyntaxTreeReadException("Syntax tree dump must be a JSON object");
        }
        return toNode(root.getAsJsonObject());
    }

    private TreeNode toNode(JsonObject json) {
        TreeNode.Builder builder = TreeNode.builder(string(json, "type"))
                .text(string(json, "text"))
                .span(span(json));
        if (json.has("is_named") && json.get("is_named").isJsonPrimitive()) {
            builder.named(json.get("is_named").getAsBoolean());
        }

        JsonObject function = object(json, "function");
        if (function != null) builder.function(function(function));
        JsonObject cls = object(json, "class");
        if (cls != null) builder.className(nullableString(cls, "name"));
        JsonObject ns = object(json, "namespace");
        if (ns != null) builder.namespaceName(nullableString(ns, "name"));

        JsonElement children = json.get("children");
        if (children != null && children.isJsonArray()) {
            for (JsonElement child : children.getAsJsonArray()) {
                if (child.isJsonObject()) builder.child(toNode(child.getAsJsonObject()));
            }
        }
        return builder.build();
    }

    private FunctionInfo function(JsonObject json) {
        List<FunctionInfo.Parameter> params = new ArrayList<>();
        JsonElement p = json.get("parameters");
        if (p != null && p.isJsonArray()) {
            JsonArray array = p.getAsJsonArray();
            for (JsonElement e : array) {
                if (!e.isJsonObject()) continue;
                JsonObject param = e.getAsJsonObject();
                params.add(new FunctionInfo.Parameter(string(param, "type"), string(param, "name")));
            }
        }
        return new FunctionInfo(
                nullableString(json, "name"),
                nullableString(json, "return_type"),
                params,
                bool(json, "is_virtual"),
                bool(json, "is_static"),
                bool(json, "is_const"));
    }

    private Span span(JsonObject json) {
        JsonObject start = object(json, "start_point");
        JsonObject end = object(json, "end_point");
        return new Span(
                integer(json, "start_byte"),
                integer(json, "end_byte"),
                start != null ? integer(start, "row") : 0,
                start != null ? integer(start, "column") : 0,
                end != null ? integer(end, "row") : 0,
                end != null ? integer(end, "column") : 0);
    }

    private static JsonObject object(JsonObject json, String key) {
        JsonElement e = json.get(key);
        return e != null && e.isJsonObject() ? e.getAsJsonObject() : null;
    }

    private static String nullableString(JsonObject json, String key) {
        JsonElement e = json.get(key);
        return e != null && e.isJsonPrimitive() ? e.getAsString() : null;
    }

    private static String string(JsonObject json, String key) {
        String s = nullableString(json, key);
        return s != null ? s : "";
    }

    private static int integer(JsonObject json, String key) {
        JsonElement e = json.get(key);
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber() ? e.getAsInt() : 0;
    }

    private static boolean bool(JsonObject json, String key) {
        JsonElement e = json.get(key);
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isBoolean() && e.getAsBoolean();
    }
}
