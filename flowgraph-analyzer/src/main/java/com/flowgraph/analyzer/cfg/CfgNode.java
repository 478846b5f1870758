package com.flowgraph.analyzer.cfg;

import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * A control-flow graph node.
 *
 * @param location    nullable source position
 * @param attributes  open attribute bag; the builder records {@code calls}, {@code condition}
 *                    and, on branch nodes, the id of their {@code merge} node
 */
public record CfgNode(String id, CfgNodeKind kind, String label, SourceLocation location, JsonObject attributes) {

    public CfgNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        attributes = attributes != null ? attributes.deepCopy() : new JsonObject();
    }

    /** Copy of the attribute bag; nodes stay immutable once built. */
    @Override
    public JsonObject attributes() {
        return attributes.deepCopy();
    }

    public String attribute(String key) {
        return attributes.has(key) && attributes.get(key).isJsonPrimitive()
                ? attributes.get(key).getAsString()
                : null;
    }
}
