package com.codemigration.metagraph.model.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * A node as the store sees it: label, natural key and an open property bag.
 *
 * <p>The bag may hold strings, numbers, booleans, lists and nested maps. Unknown keys are
 * carried through reads and writes untouched.
 */
@Value
@Builder(toBuilder = true)
public class GraphNode {

    public static final String PROJECT_ID = "project_id";
    public static final String KEY = "key";

    NodeLabel label;
    String key;
    @Singular
    Map<String, Object> properties;

    public NodeRef ref() {
        return NodeRef.of(label, key);
    }

    public Object get(String name) {
        return properties.get(name);
    }

    public Optional<String> getString(String name) {
        Object value = properties.get(name);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    public long getLong(String name, long fallback) {
        Object value = properties.get(name);
        return value instanceof Number number ? number.longValue() : fallback;
    }

    public boolean getBoolean(String name) {
        Object value = properties.get(name);
        return value instanceof Boolean bool ? bool : Boolean.parseBoolean(String.valueOf(value));
    }
}
