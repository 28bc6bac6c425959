package com.codemigration.metagraph.graph.impl;

import com.codemigration.metagraph.exception.ConstraintViolationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts open property bags to what Neo4j can hold. Neo4j properties are primitives or
 * homogeneous lists of primitives, so nested maps and lists of non-primitives are stored as
 * JSON strings and their names listed in {@value #JSON_FIELDS}.
 */
@Slf4j
class PropertyCodec {

    static final String JSON_FIELDS = "_json";

    private final ObjectMapper mapper;

    PropertyCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    Encoded encode(Map<String, Object> properties) {
        Map<String, Object> plain = new LinkedHashMap<>();
        List<String> plainNames = new ArrayList<>();
        List<String> jsonNames = new ArrayList<>();
        properties.forEach((name, value) -> {
            if (needsJson(value)) {
                plain.put(name, toJson(name, value));
                jsonNames.add(name);
            } else {
                plain.put(name, value);
                plainNames.add(name);
            }
        });
        return new Encoded(plain, plainNames, jsonNames);
    }

    Map<String, Object> decode(Map<String, Object> stored) {
        Map<String, Object> decoded = new LinkedHashMap<>(stored);
        Object names = decoded.remove(JSON_FIELDS);
        if (names instanceof Collection<?> jsonNames) {
            for (Object name : jsonNames) {
                Object raw = decoded.get(String.valueOf(name));
                if (raw instanceof String json) {
                    decoded.put(String.valueOf(name), fromJson(json));
                }
            }
        }
        return decoded;
    }

    private boolean needsJson(Object value) {
        if (value instanceof Map<?, ?>) {
            return true;
        }
        if (value instanceof Collection<?> items) {
            Class<?> seen = null;
            for (Object item : items) {
                if (item == null || item instanceof Map<?, ?> || item instanceof Collection<?>) {
                    return true;
                }
                Class<?> kind = item instanceof Number ? Number.class : item.getClass();
                if (seen != null && seen != kind) {
                    return true;
                }
                seen = kind;
            }
        }
        return false;
    }

    private String toJson(String name, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ConstraintViolationException("Property '" + name + "' cannot be serialized", e);
        }
    }

    private Object fromJson(String json) {
        try {
            return mapper.readValue(json, new TypeReference<Object>() { });
        } catch (JsonProcessingException e) {
            log.warn("Stored JSON property is not valid JSON, returning it as text: {}", e.getOriginalMessage());
            return json;
        }
    }

    record Encoded(Map<String, Object> properties, List<String> plainNames, List<String> jsonNames) {
    }
}
