package com.codemigration.metagraph.model.entity;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A name/type pair of a function or method signature.
 */
@Value
@Builder
public class Argument {
    String name;
    String type;

    public static Argument of(String name, String type) {
        return new Argument(name, type);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("type", type);
        return map;
    }

    public static Argument fromMap(Map<String, Object> map) {
        return new Argument(Props.str(map.get("name")), Props.str(map.get("type"), "Any"));
    }
}
