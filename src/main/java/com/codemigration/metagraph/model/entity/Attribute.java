package com.codemigration.metagraph.model.entity;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A class attribute: name, declared type and visibility.
 */
@Value
@Builder
public class Attribute {
    String name;
    String type;
    String visibility;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("type", type);
        map.put("visibility", visibility);
        return map;
    }

    public static Attribute fromMap(Map<String, Object> map) {
        return new Attribute(Props.str(map.get("name")), Props.str(map.get("type"), "Any"),
            Props.str(map.get("visibility"), "public"));
    }
}
