package com.codemigration.metagraph.model.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Signature of a method held inside a Class or Extension record.
 */
@Value
@Builder(toBuilder = true)
public class MethodRef {
    String name;
    String returnType;
    @Singular
    List<Argument> arguments;
    @Singular
    List<String> decorators;
    boolean isStatic;
    boolean isAsync;
    String docstring;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("return_type", returnType);
        map.put("arguments", arguments.stream().map(Argument::toMap).toList());
        map.put("decorators", List.copyOf(decorators));
        map.put("is_static", isStatic);
        map.put("is_async", isAsync);
        if (docstring != null) {
            map.put("docstring", docstring);
        }
        return map;
    }

    public static MethodRef fromMap(Map<String, Object> map) {
        return MethodRef.builder()
            .name(Props.str(map.get("name")))
            .returnType(Props.str(map.get("return_type"), "None"))
            .arguments(Props.maps(map.get("arguments")).stream().map(Argument::fromMap).toList())
            .decorators(Props.strings(map.get("decorators")))
            .isStatic(Props.bool(map.get("is_static")))
            .isAsync(Props.bool(map.get("is_async")))
            .docstring(Props.str(map.get("docstring")))
            .build();
    }
}
