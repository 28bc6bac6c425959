package com.codemigration.metagraph.model.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A tentative cross-file link recorded during extraction: the module as written in source
 * and the project-relative paths it may resolve to, most specific first.
 */
@Value
@Builder
public class ModuleRef {
    String module;
    @Singular
    List<String> candidates;
    @Singular
    List<String> names;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("module", module);
        map.put("candidates", List.copyOf(candidates));
        map.put("names", List.copyOf(names));
        return map;
    }

    public static ModuleRef fromMap(Map<String, Object> map) {
        return ModuleRef.builder()
            .module(Props.str(map.get("module")))
            .candidates(Props.strings(map.get("candidates")))
            .names(Props.strings(map.get("names")))
            .build();
    }
}
