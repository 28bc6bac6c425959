package com.codemigration.metagraph.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default target stack. A project's own target language/framework takes precedence.
 */
@Data
public class TargetProperties {

    @NotBlank
    private String language = "java";

    @NotBlank
    private String framework = "spring-boot";

    @NotBlank
    private String version = "3.2";

    /**
     * Extra source type to target type rules, applied after the built-in table.
     */
    private Map<String, String> typeOverrides = new LinkedHashMap<>();
}
