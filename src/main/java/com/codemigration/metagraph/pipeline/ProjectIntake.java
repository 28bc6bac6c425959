package com.codemigration.metagraph.pipeline;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * What the upload layer hands over when a project is created. {@code sourceDir} is absolute or
 * relative to {@code app.storage-dir}.
 */
@Value
@Builder
public class ProjectIntake {
    /** Optional; generated when absent. */
    String projectId;
    String name;
    String description;
    String sourceDir;
    String sourceLanguage;
    String targetLanguage;
    String sourceFramework;
    String targetFramework;
    @Singular
    Map<String, String> customMappings;
}
