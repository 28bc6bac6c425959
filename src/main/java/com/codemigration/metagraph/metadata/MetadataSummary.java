package com.codemigration.metagraph.metadata;

import java.util.Map;

/**
 * Per-project counts.
 *
 * @param nodesByLabel Count of every node label, Project included
 * @param relationshipsByType Count of every relationship type
 * @param filesByLanguage File count per language tag
 * @param componentsByType Component count per type tag
 */
public record MetadataSummary(String projectId, long files, long functions, long classes, long enums,
                              long extensions, long relationships, Map<String, Long> nodesByLabel,
                              Map<String, Long> relationshipsByType, Map<String, Long> filesByLanguage,
                              Map<String, Long> componentsByType) {
}
