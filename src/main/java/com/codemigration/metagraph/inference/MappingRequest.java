package com.codemigration.metagraph.inference;

import java.util.List;

/**
 * A construct or set of types the rules table has no answer for.
 */
public record MappingRequest(String sourceKey, String sourceLanguage, String construct, List<String> types,
                             String targetLanguage, String targetFramework) {
}
