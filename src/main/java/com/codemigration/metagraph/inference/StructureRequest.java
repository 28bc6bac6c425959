package com.codemigration.metagraph.inference;

import com.codemigration.metagraph.extraction.ParsedSkeleton;

/**
 * @param skeleton Syntactic skeleton, or {@code null} when no parser handles the language
 */
public record StructureRequest(String path, String language, String contents, ParsedSkeleton skeleton) {
}
