package com.codemigration.metagraph.inference;

import java.util.List;
import java.util.Map;

/**
 * What is known about a file that structural rules could not classify.
 */
public record ClassificationRequest(String path, String language, Map<String, List<String>> entities,
                                    List<String> imports) {
}
