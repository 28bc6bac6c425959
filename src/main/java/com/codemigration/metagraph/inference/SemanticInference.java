package com.codemigration.metagraph.inference;

import com.codemigration.metagraph.exception.TransientInferenceException;
import com.codemigration.metagraph.extraction.ParsedSkeleton;
import com.codemigration.metagraph.model.entity.ComponentType;

/**
 * External best-effort inference. Every call is bounded by a timeout; callers must be able to
 * proceed without an answer.
 *
 * <p>All methods throw {@link TransientInferenceException} on timeout, transport failure,
 * refusal or an unparseable answer.
 *
 * @since 1.0.0
 */
public interface SemanticInference {

    /**
     * Whether calls can be attempted at all. When false the caller skips inference silently.
     */
    boolean isAvailable();

    /**
     * Structural skeleton of a file, every field tagged {@code INFERENCE}. The syntactic skeleton,
     * when there is one, is sent along as context.
     */
    ParsedSkeleton inferStructure(StructureRequest request);

    ComponentType classify(ClassificationRequest request);

    MappingSuggestion suggestMapping(MappingRequest request);
}
