package com.codemigration.metagraph.extraction;

/**
 * Counts from one cross-file resolution pass.
 */
public record ResolutionSummary(int importEdges, int referenceEdges, int dependencies, int dependsOnEdges) {
}
