package com.codemigration.metagraph.resolver;

public record ClosureSummary(int files, int cycles, int removedEdges, int largestClosure) {
}
