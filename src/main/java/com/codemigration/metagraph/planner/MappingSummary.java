package com.codemigration.metagraph.planner;

public record MappingSummary(int mappings, int targetComponents, int byRule, int byCustom, int byInference,
                             int byFallback, int feedbackRaised) {
}
