package com.codemigration.metagraph.extraction;

import com.codemigration.metagraph.model.entity.SourceFile;

import java.util.List;

public record ExtractionSummary(int files, int parsed, int failed, int skipped, int functions, int classes,
                                int enums, int extensions, int inferred, int inferenceFailures,
                                ResolutionSummary resolution) {

    static ExtractionSummary of(List<FileOutcome> outcomes, ResolutionSummary resolution) {
        int parsed = 0;
        int failed = 0;
        int skipped = 0;
        int functions = 0;
        int classes = 0;
        int enums = 0;
        int extensions = 0;
        int inferred = 0;
        int inferenceFailures = 0;
        for (FileOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case SourceFile.PARSED -> parsed++;
                case SourceFile.FAILED -> failed++;
                default -> skipped++;
            }
            functions += outcome.functions();
            classes += outcome.classes();
            enums += outcome.enums();
            extensions += outcome.extensions();
            inferred += outcome.inferred() ? 1 : 0;
            inferenceFailures += outcome.inferenceFailed() ? 1 : 0;
        }
        return new ExtractionSummary(outcomes.size(), parsed, failed, skipped, functions, classes, enums,
            extensions, inferred, inferenceFailures, resolution);
    }

    public int entities() {
        return functions + classes + enums + extensions;
    }
}
