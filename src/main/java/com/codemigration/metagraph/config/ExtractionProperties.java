package com.codemigration.metagraph.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ExtractionProperties {

    /**
     * Files parsed concurrently within one project.
     */
    @Min(1)
    @Max(64)
    private int workerConcurrency = 4;

    /**
     * Files above this size get a File node but no content analysis.
     */
    @Min(1)
    private long maxFileSizeBytes = 512_000;

    /**
     * Source text sent to inference is truncated to this many characters.
     */
    @Min(1000)
    private int maxInferenceChars = 25_000;

    private boolean skipHidden = true;
}
