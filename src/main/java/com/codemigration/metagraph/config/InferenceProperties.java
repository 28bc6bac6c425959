package com.codemigration.metagraph.config;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Settings of the OpenAI-compatible chat endpoint used for semantic inference.
 */
@Data
public class InferenceProperties {

    private boolean enabled = false;

    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey;

    private String model = "gpt-4o-mini";

    @Min(1)
    private int timeoutSeconds = 60;

    @Min(64)
    private int maxTokens = 2000;

    public boolean isConfigured() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }
}
