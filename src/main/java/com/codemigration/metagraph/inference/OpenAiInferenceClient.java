package com.codemigration.metagraph.inference;

import com.codemigration.metagraph.config.InferenceProperties;
import com.codemigration.metagraph.config.MigrationProperties;
import com.codemigration.metagraph.exception.TransientInferenceException;
import com.codemigration.metagraph.extraction.ParsedSkeleton;
import com.codemigration.metagraph.model.entity.ComponentType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * {@link SemanticInference} over an OpenAI-compatible {@code /chat/completions} endpoint.
 */
@Slf4j
@Component
public class OpenAiInferenceClient implements SemanticInference {

    private final InferenceProperties properties;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;

    public OpenAiInferenceClient(MigrationProperties migrationProperties, ObjectMapper objectMapper,
                                 WebClient.Builder webClientBuilder) {
        this.properties = migrationProperties.getInference();
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder
            .baseUrl(properties.getBaseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + (properties.getApiKey() == null ? "" : properties.getApiKey()))
            .build();
    }

    @Override
    public boolean isAvailable() {
        return properties.isConfigured();
    }

    @Override
    public ParsedSkeleton inferStructure(StructureRequest request) {
        JsonNode answer = chat("structure", InferencePrompts.structure(request, objectMapper));
        return InferenceResultMapper.toSkeleton(request.path(), answer);
    }

    @Override
    public ComponentType classify(ClassificationRequest request) {
        JsonNode answer = chat("classify", InferencePrompts.classification(request, objectMapper));
        return ComponentType.parse(answer.path("type").asText(""))
            .orElseThrow(() -> new TransientInferenceException(
                "Inference returned no usable component type for " + request.path()));
    }

    @Override
    public MappingSuggestion suggestMapping(MappingRequest request) {
        JsonNode answer = chat("mapping", InferencePrompts.mapping(request, objectMapper));
        MappingSuggestion.MappingSuggestionBuilder suggestion = MappingSuggestion.builder()
            .notes(answer.path("notes").asText(""));
        for (JsonNode target : answer.path("target_components")) {
            if (target.isTextual() && !target.asText().isBlank()) {
                suggestion.targetComponent(target.asText());
            }
        }
        Iterator<Map.Entry<String, JsonNode>> types = answer.path("type_mappings").fields();
        while (types.hasNext()) {
            Map.Entry<String, JsonNode> entry = types.next();
            suggestion.typeMapping(entry.getKey(), entry.getValue().asText());
        }
        return suggestion.build();
    }

    private JsonNode chat(String purpose, String prompt) {
        if (!isAvailable()) {
            throw new TransientInferenceException("Inference is disabled or has no API key");
        }
        log.debug("[INFERENCE REQUEST] purpose={}, model={}, promptLength={}", purpose, properties.getModel(),
            prompt.length());
        long startTime = System.currentTimeMillis();

        Map<String, Object> body = Map.of(
            "model", properties.getModel(),
            "messages", List.of(
                Map.of("role", "system", "content", InferencePrompts.SYSTEM),
                Map.of("role", "user", "content", prompt)),
            "response_format", Map.of("type", "json_object"),
            "temperature", 0.0,
            "max_tokens", properties.getMaxTokens());

        JsonNode response;
        try {
            response = webClient.post()
                .uri("/chat/completions")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .block();
        } catch (Exception e) {
            log.warn("[INFERENCE FAILED] purpose={}, model={}: {}", purpose, properties.getModel(), e.getMessage());
            throw new TransientInferenceException("Inference call failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new TransientInferenceException("Inference returned an empty response");
        }

        String content = response.path("choices").path(0).path("message").path("content").asText("");
        log.debug("[INFERENCE RESPONSE] purpose={}, latency={}ms, length={}", purpose,
            System.currentTimeMillis() - startTime, content.length());
        return parseJson(content);
    }

    /**
     * Parses the first JSON object in {@code content}, tolerating code fences or surrounding prose.
     */
    JsonNode parseJson(String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new TransientInferenceException("Inference answer holds no JSON object");
        }
        try {
            return objectMapper.readTree(content.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new TransientInferenceException("Inference answer is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
