package com.codemigration.metagraph.inference;

import com.codemigration.metagraph.config.MigrationProperties;
import com.codemigration.metagraph.exception.TransientInferenceException;
import com.codemigration.metagraph.model.entity.ComponentType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OpenAI Inference Client Tests")
class OpenAiInferenceClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MigrationProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MigrationProperties();
    }

    private OpenAiInferenceClient clientAnswering(String content) throws Exception {
        properties.getInference().setEnabled(true);
        properties.getInference().setApiKey("test-key");
        String body = objectMapper.writeValueAsString(Map.of(
            "choices", List.of(Map.of("message", Map.of("role", "assistant", "content", content)))));
        WebClient.Builder builder = WebClient.builder()
            .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build()));
        return new OpenAiInferenceClient(properties, objectMapper, builder);
    }

    @Test
    @DisplayName("Should be unavailable without an API key and refuse calls")
    void testDisabled_ShouldNotCall() {
        OpenAiInferenceClient client = new OpenAiInferenceClient(properties, objectMapper, WebClient.builder());

        assertFalse(client.isAvailable());
        assertThrows(TransientInferenceException.class, () -> client.classify(
            new ClassificationRequest("a.py", "python", Map.of(), List.of())));
    }

    @Test
    @DisplayName("Should parse JSON wrapped in code fences or prose")
    void testParseJson() {
        OpenAiInferenceClient client = new OpenAiInferenceClient(properties, objectMapper, WebClient.builder());

        JsonNode node = client.parseJson("Here you go:\n```json\n{\"type\": \"logic\"}\n```");

        assertEquals("logic", node.path("type").asText());
        assertThrows(TransientInferenceException.class, () -> client.parseJson("no json here"));
        assertThrows(TransientInferenceException.class, () -> client.parseJson("{\"type\": }"));
    }

    @Test
    @DisplayName("Should read the component type from the chat answer")
    void testClassify() throws Exception {
        OpenAiInferenceClient client = clientAnswering("{\"type\": \"DATA\"}");

        assertEquals(ComponentType.DATA, client.classify(
            new ClassificationRequest("models.py", "python", Map.of("classes", List.of("Order")), List.of())));
    }

    @Test
    @DisplayName("Should treat an unusable classification as a transient failure")
    void testClassify_UnknownType() throws Exception {
        OpenAiInferenceClient client = clientAnswering("{\"type\": \"widget\"}");

        assertThrows(TransientInferenceException.class, () -> client.classify(
            new ClassificationRequest("x.py", "python", Map.of(), List.of())));
    }

    @Test
    @DisplayName("Should read target components and type mappings from a mapping answer")
    void testSuggestMapping() throws Exception {
        OpenAiInferenceClient client = clientAnswering(
            "{\"target_components\": [\"scheduler\", \"\"], \"type_mappings\": {\"np.ndarray\": \"double[]\"},"
                + " \"notes\": \"batch job\"}");

        MappingSuggestion suggestion = client.suggestMapping(new MappingRequest("component:jobs.py", "python",
            "component:unknown", List.of("np.ndarray"), "java", "spring-boot"));

        assertEquals(List.of("scheduler"), suggestion.getTargetComponents());
        assertEquals(Map.of("np.ndarray", "double[]"), suggestion.getTypeMappings());
        assertEquals("batch job", suggestion.getNotes());
    }
}
