package com.codemigration.metagraph.graph.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Property Codec Tests")
class PropertyCodecTest {

    private PropertyCodec codec;

    @BeforeEach
    void setUp() {
        codec = new PropertyCodec(new ObjectMapper());
    }

    @Test
    @DisplayName("Should keep primitives and homogeneous lists as native properties")
    void testEncode_PrimitivesStayNative() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("name", "main");
        props.put("line", 4);
        props.put("is_async", false);
        props.put("decorators", List.of("@cached", "@staticmethod"));
        props.put("sizes", List.of(1, 2L, 3.5));

        PropertyCodec.Encoded encoded = codec.encode(props);

        assertEquals(props, encoded.properties());
        assertEquals(List.of("name", "line", "is_async", "decorators", "sizes"), encoded.plainNames());
        assertTrue(encoded.jsonNames().isEmpty());
    }

    @Test
    @DisplayName("Should store maps and mixed lists as JSON text")
    void testEncode_NestedValuesBecomeJson() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("provenance", Map.of("name", "syntax"));
        props.put("arguments", List.of(Map.of("name", "args", "type", "list")));
        props.put("mixed", List.of("a", 1));

        PropertyCodec.Encoded encoded = codec.encode(props);

        assertEquals("{\"name\":\"syntax\"}", encoded.properties().get("provenance"));
        assertEquals("[\"a\",1]", encoded.properties().get("mixed"));
        assertEquals(List.of("provenance", "arguments", "mixed"), encoded.jsonNames());
    }

    @Test
    @DisplayName("Should restore JSON fields listed under _json and drop the marker")
    void testDecode_RestoresStructures() {
        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put("name", "main");
        stored.put("arguments", "[{\"name\":\"args\",\"type\":\"list\"}]");
        stored.put(PropertyCodec.JSON_FIELDS, List.of("arguments"));

        Map<String, Object> decoded = codec.decode(stored);

        assertFalse(decoded.containsKey(PropertyCodec.JSON_FIELDS));
        assertEquals("main", decoded.get("name"));
        assertEquals(List.of(Map.of("name", "args", "type", "list")), decoded.get("arguments"));
    }

    @Test
    @DisplayName("Should fall back to the raw text when a JSON field is corrupt")
    void testDecode_CorruptJsonKeptAsText() {
        Map<String, Object> stored = Map.of(
            "extra", "{not json",
            PropertyCodec.JSON_FIELDS, List.of("extra"));

        Map<String, Object> decoded = codec.decode(stored);

        assertEquals("{not json", decoded.get("extra"));
    }
}
