package com.codemigration.metagraph.inference;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class MappingSuggestion {
    @Singular
    List<String> targetComponents;
    @Singular("typeMapping")
    Map<String, String> typeMappings;
    String notes;
}
