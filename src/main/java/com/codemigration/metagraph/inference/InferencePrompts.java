package com.codemigration.metagraph.inference;

import com.codemigration.metagraph.extraction.ParsedSkeleton;
import com.codemigration.metagraph.model.entity.ClassInfo;
import com.codemigration.metagraph.model.entity.FunctionInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prompt texts. Every prompt asks for a single JSON object and names its exact shape.
 */
final class InferencePrompts {

    static final String SYSTEM = "You are a code analyzer for a legacy-code migration tool. "
        + "Always respond with one valid JSON object only, no prose and no markdown.";

    private InferencePrompts() {
    }

    static String structure(StructureRequest request, ObjectMapper mapper) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analyze this ").append(request.language()).append(" file (").append(request.path())
            .append(") and extract its metadata as JSON with exactly these keys:\n")
            .append("- functions: [{name, return_type, arguments: [{name, type}], decorators, is_static, is_async, docstring}]\n")
            .append("- classes: [{name, type (plain|singleton|abstract|interface|dataclass|...), is_static, is_final, ")
            .append("superclasses, interfaces, methods: [{name, return_type, arguments, decorators, is_static, is_async}], ")
            .append("attributes: [{name, type, visibility}], docstring}]\n")
            .append("- enums: [{name, values, docstring}]\n")
            .append("- extensions: [{name, base_type, methods}] for behaviour attached to existing types\n")
            .append("- imports: [module names exactly as written]\n");
        if (request.skeleton() != null) {
            prompt.append("\nA syntax parser already found the skeleton below. Fill in the fields it lists as ")
                .append("unresolved and keep everything else consistent with it:\n")
                .append(toJson(skeletonContext(request.skeleton()), mapper)).append('\n');
        }
        prompt.append("\nCode:\n").append(request.contents());
        return prompt.toString();
    }

    static String classification(ClassificationRequest request, ObjectMapper mapper) {
        return "Classify the file " + request.path() + " (" + request.language() + ") of a legacy project into "
            + "exactly one component type: ui, logic, data or config.\n"
            + "Declared entities: " + toJson(request.entities(), mapper) + "\n"
            + "Imports: " + toJson(request.imports(), mapper) + "\n"
            + "Respond as {\"type\": \"ui|logic|data|config\", \"reason\": \"...\"}.";
    }

    static String mapping(MappingRequest request, ObjectMapper mapper) {
        return "A " + request.sourceLanguage() + " construct is being migrated to " + request.targetLanguage()
            + " (" + request.targetFramework() + ").\n"
            + "Source: " + request.sourceKey() + "\n"
            + "Construct: " + (request.construct() == null ? "none" : request.construct()) + "\n"
            + "Unmapped source types: " + toJson(request.types(), mapper) + "\n"
            + "Respond as {\"target_components\": [\"...\"], \"type_mappings\": {\"sourceType\": \"targetType\"}, "
            + "\"notes\": \"...\"}. Use an empty target_components list if there is no sensible target.";
    }

    private static Map<String, Object> skeletonContext(ParsedSkeleton skeleton) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("functions", skeleton.getFunctions().stream().map(InferencePrompts::describe).toList());
        context.put("classes", skeleton.getClasses().stream().map(InferencePrompts::describe).toList());
        context.put("enums", skeleton.getEnums().stream().map(e -> e.getName()).toList());
        return context;
    }

    private static Map<String, Object> describe(FunctionInfo function) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("name", function.getName());
        d.put("return_type", function.getReturnType());
        d.put("decorators", function.getDecorators());
        d.put("unresolved", List.copyOf(function.getUnresolved()));
        return d;
    }

    private static Map<String, Object> describe(ClassInfo clazz) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("name", clazz.getName());
        d.put("type", clazz.getKind());
        d.put("decorators", clazz.getDecorators());
        d.put("superclasses", clazz.getSuperclasses());
        d.put("unresolved", List.copyOf(clazz.getUnresolved()));
        return d;
    }

    private static String toJson(Object value, ObjectMapper mapper) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
