package com.codemigration.metagraph.inference;

import com.codemigration.metagraph.extraction.ParsedSkeleton;
import com.codemigration.metagraph.model.entity.Argument;
import com.codemigration.metagraph.model.entity.Attribute;
import com.codemigration.metagraph.model.entity.ClassInfo;
import com.codemigration.metagraph.model.entity.EntityKeys;
import com.codemigration.metagraph.model.entity.EnumInfo;
import com.codemigration.metagraph.model.entity.ExtensionInfo;
import com.codemigration.metagraph.model.entity.FunctionInfo;
import com.codemigration.metagraph.model.entity.MethodRef;
import com.codemigration.metagraph.model.entity.ModuleRef;
import com.codemigration.metagraph.model.entity.Provenance;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Converts an inference answer of the shape
 * <pre>
 * {"functions": [...], "classes": [...], "enums": [...], "extensions": [...], "imports": [...]}
 * </pre>
 * into a skeleton whose fields are all tagged {@code INFERENCE}. Missing fields get the same
 * defaults a parser would use.
 */
public final class InferenceResultMapper {

    private InferenceResultMapper() {
    }

    public static ParsedSkeleton toSkeleton(String path, JsonNode root) {
        ParsedSkeleton.ParsedSkeletonBuilder skeleton = ParsedSkeleton.builder();
        Map<String, Integer> ordinals = new HashMap<>();

        for (JsonNode f : root.path("functions")) {
            String name = f.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            int ordinal = ordinals.merge(name, 1, Integer::sum) - 1;
            FunctionInfo.FunctionInfoBuilder function = FunctionInfo.builder()
                .key(EntityKeys.function(path, name, ordinal))
                .filePath(path)
                .name(name)
                .returnType(f.path("return_type").asText("Any"))
                .arguments(arguments(f.path("arguments")))
                .decorators(strings(f.path("decorators")))
                .isStatic(f.path("is_static").asBoolean(false))
                .isAsync(f.path("is_async").asBoolean(false))
                .docstring(f.path("docstring").asText(""));
            tagAll(function::provenanceEntry, "name", "return_type", "arguments", "decorators", "is_static",
                "is_async", "docstring");
            skeleton.function(function.build());
        }

        for (JsonNode c : root.path("classes")) {
            String name = c.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            ClassInfo.ClassInfoBuilder clazz = ClassInfo.builder()
                .key(EntityKeys.clazz(path, name))
                .filePath(path)
                .name(name)
                .kind(c.path("type").asText(ClassInfo.KIND_PLAIN))
                .isStatic(c.path("is_static").asBoolean(false))
                .isFinal(c.path("is_final").asBoolean(false))
                .superclasses(strings(c.path("superclasses")))
                .interfaces(strings(c.path("interfaces")))
                .methods(methods(c.path("methods")))
                .attributes(attributes(c.path("attributes")))
                .docstring(c.path("docstring").asText(""));
            tagAll(clazz::provenanceEntry, "name", "type", "is_static", "is_final", "superclasses", "interfaces",
                "methods", "attributes", "docstring");
            skeleton.classInfo(clazz.build());
        }

        for (JsonNode e : root.path("enums")) {
            String name = e.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            skeleton.enumInfo(EnumInfo.builder()
                .key(EntityKeys.enumeration(path, name))
                .filePath(path)
                .name(name)
                .values(strings(e.path("values")))
                .docstring(e.path("docstring").asText(""))
                .provenanceEntry("values", Provenance.INFERENCE)
                .provenanceEntry("docstring", Provenance.INFERENCE)
                .build());
        }

        for (JsonNode x : root.path("extensions")) {
            String name = x.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            skeleton.extension(ExtensionInfo.builder()
                .key(EntityKeys.extension(path, name))
                .filePath(path)
                .name(name)
                .baseType(x.path("base_type").asText(name))
                .methods(methods(x.path("methods")))
                .provenanceEntry("base_type", Provenance.INFERENCE)
                .provenanceEntry("methods", Provenance.INFERENCE)
                .build());
        }

        for (JsonNode i : root.path("imports")) {
            String module = i.isTextual() ? i.asText() : i.path("module").asText("");
            if (!module.isBlank()) {
                skeleton.importRef(ModuleRef.builder()
                    .module(module)
                    .candidates(candidatesFor(path, module))
                    .build());
            }
        }
        return skeleton.build();
    }

    /**
     * Project paths an import written as {@code module} may name, relative to {@code path}.
     * Handles both path-like ({@code ./util}, {@code ../lib/x.js}) and dotted module names.
     */
    static List<String> candidatesFor(String path, String module) {
        String extension = path.contains(".") ? path.substring(path.lastIndexOf('.')) : "";
        String directory = path.contains("/") ? path.substring(0, path.lastIndexOf('/')) : "";
        List<String> candidates = new ArrayList<>();
        if (module.contains("/")) {
            String joined = module.startsWith(".") ? normalize(directory, module) : module;
            if (joined == null) {
                return candidates;
            }
            candidates.add(joined);
            if (!joined.substring(joined.lastIndexOf('/') + 1).contains(".")) {
                candidates.add(joined + extension);
                candidates.add(joined + "/index" + extension);
            }
        } else if (!module.startsWith(".")) {
            candidates.add(module.replace('.', '/') + extension);
        }
        return candidates;
    }

    private static String normalize(String directory, String relative) {
        Deque<String> parts = new ArrayDeque<>();
        if (!directory.isEmpty()) {
            for (String p : directory.split("/")) {
                parts.addLast(p);
            }
        }
        for (String p : relative.split("/")) {
            if (p.isEmpty() || p.equals(".")) {
                continue;
            }
            if (p.equals("..")) {
                if (parts.isEmpty()) {
                    return null;
                }
                parts.removeLast();
            } else {
                parts.addLast(p);
            }
        }
        return String.join("/", parts);
    }

    private static void tagAll(BiConsumer<String, Provenance> tagger, String... fields) {
        for (String field : fields) {
            tagger.accept(field, Provenance.INFERENCE);
        }
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode v : array) {
            values.add(v.isTextual() ? v.asText() : v.path("name").asText(v.toString()));
        }
        return values;
    }

    private static List<Argument> arguments(JsonNode array) {
        List<Argument> arguments = new ArrayList<>();
        for (JsonNode a : array) {
            if (a.isTextual()) {
                arguments.add(Argument.of(a.asText(), "Any"));
            } else {
                arguments.add(Argument.of(a.path("name").asText(""), a.path("type").asText("Any")));
            }
        }
        return arguments;
    }

    private static List<Attribute> attributes(JsonNode array) {
        List<Attribute> attributes = new ArrayList<>();
        for (JsonNode a : array) {
            if (a.isTextual()) {
                attributes.add(Attribute.builder().name(a.asText()).type("Any").visibility("public").build());
            } else {
                attributes.add(Attribute.builder()
                    .name(a.path("name").asText(""))
                    .type(a.path("type").asText("Any"))
                    .visibility(a.path("visibility").asText("public"))
                    .build());
            }
        }
        return attributes;
    }

    private static List<MethodRef> methods(JsonNode array) {
        List<MethodRef> methods = new ArrayList<>();
        for (JsonNode m : array) {
            if (m.isTextual()) {
                methods.add(MethodRef.builder().name(m.asText()).returnType("Any").build());
            } else {
                methods.add(MethodRef.builder()
                    .name(m.path("name").asText(""))
                    .returnType(m.path("return_type").asText("Any"))
                    .arguments(arguments(m.path("arguments")))
                    .decorators(strings(m.path("decorators")))
                    .isStatic(m.path("is_static").asBoolean(false))
                    .isAsync(m.path("is_async").asBoolean(false))
                    .docstring(m.path("docstring").asText(null))
                    .build());
            }
        }
        return methods;
    }
}
