package com.codemigration.metagraph.planner;

import com.codemigration.metagraph.exception.UnmappableConstructException;
import com.codemigration.metagraph.model.entity.ComponentType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Built-in source to target rules: data types per source language, and the target building
 * blocks that component types, class kinds and decorators become.
 *
 * <p>Target building blocks are framework-neutral names ({@code service}, {@code repository});
 * the generator qualifies them with the project's target framework.
 */
@Component
public class MappingRuleTable {

    private static final Map<String, String> PYTHON_TYPES = Map.ofEntries(
        entry("int", "Integer"),
        entry("float", "Double"),
        entry("complex", "Double"),
        entry("str", "String"),
        entry("bool", "Boolean"),
        entry("bytes", "byte[]"),
        entry("bytearray", "byte[]"),
        entry("list", "List"),
        entry("List", "List"),
        entry("Sequence", "List"),
        entry("Iterable", "Iterable"),
        entry("Iterator", "Iterator"),
        entry("tuple", "List"),
        entry("Tuple", "List"),
        entry("dict", "Map"),
        entry("Dict", "Map"),
        entry("Mapping", "Map"),
        entry("set", "Set"),
        entry("Set", "Set"),
        entry("frozenset", "Set"),
        entry("Optional", "Optional"),
        entry("Any", "Object"),
        entry("object", "Object"),
        entry("None", "void"),
        entry("Callable", "Function"),
        entry("datetime", "LocalDateTime"),
        entry("datetime.datetime", "LocalDateTime"),
        entry("date", "LocalDate"),
        entry("Decimal", "BigDecimal"),
        entry("UUID", "UUID"),
        entry("Path", "Path"));

    private static final Map<String, String> SCRIPT_TYPES = Map.ofEntries(
        entry("string", "String"),
        entry("number", "Double"),
        entry("boolean", "Boolean"),
        entry("any", "Object"),
        entry("unknown", "Object"),
        entry("object", "Map"),
        entry("void", "void"),
        entry("undefined", "void"),
        entry("null", "void"),
        entry("Array", "List"),
        entry("Map", "Map"),
        entry("Set", "Set"),
        entry("Promise", "CompletableFuture"),
        entry("Date", "Instant"));

    private static final Map<String, Map<String, String>> TYPES_BY_LANGUAGE = Map.of(
        "python", PYTHON_TYPES,
        "javascript", SCRIPT_TYPES,
        "typescript", SCRIPT_TYPES,
        "react", SCRIPT_TYPES);

    private static final Map<ComponentType, List<String>> COMPONENT_TARGETS = Map.of(
        ComponentType.UI, List.of("controller", "view-template"),
        ComponentType.LOGIC, List.of("service"),
        ComponentType.DATA, List.of("entity", "repository"),
        ComponentType.CONFIG, List.of("configuration-properties"));

    private static final Map<String, List<String>> CLASS_KIND_TARGETS = Map.of(
        "plain", List.of("class"),
        "singleton", List.of("singleton-bean"),
        "abstract", List.of("abstract-class"),
        "interface", List.of("interface"),
        "dataclass", List.of("record"),
        "record", List.of("record"),
        "annotation", List.of("annotation"));

    private static final Map<String, String> DECORATOR_TARGETS = Map.ofEntries(
        entry("route", "request-mapping"),
        entry("get", "request-mapping"),
        entry("post", "request-mapping"),
        entry("put", "request-mapping"),
        entry("delete", "request-mapping"),
        entry("lru_cache", "cacheable"),
        entry("cache", "cacheable"),
        entry("cached_property", "cacheable"),
        entry("login_required", "security-guard"),
        entry("permission_required", "security-guard"),
        entry("transaction", "transactional"),
        entry("atomic", "transactional"),
        entry("task", "scheduled-task"),
        entry("shared_task", "scheduled-task"),
        entry("retry", "retryable"));

    /** Decorators that become plain language features and need no target component. */
    private static final Set<String> LANGUAGE_DECORATORS = Set.of("staticmethod", "classmethod", "property",
        "abstractmethod", "dataclass", "override", "overload", "setter", "getter", "deleter", "wraps",
        "total_ordering", "Override", "Deprecated", "FunctionalInterface", "SuppressWarnings", "SafeVarargs");

    public List<String> componentTargets(ComponentType type) {
        return COMPONENT_TARGETS.getOrDefault(type, List.of());
    }

    /**
     * @throws UnmappableConstructException for kinds the table does not know
     */
    public List<String> classTargets(String kind) {
        List<String> targets = CLASS_KIND_TARGETS.get(kind);
        if (targets == null) {
            throw new UnmappableConstructException("class:" + kind, "No rule for class kind '" + kind + "'");
        }
        return targets;
    }

    public boolean isLanguageDecorator(String decorator) {
        return LANGUAGE_DECORATORS.contains(simpleName(decorator));
    }

    /**
     * @throws UnmappableConstructException for decorators the table does not know
     */
    public String decoratorTarget(String decorator) {
        String target = DECORATOR_TARGETS.get(simpleName(decorator));
        if (target == null) {
            throw new UnmappableConstructException("decorator:" + decorator,
                "No rule for decorator '" + decorator + "'");
        }
        return target;
    }

    /**
     * Target type for {@code type}. Rules are tried in this order: user mappings, configured
     * overrides, types declared in the project itself, the built-in table. Parameterized types
     * ({@code List[int]}, {@code Map<String, X>}) map when their base and every argument do.
     */
    public Optional<String> mapType(String sourceLanguage, String targetLanguage, String type,
                                    TypeRules rules) {
        String t = stripQuotes(type.strip());
        if (t.isEmpty()) {
            return Optional.empty();
        }
        if (rules.custom().containsKey(t)) {
            return Optional.of(rules.custom().get(t));
        }
        if (rules.overrides().containsKey(t)) {
            return Optional.of(rules.overrides().get(t));
        }

        List<String> union = split(t, '|');
        if (union.size() > 1) {
            List<String> present = union.stream().filter(u -> !u.equals("None") && !u.equals("null")).toList();
            if (present.size() != 1) {
                return Optional.empty();
            }
            return mapType(sourceLanguage, targetLanguage, present.get(0), rules).map(m -> "Optional<" + m + ">");
        }

        int open = firstOpen(t);
        if (open > 0 && (t.endsWith("]") || t.endsWith(">"))) {
            Optional<String> base = mapType(sourceLanguage, targetLanguage, t.substring(0, open), rules);
            if (base.isEmpty()) {
                return Optional.empty();
            }
            List<String> mappedArguments = new ArrayList<>();
            for (String argument : split(t.substring(open + 1, t.length() - 1), ',')) {
                if (argument.equals("...")) {
                    continue;
                }
                Optional<String> mapped = mapType(sourceLanguage, targetLanguage, argument, rules);
                if (mapped.isEmpty()) {
                    return Optional.empty();
                }
                mappedArguments.add(mapped.get());
            }
            return Optional.of(mappedArguments.isEmpty()
                ? base.get()
                : base.get() + "<" + String.join(", ", mappedArguments) + ">");
        }

        if (rules.projectTypes().contains(t) || sourceLanguage.equals(targetLanguage)) {
            return Optional.of(t);
        }
        return Optional.ofNullable(TYPES_BY_LANGUAGE.getOrDefault(sourceLanguage, Map.of()).get(t));
    }

    private static String simpleName(String decorator) {
        String name = decorator.startsWith("@") ? decorator.substring(1) : decorator;
        int paren = name.indexOf('(');
        if (paren >= 0) {
            name = name.substring(0, paren);
        }
        return name.substring(name.lastIndexOf('.') + 1);
    }

    private static String stripQuotes(String type) {
        if (type.length() >= 2 && (type.startsWith("'") && type.endsWith("'")
            || type.startsWith("\"") && type.endsWith("\""))) {
            return type.substring(1, type.length() - 1).strip();
        }
        return type;
    }

    private static int firstOpen(String type) {
        int square = type.indexOf('[');
        int angle = type.indexOf('<');
        if (square < 0) {
            return angle;
        }
        return angle < 0 ? square : Math.min(square, angle);
    }

    private static List<String> split(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[' || c == '<' || c == '(') {
                depth++;
            } else if (c == ']' || c == '>' || c == ')') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i).strip());
                start = i + 1;
            }
        }
        parts.add(text.substring(start).strip());
        parts.removeIf(String::isEmpty);
        return parts;
    }

    /**
     * Per-project inputs to {@link #mapType}.
     *
     * @param custom User-supplied mappings of the project
     * @param overrides Configured overrides
     * @param projectTypes Names of classes and enums declared in the project
     */
    public record TypeRules(Map<String, String> custom, Map<String, String> overrides, Set<String> projectTypes) {
    }
}
