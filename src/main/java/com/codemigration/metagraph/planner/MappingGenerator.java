package com.codemigration.metagraph.planner;

import com.codemigration.metagraph.config.MigrationProperties;
import com.codemigration.metagraph.config.TargetProperties;
import com.codemigration.metagraph.exception.ErrorKind;
import com.codemigration.metagraph.exception.TransientInferenceException;
import com.codemigration.metagraph.exception.UnmappableConstructException;
import com.codemigration.metagraph.feedback.FeedbackService;
import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.inference.MappingRequest;
import com.codemigration.metagraph.inference.MappingSuggestion;
import com.codemigration.metagraph.inference.SemanticInference;
import com.codemigration.metagraph.model.entity.Argument;
import com.codemigration.metagraph.model.entity.Attribute;
import com.codemigration.metagraph.model.entity.ClassInfo;
import com.codemigration.metagraph.model.entity.Component;
import com.codemigration.metagraph.model.entity.ComponentType;
import com.codemigration.metagraph.model.entity.EntityKeys;
import com.codemigration.metagraph.model.entity.ExtensionInfo;
import com.codemigration.metagraph.model.entity.Feedback;
import com.codemigration.metagraph.model.entity.FunctionInfo;
import com.codemigration.metagraph.model.entity.Mapping;
import com.codemigration.metagraph.model.entity.MethodRef;
import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.Report;
import com.codemigration.metagraph.model.entity.SourceFile;
import com.codemigration.metagraph.model.entity.TargetComponent;
import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Derives source to target mappings.
 *
 * <p>Every Component gets a Mapping; so does every Class with a non-plain kind and every Function
 * carrying a decorator that is more than a language feature. Each Mapping targets at least one
 * TargetComponent: when neither rules nor inference yield one, it targets {@code manual-review}
 * and an {@code UnmappableConstructError} feedback entry is raised instead of failing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MappingGenerator {

    static final String REPORT_TYPE = "mapping";
    static final String FALLBACK_TARGET = "manual-review";

    private final GraphStore graphStore;
    private final MappingRuleTable rules;
    private final SemanticInference inference;
    private final FeedbackService feedbackService;
    private final MigrationProperties properties;

    public MappingSummary generate(Project project) {
        Run run = new Run(project);

        for (GraphNode node : graphStore.findNodes(project.getId(), NodeLabel.COMPONENT)) {
            mapComponent(run, Component.fromNode(node));
        }
        for (ClassInfo clazz : run.classes) {
            if (!ClassInfo.KIND_PLAIN.equals(clazz.getKind())) {
                mapClass(run, clazz);
            }
        }
        for (FunctionInfo function : run.functions) {
            List<String> decorators = function.getDecorators().stream()
                .filter(d -> !rules.isLanguageDecorator(d))
                .toList();
            if (!decorators.isEmpty()) {
                mapFunction(run, function, decorators);
            }
        }
        for (GraphNode node : graphStore.findNodes(project.getId(), NodeLabel.EXTENSION)) {
            flagExtension(run, ExtensionInfo.fromNode(node));
        }

        MappingSummary summary = run.summary();
        GraphNode reportNode = Report.keyed(REPORT_TYPE, "mappings", "Generated " + summary.mappings() + " mappings")
            .detail("mappings", summary.mappings())
            .detail("target_components", summary.targetComponents())
            .detail("by_rule", summary.byRule())
            .detail("by_custom", summary.byCustom())
            .detail("by_inference", summary.byInference())
            .detail("by_fallback", summary.byFallback())
            .detail("feedback_raised", summary.feedbackRaised())
            .build()
            .toNode(project.getId());
        graphStore.applyBatch(project.getId(), GraphBatch.builder()
            .node(reportNode)
            .edge(GraphEdge.of(RelationshipType.REPORTED_IN, run.projectRef, reportNode.ref()))
            .build());
        log.info("Mapping: {} mappings ({} rule, {} custom, {} inference, {} fallback), {} feedback",
            summary.mappings(), summary.byRule(), summary.byCustom(), summary.byInference(), summary.byFallback(),
            summary.feedbackRaised());
        return summary;
    }

    // =========================================================================
    // Sources
    // =========================================================================

    private void mapComponent(Run run, Component component) {
        String language = run.languages.getOrDefault(component.getFilePath(), "unknown");
        Targets targets = resolveTargets(run, component.getKey(), language, "component:" + component.getType().tag(),
            () -> {
                List<String> blocks = rules.componentTargets(component.getType());
                if (blocks.isEmpty()) {
                    throw new UnmappableConstructException("component:" + ComponentType.UNKNOWN.tag(),
                        "No rule for components of unknown type");
                }
                return blocks;
            });

        Set<String> types = new LinkedHashSet<>();
        run.functionsByFile.getOrDefault(component.getFilePath(), List.of()).forEach(f -> collectTypes(f, types));
        run.classesByFile.getOrDefault(component.getFilePath(), List.of()).forEach(c -> collectTypes(c, types));
        write(run, NodeRef.of(NodeLabel.COMPONENT, component.getKey()), language, "component:" + component.getType().tag(),
            targets, types);
    }

    private void mapClass(Run run, ClassInfo clazz) {
        String language = run.languages.getOrDefault(clazz.getFilePath(), "unknown");
        Targets targets = resolveTargets(run, clazz.getKey(), language, "class:" + clazz.getKind(),
            () -> rules.classTargets(clazz.getKind()));
        Set<String> types = new LinkedHashSet<>();
        collectTypes(clazz, types);
        write(run, NodeRef.of(NodeLabel.CLASS, clazz.getKey()), language, "class:" + clazz.getKind(), targets, types);
    }

    private void mapFunction(Run run, FunctionInfo function, List<String> decorators) {
        String language = run.languages.getOrDefault(function.getFilePath(), "unknown");
        String construct = "decorators:" + String.join(",", decorators);
        Targets targets = resolveTargets(run, function.getKey(), language, construct,
            () -> decorators.stream().map(rules::decoratorTarget).distinct().toList());
        Set<String> types = new LinkedHashSet<>();
        collectTypes(function, types);
        write(run, NodeRef.of(NodeLabel.FUNCTION, function.getKey()), language, construct, targets, types);
    }

    /**
     * Runtime patches have no structural counterpart in the target and always need a decision.
     */
    private void flagExtension(Run run, ExtensionInfo extension) {
        boolean raised = feedbackService.raise(run.project.getId(),
            Feedback.forError(ErrorKind.UNMAPPABLE_CONSTRUCT.getTag(), extension.getKey(),
                    "Runtime extension of " + extension.getBaseType() + " (" + extension.getName() + ") has no target equivalent")
                .suggestion("Move the behaviour into " + extension.getBaseType() + " or a subclass")
                .detail("file_path", extension.getFilePath())
                .detail("line", extension.getLine())
                .build());
        run.feedback += raised ? 1 : 0;
    }

    // =========================================================================
    // Resolution
    // =========================================================================

    private Targets resolveTargets(Run run, String sourceKey, String language, String construct,
                                   Supplier<List<String>> rule) {
        try {
            return new Targets(rule.get(), Mapping.BY_RULE);
        } catch (UnmappableConstructException e) {
            Optional<MappingSuggestion> suggestion = suggest(run, sourceKey, language, e.getConstruct(), List.of());
            if (suggestion.isPresent() && !suggestion.get().getTargetComponents().isEmpty()) {
                return new Targets(suggestion.get().getTargetComponents(), Mapping.BY_INFERENCE);
            }
            raiseUnmappable(run, sourceKey, e.getMessage(), Map.of("construct", construct));
            return new Targets(List.of(FALLBACK_TARGET), Mapping.BY_FALLBACK);
        }
    }

    private Optional<MappingSuggestion> suggest(Run run, String sourceKey, String language, String construct,
                                                List<String> types) {
        if (!inference.isAvailable()) {
            return Optional.empty();
        }
        try {
            return Optional.of(inference.suggestMapping(new MappingRequest(sourceKey, language, construct, types,
                run.targetLanguage, run.targetFramework)));
        } catch (TransientInferenceException e) {
            log.warn("Inference could not map {}: {}", sourceKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(Run run, NodeRef source, String language, String construct, Targets targets,
                       Set<String> types) {
        Map<String, String> dataTypes = new LinkedHashMap<>();
        List<String> unmapped = new ArrayList<>();
        boolean custom = false;
        for (String type : types) {
            Optional<String> mapped = rules.mapType(language, run.targetLanguage, type, run.typeRules);
            if (mapped.isPresent()) {
                dataTypes.put(type, mapped.get());
                custom |= run.typeRules.custom().containsKey(type);
            } else {
                unmapped.add(type);
            }
        }
        String resolvedBy = targets.resolvedBy();
        if (!unmapped.isEmpty()) {
            Optional<MappingSuggestion> suggestion = suggest(run, source.key(), language, "types", unmapped);
            if (suggestion.isPresent()) {
                for (String type : new ArrayList<>(unmapped)) {
                    String target = suggestion.get().getTypeMappings().get(type);
                    if (target != null && !target.isBlank()) {
                        dataTypes.put(type, target);
                        unmapped.remove(type);
                    }
                }
                if (Mapping.BY_RULE.equals(resolvedBy)) {
                    resolvedBy = Mapping.BY_INFERENCE;
                }
            }
            if (!unmapped.isEmpty()) {
                raiseUnmappable(run, source.key() + ":types", "No target type for " + String.join(", ", unmapped),
                    Map.of("types", unmapped));
            }
        }
        if (custom && Mapping.BY_RULE.equals(resolvedBy)) {
            resolvedBy = Mapping.BY_CUSTOM;
        }

        List<TargetComponent> targetComponents = targets.blocks().stream()
            .map(block -> TargetComponent.of(qualify(run, block), run.targetVersion, block))
            .toList();
        Mapping.MappingBuilder mapping = Mapping.builder()
            .key(EntityKeys.mapping(source.key()))
            .sourceLabel(source.label())
            .sourceKey(source.key())
            .targetKeys(targetComponents.stream().map(TargetComponent::getKey).toList())
            .dataTypeMapping(dataTypes)
            .isCustom(custom)
            .construct(construct)
            .resolvedBy(resolvedBy);
        if (!unmapped.isEmpty()) {
            mapping.extraProperty("unmapped_types", List.copyOf(unmapped));
        }
        GraphNode mappingNode = mapping.build().toNode(run.project.getId());

        GraphBatch.GraphBatchBuilder batch = GraphBatch.builder()
            .node(mappingNode)
            .edge(GraphEdge.of(RelationshipType.MAPS_TO, source, mappingNode.ref()));
        for (TargetComponent target : targetComponents) {
            GraphNode targetNode = target.toNode(run.project.getId());
            batch.node(targetNode).exclusiveEdge(GraphEdge.of(RelationshipType.TARGETS, mappingNode.ref(), targetNode.ref()));
            run.targetKeys.add(target.getKey());
        }
        graphStore.applyBatch(run.project.getId(), batch.build());
        run.count(resolvedBy);
    }

    private void raiseUnmappable(Run run, String subject, String issue, Map<String, Object> details) {
        boolean raised = feedbackService.raise(run.project.getId(),
            Feedback.forError(ErrorKind.UNMAPPABLE_CONSTRUCT.getTag(), subject, issue)
                .suggestion("Add a custom mapping or resolve manually")
                .details(details)
                .build());
        run.feedback += raised ? 1 : 0;
    }

    private static String qualify(Run run, String block) {
        return block.contains(":") ? block : run.targetFramework + ":" + block;
    }

    private static void collectTypes(FunctionInfo function, Set<String> types) {
        addType(types, function.getReturnType());
        function.getArguments().forEach(a -> addType(types, a.getType()));
    }

    private static void collectTypes(ClassInfo clazz, Set<String> types) {
        for (Attribute attribute : clazz.getAttributes()) {
            addType(types, attribute.getType());
        }
        for (MethodRef method : clazz.getMethods()) {
            addType(types, method.getReturnType());
            for (Argument argument : method.getArguments()) {
                addType(types, argument.getType());
            }
        }
    }

    private static void addType(Set<String> types, String type) {
        if (type != null && !type.isBlank()) {
            types.add(type.strip());
        }
    }

    private record Targets(List<String> blocks, String resolvedBy) {
    }

    /**
     * Everything one generation run reads once and the counters it keeps.
     */
    private final class Run {
        final Project project;
        final NodeRef projectRef;
        final String targetLanguage;
        final String targetFramework;
        final String targetVersion;
        final MappingRuleTable.TypeRules typeRules;
        final Map<String, String> languages = new HashMap<>();
        final List<FunctionInfo> functions;
        final List<ClassInfo> classes;
        final Map<String, List<FunctionInfo>> functionsByFile = new HashMap<>();
        final Map<String, List<ClassInfo>> classesByFile = new HashMap<>();
        final Set<String> targetKeys = new HashSet<>();
        int mappings;
        int byRule;
        int byCustom;
        int byInference;
        int byFallback;
        int feedback;

        Run(Project project) {
            this.project = project;
            this.projectRef = NodeRef.of(NodeLabel.PROJECT, project.getId());
            TargetProperties target = properties.getTarget();
            this.targetLanguage = blankTo(project.getTargetLanguage(), target.getLanguage());
            this.targetFramework = blankTo(project.getTargetFramework(), target.getFramework());
            this.targetVersion = target.getVersion();

            for (GraphNode node : graphStore.findNodes(project.getId(), NodeLabel.FILE)) {
                SourceFile file = SourceFile.fromNode(node);
                languages.put(file.getPath(), file.getLanguage());
            }
            this.functions = graphStore.findNodes(project.getId(), NodeLabel.FUNCTION).stream()
                .map(FunctionInfo::fromNode).toList();
            this.classes = graphStore.findNodes(project.getId(), NodeLabel.CLASS).stream()
                .map(ClassInfo::fromNode).toList();
            functions.forEach(f -> functionsByFile.computeIfAbsent(f.getFilePath(), k -> new ArrayList<>()).add(f));
            classes.forEach(c -> classesByFile.computeIfAbsent(c.getFilePath(), k -> new ArrayList<>()).add(c));

            Set<String> projectTypes = new HashSet<>();
            for (ClassInfo clazz : classes) {
                projectTypes.add(clazz.getName());
                projectTypes.add(clazz.getName().substring(clazz.getName().lastIndexOf('.') + 1));
            }
            for (GraphNode node : graphStore.findNodes(project.getId(), NodeLabel.ENUM)) {
                node.getString("name").ifPresent(projectTypes::add);
            }
            this.typeRules = new MappingRuleTable.TypeRules(project.getCustomMappings(), target.getTypeOverrides(),
                projectTypes);
        }

        void count(String resolvedBy) {
            mappings++;
            switch (resolvedBy) {
                case Mapping.BY_CUSTOM -> byCustom++;
                case Mapping.BY_INFERENCE -> byInference++;
                case Mapping.BY_FALLBACK -> byFallback++;
                default -> byRule++;
            }
        }

        MappingSummary summary() {
            return new MappingSummary(mappings, targetKeys.size(), byRule, byCustom, byInference, byFallback, feedback);
        }
    }

    private static String blankTo(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
