package com.codemigration.metagraph.resolver;

import com.codemigration.metagraph.exception.ErrorKind;
import com.codemigration.metagraph.exception.TransientInferenceException;
import com.codemigration.metagraph.extraction.LanguageDetector;
import com.codemigration.metagraph.feedback.FeedbackService;
import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.inference.ClassificationRequest;
import com.codemigration.metagraph.inference.SemanticInference;
import com.codemigration.metagraph.model.entity.ClassInfo;
import com.codemigration.metagraph.model.entity.Component;
import com.codemigration.metagraph.model.entity.ComponentType;
import com.codemigration.metagraph.model.entity.EntityKeys;
import com.codemigration.metagraph.model.entity.Feedback;
import com.codemigration.metagraph.model.entity.FunctionInfo;
import com.codemigration.metagraph.model.entity.ModuleRef;
import com.codemigration.metagraph.model.entity.Provenance;
import com.codemigration.metagraph.model.entity.Report;
import com.codemigration.metagraph.model.entity.SourceFile;
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
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns every file exactly one Component. Re-running replaces the file's CLASSIFIES_AS edge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClassificationService {

    static final String REPORT_TYPE = "classification";

    private final GraphStore graphStore;
    private final FileClassifier classifier;
    private final SemanticInference inference;
    private final LanguageDetector languageDetector;
    private final FeedbackService feedbackService;

    public Map<ComponentType, Integer> classifyAll(String projectId) {
        List<FileFacts> facts = collectFacts(projectId);
        Map<ComponentType, Integer> counts = new EnumMap<>(ComponentType.class);

        for (FileFacts file : facts) {
            Classification classification = classify(projectId, file);
            Component component = Component.forFile(file.path(), classification.type(), classification.source(),
                classification.reason());
            GraphNode node = component.toNode(projectId);
            graphStore.applyBatch(projectId, GraphBatch.builder()
                .node(node)
                .exclusiveEdge(GraphEdge.of(RelationshipType.CLASSIFIES_AS,
                    NodeRef.of(NodeLabel.FILE, EntityKeys.file(file.path())), node.ref()))
                .build());
            counts.merge(classification.type(), 1, Integer::sum);
            log.debug("Classified {} as {} ({})", file.path(), classification.type().tag(), classification.reason());
        }

        Report.ReportBuilder report = Report.keyed(REPORT_TYPE, "components",
            "Classified " + facts.size() + " files");
        counts.forEach((type, count) -> report.detail(type.tag(), count));
        GraphNode reportNode = report.build().toNode(projectId);
        graphStore.applyBatch(projectId, GraphBatch.builder()
            .node(reportNode)
            .edge(GraphEdge.of(RelationshipType.REPORTED_IN, NodeRef.of(NodeLabel.PROJECT, projectId),
                reportNode.ref()))
            .build());
        log.info("Classification: {}", counts);
        return counts;
    }

    Classification classify(String projectId, FileFacts file) {
        Classification byRules = classifier.classify(file);
        if (byRules.type() != ComponentType.UNKNOWN
            || !languageDetector.isCode(file.language())
            || !inference.isAvailable()) {
            return byRules;
        }
        try {
            ComponentType inferred = inference.classify(new ClassificationRequest(file.path(), file.language(),
                Map.of("functions", file.functionNames(), "classes", file.classNames()), file.imports()));
            return new Classification(inferred, Provenance.INFERENCE, "inferred");
        } catch (TransientInferenceException e) {
            log.warn("Inference could not classify {}: {}", file.path(), e.getMessage());
            feedbackService.raise(projectId, Feedback.forError(ErrorKind.TRANSIENT_INFERENCE.getTag(),
                    EntityKeys.component(file.path()), "Component type of " + file.path() + " is unknown")
                .suggestion("Classify as ui, logic, data or config")
                .detail("message", String.valueOf(e.getMessage()))
                .build());
            return byRules;
        }
    }

    List<FileFacts> collectFacts(String projectId) {
        Map<String, List<String>> functions = new HashMap<>();
        for (GraphNode node : graphStore.findNodes(projectId, NodeLabel.FUNCTION)) {
            FunctionInfo function = FunctionInfo.fromNode(node);
            functions.computeIfAbsent(function.getFilePath(), k -> new ArrayList<>()).add(function.getName());
        }
        Map<String, List<ClassInfo>> classes = new HashMap<>();
        for (GraphNode node : graphStore.findNodes(projectId, NodeLabel.CLASS)) {
            ClassInfo clazz = ClassInfo.fromNode(node);
            classes.computeIfAbsent(clazz.getFilePath(), k -> new ArrayList<>()).add(clazz);
        }
        Map<String, Integer> enums = new LinkedHashMap<>();
        for (GraphNode node : graphStore.findNodes(projectId, NodeLabel.ENUM)) {
            node.getString("file_path").ifPresent(path -> enums.merge(path, 1, Integer::sum));
        }

        List<FileFacts> facts = new ArrayList<>();
        for (GraphNode node : graphStore.findNodes(projectId, NodeLabel.FILE)) {
            SourceFile file = SourceFile.fromNode(node);
            List<ClassInfo> declared = classes.getOrDefault(file.getPath(), List.of());
            facts.add(new FileFacts(
                file.getPath(),
                file.getLanguage(),
                file.getParseStatus(),
                functions.getOrDefault(file.getPath(), List.of()),
                declared.stream().map(ClassInfo::getKind).toList(),
                declared.stream().map(ClassInfo::getName).toList(),
                enums.getOrDefault(file.getPath(), 0),
                file.getPendingImports().stream().map(ModuleRef::getModule).toList()));
        }
        return facts;
    }
}
