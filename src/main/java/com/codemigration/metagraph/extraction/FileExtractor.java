package com.codemigration.metagraph.extraction;

import com.codemigration.metagraph.config.ExtractionProperties;
import com.codemigration.metagraph.config.MigrationProperties;
import com.codemigration.metagraph.exception.ErrorKind;
import com.codemigration.metagraph.exception.MalformedInputException;
import com.codemigration.metagraph.exception.TransientInferenceException;
import com.codemigration.metagraph.extraction.parser.ParserRegistry;
import com.codemigration.metagraph.extraction.parser.SyntaxParser;
import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.inference.SemanticInference;
import com.codemigration.metagraph.inference.StructureRequest;
import com.codemigration.metagraph.model.entity.ClassInfo;
import com.codemigration.metagraph.model.entity.EnumInfo;
import com.codemigration.metagraph.model.entity.ExtensionInfo;
import com.codemigration.metagraph.model.entity.Feedback;
import com.codemigration.metagraph.model.entity.FunctionInfo;
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
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Content analysis of a single file: parse, optionally infer, merge, and write everything the
 * file owns in one batch.
 *
 * <p>Cross-file links are only recorded as pending module references on the File node; they
 * become edges in the resolution pass once every file has been written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileExtractor {

    private final GraphStore graphStore;
    private final ParserRegistry parserRegistry;
    private final LanguageDetector languageDetector;
    private final SemanticInference inference;
    private final InferenceMerger merger;
    private final MigrationProperties properties;

    public FileOutcome extract(String projectId, Path root, SourceFile file) {
        ExtractionProperties limits = properties.getExtraction();
        if (file.getSize() > limits.getMaxFileSizeBytes()) {
            log.debug("Skipping {} ({} bytes over limit)", file.getPath(), file.getSize());
            SourceFile skipped = file.toBuilder().parseStatus(SourceFile.SKIPPED).parseError(null).build();
            graphStore.upsertNode(projectId, skipped.toNode(projectId));
            return new FileOutcome(file.getPath(), SourceFile.SKIPPED, 0, 0, 0, 0, false, false);
        }

        String contents;
        ParsedSkeleton skeleton = null;
        Optional<SyntaxParser> parser = parserRegistry.find(file.getLanguage());
        try {
            contents = read(root.resolve(file.getPath()));
            if (parser.isPresent()) {
                skeleton = parser.get().parse(new SourceUnit(file.getPath(), file.getLanguage(), contents));
            }
        } catch (MalformedInputException e) {
            log.warn("Parse failed for {}: {}", file.getPath(), e.getMessage());
            writeMalformed(projectId, file, e);
            return new FileOutcome(file.getPath(), SourceFile.FAILED, 0, 0, 0, 0, false, false);
        } catch (RuntimeException e) {
            // Parser defect on this input; the rest of the project still goes on.
            log.error("Parser crashed on {}: {}", file.getPath(), e.toString(), e);
            writeMalformed(projectId, file, new MalformedInputException(file.getPath(),
                "parser error: " + e, e));
            return new FileOutcome(file.getPath(), SourceFile.FAILED, 0, 0, 0, 0, false, false);
        }

        boolean wantsInference = skeleton == null
            ? languageDetector.isCode(file.getLanguage())
            : skeleton.hasUnresolved();
        boolean inferred = false;
        Feedback inferenceFailure = null;
        if (wantsInference && inference.isAvailable()) {
            try {
                ParsedSkeleton guess = inference.inferStructure(
                    new StructureRequest(file.getPath(), file.getLanguage(), truncate(contents), skeleton));
                skeleton = merger.merge(skeleton, guess);
                inferred = true;
            } catch (TransientInferenceException e) {
                log.warn("Inference failed for {}, keeping syntactic data only: {}", file.getPath(), e.getMessage());
                inferenceFailure = inferenceFeedback(projectId, file.getPath(), e);
            }
        }

        String status = skeleton == null ? SourceFile.SKIPPED : SourceFile.PARSED;
        ParsedSkeleton result = skeleton == null ? ParsedSkeleton.empty() : skeleton;
        SourceFile parsed = file.toBuilder()
            .parseStatus(status)
            .parseError(null)
            .clearPendingImports().pendingImports(result.getImports())
            .clearPendingReferences().pendingReferences(result.getReferences())
            .build();

        graphStore.applyBatch(projectId, fileBatch(projectId, parsed, result, inferenceFailure));
        log.debug("Extracted {}: {} functions, {} classes, {} enums, {} extensions", file.getPath(),
            result.getFunctions().size(), result.getClasses().size(), result.getEnums().size(),
            result.getExtensions().size());
        return new FileOutcome(file.getPath(), status, result.getFunctions().size(), result.getClasses().size(),
            result.getEnums().size(), result.getExtensions().size(), inferred, inferenceFailure != null);
    }

    GraphBatch fileBatch(String projectId, SourceFile file, ParsedSkeleton skeleton, Feedback inferenceFailure) {
        GraphBatch.GraphBatchBuilder batch = GraphBatch.builder();
        GraphNode fileNode = file.toNode(projectId);
        NodeRef fileRef = fileNode.ref();
        batch.node(fileNode);

        for (FunctionInfo function : skeleton.getFunctions()) {
            GraphNode node = function.toNode(projectId);
            batch.node(node).edge(GraphEdge.of(RelationshipType.HAS_FUNCTION, fileRef, node.ref()));
        }
        for (ClassInfo clazz : skeleton.getClasses()) {
            GraphNode node = clazz.toNode(projectId);
            batch.node(node).edge(GraphEdge.of(RelationshipType.HAS_CLASS, fileRef, node.ref()));
        }
        for (EnumInfo enumInfo : skeleton.getEnums()) {
            GraphNode node = enumInfo.toNode(projectId);
            batch.node(node).edge(GraphEdge.of(RelationshipType.HAS_ENUM, fileRef, node.ref()));
        }
        for (ExtensionInfo extension : skeleton.getExtensions()) {
            GraphNode node = extension.toNode(projectId);
            batch.node(node).edge(GraphEdge.of(RelationshipType.HAS_EXTENSION, fileRef, node.ref()));
        }
        if (inferenceFailure != null) {
            GraphNode node = inferenceFailure.toNode(projectId);
            batch.node(node).edge(GraphEdge.of(RelationshipType.FEEDBACK_FOR,
                NodeRef.of(NodeLabel.PROJECT, projectId), node.ref()));
        }
        return batch.build();
    }

    private void writeMalformed(String projectId, SourceFile file, MalformedInputException e) {
        SourceFile failed = file.toBuilder()
            .parseStatus(SourceFile.FAILED)
            .parseError(e.getMessage())
            .clearPendingImports()
            .clearPendingReferences()
            .build();
        Report report = Report.keyed(ErrorKind.MALFORMED_INPUT.getTag(), file.getPath(), e.getMessage())
            .detail("path", file.getPath())
            .detail("line", e.getLine())
            .detail("language", file.getLanguage())
            .build();
        GraphNode reportNode = report.toNode(projectId);
        graphStore.applyBatch(projectId, GraphBatch.builder()
            .node(failed.toNode(projectId))
            .node(reportNode)
            .edge(GraphEdge.of(RelationshipType.REPORTED_IN, NodeRef.of(NodeLabel.PROJECT, projectId), reportNode.ref()))
            .build());
    }

    /**
     * Feedback for a failed inference call, or {@code null} when one is already on record for
     * this file. The key is derived from the path so re-runs never pile up duplicates.
     */
    private Feedback inferenceFeedback(String projectId, String path, TransientInferenceException e) {
        Feedback feedback = Feedback.forError(ErrorKind.TRANSIENT_INFERENCE.getTag(), path,
                "Semantic inference unavailable; structure is syntactic only")
            .suggestion("Review unresolved fields of " + path + " manually")
            .detail("message", String.valueOf(e.getMessage()))
            .build();
        return graphStore.findNode(projectId, NodeLabel.FEEDBACK, feedback.getKey()).isPresent() ? null : feedback;
    }

    private String truncate(String contents) {
        int limit = properties.getExtraction().getMaxInferenceChars();
        return contents.length() <= limit ? contents : contents.substring(0, limit);
    }

    private static String read(Path path) {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MalformedInputException(path.toString(), "Cannot read file", e);
        }
    }
}
