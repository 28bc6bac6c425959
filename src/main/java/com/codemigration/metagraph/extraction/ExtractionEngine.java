package com.codemigration.metagraph.extraction;

import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.logging.MdcContext;
import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.Report;
import com.codemigration.metagraph.model.entity.SourceFile;
import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Content analysis for a whole project.
 *
 * <p>Files are extracted independently on the extraction pool; once every file has been written
 * the cross-file resolution pass runs. A failure isolated to one file is recorded on that file;
 * a store failure fails the run so the stage can be retried as a whole.
 */
@Slf4j
@Service
public class ExtractionEngine {

    static final String REPORT_TYPE = "content_analysis";

    private final GraphStore graphStore;
    private final StructureScanner structureScanner;
    private final FileExtractor fileExtractor;
    private final CrossFileResolver crossFileResolver;
    private final Executor extractionExecutor;

    public ExtractionEngine(GraphStore graphStore, StructureScanner structureScanner, FileExtractor fileExtractor,
                            CrossFileResolver crossFileResolver,
                            @Qualifier("extractionExecutor") Executor extractionExecutor) {
        this.graphStore = graphStore;
        this.structureScanner = structureScanner;
        this.fileExtractor = fileExtractor;
        this.crossFileResolver = crossFileResolver;
        this.extractionExecutor = extractionExecutor;
    }

    public ExtractionSummary analyze(Project project) {
        String projectId = project.getId();
        Path root = structureScanner.sourceRoot(project);
        List<SourceFile> files = graphStore.findNodes(projectId, NodeLabel.FILE).stream()
            .map(SourceFile::fromNode)
            .toList();
        log.info("Extracting {} files with pool {}", files.size(), extractionExecutor.getClass().getSimpleName());

        List<CompletableFuture<FileOutcome>> futures = new ArrayList<>(files.size());
        for (SourceFile file : files) {
            futures.add(CompletableFuture.supplyAsync(MdcContext.propagate(() -> {
                MdcContext.setFile(file.getPath());
                try {
                    return fileExtractor.extract(projectId, root, file);
                } finally {
                    MdcContext.clearFile();
                }
            }), extractionExecutor));
        }

        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            futures.forEach(f -> outcomes.add(f.join()));
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        ResolutionSummary resolution = crossFileResolver.resolve(projectId);
        ExtractionSummary summary = ExtractionSummary.of(outcomes, resolution);
        writeReport(projectId, summary);
        log.info("Content analysis: {} parsed, {} failed, {} skipped, {} entities", summary.parsed(),
            summary.failed(), summary.skipped(), summary.entities());
        return summary;
    }

    private void writeReport(String projectId, ExtractionSummary summary) {
        Report report = Report.keyed(REPORT_TYPE, "extraction",
                "Extracted " + summary.entities() + " entities from " + summary.files() + " files")
            .detail("files", summary.files())
            .detail("parsed", summary.parsed())
            .detail("failed", summary.failed())
            .detail("skipped", summary.skipped())
            .detail("functions", summary.functions())
            .detail("classes", summary.classes())
            .detail("enums", summary.enums())
            .detail("extensions", summary.extensions())
            .detail("inferred", summary.inferred())
            .detail("inference_failures", summary.inferenceFailures())
            .detail("imports", summary.resolution().importEdges())
            .detail("references", summary.resolution().referenceEdges())
            .detail("dependencies", summary.resolution().dependencies())
            .build();
        GraphNode node = report.toNode(projectId);
        graphStore.applyBatch(projectId, GraphBatch.builder()
            .node(node)
            .edge(GraphEdge.of(RelationshipType.REPORTED_IN, NodeRef.of(NodeLabel.PROJECT, projectId), node.ref()))
            .build());
    }
}
