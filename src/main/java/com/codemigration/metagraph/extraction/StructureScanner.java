package com.codemigration.metagraph.extraction;

import com.codemigration.metagraph.config.MigrationProperties;
import com.codemigration.metagraph.exception.MalformedInputException;
import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.Report;
import com.codemigration.metagraph.model.entity.SourceFile;
import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Walks a project's source tree and records one File node per file.
 *
 * <p>The walk is sorted by relative path, so {@code discovery_index} is the same on every run
 * over an unchanged tree.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StructureScanner {

    static final String REPORT_TYPE = "structure_analysis";
    private static final int BATCH_SIZE = 500;

    private final GraphStore graphStore;
    private final LanguageDetector languageDetector;
    private final MigrationProperties properties;

    public List<SourceFile> scan(Project project) {
        Path root = sourceRoot(project);
        List<SourceFile> files = discover(root);
        log.info("Discovered {} files under {}", files.size(), root);

        NodeRef projectRef = NodeRef.of(NodeLabel.PROJECT, project.getId());
        for (int start = 0; start < files.size(); start += BATCH_SIZE) {
            GraphBatch.GraphBatchBuilder batch = GraphBatch.builder();
            for (SourceFile file : files.subList(start, Math.min(files.size(), start + BATCH_SIZE))) {
                var node = file.toNode(project.getId());
                batch.node(node);
                batch.edge(GraphEdge.of(RelationshipType.CONTAINS, projectRef, node.ref()));
            }
            graphStore.applyBatch(project.getId(), batch.build());
        }

        Map<String, Integer> languages = new TreeMap<>();
        files.forEach(f -> languages.merge(f.getLanguage(), 1, Integer::sum));
        Report report = Report.keyed(REPORT_TYPE, "scan", "Discovered " + files.size() + " files")
            .detail("file_count", files.size())
            .detail("languages", languages)
            .build();
        var reportNode = report.toNode(project.getId());
        graphStore.applyBatch(project.getId(), GraphBatch.builder()
            .node(reportNode)
            .edge(GraphEdge.of(RelationshipType.REPORTED_IN, projectRef, reportNode.ref()))
            .build());
        return files;
    }

    /**
     * Root of the project's source tree. Relative source dirs are taken from the storage dir.
     */
    public Path sourceRoot(Project project) {
        if (project.getSourceDir() == null || project.getSourceDir().isBlank()) {
            throw new MalformedInputException(project.getId(), 0, "Project has no source directory");
        }
        return Path.of(properties.getStorageDir()).resolve(project.getSourceDir()).normalize();
    }

    List<SourceFile> discover(Path root) {
        if (!Files.isDirectory(root)) {
            throw new MalformedInputException(root.toString(), 0, "Source directory does not exist");
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.filter(Files::isRegularFile)
                .filter(p -> !isHidden(root.relativize(p)))
                .sorted((a, b) -> relative(root, a).compareTo(relative(root, b)))
                .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new MalformedInputException(root.toString(), "Cannot walk source directory", e);
        }

        List<SourceFile> files = new ArrayList<>(paths.size());
        for (Path path : paths) {
            String relativePath = relative(root, path);
            files.add(SourceFile.builder()
                .path(relativePath)
                .language(languageDetector.detect(relativePath))
                .size(sizeOf(path))
                .discoveryIndex(files.size())
                .parseStatus(SourceFile.PENDING)
                .build());
        }
        return files;
    }

    private boolean isHidden(Path relative) {
        if (!properties.getExtraction().isSkipHidden()) {
            return false;
        }
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static String relative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            log.warn("Cannot read size of {}: {}", path, e.getMessage());
            return 0;
        }
    }
}
