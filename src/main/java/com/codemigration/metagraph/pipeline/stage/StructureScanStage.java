package com.codemigration.metagraph.pipeline.stage;

import com.codemigration.metagraph.extraction.LanguageDetector;
import com.codemigration.metagraph.extraction.StructureScanner;
import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.ProjectState;
import com.codemigration.metagraph.model.entity.SourceFile;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.pipeline.PipelineStage;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@code uploaded -> structure_analyzed}: File nodes for the whole tree. When the project was
 * created without a source language, the most common code language found is recorded.
 */
@Order(1)
@Component
@RequiredArgsConstructor
public class StructureScanStage implements PipelineStage {

    private final StructureScanner scanner;
    private final LanguageDetector languageDetector;
    private final GraphStore graphStore;

    @Override
    public String name() {
        return "structure_analysis";
    }

    @Override
    public ProjectState requires() {
        return ProjectState.UPLOADED;
    }

    @Override
    public ProjectState produces() {
        return ProjectState.STRUCTURE_ANALYZED;
    }

    @Override
    public void run(Project project) {
        List<SourceFile> files = scanner.scan(project);
        String current = project.getSourceLanguage();
        if (current != null && !current.isBlank() && !LanguageDetector.UNKNOWN.equals(current)) {
            return;
        }
        Map<String, Integer> counts = new TreeMap<>();
        files.stream()
            .map(SourceFile::getLanguage)
            .filter(languageDetector::isCode)
            .forEach(language -> counts.merge(language, 1, Integer::sum));
        // most files first, then alphabetical
        Comparator<Map.Entry<String, Integer>> byCount = Map.Entry.<String, Integer>comparingByValue()
            .thenComparing(Map.Entry.<String, Integer>comparingByKey(Comparator.reverseOrder()));
        counts.entrySet().stream()
            .max(byCount)
            .ifPresent(top -> graphStore.upsertNode(project.getId(), GraphNode.builder()
                .label(NodeLabel.PROJECT)
                .key(project.getId())
                .property("source_language", top.getKey())
                .build()));
    }
}
