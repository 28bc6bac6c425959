package com.codemigration.metagraph.resolver;

import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.model.entity.SourceFile;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.RelationshipType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Loads the IMPORTS / REFERENCES relation of a project into a {@link DependencyGraph}, files in
 * discovery order.
 */
@Component
@RequiredArgsConstructor
public class DependencyGraphReader {

    private final GraphStore graphStore;

    public DependencyGraph read(String projectId) {
        List<String> files = graphStore.findNodes(projectId, NodeLabel.FILE).stream()
            .map(SourceFile::fromNode)
            .sorted(Comparator.comparingInt(SourceFile::getDiscoveryIndex).thenComparing(SourceFile::getPath))
            .map(SourceFile::getPath)
            .toList();
        List<List<String>> edges = graphStore.findEdges(projectId, RelationshipType.FILE_DEPENDENCIES).stream()
            .map(DependencyGraphReader::pair)
            .toList();
        return new DependencyGraph(files, edges);
    }

    private static List<String> pair(GraphEdge edge) {
        return List.of(edge.getFrom().key(), edge.getTo().key());
    }
}
