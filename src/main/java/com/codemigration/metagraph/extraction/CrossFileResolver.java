package com.codemigration.metagraph.extraction;

import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.model.entity.DependencyInfo;
import com.codemigration.metagraph.model.entity.EntityKeys;
import com.codemigration.metagraph.model.entity.ModuleRef;
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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Second extraction pass: turns the pending module references recorded on File nodes into
 * IMPORTS / REFERENCES edges between files, and unresolvable imports into Dependency nodes.
 *
 * <p>Runs only after every file of the project has its node, so no edge ever points at a file
 * that is still being extracted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrossFileResolver {

    private final GraphStore graphStore;

    public ResolutionSummary resolve(String projectId) {
        List<SourceFile> files = graphStore.findNodes(projectId, NodeLabel.FILE).stream()
            .map(SourceFile::fromNode)
            .toList();
        ModulePathIndex index = new ModulePathIndex(files.stream().map(SourceFile::getPath).toList());

        int imports = 0;
        int references = 0;
        int dependsOn = 0;
        Set<String> dependencies = new LinkedHashSet<>();

        for (SourceFile file : files) {
            if (file.getPendingImports().isEmpty() && file.getPendingReferences().isEmpty()) {
                continue;
            }
            NodeRef from = NodeRef.of(NodeLabel.FILE, EntityKeys.file(file.getPath()));
            Set<String> importTargets = new LinkedHashSet<>();
            Set<String> referenceTargets = new LinkedHashSet<>();
            Map<String, DependencyInfo> fileDependencies = new LinkedHashMap<>();

            for (ModuleRef ref : file.getPendingImports()) {
                List<String> targets = index.resolve(ref.getCandidates());
                if (targets.isEmpty()) {
                    DependencyInfo dependency = dependencyFor(file, ref);
                    fileDependencies.putIfAbsent(dependency.getKey(), dependency);
                    continue;
                }
                targets.stream().filter(t -> !t.equals(file.getPath())).forEach(importTargets::add);
            }
            for (ModuleRef ref : file.getPendingReferences()) {
                index.resolve(ref.getCandidates()).stream()
                    .filter(t -> !t.equals(file.getPath()))
                    .forEach(referenceTargets::add);
            }

            GraphBatch.GraphBatchBuilder batch = GraphBatch.builder();
            importTargets.forEach(t -> batch.edge(
                GraphEdge.of(RelationshipType.IMPORTS, from, NodeRef.of(NodeLabel.FILE, EntityKeys.file(t)))));
            referenceTargets.forEach(t -> batch.edge(
                GraphEdge.of(RelationshipType.REFERENCES, from, NodeRef.of(NodeLabel.FILE, EntityKeys.file(t)))));
            for (DependencyInfo dependency : fileDependencies.values()) {
                GraphNode node = dependency.toNode(projectId);
                batch.node(node).edge(GraphEdge.of(RelationshipType.DEPENDS_ON, from, node.ref()));
            }
            GraphBatch built = batch.build();
            if (!built.isEmpty()) {
                graphStore.applyBatch(projectId, built);
            }

            imports += importTargets.size();
            references += referenceTargets.size();
            dependsOn += fileDependencies.size();
            dependencies.addAll(fileDependencies.keySet());
            log.debug("Resolved {}: {} imports, {} references, {} external", file.getPath(),
                importTargets.size(), referenceTargets.size(), fileDependencies.size());
        }

        log.info("Cross-file resolution: {} IMPORTS, {} REFERENCES, {} dependencies", imports, references,
            dependencies.size());
        return new ResolutionSummary(imports, references, dependencies.size(), dependsOn);
    }

    /**
     * Dependency node for an import nothing in the project satisfies. Relative imports that miss
     * are internal (a file the upload lacks); everything else is an external library.
     */
    static DependencyInfo dependencyFor(SourceFile file, ModuleRef ref) {
        String module = ref.getModule();
        if (module.startsWith(".")) {
            String resolved = relativeModulePath(file.getPath(), module);
            return DependencyInfo.builder()
                .key(EntityKeys.internalDependency(resolved == null ? file.getPath() + ":" + module : resolved))
                .name(resolved == null ? module : resolved)
                .version("unknown")
                .type(DependencyInfo.INTERNAL)
                .build();
        }
        return DependencyInfo.external(libraryName(file.getLanguage(), module));
    }

    /**
     * Path of a relative Python module seen from {@code importer}, e.g. {@code ..core.db} from
     * {@code shop/api/views.py} is {@code shop/core/db}. Null when it climbs above the root.
     */
    static String relativeModulePath(String importer, String module) {
        int level = 0;
        while (level < module.length() && module.charAt(level) == '.') {
            level++;
        }
        List<String> segments = new ArrayList<>(Arrays.asList(importer.split("/")));
        segments.remove(segments.size() - 1);
        for (int up = 1; up < level; up++) {
            if (segments.isEmpty()) {
                return null;
            }
            segments.remove(segments.size() - 1);
        }
        String rest = module.substring(level);
        if (!rest.isEmpty()) {
            segments.addAll(Arrays.asList(rest.split("\\.")));
        }
        return segments.isEmpty() ? "." : String.join("/", segments);
    }

    static String libraryName(String language, String module) {
        String name = module.endsWith(".*") ? module.substring(0, module.length() - 2) : module;
        if ("java".equals(language) || "kotlin".equals(language)) {
            // package of the imported type
            int dot = name.lastIndexOf('.');
            return module.endsWith(".*") || dot < 0 ? name : name.substring(0, dot);
        }
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
