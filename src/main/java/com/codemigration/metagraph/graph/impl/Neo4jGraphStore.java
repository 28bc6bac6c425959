package com.codemigration.metagraph.graph.impl;

import com.codemigration.metagraph.exception.ConstraintViolationException;
import com.codemigration.metagraph.exception.MigrationException;
import com.codemigration.metagraph.exception.TransientStoreException;
import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import org.neo4j.driver.types.Node;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Neo4j implementation of {@link GraphStore}.
 *
 * <p>Each node carries its label, {@code project_id} and {@code key}; (project_id, key) is unique
 * per label. Relationship endpoints are matched by label and natural key inside the project.
 * Label and relationship names come from enums, never from callers, so they are safe to splice
 * into Cypher text.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class Neo4jGraphStore implements GraphStore {

    private final Driver driver;
    private final PropertyCodec codec;

    public Neo4jGraphStore(Driver driver, ObjectMapper objectMapper) {
        this.driver = driver;
        this.codec = new PropertyCodec(objectMapper);
    }

    @PostConstruct
    public void init() {
        createConstraints();
    }

    private void createConstraints() {
        try (Session session = driver.session()) {
            for (NodeLabel label : NodeLabel.values()) {
                String name = label.getLabel().toLowerCase();
                session.run(String.format(
                    "CREATE CONSTRAINT %s_natural_key IF NOT EXISTS FOR (n:%s) REQUIRE (n.project_id, n.key) IS UNIQUE",
                    name, label.getLabel()));
                session.run(String.format(
                    "CREATE INDEX %s_project IF NOT EXISTS FOR (n:%s) ON (n.project_id)",
                    name, label.getLabel()));
            }
            log.info("Neo4j constraints and indexes created");
        } catch (Exception e) {
            log.warn("Failed to create constraints (may already exist): {}", e.getMessage());
        }
    }

    // ================================================================
    // WRITES
    // ================================================================

    @Override
    public void applyBatch(String projectId, GraphBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        write("applyBatch", tx -> {
            for (GraphNode node : batch.getNodes()) {
                mergeNode(tx, projectId, node);
            }
            for (GraphEdge edge : batch.getEdges()) {
                mergeEdge(tx, projectId, edge);
            }
            detachReplaced(tx, projectId, batch.getExclusiveEdges());
            for (GraphEdge edge : batch.getExclusiveEdges()) {
                mergeEdge(tx, projectId, edge);
            }
            return null;
        });
        log.debug("Applied batch of {} items to project {}", batch.size(), projectId);
    }

    private void mergeNode(TransactionContext tx, String projectId, GraphNode node) {
        Map<String, Object> props = new HashMap<>(node.getProperties());
        props.remove(GraphNode.KEY);
        props.put(GraphNode.PROJECT_ID, projectId);
        PropertyCodec.Encoded encoded = codec.encode(props);

        String cypher = String.format("""
            MERGE (n:%s {project_id: $projectId, key: $key})
            SET n += $props,
                n._json = [x IN coalesce(n._json, []) WHERE NOT x IN $plainNames AND NOT x IN $jsonNames] + $jsonNames
            """, node.getLabel().getLabel());

        tx.run(cypher, Map.of(
            "projectId", projectId,
            "key", node.getKey(),
            "props", encoded.properties(),
            "plainNames", encoded.plainNames(),
            "jsonNames", encoded.jsonNames()));
    }

    private void detachReplaced(TransactionContext tx, String projectId, List<GraphEdge> exclusiveEdges) {
        Map<NodeRef, Map<RelationshipType, List<String>>> kept = new LinkedHashMap<>();
        for (GraphEdge edge : exclusiveEdges) {
            kept.computeIfAbsent(edge.getFrom(), k -> new LinkedHashMap<>())
                .computeIfAbsent(edge.getType(), k -> new ArrayList<>())
                .add(edge.getTo().key());
        }
        kept.forEach((from, byType) -> byType.forEach((type, toKeys) -> {
            String detach = String.format("""
                MATCH (a:%s {project_id: $projectId, key: $fromKey})-[old:%s]->(b)
                WHERE NOT b.key IN $toKeys
                DELETE old
                """, from.label().getLabel(), type.name());
            tx.run(detach, Map.of("projectId", projectId, "fromKey", from.key(), "toKeys", toKeys));
        }));
    }

    private void mergeEdge(TransactionContext tx, String projectId, GraphEdge edge) {
        RelationshipType type = edge.getType();
        NodeRef from = edge.getFrom();
        NodeRef to = edge.getTo();
        if (!type.accepts(from.label(), to.label())) {
            throw new ConstraintViolationException(
                String.format("%s cannot connect %s to %s", type, from.label().getLabel(), to.label().getLabel()));
        }

        Map<String, Object> params = new HashMap<>();
        params.put("projectId", projectId);
        params.put("fromKey", from.key());
        params.put("toKey", to.key());

        PropertyCodec.Encoded encoded = codec.encode(edge.getProperties());
        params.put("props", encoded.properties());
        params.put("jsonNames", encoded.jsonNames());
        String cypher = String.format("""
            MATCH (a:%s {project_id: $projectId, key: $fromKey})
            MATCH (b:%s {project_id: $projectId, key: $toKey})
            MERGE (a)-[r:%s]->(b)
            SET r += $props, r._json = $jsonNames
            RETURN count(r) AS merged
            """, from.label().getLabel(), to.label().getLabel(), type.name());

        Result result = tx.run(cypher, params);
        long merged = result.hasNext() ? result.single().get("merged").asLong() : 0;
        if (merged == 0) {
            throw new ConstraintViolationException(
                String.format("Relationship %s %s -> %s has a missing endpoint in project %s",
                    type, from, to, projectId));
        }
    }

    @Override
    public long deleteProject(String projectId) {
        String cypher = """
            MATCH (n {project_id: $projectId})
            DETACH DELETE n
            RETURN count(n) AS deleted
            """;
        long deleted = write("deleteProject", tx ->
            tx.run(cypher, Map.of("projectId", projectId)).single().get("deleted").asLong());
        log.info("Purged {} nodes of project {}", deleted, projectId);
        return deleted;
    }

    // ================================================================
    // QUERIES
    // ================================================================

    @Override
    public Optional<GraphNode> findNode(String projectId, NodeLabel label, String key) {
        String cypher = String.format("MATCH (n:%s {project_id: $projectId, key: $key}) RETURN n",
            label.getLabel());
        return read("findNode", tx -> {
            Result result = tx.run(cypher, Map.of("projectId", projectId, "key", key));
            if (result.hasNext()) {
                return Optional.of(toGraphNode(label, result.single().get("n").asNode()));
            }
            return Optional.empty();
        });
    }

    @Override
    public List<GraphNode> findNodes(String projectId, NodeLabel label) {
        return findNodes(projectId, label, Map.of());
    }

    @Override
    public List<GraphNode> findNodes(String projectId, NodeLabel label, Map<String, Object> filter) {
        List<String> names = new ArrayList<>(filter.keySet());
        List<Object> values = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            values.add(filter.get(names.get(i)));
            conditions.add("n[$names[" + i + "]] = $values[" + i + "]");
        }
        String where = conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions);
        String cypher = String.format("MATCH (n:%s {project_id: $projectId}) %s RETURN n ORDER BY n.key",
            label.getLabel(), where);

        Map<String, Object> params = new HashMap<>();
        params.put("projectId", projectId);
        params.put("names", names);
        params.put("values", values);
        return read("findNodes", tx -> tx.run(cypher, params).list(r -> toGraphNode(label, r.get("n").asNode())));
    }

    @Override
    public List<GraphEdge> findEdges(String projectId, Set<RelationshipType> types) {
        if (types.isEmpty()) {
            return List.of();
        }
        String cypher = String.format("""
            MATCH (a {project_id: $projectId})-[r:%s]->(b {project_id: $projectId})
            RETURN labels(a)[0] AS fromLabel, a.key AS fromKey, type(r) AS type,
                   labels(b)[0] AS toLabel, b.key AS toKey, properties(r) AS props
            ORDER BY fromKey, toKey, type
            """, relationshipPattern(types));
        return read("findEdges", tx -> tx.run(cypher, Map.of("projectId", projectId)).list(this::toGraphEdge));
    }

    @Override
    public List<GraphEdge> findOutgoing(String projectId, NodeRef from, RelationshipType type) {
        String cypher = String.format("""
            MATCH (a:%s {project_id: $projectId, key: $fromKey})-[r:%s]->(b {project_id: $projectId})
            RETURN labels(a)[0] AS fromLabel, a.key AS fromKey, type(r) AS type,
                   labels(b)[0] AS toLabel, b.key AS toKey, properties(r) AS props
            ORDER BY toKey
            """, from.label().getLabel(), type.name());
        return read("findOutgoing", tx ->
            tx.run(cypher, Map.of("projectId", projectId, "fromKey", from.key())).list(this::toGraphEdge));
    }

    @Override
    public Set<String> reachableKeys(String projectId, NodeLabel label, String startKey,
                                     Set<RelationshipType> types, int maxHops) {
        if (types.isEmpty()) {
            return Set.of();
        }
        String hops = maxHops > 0 ? "1.." + maxHops : "1..";
        String cypher = String.format("""
            MATCH (s:%s {project_id: $projectId, key: $key})-[:%s*%s]->(t:%s)
            WHERE t.project_id = $projectId AND t.key <> $key
            RETURN DISTINCT t.key AS key
            ORDER BY key
            """, label.getLabel(), relationshipPattern(types), hops, label.getLabel());
        return read("reachableKeys", tx -> tx.run(cypher, Map.of("projectId", projectId, "key", startKey))
            .list(r -> r.get("key").asString())
            .stream()
            .collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    @Override
    public long countNodes(String projectId, NodeLabel label) {
        String match = label == null ? "(n {project_id: $projectId})"
            : "(n:" + label.getLabel() + " {project_id: $projectId})";
        String cypher = "MATCH " + match + " RETURN count(n) AS total";
        return read("countNodes", tx ->
            tx.run(cypher, Map.of("projectId", projectId)).single().get("total").asLong());
    }

    @Override
    public long countEdges(String projectId, RelationshipType type) {
        String rel = type == null ? "r" : "r:" + type.name();
        String cypher = "MATCH (a {project_id: $projectId})-[" + rel + "]->(b {project_id: $projectId}) "
            + "RETURN count(r) AS total";
        return read("countEdges", tx ->
            tx.run(cypher, Map.of("projectId", projectId)).single().get("total").asLong());
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private static String relationshipPattern(Set<RelationshipType> types) {
        return types.stream().map(Enum::name).sorted().collect(Collectors.joining("|"));
    }

    private GraphNode toGraphNode(NodeLabel label, Node node) {
        Map<String, Object> props = codec.decode(node.asMap());
        String key = String.valueOf(props.remove(GraphNode.KEY));
        return GraphNode.builder().label(label).key(key).properties(props).build();
    }

    private GraphEdge toGraphEdge(Record record) {
        Map<String, Object> props = codec.decode(record.get("props").asMap());
        return GraphEdge.builder()
            .type(RelationshipType.valueOf(record.get("type").asString()))
            .from(NodeRef.of(NodeLabel.fromLabel(record.get("fromLabel").asString()), record.get("fromKey").asString()))
            .to(NodeRef.of(NodeLabel.fromLabel(record.get("toLabel").asString()), record.get("toKey").asString()))
            .properties(props)
            .build();
    }

    private <T> T write(String operation, Function<TransactionContext, T> work) {
        try (Session session = driver.session()) {
            return session.executeWrite(work::apply);
        } catch (MigrationException e) {
            throw e;
        } catch (Neo4jException e) {
            throw translate(operation, e);
        }
    }

    private <T> T read(String operation, Function<TransactionContext, T> work) {
        try (Session session = driver.session()) {
            return session.executeRead(work::apply);
        } catch (MigrationException e) {
            throw e;
        } catch (Neo4jException e) {
            throw translate(operation, e);
        }
    }

    static MigrationException translate(String operation, Neo4jException e) {
        if (e instanceof ServiceUnavailableException
            || e instanceof SessionExpiredException
            || e instanceof TransientException) {
            log.warn("Neo4j {} failed transiently: {}", operation, e.getMessage());
            return new TransientStoreException("Graph store unavailable during " + operation, e);
        }
        if (e instanceof ClientException && e.code() != null && e.code().contains("ConstraintValidationFailed")) {
            return new ConstraintViolationException("Constraint violated during " + operation + ": " + e.getMessage(), e);
        }
        log.error("Neo4j {} failed: {}", operation, e.getMessage());
        return new ConstraintViolationException("Graph store rejected " + operation + ": " + e.getMessage(), e);
    }
}
