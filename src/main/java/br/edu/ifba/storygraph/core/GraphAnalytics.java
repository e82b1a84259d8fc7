package br.edu.ifba.storygraph.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural statistics for a graph and its entities.
 */
public final class GraphAnalytics {

    private GraphAnalytics() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Per-entity structural statistics.
     *
     * @param betweenness normalized directed betweenness centrality
     * @param closeness closeness over incoming distances, scaled by the reachable fraction
     */
    public record EntityStats(
        @JsonProperty("entity_id") @NotNull String entityId,
        @JsonProperty("in_degree") int inDegree,
        @JsonProperty("out_degree") int outDegree,
        @JsonProperty("betweenness") double betweenness,
        @JsonProperty("closeness") double closeness,
        @JsonProperty("mention_count") int mentionCount,
        @JsonProperty("scene_count") int sceneCount
    ) {
    }

    /**
     * Whole-graph statistics.
     */
    public record GraphStats(
        @JsonProperty("entity_count") int entityCount,
        @JsonProperty("relationship_count") int relationshipCount,
        @JsonProperty("scene_count") int sceneCount,
        @JsonProperty("density") double density,
        @JsonProperty("average_degree") double averageDegree,
        @JsonProperty("entity_types") @NotNull Map<EntityType, Integer> entityTypes,
        @JsonProperty("relation_types") @NotNull Map<RelationType, Integer> relationTypes
    ) {
    }

    @NotNull
    public static EntityStats entityStats(@NotNull KnowledgeGraph graph, @NotNull String entityId) {
        Entity entity = graph.requireEntity(entityId);
        return new EntityStats(
            entityId,
            graph.inDegree(entityId),
            graph.outDegree(entityId),
            betweenness(graph).getOrDefault(entityId, 0.0),
            closeness(graph, entityId),
            entity.getMentionCount(),
            entity.getAppearances().size());
    }

    @NotNull
    public static GraphStats graphStats(@NotNull KnowledgeGraph graph) {
        int n = graph.entityCount();
        int m = graph.relationshipCount();
        double density = n > 1 ? (double) m / ((double) n * (n - 1)) : 0.0;
        double averageDegree = n > 0 ? 2.0 * m / n : 0.0;

        Map<EntityType, Integer> entityTypes = new EnumMap<>(EntityType.class);
        for (Entity entity : graph.entities()) {
            entityTypes.merge(entity.getType(), 1, Integer::sum);
        }
        Map<RelationType, Integer> relationTypes = new EnumMap<>(RelationType.class);
        for (Relationship relationship : graph.relationships()) {
            relationTypes.merge(relationship.getRelationType(), 1, Integer::sum);
        }

        return new GraphStats(n, m, graph.sceneReferences().size(), density, averageDegree,
            entityTypes, relationTypes);
    }

    /**
     * Brandes betweenness over directed successor links, normalized by {@code (n-1)(n-2)}.
     * Parallel edges count once.
     */
    @NotNull
    public static Map<String, Double> betweenness(@NotNull KnowledgeGraph graph) {
        List<String> nodes = new ArrayList<>();
        Map<String, Double> centrality = new HashMap<>();
        for (Entity entity : graph.entities()) {
            nodes.add(entity.getId());
            centrality.put(entity.getId(), 0.0);
        }

        for (String source : nodes) {
            Deque<String> stack = new ArrayDeque<>();
            Map<String, List<String>> predecessors = new HashMap<>();
            Map<String, Double> sigma = new HashMap<>();
            Map<String, Integer> distance = new HashMap<>();
            sigma.put(source, 1.0);
            distance.put(source, 0);

            Deque<String> queue = new ArrayDeque<>();
            queue.add(source);
            while (!queue.isEmpty()) {
                String v = queue.poll();
                stack.push(v);
                for (String w : graph.neighbors(v, TraversalDirection.OUTGOING, null)) {
                    if (!distance.containsKey(w)) {
                        distance.put(w, distance.get(v) + 1);
                        queue.add(w);
                    }
                    if (distance.get(w) == distance.get(v) + 1) {
                        sigma.merge(w, sigma.get(v), Double::sum);
                        predecessors.computeIfAbsent(w, k -> new ArrayList<>()).add(v);
                    }
                }
            }

            Map<String, Double> delta = new HashMap<>();
            while (!stack.isEmpty()) {
                String w = stack.pop();
                double deltaW = delta.getOrDefault(w, 0.0);
                for (String v : predecessors.getOrDefault(w, List.of())) {
                    double contribution = sigma.get(v) / sigma.get(w) * (1.0 + deltaW);
                    delta.merge(v, contribution, Double::sum);
                }
                if (!w.equals(source)) {
                    centrality.merge(w, deltaW, Double::sum);
                }
            }
        }

        int n = nodes.size();
        if (n > 2) {
            double scale = 1.0 / ((double) (n - 1) * (n - 2));
            centrality.replaceAll((id, value) -> value * scale);
        }
        return centrality;
    }

    /**
     * Closeness of one entity measured by distances from the entities that can reach it.
     * Returns 0 for an entity nothing reaches.
     */
    public static double closeness(@NotNull KnowledgeGraph graph, @NotNull String entityId) {
        int n = graph.entityCount();
        Map<String, Integer> distance = new HashMap<>();
        distance.put(entityId, 0);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(entityId);
        long total = 0;
        while (!queue.isEmpty()) {
            String v = queue.poll();
            for (Relationship relationship : graph.getRelationships(null, v, null)) {
                String u = relationship.getSourceId();
                if (!distance.containsKey(u)) {
                    int d = distance.get(v) + 1;
                    distance.put(u, d);
                    total += d;
                    queue.add(u);
                }
            }
        }

        int reachable = distance.size() - 1;
        if (total == 0 || n <= 1) {
            return 0.0;
        }
        double value = reachable / (double) total;
        return value * reachable / (n - 1);
    }
}
