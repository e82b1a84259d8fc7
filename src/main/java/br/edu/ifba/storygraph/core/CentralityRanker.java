package br.edu.ifba.storygraph.core;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PageRank over the directed multigraph. Parallel edges between the same ordered pair add
 * weight; dangling nodes spread their rank uniformly.
 */
public final class CentralityRanker {

    private static final Logger logger = LoggerFactory.getLogger(CentralityRanker.class);

    public static final double DAMPING = 0.85;
    public static final int MAX_ITERATIONS = 100;
    public static final double TOLERANCE = 1.0e-6;

    private CentralityRanker() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static Map<String, Double> pageRank(@NotNull KnowledgeGraph graph) {
        return pageRank(graph, DAMPING, MAX_ITERATIONS, TOLERANCE);
    }

    /**
     * Power iteration until the L1 change drops below {@code tolerance * N} or
     * {@code maxIterations} is reached, in which case the last iterate is returned.
     */
    @NotNull
    public static Map<String, Double> pageRank(@NotNull KnowledgeGraph graph, double damping,
                                               int maxIterations, double tolerance) {
        int n = graph.entityCount();
        Map<String, Double> ranks = new LinkedHashMap<>();
        if (n == 0) {
            return ranks;
        }

        // source -> (target -> parallel edge count)
        Map<String, Map<String, Integer>> weights = new HashMap<>();
        Map<String, Integer> outWeight = new HashMap<>();
        for (Relationship relationship : graph.relationships()) {
            weights.computeIfAbsent(relationship.getSourceId(), k -> new HashMap<>())
                .merge(relationship.getTargetId(), 1, Integer::sum);
            outWeight.merge(relationship.getSourceId(), 1, Integer::sum);
        }

        double uniform = 1.0 / n;
        for (Entity entity : graph.entities()) {
            ranks.put(entity.getId(), uniform);
        }

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            Map<String, Double> previous = ranks;
            Map<String, Double> next = new LinkedHashMap<>();
            double danglingSum = 0.0;
            for (Map.Entry<String, Double> entry : previous.entrySet()) {
                next.put(entry.getKey(), 0.0);
                if (!outWeight.containsKey(entry.getKey())) {
                    danglingSum += entry.getValue();
                }
            }
            danglingSum *= damping;

            for (Map.Entry<String, Map<String, Integer>> source : weights.entrySet()) {
                double share = damping * previous.get(source.getKey()) / outWeight.get(source.getKey());
                for (Map.Entry<String, Integer> target : source.getValue().entrySet()) {
                    next.merge(target.getKey(), share * target.getValue(), Double::sum);
                }
            }

            double teleport = danglingSum * uniform + (1.0 - damping) * uniform;
            double error = 0.0;
            for (Map.Entry<String, Double> entry : next.entrySet()) {
                double value = entry.getValue() + teleport;
                entry.setValue(value);
                error += Math.abs(value - previous.get(entry.getKey()));
            }
            ranks = next;

            if (error < n * tolerance) {
                logger.debug("PageRank converged after {} iterations for {} nodes", iteration + 1, n);
                return ranks;
            }
        }

        logger.warn("PageRank did not converge within {} iterations for {} nodes", maxIterations, n);
        return ranks;
    }
}
