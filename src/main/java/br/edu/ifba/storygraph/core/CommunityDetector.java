package br.edu.ifba.storygraph.core;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Greedy modularity community detection (Clauset-Newman-Moore) on the undirected projection
 * of the graph.
 *
 * <p>Every entity starts in its own community. At each step the pair of connected communities
 * with the largest modularity gain {@code 2 * (e_ij - a_i * a_j)} is merged, stopping once no
 * merge has a positive gain. Relationships in either direction between two entities add to the
 * weight of that pair; self-loops are ignored.</p>
 */
public final class CommunityDetector {

    private static final Logger logger = LoggerFactory.getLogger(CommunityDetector.class);

    private CommunityDetector() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return communities as sets of entity ids, largest first
     */
    @NotNull
    public static List<Set<String>> greedyModularity(@NotNull KnowledgeGraph graph) {
        List<String> nodes = new ArrayList<>();
        Map<String, Integer> indexOf = new HashMap<>();
        for (Entity entity : graph.entities()) {
            indexOf.put(entity.getId(), nodes.size());
            nodes.add(entity.getId());
        }

        // community -> (neighbor community -> e_ij), a_i per community
        Map<Integer, Map<Integer, Double>> between = new LinkedHashMap<>();
        Map<Integer, Double> share = new LinkedHashMap<>();
        Map<Integer, Set<String>> members = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            between.put(i, new LinkedHashMap<>());
            share.put(i, 0.0);
            Set<String> single = new LinkedHashSet<>();
            single.add(nodes.get(i));
            members.put(i, single);
        }

        double totalWeight = 0.0;
        for (Relationship relationship : graph.relationships()) {
            if (!relationship.getSourceId().equals(relationship.getTargetId())) {
                totalWeight += 1.0;
            }
        }

        if (totalWeight > 0) {
            double twoM = 2.0 * totalWeight;
            for (Relationship relationship : graph.relationships()) {
                int u = indexOf.get(relationship.getSourceId());
                int v = indexOf.get(relationship.getTargetId());
                if (u == v) {
                    continue;
                }
                between.get(u).merge(v, 1.0 / twoM, Double::sum);
                between.get(v).merge(u, 1.0 / twoM, Double::sum);
                share.merge(u, 1.0 / twoM, Double::sum);
                share.merge(v, 1.0 / twoM, Double::sum);
            }

            int merges = 0;
            while (true) {
                int bestI = -1;
                int bestJ = -1;
                double bestGain = 0.0;
                for (Map.Entry<Integer, Map<Integer, Double>> row : between.entrySet()) {
                    int i = row.getKey();
                    for (Map.Entry<Integer, Double> cell : row.getValue().entrySet()) {
                        int j = cell.getKey();
                        if (j <= i) {
                            continue;
                        }
                        double gain = 2.0 * (cell.getValue() - share.get(i) * share.get(j));
                        if (gain > bestGain) {
                            bestGain = gain;
                            bestI = i;
                            bestJ = j;
                        }
                    }
                }
                if (bestI < 0) {
                    break;
                }
                merge(bestI, bestJ, between, share, members);
                merges++;
            }
            logger.debug("Community detection merged {} times over {} nodes", merges, nodes.size());
        }

        List<Set<String>> communities = new ArrayList<>(members.values());
        communities.sort(Comparator.comparingInt((Set<String> c) -> c.size()).reversed());
        return communities;
    }

    // folds community j into community i
    private static void merge(int i, int j, Map<Integer, Map<Integer, Double>> between,
                              Map<Integer, Double> share, Map<Integer, Set<String>> members) {
        Map<Integer, Double> rowJ = between.remove(j);
        Map<Integer, Double> rowI = between.get(i);
        rowI.remove(j);
        for (Map.Entry<Integer, Double> cell : rowJ.entrySet()) {
            int k = cell.getKey();
            if (k == i) {
                continue;
            }
            rowI.merge(k, cell.getValue(), Double::sum);
            Map<Integer, Double> rowK = between.get(k);
            rowK.remove(j);
            rowK.merge(i, cell.getValue(), Double::sum);
        }
        share.merge(i, share.remove(j), Double::sum);
        members.get(i).addAll(members.remove(j));
    }
}
