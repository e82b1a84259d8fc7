package br.edu.ifba.storygraph.export;

import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.KnowledgeGraph;
import br.edu.ifba.storygraph.core.Relationship;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The entities and relationships an export writes, after applying the config.
 * When entities are included, relationships are restricted to those between written entities.
 */
record ExportSelection(List<Entity> entities, List<Relationship> relationships) {

    static ExportSelection of(KnowledgeGraph graph, ExportConfig config) {
        List<Entity> entities = config.includeEntities()
            ? graph.entities().stream().limit(config.limit()).collect(Collectors.toList())
            : List.of();

        List<Relationship> relationships = List.of();
        if (config.includeRelationships()) {
            Set<String> written = entities.stream().map(Entity::getId).collect(Collectors.toCollection(HashSet::new));
            relationships = graph.relationships().stream()
                .filter(r -> !config.includeEntities()
                    || (written.contains(r.getSourceId()) && written.contains(r.getTargetId())))
                .limit(config.limit())
                .collect(Collectors.toList());
        }
        return new ExportSelection(entities, relationships);
    }
}
