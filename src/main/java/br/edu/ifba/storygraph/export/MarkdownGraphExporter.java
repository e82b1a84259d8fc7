package br.edu.ifba.storygraph.export;

import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.EntityType;
import br.edu.ifba.storygraph.core.GraphMetadata;
import br.edu.ifba.storygraph.core.KnowledgeGraph;
import br.edu.ifba.storygraph.core.Relationship;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Narrative summary of the story world, grouped by entity type.
 *
 * <p>Intended for knowledge-ingestion tools that read prose better than JSON.</p>
 *
 * <h2>Output Format:</h2>
 * <pre>
 * # Story Knowledge Graph: my-novel
 *
 * 3 entities, 1 relationships across 2 scenes.
 *
 * ## Characters (2)
 *
 * ### Mickey
 *
 * A drifter looking for his sister.
 *
 * - Also known as: Mick
 * - Appears in: scene-1, scene-2 (2 mentions)
 * - Relationships:
 *   - related to **Sarah** (strength 0.80, valence +0.50): searches for her
 * </pre>
 */
@ApplicationScoped
public class MarkdownGraphExporter implements GraphExporter {

    @Override
    public void export(
            @NotNull KnowledgeGraph graph,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {

        ExportSelection selection = ExportSelection.of(graph, config);
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));

        GraphMetadata metadata = graph.metadata();
        writer.write("# Story Knowledge Graph: " + escapeMarkdown(graph.getProjectId()));
        writer.newLine();
        writer.newLine();
        writer.write(metadata.entityCount() + " entities, " + metadata.relationshipCount()
            + " relationships across " + metadata.sceneCount() + " scenes.");
        writer.newLine();

        Map<String, String> names = new HashMap<>();
        graph.entities().forEach(e -> names.put(e.getId(), e.getName()));

        if (config.includeEntities()) {
            writeEntitiesByType(writer, selection, names, config.includeRelationships());
        } else {
            writeRelationshipList(writer, selection.relationships(), names);
        }

        writer.flush();
    }

    private void writeEntitiesByType(BufferedWriter writer, ExportSelection selection, Map<String, String> names,
                                     boolean withRelationships) throws IOException {
        Map<EntityType, List<Entity>> byType = new EnumMap<>(EntityType.class);
        for (Entity entity : selection.entities()) {
            byType.computeIfAbsent(entity.getType(), k -> new ArrayList<>()).add(entity);
        }

        Map<String, List<Relationship>> outgoing = new HashMap<>();
        if (withRelationships) {
            for (Relationship relationship : selection.relationships()) {
                outgoing.computeIfAbsent(relationship.getSourceId(), k -> new ArrayList<>()).add(relationship);
            }
        }

        for (Map.Entry<EntityType, List<Entity>> group : byType.entrySet()) {
            List<Entity> entities = group.getValue();
            entities.sort(Comparator.comparingInt(Entity::getMentionCount).reversed()
                .thenComparing(Entity::getName, String.CASE_INSENSITIVE_ORDER));

            writer.newLine();
            writer.write("## " + sectionTitle(group.getKey()) + " (" + entities.size() + ")");
            writer.newLine();

            for (Entity entity : entities) {
                writeEntity(writer, entity, outgoing.getOrDefault(entity.getId(), List.of()), names);
            }
        }
    }

    private void writeEntity(BufferedWriter writer, Entity entity, List<Relationship> relationships,
                             Map<String, String> names) throws IOException {
        writer.newLine();
        writer.write("### " + escapeMarkdown(entity.getName()));
        writer.newLine();
        writer.newLine();
        if (!entity.getDescription().isBlank()) {
            writer.write(escapeMarkdown(entity.getDescription()));
            writer.newLine();
            writer.newLine();
        }

        if (!entity.getAliases().isEmpty()) {
            writer.write("- Also known as: " + escapeMarkdown(String.join(", ", entity.getAliases())));
            writer.newLine();
        }
        if (!entity.getAppearances().isEmpty()) {
            writer.write("- Appears in: " + escapeMarkdown(String.join(", ", entity.getAppearances()))
                + " (" + entity.getMentionCount() + " mentions)");
            writer.newLine();
        }
        for (Map.Entry<String, Object> attribute : entity.getAttributes().entrySet()) {
            writer.write("- " + escapeMarkdown(humanize(attribute.getKey())) + ": "
                + escapeMarkdown(String.valueOf(attribute.getValue())));
            writer.newLine();
        }
        if (!relationships.isEmpty()) {
            writer.write("- Relationships:");
            writer.newLine();
            for (Relationship relationship : relationships) {
                writer.write("  - " + relationshipLine(relationship, names));
                writer.newLine();
            }
        }
    }

    private void writeRelationshipList(BufferedWriter writer, List<Relationship> relationships,
                                       Map<String, String> names) throws IOException {
        writer.newLine();
        writer.write("## Relationships (" + relationships.size() + ")");
        writer.newLine();
        writer.newLine();
        for (Relationship relationship : relationships) {
            writer.write("- **" + escapeMarkdown(names.getOrDefault(relationship.getSourceId(), relationship.getSourceId()))
                + "** " + relationshipLine(relationship, names));
            writer.newLine();
        }
    }

    private String relationshipLine(Relationship relationship, Map<String, String> names) {
        String target = names.getOrDefault(relationship.getTargetId(), relationship.getTargetId());
        StringBuilder line = new StringBuilder()
            .append(humanize(relationship.getRelationType().getValue()))
            .append(" **").append(escapeMarkdown(target)).append("**")
            .append(String.format(Locale.ROOT, " (strength %.2f, valence %+.2f)",
                relationship.getStrength(), relationship.getValence()));
        if (!relationship.getDescription().isBlank()) {
            line.append(": ").append(escapeMarkdown(relationship.getDescription()));
        }
        return line.toString();
    }

    private static String sectionTitle(EntityType type) {
        String value = type.getValue();
        String plural = value.endsWith("y") ? value.substring(0, value.length() - 1) + "ies" : value + "s";
        return Character.toUpperCase(plural.charAt(0)) + plural.substring(1);
    }

    private static String humanize(String key) {
        return key.replace('_', ' ');
    }

    /**
     * Flattens newlines so one item stays on one line.
     */
    private static String escapeMarkdown(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text
                .replace("\r", "")
                .replace("\n", " ");
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.MARKDOWN;
    }
}
