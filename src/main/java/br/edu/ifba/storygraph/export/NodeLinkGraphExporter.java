package br.edu.ifba.storygraph.export;

import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.KnowledgeGraph;
import br.edu.ifba.storygraph.core.Relationship;
import br.edu.ifba.storygraph.storage.GraphDocumentCodec;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

/**
 * Node/edge JSON for visualization libraries (D3, vis.js) and other graph tools.
 *
 * <pre>
 * {
 *   "nodes": [ { "id", "label", "type", "group", "description", "mentions", "verified", ...attributes } ],
 *   "edges": [ { "source", "target", "label", "type", "description", "strength", "valence" } ],
 *   "metadata": { ... }
 * }
 * </pre>
 *
 * Entity attributes are spread into the node object; they never override the fixed keys.
 */
@ApplicationScoped
public class NodeLinkGraphExporter implements GraphExporter {

    private static final ObjectMapper mapper = GraphDocumentCodec.defaultMapper()
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    @Override
    public void export(
            @NotNull KnowledgeGraph graph,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputStream, toNodeLink(graph, config));
        outputStream.flush();
    }

    @NotNull
    public ObjectNode toNodeLink(@NotNull KnowledgeGraph graph, @NotNull ExportConfig config) {
        ExportSelection selection = ExportSelection.of(graph, config);
        ObjectNode root = mapper.createObjectNode();

        ArrayNode nodes = root.putArray("nodes");
        for (Entity entity : selection.entities()) {
            ObjectNode node = nodes.addObject();
            for (Map.Entry<String, Object> attribute : entity.getAttributes().entrySet()) {
                node.set(attribute.getKey(), mapper.valueToTree(attribute.getValue()));
            }
            node.put("id", entity.getId());
            node.put("label", entity.getName());
            node.put("type", entity.getType().getValue());
            node.put("group", entity.getType().getValue());
            node.put("description", entity.getDescription());
            node.put("mentions", entity.getMentionCount());
            node.put("verified", entity.isVerified());
        }

        ArrayNode edges = root.putArray("edges");
        for (Relationship relationship : selection.relationships()) {
            ObjectNode edge = edges.addObject();
            edge.put("source", relationship.getSourceId());
            edge.put("target", relationship.getTargetId());
            edge.put("label", relationship.getRelationType().getValue());
            edge.put("type", relationship.getRelationType().getValue());
            edge.put("description", relationship.getDescription());
            edge.put("strength", relationship.getStrength());
            edge.put("valence", relationship.getValence());
        }

        root.set("metadata", mapper.valueToTree(graph.metadata()));
        return root;
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.NODE_LINK;
    }
}
