package br.edu.ifba.storygraph.export;

import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.KnowledgeGraph;
import br.edu.ifba.storygraph.core.Relationship;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * GraphML output for Gephi, yEd and similar tools.
 * Each relationship is one {@code <edge>}; parallel edges between a pair differ by {@code relation}.
 */
@ApplicationScoped
public class GraphMlGraphExporter implements GraphExporter {

    private static final String NAMESPACE = "http://graphml.graphdrawing.org/xmlns";

    private static final String[][] NODE_KEYS = {
        {"name", "string"}, {"type", "string"}, {"description", "string"},
        {"mention_count", "int"}, {"confidence", "double"}, {"verified", "boolean"}
    };
    private static final String[][] EDGE_KEYS = {
        {"relation", "string"}, {"description", "string"},
        {"strength", "double"}, {"valence", "double"}, {"confidence", "double"}
    };

    private final XMLOutputFactory outputFactory = XMLOutputFactory.newInstance();

    @Override
    public void export(
            @NotNull KnowledgeGraph graph,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {
        ExportSelection selection = ExportSelection.of(graph, config);
        try {
            XMLStreamWriter xml = outputFactory.createXMLStreamWriter(outputStream, StandardCharsets.UTF_8.name());
            xml.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
            xml.writeStartElement("graphml");
            xml.writeDefaultNamespace(NAMESPACE);

            writeKeys(xml, "node", "n", NODE_KEYS);
            writeKeys(xml, "edge", "e", EDGE_KEYS);

            xml.writeStartElement("graph");
            xml.writeAttribute("id", graph.getProjectId());
            xml.writeAttribute("edgedefault", "directed");

            for (Entity entity : selection.entities()) {
                xml.writeStartElement("node");
                xml.writeAttribute("id", entity.getId());
                writeData(xml, "n_name", entity.getName());
                writeData(xml, "n_type", entity.getType().getValue());
                writeData(xml, "n_description", entity.getDescription());
                writeData(xml, "n_mention_count", String.valueOf(entity.getMentionCount()));
                writeData(xml, "n_confidence", String.valueOf(entity.getConfidence()));
                writeData(xml, "n_verified", String.valueOf(entity.isVerified()));
                xml.writeEndElement();
            }

            int edgeIndex = 0;
            for (Relationship relationship : selection.relationships()) {
                xml.writeStartElement("edge");
                xml.writeAttribute("id", "e" + edgeIndex++);
                xml.writeAttribute("source", relationship.getSourceId());
                xml.writeAttribute("target", relationship.getTargetId());
                writeData(xml, "e_relation", relationship.getRelationType().getValue());
                writeData(xml, "e_description", relationship.getDescription());
                writeData(xml, "e_strength", String.valueOf(relationship.getStrength()));
                writeData(xml, "e_valence", String.valueOf(relationship.getValence()));
                writeData(xml, "e_confidence", String.valueOf(relationship.getConfidence()));
                xml.writeEndElement();
            }

            xml.writeEndElement(); // graph
            xml.writeEndElement(); // graphml
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IOException("Failed to write GraphML for project " + graph.getProjectId(), e);
        }
        outputStream.flush();
    }

    private static void writeKeys(XMLStreamWriter xml, String domain, String prefix, String[][] keys)
            throws XMLStreamException {
        for (String[] key : keys) {
            xml.writeEmptyElement("key");
            xml.writeAttribute("id", prefix + "_" + key[0]);
            xml.writeAttribute("for", domain);
            xml.writeAttribute("attr.name", key[0]);
            xml.writeAttribute("attr.type", key[1]);
        }
    }

    private static void writeData(XMLStreamWriter xml, String key, String value) throws XMLStreamException {
        xml.writeStartElement("data");
        xml.writeAttribute("key", key);
        xml.writeCharacters(value != null ? value : "");
        xml.writeEndElement();
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.GRAPHML;
    }
}
