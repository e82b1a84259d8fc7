package br.edu.ifba.storygraph.export;

import br.edu.ifba.storygraph.core.KnowledgeGraph;
import br.edu.ifba.storygraph.storage.GraphDocumentCodec;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes the graph exactly as it is persisted, so the output can be loaded back.
 * The include and limit options are ignored: a partial document would not load.
 */
@ApplicationScoped
public class DocumentGraphExporter implements GraphExporter {

    private final GraphDocumentCodec codec = new GraphDocumentCodec();
    private final ObjectMapper writer = codec.mapper().copy().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    @Override
    public void export(
            @NotNull KnowledgeGraph graph,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {
        writer.writerWithDefaultPrettyPrinter().writeValue(outputStream, codec.save(graph));
        outputStream.flush();
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.DOCUMENT;
    }
}
