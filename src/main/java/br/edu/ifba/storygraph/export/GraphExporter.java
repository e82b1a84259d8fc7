package br.edu.ifba.storygraph.export;

import br.edu.ifba.storygraph.core.KnowledgeGraph;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes a project graph in one external format.
 *
 * <h2>Contract:</h2>
 * <ul>
 *   <li>MUST write a complete, valid document for the format</li>
 *   <li>MUST honor {@link ExportConfig#includeEntities()}, {@link ExportConfig#includeRelationships()}
 *       and {@link ExportConfig#maxItems()} where the format allows partial content</li>
 *   <li>MUST NOT close the output stream (caller responsibility)</li>
 *   <li>Called with the project lock held; MUST NOT mutate the graph</li>
 * </ul>
 *
 * @see GraphExporterFactory
 */
public interface GraphExporter {

    void export(
        @NotNull KnowledgeGraph graph,
        @NotNull ExportConfig config,
        @NotNull OutputStream outputStream
    ) throws IOException;

    default String getMimeType() {
        return getFormat().getMimeType();
    }

    default String getFileExtension() {
        return getFormat().getExtension();
    }

    ExportFormat getFormat();
}
