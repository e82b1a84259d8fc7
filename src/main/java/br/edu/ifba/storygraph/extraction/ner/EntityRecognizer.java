package br.edu.ifba.storygraph.extraction.ner;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Named-entity recognizer used by lightweight extraction.
 */
public interface EntityRecognizer {

    /**
     * Finds entity mentions in document order. Empty text yields an empty list.
     */
    @NotNull
    List<RecognizedEntity> recognize(@NotNull String text);

    /**
     * Short identifier for logs.
     */
    @NotNull
    String getName();
}
