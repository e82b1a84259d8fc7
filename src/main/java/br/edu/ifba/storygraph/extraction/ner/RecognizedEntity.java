package br.edu.ifba.storygraph.extraction.ner;

import org.jetbrains.annotations.NotNull;

/**
 * A named-entity mention found in text.
 *
 * @param text the mention as written
 * @param label recognizer category, upper case (PERSON, GPE, LOC, FAC, ORG, EVENT, PRODUCT, WORK_OF_ART, ...)
 * @param start start offset in the source text
 * @param end end offset in the source text, exclusive
 * @param sentence the sentence containing the mention
 */
public record RecognizedEntity(
    @NotNull String text,
    @NotNull String label,
    int start,
    int end,
    @NotNull String sentence
) {
}
