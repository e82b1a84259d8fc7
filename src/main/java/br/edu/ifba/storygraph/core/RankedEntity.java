package br.edu.ifba.storygraph.core;

import org.jetbrains.annotations.NotNull;

/**
 * An entity paired with its centrality score.
 */
public record RankedEntity(@NotNull Entity entity, double score) {
}
