package br.edu.ifba.storygraph.core;

/**
 * Which edges a traversal may follow from a node.
 */
public enum TraversalDirection {
    /** Follow edges from source to target only. */
    OUTGOING,
    /** Treat every edge as undirected. */
    BOTH
}
