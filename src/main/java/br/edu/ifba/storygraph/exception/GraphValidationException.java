package br.edu.ifba.storygraph.exception;

/**
 * A persisted graph document is missing a required section or is structurally malformed.
 * Loads that raise it are fatal for that call; no partial graph is returned.
 */
public class GraphValidationException extends StoryGraphException {

    private final String path;

    public GraphValidationException(final String path, final String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public GraphValidationException(final String path, final String message, final Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    /**
     * JSON-pointer-like location of the offending section, e.g. {@code /entities/entity_sarah}.
     */
    public String getPath() {
        return path;
    }
}
