package br.edu.ifba.storygraph.exception;

public class GraphStorageException extends StoryGraphException {

    public GraphStorageException(final String message) {
        super(message);
    }

    public GraphStorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
