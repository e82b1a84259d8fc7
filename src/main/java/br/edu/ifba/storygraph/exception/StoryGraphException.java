package br.edu.ifba.storygraph.exception;

/**
 * Base type for every failure raised by the story graph engine.
 */
public class StoryGraphException extends RuntimeException {

    public StoryGraphException(final String message) {
        super(message);
    }

    public StoryGraphException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
