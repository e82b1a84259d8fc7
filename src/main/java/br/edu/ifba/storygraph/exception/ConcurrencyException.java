package br.edu.ifba.storygraph.exception;

/**
 * The per-project graph lock could not be acquired within the configured bound.
 */
public class ConcurrencyException extends StoryGraphException {

    public ConcurrencyException(final String message) {
        super(message);
    }

    public ConcurrencyException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
