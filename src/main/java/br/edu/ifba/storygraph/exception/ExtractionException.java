package br.edu.ifba.storygraph.exception;

/**
 * The extraction model call failed, timed out, or returned output that could not be used.
 */
public class ExtractionException extends StoryGraphException {

    /**
     * Failure modes callers can tell apart.
     */
    public enum Kind {
        RATE_LIMITED,
        TIMEOUT,
        AUTHENTICATION,
        PROVIDER,
        UNPARSEABLE;

        /**
         * Whether retrying the same call later may succeed.
         */
        public boolean isTransient() {
            return this == RATE_LIMITED || this == TIMEOUT;
        }
    }

    private final Kind kind;

    public ExtractionException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
