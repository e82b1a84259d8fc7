package br.edu.ifba.storygraph.exception;

public class EntityNotFoundException extends StoryGraphException {

    private final String entityId;

    public EntityNotFoundException(final String entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }

    public EntityNotFoundException(final String entityId, final String message) {
        super(message);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
