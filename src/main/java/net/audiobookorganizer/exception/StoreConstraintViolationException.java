package net.audiobookorganizer.exception;

/**
 * A write collided with a unique key (file path, import path, username, email) or referenced
 * an entity that does not exist.
 * RETRYABLE: No (the caller must resolve the conflict first)
 */
public class StoreConstraintViolationException extends AudiobookStoreException {

    private final String entity;

    public StoreConstraintViolationException(String entity, String message) {
        super(message);
        this.entity = entity;
    }

    public StoreConstraintViolationException(String entity, String message, Throwable cause) {
        super(message, cause);
        this.entity = entity;
    }

    /** Entity family the violation was raised for, e.g. {@code "book"} or {@code "user"}. */
    public String getEntity() {
        return entity;
    }

    public static StoreConstraintViolationException duplicate(String entity, String attribute, String value) {
        return new StoreConstraintViolationException(entity,
            entity + " with " + attribute + " '" + value + "' already exists");
    }

    public static StoreConstraintViolationException notFound(String entity, Object id) {
        return new StoreConstraintViolationException(entity, entity + " not found: " + id);
    }
}
