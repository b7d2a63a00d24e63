package net.audiobookorganizer.exception;

/**
 * The active engine intentionally does not implement this operation.
 * RETRYABLE: No (switch engines instead)
 */
public class UnsupportedStoreOperationException extends AudiobookStoreException {

    private final String engine;
    private final String operation;

    public UnsupportedStoreOperationException(String engine, String operation) {
        super(operation + " is not supported by the " + engine + " store");
        this.engine = engine;
        this.operation = operation;
    }

    public String getEngine() {
        return engine;
    }

    public String getOperation() {
        return operation;
    }
}
