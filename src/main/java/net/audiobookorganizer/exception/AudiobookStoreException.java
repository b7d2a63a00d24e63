package net.audiobookorganizer.exception;

/**
 * Base for every failure raised by a store engine. Engine-specific failures
 * ({@code RocksDBException}, {@code DataAccessException}, I/O) are wrapped in this type so
 * callers depend only on the store contract.
 * RETRYABLE: Depends on subtype; the base type itself wraps engine/I-O failures that may be transient
 */
public class AudiobookStoreException extends RuntimeException {

    public AudiobookStoreException(String message) {
        super(message);
    }

    public AudiobookStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
