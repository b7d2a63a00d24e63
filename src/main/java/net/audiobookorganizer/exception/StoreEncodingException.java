package net.audiobookorganizer.exception;

/**
 * A stored record could not be decoded (corrupt JSON value or unexpected row shape).
 * RETRYABLE: No
 */
public class StoreEncodingException extends AudiobookStoreException {

    private final String key;

    public StoreEncodingException(String key, Throwable cause) {
        super("Failed to decode stored record " + key, cause);
        this.key = key;
    }

    public StoreEncodingException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
