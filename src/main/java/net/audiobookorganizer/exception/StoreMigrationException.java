package net.audiobookorganizer.exception;

/**
 * A migration step failed or the recorded schema version could not be read.
 * The recorded version stays at the last step that completed.
 * RETRYABLE: Yes (re-running resumes after the last completed step)
 */
public class StoreMigrationException extends AudiobookStoreException {

    private final int version;

    public StoreMigrationException(int version, String message, Throwable cause) {
        super(message, cause);
        this.version = version;
    }

    public StoreMigrationException(String message, Throwable cause) {
        this(-1, message, cause);
    }

    /** Version of the failing step, or -1 when the failure is not tied to one step. */
    public int getVersion() {
        return version;
    }
}
