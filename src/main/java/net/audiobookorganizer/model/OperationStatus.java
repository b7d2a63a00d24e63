package net.audiobookorganizer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a long-running {@link Operation}.
 */
public enum OperationStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    /** Lower-case wire/storage value, e.g. {@code "running"}. */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static OperationStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Operation status must not be blank");
        }
        return OperationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
