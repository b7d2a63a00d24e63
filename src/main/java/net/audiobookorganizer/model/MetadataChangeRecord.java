package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Append-only history entry for a metadata field change.
 */
public record MetadataChangeRecord(
    int id,
    String bookId,
    String field,
    @Nullable String previousValue,
    @Nullable String newValue,
    String changeType,
    @Nullable String source,
    @Nullable Instant changedAt
) {

    public MetadataChangeRecord withId(int newId, Instant at) {
        return new MetadataChangeRecord(newId, bookId, field, previousValue, newValue, changeType, source,
            changedAt != null ? changedAt : at);
    }
}
