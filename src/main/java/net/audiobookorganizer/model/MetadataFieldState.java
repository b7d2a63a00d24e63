package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Provenance of one metadata field of one book. When {@code overrideLocked} is set, automated
 * re-extraction must leave {@code overrideValue} alone.
 */
public record MetadataFieldState(
    String bookId,
    String field,
    @Nullable String fetchedValue,
    @Nullable String overrideValue,
    boolean overrideLocked,
    @Nullable Instant updatedAt
) {

    public MetadataFieldState withUpdatedAt(Instant instant) {
        return new MetadataFieldState(bookId, field, fetchedValue, overrideValue, overrideLocked, instant);
    }
}
