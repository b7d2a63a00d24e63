package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;
import java.time.Instant;
import lombok.Builder;

/**
 * One physical file contributing to a (possibly multi-file) audiobook. Segments are never
 * deleted: merging deactivates them and points {@code supersededBy} at the merged segment.
 */
@Builder(toBuilder = true)
public record BookSegment(
    String id,
    String bookId,
    String filePath,
    @Nullable String format,
    long sizeBytes,
    int durationSec,
    @Nullable Integer trackNumber,
    boolean active,
    @Nullable String supersededBy,
    @Nullable Instant createdAt,
    @Nullable Instant updatedAt,
    int version
) {
}
