package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Latest playback position; one record per (userId, bookId).
 */
public record PlaybackProgress(
    String userId,
    String bookId,
    @Nullable String segmentId,
    int positionSec,
    double percentComplete,
    @Nullable Instant updatedAt
) {

    public PlaybackProgress withUpdatedAt(Instant instant) {
        return new PlaybackProgress(userId, bookId, segmentId, positionSec, percentComplete, instant);
    }
}
