package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;
import java.time.Instant;

public record PlaybackEvent(
    String userId,
    String bookId,
    @Nullable String segmentId,
    int positionSec,
    String eventType,
    @Nullable Instant createdAt
) {

    public PlaybackEvent withCreatedAt(Instant instant) {
        return new PlaybackEvent(userId, bookId, segmentId, positionSec, eventType, instant);
    }
}
