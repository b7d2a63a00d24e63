package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Long-running task (scan, organize, metadata fetch). Mutated only by the task that created it.
 */
public record Operation(
    String id,
    String type,
    OperationStatus status,
    int progress,
    int total,
    String message,
    @Nullable String folderPath,
    Instant createdAt,
    @Nullable Instant startedAt,
    @Nullable Instant completedAt,
    @Nullable String errorMessage
) {

    public Operation withStatus(OperationStatus newStatus, int newProgress, int newTotal, String newMessage, Instant now) {
        Instant started = startedAt;
        Instant completed = completedAt;
        if (newStatus == OperationStatus.RUNNING && started == null) {
            started = now;
        }
        if (newStatus.isTerminal()) {
            completed = now;
        }
        return new Operation(id, type, newStatus, newProgress, newTotal, newMessage, folderPath,
            createdAt, started, completed, errorMessage);
    }

    public Operation withError(String error, Instant now) {
        return new Operation(id, type, OperationStatus.FAILED, progress, total, message, folderPath,
            createdAt, startedAt, now, error);
    }
}
