package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;
import java.time.Instant;

public record OperationLog(
    int id,
    String operationId,
    String level,
    String message,
    @Nullable String details,
    Instant createdAt
) {
}
