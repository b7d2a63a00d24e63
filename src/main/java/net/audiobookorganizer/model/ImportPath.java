package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Filesystem folder the import pipeline scans. {@code path} is unique.
 */
public record ImportPath(
    int id,
    String path,
    String name,
    boolean enabled,
    Instant createdAt,
    @Nullable Instant lastScan,
    int bookCount
) {
}
