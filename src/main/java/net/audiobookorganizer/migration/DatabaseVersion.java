package net.audiobookorganizer.migration;

import java.time.Instant;

/**
 * Value of the {@code db_version} preference: the highest migration step applied.
 */
public record DatabaseVersion(int version, Instant updatedAt) {
}
