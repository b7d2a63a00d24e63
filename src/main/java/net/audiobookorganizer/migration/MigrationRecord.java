package net.audiobookorganizer.migration;

import java.time.Instant;

/**
 * Bookkeeping entry written to the {@code migration_<version>} preference after a step succeeds.
 */
public record MigrationRecord(int version, String description, Instant appliedAt) {
}
