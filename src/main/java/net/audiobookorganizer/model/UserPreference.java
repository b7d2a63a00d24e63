package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Global (not per-user) preference. Also carries migration bookkeeping ({@code db_version},
 * {@code migration_<n>}).
 */
public record UserPreference(int id, String key, @Nullable String value, Instant updatedAt) {
}
