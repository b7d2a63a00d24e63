package net.audiobookorganizer.model;

import java.time.Instant;

/**
 * Per-user preference keyed by (userId, key).
 */
public record UserPreferenceEntry(String userId, String key, String value, Instant updatedAt) {
}
