package net.audiobookorganizer.model;

import java.time.Instant;

/**
 * Audiobook narrator, linked to books through {@link BookNarrator} rows.
 */
public record Narrator(int id, String name, Instant createdAt) {
}
