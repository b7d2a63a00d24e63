package net.audiobookorganizer.model;

import java.time.Instant;

/**
 * Content-hash blocklist entry; the import pipeline skips files whose hash is listed.
 */
public record DoNotImport(String hash, String reason, Instant createdAt) {
}
