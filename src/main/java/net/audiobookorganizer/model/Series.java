package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;

/**
 * Named series; the name is unique per author, where "no author" counts as its own bucket.
 */
public record Series(int id, String name, @Nullable Integer authorId) {
}
