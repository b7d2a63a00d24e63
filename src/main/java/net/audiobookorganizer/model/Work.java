package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;

/**
 * Logical title grouping several physical {@link Book} records (editions, re-recordings).
 */
public record Work(
    String id,
    String title,
    @Nullable Integer authorId,
    @Nullable Integer seriesId,
    List<String> altTitles,
    @Nullable Instant createdAt,
    @Nullable Instant updatedAt
) {
    public Work {
        altTitles = altTitles == null ? List.of() : List.copyOf(altTitles);
    }

    public static Work of(String title, @Nullable Integer authorId, @Nullable Integer seriesId, List<String> altTitles) {
        return new Work(null, title, authorId, seriesId, altTitles, null, null);
    }

    public Work withId(String newId) {
        return new Work(newId, title, authorId, seriesId, altTitles, createdAt, updatedAt);
    }

    public Work withTimestamps(Instant created, Instant updated) {
        return new Work(id, title, authorId, seriesId, altTitles, created, updated);
    }
}
