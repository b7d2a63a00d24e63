package net.audiobookorganizer.model;

import java.util.List;

/**
 * Denormalized playback read model for a book: the active segments in play order, each with
 * its cumulative start offset.
 */
public record DurationMap(String bookId, List<Entry> segments, int totalDuration, int version) {

    public DurationMap {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public record Entry(String id, int duration, boolean active, int offsetStart) {
    }
}
