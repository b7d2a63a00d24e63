package net.audiobookorganizer.model;

import java.util.Map;

/**
 * Library-wide aggregates over non-deleted books. Books without a library state count as
 * {@code imported}; books without a codec count as {@code unknown}.
 */
public record DashboardStats(
    int totalBooks,
    long totalDuration,
    long totalSize,
    Map<String, Integer> stateDistribution,
    Map<String, Integer> formatDistribution
) {
    public DashboardStats {
        stateDistribution = stateDistribution == null ? Map.of() : Map.copyOf(stateDistribution);
        formatDistribution = formatDistribution == null ? Map.of() : Map.copyOf(formatDistribution);
    }
}
