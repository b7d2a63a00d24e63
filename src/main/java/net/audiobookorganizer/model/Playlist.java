package net.audiobookorganizer.model;

import jakarta.annotation.Nullable;

public record Playlist(int id, String name, @Nullable Integer seriesId, String filePath) {
}
