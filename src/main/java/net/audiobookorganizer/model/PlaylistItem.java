package net.audiobookorganizer.model;

public record PlaylistItem(int id, int playlistId, String bookId, int position) {
}
