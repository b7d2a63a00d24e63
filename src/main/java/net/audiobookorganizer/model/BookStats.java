package net.audiobookorganizer.model;

public record BookStats(String bookId, long playCount, long listenSeconds) {
}
