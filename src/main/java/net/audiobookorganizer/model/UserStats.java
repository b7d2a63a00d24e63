package net.audiobookorganizer.model;

public record UserStats(String userId, long listenSeconds) {
}
