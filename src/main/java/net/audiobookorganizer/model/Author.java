package net.audiobookorganizer.model;

/**
 * Book author. Names are unique, compared case-insensitively.
 */
public record Author(int id, String name) {
}
