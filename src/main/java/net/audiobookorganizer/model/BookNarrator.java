package net.audiobookorganizer.model;

/**
 * Ordered narrator link for a book. Unique per (bookId, narratorId, role).
 */
public record BookNarrator(String bookId, int narratorId, String role, int position) {

    public static final String ROLE_NARRATOR = "narrator";
    public static final String ROLE_CO_NARRATOR = "co-narrator";
}
