package net.audiobookorganizer.model;

/**
 * Ordered author link for a book. Unique per (bookId, authorId, role).
 */
public record BookAuthor(String bookId, int authorId, String role, int position) {

    public static final String ROLE_AUTHOR = "author";
    public static final String ROLE_CO_AUTHOR = "co-author";
}
