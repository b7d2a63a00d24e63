package net.audiobookorganizer.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.model.Author;
import net.audiobookorganizer.model.Book;
import net.audiobookorganizer.model.BookAuthor;
import net.audiobookorganizer.store.AudiobookStore;

/**
 * Splits combined author names ("A & B") into separate authors linked through
 * {@link BookAuthor} rows. The first name becomes the primary {@code author}; later names are
 * {@code co-author}s. The book's direct author reference is moved to the first author.
 */
@Slf4j
public class AuthorSplitMigration implements StoreMigration {

    public static final int VERSION = 6;

    @Override
    public int getVersion() {
        return VERSION;
    }

    @Override
    public String getDescription() {
        return "Split combined author names into linked authors";
    }

    @Override
    public void execute(AudiobookStore store) {
        int split = 0;
        for (Book book : allBooks(store)) {
            if (book.getAuthorId() == null) {
                continue;
            }
            Optional<Author> current = store.getAuthorById(book.getAuthorId());
            if (current.isEmpty() || !PersonNameSplitter.isCombined(current.get().name())) {
                continue;
            }
            List<String> names = PersonNameSplitter.split(current.get().name());
            if (names.isEmpty()) {
                continue;
            }
            Author first = null;
            for (int position = 0; position < names.size(); position++) {
                Author author = store.createAuthor(names.get(position));
                if (first == null) {
                    first = author;
                }
                String role = position == 0 ? BookAuthor.ROLE_AUTHOR : BookAuthor.ROLE_CO_AUTHOR;
                store.addBookAuthor(new BookAuthor(book.getId(), author.id(), role, position));
            }
            if (book.getAuthorId() != first.id()) {
                Book repointed = book.copy();
                repointed.setAuthorId(first.id());
                store.updateBook(book.getId(), repointed);
            }
            split++;
        }
        log.info("Split combined authors on {} books", split);
    }

    /** Every book, soft-deleted ones included, so restored books come back migrated. */
    static List<Book> allBooks(AudiobookStore store) {
        List<Book> books = new ArrayList<>(store.getAllBooks(0, 0));
        books.addAll(store.listSoftDeletedBooks(0, 0, null));
        return books;
    }
}
