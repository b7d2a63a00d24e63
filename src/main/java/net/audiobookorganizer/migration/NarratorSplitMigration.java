package net.audiobookorganizer.migration;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.model.Book;
import net.audiobookorganizer.model.BookNarrator;
import net.audiobookorganizer.model.Narrator;
import net.audiobookorganizer.store.AudiobookStore;

/**
 * Creates narrator records for combined narrator credits ("A & B") and links them to the book
 * as {@code narrator} and {@code co-narrator}. The free-text {@link Book#getNarrator()} value is
 * kept as imported.
 */
@Slf4j
public class NarratorSplitMigration implements StoreMigration {

    public static final int VERSION = 7;

    @Override
    public int getVersion() {
        return VERSION;
    }

    @Override
    public String getDescription() {
        return "Split combined narrator credits into linked narrators";
    }

    @Override
    public void execute(AudiobookStore store) {
        int linked = 0;
        for (Book book : AuthorSplitMigration.allBooks(store)) {
            if (!PersonNameSplitter.isCombined(book.getNarrator())) {
                continue;
            }
            List<String> names = PersonNameSplitter.split(book.getNarrator());
            for (int position = 0; position < names.size(); position++) {
                Narrator narrator = store.createNarrator(names.get(position));
                String role = position == 0 ? BookNarrator.ROLE_NARRATOR : BookNarrator.ROLE_CO_NARRATOR;
                if (store.addBookNarrator(new BookNarrator(book.getId(), narrator.id(), role, position))) {
                    linked++;
                }
            }
        }
        log.info("Added {} narrator links from combined credits", linked);
    }
}
