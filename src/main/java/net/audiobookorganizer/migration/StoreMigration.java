package net.audiobookorganizer.migration;

import net.audiobookorganizer.store.AudiobookStore;

/**
 * One versioned migration step. Steps must be idempotent: a step interrupted after partial
 * work is re-run in full on the next start.
 */
public interface StoreMigration {

    int getVersion();

    String getDescription();

    void execute(AudiobookStore store);
}
