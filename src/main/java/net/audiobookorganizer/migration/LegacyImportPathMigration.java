package net.audiobookorganizer.migration;

import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.store.AudiobookStore;
import net.audiobookorganizer.store.LegacySchemaSupport;

/**
 * Moves import paths recorded under the old "library" naming to the current import path
 * storage. The engine does the physical work through {@link LegacySchemaSupport}.
 */
@Slf4j
public class LegacyImportPathMigration implements StoreMigration {

    public static final int VERSION = 5;

    @Override
    public int getVersion() {
        return VERSION;
    }

    @Override
    public String getDescription() {
        return "Rename legacy library folders to import paths";
    }

    @Override
    public void execute(AudiobookStore store) {
        if (!(store instanceof LegacySchemaSupport legacy)) {
            log.debug("{} store keeps no legacy library folders", store.engineName());
            return;
        }
        int moved = legacy.migrateLegacyImportPaths();
        log.info("Moved {} legacy library folder entries to import paths", moved);
    }
}
