package net.audiobookorganizer.migration;

import java.util.List;

/**
 * The ordered migration list shipped with this release.
 */
public final class StoreMigrations {

    private StoreMigrations() {
    }

    public static List<StoreMigration> defaults() {
        return List.of(
            new BaselineMigration(1, "Initial schema"),
            new BaselineMigration(2, "Operations and operation logs"),
            new BaselineMigration(3, "Extended book metadata columns"),
            new BaselineMigration(4, "Preferences and settings"),
            new LegacyImportPathMigration(),
            new AuthorSplitMigration(),
            new NarratorSplitMigration()
        );
    }
}
