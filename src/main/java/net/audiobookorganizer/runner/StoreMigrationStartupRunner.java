package net.audiobookorganizer.runner;

import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.config.StoreProperties;
import net.audiobookorganizer.migration.MigrationRunner;
import net.audiobookorganizer.store.AudiobookStore;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Brings the opened store up to the latest schema version before the application serves work.
 * A failed migration aborts startup.
 */
@Slf4j
@Component
public class StoreMigrationStartupRunner implements ApplicationRunner {

    private final AudiobookStore audiobookStore;
    private final MigrationRunner migrationRunner;
    private final StoreProperties properties;

    public StoreMigrationStartupRunner(AudiobookStore audiobookStore, MigrationRunner migrationRunner,
                                       StoreProperties properties) {
        this.audiobookStore = audiobookStore;
        this.migrationRunner = migrationRunner;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunMigrationsOnStartup()) {
            log.info("[MIGRATION] Startup migrations disabled (audiobook.store.run-migrations-on-startup=false)");
            return;
        }
        int applied = migrationRunner.runMigrations(audiobookStore);
        log.info("[MIGRATION] Store at version {} ({} migration(s) applied at startup)",
            migrationRunner.getCurrentVersion(audiobookStore), applied);
    }
}
