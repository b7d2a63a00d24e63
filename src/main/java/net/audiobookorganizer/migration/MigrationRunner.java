package net.audiobookorganizer.migration;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.exception.StoreEncodingException;
import net.audiobookorganizer.exception.StoreMigrationException;
import net.audiobookorganizer.model.UserPreference;
import net.audiobookorganizer.store.AudiobookStore;
import net.audiobookorganizer.store.StoreJson;
import net.audiobookorganizer.store.StoreQueries;

/**
 * Applies pending {@link StoreMigration} steps to whichever engine is active.
 *
 * <p>Progress lives in global preferences: {@code db_version} holds the last applied version and
 * {@code migration_<n>} records each applied step. A step is recorded, then the version is
 * advanced; a failing step stops the run and leaves the version at the last success.
 */
@Slf4j
public class MigrationRunner {

    public static final String VERSION_KEY = "db_version";
    public static final String STEP_KEY_PREFIX = "migration_";

    private final List<StoreMigration> migrations;
    private final StoreJson json;
    private final Clock clock;

    public MigrationRunner() {
        this(StoreMigrations.defaults(), new StoreJson(), Clock.systemUTC());
    }

    public MigrationRunner(List<StoreMigration> migrations, StoreJson json, Clock clock) {
        List<StoreMigration> ordered = new ArrayList<>(migrations);
        ordered.sort(Comparator.comparingInt(StoreMigration::getVersion));
        Set<Integer> versions = new HashSet<>();
        for (StoreMigration migration : ordered) {
            if (migration.getVersion() <= 0 || !versions.add(migration.getVersion())) {
                throw new IllegalArgumentException("Migration versions must be positive and unique: "
                    + migration.getVersion());
            }
        }
        this.migrations = List.copyOf(ordered);
        this.json = json;
        this.clock = clock;
    }

    public int getLatestVersion() {
        return migrations.isEmpty() ? 0 : migrations.get(migrations.size() - 1).getVersion();
    }

    /** Version recorded in the store; 0 when nothing was ever applied. */
    public int getCurrentVersion(AudiobookStore store) {
        Optional<UserPreference> preference = store.getUserPreference(VERSION_KEY);
        if (preference.isEmpty() || preference.get().value() == null) {
            return 0;
        }
        try {
            return json.decode(VERSION_KEY, preference.get().value(), DatabaseVersion.class).version();
        } catch (StoreEncodingException ex) {
            throw new StoreMigrationException("Malformed " + VERSION_KEY + " preference", ex);
        }
    }

    /**
     * Applies every step newer than the recorded version, in order.
     *
     * @return how many steps were applied
     * @throws StoreMigrationException when a step fails; earlier steps stay recorded
     */
    public int runMigrations(AudiobookStore store) {
        int current = getCurrentVersion(store);
        int applied = 0;
        for (StoreMigration migration : migrations) {
            if (migration.getVersion() <= current) {
                continue;
            }
            log.info("Applying migration {} on {}: {}", migration.getVersion(), store.engineName(),
                migration.getDescription());
            try {
                migration.execute(store);
            } catch (RuntimeException ex) {
                log.error("Migration {} failed", migration.getVersion(), ex);
                throw new StoreMigrationException(migration.getVersion(),
                    "Migration " + migration.getVersion() + " (" + migration.getDescription() + ") failed", ex);
            }
            record(store, migration);
            current = migration.getVersion();
            applied++;
        }
        if (applied == 0) {
            log.info("{} store is up to date at version {}", store.engineName(), current);
        } else {
            log.info("Applied {} migrations; {} store is now at version {}", applied, store.engineName(), current);
        }
        return applied;
    }

    private void record(AudiobookStore store, StoreMigration migration) {
        Instant now = StoreQueries.now(clock);
        MigrationRecord entry = new MigrationRecord(migration.getVersion(), migration.getDescription(), now);
        String stepKey = STEP_KEY_PREFIX + migration.getVersion();
        store.setUserPreference(stepKey, json.encodeToString(stepKey, entry));
        store.setUserPreference(VERSION_KEY,
            json.encodeToString(VERSION_KEY, new DatabaseVersion(migration.getVersion(), now)));
    }

    /** Recorded steps sorted by version. Records that cannot be decoded are skipped. */
    public List<MigrationRecord> getMigrationHistory(AudiobookStore store) {
        List<MigrationRecord> history = new ArrayList<>();
        for (UserPreference preference : store.getAllUserPreferences()) {
            if (!preference.key().startsWith(STEP_KEY_PREFIX) || preference.value() == null) {
                continue;
            }
            try {
                history.add(json.decode(preference.key(), preference.value(), MigrationRecord.class));
            } catch (StoreEncodingException ex) {
                log.warn("Skipping malformed migration record {}: {}", preference.key(), ex.getMessage());
            }
        }
        history.sort(Comparator.comparingInt(MigrationRecord::version));
        return history;
    }
}
