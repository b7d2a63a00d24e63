package net.audiobookorganizer.store.sqlite;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import net.audiobookorganizer.migration.LegacyImportPathMigration;
import net.audiobookorganizer.model.ImportPath;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteLegacyImportPathTest {

    @TempDir
    Path tempDir;

    private SqliteAudiobookStore store;

    @BeforeEach
    void setUp() {
        store = new SqliteAudiobookStore(tempDir.resolve("audiobooks.db"), Duration.ofSeconds(5));
        store.jdbcTemplate().execute("""
            CREATE TABLE library_folders (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                path TEXT NOT NULL UNIQUE,
                name TEXT,
                enabled INTEGER,
                created_at TEXT,
                last_scan TEXT,
                book_count INTEGER
            )""");
        store.jdbcTemplate().update(
            "INSERT INTO library_folders (id, path, name, enabled, created_at, last_scan, book_count) VALUES (?, ?, ?, ?, ?, ?, ?)",
            7, "/media/books", "Books", 1, "2023-11-02 09:30:00", null, 12);
        store.jdbcTemplate().update(
            "INSERT INTO library_folders (id, path, name, enabled, created_at, last_scan, book_count) VALUES (?, ?, ?, ?, ?, ?, ?)",
            8, "/media/podcasts", null, 0, null, "2024-01-05 00:00:00", null);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void should_CopyRowsAndDropTable_When_LegacyTableExists() {
        int copied = store.migrateLegacyImportPaths();

        assertThat(copied).isEqualTo(2);
        assertThat(SqliteSchema.tableExists(store.jdbcTemplate(), SqliteSchema.LEGACY_IMPORT_PATH_TABLE)).isFalse();
        assertThat(store.getImportPathById(7)).hasValueSatisfying(path -> {
            assertThat(path.path()).isEqualTo("/media/books");
            assertThat(path.bookCount()).isEqualTo(12);
            assertThat(path.createdAt()).isEqualTo(Instant.parse("2023-11-02T09:30:00Z"));
        });
        assertThat(store.getImportPathByPath("/media/podcasts")).hasValueSatisfying(path -> {
            assertThat(path.name()).isEqualTo("/media/podcasts");
            assertThat(path.enabled()).isFalse();
            assertThat(path.lastScan()).isEqualTo(Instant.parse("2024-01-05T00:00:00Z"));
        });
    }

    @Test
    void should_KeepExistingImportPath_When_PathAlreadyMigrated() {
        ImportPath existing = store.createImportPath("/media/books", "Already here");

        store.migrateLegacyImportPaths();

        assertThat(store.getImportPathByPath("/media/books")).contains(existing);
        assertThat(store.getAllImportPaths()).hasSize(2);
    }

    @Test
    void should_ChangeNothing_When_RunAgain() {
        new LegacyImportPathMigration().execute(store);

        int copied = store.migrateLegacyImportPaths();

        assertThat(copied).isZero();
        assertThat(store.getAllImportPaths()).extracting(ImportPath::id).containsExactlyInAnyOrder(7, 8);
    }
}
