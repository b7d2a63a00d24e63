package net.audiobookorganizer.store.sqlite;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * DDL for the relational engine. Tables are created if missing; book columns introduced after
 * the first release are added one by one with {@code ALTER TABLE} so older database files
 * upgrade in place.
 */
@Slf4j
final class SqliteSchema {

    static final String LEGACY_IMPORT_PATH_TABLE = "library_folders";

    private static final List<String> TABLES = List.of(
        """
        CREATE TABLE IF NOT EXISTS authors (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            name TEXT NOT NULL UNIQUE COLLATE NOCASE
        )""",
        """
        CREATE TABLE IF NOT EXISTS narrators (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            name TEXT NOT NULL UNIQUE COLLATE NOCASE,
            created_at INTEGER NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS series (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            name TEXT NOT NULL,
            author_id INTEGER,
            lookup_key TEXT NOT NULL UNIQUE
        )""",
        """
        CREATE TABLE IF NOT EXISTS works (
            id TEXT PRIMARY KEY,
            title TEXT NOT NULL,
            author_id INTEGER,
            series_id INTEGER,
            alt_titles TEXT,
            created_at INTEGER NOT NULL,
            updated_at INTEGER NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS books (
            id TEXT PRIMARY KEY,
            title TEXT NOT NULL,
            author_id INTEGER,
            series_id INTEGER,
            series_sequence INTEGER,
            file_path TEXT NOT NULL UNIQUE,
            format TEXT,
            duration INTEGER,
            created_at INTEGER NOT NULL,
            updated_at INTEGER NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS book_authors (
            book_id TEXT NOT NULL,
            author_id INTEGER NOT NULL,
            role TEXT NOT NULL,
            position INTEGER NOT NULL DEFAULT 0,
            UNIQUE (book_id, author_id, role)
        )""",
        """
        CREATE TABLE IF NOT EXISTS book_narrators (
            book_id TEXT NOT NULL,
            narrator_id INTEGER NOT NULL,
            role TEXT NOT NULL,
            position INTEGER NOT NULL DEFAULT 0,
            UNIQUE (book_id, narrator_id, role)
        )""",
        """
        CREATE TABLE IF NOT EXISTS import_paths (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            path TEXT NOT NULL UNIQUE,
            name TEXT NOT NULL,
            enabled INTEGER NOT NULL DEFAULT 1,
            created_at INTEGER NOT NULL,
            last_scan INTEGER,
            book_count INTEGER NOT NULL DEFAULT 0
        )""",
        """
        CREATE TABLE IF NOT EXISTS operations (
            id TEXT PRIMARY KEY,
            type TEXT NOT NULL,
            status TEXT NOT NULL,
            progress INTEGER NOT NULL DEFAULT 0,
            total INTEGER NOT NULL DEFAULT 0,
            message TEXT,
            folder_path TEXT,
            created_at INTEGER NOT NULL,
            started_at INTEGER,
            completed_at INTEGER,
            error_message TEXT
        )""",
        """
        CREATE TABLE IF NOT EXISTS operation_logs (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            operation_id TEXT NOT NULL,
            level TEXT NOT NULL,
            message TEXT NOT NULL,
            details TEXT,
            created_at INTEGER NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS user_preferences (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            key TEXT NOT NULL UNIQUE,
            value TEXT,
            updated_at INTEGER NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS settings (
            key TEXT PRIMARY KEY,
            value TEXT,
            type TEXT,
            is_secret INTEGER NOT NULL DEFAULT 0,
            updated_at INTEGER NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS metadata_field_states (
            book_id TEXT NOT NULL,
            field TEXT NOT NULL,
            fetched_value TEXT,
            override_value TEXT,
            override_locked INTEGER NOT NULL DEFAULT 0,
            updated_at INTEGER NOT NULL,
            PRIMARY KEY (book_id, field)
        )""",
        """
        CREATE TABLE IF NOT EXISTS metadata_changes (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            book_id TEXT NOT NULL,
            field TEXT NOT NULL,
            previous_value TEXT,
            new_value TEXT,
            change_type TEXT NOT NULL,
            source TEXT,
            changed_at INTEGER NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS playlists (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            name TEXT NOT NULL,
            series_id INTEGER,
            file_path TEXT
        )""",
        """
        CREATE TABLE IF NOT EXISTS playlist_items (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            playlist_id INTEGER NOT NULL,
            book_id TEXT NOT NULL,
            position INTEGER NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS user_preferences_kv (
            user_id TEXT NOT NULL,
            key TEXT NOT NULL,
            value TEXT,
            updated_at INTEGER NOT NULL,
            PRIMARY KEY (user_id, key)
        )""",
        """
        CREATE TABLE IF NOT EXISTS book_segments (
            id TEXT PRIMARY KEY,
            book_id TEXT NOT NULL,
            file_path TEXT NOT NULL,
            format TEXT,
            size_bytes INTEGER NOT NULL DEFAULT 0,
            duration_sec INTEGER NOT NULL DEFAULT 0,
            track_number INTEGER,
            active INTEGER NOT NULL DEFAULT 1,
            superseded_by TEXT,
            created_at INTEGER NOT NULL,
            updated_at INTEGER NOT NULL,
            version INTEGER NOT NULL DEFAULT 1
        )""",
        """
        CREATE TABLE IF NOT EXISTS duration_maps (
            book_id TEXT PRIMARY KEY,
            payload TEXT NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS playback_events (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            user_id TEXT NOT NULL,
            book_id TEXT NOT NULL,
            segment_id TEXT,
            position_sec INTEGER NOT NULL DEFAULT 0,
            event_type TEXT NOT NULL,
            created_at INTEGER NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS playback_progress (
            user_id TEXT NOT NULL,
            book_id TEXT NOT NULL,
            segment_id TEXT,
            position_sec INTEGER NOT NULL DEFAULT 0,
            percent_complete REAL NOT NULL DEFAULT 0,
            updated_at INTEGER NOT NULL,
            PRIMARY KEY (user_id, book_id)
        )""",
        """
        CREATE TABLE IF NOT EXISTS book_stats (
            book_id TEXT PRIMARY KEY,
            play_count INTEGER NOT NULL DEFAULT 0,
            listen_seconds INTEGER NOT NULL DEFAULT 0
        )""",
        """
        CREATE TABLE IF NOT EXISTS user_stats (
            user_id TEXT PRIMARY KEY,
            listen_seconds INTEGER NOT NULL DEFAULT 0
        )""",
        """
        CREATE TABLE IF NOT EXISTS do_not_import (
            hash TEXT PRIMARY KEY,
            reason TEXT,
            created_at INTEGER NOT NULL
        )"""
    );

    /** Book columns added after the base table, in the order they were introduced. */
    private static final Map<String, String> EXTENDED_BOOK_COLUMNS = extendedBookColumns();

    private static final List<String> INDEXES = List.of(
        "CREATE INDEX IF NOT EXISTS idx_books_author_id ON books(author_id)",
        "CREATE INDEX IF NOT EXISTS idx_books_series_id ON books(series_id)",
        "CREATE INDEX IF NOT EXISTS idx_books_title ON books(title)",
        "CREATE INDEX IF NOT EXISTS idx_books_work_id ON books(work_id)",
        "CREATE INDEX IF NOT EXISTS idx_books_file_hash ON books(file_hash)",
        "CREATE INDEX IF NOT EXISTS idx_books_original_file_hash ON books(original_file_hash)",
        "CREATE INDEX IF NOT EXISTS idx_books_organized_file_hash ON books(organized_file_hash)",
        "CREATE INDEX IF NOT EXISTS idx_books_version_group_id ON books(version_group_id)",
        "CREATE INDEX IF NOT EXISTS idx_books_marked_for_deletion ON books(marked_for_deletion)",
        "CREATE INDEX IF NOT EXISTS idx_book_authors_author_id ON book_authors(author_id)",
        "CREATE INDEX IF NOT EXISTS idx_operation_logs_operation_id ON operation_logs(operation_id)",
        "CREATE INDEX IF NOT EXISTS idx_metadata_changes_book_field ON metadata_changes(book_id, field)",
        "CREATE INDEX IF NOT EXISTS idx_playlist_items_playlist_id ON playlist_items(playlist_id)",
        "CREATE INDEX IF NOT EXISTS idx_book_segments_book_id ON book_segments(book_id)",
        "CREATE INDEX IF NOT EXISTS idx_playback_events_user_book ON playback_events(user_id, book_id, created_at)"
    );

    /** Tables emptied by {@link #truncateAll}, children before parents. */
    static final List<String> DATA_TABLES = List.of(
        "book_authors", "book_narrators", "metadata_field_states", "metadata_changes", "playlist_items",
        "playlists", "operation_logs", "operations", "book_segments", "duration_maps", "playback_events",
        "playback_progress", "book_stats", "user_stats", "do_not_import", "user_preferences_kv",
        "user_preferences", "settings", "import_paths", "books", "works", "series", "narrators", "authors"
    );

    private SqliteSchema() {
    }

    private static Map<String, String> extendedBookColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("original_filename", "TEXT");
        columns.put("work_id", "TEXT");
        columns.put("narrator", "TEXT");
        columns.put("edition", "TEXT");
        columns.put("language", "TEXT");
        columns.put("publisher", "TEXT");
        columns.put("print_year", "INTEGER");
        columns.put("audiobook_release_year", "INTEGER");
        columns.put("isbn10", "TEXT");
        columns.put("isbn13", "TEXT");
        columns.put("file_hash", "TEXT");
        columns.put("file_size", "INTEGER");
        columns.put("bitrate", "INTEGER");
        columns.put("codec", "TEXT");
        columns.put("sample_rate", "INTEGER");
        columns.put("channels", "INTEGER");
        columns.put("bit_depth", "INTEGER");
        columns.put("quality", "TEXT");
        columns.put("is_primary_version", "INTEGER DEFAULT 1");
        columns.put("version_group_id", "TEXT");
        columns.put("version_notes", "TEXT");
        columns.put("original_file_hash", "TEXT");
        columns.put("organized_file_hash", "TEXT");
        columns.put("library_state", "TEXT DEFAULT 'imported'");
        columns.put("quantity", "INTEGER DEFAULT 1");
        columns.put("marked_for_deletion", "INTEGER DEFAULT 0");
        columns.put("marked_for_deletion_at", "INTEGER");
        return columns;
    }

    static void create(JdbcTemplate jdbcTemplate) {
        for (String ddl : TABLES) {
            jdbcTemplate.execute(ddl);
        }
        ensureExtendedBookColumns(jdbcTemplate);
        for (String ddl : INDEXES) {
            jdbcTemplate.execute(ddl);
        }
    }

    /** Adds every extended book column the table does not have yet; returns how many were added. */
    static int ensureExtendedBookColumns(JdbcTemplate jdbcTemplate) {
        Set<String> existing = columnNames(jdbcTemplate, "books");
        int added = 0;
        for (Map.Entry<String, String> column : EXTENDED_BOOK_COLUMNS.entrySet()) {
            if (existing.contains(column.getKey())) {
                continue;
            }
            jdbcTemplate.execute("ALTER TABLE books ADD COLUMN " + column.getKey() + " " + column.getValue());
            log.debug("Added books.{} column", column.getKey());
            added++;
        }
        return added;
    }

    static Set<String> columnNames(JdbcTemplate jdbcTemplate, String table) {
        return new HashSet<>(jdbcTemplate.query("PRAGMA table_info(" + table + ")",
            (rs, rowNum) -> rs.getString("name")));
    }

    static boolean tableExists(JdbcTemplate jdbcTemplate, String table) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?", Integer.class, table);
        return count != null && count > 0;
    }

    static void truncateAll(JdbcTemplate jdbcTemplate) {
        for (String table : DATA_TABLES) {
            jdbcTemplate.update("DELETE FROM " + table);
        }
        if (tableExists(jdbcTemplate, "sqlite_sequence")) {
            jdbcTemplate.update("DELETE FROM sqlite_sequence");
        }
    }
}
