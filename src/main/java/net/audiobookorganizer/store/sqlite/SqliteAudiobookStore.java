package net.audiobookorganizer.store.sqlite;

import static net.audiobookorganizer.store.sqlite.SqliteResultSetSupport.getBooleanOrNull;
import static net.audiobookorganizer.store.sqlite.SqliteResultSetSupport.getInstantOrNull;
import static net.audiobookorganizer.store.sqlite.SqliteResultSetSupport.getIntOrNull;
import static net.audiobookorganizer.store.sqlite.SqliteResultSetSupport.getLongOrNull;
import static net.audiobookorganizer.store.sqlite.SqliteResultSetSupport.toFlag;
import static net.audiobookorganizer.store.sqlite.SqliteResultSetSupport.toMillis;

import jakarta.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.exception.AudiobookStoreException;
import net.audiobookorganizer.exception.StoreConstraintViolationException;
import net.audiobookorganizer.exception.UnsupportedStoreOperationException;
import net.audiobookorganizer.model.Author;
import net.audiobookorganizer.model.Book;
import net.audiobookorganizer.model.BookAuthor;
import net.audiobookorganizer.model.BookNarrator;
import net.audiobookorganizer.model.BookSegment;
import net.audiobookorganizer.model.BookStats;
import net.audiobookorganizer.model.DashboardStats;
import net.audiobookorganizer.model.DoNotImport;
import net.audiobookorganizer.model.DurationMap;
import net.audiobookorganizer.model.ImportPath;
import net.audiobookorganizer.model.MetadataChangeRecord;
import net.audiobookorganizer.model.MetadataFieldState;
import net.audiobookorganizer.model.Narrator;
import net.audiobookorganizer.model.Operation;
import net.audiobookorganizer.model.OperationLog;
import net.audiobookorganizer.model.OperationStatus;
import net.audiobookorganizer.model.PlaybackEvent;
import net.audiobookorganizer.model.PlaybackProgress;
import net.audiobookorganizer.model.Playlist;
import net.audiobookorganizer.model.PlaylistItem;
import net.audiobookorganizer.model.Series;
import net.audiobookorganizer.model.Session;
import net.audiobookorganizer.model.Setting;
import net.audiobookorganizer.model.User;
import net.audiobookorganizer.model.UserPreference;
import net.audiobookorganizer.model.UserPreferenceEntry;
import net.audiobookorganizer.model.UserStats;
import net.audiobookorganizer.model.Work;
import net.audiobookorganizer.store.AudiobookStore;
import net.audiobookorganizer.store.LegacySchemaSupport;
import net.audiobookorganizer.store.StoreJson;
import net.audiobookorganizer.store.StoreQueries;
import net.audiobookorganizer.store.TransactionalStore;
import net.audiobookorganizer.util.IdGenerator;
import net.audiobookorganizer.util.JdbcUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;
import tools.jackson.core.type.TypeReference;

/**
 * {@link AudiobookStore} backed by a single SQLite file through {@link JdbcTemplate}.
 *
 * <p>Unique constraints enforce book paths, import paths and natural-key lookups. Multi-row
 * writes run inside a {@link TransactionTemplate} with IMMEDIATE locking so concurrent writers
 * queue on the busy timeout instead of failing on lock upgrade. Spring's
 * {@link DataAccessException} never escapes: constraint failures become
 * {@link StoreConstraintViolationException}, everything else {@link AudiobookStoreException}.
 *
 * <p>User accounts and sessions are not stored by this engine.
 */
@Slf4j
public class SqliteAudiobookStore implements AudiobookStore, LegacySchemaSupport, TransactionalStore {

    public static final String ENGINE = "sqlite";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String LIVE = "COALESCE(marked_for_deletion, 0) = 0";

    private static final String BOOK_COLUMNS = "id, title, author_id, series_id, series_sequence, file_path, "
        + "original_filename, format, duration, work_id, narrator, edition, language, publisher, print_year, "
        + "audiobook_release_year, isbn10, isbn13, file_hash, file_size, bitrate, codec, sample_rate, channels, "
        + "bit_depth, quality, is_primary_version, version_group_id, version_notes, original_file_hash, "
        + "organized_file_hash, library_state, quantity, marked_for_deletion, marked_for_deletion_at, "
        + "created_at, updated_at";

    private static final String INSERT_BOOK = "INSERT INTO books (" + BOOK_COLUMNS + ") VALUES ("
        + "?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_BOOK = """
        UPDATE books SET title = ?, author_id = ?, series_id = ?, series_sequence = ?, file_path = ?,
            original_filename = ?, format = ?, duration = ?, work_id = ?, narrator = ?, edition = ?,
            language = ?, publisher = ?, print_year = ?, audiobook_release_year = ?, isbn10 = ?, isbn13 = ?,
            file_hash = ?, file_size = ?, bitrate = ?, codec = ?, sample_rate = ?, channels = ?, bit_depth = ?,
            quality = ?, is_primary_version = ?, version_group_id = ?, version_notes = ?,
            original_file_hash = ?, organized_file_hash = ?, library_state = ?, quantity = ?,
            marked_for_deletion = ?, marked_for_deletion_at = ?, created_at = ?, updated_at = ?
        WHERE id = ?""";

    private static final String BOOK_ORDER = " ORDER BY title, id";

    private final Path databaseFile;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final StoreJson json;
    private final Clock clock;

    private final RowMapper<Book> bookRowMapper = this::mapBook;

    public SqliteAudiobookStore(Path databaseFile, Duration busyTimeout) {
        this(databaseFile, busyTimeout, new StoreJson(), Clock.systemUTC());
    }

    public SqliteAudiobookStore(Path databaseFile, Duration busyTimeout, StoreJson json, Clock clock) {
        this.databaseFile = databaseFile;
        this.json = json;
        this.clock = clock;
        SQLiteDataSource dataSource = createDataSource(databaseFile, busyTimeout);
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        inTransaction(() -> {
            SqliteSchema.create(jdbcTemplate);
            return null;
        });
        log.debug("Opened SQLite store at {}", databaseFile);
    }

    private static SQLiteDataSource createDataSource(Path databaseFile, Duration busyTimeout) {
        Path parent = databaseFile.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException ex) {
                throw new AudiobookStoreException("Failed to create directory for " + databaseFile, ex);
            }
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, busyTimeout.toMillis()));
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        config.enforceForeignKeys(false);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath());
        return dataSource;
    }

    JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    @Override
    public String engineName() {
        return ENGINE;
    }

    @Override
    public void close() {
        // connections are opened per call; nothing stays open between operations
        log.debug("Closed SQLite store at {}", databaseFile);
    }

    @Override
    public void reset() {
        inTransaction(() -> {
            SqliteSchema.truncateAll(jdbcTemplate);
            return null;
        });
    }

    // ---- JDBC plumbing ----

    private Instant now() {
        return StoreQueries.now(clock);
    }

    private <T> T inTransaction(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (TransactionException ex) {
            throw new AudiobookStoreException("SQLite transaction failed", ex);
        }
    }

    @Override
    public <T> T executeInTransaction(Supplier<T> work) {
        return inTransaction(work);
    }

    private <T> List<T> query(String sql, RowMapper<T> mapper, Object... args) {
        try {
            return jdbcTemplate.query(sql, mapper, args);
        } catch (DataAccessException ex) {
            throw translate(sql, ex);
        }
    }

    private <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... args) {
        try {
            return JdbcUtils.queryForOptionalObject(jdbcTemplate, sql, mapper, args);
        } catch (DataAccessException ex) {
            throw translate(sql, ex);
        }
    }

    private <T> Optional<T> queryValue(String sql, Class<T> type, Object... args) {
        try {
            return JdbcUtils.queryForOptional(jdbcTemplate, sql, type, args);
        } catch (DataAccessException ex) {
            throw translate(sql, ex);
        }
    }

    private int update(String sql, Object... args) {
        try {
            return jdbcTemplate.update(sql, args);
        } catch (DataAccessException ex) {
            throw translate(sql, ex);
        }
    }

    private long lastInsertId() {
        return queryValue("SELECT last_insert_rowid()", Long.class).orElse(0L);
    }

    private static AudiobookStoreException translate(String sql, DataAccessException ex) {
        if (JdbcUtils.isUniqueViolation(ex)) {
            return new StoreConstraintViolationException("sqlite", "Unique constraint violated: "
                + Objects.requireNonNullElse(ex.getMostSpecificCause().getMessage(), sql), ex);
        }
        return new AudiobookStoreException("SQLite statement failed: " + sql, ex);
    }

    /** SQLite treats a negative LIMIT as unlimited. */
    private static int sqlLimit(int limit) {
        return limit > 0 ? limit : -1;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }

    // ---- Authors ----

    private static Author mapAuthor(ResultSet rs, int rowNum) throws SQLException {
        return new Author(rs.getInt("id"), rs.getString("name"));
    }

    @Override
    public List<Author> getAllAuthors() {
        return query("SELECT id, name FROM authors ORDER BY name COLLATE BINARY, id", SqliteAudiobookStore::mapAuthor);
    }

    @Override
    public Optional<Author> getAuthorById(int id) {
        return queryOne("SELECT id, name FROM authors WHERE id = ?", SqliteAudiobookStore::mapAuthor, id);
    }

    @Override
    public Optional<Author> getAuthorByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return queryOne("SELECT id, name FROM authors WHERE name = ?", SqliteAudiobookStore::mapAuthor, name.trim());
    }

    @Override
    public Author createAuthor(String name) {
        String trimmed = requireText(name, "author name").trim();
        return inTransaction(() -> {
            update("INSERT OR IGNORE INTO authors (name) VALUES (?)", trimmed);
            return getAuthorByName(trimmed)
                .orElseThrow(() -> new AudiobookStoreException("Author vanished after insert: " + trimmed));
        });
    }

    // ---- Narrators ----

    private static Narrator mapNarrator(ResultSet rs, int rowNum) throws SQLException {
        return new Narrator(rs.getInt("id"), rs.getString("name"), getInstantOrNull(rs, "created_at"));
    }

    @Override
    public List<Narrator> getAllNarrators() {
        return query("SELECT * FROM narrators ORDER BY name COLLATE BINARY, id", SqliteAudiobookStore::mapNarrator);
    }

    @Override
    public Optional<Narrator> getNarratorById(int id) {
        return queryOne("SELECT * FROM narrators WHERE id = ?", SqliteAudiobookStore::mapNarrator, id);
    }

    @Override
    public Optional<Narrator> getNarratorByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return queryOne("SELECT * FROM narrators WHERE name = ?", SqliteAudiobookStore::mapNarrator, name.trim());
    }

    @Override
    public Narrator createNarrator(String name) {
        String trimmed = requireText(name, "narrator name").trim();
        return inTransaction(() -> {
            update("INSERT OR IGNORE INTO narrators (name, created_at) VALUES (?, ?)", trimmed, toMillis(now()));
            return getNarratorByName(trimmed)
                .orElseThrow(() -> new AudiobookStoreException("Narrator vanished after insert: " + trimmed));
        });
    }

    // ---- Series ----

    private static Series mapSeries(ResultSet rs, int rowNum) throws SQLException {
        return new Series(rs.getInt("id"), rs.getString("name"), getIntOrNull(rs, "author_id"));
    }

    private static String seriesLookupKey(String name, @Nullable Integer authorId) {
        return StoreQueries.normalizeKey(name) + ":" + (authorId == null ? "nil" : authorId.toString());
    }

    @Override
    public List<Series> getAllSeries() {
        return query("SELECT * FROM series ORDER BY name, id", SqliteAudiobookStore::mapSeries);
    }

    @Override
    public Optional<Series> getSeriesById(int id) {
        return queryOne("SELECT * FROM series WHERE id = ?", SqliteAudiobookStore::mapSeries, id);
    }

    @Override
    public Optional<Series> getSeriesByName(String name, @Nullable Integer authorId) {
        return queryOne("SELECT * FROM series WHERE lookup_key = ?", SqliteAudiobookStore::mapSeries,
            seriesLookupKey(name, authorId));
    }

    @Override
    public Series createSeries(String name, @Nullable Integer authorId) {
        String trimmed = requireText(name, "series name").trim();
        return inTransaction(() -> {
            update("INSERT OR IGNORE INTO series (name, author_id, lookup_key) VALUES (?, ?, ?)",
                trimmed, authorId, seriesLookupKey(trimmed, authorId));
            return getSeriesByName(trimmed, authorId)
                .orElseThrow(() -> new AudiobookStoreException("Series vanished after insert: " + trimmed));
        });
    }

    // ---- Works ----

    private Work mapWork(ResultSet rs, int rowNum) throws SQLException {
        String altTitles = rs.getString("alt_titles");
        List<String> titles = altTitles == null || altTitles.isBlank()
            ? List.of()
            : json.decode("works:" + rs.getString("id"), altTitles, STRING_LIST);
        return new Work(rs.getString("id"), rs.getString("title"), getIntOrNull(rs, "author_id"),
            getIntOrNull(rs, "series_id"), titles, getInstantOrNull(rs, "created_at"), getInstantOrNull(rs, "updated_at"));
    }

    @Override
    public List<Work> getAllWorks() {
        return query("SELECT * FROM works ORDER BY title, id", this::mapWork);
    }

    @Override
    public Optional<Work> getWorkById(String id) {
        return queryOne("SELECT * FROM works WHERE id = ?", this::mapWork, id);
    }

    @Override
    public Work createWork(Work work) {
        requireText(work.title(), "work title");
        String id = work.id() == null || work.id().isBlank()
            ? IdGenerator.ulid()
            : StoreQueries.requireStorableId("work", work.id());
        Instant now = now();
        Work stored = work.withId(id).withTimestamps(now, now);
        if (getWorkById(id).isPresent()) {
            throw StoreConstraintViolationException.duplicate("work", "id", id);
        }
        update("INSERT INTO works (id, title, author_id, series_id, alt_titles, created_at, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)",
            id, stored.title(), stored.authorId(), stored.seriesId(), json.encodeToString("works:" + id, stored.altTitles()),
            toMillis(now), toMillis(now));
        return stored;
    }

    @Override
    public Work updateWork(String id, Work work) {
        requireText(work.title(), "work title");
        return inTransaction(() -> {
            Work old = getWorkById(id).orElseThrow(() -> StoreConstraintViolationException.notFound("work", id));
            Work stored = work.withId(id).withTimestamps(old.createdAt(), now());
            update("UPDATE works SET title = ?, author_id = ?, series_id = ?, alt_titles = ?, updated_at = ? WHERE id = ?",
                stored.title(), stored.authorId(), stored.seriesId(),
                json.encodeToString("works:" + id, stored.altTitles()), toMillis(stored.updatedAt()), id);
            return stored;
        });
    }

    @Override
    public void deleteWork(String id) {
        update("DELETE FROM works WHERE id = ?", id);
    }

    @Override
    public List<Book> getBooksByWorkId(String workId) {
        return query("SELECT * FROM books WHERE work_id = ? AND " + LIVE + BOOK_ORDER, bookRowMapper, workId);
    }

    // ---- Books ----

    private Book mapBook(ResultSet rs, int rowNum) throws SQLException {
        return Book.builder()
            .id(rs.getString("id"))
            .title(rs.getString("title"))
            .authorId(getIntOrNull(rs, "author_id"))
            .seriesId(getIntOrNull(rs, "series_id"))
            .seriesSequence(getIntOrNull(rs, "series_sequence"))
            .filePath(rs.getString("file_path"))
            .originalFilename(rs.getString("original_filename"))
            .format(rs.getString("format"))
            .duration(getIntOrNull(rs, "duration"))
            .workId(rs.getString("work_id"))
            .narrator(rs.getString("narrator"))
            .edition(rs.getString("edition"))
            .language(rs.getString("language"))
            .publisher(rs.getString("publisher"))
            .printYear(getIntOrNull(rs, "print_year"))
            .audiobookReleaseYear(getIntOrNull(rs, "audiobook_release_year"))
            .isbn10(rs.getString("isbn10"))
            .isbn13(rs.getString("isbn13"))
            .fileHash(rs.getString("file_hash"))
            .fileSize(getLongOrNull(rs, "file_size"))
            .bitrate(getIntOrNull(rs, "bitrate"))
            .codec(rs.getString("codec"))
            .sampleRate(getIntOrNull(rs, "sample_rate"))
            .channels(getIntOrNull(rs, "channels"))
            .bitDepth(getIntOrNull(rs, "bit_depth"))
            .quality(rs.getString("quality"))
            .isPrimaryVersion(getBooleanOrNull(rs, "is_primary_version"))
            .versionGroupId(rs.getString("version_group_id"))
            .versionNotes(rs.getString("version_notes"))
            .originalFileHash(rs.getString("original_file_hash"))
            .organizedFileHash(rs.getString("organized_file_hash"))
            .libraryState(rs.getString("library_state"))
            .quantity(getIntOrNull(rs, "quantity"))
            .markedForDeletion(getBooleanOrNull(rs, "marked_for_deletion"))
            .markedForDeletionAt(getInstantOrNull(rs, "marked_for_deletion_at"))
            .createdAt(getInstantOrNull(rs, "created_at"))
            .updatedAt(getInstantOrNull(rs, "updated_at"))
            .build();
    }

    /** Column values in {@link #BOOK_COLUMNS} order, without the leading id. */
    private static List<Object> bookValues(Book book) {
        List<Object> values = new ArrayList<>();
        values.add(book.getTitle());
        values.add(book.getAuthorId());
        values.add(book.getSeriesId());
        values.add(book.getSeriesSequence());
        values.add(book.getFilePath());
        values.add(book.getOriginalFilename());
        values.add(book.getFormat());
        values.add(book.getDuration());
        values.add(book.getWorkId());
        values.add(book.getNarrator());
        values.add(book.getEdition());
        values.add(book.getLanguage());
        values.add(book.getPublisher());
        values.add(book.getPrintYear());
        values.add(book.getAudiobookReleaseYear());
        values.add(book.getIsbn10());
        values.add(book.getIsbn13());
        values.add(book.getFileHash());
        values.add(book.getFileSize());
        values.add(book.getBitrate());
        values.add(book.getCodec());
        values.add(book.getSampleRate());
        values.add(book.getChannels());
        values.add(book.getBitDepth());
        values.add(book.getQuality());
        values.add(toFlag(book.getIsPrimaryVersion()));
        values.add(book.getVersionGroupId());
        values.add(book.getVersionNotes());
        values.add(book.getOriginalFileHash());
        values.add(book.getOrganizedFileHash());
        values.add(book.getLibraryState());
        values.add(book.getQuantity());
        values.add(toFlag(book.getMarkedForDeletion()));
        values.add(toMillis(book.getMarkedForDeletionAt()));
        values.add(toMillis(book.getCreatedAt()));
        values.add(toMillis(book.getUpdatedAt()));
        return values;
    }

    @Override
    public List<Book> getAllBooks(int limit, int offset) {
        return query("SELECT * FROM books WHERE " + LIVE + BOOK_ORDER + " LIMIT ? OFFSET ?", bookRowMapper,
            sqlLimit(limit), Math.max(0, offset));
    }

    @Override
    public Optional<Book> getBookById(String id) {
        return queryOne("SELECT * FROM books WHERE id = ?", bookRowMapper, id);
    }

    @Override
    public Optional<Book> getBookByFilePath(String path) {
        return queryOne("SELECT * FROM books WHERE file_path = ?", bookRowMapper, path);
    }

    @Override
    public Optional<Book> getBookByFileHash(String hash) {
        return queryOne("SELECT * FROM books WHERE file_hash = ? ORDER BY created_at DESC, id DESC LIMIT 1",
            bookRowMapper, hash);
    }

    @Override
    public Optional<Book> getBookByOriginalHash(String hash) {
        return queryOne("SELECT * FROM books WHERE original_file_hash = ? ORDER BY created_at DESC, id DESC LIMIT 1",
            bookRowMapper, hash);
    }

    @Override
    public Optional<Book> getBookByOrganizedHash(String hash) {
        return queryOne("SELECT * FROM books WHERE organized_file_hash = ? ORDER BY created_at DESC, id DESC LIMIT 1",
            bookRowMapper, hash);
    }

    @Override
    public List<Book> getBooksBySeriesId(int seriesId) {
        return query("SELECT * FROM books WHERE series_id = ? AND " + LIVE
            + " ORDER BY series_sequence IS NULL, series_sequence, title, id", bookRowMapper, seriesId);
    }

    @Override
    public List<Book> getBooksByAuthorId(int authorId) {
        return query("SELECT * FROM books WHERE author_id = ? AND " + LIVE + BOOK_ORDER, bookRowMapper, authorId);
    }

    @Override
    public Book createBook(Book book) {
        Book stored = book.copy();
        requireText(stored.getTitle(), "book title");
        requireText(stored.getFilePath(), "book file path");
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(IdGenerator.ulid());
        } else {
            StoreQueries.requireStorableId("book", stored.getId());
        }
        stored.applyCreateDefaults();
        stored.setMarkedForDeletionAt(StoreQueries.millis(stored.getMarkedForDeletionAt()));
        Instant now = now();
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);

        return inTransaction(() -> {
            if (getBookById(stored.getId()).isPresent()) {
                throw StoreConstraintViolationException.duplicate("book", "id", stored.getId());
            }
            if (getBookByFilePath(stored.getFilePath()).isPresent()) {
                throw StoreConstraintViolationException.duplicate("book", "file path", stored.getFilePath());
            }
            List<Object> values = new ArrayList<>();
            values.add(stored.getId());
            values.addAll(bookValues(stored));
            update(INSERT_BOOK, values.toArray());
            return stored.copy();
        });
    }

    @Override
    public Book updateBook(String id, Book book) {
        Book stored = book.copy();
        requireText(stored.getTitle(), "book title");
        requireText(stored.getFilePath(), "book file path");
        return inTransaction(() -> {
            Book old = getBookById(id).orElseThrow(() -> StoreConstraintViolationException.notFound("book", id));
            stored.setId(id);
            stored.setCreatedAt(old.getCreatedAt());
            stored.setUpdatedAt(now());
            stored.setMarkedForDeletionAt(StoreQueries.millis(stored.getMarkedForDeletionAt()));
            if (!Objects.equals(old.getFilePath(), stored.getFilePath())) {
                Optional<Book> owner = getBookByFilePath(stored.getFilePath());
                if (owner.isPresent() && !owner.get().getId().equals(id)) {
                    throw StoreConstraintViolationException.duplicate("book", "file path", stored.getFilePath());
                }
            }
            List<Object> values = bookValues(stored);
            values.add(id);
            update(UPDATE_BOOK, values.toArray());
            return stored.copy();
        });
    }

    @Override
    public void deleteBook(String id) {
        inTransaction(() -> {
            update("DELETE FROM metadata_field_states WHERE book_id = ?", id);
            update("DELETE FROM book_authors WHERE book_id = ?", id);
            update("DELETE FROM book_narrators WHERE book_id = ?", id);
            update("DELETE FROM books WHERE id = ?", id);
            return null;
        });
    }

    @Override
    public List<Book> searchBooks(String query, int limit, int offset) {
        String needle = query == null ? "" : query;
        return query("SELECT * FROM books WHERE " + LIVE + " AND instr(lower(title), lower(?)) > 0"
            + BOOK_ORDER + " LIMIT ? OFFSET ?", bookRowMapper, needle, sqlLimit(limit), Math.max(0, offset));
    }

    @Override
    public int countBooks() {
        return queryValue("SELECT COUNT(*) FROM books WHERE " + LIVE, Integer.class).orElse(0);
    }

    @Override
    public List<List<Book>> getDuplicateBooks() {
        List<Book> candidates = query("""
            SELECT * FROM books
            WHERE COALESCE(marked_for_deletion, 0) = 0
              AND COALESCE(NULLIF(organized_file_hash, ''), NULLIF(file_hash, '')) IN (
                SELECT COALESCE(NULLIF(organized_file_hash, ''), NULLIF(file_hash, '')) AS content_hash
                FROM books
                WHERE COALESCE(marked_for_deletion, 0) = 0
                GROUP BY content_hash
                HAVING content_hash IS NOT NULL AND COUNT(*) > 1)""", bookRowMapper);
        return StoreQueries.groupDuplicates(candidates);
    }

    @Override
    public List<Book> getBooksByVersionGroup(String groupId) {
        return query("SELECT * FROM books WHERE version_group_id = ? AND " + LIVE
                + " ORDER BY CASE WHEN is_primary_version = 1 THEN 0 ELSE 1 END, title, id",
            bookRowMapper, groupId);
    }

    @Override
    public List<Book> listSoftDeletedBooks(int limit, int offset, @Nullable Instant olderThan) {
        StringBuilder sql = new StringBuilder("SELECT * FROM books WHERE marked_for_deletion = 1");
        List<Object> args = new ArrayList<>();
        if (olderThan != null) {
            sql.append(" AND marked_for_deletion_at IS NOT NULL AND marked_for_deletion_at <= ?");
            args.add(olderThan.toEpochMilli());
        }
        sql.append(" ORDER BY marked_for_deletion_at IS NULL, marked_for_deletion_at DESC, title, id LIMIT ? OFFSET ?");
        args.add(sqlLimit(limit));
        args.add(Math.max(0, offset));
        return query(sql.toString(), bookRowMapper, args.toArray());
    }

    @Override
    public Book markBookForDeletion(String id, Instant markedAt) {
        return inTransaction(() -> {
            Instant now = now();
            int updated = update("UPDATE books SET marked_for_deletion = 1, marked_for_deletion_at = ?, updated_at = ? "
                + "WHERE id = ?", toMillis(StoreQueries.millis(markedAt)), toMillis(now), id);
            if (updated == 0) {
                throw StoreConstraintViolationException.notFound("book", id);
            }
            return getBookById(id).orElseThrow(() -> StoreConstraintViolationException.notFound("book", id));
        });
    }

    @Override
    public Book restoreBook(String id) {
        return inTransaction(() -> {
            int updated = update("UPDATE books SET marked_for_deletion = 0, marked_for_deletion_at = NULL, updated_at = ? "
                + "WHERE id = ?", toMillis(now()), id);
            if (updated == 0) {
                throw StoreConstraintViolationException.notFound("book", id);
            }
            return getBookById(id).orElseThrow(() -> StoreConstraintViolationException.notFound("book", id));
        });
    }

    @Override
    public DashboardStats getDashboardStats() {
        return inTransaction(() -> {
            int[] total = new int[1];
            long[] sums = new long[2];
            query("SELECT COUNT(*) AS total, COALESCE(SUM(duration), 0) AS duration, COALESCE(SUM(file_size), 0) AS size "
                + "FROM books WHERE " + LIVE, (rs, rowNum) -> {
                    total[0] = rs.getInt("total");
                    sums[0] = rs.getLong("duration");
                    sums[1] = rs.getLong("size");
                    return null;
                });
            Map<String, Integer> states = distribution(
                "SELECT COALESCE(library_state, '" + Book.DEFAULT_LIBRARY_STATE + "') AS bucket, COUNT(*) AS total "
                    + "FROM books WHERE " + LIVE + " GROUP BY bucket");
            Map<String, Integer> formats = distribution(
                "SELECT COALESCE(codec, '" + StoreQueries.UNKNOWN_CODEC + "') AS bucket, COUNT(*) AS total "
                    + "FROM books WHERE " + LIVE + " GROUP BY bucket");
            return new DashboardStats(total[0], sums[0], sums[1], states, formats);
        });
    }

    private Map<String, Integer> distribution(String sql) {
        Map<String, Integer> buckets = new TreeMap<>();
        query(sql, (rs, rowNum) -> buckets.put(rs.getString("bucket"), rs.getInt("total")));
        return buckets;
    }

    // ---- Book authors / narrators ----

    private static BookAuthor mapBookAuthor(ResultSet rs, int rowNum) throws SQLException {
        return new BookAuthor(rs.getString("book_id"), rs.getInt("author_id"), rs.getString("role"), rs.getInt("position"));
    }

    private static BookNarrator mapBookNarrator(ResultSet rs, int rowNum) throws SQLException {
        return new BookNarrator(rs.getString("book_id"), rs.getInt("narrator_id"), rs.getString("role"), rs.getInt("position"));
    }

    @Override
    public List<BookAuthor> getBookAuthors(String bookId) {
        return query("SELECT * FROM book_authors WHERE book_id = ? ORDER BY position, author_id",
            SqliteAudiobookStore::mapBookAuthor, bookId);
    }

    @Override
    public void setBookAuthors(String bookId, List<BookAuthor> authors) {
        inTransaction(() -> {
            update("DELETE FROM book_authors WHERE book_id = ?", bookId);
            for (BookAuthor link : authors) {
                update("INSERT OR IGNORE INTO book_authors (book_id, author_id, role, position) VALUES (?, ?, ?, ?)",
                    bookId, link.authorId(), link.role(), link.position());
            }
            return null;
        });
    }

    @Override
    public boolean addBookAuthor(BookAuthor link) {
        return update("INSERT OR IGNORE INTO book_authors (book_id, author_id, role, position) VALUES (?, ?, ?, ?)",
            link.bookId(), link.authorId(), link.role(), link.position()) > 0;
    }

    @Override
    public List<Book> getBooksByAuthorIdWithRole(int authorId) {
        return query("SELECT * FROM books WHERE " + LIVE
                + " AND (author_id = ? OR id IN (SELECT book_id FROM book_authors WHERE author_id = ?))" + BOOK_ORDER,
            bookRowMapper, authorId, authorId);
    }

    @Override
    public List<BookNarrator> getBookNarrators(String bookId) {
        return query("SELECT * FROM book_narrators WHERE book_id = ? ORDER BY position, narrator_id",
            SqliteAudiobookStore::mapBookNarrator, bookId);
    }

    @Override
    public void setBookNarrators(String bookId, List<BookNarrator> narrators) {
        inTransaction(() -> {
            update("DELETE FROM book_narrators WHERE book_id = ?", bookId);
            for (BookNarrator link : narrators) {
                update("INSERT OR IGNORE INTO book_narrators (book_id, narrator_id, role, position) VALUES (?, ?, ?, ?)",
                    bookId, link.narratorId(), link.role(), link.position());
            }
            return null;
        });
    }

    @Override
    public boolean addBookNarrator(BookNarrator link) {
        return update("INSERT OR IGNORE INTO book_narrators (book_id, narrator_id, role, position) VALUES (?, ?, ?, ?)",
            link.bookId(), link.narratorId(), link.role(), link.position()) > 0;
    }

    // ---- Import paths ----

    private static ImportPath mapImportPath(ResultSet rs, int rowNum) throws SQLException {
        return new ImportPath(rs.getInt("id"), rs.getString("path"), rs.getString("name"), rs.getInt("enabled") != 0,
            getInstantOrNull(rs, "created_at"), getInstantOrNull(rs, "last_scan"), rs.getInt("book_count"));
    }

    @Override
    public List<ImportPath> getAllImportPaths() {
        return query("SELECT * FROM import_paths ORDER BY name, id", SqliteAudiobookStore::mapImportPath);
    }

    @Override
    public Optional<ImportPath> getImportPathById(int id) {
        return queryOne("SELECT * FROM import_paths WHERE id = ?", SqliteAudiobookStore::mapImportPath, id);
    }

    @Override
    public Optional<ImportPath> getImportPathByPath(String path) {
        return queryOne("SELECT * FROM import_paths WHERE path = ?", SqliteAudiobookStore::mapImportPath, path);
    }

    @Override
    public ImportPath createImportPath(String path, String name) {
        requireText(path, "import path");
        return inTransaction(() -> {
            if (getImportPathByPath(path).isPresent()) {
                throw StoreConstraintViolationException.duplicate("import path", "path", path);
            }
            update("INSERT INTO import_paths (path, name, enabled, created_at, book_count) VALUES (?, ?, 1, ?, 0)",
                path, name, toMillis(now()));
            int id = (int) lastInsertId();
            return getImportPathById(id).orElseThrow(() -> StoreConstraintViolationException.notFound("import path", id));
        });
    }

    @Override
    public ImportPath updateImportPath(int id, ImportPath importPath) {
        requireText(importPath.path(), "import path");
        return inTransaction(() -> {
            ImportPath old = getImportPathById(id)
                .orElseThrow(() -> StoreConstraintViolationException.notFound("import path", id));
            Optional<ImportPath> owner = getImportPathByPath(importPath.path());
            if (owner.isPresent() && owner.get().id() != id) {
                throw StoreConstraintViolationException.duplicate("import path", "path", importPath.path());
            }
            ImportPath stored = new ImportPath(id, importPath.path(), importPath.name(), importPath.enabled(),
                old.createdAt(), StoreQueries.millis(importPath.lastScan()), importPath.bookCount());
            update("UPDATE import_paths SET path = ?, name = ?, enabled = ?, last_scan = ?, book_count = ? WHERE id = ?",
                stored.path(), stored.name(), stored.enabled() ? 1 : 0, toMillis(stored.lastScan()), stored.bookCount(), id);
            return stored;
        });
    }

    @Override
    public void deleteImportPath(int id) {
        update("DELETE FROM import_paths WHERE id = ?", id);
    }

    // ---- Operations ----

    private static Operation mapOperation(ResultSet rs, int rowNum) throws SQLException {
        return new Operation(rs.getString("id"), rs.getString("type"), OperationStatus.fromValue(rs.getString("status")),
            rs.getInt("progress"), rs.getInt("total"), rs.getString("message"), rs.getString("folder_path"),
            getInstantOrNull(rs, "created_at"), getInstantOrNull(rs, "started_at"),
            getInstantOrNull(rs, "completed_at"), rs.getString("error_message"));
    }

    @Override
    public Operation createOperation(String id, String type, @Nullable String folderPath) {
        StoreQueries.requireStorableId("operation", id);
        Operation operation = new Operation(id, type, OperationStatus.PENDING, 0, 0, "", folderPath,
            now(), null, null, null);
        return inTransaction(() -> {
            if (getOperationById(id).isPresent()) {
                throw StoreConstraintViolationException.duplicate("operation", "id", id);
            }
            update("INSERT INTO operations (id, type, status, progress, total, message, folder_path, created_at) "
                    + "VALUES (?, ?, ?, 0, 0, ?, ?, ?)",
                id, type, operation.status().value(), operation.message(), folderPath, toMillis(operation.createdAt()));
            return operation;
        });
    }

    @Override
    public Optional<Operation> getOperationById(String id) {
        return queryOne("SELECT * FROM operations WHERE id = ?", SqliteAudiobookStore::mapOperation, id);
    }

    @Override
    public List<Operation> getRecentOperations(int limit) {
        return query("SELECT * FROM operations ORDER BY created_at DESC, id DESC LIMIT ?",
            SqliteAudiobookStore::mapOperation, sqlLimit(limit));
    }

    @Override
    public void updateOperationStatus(String id, OperationStatus status, int progress, int total, String message) {
        inTransaction(() -> {
            Operation operation = getOperationById(id)
                .orElseThrow(() -> StoreConstraintViolationException.notFound("operation", id));
            saveOperation(operation.withStatus(status, progress, total, message, now()));
            return null;
        });
    }

    @Override
    public void updateOperationError(String id, String errorMessage) {
        inTransaction(() -> {
            Operation operation = getOperationById(id)
                .orElseThrow(() -> StoreConstraintViolationException.notFound("operation", id));
            saveOperation(operation.withError(errorMessage, now()));
            return null;
        });
    }

    private void saveOperation(Operation operation) {
        update("UPDATE operations SET status = ?, progress = ?, total = ?, message = ?, started_at = ?, "
                + "completed_at = ?, error_message = ? WHERE id = ?",
            operation.status().value(), operation.progress(), operation.total(), operation.message(),
            toMillis(operation.startedAt()), toMillis(operation.completedAt()), operation.errorMessage(), operation.id());
    }

    @Override
    public void addOperationLog(String operationId, String level, String message, @Nullable String details) {
        update("INSERT INTO operation_logs (operation_id, level, message, details, created_at) VALUES (?, ?, ?, ?, ?)",
            operationId, level, message, details, toMillis(now()));
    }

    @Override
    public List<OperationLog> getOperationLogs(String operationId) {
        return query("SELECT * FROM operation_logs WHERE operation_id = ? ORDER BY id",
            (rs, rowNum) -> new OperationLog(rs.getInt("id"), rs.getString("operation_id"), rs.getString("level"),
                rs.getString("message"), rs.getString("details"), getInstantOrNull(rs, "created_at")),
            operationId);
    }

    // ---- Global preferences ----

    private static UserPreference mapPreference(ResultSet rs, int rowNum) throws SQLException {
        return new UserPreference(rs.getInt("id"), rs.getString("key"), rs.getString("value"),
            getInstantOrNull(rs, "updated_at"));
    }

    @Override
    public Optional<UserPreference> getUserPreference(String key) {
        return queryOne("SELECT * FROM user_preferences WHERE key = ?", SqliteAudiobookStore::mapPreference, key);
    }

    @Override
    public void setUserPreference(String key, String value) {
        requireText(key, "preference key");
        update("INSERT INTO user_preferences (key, value, updated_at) VALUES (?, ?, ?) "
            + "ON CONFLICT(key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at",
            key, value, toMillis(now()));
    }

    @Override
    public List<UserPreference> getAllUserPreferences() {
        return query("SELECT * FROM user_preferences ORDER BY key", SqliteAudiobookStore::mapPreference);
    }

    // ---- Settings ----

    private static Setting mapSetting(ResultSet rs, int rowNum) throws SQLException {
        return new Setting(rs.getString("key"), rs.getString("value"), rs.getString("type"),
            rs.getInt("is_secret") != 0, getInstantOrNull(rs, "updated_at"));
    }

    @Override
    public Optional<Setting> getSetting(String key) {
        return queryOne("SELECT * FROM settings WHERE key = ?", SqliteAudiobookStore::mapSetting, key);
    }

    @Override
    public void setSetting(Setting setting) {
        requireText(setting.key(), "setting key");
        update("INSERT INTO settings (key, value, type, is_secret, updated_at) VALUES (?, ?, ?, ?, ?) "
                + "ON CONFLICT(key) DO UPDATE SET value = excluded.value, type = excluded.type, "
                + "is_secret = excluded.is_secret, updated_at = excluded.updated_at",
            setting.key(), setting.value(), setting.type(), setting.secret() ? 1 : 0, toMillis(now()));
    }

    @Override
    public List<Setting> getAllSettings() {
        return query("SELECT * FROM settings ORDER BY key", SqliteAudiobookStore::mapSetting);
    }

    @Override
    public void deleteSetting(String key) {
        update("DELETE FROM settings WHERE key = ?", key);
    }

    // ---- Metadata provenance ----

    private static MetadataFieldState mapFieldState(ResultSet rs, int rowNum) throws SQLException {
        return new MetadataFieldState(rs.getString("book_id"), rs.getString("field"), rs.getString("fetched_value"),
            rs.getString("override_value"), rs.getInt("override_locked") != 0, getInstantOrNull(rs, "updated_at"));
    }

    private static MetadataChangeRecord mapChange(ResultSet rs, int rowNum) throws SQLException {
        return new MetadataChangeRecord(rs.getInt("id"), rs.getString("book_id"), rs.getString("field"),
            rs.getString("previous_value"), rs.getString("new_value"), rs.getString("change_type"),
            rs.getString("source"), getInstantOrNull(rs, "changed_at"));
    }

    @Override
    public List<MetadataFieldState> getMetadataFieldStates(String bookId) {
        return query("SELECT * FROM metadata_field_states WHERE book_id = ? ORDER BY field",
            SqliteAudiobookStore::mapFieldState, bookId);
    }

    @Override
    public void upsertMetadataFieldState(MetadataFieldState state) {
        requireText(state.bookId(), "book id");
        requireText(state.field(), "field");
        update("""
            INSERT INTO metadata_field_states (book_id, field, fetched_value, override_value, override_locked, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT(book_id, field) DO UPDATE SET fetched_value = excluded.fetched_value,
                override_value = excluded.override_value, override_locked = excluded.override_locked,
                updated_at = excluded.updated_at""",
            state.bookId(), state.field(), state.fetchedValue(), state.overrideValue(),
            state.overrideLocked() ? 1 : 0, toMillis(now()));
    }

    @Override
    public void deleteMetadataFieldState(String bookId, String field) {
        update("DELETE FROM metadata_field_states WHERE book_id = ? AND field = ?", bookId, field);
    }

    @Override
    public MetadataChangeRecord recordMetadataChange(MetadataChangeRecord change) {
        requireText(change.bookId(), "book id");
        return inTransaction(() -> {
            Instant changedAt = change.changedAt() != null ? StoreQueries.millis(change.changedAt()) : now();
            update("INSERT INTO metadata_changes (book_id, field, previous_value, new_value, change_type, source, changed_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                change.bookId(), change.field(), change.previousValue(), change.newValue(), change.changeType(),
                change.source(), toMillis(changedAt));
            return new MetadataChangeRecord((int) lastInsertId(), change.bookId(), change.field(),
                change.previousValue(), change.newValue(), change.changeType(), change.source(), changedAt);
        });
    }

    @Override
    public List<MetadataChangeRecord> getMetadataChangeHistory(String bookId, String field, int limit) {
        return query("SELECT * FROM metadata_changes WHERE book_id = ? AND field = ? "
            + "ORDER BY changed_at DESC, id DESC LIMIT ?", SqliteAudiobookStore::mapChange, bookId, field, sqlLimit(limit));
    }

    @Override
    public List<MetadataChangeRecord> getBookChangeHistory(String bookId, int limit) {
        return query("SELECT * FROM metadata_changes WHERE book_id = ? ORDER BY changed_at DESC, id DESC LIMIT ?",
            SqliteAudiobookStore::mapChange, bookId, sqlLimit(limit));
    }

    // ---- Playlists ----

    private static Playlist mapPlaylist(ResultSet rs, int rowNum) throws SQLException {
        return new Playlist(rs.getInt("id"), rs.getString("name"), getIntOrNull(rs, "series_id"), rs.getString("file_path"));
    }

    @Override
    public Playlist createPlaylist(String name, @Nullable Integer seriesId, String filePath) {
        requireText(name, "playlist name");
        return inTransaction(() -> {
            update("INSERT INTO playlists (name, series_id, file_path) VALUES (?, ?, ?)", name, seriesId, filePath);
            return new Playlist((int) lastInsertId(), name, seriesId, filePath);
        });
    }

    @Override
    public Optional<Playlist> getPlaylistById(int id) {
        return queryOne("SELECT * FROM playlists WHERE id = ?", SqliteAudiobookStore::mapPlaylist, id);
    }

    @Override
    public Optional<Playlist> getPlaylistBySeriesId(int seriesId) {
        // the newest playlist wins, matching the key-value engine's overwritten series index
        return queryOne("SELECT * FROM playlists WHERE series_id = ? ORDER BY id DESC LIMIT 1",
            SqliteAudiobookStore::mapPlaylist, seriesId);
    }

    @Override
    public PlaylistItem addPlaylistItem(int playlistId, String bookId, int position) {
        return inTransaction(() -> {
            update("INSERT INTO playlist_items (playlist_id, book_id, position) VALUES (?, ?, ?)",
                playlistId, bookId, position);
            return new PlaylistItem((int) lastInsertId(), playlistId, bookId, position);
        });
    }

    @Override
    public List<PlaylistItem> getPlaylistItems(int playlistId) {
        return query("SELECT * FROM playlist_items WHERE playlist_id = ? ORDER BY position, id",
            (rs, rowNum) -> new PlaylistItem(rs.getInt("id"), rs.getInt("playlist_id"), rs.getString("book_id"),
                rs.getInt("position")),
            playlistId);
    }

    // ---- Users & sessions (not stored by this engine) ----

    private UnsupportedStoreOperationException unsupported(String operation) {
        return new UnsupportedStoreOperationException(ENGINE, operation);
    }

    @Override
    public User createUser(String username, String email, String passwordHashAlgo, String passwordHash,
                           List<String> roles, String status) {
        throw unsupported("createUser");
    }

    @Override
    public Optional<User> getUserById(String id) {
        throw unsupported("getUserById");
    }

    @Override
    public Optional<User> getUserByUsername(String username) {
        throw unsupported("getUserByUsername");
    }

    @Override
    public Optional<User> getUserByEmail(String email) {
        throw unsupported("getUserByEmail");
    }

    @Override
    public User updateUser(User user) {
        throw unsupported("updateUser");
    }

    @Override
    public int countUsers() {
        throw unsupported("countUsers");
    }

    @Override
    public Session createSession(String userId, String ip, String userAgent, Duration ttl) {
        throw unsupported("createSession");
    }

    @Override
    public Optional<Session> getSession(String id) {
        throw unsupported("getSession");
    }

    @Override
    public void revokeSession(String id) {
        throw unsupported("revokeSession");
    }

    @Override
    public List<Session> listUserSessions(String userId) {
        return List.of();
    }

    @Override
    public int deleteExpiredSessions(Instant now) {
        return 0;
    }

    // ---- Per-user preferences ----

    private static UserPreferenceEntry mapPreferenceEntry(ResultSet rs, int rowNum) throws SQLException {
        return new UserPreferenceEntry(rs.getString("user_id"), rs.getString("key"), rs.getString("value"),
            getInstantOrNull(rs, "updated_at"));
    }

    @Override
    public void setUserPreferenceForUser(String userId, String key, String value) {
        update("INSERT INTO user_preferences_kv (user_id, key, value, updated_at) VALUES (?, ?, ?, ?) "
                + "ON CONFLICT(user_id, key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at",
            userId, key, value, toMillis(now()));
    }

    @Override
    public Optional<UserPreferenceEntry> getUserPreferenceForUser(String userId, String key) {
        return queryOne("SELECT * FROM user_preferences_kv WHERE user_id = ? AND key = ?",
            SqliteAudiobookStore::mapPreferenceEntry, userId, key);
    }

    @Override
    public List<UserPreferenceEntry> getAllPreferencesForUser(String userId) {
        return query("SELECT * FROM user_preferences_kv WHERE user_id = ? ORDER BY key",
            SqliteAudiobookStore::mapPreferenceEntry, userId);
    }

    // ---- Segments ----

    private static BookSegment mapSegment(ResultSet rs, int rowNum) throws SQLException {
        return BookSegment.builder()
            .id(rs.getString("id"))
            .bookId(rs.getString("book_id"))
            .filePath(rs.getString("file_path"))
            .format(rs.getString("format"))
            .sizeBytes(rs.getLong("size_bytes"))
            .durationSec(rs.getInt("duration_sec"))
            .trackNumber(getIntOrNull(rs, "track_number"))
            .active(rs.getInt("active") != 0)
            .supersededBy(rs.getString("superseded_by"))
            .createdAt(getInstantOrNull(rs, "created_at"))
            .updatedAt(getInstantOrNull(rs, "updated_at"))
            .version(rs.getInt("version"))
            .build();
    }

    private BookSegment insertSegment(String bookId, BookSegment segment, Instant now) {
        requireText(segment.filePath(), "segment file path");
        BookSegment stored = segment.toBuilder()
            .id(IdGenerator.ulid())
            .bookId(bookId)
            .active(true)
            .supersededBy(null)
            .createdAt(now)
            .updatedAt(now)
            .version(1)
            .build();
        update("""
            INSERT INTO book_segments (id, book_id, file_path, format, size_bytes, duration_sec, track_number, active,
                superseded_by, created_at, updated_at, version)
            VALUES (?, ?, ?, ?, ?, ?, ?, 1, NULL, ?, ?, 1)""",
            stored.id(), bookId, stored.filePath(), stored.format(), stored.sizeBytes(), stored.durationSec(),
            stored.trackNumber(), toMillis(now), toMillis(now));
        return stored;
    }

    private void writeDurationMap(String bookId) {
        DurationMap map = StoreQueries.computeDurationMap(bookId, listBookSegments(bookId));
        update("INSERT INTO duration_maps (book_id, payload) VALUES (?, ?) "
                + "ON CONFLICT(book_id) DO UPDATE SET payload = excluded.payload",
            bookId, json.encodeToString("duration_maps:" + bookId, map));
    }

    @Override
    public BookSegment createBookSegment(String bookId, BookSegment segment) {
        return inTransaction(() -> {
            BookSegment stored = insertSegment(bookId, segment, now());
            writeDurationMap(bookId);
            return stored;
        });
    }

    @Override
    public Optional<BookSegment> getBookSegment(String segmentId) {
        return queryOne("SELECT * FROM book_segments WHERE id = ?", SqliteAudiobookStore::mapSegment, segmentId);
    }

    @Override
    public List<BookSegment> listBookSegments(String bookId) {
        return query("SELECT * FROM book_segments WHERE book_id = ? ORDER BY id", SqliteAudiobookStore::mapSegment, bookId);
    }

    @Override
    public BookSegment mergeBookSegments(String bookId, BookSegment merged, List<String> supersededIds) {
        return inTransaction(() -> {
            Instant now = now();
            Map<String, BookSegment> segments = new LinkedHashMap<>();
            for (BookSegment segment : listBookSegments(bookId)) {
                segments.put(segment.id(), segment);
            }
            for (String id : supersededIds) {
                if (!segments.containsKey(id)) {
                    throw StoreConstraintViolationException.notFound("segment of book " + bookId, id);
                }
            }
            BookSegment stored = insertSegment(bookId, merged, now);
            for (String id : supersededIds) {
                update("UPDATE book_segments SET active = 0, superseded_by = ?, updated_at = ? WHERE id = ?",
                    stored.id(), toMillis(now), id);
            }
            writeDurationMap(bookId);
            return stored;
        });
    }

    @Override
    public Optional<DurationMap> getDurationMap(String bookId) {
        return queryValue("SELECT payload FROM duration_maps WHERE book_id = ?", String.class, bookId)
            .map(payload -> json.decode("duration_maps:" + bookId, payload, DurationMap.class));
    }

    // ---- Playback ----

    @Override
    public void addPlaybackEvent(PlaybackEvent event) {
        Instant createdAt = event.createdAt() != null ? StoreQueries.millis(event.createdAt()) : now();
        update("INSERT INTO playback_events (user_id, book_id, segment_id, position_sec, event_type, created_at) "
                + "VALUES (?, ?, ?, ?, ?, ?)",
            event.userId(), event.bookId(), event.segmentId(), event.positionSec(), event.eventType(), toMillis(createdAt));
    }

    @Override
    public List<PlaybackEvent> listPlaybackEvents(String userId, String bookId, int limit) {
        return query("SELECT * FROM playback_events WHERE user_id = ? AND book_id = ? "
                + "ORDER BY created_at DESC, id DESC LIMIT ?",
            (rs, rowNum) -> new PlaybackEvent(rs.getString("user_id"), rs.getString("book_id"),
                rs.getString("segment_id"), rs.getInt("position_sec"), rs.getString("event_type"),
                getInstantOrNull(rs, "created_at")),
            userId, bookId, sqlLimit(limit));
    }

    @Override
    public void updatePlaybackProgress(PlaybackProgress progress) {
        Instant updatedAt = progress.updatedAt() != null ? StoreQueries.millis(progress.updatedAt()) : now();
        update("""
            INSERT INTO playback_progress (user_id, book_id, segment_id, position_sec, percent_complete, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT(user_id, book_id) DO UPDATE SET segment_id = excluded.segment_id,
                position_sec = excluded.position_sec, percent_complete = excluded.percent_complete,
                updated_at = excluded.updated_at""",
            progress.userId(), progress.bookId(), progress.segmentId(), progress.positionSec(),
            progress.percentComplete(), toMillis(updatedAt));
    }

    @Override
    public Optional<PlaybackProgress> getPlaybackProgress(String userId, String bookId) {
        return queryOne("SELECT * FROM playback_progress WHERE user_id = ? AND book_id = ?",
            (rs, rowNum) -> new PlaybackProgress(rs.getString("user_id"), rs.getString("book_id"),
                rs.getString("segment_id"), rs.getInt("position_sec"), rs.getDouble("percent_complete"),
                getInstantOrNull(rs, "updated_at")),
            userId, bookId);
    }

    // ---- Stats ----

    @Override
    public void incrementBookPlayStats(String bookId, int seconds) {
        update("INSERT INTO book_stats (book_id, play_count, listen_seconds) VALUES (?, 1, ?) "
                + "ON CONFLICT(book_id) DO UPDATE SET play_count = play_count + 1, "
                + "listen_seconds = listen_seconds + excluded.listen_seconds",
            bookId, seconds);
    }

    @Override
    public BookStats getBookStats(String bookId) {
        return queryOne("SELECT * FROM book_stats WHERE book_id = ?",
                (rs, rowNum) -> new BookStats(bookId, rs.getLong("play_count"), rs.getLong("listen_seconds")), bookId)
            .orElse(new BookStats(bookId, 0L, 0L));
    }

    @Override
    public void incrementUserListenStats(String userId, int seconds) {
        update("INSERT INTO user_stats (user_id, listen_seconds) VALUES (?, ?) "
                + "ON CONFLICT(user_id) DO UPDATE SET listen_seconds = listen_seconds + excluded.listen_seconds",
            userId, seconds);
    }

    @Override
    public UserStats getUserStats(String userId) {
        return queryOne("SELECT * FROM user_stats WHERE user_id = ?",
                (rs, rowNum) -> new UserStats(userId, rs.getLong("listen_seconds")), userId)
            .orElse(new UserStats(userId, 0L));
    }

    // ---- Do-not-import blocklist ----

    private static DoNotImport mapBlocked(ResultSet rs, int rowNum) throws SQLException {
        return new DoNotImport(rs.getString("hash"), rs.getString("reason"), getInstantOrNull(rs, "created_at"));
    }

    @Override
    public boolean isHashBlocked(String hash) {
        return queryValue("SELECT COUNT(*) FROM do_not_import WHERE hash = ?", Integer.class, hash).orElse(0) > 0;
    }

    @Override
    public void addBlockedHash(String hash, String reason) {
        requireText(hash, "hash");
        update("INSERT INTO do_not_import (hash, reason, created_at) VALUES (?, ?, ?) "
                + "ON CONFLICT(hash) DO UPDATE SET reason = excluded.reason, created_at = excluded.created_at",
            hash, reason, toMillis(now()));
    }

    @Override
    public void removeBlockedHash(String hash) {
        update("DELETE FROM do_not_import WHERE hash = ?", hash);
    }

    @Override
    public List<DoNotImport> getAllBlockedHashes() {
        return query("SELECT * FROM do_not_import ORDER BY hash", SqliteAudiobookStore::mapBlocked);
    }

    @Override
    public Optional<DoNotImport> getBlockedHashByHash(String hash) {
        return queryOne("SELECT * FROM do_not_import WHERE hash = ?", SqliteAudiobookStore::mapBlocked, hash);
    }

    // ---- Legacy schema ----

    /**
     * Copies rows of the pre-rename {@code library_folders} table into {@code import_paths},
     * keeping ids and paths, then drops the legacy table. Rows whose id or path already exists
     * are left alone. Text timestamps written by older releases are converted to epoch millis.
     */
    @Override
    public int migrateLegacyImportPaths() {
        return inTransaction(() -> {
            if (!SqliteSchema.tableExists(jdbcTemplate, SqliteSchema.LEGACY_IMPORT_PATH_TABLE)) {
                return 0;
            }
            long nowMillis = now().toEpochMilli();
            int copied = update("""
                INSERT OR IGNORE INTO import_paths (id, path, name, enabled, created_at, last_scan, book_count)
                SELECT id, path, COALESCE(name, path), COALESCE(enabled, 1),
                    CASE typeof(created_at)
                        WHEN 'integer' THEN created_at
                        WHEN 'text' THEN COALESCE(CAST(strftime('%s', created_at) AS INTEGER) * 1000, ?)
                        ELSE ? END,
                    CASE typeof(last_scan)
                        WHEN 'integer' THEN last_scan
                        WHEN 'text' THEN CAST(strftime('%s', last_scan) AS INTEGER) * 1000
                        ELSE NULL END,
                    COALESCE(book_count, 0)
                FROM library_folders""", nowMillis, nowMillis);
            update("DROP TABLE library_folders");
            log.debug("Copied {} rows from legacy library_folders", copied);
            return copied;
        });
    }
}
