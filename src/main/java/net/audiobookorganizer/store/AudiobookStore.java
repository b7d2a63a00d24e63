package net.audiobookorganizer.store;

import jakarta.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
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

/**
 * Storage contract shared by the SQLite and RocksDB engines.
 *
 * <p>Conventions every implementation follows:
 * <ul>
 *   <li>Single-entity lookups return {@link Optional#empty()} when nothing matches; they never
 *       throw for a missing entity.</li>
 *   <li>Unique-key collisions and updates of missing entities throw
 *       {@link net.audiobookorganizer.exception.StoreConstraintViolationException}.</li>
 *   <li>Listings documented with an order return that order in both engines.</li>
 *   <li>Ordinary book queries hide soft-deleted books; {@link #listSoftDeletedBooks} is the only
 *       listing that returns them.</li>
 *   <li>Engine failures surface as {@link net.audiobookorganizer.exception.AudiobookStoreException}.</li>
 * </ul>
 */
public interface AudiobookStore extends AutoCloseable {

    /** Short engine name used in logs and unsupported-operation errors. */
    String engineName();

    @Override
    void close();

    /** Removes all data and restarts every id counter. */
    void reset();

    // Authors

    /** All authors ordered by name. */
    List<Author> getAllAuthors();

    Optional<Author> getAuthorById(int id);

    /** Case-insensitive lookup. */
    Optional<Author> getAuthorByName(String name);

    /** Returns the existing author when one with the same name (case-insensitive) exists. */
    Author createAuthor(String name);

    // Narrators

    List<Narrator> getAllNarrators();

    Optional<Narrator> getNarratorById(int id);

    Optional<Narrator> getNarratorByName(String name);

    Narrator createNarrator(String name);

    // Series

    /** All series ordered by name. */
    List<Series> getAllSeries();

    Optional<Series> getSeriesById(int id);

    Optional<Series> getSeriesByName(String name, @Nullable Integer authorId);

    /** Returns the existing series when (name, author) is already taken. */
    Series createSeries(String name, @Nullable Integer authorId);

    // Works

    /** All works ordered by title. */
    List<Work> getAllWorks();

    Optional<Work> getWorkById(String id);

    /** Assigns a ULID when the work has no id. */
    Work createWork(Work work);

    Work updateWork(String id, Work work);

    void deleteWork(String id);

    List<Book> getBooksByWorkId(String workId);

    // Books

    /** Non-deleted books ordered by title. A non-positive limit means no limit. */
    List<Book> getAllBooks(int limit, int offset);

    /** Returns the book even when it is soft-deleted. */
    Optional<Book> getBookById(String id);

    Optional<Book> getBookByFilePath(String path);

    Optional<Book> getBookByFileHash(String hash);

    Optional<Book> getBookByOriginalHash(String hash);

    Optional<Book> getBookByOrganizedHash(String hash);

    /** Non-deleted books of a series ordered by sequence (missing last), then title. */
    List<Book> getBooksBySeriesId(int seriesId);

    /** Non-deleted books whose direct author reference matches, ordered by title. */
    List<Book> getBooksByAuthorId(int authorId);

    /**
     * Creates a book, assigning a ULID when absent. Unset {@code isPrimaryVersion},
     * {@code libraryState}, {@code quantity} and {@code markedForDeletion} get their defaults.
     */
    Book createBook(Book book);

    /** Replaces every field; {@code createdAt} is preserved and {@code updatedAt} refreshed. */
    Book updateBook(String id, Book book);

    /** Hard delete: record, secondary indexes, metadata state and author/narrator links. */
    void deleteBook(String id);

    /** Case-insensitive title substring match over non-deleted books, ordered by title. */
    List<Book> searchBooks(String query, int limit, int offset);

    int countBooks();

    /**
     * Groups of at least two non-deleted books sharing a content hash (organized hash, falling
     * back to the file hash). Each group is ordered by file path; groups are ordered by their
     * first member's path.
     */
    List<List<Book>> getDuplicateBooks();

    /** Non-deleted members of a version group, primary version first, then by title. */
    List<Book> getBooksByVersionGroup(String groupId);

    /**
     * Soft-deleted books, most recently marked first (unknown mark time last).
     *
     * @param olderThan when present, only books marked at or before this instant
     */
    List<Book> listSoftDeletedBooks(int limit, int offset, @Nullable Instant olderThan);

    Book markBookForDeletion(String id, Instant markedAt);

    Book restoreBook(String id);

    DashboardStats getDashboardStats();

    // Book authors / narrators

    /** Author links ordered by position. */
    List<BookAuthor> getBookAuthors(String bookId);

    /** Replaces the book's author links. */
    void setBookAuthors(String bookId, List<BookAuthor> authors);

    /** Adds one link unless (book, author, role) is already linked; returns whether it was added. */
    boolean addBookAuthor(BookAuthor link);

    /** Books linked to the author directly or through an author link row, ordered by title. */
    List<Book> getBooksByAuthorIdWithRole(int authorId);

    List<BookNarrator> getBookNarrators(String bookId);

    void setBookNarrators(String bookId, List<BookNarrator> narrators);

    boolean addBookNarrator(BookNarrator link);

    // Import paths

    /** Ordered by display name. */
    List<ImportPath> getAllImportPaths();

    Optional<ImportPath> getImportPathById(int id);

    Optional<ImportPath> getImportPathByPath(String path);

    /** Fails with a constraint violation when the path is already registered. */
    ImportPath createImportPath(String path, String name);

    ImportPath updateImportPath(int id, ImportPath importPath);

    void deleteImportPath(int id);

    // Operations

    Operation createOperation(String id, String type, @Nullable String folderPath);

    Optional<Operation> getOperationById(String id);

    /** Newest first. */
    List<Operation> getRecentOperations(int limit);

    /** Sets {@code startedAt} on RUNNING and {@code completedAt} on COMPLETED/FAILED. */
    void updateOperationStatus(String id, OperationStatus status, int progress, int total, String message);

    /** Marks the operation failed with the given error message. */
    void updateOperationError(String id, String errorMessage);

    void addOperationLog(String operationId, String level, String message, @Nullable String details);

    /** In insertion order. */
    List<OperationLog> getOperationLogs(String operationId);

    // Global preferences

    Optional<UserPreference> getUserPreference(String key);

    void setUserPreference(String key, String value);

    /** Ordered by key. */
    List<UserPreference> getAllUserPreferences();

    // Settings (values stored as given; see SettingsService for encryption)

    Optional<Setting> getSetting(String key);

    void setSetting(Setting setting);

    List<Setting> getAllSettings();

    void deleteSetting(String key);

    // Metadata provenance

    /** Ordered by field name. */
    List<MetadataFieldState> getMetadataFieldStates(String bookId);

    void upsertMetadataFieldState(MetadataFieldState state);

    void deleteMetadataFieldState(String bookId, String field);

    MetadataChangeRecord recordMetadataChange(MetadataChangeRecord change);

    /** Newest first; a non-positive limit means no limit. */
    List<MetadataChangeRecord> getMetadataChangeHistory(String bookId, String field, int limit);

    List<MetadataChangeRecord> getBookChangeHistory(String bookId, int limit);

    // Playlists

    Playlist createPlaylist(String name, @Nullable Integer seriesId, String filePath);

    Optional<Playlist> getPlaylistById(int id);

    Optional<Playlist> getPlaylistBySeriesId(int seriesId);

    PlaylistItem addPlaylistItem(int playlistId, String bookId, int position);

    /** Ordered by position. */
    List<PlaylistItem> getPlaylistItems(int playlistId);

    // Users & sessions

    User createUser(String username, String email, String passwordHashAlgo, String passwordHash,
                    List<String> roles, String status);

    Optional<User> getUserById(String id);

    Optional<User> getUserByUsername(String username);

    Optional<User> getUserByEmail(String email);

    User updateUser(User user);

    int countUsers();

    Session createSession(String userId, String ip, String userAgent, Duration ttl);

    Optional<Session> getSession(String id);

    void revokeSession(String id);

    List<Session> listUserSessions(String userId);

    /** Deletes sessions that are revoked or expired at {@code now}; returns how many. */
    int deleteExpiredSessions(Instant now);

    // Per-user preferences

    void setUserPreferenceForUser(String userId, String key, String value);

    Optional<UserPreferenceEntry> getUserPreferenceForUser(String userId, String key);

    /** Ordered by key. */
    List<UserPreferenceEntry> getAllPreferencesForUser(String userId);

    // Segments

    /** Stores the segment as active with a fresh id and recomputes the book's duration map. */
    BookSegment createBookSegment(String bookId, BookSegment segment);

    Optional<BookSegment> getBookSegment(String segmentId);

    /** Every segment of the book, active or not, in creation order. */
    List<BookSegment> listBookSegments(String bookId);

    /**
     * Creates {@code merged} as a new active segment, deactivates every superseded segment and
     * points it at the merged one, then recomputes the duration map.
     */
    BookSegment mergeBookSegments(String bookId, BookSegment merged, List<String> supersededIds);

    Optional<DurationMap> getDurationMap(String bookId);

    // Playback

    void addPlaybackEvent(PlaybackEvent event);

    /** Newest first; a non-positive limit means no limit. */
    List<PlaybackEvent> listPlaybackEvents(String userId, String bookId, int limit);

    void updatePlaybackProgress(PlaybackProgress progress);

    Optional<PlaybackProgress> getPlaybackProgress(String userId, String bookId);

    // Stats

    void incrementBookPlayStats(String bookId, int seconds);

    /** Zero counters when nothing was recorded. */
    BookStats getBookStats(String bookId);

    void incrementUserListenStats(String userId, int seconds);

    UserStats getUserStats(String userId);

    // Do-not-import blocklist

    boolean isHashBlocked(String hash);

    /** Upserts the entry. */
    void addBlockedHash(String hash, String reason);

    void removeBlockedHash(String hash);

    /** Ordered by hash. */
    List<DoNotImport> getAllBlockedHashes();

    Optional<DoNotImport> getBlockedHashByHash(String hash);
}
