package net.audiobookorganizer.store.kv;

import jakarta.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import net.audiobookorganizer.store.StoreQueries;

/**
 * Key layout of the key-value engine.
 *
 * <p>Primary records live at {@code <family>:<id>}. Secondary indexes share the family prefix
 * but carry a literal marker ({@code :path:}, {@code :hash:}, {@code :series:}, ...), so a
 * family scan keeps only keys whose remainder after the family prefix has no further colon.
 * Ordering is byte-lexicographic; numeric key components are zero-padded so range scans come
 * back in numeric order.
 */
final class KeySpace {

    static final String AUTHOR = "author:";
    static final String AUTHOR_NAME = "author:name:";
    static final String NARRATOR = "narrator:";
    static final String NARRATOR_NAME = "narrator:name:";
    static final String SERIES = "series:";
    static final String SERIES_NAME = "series:name:";
    static final String WORK = "work:";
    static final String WORK_TITLE = "work:title:";
    static final String BOOK = "book:";
    static final String BOOK_PATH = "book:path:";
    static final String BOOK_HASH = "book:hash:";
    static final String BOOK_ORIGINAL_HASH = "book:originalhash:";
    static final String BOOK_ORGANIZED_HASH = "book:organizedhash:";
    static final String BOOK_SERIES = "book:series:";
    static final String BOOK_AUTHOR = "book:author:";
    static final String BOOK_WORK = "book:work:";
    static final String BOOK_VERSION_GROUP = "book:versiongroup:";
    static final String BOOK_AUTHORS = "book_authors:";
    static final String BOOK_NARRATORS = "book_narrators:";
    static final String AUTHOR_BOOKS = "idx:author_books:";
    static final String IMPORT_PATH = "import_path:";
    static final String IMPORT_PATH_PATH = "import_path:path:";
    static final String LEGACY_LIBRARY = "library:";
    static final String LEGACY_LIBRARY_PATH = "library:path:";
    static final String OPERATION = "operation:";
    static final String OPERATION_LOG = "operationlog:";
    static final String PREFERENCE = "preference:";
    static final String SETTING = "setting:";
    static final String PLAYLIST = "playlist:";
    static final String PLAYLIST_SERIES = "playlist:series:";
    static final String PLAYLIST_ITEM = "playlistitem:";
    static final String COUNTER = "counter:";
    static final String METADATA_STATE = "metadata_state:";
    static final String METADATA_CHANGE = "metadata_change:";
    static final String USER = "u:";
    static final String USER_USERNAME = "idx:user:username:";
    static final String USER_EMAIL = "idx:user:email:";
    static final String SESSION = "sess:";
    static final String SESSION_BY_USER = "idx:sess:user:";
    static final String USER_PREFERENCE = "pref:";
    static final String SEGMENT = "bf:";
    static final String SEGMENT_BY_BOOK = "bfs:";
    static final String DURATION_MAP = "b:duration_map:";
    static final String PLAYBACK_EVENT = "playe:";
    static final String PLAYBACK_PROGRESS = "playp:";
    static final String STATS_BOOK_PLAYS = "stats:book:plays:";
    static final String STATS_BOOK_SECONDS = "stats:book:listen_seconds:";
    static final String STATS_USER_SECONDS = "stats:user:listen_seconds:";
    static final String BLOCKED_HASH = "blocked:hash:";

    static final String NO_AUTHOR = "nil";
    static final byte UPPER_BOUND_SUFFIX = (byte) 0xFF;

    private KeySpace() {
    }

    static String primary(String family, Object id) {
        return family + id;
    }

    /** True when {@code key} is a primary record of the family rather than one of its indexes. */
    static boolean isPrimary(String family, String key) {
        return key.startsWith(family) && key.indexOf(':', family.length()) < 0;
    }

    static String seriesName(String normalizedName, @Nullable Integer authorId) {
        return SERIES_NAME + normalizedName + ":" + (authorId == null ? NO_AUTHOR : authorId.toString());
    }

    static String workTitle(String normalizedTitle, String workId) {
        return WORK_TITLE + normalizedTitle + ":" + workId;
    }

    static String bookSeries(int seriesId, String bookId) {
        return BOOK_SERIES + seriesId + ":" + bookId;
    }

    static String bookSeriesPrefix(int seriesId) {
        return BOOK_SERIES + seriesId + ":";
    }

    static String bookAuthor(int authorId, String bookId) {
        return BOOK_AUTHOR + authorId + ":" + bookId;
    }

    static String bookAuthorPrefix(int authorId) {
        return BOOK_AUTHOR + authorId + ":";
    }

    static String bookWork(String workId, String bookId) {
        return BOOK_WORK + workId + ":" + bookId;
    }

    static String bookWorkPrefix(String workId) {
        return BOOK_WORK + workId + ":";
    }

    static String bookVersionGroup(String groupId, String bookId) {
        return BOOK_VERSION_GROUP + groupId + ":" + bookId;
    }

    static String bookVersionGroupPrefix(String groupId) {
        return BOOK_VERSION_GROUP + groupId + ":";
    }

    static String authorBooks(int authorId, String bookId) {
        return AUTHOR_BOOKS + authorId + ":" + bookId;
    }

    static String authorBooksPrefix(int authorId) {
        return AUTHOR_BOOKS + authorId + ":";
    }

    static String operationLog(String operationId, long logId) {
        return operationLogPrefix(operationId) + pad(logId);
    }

    static String operationLogPrefix(String operationId) {
        return OPERATION_LOG + operationId + ":";
    }

    static String playlistItem(int playlistId, int position, long itemId) {
        return playlistItemPrefix(playlistId) + pad(position) + ":" + pad(itemId);
    }

    static String playlistItemPrefix(int playlistId) {
        return PLAYLIST_ITEM + playlistId + ":";
    }

    static String counter(String family) {
        return COUNTER + family;
    }

    static String metadataState(String bookId, String field) {
        return metadataStatePrefix(bookId) + field;
    }

    static String metadataStatePrefix(String bookId) {
        return METADATA_STATE + bookId + ":";
    }

    static String metadataChange(String bookId, long changeId) {
        return metadataChangePrefix(bookId) + pad(changeId);
    }

    static String metadataChangePrefix(String bookId) {
        return METADATA_CHANGE + bookId + ":";
    }

    static String sessionByUser(String userId, String sessionId) {
        return sessionByUserPrefix(userId) + sessionId;
    }

    static String sessionByUserPrefix(String userId) {
        return SESSION_BY_USER + userId + ":";
    }

    static String userPreference(String userId, String key) {
        return userPreferencePrefix(userId) + key;
    }

    static String userPreferencePrefix(String userId) {
        return USER_PREFERENCE + userId + ":";
    }

    static String segmentByBook(String bookId, String segmentId) {
        return segmentByBookPrefix(bookId) + segmentId;
    }

    static String segmentByBookPrefix(String bookId) {
        return SEGMENT_BY_BOOK + bookId + ":";
    }

    static String playbackEvent(String userId, String bookId, long epochMillis, long seq) {
        return playbackEventPrefix(userId, bookId) + pad(epochMillis) + ":" + pad(seq);
    }

    static String playbackEventPrefix(String userId, String bookId) {
        return PLAYBACK_EVENT + userId + ":" + bookId + ":";
    }

    static String playbackProgress(String userId, String bookId) {
        return PLAYBACK_PROGRESS + userId + ":" + bookId;
    }

    /** Fixed-width decimal so lexicographic key order equals numeric order. */
    static String pad(long value) {
        return String.format("%019d", value);
    }

    static byte[] bytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    static String string(byte[] key) {
        return new String(key, StandardCharsets.UTF_8);
    }

    /** Exclusive upper bound of a prefix scan: the prefix followed by 0xFF. */
    static byte[] upperBound(String prefix) {
        byte[] lower = bytes(prefix);
        byte[] upper = Arrays.copyOf(lower, lower.length + 1);
        upper[lower.length] = UPPER_BOUND_SUFFIX;
        return upper;
    }

    /**
     * Rejects identifiers that would break the key layout. A colon inside a primary id would
     * make the record indistinguishable from an index key during family scans.
     */
    static String checkId(String entity, String id) {
        return StoreQueries.requireStorableId(entity, id);
    }
}
