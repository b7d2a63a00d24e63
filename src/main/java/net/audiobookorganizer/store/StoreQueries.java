package net.audiobookorganizer.store;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import net.audiobookorganizer.model.Book;
import net.audiobookorganizer.model.BookSegment;
import net.audiobookorganizer.model.DashboardStats;
import net.audiobookorganizer.model.DurationMap;

/**
 * Orderings and in-memory algorithms both engines share, so the relational engine's ORDER BY
 * clauses and the key-value engine's scans agree on every contractually ordered listing.
 */
public final class StoreQueries {

    public static final String UNKNOWN_CODEC = "unknown";
    public static final int DURATION_MAP_VERSION = 1;

    private static final Comparator<String> NULLS_LAST = Comparator.nullsLast(Comparator.naturalOrder());

    /** Title, then id. Matches {@code ORDER BY title, id}. */
    public static final Comparator<Book> BY_TITLE =
        Comparator.comparing(Book::getTitle, NULLS_LAST).thenComparing(Book::getId, NULLS_LAST);

    /** Series sequence (missing last), then title. */
    public static final Comparator<Book> BY_SERIES_SEQUENCE =
        Comparator.comparing(Book::getSeriesSequence, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(BY_TITLE);

    /** Primary version first, then title. */
    public static final Comparator<Book> PRIMARY_VERSION_FIRST =
        Comparator.comparing((Book book) -> book.isPrimary() ? 0 : 1).thenComparing(BY_TITLE);

    /** Most recently marked first, unknown mark time last, then title. */
    public static final Comparator<Book> MOST_RECENTLY_MARKED =
        Comparator.comparing(Book::getMarkedForDeletionAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(BY_TITLE);

    /**
     * Play order for the duration map: numbered tracks ascending, unnumbered after them,
     * ties broken by file path.
     */
    public static final Comparator<BookSegment> PLAY_ORDER =
        Comparator.comparing(BookSegment::trackNumber, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(BookSegment::filePath, NULLS_LAST)
            .thenComparing(BookSegment::id, NULLS_LAST);

    private StoreQueries() {
    }

    /** Current instant at millisecond precision, the precision both engines persist. */
    public static Instant now(Clock clock) {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public static Instant millis(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Validates a caller-supplied primary id. Both engines reject a colon so that an id accepted
     * by one engine is accepted by the other; the key-value layout reserves it as a separator.
     */
    public static String requireStorableId(String entity, String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(entity + " id must not be blank");
        }
        if (id.indexOf(':') >= 0) {
            throw new IllegalArgumentException(entity + " id must not contain ':' but was " + id);
        }
        return id;
    }

    /** Lookup form of a natural key: trimmed and lower-cased. */
    public static String normalizeKey(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean titleContains(Book book, String query) {
        if (query == null || query.isEmpty()) {
            return true;
        }
        String title = book.getTitle();
        return title != null && title.toLowerCase(Locale.ROOT).contains(query.toLowerCase(Locale.ROOT));
    }

    /** Applies limit/offset to an already ordered list; a non-positive limit means no limit. */
    public static <T> List<T> page(List<T> ordered, int limit, int offset) {
        int from = Math.max(0, offset);
        if (from >= ordered.size()) {
            return new ArrayList<>();
        }
        int to = limit > 0 ? (int) Math.min((long) from + limit, ordered.size()) : ordered.size();
        return new ArrayList<>(ordered.subList(from, to));
    }

    /**
     * Groups live books by {@link Book#duplicateHash()} and keeps groups with two or more
     * members. Members are ordered by file path and groups by their first member's path.
     */
    public static List<List<Book>> groupDuplicates(Iterable<Book> books) {
        Map<String, List<Book>> byHash = new LinkedHashMap<>();
        for (Book book : books) {
            if (book.isSoftDeleted()) {
                continue;
            }
            String hash = book.duplicateHash();
            if (hash == null) {
                continue;
            }
            byHash.computeIfAbsent(hash, ignored -> new ArrayList<>()).add(book);
        }
        Comparator<Book> byPath = Comparator.comparing(Book::getFilePath, NULLS_LAST)
            .thenComparing(Book::getId, NULLS_LAST);
        List<List<Book>> groups = new ArrayList<>();
        for (List<Book> group : byHash.values()) {
            if (group.size() < 2) {
                continue;
            }
            group.sort(byPath);
            groups.add(group);
        }
        groups.sort(Comparator.comparing((List<Book> group) -> group.get(0), byPath));
        return groups;
    }

    /**
     * Builds the duration map from a book's segments. Inactive segments are left out; each
     * active segment starts where the previous one ended.
     */
    public static DurationMap computeDurationMap(String bookId, List<BookSegment> segments) {
        List<BookSegment> active = new ArrayList<>();
        for (BookSegment segment : segments) {
            if (segment.active()) {
                active.add(segment);
            }
        }
        active.sort(PLAY_ORDER);
        List<DurationMap.Entry> entries = new ArrayList<>(active.size());
        int offset = 0;
        for (BookSegment segment : active) {
            entries.add(new DurationMap.Entry(segment.id(), segment.durationSec(), true, offset));
            offset += segment.durationSec();
        }
        return new DurationMap(bookId, entries, offset, DURATION_MAP_VERSION);
    }

    public static DashboardStats dashboardStats(Iterable<Book> books) {
        int total = 0;
        long duration = 0;
        long size = 0;
        Map<String, Integer> states = new TreeMap<>();
        Map<String, Integer> formats = new TreeMap<>();
        for (Book book : books) {
            if (book.isSoftDeleted()) {
                continue;
            }
            total++;
            if (book.getDuration() != null) {
                duration += book.getDuration();
            }
            if (book.getFileSize() != null) {
                size += book.getFileSize();
            }
            String state = book.getLibraryState() != null ? book.getLibraryState() : Book.DEFAULT_LIBRARY_STATE;
            states.merge(state, 1, Integer::sum);
            String codec = book.getCodec() != null ? book.getCodec() : UNKNOWN_CODEC;
            formats.merge(codec, 1, Integer::sum);
        }
        return new DashboardStats(total, duration, size, states, formats);
    }
}
