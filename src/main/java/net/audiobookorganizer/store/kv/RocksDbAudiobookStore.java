package net.audiobookorganizer.store.kv;

import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.exception.StoreConstraintViolationException;
import net.audiobookorganizer.exception.StoreEncodingException;
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
import net.audiobookorganizer.util.IdGenerator;
import tools.jackson.core.type.TypeReference;

/**
 * {@link AudiobookStore} over an embedded RocksDB instance.
 *
 * <p>Every entity is a JSON value under a primary key; every non-primary lookup goes through a
 * hand-maintained index key (see {@link KeySpace}). A mutation writes the primary record and all
 * affected index keys in one {@link RocksDbAccess.Batch}, so readers never see a record whose
 * indexes are stale. Updates diff old and new indexed values and touch only the indexes that
 * changed.
 *
 * <p>Uniqueness (book path, import path, username, email) is checked against the index before
 * the batch is written. Two callers racing to create the same natural key can both pass the
 * check; only id counters are serialized in-process.
 */
@Slf4j
public class RocksDbAudiobookStore implements AudiobookStore, LegacySchemaSupport {

    public static final String ENGINE = "rocksdb";

    private static final TypeReference<List<BookAuthor>> BOOK_AUTHOR_LIST = new TypeReference<>() {};
    private static final TypeReference<List<BookNarrator>> BOOK_NARRATOR_LIST = new TypeReference<>() {};

    private static final Map<String, Function<Book, String>> HASH_INDEXES = Map.of(
        KeySpace.BOOK_HASH, Book::getFileHash,
        KeySpace.BOOK_ORIGINAL_HASH, Book::getOriginalFileHash,
        KeySpace.BOOK_ORGANIZED_HASH, Book::getOrganizedFileHash);

    /** Hash indexes point at the newest holder: latest createdAt, then highest id. */
    private static final Comparator<Book> HASH_PRECEDENCE = Comparator
        .comparing(Book::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
        .thenComparing(Book::getId);

    private final RocksDbAccess access;
    private final StoreJson json;
    private final Clock clock;
    // book writes share the path and hash indexes, so they are serialized as a whole
    private final ReentrantLock bookWriteLock = new ReentrantLock();

    public RocksDbAudiobookStore(Path directory) {
        this(directory, new StoreJson(), Clock.systemUTC());
    }

    public RocksDbAudiobookStore(Path directory, StoreJson json, Clock clock) {
        this.access = new RocksDbAccess(directory);
        this.json = json;
        this.clock = clock;
    }

    RocksDbAccess access() {
        return access;
    }

    @Override
    public String engineName() {
        return ENGINE;
    }

    @Override
    public void close() {
        access.close();
    }

    @Override
    public void reset() {
        access.clear();
    }

    // ---- record helpers ----

    private Instant now() {
        return StoreQueries.now(clock);
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        return access.get(key).map(value -> json.decode(key, value, type));
    }

    private <T> Optional<T> read(String key, TypeReference<T> type) {
        return access.get(key).map(value -> json.decode(key, value, type));
    }

    /** Primary records of a family; undecodable records are skipped so one bad value cannot fail a listing. */
    private <T> List<T> scanRecords(String family, Class<T> type) {
        List<T> records = new ArrayList<>();
        for (RocksDbAccess.Entry entry : access.scan(family)) {
            if (KeySpace.isPrimary(family, entry.key())) {
                decodeOrSkip(entry, type).ifPresent(records::add);
            }
        }
        return records;
    }

    /** Every value under a prefix that holds no index keys; undecodable values are skipped. */
    private <T> List<T> scanValues(String prefix, Class<T> type) {
        List<T> records = new ArrayList<>();
        for (RocksDbAccess.Entry entry : access.scan(prefix)) {
            decodeOrSkip(entry, type).ifPresent(records::add);
        }
        return records;
    }

    private <T> Optional<T> decodeOrSkip(RocksDbAccess.Entry entry, Class<T> type) {
        try {
            return Optional.of(json.decode(entry.key(), entry.value(), type));
        } catch (StoreEncodingException ex) {
            log.warn("Skipping undecodable record {}: {}", entry.key(), ex.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> indexTarget(String indexKey) {
        return access.getString(indexKey);
    }

    private void put(RocksDbAccess.Batch batch, String key, Object value) {
        batch.put(key, json.encode(key, value));
    }

    private void write(String key, Object value) {
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, key, value);
            batch.commit();
        }
    }

    private static int parseIntId(String raw) {
        return Integer.parseInt(raw.trim());
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }

    // ---- Authors ----

    @Override
    public List<Author> getAllAuthors() {
        List<Author> authors = scanRecords(KeySpace.AUTHOR, Author.class);
        authors.sort(Comparator.comparing(Author::name).thenComparingInt(Author::id));
        return authors;
    }

    @Override
    public Optional<Author> getAuthorById(int id) {
        return read(KeySpace.primary(KeySpace.AUTHOR, id), Author.class);
    }

    @Override
    public Optional<Author> getAuthorByName(String name) {
        return indexTarget(KeySpace.AUTHOR_NAME + StoreQueries.normalizeKey(name))
            .flatMap(id -> getAuthorById(parseIntId(id)));
    }

    @Override
    public Author createAuthor(String name) {
        String trimmed = requireText(name, "author name").trim();
        Optional<Author> existing = getAuthorByName(trimmed);
        if (existing.isPresent()) {
            return existing.get();
        }
        Author author = new Author((int) access.nextId("author"), trimmed);
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.AUTHOR, author.id()), author);
            batch.put(KeySpace.AUTHOR_NAME + StoreQueries.normalizeKey(trimmed), Integer.toString(author.id()));
            batch.commit();
        }
        return author;
    }

    // ---- Narrators ----

    @Override
    public List<Narrator> getAllNarrators() {
        List<Narrator> narrators = scanRecords(KeySpace.NARRATOR, Narrator.class);
        narrators.sort(Comparator.comparing(Narrator::name).thenComparingInt(Narrator::id));
        return narrators;
    }

    @Override
    public Optional<Narrator> getNarratorById(int id) {
        return read(KeySpace.primary(KeySpace.NARRATOR, id), Narrator.class);
    }

    @Override
    public Optional<Narrator> getNarratorByName(String name) {
        return indexTarget(KeySpace.NARRATOR_NAME + StoreQueries.normalizeKey(name))
            .flatMap(id -> getNarratorById(parseIntId(id)));
    }

    @Override
    public Narrator createNarrator(String name) {
        String trimmed = requireText(name, "narrator name").trim();
        Optional<Narrator> existing = getNarratorByName(trimmed);
        if (existing.isPresent()) {
            return existing.get();
        }
        Narrator narrator = new Narrator((int) access.nextId("narrator"), trimmed, now());
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.NARRATOR, narrator.id()), narrator);
            batch.put(KeySpace.NARRATOR_NAME + StoreQueries.normalizeKey(trimmed), Integer.toString(narrator.id()));
            batch.commit();
        }
        return narrator;
    }

    // ---- Series ----

    @Override
    public List<Series> getAllSeries() {
        List<Series> series = scanRecords(KeySpace.SERIES, Series.class);
        series.sort(Comparator.comparing(Series::name).thenComparingInt(Series::id));
        return series;
    }

    @Override
    public Optional<Series> getSeriesById(int id) {
        return read(KeySpace.primary(KeySpace.SERIES, id), Series.class);
    }

    @Override
    public Optional<Series> getSeriesByName(String name, @Nullable Integer authorId) {
        return indexTarget(KeySpace.seriesName(StoreQueries.normalizeKey(name), authorId))
            .flatMap(id -> getSeriesById(parseIntId(id)));
    }

    @Override
    public Series createSeries(String name, @Nullable Integer authorId) {
        String trimmed = requireText(name, "series name").trim();
        Optional<Series> existing = getSeriesByName(trimmed, authorId);
        if (existing.isPresent()) {
            return existing.get();
        }
        Series series = new Series((int) access.nextId("series"), trimmed, authorId);
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.SERIES, series.id()), series);
            batch.put(KeySpace.seriesName(StoreQueries.normalizeKey(trimmed), authorId), Integer.toString(series.id()));
            batch.commit();
        }
        return series;
    }

    // ---- Works ----

    @Override
    public List<Work> getAllWorks() {
        List<Work> works = scanRecords(KeySpace.WORK, Work.class);
        works.sort(Comparator.comparing(Work::title, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(Work::id));
        return works;
    }

    @Override
    public Optional<Work> getWorkById(String id) {
        return read(KeySpace.primary(KeySpace.WORK, id), Work.class);
    }

    @Override
    public Work createWork(Work work) {
        requireText(work.title(), "work title");
        String id = work.id() == null || work.id().isBlank() ? IdGenerator.ulid() : KeySpace.checkId("work", work.id());
        if (access.exists(KeySpace.primary(KeySpace.WORK, id))) {
            throw StoreConstraintViolationException.duplicate("work", "id", id);
        }
        Instant now = now();
        Work stored = work.withId(id).withTimestamps(now, now);
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.WORK, id), stored);
            String title = StoreQueries.normalizeKey(stored.title());
            if (!title.isEmpty()) {
                batch.put(KeySpace.workTitle(title, id), id);
            }
            batch.commit();
        }
        return stored;
    }

    @Override
    public Work updateWork(String id, Work work) {
        Work old = getWorkById(id).orElseThrow(() -> StoreConstraintViolationException.notFound("work", id));
        requireText(work.title(), "work title");
        Work stored = work.withId(id).withTimestamps(old.createdAt(), now());
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.WORK, id), stored);
            String oldTitle = StoreQueries.normalizeKey(old.title());
            String newTitle = StoreQueries.normalizeKey(stored.title());
            if (!oldTitle.equals(newTitle)) {
                if (!oldTitle.isEmpty()) {
                    batch.delete(KeySpace.workTitle(oldTitle, id));
                }
                if (!newTitle.isEmpty()) {
                    batch.put(KeySpace.workTitle(newTitle, id), id);
                }
            }
            batch.commit();
        }
        return stored;
    }

    @Override
    public void deleteWork(String id) {
        Optional<Work> work = getWorkById(id);
        if (work.isEmpty()) {
            return;
        }
        try (RocksDbAccess.Batch batch = access.batch()) {
            batch.delete(KeySpace.primary(KeySpace.WORK, id));
            String title = StoreQueries.normalizeKey(work.get().title());
            if (!title.isEmpty()) {
                batch.delete(KeySpace.workTitle(title, id));
            }
            batch.commit();
        }
    }

    @Override
    public List<Book> getBooksByWorkId(String workId) {
        List<Book> books = liveBooksFromIndex(KeySpace.bookWorkPrefix(workId));
        books.sort(StoreQueries.BY_TITLE);
        return books;
    }

    // ---- Books ----

    private List<Book> allBookRecords() {
        return scanRecords(KeySpace.BOOK, Book.class);
    }

    private List<Book> liveBooks() {
        List<Book> live = new ArrayList<>();
        for (Book book : allBookRecords()) {
            if (!book.isSoftDeleted()) {
                live.add(book);
            }
        }
        return live;
    }

    /** Resolves a multi-valued index prefix (values are book ids) to live books. */
    private List<Book> liveBooksFromIndex(String prefix) {
        Set<String> ids = new LinkedHashSet<>();
        for (RocksDbAccess.Entry entry : access.scan(prefix)) {
            ids.add(entry.valueAsString());
        }
        return liveBooksByIds(ids);
    }

    private List<Book> liveBooksByIds(Iterable<String> ids) {
        List<Book> books = new ArrayList<>();
        for (String id : ids) {
            String key = KeySpace.primary(KeySpace.BOOK, id);
            access.get(key).ifPresent(value -> decodeOrSkip(new RocksDbAccess.Entry(key, value), Book.class)
                .filter(book -> !book.isSoftDeleted())
                .ifPresent(books::add));
        }
        return books;
    }

    @Override
    public List<Book> getAllBooks(int limit, int offset) {
        List<Book> books = liveBooks();
        books.sort(StoreQueries.BY_TITLE);
        return StoreQueries.page(books, limit, offset);
    }

    @Override
    public Optional<Book> getBookById(String id) {
        return read(KeySpace.primary(KeySpace.BOOK, id), Book.class);
    }

    @Override
    public Optional<Book> getBookByFilePath(String path) {
        return indexTarget(KeySpace.BOOK_PATH + path)
            .flatMap(this::getBookById)
            .filter(book -> Objects.equals(book.getFilePath(), path));
    }

    @Override
    public Optional<Book> getBookByFileHash(String hash) {
        return indexTarget(KeySpace.BOOK_HASH + hash)
            .flatMap(this::getBookById)
            .filter(book -> Objects.equals(book.getFileHash(), hash));
    }

    @Override
    public Optional<Book> getBookByOriginalHash(String hash) {
        return indexTarget(KeySpace.BOOK_ORIGINAL_HASH + hash)
            .flatMap(this::getBookById)
            .filter(book -> Objects.equals(book.getOriginalFileHash(), hash));
    }

    @Override
    public Optional<Book> getBookByOrganizedHash(String hash) {
        return indexTarget(KeySpace.BOOK_ORGANIZED_HASH + hash)
            .flatMap(this::getBookById)
            .filter(book -> Objects.equals(book.getOrganizedFileHash(), hash));
    }

    @Override
    public List<Book> getBooksBySeriesId(int seriesId) {
        List<Book> books = liveBooksFromIndex(KeySpace.bookSeriesPrefix(seriesId));
        books.sort(StoreQueries.BY_SERIES_SEQUENCE);
        return books;
    }

    @Override
    public List<Book> getBooksByAuthorId(int authorId) {
        List<Book> books = liveBooksFromIndex(KeySpace.bookAuthorPrefix(authorId));
        books.sort(StoreQueries.BY_TITLE);
        return books;
    }

    @Override
    public Book createBook(Book book) {
        bookWriteLock.lock();
        try {
            return insertBook(book);
        } finally {
            bookWriteLock.unlock();
        }
    }

    private Book insertBook(Book book) {
        Book stored = book.copy();
        requireText(stored.getTitle(), "book title");
        requireText(stored.getFilePath(), "book file path");
        String id = stored.getId() == null || stored.getId().isBlank()
            ? IdGenerator.ulid()
            : KeySpace.checkId("book", stored.getId());
        stored.setId(id);
        if (access.exists(KeySpace.primary(KeySpace.BOOK, id))) {
            throw StoreConstraintViolationException.duplicate("book", "id", id);
        }
        if (access.exists(KeySpace.BOOK_PATH + stored.getFilePath())) {
            throw StoreConstraintViolationException.duplicate("book", "file path", stored.getFilePath());
        }
        stored.applyCreateDefaults();
        stored.setMarkedForDeletionAt(StoreQueries.millis(stored.getMarkedForDeletionAt()));
        Instant now = now();
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);

        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.BOOK, id), stored);
            BookIndexes.of(stored).writeAll(batch, this);
            batch.commit();
        }
        return stored.copy();
    }

    @Override
    public Book updateBook(String id, Book book) {
        bookWriteLock.lock();
        try {
            return replaceBook(id, book);
        } finally {
            bookWriteLock.unlock();
        }
    }

    private Book replaceBook(String id, Book book) {
        Book old = getBookById(id).orElseThrow(() -> StoreConstraintViolationException.notFound("book", id));
        Book stored = book.copy();
        requireText(stored.getTitle(), "book title");
        requireText(stored.getFilePath(), "book file path");
        stored.setId(id);
        stored.setCreatedAt(old.getCreatedAt());
        stored.setUpdatedAt(now());
        stored.setMarkedForDeletionAt(StoreQueries.millis(stored.getMarkedForDeletionAt()));

        if (!Objects.equals(old.getFilePath(), stored.getFilePath())) {
            Optional<String> owner = indexTarget(KeySpace.BOOK_PATH + stored.getFilePath());
            if (owner.isPresent() && !owner.get().equals(id)) {
                throw StoreConstraintViolationException.duplicate("book", "file path", stored.getFilePath());
            }
        }

        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.BOOK, id), stored);
            BookIndexes.of(old).diff(BookIndexes.of(stored), batch, this);
            batch.commit();
        }
        return stored.copy();
    }

    @Override
    public void deleteBook(String id) {
        bookWriteLock.lock();
        try {
            access.runWithLock(KeySpace.primary(KeySpace.BOOK, id), () -> removeBook(id));
        } finally {
            bookWriteLock.unlock();
        }
    }

    private void removeBook(String id) {
        Optional<Book> existing = getBookById(id);
        if (existing.isEmpty()) {
            return;
        }
        try (RocksDbAccess.Batch batch = access.batch()) {
            batch.delete(KeySpace.primary(KeySpace.BOOK, id));
            BookIndexes.of(existing.get()).deleteAll(batch, this);
            for (String key : access.keys(KeySpace.metadataStatePrefix(id))) {
                batch.delete(key);
            }
            for (BookAuthor link : getBookAuthors(id)) {
                batch.delete(KeySpace.authorBooks(link.authorId(), id));
            }
            batch.delete(KeySpace.BOOK_AUTHORS + id);
            batch.delete(KeySpace.BOOK_NARRATORS + id);
            batch.commit();
        }
    }

    @Override
    public List<Book> searchBooks(String query, int limit, int offset) {
        List<Book> matches = new ArrayList<>();
        for (Book book : liveBooks()) {
            if (StoreQueries.titleContains(book, query)) {
                matches.add(book);
            }
        }
        matches.sort(StoreQueries.BY_TITLE);
        return StoreQueries.page(matches, limit, offset);
    }

    @Override
    public int countBooks() {
        return liveBooks().size();
    }

    @Override
    public List<List<Book>> getDuplicateBooks() {
        return StoreQueries.groupDuplicates(allBookRecords());
    }

    @Override
    public List<Book> getBooksByVersionGroup(String groupId) {
        List<Book> books = liveBooksFromIndex(KeySpace.bookVersionGroupPrefix(groupId));
        books.removeIf(book -> !groupId.equals(book.getVersionGroupId()));
        books.sort(StoreQueries.PRIMARY_VERSION_FIRST);
        return books;
    }

    @Override
    public List<Book> listSoftDeletedBooks(int limit, int offset, @Nullable Instant olderThan) {
        List<Book> deleted = new ArrayList<>();
        for (Book book : allBookRecords()) {
            if (!book.isSoftDeleted()) {
                continue;
            }
            if (olderThan != null
                && (book.getMarkedForDeletionAt() == null || book.getMarkedForDeletionAt().isAfter(olderThan))) {
                continue;
            }
            deleted.add(book);
        }
        deleted.sort(StoreQueries.MOST_RECENTLY_MARKED);
        return StoreQueries.page(deleted, limit, offset);
    }

    @Override
    public Book markBookForDeletion(String id, Instant markedAt) {
        bookWriteLock.lock();
        try {
            Book book = getBookById(id).orElseThrow(() -> StoreConstraintViolationException.notFound("book", id));
            book.setMarkedForDeletion(Boolean.TRUE);
            book.setMarkedForDeletionAt(StoreQueries.millis(markedAt));
            book.setUpdatedAt(now());
            // indexes stay in place; only ordinary listings hide the book
            write(KeySpace.primary(KeySpace.BOOK, id), book);
            return book;
        } finally {
            bookWriteLock.unlock();
        }
    }

    @Override
    public Book restoreBook(String id) {
        bookWriteLock.lock();
        try {
            Book book = getBookById(id).orElseThrow(() -> StoreConstraintViolationException.notFound("book", id));
            book.setMarkedForDeletion(Boolean.FALSE);
            book.setMarkedForDeletionAt(null);
            book.setUpdatedAt(now());
            write(KeySpace.primary(KeySpace.BOOK, id), book);
            return book;
        } finally {
            bookWriteLock.unlock();
        }
    }

    @Override
    public DashboardStats getDashboardStats() {
        return StoreQueries.dashboardStats(allBookRecords());
    }

    // ---- Book authors / narrators ----

    @Override
    public List<BookAuthor> getBookAuthors(String bookId) {
        List<BookAuthor> links = new ArrayList<>(read(KeySpace.BOOK_AUTHORS + bookId, BOOK_AUTHOR_LIST).orElse(List.of()));
        links.sort(Comparator.comparingInt(BookAuthor::position).thenComparingInt(BookAuthor::authorId));
        return links;
    }

    @Override
    public void setBookAuthors(String bookId, List<BookAuthor> authors) {
        access.runWithLock(KeySpace.primary(KeySpace.BOOK, bookId), () -> replaceBookAuthors(bookId, authors));
    }

    private void replaceBookAuthors(String bookId, List<BookAuthor> authors) {
        List<BookAuthor> normalized = new ArrayList<>();
        for (BookAuthor link : authors) {
            normalized.add(new BookAuthor(bookId, link.authorId(), link.role(), link.position()));
        }
        normalized.sort(Comparator.comparingInt(BookAuthor::position).thenComparingInt(BookAuthor::authorId));
        Set<Integer> previous = authorIds(getBookAuthors(bookId));
        Set<Integer> current = authorIds(normalized);
        try (RocksDbAccess.Batch batch = access.batch()) {
            if (normalized.isEmpty()) {
                batch.delete(KeySpace.BOOK_AUTHORS + bookId);
            } else {
                put(batch, KeySpace.BOOK_AUTHORS + bookId, normalized);
            }
            for (Integer authorId : previous) {
                if (!current.contains(authorId)) {
                    batch.delete(KeySpace.authorBooks(authorId, bookId));
                }
            }
            for (Integer authorId : current) {
                if (!previous.contains(authorId)) {
                    batch.put(KeySpace.authorBooks(authorId, bookId), bookId);
                }
            }
            batch.commit();
        }
    }

    @Override
    public boolean addBookAuthor(BookAuthor link) {
        return access.withLock(KeySpace.primary(KeySpace.BOOK, link.bookId()), () -> appendBookAuthor(link));
    }

    private boolean appendBookAuthor(BookAuthor link) {
        List<BookAuthor> links = getBookAuthors(link.bookId());
        for (BookAuthor existing : links) {
            if (existing.authorId() == link.authorId() && Objects.equals(existing.role(), link.role())) {
                return false;
            }
        }
        links.add(link);
        links.sort(Comparator.comparingInt(BookAuthor::position).thenComparingInt(BookAuthor::authorId));
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.BOOK_AUTHORS + link.bookId(), links);
            batch.put(KeySpace.authorBooks(link.authorId(), link.bookId()), link.bookId());
            batch.commit();
        }
        return true;
    }

    private static Set<Integer> authorIds(List<BookAuthor> links) {
        Set<Integer> ids = new HashSet<>();
        for (BookAuthor link : links) {
            ids.add(link.authorId());
        }
        return ids;
    }

    @Override
    public List<Book> getBooksByAuthorIdWithRole(int authorId) {
        Set<String> ids = new LinkedHashSet<>();
        for (RocksDbAccess.Entry entry : access.scan(KeySpace.bookAuthorPrefix(authorId))) {
            ids.add(entry.valueAsString());
        }
        for (RocksDbAccess.Entry entry : access.scan(KeySpace.authorBooksPrefix(authorId))) {
            ids.add(entry.valueAsString());
        }
        List<Book> books = liveBooksByIds(ids);
        books.sort(StoreQueries.BY_TITLE);
        return books;
    }

    @Override
    public List<BookNarrator> getBookNarrators(String bookId) {
        List<BookNarrator> links = new ArrayList<>(read(KeySpace.BOOK_NARRATORS + bookId, BOOK_NARRATOR_LIST).orElse(List.of()));
        links.sort(Comparator.comparingInt(BookNarrator::position).thenComparingInt(BookNarrator::narratorId));
        return links;
    }

    @Override
    public void setBookNarrators(String bookId, List<BookNarrator> narrators) {
        access.runWithLock(KeySpace.primary(KeySpace.BOOK, bookId), () -> replaceBookNarrators(bookId, narrators));
    }

    private void replaceBookNarrators(String bookId, List<BookNarrator> narrators) {
        List<BookNarrator> normalized = new ArrayList<>();
        for (BookNarrator link : narrators) {
            normalized.add(new BookNarrator(bookId, link.narratorId(), link.role(), link.position()));
        }
        normalized.sort(Comparator.comparingInt(BookNarrator::position).thenComparingInt(BookNarrator::narratorId));
        try (RocksDbAccess.Batch batch = access.batch()) {
            if (normalized.isEmpty()) {
                batch.delete(KeySpace.BOOK_NARRATORS + bookId);
            } else {
                put(batch, KeySpace.BOOK_NARRATORS + bookId, normalized);
            }
            batch.commit();
        }
    }

    @Override
    public boolean addBookNarrator(BookNarrator link) {
        return access.withLock(KeySpace.primary(KeySpace.BOOK, link.bookId()), () -> appendBookNarrator(link));
    }

    private boolean appendBookNarrator(BookNarrator link) {
        List<BookNarrator> links = getBookNarrators(link.bookId());
        for (BookNarrator existing : links) {
            if (existing.narratorId() == link.narratorId() && Objects.equals(existing.role(), link.role())) {
                return false;
            }
        }
        links.add(link);
        links.sort(Comparator.comparingInt(BookNarrator::position).thenComparingInt(BookNarrator::narratorId));
        write(KeySpace.BOOK_NARRATORS + link.bookId(), links);
        return true;
    }

    // ---- Import paths ----

    @Override
    public List<ImportPath> getAllImportPaths() {
        List<ImportPath> paths = scanRecords(KeySpace.IMPORT_PATH, ImportPath.class);
        paths.sort(Comparator.comparing(ImportPath::name, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparingInt(ImportPath::id));
        return paths;
    }

    @Override
    public Optional<ImportPath> getImportPathById(int id) {
        return read(KeySpace.primary(KeySpace.IMPORT_PATH, id), ImportPath.class);
    }

    @Override
    public Optional<ImportPath> getImportPathByPath(String path) {
        return indexTarget(KeySpace.IMPORT_PATH_PATH + path).flatMap(id -> getImportPathById(parseIntId(id)));
    }

    @Override
    public ImportPath createImportPath(String path, String name) {
        requireText(path, "import path");
        if (access.exists(KeySpace.IMPORT_PATH_PATH + path)) {
            throw StoreConstraintViolationException.duplicate("import path", "path", path);
        }
        ImportPath importPath = new ImportPath((int) access.nextId("import_path"), path, name, true, now(), null, 0);
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.IMPORT_PATH, importPath.id()), importPath);
            batch.put(KeySpace.IMPORT_PATH_PATH + path, Integer.toString(importPath.id()));
            batch.commit();
        }
        return importPath;
    }

    @Override
    public ImportPath updateImportPath(int id, ImportPath importPath) {
        ImportPath old = getImportPathById(id)
            .orElseThrow(() -> StoreConstraintViolationException.notFound("import path", id));
        requireText(importPath.path(), "import path");
        ImportPath stored = new ImportPath(id, importPath.path(), importPath.name(), importPath.enabled(),
            old.createdAt(), StoreQueries.millis(importPath.lastScan()), importPath.bookCount());
        boolean pathChanged = !old.path().equals(stored.path());
        if (pathChanged) {
            Optional<String> owner = indexTarget(KeySpace.IMPORT_PATH_PATH + stored.path());
            if (owner.isPresent() && parseIntId(owner.get()) != id) {
                throw StoreConstraintViolationException.duplicate("import path", "path", stored.path());
            }
        }
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.IMPORT_PATH, id), stored);
            if (pathChanged) {
                batch.delete(KeySpace.IMPORT_PATH_PATH + old.path());
                batch.put(KeySpace.IMPORT_PATH_PATH + stored.path(), Integer.toString(id));
            }
            batch.commit();
        }
        return stored;
    }

    @Override
    public void deleteImportPath(int id) {
        Optional<ImportPath> existing = getImportPathById(id);
        if (existing.isEmpty()) {
            return;
        }
        try (RocksDbAccess.Batch batch = access.batch()) {
            batch.delete(KeySpace.primary(KeySpace.IMPORT_PATH, id));
            batch.delete(KeySpace.IMPORT_PATH_PATH + existing.get().path());
            batch.commit();
        }
    }

    // ---- Operations ----

    @Override
    public Operation createOperation(String id, String type, @Nullable String folderPath) {
        KeySpace.checkId("operation", id);
        if (access.exists(KeySpace.primary(KeySpace.OPERATION, id))) {
            throw StoreConstraintViolationException.duplicate("operation", "id", id);
        }
        Operation operation = new Operation(id, type, OperationStatus.PENDING, 0, 0, "", folderPath,
            now(), null, null, null);
        write(KeySpace.primary(KeySpace.OPERATION, id), operation);
        return operation;
    }

    @Override
    public Optional<Operation> getOperationById(String id) {
        return read(KeySpace.primary(KeySpace.OPERATION, id), Operation.class);
    }

    @Override
    public List<Operation> getRecentOperations(int limit) {
        List<Operation> operations = scanRecords(KeySpace.OPERATION, Operation.class);
        operations.sort(Comparator.comparing(Operation::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Operation::id, Comparator.reverseOrder()));
        return StoreQueries.page(operations, limit, 0);
    }

    @Override
    public void updateOperationStatus(String id, OperationStatus status, int progress, int total, String message) {
        String key = KeySpace.primary(KeySpace.OPERATION, id);
        access.runWithLock(key, () -> {
            Operation operation = getOperationById(id)
                .orElseThrow(() -> StoreConstraintViolationException.notFound("operation", id));
            write(key, operation.withStatus(status, progress, total, message, now()));
        });
    }

    @Override
    public void updateOperationError(String id, String errorMessage) {
        String key = KeySpace.primary(KeySpace.OPERATION, id);
        access.runWithLock(key, () -> {
            Operation operation = getOperationById(id)
                .orElseThrow(() -> StoreConstraintViolationException.notFound("operation", id));
            write(key, operation.withError(errorMessage, now()));
        });
    }

    @Override
    public void addOperationLog(String operationId, String level, String message, @Nullable String details) {
        long id = access.nextId("operationlog");
        OperationLog entry = new OperationLog((int) id, operationId, level, message, details, now());
        write(KeySpace.operationLog(operationId, id), entry);
    }

    @Override
    public List<OperationLog> getOperationLogs(String operationId) {
        return scanValues(KeySpace.operationLogPrefix(operationId), OperationLog.class);
    }

    // ---- Global preferences ----

    @Override
    public Optional<UserPreference> getUserPreference(String key) {
        return read(KeySpace.PREFERENCE + key, UserPreference.class);
    }

    @Override
    public void setUserPreference(String key, String value) {
        requireText(key, "preference key");
        int id = getUserPreference(key).map(UserPreference::id).orElseGet(() -> (int) access.nextId("preference"));
        write(KeySpace.PREFERENCE + key, new UserPreference(id, key, value, now()));
    }

    @Override
    public List<UserPreference> getAllUserPreferences() {
        List<UserPreference> preferences = scanValues(KeySpace.PREFERENCE, UserPreference.class);
        preferences.sort(Comparator.comparing(UserPreference::key));
        return preferences;
    }

    // ---- Settings ----

    @Override
    public Optional<Setting> getSetting(String key) {
        return read(KeySpace.SETTING + key, Setting.class);
    }

    @Override
    public void setSetting(Setting setting) {
        requireText(setting.key(), "setting key");
        write(KeySpace.SETTING + setting.key(), setting.withUpdatedAt(now()));
    }

    @Override
    public List<Setting> getAllSettings() {
        List<Setting> settings = scanValues(KeySpace.SETTING, Setting.class);
        settings.sort(Comparator.comparing(Setting::key));
        return settings;
    }

    @Override
    public void deleteSetting(String key) {
        try (RocksDbAccess.Batch batch = access.batch()) {
            batch.delete(KeySpace.SETTING + key);
            batch.commit();
        }
    }

    // ---- Metadata provenance ----

    @Override
    public List<MetadataFieldState> getMetadataFieldStates(String bookId) {
        List<MetadataFieldState> states = scanValues(KeySpace.metadataStatePrefix(bookId), MetadataFieldState.class);
        states.sort(Comparator.comparing(MetadataFieldState::field));
        return states;
    }

    @Override
    public void upsertMetadataFieldState(MetadataFieldState state) {
        requireText(state.bookId(), "book id");
        requireText(state.field(), "field");
        write(KeySpace.metadataState(state.bookId(), state.field()), state.withUpdatedAt(now()));
    }

    @Override
    public void deleteMetadataFieldState(String bookId, String field) {
        try (RocksDbAccess.Batch batch = access.batch()) {
            batch.delete(KeySpace.metadataState(bookId, field));
            batch.commit();
        }
    }

    @Override
    public MetadataChangeRecord recordMetadataChange(MetadataChangeRecord change) {
        requireText(change.bookId(), "book id");
        long id = access.nextId("metadata_change");
        MetadataChangeRecord stored = change.withId((int) id, now());
        stored = new MetadataChangeRecord(stored.id(), stored.bookId(), stored.field(), stored.previousValue(),
            stored.newValue(), stored.changeType(), stored.source(), StoreQueries.millis(stored.changedAt()));
        write(KeySpace.metadataChange(change.bookId(), id), stored);
        return stored;
    }

    @Override
    public List<MetadataChangeRecord> getMetadataChangeHistory(String bookId, String field, int limit) {
        List<MetadataChangeRecord> history = new ArrayList<>();
        for (MetadataChangeRecord change : scanValues(KeySpace.metadataChangePrefix(bookId), MetadataChangeRecord.class)) {
            if (Objects.equals(change.field(), field)) {
                history.add(change);
            }
        }
        history.sort(NEWEST_CHANGE_FIRST);
        return StoreQueries.page(history, limit, 0);
    }

    @Override
    public List<MetadataChangeRecord> getBookChangeHistory(String bookId, int limit) {
        List<MetadataChangeRecord> history = scanValues(KeySpace.metadataChangePrefix(bookId), MetadataChangeRecord.class);
        history.sort(NEWEST_CHANGE_FIRST);
        return StoreQueries.page(history, limit, 0);
    }

    private static final Comparator<MetadataChangeRecord> NEWEST_CHANGE_FIRST =
        Comparator.comparing(MetadataChangeRecord::changedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Comparator.comparingInt(MetadataChangeRecord::id).reversed());

    // ---- Playlists ----

    @Override
    public Playlist createPlaylist(String name, @Nullable Integer seriesId, String filePath) {
        Playlist playlist = new Playlist((int) access.nextId("playlist"), requireText(name, "playlist name"), seriesId, filePath);
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.PLAYLIST, playlist.id()), playlist);
            if (seriesId != null) {
                batch.put(KeySpace.PLAYLIST_SERIES + seriesId, Integer.toString(playlist.id()));
            }
            batch.commit();
        }
        return playlist;
    }

    @Override
    public Optional<Playlist> getPlaylistById(int id) {
        return read(KeySpace.primary(KeySpace.PLAYLIST, id), Playlist.class);
    }

    @Override
    public Optional<Playlist> getPlaylistBySeriesId(int seriesId) {
        return indexTarget(KeySpace.PLAYLIST_SERIES + seriesId).flatMap(id -> getPlaylistById(parseIntId(id)));
    }

    @Override
    public PlaylistItem addPlaylistItem(int playlistId, String bookId, int position) {
        long id = access.nextId("playlistitem");
        PlaylistItem item = new PlaylistItem((int) id, playlistId, bookId, position);
        write(KeySpace.playlistItem(playlistId, position, id), item);
        return item;
    }

    @Override
    public List<PlaylistItem> getPlaylistItems(int playlistId) {
        return scanValues(KeySpace.playlistItemPrefix(playlistId), PlaylistItem.class);
    }

    // ---- Users ----

    @Override
    public User createUser(String username, String email, String passwordHashAlgo, String passwordHash,
                           List<String> roles, String status) {
        String usernameKey = KeySpace.USER_USERNAME + StoreQueries.normalizeKey(requireText(username, "username"));
        String emailKey = KeySpace.USER_EMAIL + StoreQueries.normalizeKey(requireText(email, "email"));
        if (access.exists(usernameKey)) {
            throw StoreConstraintViolationException.duplicate("user", "username", username);
        }
        if (access.exists(emailKey)) {
            throw StoreConstraintViolationException.duplicate("user", "email", email);
        }
        Instant now = now();
        User user = new User(IdGenerator.ulid(), username, email, passwordHashAlgo, passwordHash, roles, status, now, now, 1);
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.USER, user.id()), user);
            batch.put(usernameKey, user.id());
            batch.put(emailKey, user.id());
            batch.commit();
        }
        return user;
    }

    @Override
    public Optional<User> getUserById(String id) {
        return read(KeySpace.primary(KeySpace.USER, id), User.class);
    }

    @Override
    public Optional<User> getUserByUsername(String username) {
        return indexTarget(KeySpace.USER_USERNAME + StoreQueries.normalizeKey(username)).flatMap(this::getUserById);
    }

    @Override
    public Optional<User> getUserByEmail(String email) {
        return indexTarget(KeySpace.USER_EMAIL + StoreQueries.normalizeKey(email)).flatMap(this::getUserById);
    }

    @Override
    public User updateUser(User user) {
        return access.withLock(KeySpace.primary(KeySpace.USER, user.id()), () -> replaceUser(user));
    }

    private User replaceUser(User user) {
        User old = getUserById(user.id()).orElseThrow(() -> StoreConstraintViolationException.notFound("user", user.id()));
        User stored = new User(old.id(), requireText(user.username(), "username"), requireText(user.email(), "email"),
            user.passwordHashAlgo(), user.passwordHash(), user.roles(), user.status(), old.createdAt(), now(),
            user.version());
        String oldUsernameKey = KeySpace.USER_USERNAME + StoreQueries.normalizeKey(old.username());
        String newUsernameKey = KeySpace.USER_USERNAME + StoreQueries.normalizeKey(stored.username());
        String oldEmailKey = KeySpace.USER_EMAIL + StoreQueries.normalizeKey(old.email());
        String newEmailKey = KeySpace.USER_EMAIL + StoreQueries.normalizeKey(stored.email());
        requireIndexFree(newUsernameKey, oldUsernameKey, stored.id(), "username", stored.username());
        requireIndexFree(newEmailKey, oldEmailKey, stored.id(), "email", stored.email());
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.USER, stored.id()), stored);
            if (!oldUsernameKey.equals(newUsernameKey)) {
                batch.delete(oldUsernameKey);
                batch.put(newUsernameKey, stored.id());
            }
            if (!oldEmailKey.equals(newEmailKey)) {
                batch.delete(oldEmailKey);
                batch.put(newEmailKey, stored.id());
            }
            batch.commit();
        }
        return stored;
    }

    private void requireIndexFree(String newKey, String oldKey, String ownerId, String attribute, String value) {
        if (newKey.equals(oldKey)) {
            return;
        }
        Optional<String> owner = indexTarget(newKey);
        if (owner.isPresent() && !owner.get().equals(ownerId)) {
            throw StoreConstraintViolationException.duplicate("user", attribute, value);
        }
    }

    @Override
    public int countUsers() {
        int count = 0;
        for (String key : access.keys(KeySpace.USER)) {
            if (KeySpace.isPrimary(KeySpace.USER, key)) {
                count++;
            }
        }
        return count;
    }

    // ---- Sessions ----

    @Override
    public Session createSession(String userId, String ip, String userAgent, Duration ttl) {
        Instant now = now();
        Session session = new Session(IdGenerator.ulid(), userId, now, StoreQueries.millis(now.plus(ttl)), ip, userAgent, false, 1);
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.SESSION, session.id()), session);
            batch.put(KeySpace.sessionByUser(userId, session.id()), "1");
            batch.commit();
        }
        return session;
    }

    @Override
    public Optional<Session> getSession(String id) {
        return read(KeySpace.primary(KeySpace.SESSION, id), Session.class);
    }

    @Override
    public void revokeSession(String id) {
        getSession(id).ifPresent(session -> write(KeySpace.primary(KeySpace.SESSION, id), session.revoke()));
    }

    @Override
    public List<Session> listUserSessions(String userId) {
        String prefix = KeySpace.sessionByUserPrefix(userId);
        List<Session> sessions = new ArrayList<>();
        for (String key : access.keys(prefix)) {
            String sessionKey = KeySpace.primary(KeySpace.SESSION, key.substring(prefix.length()));
            access.get(sessionKey)
                .flatMap(value -> decodeOrSkip(new RocksDbAccess.Entry(sessionKey, value), Session.class))
                .ifPresent(sessions::add);
        }
        return sessions;
    }

    @Override
    public int deleteExpiredSessions(Instant now) {
        int deleted = 0;
        try (RocksDbAccess.Batch batch = access.batch()) {
            for (Session session : scanRecords(KeySpace.SESSION, Session.class)) {
                if (!session.isExpiredOrRevoked(now)) {
                    continue;
                }
                batch.delete(KeySpace.primary(KeySpace.SESSION, session.id()));
                batch.delete(KeySpace.sessionByUser(session.userId(), session.id()));
                deleted++;
            }
            batch.commit();
        }
        return deleted;
    }

    // ---- Per-user preferences ----

    @Override
    public void setUserPreferenceForUser(String userId, String key, String value) {
        write(KeySpace.userPreference(userId, key), new UserPreferenceEntry(userId, key, value, now()));
    }

    @Override
    public Optional<UserPreferenceEntry> getUserPreferenceForUser(String userId, String key) {
        return read(KeySpace.userPreference(userId, key), UserPreferenceEntry.class);
    }

    @Override
    public List<UserPreferenceEntry> getAllPreferencesForUser(String userId) {
        List<UserPreferenceEntry> entries = scanValues(KeySpace.userPreferencePrefix(userId), UserPreferenceEntry.class);
        entries.sort(Comparator.comparing(UserPreferenceEntry::key));
        return entries;
    }

    // ---- Segments ----

    private BookSegment newSegment(String bookId, BookSegment segment, Instant now) {
        requireText(segment.filePath(), "segment file path");
        return segment.toBuilder()
            .id(IdGenerator.ulid())
            .bookId(bookId)
            .active(true)
            .supersededBy(null)
            .createdAt(now)
            .updatedAt(now)
            .version(1)
            .build();
    }

    @Override
    public BookSegment createBookSegment(String bookId, BookSegment segment) {
        return access.withLock(KeySpace.primary(KeySpace.BOOK, bookId), () -> insertBookSegment(bookId, segment));
    }

    private BookSegment insertBookSegment(String bookId, BookSegment segment) {
        BookSegment stored = newSegment(bookId, segment, now());
        List<BookSegment> segments = listBookSegments(bookId);
        segments.add(stored);
        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.SEGMENT, stored.id()), stored);
            batch.put(KeySpace.segmentByBook(bookId, stored.id()), "1");
            put(batch, KeySpace.DURATION_MAP + bookId, StoreQueries.computeDurationMap(bookId, segments));
            batch.commit();
        }
        return stored;
    }

    @Override
    public Optional<BookSegment> getBookSegment(String segmentId) {
        return read(KeySpace.primary(KeySpace.SEGMENT, segmentId), BookSegment.class);
    }

    @Override
    public List<BookSegment> listBookSegments(String bookId) {
        String prefix = KeySpace.segmentByBookPrefix(bookId);
        List<BookSegment> segments = new ArrayList<>();
        for (String key : access.keys(prefix)) {
            String segmentKey = KeySpace.primary(KeySpace.SEGMENT, key.substring(prefix.length()));
            access.get(segmentKey)
                .flatMap(value -> decodeOrSkip(new RocksDbAccess.Entry(segmentKey, value), BookSegment.class))
                .ifPresent(segments::add);
        }
        return segments;
    }

    @Override
    public BookSegment mergeBookSegments(String bookId, BookSegment merged, List<String> supersededIds) {
        return access.withLock(KeySpace.primary(KeySpace.BOOK, bookId),
            () -> replaceBookSegments(bookId, merged, supersededIds));
    }

    private BookSegment replaceBookSegments(String bookId, BookSegment merged, List<String> supersededIds) {
        Instant now = now();
        BookSegment stored = newSegment(bookId, merged, now);
        Map<String, BookSegment> segments = new LinkedHashMap<>();
        for (BookSegment segment : listBookSegments(bookId)) {
            segments.put(segment.id(), segment);
        }
        List<BookSegment> superseded = new ArrayList<>();
        for (String id : supersededIds) {
            BookSegment existing = segments.get(id);
            if (existing == null) {
                throw StoreConstraintViolationException.notFound("segment of book " + bookId, id);
            }
            BookSegment deactivated = existing.toBuilder().active(false).supersededBy(stored.id()).updatedAt(now).build();
            segments.put(id, deactivated);
            superseded.add(deactivated);
        }
        segments.put(stored.id(), stored);

        try (RocksDbAccess.Batch batch = access.batch()) {
            put(batch, KeySpace.primary(KeySpace.SEGMENT, stored.id()), stored);
            batch.put(KeySpace.segmentByBook(bookId, stored.id()), "1");
            for (BookSegment segment : superseded) {
                put(batch, KeySpace.primary(KeySpace.SEGMENT, segment.id()), segment);
            }
            put(batch, KeySpace.DURATION_MAP + bookId,
                StoreQueries.computeDurationMap(bookId, new ArrayList<>(segments.values())));
            batch.commit();
        }
        return stored;
    }

    @Override
    public Optional<DurationMap> getDurationMap(String bookId) {
        return read(KeySpace.DURATION_MAP + bookId, DurationMap.class);
    }

    // ---- Playback ----

    @Override
    public void addPlaybackEvent(PlaybackEvent event) {
        Instant createdAt = event.createdAt() != null ? StoreQueries.millis(event.createdAt()) : now();
        long seq = access.nextId("playback_event");
        write(KeySpace.playbackEvent(event.userId(), event.bookId(), createdAt.toEpochMilli(), seq),
            event.withCreatedAt(createdAt));
    }

    @Override
    public List<PlaybackEvent> listPlaybackEvents(String userId, String bookId, int limit) {
        List<PlaybackEvent> events = scanValues(KeySpace.playbackEventPrefix(userId, bookId), PlaybackEvent.class);
        Collections.reverse(events);
        return StoreQueries.page(events, limit, 0);
    }

    @Override
    public void updatePlaybackProgress(PlaybackProgress progress) {
        Instant updatedAt = progress.updatedAt() != null ? StoreQueries.millis(progress.updatedAt()) : now();
        write(KeySpace.playbackProgress(progress.userId(), progress.bookId()), progress.withUpdatedAt(updatedAt));
    }

    @Override
    public Optional<PlaybackProgress> getPlaybackProgress(String userId, String bookId) {
        return read(KeySpace.playbackProgress(userId, bookId), PlaybackProgress.class);
    }

    // ---- Stats ----

    @Override
    public void incrementBookPlayStats(String bookId, int seconds) {
        Map<String, Long> deltas = new LinkedHashMap<>();
        deltas.put(KeySpace.STATS_BOOK_PLAYS + bookId, 1L);
        deltas.put(KeySpace.STATS_BOOK_SECONDS + bookId, (long) seconds);
        access.incrementAll(deltas);
    }

    @Override
    public BookStats getBookStats(String bookId) {
        return new BookStats(bookId,
            access.readLong(KeySpace.STATS_BOOK_PLAYS + bookId, 0L),
            access.readLong(KeySpace.STATS_BOOK_SECONDS + bookId, 0L));
    }

    @Override
    public void incrementUserListenStats(String userId, int seconds) {
        access.incrementAll(Map.of(KeySpace.STATS_USER_SECONDS + userId, (long) seconds));
    }

    @Override
    public UserStats getUserStats(String userId) {
        return new UserStats(userId, access.readLong(KeySpace.STATS_USER_SECONDS + userId, 0L));
    }

    // ---- Do-not-import blocklist ----

    @Override
    public boolean isHashBlocked(String hash) {
        return access.exists(KeySpace.BLOCKED_HASH + hash);
    }

    @Override
    public void addBlockedHash(String hash, String reason) {
        write(KeySpace.BLOCKED_HASH + requireText(hash, "hash"), new DoNotImport(hash, reason, now()));
    }

    @Override
    public void removeBlockedHash(String hash) {
        try (RocksDbAccess.Batch batch = access.batch()) {
            batch.delete(KeySpace.BLOCKED_HASH + hash);
            batch.commit();
        }
    }

    @Override
    public List<DoNotImport> getAllBlockedHashes() {
        List<DoNotImport> entries = scanValues(KeySpace.BLOCKED_HASH, DoNotImport.class);
        entries.sort(Comparator.comparing(DoNotImport::hash));
        return entries;
    }

    @Override
    public Optional<DoNotImport> getBlockedHashByHash(String hash) {
        return read(KeySpace.BLOCKED_HASH + hash, DoNotImport.class);
    }

    // ---- Legacy key migration ----

    /**
     * Renames {@code library:*} records and their path index to the {@code import_path:*}
     * family in one batch. The legacy counter is copied only when the import path counter does
     * not exist yet, then removed. A second call finds no legacy keys and changes nothing.
     */
    @Override
    public int migrateLegacyImportPaths() {
        List<RocksDbAccess.Entry> legacy = access.scan(KeySpace.LEGACY_LIBRARY);
        String legacyCounterKey = KeySpace.counter("library");
        String counterKey = KeySpace.counter("import_path");
        Optional<String> legacyCounter = access.getString(legacyCounterKey);
        if (legacy.isEmpty() && legacyCounter.isEmpty()) {
            return 0;
        }

        int maxMigratedId = 0;
        try (RocksDbAccess.Batch batch = access.batch()) {
            for (RocksDbAccess.Entry entry : legacy) {
                String key = entry.key();
                String renamed = key.startsWith(KeySpace.LEGACY_LIBRARY_PATH)
                    ? KeySpace.IMPORT_PATH_PATH + key.substring(KeySpace.LEGACY_LIBRARY_PATH.length())
                    : KeySpace.IMPORT_PATH + key.substring(KeySpace.LEGACY_LIBRARY.length());
                batch.put(renamed, entry.value());
                batch.delete(key);
                if (KeySpace.isPrimary(KeySpace.IMPORT_PATH, renamed)) {
                    maxMigratedId = Math.max(maxMigratedId, legacyId(renamed));
                }
            }
            boolean counterExists = access.exists(counterKey);
            if (legacyCounter.isPresent()) {
                if (!counterExists) {
                    batch.put(counterKey, legacyCounter.get());
                }
                batch.delete(legacyCounterKey);
            } else if (!counterExists && maxMigratedId > 0) {
                batch.put(counterKey, Long.toString(maxMigratedId + 1L));
            }
            batch.commit();
        }
        log.debug("Moved {} legacy library keys to the import path family", legacy.size());
        return legacy.size();
    }

    private static int legacyId(String primaryKey) {
        try {
            return Integer.parseInt(primaryKey.substring(KeySpace.IMPORT_PATH.length()));
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private Optional<Book> indexedBook(String indexKey) {
        return indexTarget(indexKey).flatMap(id -> {
            String key = KeySpace.primary(KeySpace.BOOK, id);
            return access.get(key).flatMap(value -> decodeOrSkip(new RocksDbAccess.Entry(key, value), Book.class));
        });
    }

    /** The newest book other than {@code excludedId} still carrying {@code value} under a hash index. */
    private Optional<Book> newestHashHolder(String prefix, String value, String excludedId) {
        Function<Book, String> attribute = HASH_INDEXES.get(prefix);
        Book newest = null;
        for (Book candidate : allBookRecords()) {
            if (candidate.getId().equals(excludedId) || !value.equals(attribute.apply(candidate))) {
                continue;
            }
            if (newest == null || HASH_PRECEDENCE.compare(candidate, newest) > 0) {
                newest = candidate;
            }
        }
        return Optional.ofNullable(newest);
    }

    /**
     * Index entries derived from one book version. Unique indexes (path, hashes) map a value to a
     * single book id; multi-valued indexes (series, author, work, version group) embed the book id
     * in the key. Books may share a hash; the hash entry then names the newest holder.
     */
    private record BookIndexes(Book book, Map<String, String> unique, Set<String> multi) {

        static BookIndexes of(Book book) {
            String id = book.getId();
            Map<String, String> unique = new LinkedHashMap<>();
            unique.put(KeySpace.BOOK_PATH, book.getFilePath());
            unique.put(KeySpace.BOOK_HASH, book.getFileHash());
            unique.put(KeySpace.BOOK_ORIGINAL_HASH, book.getOriginalFileHash());
            unique.put(KeySpace.BOOK_ORGANIZED_HASH, book.getOrganizedFileHash());
            Set<String> multi = new LinkedHashSet<>();
            if (book.getSeriesId() != null) {
                multi.add(KeySpace.bookSeries(book.getSeriesId(), id));
            }
            if (book.getAuthorId() != null) {
                multi.add(KeySpace.bookAuthor(book.getAuthorId(), id));
            }
            if (book.getWorkId() != null && !book.getWorkId().isEmpty()) {
                multi.add(KeySpace.bookWork(book.getWorkId(), id));
            }
            if (book.getVersionGroupId() != null && !book.getVersionGroupId().isEmpty()) {
                multi.add(KeySpace.bookVersionGroup(book.getVersionGroupId(), id));
            }
            return new BookIndexes(book, unique, multi);
        }

        void writeAll(RocksDbAccess.Batch batch, RocksDbAudiobookStore store) {
            unique.forEach((prefix, value) -> claim(batch, prefix, value, store));
            for (String key : multi) {
                batch.put(key, book.getId());
            }
        }

        void deleteAll(RocksDbAccess.Batch batch, RocksDbAudiobookStore store) {
            unique.forEach((prefix, value) -> release(batch, prefix, value, store));
            for (String key : multi) {
                batch.delete(key);
            }
        }

        void diff(BookIndexes next, RocksDbAccess.Batch batch, RocksDbAudiobookStore store) {
            BiFunction<String, String, Boolean> same = (a, b) -> Objects.equals(emptyToNull(a), emptyToNull(b));
            unique.forEach((prefix, oldValue) -> {
                String newValue = next.unique.get(prefix);
                if (same.apply(oldValue, newValue)) {
                    return;
                }
                release(batch, prefix, oldValue, store);
                next.claim(batch, prefix, newValue, store);
            });
            for (String key : multi) {
                if (!next.multi.contains(key)) {
                    batch.delete(key);
                }
            }
            for (String key : next.multi) {
                if (!multi.contains(key)) {
                    batch.put(key, book.getId());
                }
            }
        }

        /** Points the entry at this book unless a newer book already holds the same hash. */
        private void claim(RocksDbAccess.Batch batch, String prefix, String value, RocksDbAudiobookStore store) {
            if (value == null || value.isEmpty()) {
                return;
            }
            String key = prefix + value;
            if (HASH_INDEXES.containsKey(prefix)) {
                Optional<Book> holder = store.indexedBook(key);
                if (holder.isPresent() && !holder.get().getId().equals(book.getId())
                        && HASH_PRECEDENCE.compare(holder.get(), book) > 0) {
                    return;
                }
            }
            batch.put(key, book.getId());
        }

        /** Drops the entry if this book owns it, handing a hash entry over to the next newest holder. */
        private void release(RocksDbAccess.Batch batch, String prefix, String value, RocksDbAudiobookStore store) {
            if (value == null || value.isEmpty()) {
                return;
            }
            String key = prefix + value;
            if (!store.indexTarget(key).map(book.getId()::equals).orElse(false)) {
                return;
            }
            Optional<Book> successor = HASH_INDEXES.containsKey(prefix)
                ? store.newestHashHolder(prefix, value, book.getId())
                : Optional.empty();
            if (successor.isPresent()) {
                batch.put(key, successor.get().getId());
            } else {
                batch.delete(key);
            }
        }

        private static String emptyToNull(String value) {
            return value == null || value.isEmpty() ? null : value;
        }
    }
}
