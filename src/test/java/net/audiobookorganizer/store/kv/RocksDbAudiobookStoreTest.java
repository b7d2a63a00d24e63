package net.audiobookorganizer.store.kv;

import static net.audiobookorganizer.support.TestBooks.book;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;
import net.audiobookorganizer.exception.StoreConstraintViolationException;
import net.audiobookorganizer.exception.StoreEncodingException;
import net.audiobookorganizer.model.Author;
import net.audiobookorganizer.model.Book;
import net.audiobookorganizer.model.BookAuthor;
import net.audiobookorganizer.model.BookSegment;
import net.audiobookorganizer.model.DurationMap;
import net.audiobookorganizer.model.Operation;
import net.audiobookorganizer.model.OperationStatus;
import net.audiobookorganizer.model.Session;
import net.audiobookorganizer.model.User;
import net.audiobookorganizer.store.AudiobookStore;
import net.audiobookorganizer.store.AudiobookStoreContractTest;
import net.audiobookorganizer.store.StoreJson;
import net.audiobookorganizer.support.MutableClock;
import org.junit.jupiter.api.Test;

class RocksDbAudiobookStoreTest extends AudiobookStoreContractTest {

    @Override
    protected AudiobookStore openStore(Path directory, MutableClock clock) {
        return new RocksDbAudiobookStore(directory.resolve("rocksdb"), new StoreJson(), clock);
    }

    private RocksDbAccess access() {
        return ((RocksDbAudiobookStore) store).access();
    }

    private void putRaw(String key, String value) {
        try (RocksDbAccess.Batch batch = access().batch()) {
            batch.put(key, value.getBytes(StandardCharsets.UTF_8));
            batch.commit();
        }
    }

    @Test
    void should_WriteEveryIndexKey_When_BookCreated() {
        Author author = store.createAuthor("Le Guin");
        Book created = store.createBook(Book.builder()
            .title("The Dispossessed")
            .filePath("/library/dispossessed.m4b")
            .fileHash("fh")
            .originalFileHash("oh")
            .organizedFileHash("zh")
            .authorId(author.id())
            .seriesId(7)
            .workId("W1")
            .versionGroupId("G1")
            .build());
        String id = created.getId();

        assertThat(access().getString(KeySpace.BOOK_PATH + "/library/dispossessed.m4b")).contains(id);
        assertThat(access().getString(KeySpace.BOOK_HASH + "fh")).contains(id);
        assertThat(access().getString(KeySpace.BOOK_ORIGINAL_HASH + "oh")).contains(id);
        assertThat(access().getString(KeySpace.BOOK_ORGANIZED_HASH + "zh")).contains(id);
        assertThat(access().exists(KeySpace.bookAuthor(author.id(), id))).isTrue();
        assertThat(access().exists(KeySpace.bookSeries(7, id))).isTrue();
        assertThat(access().exists(KeySpace.bookWork("W1", id))).isTrue();
        assertThat(access().exists(KeySpace.bookVersionGroup("G1", id))).isTrue();
    }

    @Test
    void should_RewriteOnlyChangedIndexes_When_BookUpdated() {
        Book created = store.createBook(book("Title", "/library/a.m4b", "hash-a").toBuilder().seriesId(1).build());
        String id = created.getId();

        store.updateBook(id, created.toBuilder().seriesId(2).fileHash(null).build());

        assertThat(access().exists(KeySpace.bookSeries(1, id))).isFalse();
        assertThat(access().exists(KeySpace.bookSeries(2, id))).isTrue();
        assertThat(access().exists(KeySpace.BOOK_HASH + "hash-a")).isFalse();
        assertThat(access().getString(KeySpace.BOOK_PATH + "/library/a.m4b")).contains(id);
    }

    @Test
    void should_KeepOtherOwnersIndex_When_SharedHashBookDeleted() {
        Book first = store.createBook(book("First", "/library/1.m4b", "shared"));
        Book second = store.createBook(book("Second", "/library/2.m4b", "shared"));
        assertThat(access().getString(KeySpace.BOOK_HASH + "shared")).contains(second.getId());

        store.deleteBook(first.getId());

        assertThat(access().getString(KeySpace.BOOK_HASH + "shared")).contains(second.getId());
        assertThat(store.getBookByFileHash("shared")).contains(second);
    }

    @Test
    void should_HandHashIndexToRemainingBook_When_OwnerDeleted() {
        Book first = store.createBook(book("First", "/library/1.m4b", "shared"));
        Book second = store.createBook(book("Second", "/library/2.m4b", "shared"));

        store.deleteBook(second.getId());

        assertThat(access().getString(KeySpace.BOOK_HASH + "shared")).contains(first.getId());
    }

    @Test
    void should_KeepEverySegmentInDurationMap_When_SegmentsAddedConcurrently() throws Exception {
        Book book = store.createBook(book("Parallel", "/library/parallel"));
        int segments = 64;

        runConcurrently(segments, i -> store.createBookSegment(book.getId(), BookSegment.builder()
            .filePath("/library/parallel/" + i + ".mp3").format("mp3").durationSec(10).trackNumber(i).build()));

        assertThat(store.listBookSegments(book.getId())).hasSize(segments);
        DurationMap map = store.getDurationMap(book.getId()).orElseThrow();
        assertThat(map.segments()).hasSize(segments);
        assertThat(map.totalDuration()).isEqualTo(segments * 10);
    }

    @Test
    void should_KeepEveryLink_When_AuthorsAddedConcurrently() throws Exception {
        Book book = store.createBook(book("Anthology", "/library/anthology.m4b"));
        List<Author> authors = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            authors.add(store.createAuthor("Contributor " + i));
        }

        runConcurrently(authors.size(), i -> store.addBookAuthor(
            new BookAuthor(book.getId(), authors.get(i).id(), BookAuthor.ROLE_CO_AUTHOR, i)));

        assertThat(store.getBookAuthors(book.getId())).hasSize(authors.size());
        assertThat(store.getBooksByAuthorIdWithRole(authors.get(31).id())).extracting(Book::getId)
            .containsExactly(book.getId());
    }

    @Test
    void should_ApplyEveryUpdate_When_OperationProgressReportedConcurrently() throws Exception {
        store.createOperation("op-parallel", "scan", null);

        runConcurrently(16, i -> store.addOperationLog("op-parallel", "info", "step " + i, null));
        runConcurrently(16, i -> store.updateOperationStatus("op-parallel", OperationStatus.RUNNING, i, 16, "working"));

        assertThat(store.getOperationLogs("op-parallel")).hasSize(16);
        assertThat(store.getOperationById("op-parallel")).map(Operation::status).contains(OperationStatus.RUNNING);
    }

    private static void runConcurrently(int tasks, IntConsumer task) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < tasks; i++) {
                int index = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    task.accept(index);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void should_KeepIndexes_When_BookSoftDeleted() {
        Book created = store.createBook(book("Kept", "/library/kept.m4b", "kept-hash"));

        store.markBookForDeletion(created.getId(), Instant.parse("2024-01-01T00:00:00Z"));

        assertThat(access().exists(KeySpace.BOOK_PATH + "/library/kept.m4b")).isTrue();
        assertThat(store.getBookByFilePath("/library/kept.m4b")).contains(created);
        assertThatThrownBy(() -> store.createBook(book("Clash", "/library/kept.m4b")))
            .isInstanceOf(StoreConstraintViolationException.class);
    }

    @Test
    void should_SkipIndexKeys_When_ScanningFamily() {
        store.createAuthor("Only Author");
        store.createBook(book("Only Book", "/library/only.m4b", "only-hash").toBuilder().seriesId(3).build());

        assertThat(access().keys(KeySpace.BOOK)).hasSizeGreaterThan(1);
        assertThat(store.getAllBooks(0, 0)).hasSize(1);
        assertThat(store.getAllAuthors()).extracting(Author::name).containsExactly("Only Author");
    }

    @Test
    void should_SkipCorruptRecord_When_Listing() {
        store.createBook(book("Healthy", "/library/healthy.m4b"));
        putRaw(KeySpace.primary(KeySpace.BOOK, "01BROKENBROKENBROKENBROKEN"), "{not json");

        assertThat(store.getAllBooks(0, 0)).extracting(Book::getTitle).containsExactly("Healthy");
        assertThatThrownBy(() -> store.getBookById("01BROKENBROKENBROKENBROKEN"))
            .isInstanceOf(StoreEncodingException.class);
    }

    @Test
    void should_IssueIncreasingIds_When_CounterUsed() {
        long first = access().nextId("sample");
        long second = access().nextId("sample");
        long third = access().nextId("sample");

        assertThat(first).isEqualTo(1);
        assertThat(List.of(first, second, third)).isSorted().doesNotHaveDuplicates();
        assertThat(access().readLong(KeySpace.counter("sample"), 0)).isEqualTo(4);
    }

    @Test
    void should_PersistRecords_When_Reopened() {
        Book created = store.createBook(book("Durable", "/library/durable.m4b"));
        store.close();

        store = openStore(tempDir, clock);

        assertThat(store.getBookByFilePath("/library/durable.m4b")).contains(created);
    }

    // ---- users & sessions, which only this engine stores ----

    @Test
    void should_EnforceUniqueUsernameAndEmail_When_CreatingUsers() {
        User user = store.createUser("Reader", "reader@example.com", "argon2id", "hash", List.of("admin"), "active");

        assertThat(store.getUserByUsername("reader")).contains(user);
        assertThat(store.getUserByEmail("READER@example.com")).contains(user);
        assertThat(store.countUsers()).isEqualTo(1);
        assertThatThrownBy(() -> store.createUser("READER", "other@example.com", "argon2id", "h", List.of(), "active"))
            .isInstanceOf(StoreConstraintViolationException.class);
        assertThatThrownBy(() -> store.createUser("other", "reader@example.com", "argon2id", "h", List.of(), "active"))
            .isInstanceOf(StoreConstraintViolationException.class);
    }

    @Test
    void should_MoveUsernameIndex_When_UserRenamed() {
        User user = store.createUser("old-name", "u@example.com", "argon2id", "hash", List.of(), "active");

        store.updateUser(new User(user.id(), "new-name", user.email(), user.passwordHashAlgo(), user.passwordHash(),
            user.roles(), "disabled", user.createdAt(), user.updatedAt(), user.version() + 1));

        assertThat(store.getUserByUsername("old-name")).isEmpty();
        assertThat(store.getUserByUsername("new-name")).map(User::status).contains("disabled");
    }

    @Test
    void should_SweepRevokedAndExpiredSessions_When_Cleaning() {
        User user = store.createUser("sessions", "s@example.com", "argon2id", "hash", List.of(), "active");
        Session live = store.createSession(user.id(), "127.0.0.1", "test", Duration.ofHours(2));
        Session expiring = store.createSession(user.id(), "127.0.0.1", "test", Duration.ofMinutes(5));
        Session revoked = store.createSession(user.id(), "127.0.0.1", "test", Duration.ofHours(2));
        store.revokeSession(revoked.id());

        int deleted = store.deleteExpiredSessions(START.plus(Duration.ofMinutes(10)));

        assertThat(deleted).isEqualTo(2);
        assertThat(store.listUserSessions(user.id())).extracting(Session::id).containsExactly(live.id());
        assertThat(store.getSession(expiring.id())).isEmpty();
        assertThat(access().keys(KeySpace.sessionByUserPrefix(user.id()))).hasSize(1);
    }
}
