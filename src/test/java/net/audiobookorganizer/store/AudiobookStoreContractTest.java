package net.audiobookorganizer.store;

import static net.audiobookorganizer.support.TestBooks.book;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import net.audiobookorganizer.exception.StoreConstraintViolationException;
import net.audiobookorganizer.model.Author;
import net.audiobookorganizer.model.Book;
import net.audiobookorganizer.model.BookAuthor;
import net.audiobookorganizer.model.BookNarrator;
import net.audiobookorganizer.model.BookSegment;
import net.audiobookorganizer.model.DashboardStats;
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
import net.audiobookorganizer.model.Setting;
import net.audiobookorganizer.model.Work;
import net.audiobookorganizer.support.MutableClock;
import net.audiobookorganizer.util.IdGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Behaviour every {@link AudiobookStore} engine must share. Subclasses only open the engine.
 */
public abstract class AudiobookStoreContractTest {

    protected static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    @TempDir
    protected Path tempDir;

    protected MutableClock clock;
    protected AudiobookStore store;

    protected abstract AudiobookStore openStore(Path directory, MutableClock clock);

    @BeforeEach
    void openEngine() {
        clock = new MutableClock(START);
        store = openStore(tempDir, clock);
    }

    @AfterEach
    void closeEngine() {
        store.close();
    }

    protected Book createBook(String title, String path) {
        return store.createBook(book(title, path));
    }

    // ---- books ----

    @Test
    void should_RoundTripEveryField_When_BookIsCreated() {
        Author author = store.createAuthor("Ursula K. Le Guin");
        Series series = store.createSeries("Earthsea", author.id());
        Book created = store.createBook(Book.builder()
            .title("A Wizard of Earthsea")
            .filePath("/library/earthsea/01.m4b")
            .authorId(author.id())
            .seriesId(series.id())
            .seriesSequence(1)
            .format("m4b")
            .duration(26_000)
            .narrator("Rob Inglis")
            .isbn13("9780553383041")
            .fileHash("hash-1")
            .fileSize(412_000_000L)
            .bitrate(64)
            .codec("aac")
            .sampleRate(44_100)
            .channels(2)
            .build());

        Book loaded = store.getBookById(created.getId()).orElseThrow();

        assertThat(IdGenerator.isUlid(created.getId())).isTrue();
        assertThat(loaded.getTitle()).isEqualTo("A Wizard of Earthsea");
        assertThat(loaded.getAuthorId()).isEqualTo(author.id());
        assertThat(loaded.getSeriesId()).isEqualTo(series.id());
        assertThat(loaded.getSeriesSequence()).isEqualTo(1);
        assertThat(loaded.getDuration()).isEqualTo(26_000);
        assertThat(loaded.getNarrator()).isEqualTo("Rob Inglis");
        assertThat(loaded.getIsbn13()).isEqualTo("9780553383041");
        assertThat(loaded.getFileSize()).isEqualTo(412_000_000L);
        assertThat(loaded.getSampleRate()).isEqualTo(44_100);
        assertThat(loaded.getIsPrimaryVersion()).isTrue();
        assertThat(loaded.getLibraryState()).isEqualTo(Book.DEFAULT_LIBRARY_STATE);
        assertThat(loaded.getQuantity()).isEqualTo(1);
        assertThat(loaded.getMarkedForDeletion()).isFalse();
        assertThat(loaded.getCreatedAt()).isEqualTo(START);
        assertThat(loaded.getUpdatedAt()).isEqualTo(START);
    }

    @Test
    void should_FindBookByPathAndHashes_When_Indexed() {
        Book created = store.createBook(Book.builder()
            .title("Dune")
            .filePath("/library/dune.m4b")
            .fileHash("file-hash")
            .originalFileHash("original-hash")
            .organizedFileHash("organized-hash")
            .build());

        assertThat(store.getBookByFilePath("/library/dune.m4b")).contains(created);
        assertThat(store.getBookByFileHash("file-hash")).contains(created);
        assertThat(store.getBookByOriginalHash("original-hash")).contains(created);
        assertThat(store.getBookByOrganizedHash("organized-hash")).contains(created);
        assertThat(store.getBookByFileHash("missing")).isEmpty();
    }

    @Test
    void should_RejectBook_When_FilePathAlreadyStored() {
        createBook("First", "/library/same.m4b");

        assertThatThrownBy(() -> createBook("Second", "/library/same.m4b"))
            .isInstanceOf(StoreConstraintViolationException.class);
        assertThat(store.countBooks()).isEqualTo(1);
    }

    @Test
    void should_PreserveCreatedAtAndMoveIndexes_When_BookIsUpdated() {
        Book created = store.createBook(book("Old Title", "/library/old.m4b", "hash-old"));
        clock.advance(Duration.ofMinutes(5));

        Book changed = created.toBuilder().title("New Title").filePath("/library/new.m4b").fileHash("hash-new").build();
        Book updated = store.updateBook(created.getId(), changed);

        assertThat(updated.getCreatedAt()).isEqualTo(START);
        assertThat(updated.getUpdatedAt()).isEqualTo(START.plus(Duration.ofMinutes(5)));
        assertThat(store.getBookByFilePath("/library/old.m4b")).isEmpty();
        assertThat(store.getBookByFileHash("hash-old")).isEmpty();
        assertThat(store.getBookByFilePath("/library/new.m4b")).map(Book::getTitle).contains("New Title");
        assertThat(store.getBookByFileHash("hash-new")).contains(created);
    }

    @Test
    void should_FindRemainingHolder_When_NewestSharedHashHolderDeleted() {
        Book first = store.createBook(book("First", "/library/1.m4b", "shared").toBuilder()
            .organizedFileHash("organized-shared").build());
        clock.advance(Duration.ofMinutes(1));
        Book second = store.createBook(book("Second", "/library/2.m4b", "shared").toBuilder()
            .organizedFileHash("organized-shared").build());
        assertThat(store.getBookByFileHash("shared")).map(Book::getId).contains(second.getId());

        store.deleteBook(second.getId());

        assertThat(store.getBookByFileHash("shared")).map(Book::getId).contains(first.getId());
        assertThat(store.getBookByOrganizedHash("organized-shared")).map(Book::getId).contains(first.getId());

        store.deleteBook(first.getId());

        assertThat(store.getBookByFileHash("shared")).isEmpty();
        assertThat(store.getBookByOrganizedHash("organized-shared")).isEmpty();
    }

    @Test
    void should_FindRemainingHolder_When_NewestSharedHashHolderChangesHash() {
        Book first = store.createBook(book("First", "/library/1.m4b", "shared"));
        clock.advance(Duration.ofMinutes(1));
        Book second = store.createBook(book("Second", "/library/2.m4b", "shared"));

        store.updateBook(second.getId(), second.toBuilder().fileHash("re-encoded").build());

        assertThat(store.getBookByFileHash("shared")).map(Book::getId).contains(first.getId());
        assertThat(store.getBookByFileHash("re-encoded")).map(Book::getId).contains(second.getId());
    }

    @Test
    void should_KeepNewestHolder_When_OlderBookTakesSharedHash() {
        Book older = store.createBook(book("Older", "/library/older.m4b", "own-hash"));
        clock.advance(Duration.ofMinutes(1));
        Book newer = store.createBook(book("Newer", "/library/newer.m4b", "shared"));

        store.updateBook(older.getId(), older.toBuilder().fileHash("shared").build());

        assertThat(store.getBookByFileHash("shared")).map(Book::getId).contains(newer.getId());
        assertThat(store.getBookByFileHash("own-hash")).isEmpty();
    }

    @Test
    void should_RejectCallerIdsContainingColon_When_Creating() {
        assertThatThrownBy(() -> store.createBook(book("Bad", "/library/bad.m4b").toBuilder().id("a:b").build()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.createWork(Work.of("Bad", null, null, List.of()).withId("work:1")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.createOperation("scan:1", "scan", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.countBooks()).isZero();
        assertThat(store.getAllWorks()).isEmpty();
    }

    @Test
    void should_KeepCallerSuppliedId_When_IdIsStorable() {
        Book created = store.createBook(book("Custom", "/library/custom.m4b").toBuilder().id("legacy-book-42").build());

        assertThat(created.getId()).isEqualTo("legacy-book-42");
        assertThat(store.getBookById("legacy-book-42")).map(Book::getTitle).contains("Custom");
    }

    @Test
    void should_Fail_When_UpdatingMissingBook() {
        assertThatThrownBy(() -> store.updateBook("01HZZZZZZZZZZZZZZZZZZZZZZZ", book("Ghost", "/library/ghost.m4b")))
            .isInstanceOf(StoreConstraintViolationException.class);
    }

    @Test
    void should_RejectUpdate_When_NewPathBelongsToAnotherBook() {
        createBook("One", "/library/one.m4b");
        Book two = createBook("Two", "/library/two.m4b");

        assertThatThrownBy(() -> store.updateBook(two.getId(), two.toBuilder().filePath("/library/one.m4b").build()))
            .isInstanceOf(StoreConstraintViolationException.class);
        assertThat(store.getBookById(two.getId())).map(Book::getFilePath).contains("/library/two.m4b");
    }

    @Test
    void should_RemoveBookAndLinks_When_HardDeleted() {
        Author author = store.createAuthor("Frank Herbert");
        Book created = store.createBook(book("Dune", "/library/dune.m4b", "hash-dune").toBuilder()
            .authorId(author.id()).build());
        store.setBookAuthors(created.getId(), List.of(new BookAuthor(created.getId(), author.id(), BookAuthor.ROLE_AUTHOR, 0)));
        store.upsertMetadataFieldState(new MetadataFieldState(created.getId(), "title", "Dune", null, false, null));

        store.deleteBook(created.getId());

        assertThat(store.getBookById(created.getId())).isEmpty();
        assertThat(store.getBookByFilePath("/library/dune.m4b")).isEmpty();
        assertThat(store.getBookByFileHash("hash-dune")).isEmpty();
        assertThat(store.getBookAuthors(created.getId())).isEmpty();
        assertThat(store.getMetadataFieldStates(created.getId())).isEmpty();
        assertThat(store.getBooksByAuthorIdWithRole(author.id())).isEmpty();
        assertThat(createBook("Dune again", "/library/dune.m4b")).isNotNull();
    }

    @Test
    void should_OrderAndPageBooks_When_Listing() {
        createBook("Charlie", "/library/c.m4b");
        createBook("Alpha", "/library/a.m4b");
        createBook("Bravo", "/library/b.m4b");

        assertThat(store.getAllBooks(0, 0)).extracting(Book::getTitle).containsExactly("Alpha", "Bravo", "Charlie");
        assertThat(store.getAllBooks(1, 1)).extracting(Book::getTitle).containsExactly("Bravo");
        assertThat(store.getAllBooks(10, 5)).isEmpty();
    }

    @Test
    void should_MatchCaseInsensitively_When_SearchingTitles() {
        createBook("The Left Hand of Darkness", "/library/left.m4b");
        createBook("The Dispossessed", "/library/dispossessed.m4b");
        createBook("Lathe of Heaven", "/library/lathe.m4b");

        assertThat(store.searchBooks("DARK", 0, 0)).extracting(Book::getTitle)
            .containsExactly("The Left Hand of Darkness");
        assertThat(store.searchBooks("the", 0, 0)).extracting(Book::getTitle)
            .containsExactly("Lathe of Heaven", "The Dispossessed", "The Left Hand of Darkness");
        assertThat(store.searchBooks("the", 1, 0)).hasSize(1);
    }

    @Test
    void should_OrderSeriesBooksBySequence_When_SomeSequencesMissing() {
        Series series = store.createSeries("Discworld", null);
        store.createBook(book("Zeta Extra", "/library/x.m4b").toBuilder().seriesId(series.id()).build());
        store.createBook(book("Mort", "/library/mort.m4b").toBuilder().seriesId(series.id()).seriesSequence(4).build());
        store.createBook(book("The Colour of Magic", "/library/colour.m4b").toBuilder()
            .seriesId(series.id()).seriesSequence(1).build());

        assertThat(store.getBooksBySeriesId(series.id())).extracting(Book::getTitle)
            .containsExactly("The Colour of Magic", "Mort", "Zeta Extra");
    }

    // ---- soft delete ----

    @Test
    void should_HideBookFromListings_When_MarkedForDeletion() {
        Author author = store.createAuthor("Iain M. Banks");
        Book kept = store.createBook(book("Excession", "/library/excession.m4b").toBuilder().authorId(author.id()).build());
        Book marked = store.createBook(book("Consider Phlebas", "/library/phlebas.m4b").toBuilder()
            .authorId(author.id()).build());

        store.markBookForDeletion(marked.getId(), START.plusSeconds(60));

        assertThat(store.getAllBooks(0, 0)).containsExactly(kept);
        assertThat(store.countBooks()).isEqualTo(1);
        assertThat(store.searchBooks("Phlebas", 0, 0)).isEmpty();
        assertThat(store.getBooksByAuthorId(author.id())).containsExactly(kept);
        assertThat(store.getBookById(marked.getId())).hasValueSatisfying(book -> {
            assertThat(book.isSoftDeleted()).isTrue();
            assertThat(book.getMarkedForDeletionAt()).isEqualTo(START.plusSeconds(60));
        });
        assertThat(store.listSoftDeletedBooks(0, 0, null)).containsExactly(marked);
    }

    @Test
    void should_ReturnBookToListings_When_Restored() {
        Book marked = createBook("Use of Weapons", "/library/weapons.m4b");
        store.markBookForDeletion(marked.getId(), START);

        Book restored = store.restoreBook(marked.getId());

        assertThat(restored.isSoftDeleted()).isFalse();
        assertThat(restored.getMarkedForDeletionAt()).isNull();
        assertThat(store.getAllBooks(0, 0)).containsExactly(marked);
        assertThat(store.listSoftDeletedBooks(0, 0, null)).isEmpty();
    }

    @Test
    void should_OrderAndFilterSoftDeleted_When_OlderThanGiven() {
        Book early = createBook("Early", "/library/early.m4b");
        Book late = createBook("Late", "/library/late.m4b");
        store.markBookForDeletion(early.getId(), START.minus(Duration.ofDays(10)));
        store.markBookForDeletion(late.getId(), START.minus(Duration.ofDays(1)));

        assertThat(store.listSoftDeletedBooks(0, 0, null)).containsExactly(late, early);
        assertThat(store.listSoftDeletedBooks(0, 0, START.minus(Duration.ofDays(5)))).containsExactly(early);
        assertThat(store.listSoftDeletedBooks(1, 1, null)).containsExactly(early);
    }

    @Test
    void should_Fail_When_MarkingMissingBook() {
        assertThatThrownBy(() -> store.markBookForDeletion("01HZZZZZZZZZZZZZZZZZZZZZZZ", START))
            .isInstanceOf(StoreConstraintViolationException.class);
    }

    // ---- duplicates & versions ----

    @Test
    void should_GroupBooksByContentHash_When_FindingDuplicates() {
        Book c = store.createBook(book("C", "/library/c.m4b", "h1"));
        Book a = store.createBook(book("A", "/library/a.m4b", "h1"));
        Book b = store.createBook(book("B", "/library/b.m4b", "other").toBuilder().organizedFileHash("h1").build());
        store.createBook(book("D", "/library/d.m4b", "h2"));
        Book e = store.createBook(book("E", "/library/e.m4b", "h2"));
        store.markBookForDeletion(e.getId(), START);
        store.createBook(book("F", "/library/f.m4b"));

        List<List<Book>> groups = store.getDuplicateBooks();

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0)).containsExactly(a, b, c);
    }

    @Test
    void should_ListPrimaryVersionFirst_When_ReadingVersionGroup() {
        String group = IdGenerator.ulid();
        Book primary = store.createBook(book("Zeta Edition", "/library/z.m4b").toBuilder()
            .versionGroupId(group).isPrimaryVersion(true).build());
        Book alternate = store.createBook(book("Alpha Edition", "/library/a.m4b").toBuilder()
            .versionGroupId(group).isPrimaryVersion(false).build());
        Book deleted = store.createBook(book("Beta Edition", "/library/b.m4b").toBuilder()
            .versionGroupId(group).isPrimaryVersion(false).build());
        store.markBookForDeletion(deleted.getId(), START);
        createBook("Unrelated", "/library/u.m4b");

        assertThat(store.getBooksByVersionGroup(group)).containsExactly(primary, alternate);
    }

    @Test
    void should_DropBookFromOldGroup_When_VersionGroupChanges() {
        String first = IdGenerator.ulid();
        String second = IdGenerator.ulid();
        Book created = store.createBook(book("Mover", "/library/mover.m4b").toBuilder().versionGroupId(first).build());

        store.updateBook(created.getId(), created.toBuilder().versionGroupId(second).build());

        assertThat(store.getBooksByVersionGroup(first)).isEmpty();
        assertThat(store.getBooksByVersionGroup(second)).containsExactly(created);
    }

    // ---- segments ----

    private BookSegment segment(String path, int track, int duration) {
        return BookSegment.builder().filePath(path).format("mp3").sizeBytes(1_000L).durationSec(duration)
            .trackNumber(track).build();
    }

    @Test
    void should_ComputeOffsets_When_SegmentsAreAdded() {
        Book book = createBook("Multi", "/library/multi");
        store.createBookSegment(book.getId(), segment("/library/multi/02.mp3", 2, 200));
        BookSegment first = store.createBookSegment(book.getId(), segment("/library/multi/01.mp3", 1, 100));

        DurationMap map = store.getDurationMap(book.getId()).orElseThrow();

        assertThat(first.active()).isTrue();
        assertThat(first.version()).isEqualTo(1);
        assertThat(map.totalDuration()).isEqualTo(300);
        assertThat(map.segments()).extracting(DurationMap.Entry::offsetStart).containsExactly(0, 100);
        assertThat(map.segments().get(0).id()).isEqualTo(first.id());
    }

    @Test
    void should_SupersedeSegmentsAndRebuildMap_When_Merged() {
        Book book = createBook("Multi", "/library/multi");
        BookSegment one = store.createBookSegment(book.getId(), segment("/library/multi/01.mp3", 1, 100));
        BookSegment two = store.createBookSegment(book.getId(), segment("/library/multi/02.mp3", 2, 200));
        BookSegment three = store.createBookSegment(book.getId(), segment("/library/multi/03.mp3", 3, 300));

        BookSegment merged = store.mergeBookSegments(book.getId(), segment("/library/multi/01-02.mp3", 1, 300),
            List.of(one.id(), two.id()));

        assertThat(store.listBookSegments(book.getId())).extracting(BookSegment::id)
            .containsExactly(one.id(), two.id(), three.id(), merged.id());
        assertThat(store.getBookSegment(one.id())).hasValueSatisfying(segment -> {
            assertThat(segment.active()).isFalse();
            assertThat(segment.supersededBy()).isEqualTo(merged.id());
        });
        assertThat(store.getBookSegment(three.id())).map(BookSegment::active).contains(true);
        DurationMap map = store.getDurationMap(book.getId()).orElseThrow();
        assertThat(map.segments()).extracting(DurationMap.Entry::id).containsExactly(merged.id(), three.id());
        assertThat(map.segments()).extracting(DurationMap.Entry::offsetStart).containsExactly(0, 300);
        assertThat(map.totalDuration()).isEqualTo(600);
    }

    @Test
    void should_LeaveSegmentsUntouched_When_MergeNamesUnknownSegment() {
        Book book = createBook("Multi", "/library/multi");
        BookSegment one = store.createBookSegment(book.getId(), segment("/library/multi/01.mp3", 1, 100));

        assertThatThrownBy(() -> store.mergeBookSegments(book.getId(), segment("/library/multi/all.mp3", 1, 100),
            List.of(one.id(), "01HZZZZZZZZZZZZZZZZZZZZZZZ")))
            .isInstanceOf(StoreConstraintViolationException.class);

        assertThat(store.listBookSegments(book.getId())).containsExactly(one);
        assertThat(store.getDurationMap(book.getId()).orElseThrow().totalDuration()).isEqualTo(100);
    }

    // ---- reference data ----

    @Test
    void should_ReuseAuthor_When_NameDiffersOnlyInCase() {
        Author first = store.createAuthor("Terry Pratchett");
        Author second = store.createAuthor("terry pratchett");

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(store.getAuthorByName("TERRY PRATCHETT")).contains(first);
        assertThat(store.getAllAuthors()).containsExactly(first);
    }

    @Test
    void should_KeepSeriesPerAuthor_When_NamesCollide() {
        Author one = store.createAuthor("Author One");
        Author two = store.createAuthor("Author Two");

        Series first = store.createSeries("Chronicles", one.id());
        Series second = store.createSeries("Chronicles", two.id());
        Series orphan = store.createSeries("Chronicles", null);

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(orphan.id()).isNotIn(first.id(), second.id());
        assertThat(store.createSeries("chronicles", one.id())).isEqualTo(first);
        assertThat(store.getSeriesByName("Chronicles", null)).contains(orphan);
    }

    @Test
    void should_ReuseNarrator_When_CreatedTwice() {
        Narrator narrator = store.createNarrator("Stephen Fry");

        assertThat(store.createNarrator("Stephen Fry").id()).isEqualTo(narrator.id());
        assertThat(store.getNarratorByName("stephen fry")).map(Narrator::id).contains(narrator.id());
    }

    @Test
    void should_LinkBooksToWork_When_WorkIdSet() {
        Work work = store.createWork(Work.of("Foundation", null, null, List.of("Fundação")));
        Book book = store.createBook(book("Foundation", "/library/foundation.m4b").toBuilder().workId(work.id()).build());

        assertThat(IdGenerator.isUlid(work.id())).isTrue();
        assertThat(store.getWorkById(work.id())).map(Work::altTitles).contains(List.of("Fundação"));
        assertThat(store.getBooksByWorkId(work.id())).containsExactly(book);

        Work renamed = store.updateWork(work.id(), Work.of("Foundation (1951)", null, null, List.of()));
        assertThat(renamed.createdAt()).isEqualTo(work.createdAt());
        store.deleteWork(work.id());
        assertThat(store.getWorkById(work.id())).isEmpty();
    }

    @Test
    void should_FindBooksThroughLinkRows_When_AuthorIsCoAuthor() {
        Author lead = store.createAuthor("Neil Gaiman");
        Author partner = store.createAuthor("Terry Pratchett");
        Book omens = store.createBook(book("Good Omens", "/library/omens.m4b").toBuilder().authorId(lead.id()).build());
        String id = omens.getId();

        store.setBookAuthors(id, List.of(
            new BookAuthor(id, partner.id(), BookAuthor.ROLE_CO_AUTHOR, 1),
            new BookAuthor(id, lead.id(), BookAuthor.ROLE_AUTHOR, 0)));

        assertThat(store.getBookAuthors(id)).extracting(BookAuthor::authorId).containsExactly(lead.id(), partner.id());
        assertThat(store.getBooksByAuthorId(partner.id())).isEmpty();
        assertThat(store.getBooksByAuthorIdWithRole(partner.id())).containsExactly(omens);
        assertThat(store.addBookAuthor(new BookAuthor(id, partner.id(), BookAuthor.ROLE_CO_AUTHOR, 1))).isFalse();

        store.setBookAuthors(id, List.of(new BookAuthor(id, lead.id(), BookAuthor.ROLE_AUTHOR, 0)));
        assertThat(store.getBooksByAuthorIdWithRole(partner.id())).isEmpty();
    }

    @Test
    void should_KeepNarratorLinksOrdered_When_Added() {
        Narrator first = store.createNarrator("First Voice");
        Narrator second = store.createNarrator("Second Voice");
        Book book = createBook("Duet", "/library/duet.m4b");

        assertThat(store.addBookNarrator(new BookNarrator(book.getId(), second.id(), BookNarrator.ROLE_CO_NARRATOR, 1)))
            .isTrue();
        assertThat(store.addBookNarrator(new BookNarrator(book.getId(), first.id(), BookNarrator.ROLE_NARRATOR, 0)))
            .isTrue();
        assertThat(store.addBookNarrator(new BookNarrator(book.getId(), first.id(), BookNarrator.ROLE_NARRATOR, 0)))
            .isFalse();

        assertThat(store.getBookNarrators(book.getId())).extracting(BookNarrator::narratorId)
            .containsExactly(first.id(), second.id());
    }

    // ---- import paths ----

    @Test
    void should_RejectImportPath_When_PathAlreadyRegistered() {
        ImportPath created = store.createImportPath("/media/audiobooks", "Main");

        assertThat(created.enabled()).isTrue();
        assertThat(store.getImportPathByPath("/media/audiobooks")).contains(created);
        assertThatThrownBy(() -> store.createImportPath("/media/audiobooks", "Again"))
            .isInstanceOf(StoreConstraintViolationException.class);
    }

    @Test
    void should_MoveImportPathIndex_When_PathUpdated() {
        ImportPath created = store.createImportPath("/media/old", "Shelf");

        store.updateImportPath(created.id(), new ImportPath(created.id(), "/media/new", "Shelf", false,
            created.createdAt(), START, 12));

        assertThat(store.getImportPathByPath("/media/old")).isEmpty();
        assertThat(store.getImportPathByPath("/media/new")).hasValueSatisfying(path -> {
            assertThat(path.enabled()).isFalse();
            assertThat(path.bookCount()).isEqualTo(12);
            assertThat(path.lastScan()).isEqualTo(START);
        });
        store.deleteImportPath(created.id());
        assertThat(store.getAllImportPaths()).isEmpty();
    }

    // ---- operations ----

    @Test
    void should_TrackLifecycleTimestamps_When_OperationProgresses() {
        Operation created = store.createOperation("op-scan", "scan", "/media/audiobooks");
        assertThat(created.status()).isEqualTo(OperationStatus.PENDING);

        clock.advance(Duration.ofSeconds(1));
        store.updateOperationStatus("op-scan", OperationStatus.RUNNING, 1, 10, "scanning");
        clock.advance(Duration.ofSeconds(1));
        store.updateOperationStatus("op-scan", OperationStatus.COMPLETED, 10, 10, "done");

        Operation done = store.getOperationById("op-scan").orElseThrow();
        assertThat(done.startedAt()).isEqualTo(START.plusSeconds(1));
        assertThat(done.completedAt()).isEqualTo(START.plusSeconds(2));
        assertThat(done.progress()).isEqualTo(10);
        assertThat(done.message()).isEqualTo("done");
    }

    @Test
    void should_MarkOperationFailed_When_ErrorRecorded() {
        store.createOperation("op-organize", "organize", null);

        store.updateOperationError("op-organize", "disk full");

        assertThat(store.getOperationById("op-organize")).hasValueSatisfying(operation -> {
            assertThat(operation.status()).isEqualTo(OperationStatus.FAILED);
            assertThat(operation.errorMessage()).isEqualTo("disk full");
            assertThat(operation.completedAt()).isNotNull();
        });
        assertThatThrownBy(() -> store.createOperation("op-organize", "organize", null))
            .isInstanceOf(StoreConstraintViolationException.class);
    }

    @Test
    void should_ListNewestOperationsFirst_When_ReadingRecent() {
        store.createOperation("op-1", "scan", null);
        clock.advance(Duration.ofSeconds(1));
        store.createOperation("op-2", "scan", null);
        clock.advance(Duration.ofSeconds(1));
        store.createOperation("op-3", "scan", null);

        assertThat(store.getRecentOperations(2)).extracting(Operation::id).containsExactly("op-3", "op-2");
    }

    @Test
    void should_KeepInsertionOrder_When_ReadingOperationLogs() {
        store.createOperation("op-logs", "scan", null);
        store.addOperationLog("op-logs", "info", "started", null);
        store.addOperationLog("op-logs", "warn", "slow disk", "{\"ms\":900}");
        store.addOperationLog("op-other", "info", "elsewhere", null);
        store.addOperationLog("op-logs", "info", "finished", null);

        List<OperationLog> logs = store.getOperationLogs("op-logs");

        assertThat(logs).extracting(OperationLog::message).containsExactly("started", "slow disk", "finished");
        assertThat(logs.get(1).details()).isEqualTo("{\"ms\":900}");
    }

    // ---- preferences, settings, provenance ----

    @Test
    void should_UpsertPreference_When_KeySetTwice() {
        store.setUserPreference("theme", "dark");
        store.setUserPreference("theme", "light");
        store.setUserPreference("autoplay", "true");

        assertThat(store.getUserPreference("theme")).map(pref -> pref.value()).contains("light");
        assertThat(store.getAllUserPreferences()).extracting(pref -> pref.key()).containsExactly("autoplay", "theme");
    }

    @Test
    void should_StoreSettingsAsGiven_When_SetAndDeleted() {
        store.setSetting(new Setting("openai_api_key", "ciphertext", "string", true, null));
        store.setSetting(new Setting("concurrency", "4", "int", false, null));

        assertThat(store.getSetting("openai_api_key")).hasValueSatisfying(setting -> {
            assertThat(setting.value()).isEqualTo("ciphertext");
            assertThat(setting.secret()).isTrue();
        });
        assertThat(store.getAllSettings()).extracting(Setting::key).containsExactly("concurrency", "openai_api_key");

        store.deleteSetting("concurrency");
        assertThat(store.getSetting("concurrency")).isEmpty();
    }

    @Test
    void should_ReplaceFieldState_When_Upserted() {
        Book book = createBook("Provenance", "/library/p.m4b");
        store.upsertMetadataFieldState(new MetadataFieldState(book.getId(), "title", "Fetched", null, false, null));
        store.upsertMetadataFieldState(new MetadataFieldState(book.getId(), "title", "Fetched", "Mine", true, null));
        store.upsertMetadataFieldState(new MetadataFieldState(book.getId(), "author", "Someone", null, false, null));

        List<MetadataFieldState> states = store.getMetadataFieldStates(book.getId());

        assertThat(states).extracting(MetadataFieldState::field).containsExactly("author", "title");
        assertThat(states.get(1).overrideValue()).isEqualTo("Mine");
        assertThat(states.get(1).overrideLocked()).isTrue();

        store.deleteMetadataFieldState(book.getId(), "author");
        assertThat(store.getMetadataFieldStates(book.getId())).hasSize(1);
    }

    @Test
    void should_ReturnNewestChangeFirst_When_ReadingHistory() {
        Book book = createBook("History", "/library/h.m4b");
        store.recordMetadataChange(new MetadataChangeRecord(0, book.getId(), "title", null, "One", "fetched", "audible", null));
        clock.advance(Duration.ofSeconds(1));
        store.recordMetadataChange(new MetadataChangeRecord(0, book.getId(), "narrator", null, "N", "fetched", null, null));
        clock.advance(Duration.ofSeconds(1));
        MetadataChangeRecord latest = store.recordMetadataChange(
            new MetadataChangeRecord(0, book.getId(), "title", "One", "Two", "override", "user", null));

        assertThat(latest.id()).isPositive();
        assertThat(latest.changedAt()).isEqualTo(START.plusSeconds(2));
        assertThat(store.getMetadataChangeHistory(book.getId(), "title", 0)).extracting(MetadataChangeRecord::newValue)
            .containsExactly("Two", "One");
        assertThat(store.getBookChangeHistory(book.getId(), 2)).extracting(MetadataChangeRecord::field)
            .containsExactly("title", "narrator");
    }

    // ---- playlists ----

    @Test
    void should_OrderItemsByPosition_When_PlaylistRead() {
        Series series = store.createSeries("Expanse", null);
        Playlist playlist = store.createPlaylist("Expanse", series.id(), "/library/expanse.m3u");
        store.addPlaylistItem(playlist.id(), "book-b", 2);
        store.addPlaylistItem(playlist.id(), "book-a", 1);

        assertThat(store.getPlaylistById(playlist.id())).contains(playlist);
        assertThat(store.getPlaylistBySeriesId(series.id())).contains(playlist);
        assertThat(store.getPlaylistItems(playlist.id())).extracting(PlaylistItem::bookId)
            .containsExactly("book-a", "book-b");
    }

    // ---- per-user data ----

    @Test
    void should_KeepPreferencesPerUser_When_KeysOverlap() {
        store.setUserPreferenceForUser("user-1", "speed", "1.5");
        store.setUserPreferenceForUser("user-2", "speed", "1.0");
        store.setUserPreferenceForUser("user-1", "speed", "2.0");
        store.setUserPreferenceForUser("user-1", "skip", "30");

        assertThat(store.getUserPreferenceForUser("user-1", "speed")).map(entry -> entry.value()).contains("2.0");
        assertThat(store.getAllPreferencesForUser("user-1")).extracting(entry -> entry.key())
            .containsExactly("skip", "speed");
        assertThat(store.getUserPreferenceForUser("user-2", "speed")).map(entry -> entry.value()).contains("1.0");
    }

    @Test
    void should_ReturnNewestEventsFirst_When_ListingPlayback() {
        store.addPlaybackEvent(new PlaybackEvent("user-1", "book-1", null, 10, "play", START));
        store.addPlaybackEvent(new PlaybackEvent("user-1", "book-1", null, 20, "pause", START.plusSeconds(10)));
        store.addPlaybackEvent(new PlaybackEvent("user-1", "book-1", null, 30, "play", START.plusSeconds(20)));
        store.addPlaybackEvent(new PlaybackEvent("user-1", "book-2", null, 99, "play", START.plusSeconds(30)));

        assertThat(store.listPlaybackEvents("user-1", "book-1", 0)).extracting(PlaybackEvent::positionSec)
            .containsExactly(30, 20, 10);
        assertThat(store.listPlaybackEvents("user-1", "book-1", 1)).extracting(PlaybackEvent::positionSec)
            .containsExactly(30);
    }

    @Test
    void should_KeepLatestProgress_When_UpdatedTwice() {
        store.updatePlaybackProgress(new PlaybackProgress("user-1", "book-1", null, 100, 10.0, null));
        store.updatePlaybackProgress(new PlaybackProgress("user-1", "book-1", "seg-2", 500, 50.0, null));

        assertThat(store.getPlaybackProgress("user-1", "book-1")).hasValueSatisfying(progress -> {
            assertThat(progress.positionSec()).isEqualTo(500);
            assertThat(progress.segmentId()).isEqualTo("seg-2");
            assertThat(progress.percentComplete()).isEqualTo(50.0);
            assertThat(progress.updatedAt()).isEqualTo(START);
        });
        assertThat(store.getPlaybackProgress("user-1", "book-2")).isEmpty();
    }

    @Test
    void should_AccumulateCounters_When_StatsIncremented() {
        assertThat(store.getBookStats("book-1").playCount()).isZero();

        store.incrementBookPlayStats("book-1", 120);
        store.incrementBookPlayStats("book-1", 30);
        store.incrementUserListenStats("user-1", 120);
        store.incrementUserListenStats("user-1", 30);

        assertThat(store.getBookStats("book-1").playCount()).isEqualTo(2);
        assertThat(store.getBookStats("book-1").listenSeconds()).isEqualTo(150);
        assertThat(store.getUserStats("user-1").listenSeconds()).isEqualTo(150);
        assertThat(store.getUserStats("user-2").listenSeconds()).isZero();
    }

    // ---- blocklist & stats ----

    @Test
    void should_BlockAndUnblockHash_When_Managed() {
        store.addBlockedHash("bbb", "user deleted");
        store.addBlockedHash("aaa", "duplicate");
        store.addBlockedHash("aaa", "duplicate of book 7");

        assertThat(store.isHashBlocked("aaa")).isTrue();
        assertThat(store.getBlockedHashByHash("aaa")).map(entry -> entry.reason()).contains("duplicate of book 7");
        assertThat(store.getAllBlockedHashes()).extracting(entry -> entry.hash()).containsExactly("aaa", "bbb");

        store.removeBlockedHash("aaa");
        assertThat(store.isHashBlocked("aaa")).isFalse();
    }

    @Test
    void should_AggregateLiveBooks_When_ComputingDashboard() {
        store.createBook(book("One", "/library/1.m4b").toBuilder().duration(100).fileSize(1_000L).codec("aac").build());
        store.createBook(book("Two", "/library/2.m4b").toBuilder().duration(50).fileSize(500L)
            .libraryState("organized").build());
        Book gone = store.createBook(book("Three", "/library/3.m4b").toBuilder().duration(999).codec("mp3").build());
        store.markBookForDeletion(gone.getId(), START);

        DashboardStats stats = store.getDashboardStats();

        assertThat(stats.totalBooks()).isEqualTo(2);
        assertThat(stats.totalDuration()).isEqualTo(150);
        assertThat(stats.totalSize()).isEqualTo(1_500);
        assertThat(stats.stateDistribution()).containsEntry("imported", 1).containsEntry("organized", 1);
        assertThat(stats.formatDistribution()).containsEntry("aac", 1).containsEntry("unknown", 1)
            .doesNotContainKey("mp3");
    }

    @Test
    void should_EmptyStoreAndRestartIds_When_Reset() {
        Author before = store.createAuthor("Before");
        createBook("Gone", "/library/gone.m4b");
        store.setUserPreference("theme", "dark");

        store.reset();

        assertThat(store.countBooks()).isZero();
        assertThat(store.getAllAuthors()).isEmpty();
        assertThat(store.getUserPreference("theme")).isEmpty();
        assertThat(store.createAuthor("After").id()).isEqualTo(before.id());
    }
}
