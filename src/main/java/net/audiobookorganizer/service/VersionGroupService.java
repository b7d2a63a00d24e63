package net.audiobookorganizer.service;

import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.exception.StoreConstraintViolationException;
import net.audiobookorganizer.model.Book;
import net.audiobookorganizer.store.AudiobookStore;
import net.audiobookorganizer.store.TransactionalStore;
import net.audiobookorganizer.util.IdGenerator;

/**
 * Caller-side rules for version groups. Storage keeps whatever primary flags it is given; this
 * service keeps at most one primary per group.
 */
@Slf4j
public class VersionGroupService {

    private final AudiobookStore store;

    public VersionGroupService(AudiobookStore store) {
        this.store = store;
    }

    /**
     * Puts {@code bookId} into the group of {@code otherBookId}, creating a group when the other
     * book has none. The joining book becomes a non-primary version.
     *
     * @return the group id
     */
    public String linkVersions(String otherBookId, String bookId) {
        Book anchor = requireBook(otherBookId);
        Book joining = requireBook(bookId);
        String groupId = anchor.getVersionGroupId();
        if (groupId == null || groupId.isEmpty()) {
            groupId = IdGenerator.ulid();
            anchor.setVersionGroupId(groupId);
            anchor.setIsPrimaryVersion(Boolean.TRUE);
            store.updateBook(anchor.getId(), anchor);
        }
        joining.setVersionGroupId(groupId);
        joining.setIsPrimaryVersion(Boolean.FALSE);
        store.updateBook(joining.getId(), joining);
        log.debug("Linked book {} into version group {}", bookId, groupId);
        return groupId;
    }

    /**
     * Makes {@code bookId} the only primary version of its group. Other members that are
     * currently primary are demoted first, atomically on engines that support transactions.
     */
    public Book promoteToPrimary(String bookId) {
        if (store instanceof TransactionalStore transactional) {
            return transactional.executeInTransaction(() -> promote(bookId));
        }
        return promote(bookId);
    }

    private Book promote(String bookId) {
        Book book = requireBook(bookId);
        String groupId = book.getVersionGroupId();
        if (groupId == null || groupId.isEmpty()) {
            throw new StoreConstraintViolationException("book", "Book " + bookId + " is not in a version group");
        }
        List<Book> members = store.getBooksByVersionGroup(groupId);
        for (Book member : members) {
            if (!Objects.equals(member.getId(), bookId) && member.isPrimary()) {
                member.setIsPrimaryVersion(Boolean.FALSE);
                store.updateBook(member.getId(), member);
            }
        }
        book.setIsPrimaryVersion(Boolean.TRUE);
        return store.updateBook(bookId, book);
    }

    /** The group's primary version, or the first member when none is flagged. */
    public Book getPrimaryVersion(String groupId) {
        List<Book> members = store.getBooksByVersionGroup(groupId);
        if (members.isEmpty()) {
            throw StoreConstraintViolationException.notFound("version group", groupId);
        }
        return members.get(0);
    }

    private Book requireBook(String id) {
        return store.getBookById(id).orElseThrow(() -> StoreConstraintViolationException.notFound("book", id));
    }
}
