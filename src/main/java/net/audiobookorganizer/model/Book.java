/**
 * Physical audiobook record: one file (or one merged set of segments) on disk.
 *
 * Features:
 * - Bibliographic fields (title, author/series/work references, narrator, ISBNs)
 * - Audio technical fields (format, codec, bitrate, sample rate, channels, bit depth)
 * - Three independent content hashes: as-imported, pre-organization, post-organization
 * - Version clustering via versionGroupId / isPrimaryVersion
 * - Soft delete via markedForDeletion / markedForDeletionAt
 */
package net.audiobookorganizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Book {

    public static final String DEFAULT_LIBRARY_STATE = "imported";

    @ToString.Include
    @EqualsAndHashCode.Include
    private String id;
    @ToString.Include
    private String title;
    private Integer authorId;
    private Integer seriesId;
    private Integer seriesSequence;
    @ToString.Include
    private String filePath;
    private String originalFilename;
    private String format;
    private Integer duration;
    private String workId;
    private String narrator;
    private String edition;
    private String language;
    private String publisher;
    private Integer printYear;
    private Integer audiobookReleaseYear;
    private String isbn10;
    private String isbn13;
    private String fileHash;
    private Long fileSize;
    private Integer bitrate;
    private String codec;
    private Integer sampleRate;
    private Integer channels;
    private Integer bitDepth;
    private String quality;
    private Boolean isPrimaryVersion;
    private String versionGroupId;
    private String versionNotes;
    private String originalFileHash;
    private String organizedFileHash;
    private String libraryState;
    private Integer quantity;
    private Boolean markedForDeletion;
    private Instant markedForDeletionAt;
    private Instant createdAt;
    private Instant updatedAt;

    /** Shallow copy; every field is immutable so this is safe to hand out. */
    public Book copy() {
        return toBuilder().build();
    }

    @JsonIgnore
    public boolean isSoftDeleted() {
        return Boolean.TRUE.equals(markedForDeletion);
    }

    @JsonIgnore
    public boolean isPrimary() {
        return Boolean.TRUE.equals(isPrimaryVersion);
    }

    /**
     * Hash used for duplicate grouping: the post-organization hash when present, otherwise the
     * as-imported hash. Null when the book has neither.
     */
    @JsonIgnore
    public String duplicateHash() {
        if (organizedFileHash != null && !organizedFileHash.isEmpty()) {
            return organizedFileHash;
        }
        if (fileHash != null && !fileHash.isEmpty()) {
            return fileHash;
        }
        return null;
    }

    /** Fills the column defaults a freshly created book gets in both engines. */
    public void applyCreateDefaults() {
        if (isPrimaryVersion == null) {
            isPrimaryVersion = Boolean.TRUE;
        }
        if (libraryState == null) {
            libraryState = DEFAULT_LIBRARY_STATE;
        }
        if (quantity == null) {
            quantity = 1;
        }
        if (markedForDeletion == null) {
            markedForDeletion = Boolean.FALSE;
        }
    }
}
