package org.endlesssource.mediarotator.api;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A ready-to-play library entry: a local media file plus its display metadata.
 *
 * @param id               stable item id
 * @param localPath        cached media file
 * @param title            display title (song)
 * @param artist           display artist
 * @param metadataDegraded true when title/artist came from a fallback heuristic
 */
public record LibraryItem(String id, Path localPath, String title, String artist, boolean metadataDegraded) {
    public LibraryItem(String id, Path localPath, String title, String artist, boolean metadataDegraded) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.localPath = Objects.requireNonNull(localPath, "localPath must not be null");
        this.title = title == null ? "" : title;
        this.artist = artist == null ? "" : artist;
        this.metadataDegraded = metadataDegraded;
    }

    public boolean sameDisplay(LibraryItem other) {
        return other != null
                && title.equals(other.title)
                && artist.equals(other.artist)
                && metadataDegraded == other.metadataDegraded;
    }
}
