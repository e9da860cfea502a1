package org.endlesssource.mediarotator.overlay;

import org.endlesssource.mediarotator.api.LibraryItem;

/**
 * Text shown on the overlay for one item.
 */
public record TitleCard(String title, String artist, boolean degraded) {
    public TitleCard(String title, String artist, boolean degraded) {
        this.title = title == null ? "" : title;
        this.artist = artist == null ? "" : artist;
        this.degraded = degraded;
    }

    public static TitleCard of(LibraryItem item) {
        return new TitleCard(item.title(), item.artist(), item.metadataDegraded());
    }
}
