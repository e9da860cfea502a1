package org.endlesssource.mediarotator.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Policy deciding what plays after the current item.
 */
public enum PlaybackMode {
    /** Rotate through the whole library forever, no repeat until every item has played. */
    CONTINUOUS("continuous"),
    /** Play one item, then stop. */
    SINGLE("single"),
    /** Repeat one pinned item. */
    LOOP("loop");

    private final String id;

    PlaybackMode(String id) {
        this.id = id;
    }

    /**
     * Stable lower-case identifier, e.g. for settings files or command lines.
     */
    public String id() {
        return id;
    }

    public static Optional<PlaybackMode> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PlaybackMode mode : values()) {
            if (mode.id.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
