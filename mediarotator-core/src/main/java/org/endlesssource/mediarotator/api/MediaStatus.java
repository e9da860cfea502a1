package org.endlesssource.mediarotator.api;

/**
 * Coarse media status as polled from the host
 */
public enum MediaStatus {
    NONE,
    PLAYING,
    STOPPED,
    ENDED
}
