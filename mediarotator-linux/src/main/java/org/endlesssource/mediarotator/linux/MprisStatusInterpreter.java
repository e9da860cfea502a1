package org.endlesssource.mediarotator.linux;

import org.endlesssource.mediarotator.api.MediaStatus;

/**
 * Maps MPRIS playback status onto the coarse media status.
 * <p>
 * MPRIS has no "ended" state; a player that stops within {@link #END_TOLERANCE_MS}
 * of the track length is taken to have reached the end.
 */
final class MprisStatusInterpreter {
    static final long END_TOLERANCE_MS = 1500L;

    private MprisStatusInterpreter() {
    }

    static MediaStatus interpret(String playbackStatus, boolean hasTrack, long lastPositionMs, long lengthMs) {
        if (!hasTrack || playbackStatus == null) {
            return MediaStatus.NONE;
        }
        return switch (playbackStatus.trim().toLowerCase()) {
            case "playing", "paused" -> MediaStatus.PLAYING;
            case "stopped" -> reachedEnd(lastPositionMs, lengthMs) ? MediaStatus.ENDED : MediaStatus.STOPPED;
            default -> MediaStatus.NONE;
        };
    }

    static boolean reachedEnd(long lastPositionMs, long lengthMs) {
        return lengthMs > 0 && lastPositionMs > 0 && lengthMs - lastPositionMs <= END_TOLERANCE_MS;
    }
}
