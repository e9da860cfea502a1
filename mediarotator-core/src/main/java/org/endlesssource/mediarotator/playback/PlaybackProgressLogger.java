package org.endlesssource.mediarotator.playback;

import org.endlesssource.mediarotator.api.LibraryItem;
import org.endlesssource.mediarotator.overlay.TitleCard;
import org.endlesssource.mediarotator.overlay.TitleFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the position of the item on air once per 30 s of playback.
 */
final class PlaybackProgressLogger {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackProgressLogger.class);

    static final long BUCKET_MS = 30_000L;

    private String itemId;
    private long lastBucket = -1L;

    void reset(String itemId) {
        this.itemId = itemId;
        this.lastBucket = -1L;
    }

    /**
     * @return true if a line was written
     */
    boolean log(LibraryItem item, long positionMs, long durationMs) {
        if (durationMs <= 0) {
            return false;
        }
        if (!item.id().equals(itemId)) {
            reset(item.id());
        }
        long bucket = positionMs / BUCKET_MS;
        if (bucket == lastBucket) {
            return false;
        }
        lastBucket = bucket;
        long percent = Math.min(100L, positionMs * 100L / durationMs);
        logger.info("Playing: {} [{}% - {} / {}]", TitleFormatter.format(TitleCard.of(item)), percent,
                formatTime(positionMs), formatTime(durationMs));
        return true;
    }

    static String formatTime(long millis) {
        long totalSeconds = Math.max(0L, millis) / 1000L;
        return String.format("%d:%02d", totalSeconds / 60L, totalSeconds % 60L);
    }
}
