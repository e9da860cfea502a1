package org.endlesssource.mediarotator.playback;

import org.endlesssource.mediarotator.api.LibraryItem;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlaybackProgressLoggerTest {
    private static final LibraryItem ITEM = new LibraryItem("a", Path.of("a.mp4"), "Song", "Artist", false);

    @Test
    void formatsMinutesAndSeconds() {
        assertEquals("0:00", PlaybackProgressLogger.formatTime(0L));
        assertEquals("2:05", PlaybackProgressLogger.formatTime(125_400L));
        assertEquals("61:00", PlaybackProgressLogger.formatTime(3_660_000L));
        assertEquals("0:00", PlaybackProgressLogger.formatTime(-5L));
    }

    @Test
    void logsOncePerThirtySecondBucket() {
        PlaybackProgressLogger progress = new PlaybackProgressLogger();

        assertTrue(progress.log(ITEM, 1_000L, 180_000L));
        assertFalse(progress.log(ITEM, 29_000L, 180_000L));
        assertTrue(progress.log(ITEM, 30_000L, 180_000L));
        assertFalse(progress.log(ITEM, 40_000L, 0L));

        progress.reset("a");
        assertTrue(progress.log(ITEM, 31_000L, 180_000L));
    }
}
