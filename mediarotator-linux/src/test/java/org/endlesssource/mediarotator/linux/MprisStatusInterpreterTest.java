package org.endlesssource.mediarotator.linux;

import org.endlesssource.mediarotator.api.MediaStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MprisStatusInterpreterTest {

    @Test
    void playingAndPaused_reportPlaying() {
        assertEquals(MediaStatus.PLAYING, MprisStatusInterpreter.interpret("Playing", true, 0L, 0L));
        assertEquals(MediaStatus.PLAYING, MprisStatusInterpreter.interpret("Paused", true, 5_000L, 60_000L));
    }

    @Test
    void noTrack_reportsNone() {
        assertEquals(MediaStatus.NONE, MprisStatusInterpreter.interpret("Playing", false, 0L, 0L));
        assertEquals(MediaStatus.NONE, MprisStatusInterpreter.interpret(null, true, 0L, 0L));
        assertEquals(MediaStatus.NONE, MprisStatusInterpreter.interpret("Buffering", true, 0L, 0L));
    }

    @Test
    void stoppedNearTheEnd_reportsEnded() {
        assertEquals(MediaStatus.ENDED, MprisStatusInterpreter.interpret("Stopped", true, 59_000L, 60_000L));
        assertEquals(MediaStatus.ENDED, MprisStatusInterpreter.interpret("stopped", true, 58_500L, 60_000L));
    }

    @Test
    void stoppedElsewhere_reportsStopped() {
        assertEquals(MediaStatus.STOPPED, MprisStatusInterpreter.interpret("Stopped", true, 20_000L, 60_000L));
        assertEquals(MediaStatus.STOPPED, MprisStatusInterpreter.interpret("Stopped", true, 0L, 60_000L));
        assertEquals(MediaStatus.STOPPED, MprisStatusInterpreter.interpret("Stopped", true, 59_000L, 0L));
    }
}
