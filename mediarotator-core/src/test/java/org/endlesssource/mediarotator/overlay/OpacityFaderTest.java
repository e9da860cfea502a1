package org.endlesssource.mediarotator.overlay;

import org.endlesssource.mediarotator.api.RotatorOptions;
import org.endlesssource.mediarotator.schedule.QueuedScheduler;
import org.endlesssource.mediarotator.schedule.TimerToken;
import org.endlesssource.mediarotator.test.RecordingOverlay;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpacityFaderTest {
    private QueuedScheduler scheduler;
    private RecordingOverlay overlay;
    private OpacityFader fader;

    @BeforeEach
    void setUp() {
        scheduler = new QueuedScheduler();
        overlay = new RecordingOverlay();
        fader = new OpacityFader(overlay, scheduler, RotatorOptions.defaults());
    }

    @Test
    void fadeIn_reachesFullOpacityAfterRampAndStops() {
        fader.fadeIn();

        scheduler.advanceBy(Duration.ofMillis(500));
        assertEquals(50.0d, fader.getOpacity(), 0.001d);
        assertTrue(fader.isFading());

        scheduler.advanceBy(Duration.ofMillis(500));
        assertEquals(100.0d, fader.getOpacity(), 0.001d);
        assertEquals(100, overlay.lastOpacity());
        assertFalse(fader.isFading());
        assertTrue(fader.getDirection().isEmpty());
        assertEquals(0, scheduler.activeCount(TimerToken.FADE_STEP));
    }

    @Test
    void repeatedFadeIn_keepsASingleRamp() {
        fader.fadeIn();
        fader.fadeIn();
        assertEquals(1, scheduler.activeCount(TimerToken.FADE_STEP));
    }

    @Test
    void fadeOutAtZero_doesNothing() {
        fader.fadeOut();
        assertFalse(fader.isFading());
        assertEquals(0, scheduler.activeCount(TimerToken.FADE_STEP));
    }

    @Test
    void reversingMidRamp_returnsToZero() {
        fader.fadeIn();
        scheduler.advanceBy(Duration.ofMillis(300));
        fader.fadeOut();
        assertEquals(1, scheduler.activeCount(TimerToken.FADE_STEP));

        scheduler.advanceBy(Duration.ofMillis(1000));

        assertEquals(0.0d, fader.getOpacity(), 0.001d);
        assertEquals(0, overlay.lastOpacity());
        assertFalse(fader.isFading());
    }

    @Test
    void snapTo_cancelsRampAndSetsValue() {
        fader.fadeIn();
        scheduler.advanceBy(Duration.ofMillis(200));

        fader.snapTo(0.0d);
        scheduler.advanceBy(Duration.ofMillis(1000));

        assertEquals(0.0d, fader.getOpacity(), 0.001d);
        assertEquals(0, overlay.lastOpacity());
        assertFalse(fader.isFading());
    }

    @Test
    void customRampShape_isHonoured() {
        OpacityFader quick = new OpacityFader(overlay, scheduler,
                RotatorOptions.defaults().withFade(Duration.ofMillis(400), 4));
        quick.fadeIn();

        scheduler.advanceBy(Duration.ofMillis(100));
        assertEquals(25.0d, quick.getOpacity(), 0.001d);
        scheduler.advanceBy(Duration.ofMillis(300));
        assertEquals(100.0d, quick.getOpacity(), 0.001d);
    }
}
