package org.endlesssource.mediarotator.schedule;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueuedSchedulerTest {

    @Test
    void oneShotTimers_fireInDueOrder() {
        QueuedScheduler scheduler = new QueuedScheduler();
        List<TimerToken> fired = new ArrayList<>();
        scheduler.schedule(TimerToken.TITLE_CLEAR, Duration.ofMillis(100), fired::add);
        scheduler.schedule(TimerToken.TITLE_SHOW, Duration.ofMillis(50), fired::add);

        scheduler.advanceBy(Duration.ofMillis(99));
        assertEquals(List.of(TimerToken.TITLE_SHOW), fired);

        scheduler.advanceBy(Duration.ofMillis(1));
        assertEquals(List.of(TimerToken.TITLE_SHOW, TimerToken.TITLE_CLEAR), fired);
        assertEquals(100L, scheduler.nowMillis());
    }

    @Test
    void cancel_isIdempotentAndPreventsFiring() {
        QueuedScheduler scheduler = new QueuedScheduler();
        List<TimerToken> fired = new ArrayList<>();
        TimerHandle handle = scheduler.schedule(TimerToken.LOOP_RESTART, Duration.ofSeconds(1), fired::add);

        assertTrue(handle.cancel());
        assertFalse(handle.cancel());
        scheduler.advanceBy(Duration.ofSeconds(2));

        assertTrue(fired.isEmpty());
        assertFalse(handle.isActive());
    }

    @Test
    void repeatingTimer_firesEveryIntervalUntilCancelled() {
        QueuedScheduler scheduler = new QueuedScheduler();
        List<Long> firedAt = new ArrayList<>();
        TimerHandle handle = scheduler.scheduleRepeating(TimerToken.FADE_STEP, Duration.ofMillis(100),
                token -> firedAt.add(scheduler.nowMillis()));

        scheduler.advanceBy(Duration.ofMillis(350));
        assertEquals(List.of(100L, 200L, 300L), firedAt);
        assertEquals(1, scheduler.activeCount(TimerToken.FADE_STEP));

        handle.cancel();
        scheduler.advanceBy(Duration.ofMillis(500));
        assertEquals(3, firedAt.size());
        assertEquals(0, scheduler.activeCount(TimerToken.FADE_STEP));
    }

    @Test
    void failingCallback_doesNotStopLaterTimers() {
        QueuedScheduler scheduler = new QueuedScheduler();
        List<TimerToken> fired = new ArrayList<>();
        scheduler.schedule(TimerToken.TITLE_SHOW, Duration.ofMillis(10), token -> {
            throw new IllegalStateException("boom");
        });
        scheduler.schedule(TimerToken.TITLE_CLEAR, Duration.ofMillis(20), fired::add);

        scheduler.advanceBy(Duration.ofMillis(20));

        assertEquals(List.of(TimerToken.TITLE_CLEAR), fired);
    }

    @Test
    void timerScheduledFromCallback_firesWhenDue() {
        QueuedScheduler scheduler = new QueuedScheduler();
        List<Long> firedAt = new ArrayList<>();
        scheduler.schedule(TimerToken.TITLE_SHOW, Duration.ofMillis(10), token ->
                scheduler.schedule(TimerToken.TITLE_CLEAR, Duration.ofMillis(10),
                        inner -> firedAt.add(scheduler.nowMillis())));

        scheduler.advanceBy(Duration.ofMillis(25));

        assertEquals(List.of(20L), firedAt);
    }
}
