package org.endlesssource.mediarotator.schedule;

/**
 * Identifies what a scheduled callback is for. Callbacks are delivered as tokens
 * to a {@link TimerDispatcher} instead of as captured closures.
 */
public enum TimerToken {
    TITLE_SHOW,
    TITLE_CLEAR,
    DURATION_POLL,
    FADE_STEP,
    LOOP_RESTART
}
