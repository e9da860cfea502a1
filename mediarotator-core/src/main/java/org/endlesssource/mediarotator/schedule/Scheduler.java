package org.endlesssource.mediarotator.schedule;

import java.time.Duration;

/**
 * Single-threaded cooperative timer source. Every callback is delivered on the
 * thread that also runs controller ticks, so no two callbacks ever overlap.
 */
public interface Scheduler {

    /**
     * Monotonic time in milliseconds
     */
    long nowMillis();

    /**
     * Fire {@code token} once at {@code target} after {@code delay}
     */
    TimerHandle schedule(TimerToken token, Duration delay, TimerDispatcher target);

    /**
     * Fire {@code token} at {@code target} every {@code interval}, first after one interval
     */
    TimerHandle scheduleRepeating(TimerToken token, Duration interval, TimerDispatcher target);
}
