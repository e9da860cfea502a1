package org.endlesssource.mediarotator.schedule;

/**
 * Receiver of fired timers. Always invoked on the scheduler's single thread.
 */
@FunctionalInterface
public interface TimerDispatcher {

    void onTimer(TimerToken token);
}
