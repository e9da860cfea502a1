package org.endlesssource.mediarotator.schedule;

/**
 * A scheduled timer. Cancelling is idempotent.
 */
public interface TimerHandle {

    TimerToken token();

    /**
     * @return true while the timer may still fire
     */
    boolean isActive();

    /**
     * Cancel the timer
     * @return true if this call cancelled an active timer, false if it was already cancelled or done
     */
    boolean cancel();

    /**
     * Null-safe {@link #cancel()}.
     */
    static void cancel(TimerHandle handle) {
        if (handle != null) {
            handle.cancel();
        }
    }

    /**
     * Null-safe {@link #isActive()}.
     */
    static boolean isActive(TimerHandle handle) {
        return handle != null && handle.isActive();
    }
}
