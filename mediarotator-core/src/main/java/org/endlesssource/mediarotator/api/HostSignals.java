package org.endlesssource.mediarotator.api;

/**
 * Host-driven flags read by the controller on every tick.
 */
public interface HostSignals {

    /**
     * @return true while our output is shown by the host
     */
    boolean isOutputVisible();

    /**
     * @return true once the host is shutting down
     */
    boolean isShutdownRequested();
}
