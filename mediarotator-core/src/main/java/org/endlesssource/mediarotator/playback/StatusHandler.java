package org.endlesssource.mediarotator.playback;

/**
 * Transition policy for one host-reported media status.
 */
@FunctionalInterface
interface StatusHandler {

    /**
     * @param controller Controller owning the state
     * @param visible Whether the output is shown this tick
     */
    void handle(PlaybackController controller, boolean visible);
}
