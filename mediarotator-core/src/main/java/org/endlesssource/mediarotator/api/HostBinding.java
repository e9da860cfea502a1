package org.endlesssource.mediarotator.api;

/**
 * Everything the orchestrator needs from one host output: the media slot,
 * the overlay slot and the host signals.
 */
public interface HostBinding extends AutoCloseable {

    MediaSourceAdapter mediaSource();

    OverlayAdapter overlay();

    HostSignals signals();

    /**
     * Close and release resources held by this binding.
     */
    @Override
    void close();
}
