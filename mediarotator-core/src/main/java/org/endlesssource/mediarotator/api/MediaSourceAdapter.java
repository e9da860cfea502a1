package org.endlesssource.mediarotator.api;

/**
 * The host's single controllable media slot
 */
public interface MediaSourceAdapter {

    /**
     * Whether the media sink currently exists on the host
     * @return true if commands can be issued
     */
    boolean isAvailable();

    /**
     * Get the coarse media status
     * @return The current host status, {@link MediaStatus#NONE} if nothing is loaded
     */
    MediaStatus getStatus();

    /**
     * Get the duration of the loaded media
     * @return Duration in milliseconds, 0 if unknown
     */
    long getDurationMs();

    /**
     * Get the playback position of the loaded media
     * @return Position in milliseconds, 0 if unknown
     */
    long getPositionMs();

    /**
     * Load and start a local file.
     * With {@code forceReload} the slot is fully detached and reattached so that
     * loading the path that is already active restarts it.
     * @param path Absolute path of the file
     * @param forceReload Reload even if the same path is active
     * @return true if the host accepted the file
     */
    boolean setLocalFile(String path, boolean forceReload);

    /**
     * Stop playback and unload the media
     */
    void stopAndClear();

    /**
     * Get the local path currently loaded in the slot
     * @return The path, or an empty string if none
     */
    String getActiveLocalPath();
}
