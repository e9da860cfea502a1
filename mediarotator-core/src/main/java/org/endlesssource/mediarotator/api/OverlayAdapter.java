package org.endlesssource.mediarotator.api;

/**
 * The host's single text overlay slot
 */
public interface OverlayAdapter {

    /**
     * Whether the overlay sink currently exists on the host
     * @return true if the overlay can be updated
     */
    boolean isAvailable();

    /**
     * Replace the overlay text
     * @param text New text, empty to blank the overlay
     * @return true if the host accepted the update
     */
    boolean setText(String text);

    /**
     * Set overlay opacity
     * @param percent Opacity between 0 and 100
     */
    void setOpacity(int percent);
}
