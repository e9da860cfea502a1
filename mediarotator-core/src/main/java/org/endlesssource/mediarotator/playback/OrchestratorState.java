package org.endlesssource.mediarotator.playback;

import org.endlesssource.mediarotator.api.LibraryItem;
import org.endlesssource.mediarotator.selection.RotationState;

import java.util.Optional;

/**
 * What the controller believes about the host and the rotation. Owned by one
 * {@link PlaybackController} and only touched on its tick thread.
 */
public final class OrchestratorState {
    private final RotationState rotation = new RotationState();
    private boolean playing;
    private String currentItemId;
    private boolean firstItemPlayed;
    private long lastKnownPositionMs;
    private int retryCount;
    private boolean manualStopDetected;
    private boolean restartPending;
    private String restartItemId;
    private boolean titleClearArmed;
    private long startedAtMillis;
    private boolean retryExhausted;
    private boolean reconciled;
    private LibraryItem displayedItem;

    public boolean isPlaying() {
        return playing;
    }

    void setPlaying(boolean playing) {
        this.playing = playing;
    }

    public Optional<String> currentItemId() {
        return Optional.ofNullable(currentItemId);
    }

    void setCurrentItemId(String currentItemId) {
        this.currentItemId = currentItemId;
    }

    public Optional<String> loopItemId() {
        return rotation.loopItemId();
    }

    public RotationState rotation() {
        return rotation;
    }

    public boolean isFirstItemPlayed() {
        return firstItemPlayed;
    }

    void setFirstItemPlayed(boolean firstItemPlayed) {
        this.firstItemPlayed = firstItemPlayed;
    }

    public long getLastKnownPositionMs() {
        return lastKnownPositionMs;
    }

    void setLastKnownPositionMs(long lastKnownPositionMs) {
        this.lastKnownPositionMs = lastKnownPositionMs;
    }

    public int getRetryCount() {
        return retryCount;
    }

    int incrementRetryCount() {
        return ++retryCount;
    }

    void resetRetryCount() {
        retryCount = 0;
    }

    public boolean isManualStopDetected() {
        return manualStopDetected;
    }

    void setManualStopDetected(boolean manualStopDetected) {
        this.manualStopDetected = manualStopDetected;
    }

    public boolean isRestartPending() {
        return restartPending;
    }

    public Optional<String> restartItemId() {
        return Optional.ofNullable(restartItemId);
    }

    void markRestartPending(String itemId) {
        this.restartPending = true;
        this.restartItemId = itemId;
    }

    void clearRestartPending() {
        this.restartPending = false;
        this.restartItemId = null;
    }

    public boolean isTitleClearArmed() {
        return titleClearArmed;
    }

    void setTitleClearArmed(boolean titleClearArmed) {
        this.titleClearArmed = titleClearArmed;
    }

    public long getStartedAtMillis() {
        return startedAtMillis;
    }

    void setStartedAtMillis(long startedAtMillis) {
        this.startedAtMillis = startedAtMillis;
    }

    /**
     * True after the Stopped retry cap forced a stop; no auto-start until cleared.
     */
    public boolean isRetryExhausted() {
        return retryExhausted;
    }

    void setRetryExhausted(boolean retryExhausted) {
        this.retryExhausted = retryExhausted;
    }

    boolean isReconciled() {
        return reconciled;
    }

    void setReconciled(boolean reconciled) {
        this.reconciled = reconciled;
    }

    Optional<LibraryItem> displayedItem() {
        return Optional.ofNullable(displayedItem);
    }

    void setDisplayedItem(LibraryItem displayedItem) {
        this.displayedItem = displayedItem;
    }

    /**
     * Forget the item on air. Mode bookkeeping and the rotation are kept.
     */
    void clearCurrent() {
        playing = false;
        currentItemId = null;
        lastKnownPositionMs = 0L;
        titleClearArmed = false;
        displayedItem = null;
    }
}
