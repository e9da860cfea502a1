package org.endlesssource.mediarotator.overlay;

import org.endlesssource.mediarotator.api.MediaSourceAdapter;
import org.endlesssource.mediarotator.api.OverlayAdapter;
import org.endlesssource.mediarotator.api.RotatorOptions;
import org.endlesssource.mediarotator.schedule.Scheduler;
import org.endlesssource.mediarotator.schedule.TimerDispatcher;
import org.endlesssource.mediarotator.schedule.TimerHandle;
import org.endlesssource.mediarotator.schedule.TimerToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the title overlay in step with playback: blank and show shortly after an item
 * starts, fade out a fixed lead time before it ends.
 * <p>
 * At most one show timer and one clear timer are outstanding; scheduling either
 * cancels its predecessor.
 */
public final class TitleOverlay implements TimerDispatcher, OpacityFader.FadeListener {
    private static final Logger logger = LoggerFactory.getLogger(TitleOverlay.class);

    private final OverlayAdapter overlay;
    private final MediaSourceAdapter media;
    private final Scheduler scheduler;
    private final OpacityFader fader;
    private final Duration showDelay;
    private final long clearLeadMs;
    private final Duration durationPollInterval;

    private TitleCard pendingTitle;
    private TitleCard pendingSwap;
    private TitleCard displayed;
    private TimerHandle showHandle;
    private TimerHandle clearHandle;
    private TimerHandle durationPollHandle;

    public TitleOverlay(OverlayAdapter overlay, MediaSourceAdapter media, Scheduler scheduler, RotatorOptions options) {
        this.overlay = Objects.requireNonNull(overlay, "overlay must not be null");
        this.media = Objects.requireNonNull(media, "media must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.fader = new OpacityFader(overlay, scheduler, options);
        this.fader.setListener(this);
        this.showDelay = options.getTitleShowDelay();
        this.clearLeadMs = options.getTitleClearLead().toMillis();
        this.durationPollInterval = options.getDurationPollInterval();
    }

    /**
     * Blank the overlay now and show {@code card} after the show delay.
     */
    public void showTitle(TitleCard card) {
        TimerHandle.cancel(showHandle);
        TimerHandle.cancel(clearHandle);
        clearHandle = null;
        pendingTitle = card;
        pendingSwap = null;
        fader.snapTo(0.0d);
        writeText("");
        displayed = null;
        showHandle = scheduler.schedule(TimerToken.TITLE_SHOW, showDelay, this);
        logger.debug("Scheduled title show in {} ms", showDelay.toMillis());
    }

    /**
     * Poll the media duration until it is known, then schedule the clear.
     */
    public void scheduleClearWhenDurationKnown() {
        TimerHandle.cancel(durationPollHandle);
        durationPollHandle = scheduler.scheduleRepeating(TimerToken.DURATION_POLL, durationPollInterval, this);
    }

    /**
     * Schedule the fade-out relative to the remaining play time. Fades immediately if
     * less than the lead time is left.
     */
    public void scheduleClearFromRemaining(long remainingMs) {
        TimerHandle.cancel(clearHandle);
        clearHandle = null;
        long clearInMs = remainingMs - clearLeadMs;
        if (clearInMs > 0) {
            clearHandle = scheduler.schedule(TimerToken.TITLE_CLEAR, Duration.ofMillis(clearInMs), this);
            logger.debug("Scheduled title fade out in {} ms (remaining {} ms)", clearInMs, remainingMs);
        } else if (fader.getOpacity() > 0.0d) {
            logger.debug("Fade-out point already passed, fading now");
            fader.fadeOut();
        }
    }

    public boolean isClearScheduled() {
        return TimerHandle.isActive(clearHandle);
    }

    public boolean isShowPending() {
        return TimerHandle.isActive(showHandle);
    }

    /**
     * Swap the text of the item on air: fade out, replace, fade back in.
     */
    public void replaceTitle(TitleCard card) {
        if (isShowPending()) {
            pendingTitle = card;
            return;
        }
        if (fader.getOpacity() > 0.0d) {
            pendingSwap = card;
            fader.fadeOut();
            return;
        }
        String text = apply(card);
        if (!text.isEmpty()) {
            fader.fadeIn();
        }
    }

    /**
     * Cancel every outstanding overlay timer and drop pending text.
     */
    public void cancelTimers() {
        TimerHandle.cancel(showHandle);
        TimerHandle.cancel(clearHandle);
        TimerHandle.cancel(durationPollHandle);
        showHandle = null;
        clearHandle = null;
        durationPollHandle = null;
        pendingTitle = null;
        pendingSwap = null;
        fader.cancel();
    }

    /**
     * Cancel timers and blank the overlay.
     */
    public void blank() {
        cancelTimers();
        writeText("");
        fader.snapTo(0.0d);
        displayed = null;
    }

    public Optional<TitleCard> displayedTitle() {
        return Optional.ofNullable(displayed);
    }

    public Optional<TitleCard> pendingTitle() {
        return Optional.ofNullable(pendingTitle);
    }

    public double getOpacity() {
        return fader.getOpacity();
    }

    public Optional<FadeDirection> getFadeDirection() {
        return fader.getDirection();
    }

    @Override
    public void onTimer(TimerToken token) {
        switch (token) {
            case TITLE_SHOW -> onShowDue();
            case TITLE_CLEAR -> onClearDue();
            case DURATION_POLL -> onDurationPoll();
            default -> logger.debug("Ignoring timer {}", token);
        }
    }

    @Override
    public void onFadedOut() {
        if (pendingSwap == null) {
            return;
        }
        TitleCard swap = pendingSwap;
        pendingSwap = null;
        apply(swap);
        fader.fadeIn();
    }

    private void onShowDue() {
        showHandle = null;
        if (pendingTitle == null) {
            return;
        }
        String text = apply(pendingTitle);
        pendingTitle = null;
        logger.debug("Showing title: {}", text);
        fader.fadeIn();
    }

    private void onClearDue() {
        clearHandle = null;
        logger.debug("Fading out title before end");
        fader.fadeOut();
    }

    private void onDurationPoll() {
        long durationMs = media.getDurationMs();
        if (durationMs <= 0) {
            logger.debug("No duration yet, polling again");
            return;
        }
        TimerHandle.cancel(durationPollHandle);
        durationPollHandle = null;
        long positionMs = Math.max(0L, media.getPositionMs());
        scheduleClearFromRemaining(durationMs - positionMs);
    }

    private String apply(TitleCard card) {
        String text = TitleFormatter.format(card);
        writeText(text);
        displayed = card;
        return text;
    }

    private void writeText(String text) {
        if (!overlay.setText(text)) {
            logger.warn("Overlay rejected text update '{}'", text);
        }
    }
}
