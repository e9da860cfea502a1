package org.endlesssource.mediarotator.playback;

import org.endlesssource.mediarotator.api.LibraryItem;
import org.endlesssource.mediarotator.api.MediaSourceAdapter;
import org.endlesssource.mediarotator.api.PlaybackMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

final class PlayingHandler implements StatusHandler {
    private static final Logger logger = LoggerFactory.getLogger(PlayingHandler.class);

    /** Remaining time, on top of the clear lead, at which the clear is (re)scheduled. */
    static final long APPROACH_WINDOW_MS = 5000L;

    @Override
    public void handle(PlaybackController controller, boolean visible) {
        OrchestratorState state = controller.state();
        state.setManualStopDetected(false);
        if (state.isRestartPending()
                && state.restartItemId().isPresent()
                && state.restartItemId().equals(state.currentItemId())) {
            logger.debug("Loop restart of {} confirmed", state.restartItemId().get());
            state.clearRestartPending();
        }

        if (!state.isPlaying()) {
            adoptHostPlayback(controller, state);
            return;
        }

        MediaSourceAdapter media = controller.media();
        long durationMs = media.getDurationMs();
        long positionMs = media.getPositionMs();
        if (durationMs <= 0 || positionMs < 0) {
            return;
        }
        long remainingMs = Math.max(0L, durationMs - positionMs);

        if (isSeek(state.getLastKnownPositionMs(), positionMs, controller.seekThresholdMs())) {
            logger.info("Seek detected ({} ms -> {} ms)", state.getLastKnownPositionMs(), positionMs);
            state.setTitleClearArmed(false);
            controller.overlay().scheduleClearFromRemaining(remainingMs);
        }
        state.setLastKnownPositionMs(positionMs);
        if (positionMs > 0) {
            state.resetRetryCount();
        }
        state.currentItemId()
                .flatMap(controller.library()::get)
                .ifPresent(item -> controller.progress().log(item, positionMs, durationMs));

        if (!state.isTitleClearArmed() && remainingMs < controller.titleClearLeadMs() + APPROACH_WINDOW_MS) {
            controller.overlay().scheduleClearFromRemaining(remainingMs);
            state.setTitleClearArmed(true);
        }
    }

    static boolean isSeek(long previousMs, long currentMs, long thresholdMs) {
        return previousMs > 0 && currentMs - previousMs > thresholdMs;
    }

    private void adoptHostPlayback(PlaybackController controller, OrchestratorState state) {
        if (controller.media().getDurationMs() <= 0) {
            logger.info("Host reports playing but no duration is available, starting fresh");
            controller.startNext();
            return;
        }
        state.setPlaying(true);
        state.setStartedAtMillis(controller.nowMillis());
        Optional<LibraryItem> item = controller.identifyCurrentItem();
        if (item.isPresent()) {
            controller.adoptCurrent(item.get());
            if (controller.mode() == PlaybackMode.SINGLE) {
                state.setFirstItemPlayed(true);
            }
            if (controller.mode() == PlaybackMode.LOOP && state.loopItemId().isEmpty()) {
                state.rotation().pin(item.get().id());
                logger.info("Pinned {} for loop playback", item.get().id());
            }
            logger.info("Adopted host playback of {}", item.get().id());
        } else {
            logger.info("Adopted host playback of an item not in the library");
        }
    }
}
