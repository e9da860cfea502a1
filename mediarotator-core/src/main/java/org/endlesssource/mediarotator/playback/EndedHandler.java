package org.endlesssource.mediarotator.playback;

import org.endlesssource.mediarotator.api.LibraryItem;
import org.endlesssource.mediarotator.api.PlaybackMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

final class EndedHandler implements StatusHandler {
    private static final Logger logger = LoggerFactory.getLogger(EndedHandler.class);

    @Override
    public void handle(PlaybackController controller, boolean visible) {
        OrchestratorState state = controller.state();
        state.setLastKnownPositionMs(0L);
        state.setTitleClearArmed(false);
        PlaybackMode mode = controller.mode();

        if (!state.isPlaying()) {
            if (visible && !controller.library().isEmpty() && controller.mayAutoStart()) {
                controller.startNext();
            }
            return;
        }

        if (mode == PlaybackMode.LOOP) {
            if (state.isRestartPending()) {
                return;
            }
            Optional<LibraryItem> ended = controller.identifyCurrentItem();
            if (ended.isEmpty()) {
                logger.info("Loop item could not be identified, selecting a new one");
                controller.startNext();
                return;
            }
            if (state.loopItemId().isEmpty()) {
                state.rotation().pin(ended.get().id());
            }
            String restartId = state.loopItemId()
                    .filter(controller.library()::contains)
                    .orElse(ended.get().id());
            controller.scheduleLoopRestart(restartId);
            return;
        }

        if (mode == PlaybackMode.SINGLE && state.isFirstItemPlayed()) {
            logger.info("Single item finished, stopping");
            controller.fullStop();
            return;
        }
        logger.debug("Item {} ended", state.currentItemId().orElse("?"));
        controller.startNext();
    }
}
