package org.endlesssource.mediarotator.playback;

import org.endlesssource.mediarotator.api.PlaybackMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class StoppedHandler implements StatusHandler {
    private static final Logger logger = LoggerFactory.getLogger(StoppedHandler.class);

    @Override
    public void handle(PlaybackController controller, boolean visible) {
        OrchestratorState state = controller.state();
        if (!state.isPlaying()) {
            return;
        }
        if (!state.isManualStopDetected()) {
            state.setManualStopDetected(true);
            logger.info("Playback of {} was stopped outside the rotator",
                    state.currentItemId().orElse("unknown item"));
            if (controller.mode() == PlaybackMode.LOOP) {
                state.rotation().unpin();
            }
            controller.fullStop();
            return;
        }

        int attempt = state.incrementRetryCount();
        if (attempt > controller.maxRetries()) {
            logger.warn("Host still stopped after {} retries, giving up until the next cycle", controller.maxRetries());
            controller.giveUp();
            return;
        }
        logger.info("Host still stopped, retry {}/{}", attempt, controller.maxRetries());
        controller.startNext(true);
    }
}
