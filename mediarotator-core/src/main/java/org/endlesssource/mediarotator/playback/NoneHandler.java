package org.endlesssource.mediarotator.playback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class NoneHandler implements StatusHandler {
    private static final Logger logger = LoggerFactory.getLogger(NoneHandler.class);

    @Override
    public void handle(PlaybackController controller, boolean visible) {
        if (!visible) {
            return;
        }
        OrchestratorState state = controller.state();
        if (!state.isPlaying()) {
            return;
        }

        long sinceStartMs = controller.nowMillis() - state.getStartedAtMillis();
        if (sinceStartMs < controller.noneGracePeriodMs()) {
            return;
        }
        logger.warn("Host reports no media {} ms after starting {}, resetting playback state",
                sinceStartMs, state.currentItemId().orElse("unknown item"));
        controller.releaseCurrent();
    }
}
