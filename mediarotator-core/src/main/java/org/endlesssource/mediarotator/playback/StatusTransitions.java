package org.endlesssource.mediarotator.playback;

import org.endlesssource.mediarotator.api.MediaStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * Transition table from host status to handler.
 */
final class StatusTransitions {
    private final Map<MediaStatus, StatusHandler> handlers = new EnumMap<>(MediaStatus.class);

    private StatusTransitions() {
    }

    static StatusTransitions standard() {
        StatusTransitions transitions = new StatusTransitions();
        transitions.handlers.put(MediaStatus.PLAYING, new PlayingHandler());
        transitions.handlers.put(MediaStatus.ENDED, new EndedHandler());
        transitions.handlers.put(MediaStatus.STOPPED, new StoppedHandler());
        transitions.handlers.put(MediaStatus.NONE, new NoneHandler());
        return transitions;
    }

    StatusHandler handlerFor(MediaStatus status) {
        StatusHandler handler = handlers.get(status);
        if (handler == null) {
            throw new IllegalStateException("No handler for status " + status);
        }
        return handler;
    }
}
