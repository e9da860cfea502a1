package org.endlesssource.mediarotator.overlay;

import org.endlesssource.mediarotator.api.OverlayAdapter;
import org.endlesssource.mediarotator.api.RotatorOptions;
import org.endlesssource.mediarotator.schedule.Scheduler;
import org.endlesssource.mediarotator.schedule.TimerDispatcher;
import org.endlesssource.mediarotator.schedule.TimerHandle;
import org.endlesssource.mediarotator.schedule.TimerToken;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Moves overlay opacity toward 0 or 100 in fixed steps on a repeating timer.
 */
public final class OpacityFader implements TimerDispatcher {
    static final double EPSILON = 0.5d;
    static final double MAX_OPACITY = 100.0d;

    /**
     * Notified when a fade-out lands on zero.
     */
    public interface FadeListener {
        void onFadedOut();
    }

    private final OverlayAdapter overlay;
    private final Scheduler scheduler;
    private final double stepSize;
    private final Duration stepInterval;
    private FadeListener listener;

    private double opacity;
    private FadeDirection direction;
    private TimerHandle stepHandle;

    public OpacityFader(OverlayAdapter overlay, Scheduler scheduler, RotatorOptions options) {
        this.overlay = Objects.requireNonNull(overlay, "overlay must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        int steps = options.getFadeSteps();
        this.stepSize = MAX_OPACITY / steps;
        this.stepInterval = Duration.ofMillis(Math.max(1L, options.getFadeDuration().toMillis() / steps));
    }

    void setListener(FadeListener listener) {
        this.listener = listener;
    }

    public double getOpacity() {
        return opacity;
    }

    public Optional<FadeDirection> getDirection() {
        return Optional.ofNullable(direction);
    }

    public boolean isFading() {
        return TimerHandle.isActive(stepHandle);
    }

    public void fadeIn() {
        if (direction == FadeDirection.IN && isFading()) {
            return;
        }
        if (opacity >= MAX_OPACITY && !isFading()) {
            return;
        }
        start(FadeDirection.IN);
    }

    public void fadeOut() {
        if (direction == FadeDirection.OUT && isFading()) {
            return;
        }
        if (opacity <= 0.0d && !isFading()) {
            return;
        }
        start(FadeDirection.OUT);
    }

    /**
     * Stop any ramp and jump straight to {@code value}.
     */
    public void snapTo(double value) {
        cancel();
        opacity = clamp(value);
        overlay.setOpacity(toPercent(opacity));
    }

    public void cancel() {
        TimerHandle.cancel(stepHandle);
        stepHandle = null;
        direction = null;
    }

    @Override
    public void onTimer(TimerToken token) {
        if (token != TimerToken.FADE_STEP) {
            return;
        }
        if (direction == null) {
            cancel();
            return;
        }
        FadeDirection current = direction;
        double target = current == FadeDirection.IN ? MAX_OPACITY : 0.0d;
        double next = current == FadeDirection.IN ? opacity + stepSize : opacity - stepSize;
        boolean reached = Math.abs(target - next) <= EPSILON
                || (current == FadeDirection.IN && next > target)
                || (current == FadeDirection.OUT && next < target);
        opacity = reached ? target : next;
        overlay.setOpacity(toPercent(opacity));
        if (reached) {
            cancel();
            if (current == FadeDirection.OUT && listener != null) {
                listener.onFadedOut();
            }
        }
    }

    private void start(FadeDirection newDirection) {
        TimerHandle.cancel(stepHandle);
        direction = newDirection;
        stepHandle = scheduler.scheduleRepeating(TimerToken.FADE_STEP, stepInterval, this);
    }

    private static double clamp(double value) {
        return Math.max(0.0d, Math.min(MAX_OPACITY, value));
    }

    private static int toPercent(double value) {
        return (int) Math.round(clamp(value));
    }
}
