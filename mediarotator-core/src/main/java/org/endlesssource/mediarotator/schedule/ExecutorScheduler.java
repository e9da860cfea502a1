package org.endlesssource.mediarotator.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler backed by a single-threaded {@link ScheduledExecutorService}. The same
 * executor must run the controller ticks so callbacks and ticks never overlap.
 */
public final class ExecutorScheduler implements Scheduler {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorScheduler.class);

    private final ScheduledExecutorService executor;

    public ExecutorScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public long nowMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }

    @Override
    public TimerHandle schedule(TimerToken token, Duration delay, TimerDispatcher target) {
        FutureHandle handle = new FutureHandle(token, false);
        handle.future = executor.schedule(() -> fire(handle, target),
                Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
        return handle;
    }

    @Override
    public TimerHandle scheduleRepeating(TimerToken token, Duration interval, TimerDispatcher target) {
        long intervalMs = interval.toMillis();
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("interval must be positive");
        }
        FutureHandle handle = new FutureHandle(token, true);
        handle.future = executor.scheduleAtFixedRate(() -> fire(handle, target),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        return handle;
    }

    private void fire(FutureHandle handle, TimerDispatcher target) {
        boolean shouldFire = handle.repeating ? handle.active.get() : handle.active.compareAndSet(true, false);
        if (!shouldFire) {
            return;
        }
        try {
            target.onTimer(handle.token);
        } catch (RuntimeException e) {
            logger.error("Timer {} failed", handle.token, e);
        }
    }

    private static final class FutureHandle implements TimerHandle {
        private final TimerToken token;
        private final boolean repeating;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private volatile ScheduledFuture<?> future;

        private FutureHandle(TimerToken token, boolean repeating) {
            this.token = token;
            this.repeating = repeating;
        }

        @Override
        public TimerToken token() {
            return token;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public boolean cancel() {
            if (!active.compareAndSet(true, false)) {
                return false;
            }
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
            return true;
        }
    }
}
