package org.endlesssource.mediarotator.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Scheduler on a manually advanced clock. Due timers fire in due-time order on the
 * thread that advances it.
 */
public final class QueuedScheduler implements Scheduler {
    private static final Logger logger = LoggerFactory.getLogger(QueuedScheduler.class);

    private final PriorityQueue<Entry> queue = new PriorityQueue<>(
            Comparator.comparingLong((Entry e) -> e.dueAt).thenComparingLong(e -> e.sequence));
    private long now;
    private long sequence;

    public QueuedScheduler() {
        this(0L);
    }

    public QueuedScheduler(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public long nowMillis() {
        return now;
    }

    @Override
    public TimerHandle schedule(TimerToken token, Duration delay, TimerDispatcher target) {
        return enqueue(token, Math.max(0L, delay.toMillis()), 0L, target);
    }

    @Override
    public TimerHandle scheduleRepeating(TimerToken token, Duration interval, TimerDispatcher target) {
        long intervalMs = interval.toMillis();
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("interval must be positive");
        }
        return enqueue(token, intervalMs, intervalMs, target);
    }

    /**
     * Advance the clock, firing every timer that becomes due on the way.
     */
    public void advanceBy(Duration amount) {
        advanceTo(now + Math.max(0L, amount.toMillis()));
    }

    public void advanceTo(long targetMillis) {
        Entry next;
        while ((next = queue.peek()) != null && next.dueAt <= targetMillis) {
            queue.poll();
            if (!next.active) {
                continue;
            }
            now = Math.max(now, next.dueAt);
            if (next.intervalMs == 0L) {
                next.active = false;
            }
            fire(next);
            if (next.active && next.intervalMs > 0L) {
                next.dueAt += next.intervalMs;
                next.sequence = sequence++;
                queue.add(next);
            }
        }
        now = Math.max(now, targetMillis);
    }

    /**
     * Fire timers already due at the current time.
     */
    public void runDue() {
        advanceTo(now);
    }

    /**
     * Number of active timers carrying {@code token}.
     */
    public int activeCount(TimerToken token) {
        int count = 0;
        for (Entry entry : queue) {
            if (entry.active && entry.token == token) {
                count++;
            }
        }
        return count;
    }

    private TimerHandle enqueue(TimerToken token, long delayMs, long intervalMs, TimerDispatcher target) {
        Entry entry = new Entry(Objects.requireNonNull(token, "token must not be null"),
                Objects.requireNonNull(target, "target must not be null"),
                now + delayMs, intervalMs, sequence++);
        queue.add(entry);
        return entry;
    }

    private void fire(Entry entry) {
        try {
            entry.target.onTimer(entry.token);
        } catch (RuntimeException e) {
            logger.error("Timer {} failed", entry.token, e);
        }
    }

    private static final class Entry implements TimerHandle {
        private final TimerToken token;
        private final TimerDispatcher target;
        private final long intervalMs;
        private long dueAt;
        private long sequence;
        private boolean active = true;

        private Entry(TimerToken token, TimerDispatcher target, long dueAt, long intervalMs, long sequence) {
            this.token = token;
            this.target = target;
            this.dueAt = dueAt;
            this.intervalMs = intervalMs;
            this.sequence = sequence;
        }

        @Override
        public TimerToken token() {
            return token;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public boolean cancel() {
            if (!active) {
                return false;
            }
            active = false;
            return true;
        }
    }
}
