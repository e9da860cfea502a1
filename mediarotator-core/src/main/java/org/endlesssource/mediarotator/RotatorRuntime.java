package org.endlesssource.mediarotator;

import org.endlesssource.mediarotator.api.HostBinding;
import org.endlesssource.mediarotator.api.PlaybackMode;
import org.endlesssource.mediarotator.api.RotatorOptions;
import org.endlesssource.mediarotator.library.LibraryStore;
import org.endlesssource.mediarotator.playback.PlaybackController;
import org.endlesssource.mediarotator.schedule.ExecutorScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a {@link PlaybackController} on its own single thread: ticks at the configured
 * interval, delivers every timer on that thread and tears down in order on close.
 */
public final class RotatorRuntime implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RotatorRuntime.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5L;

    private final HostBinding binding;
    private final LibraryStore library;
    private final RotatorOptions options;
    private final ScheduledExecutorService executor;
    private final PlaybackController controller;
    private boolean started;
    private boolean closed;

    public RotatorRuntime(HostBinding binding, LibraryStore library, RotatorOptions options) {
        this.binding = Objects.requireNonNull(binding, "binding must not be null");
        this.library = Objects.requireNonNull(library, "library must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mediarotator-tick");
            thread.setDaemon(true);
            return thread;
        });
        this.controller = new PlaybackController(binding, library, new ExecutorScheduler(executor), options);
    }

    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Runtime is closed");
        }
        if (started) {
            return;
        }
        started = true;
        long intervalMs = options.getTickInterval().toMillis();
        executor.scheduleWithFixedDelay(controller::tick, 0L, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("Rotator started in {} mode, ticking every {} ms", controller.getMode().id(), intervalMs);
    }

    /**
     * Change the mode on the tick thread.
     */
    public void setMode(PlaybackMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        executor.execute(() -> controller.setMode(mode));
    }

    public PlaybackMode getMode() {
        return controller.getMode();
    }

    public LibraryStore getLibrary() {
        return library;
    }

    public HostBinding getBinding() {
        return binding;
    }

    /**
     * Snapshot of the controller state taken on the tick thread.
     */
    public String describe() {
        Future<String> future = executor.submit(() -> String.format("mode=%s playing=%s current=%s loop=%s played=%d library=%d",
                controller.getMode().id(),
                controller.state().isPlaying(),
                controller.state().currentItemId().orElse("-"),
                controller.state().loopItemId().orElse("-"),
                controller.state().rotation().playedIds().size(),
                library.size()));
        try {
            return future.get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "interrupted";
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Failed to read controller state: {}", e.getMessage());
            return "unavailable";
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            executor.submit(() -> {
                controller.requestShutdown();
                controller.tick();
            }).get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Orderly stop did not complete: {}", e.getMessage());
        }
        executor.shutdownNow();
        try {
            binding.close();
        } catch (RuntimeException e) {
            logger.error("Failed to close host binding", e);
        }
        logger.info("Rotator closed");
    }
}
