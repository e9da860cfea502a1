package org.endlesssource.mediarotator.playback;

import org.endlesssource.mediarotator.api.HostBinding;
import org.endlesssource.mediarotator.api.HostSignals;
import org.endlesssource.mediarotator.api.LibraryItem;
import org.endlesssource.mediarotator.api.MediaSourceAdapter;
import org.endlesssource.mediarotator.api.MediaStatus;
import org.endlesssource.mediarotator.api.OverlayAdapter;
import org.endlesssource.mediarotator.api.PlaybackMode;
import org.endlesssource.mediarotator.api.RotatorOptions;
import org.endlesssource.mediarotator.library.LibraryStore;
import org.endlesssource.mediarotator.library.PlayHistoryStore;
import org.endlesssource.mediarotator.overlay.TitleCard;
import org.endlesssource.mediarotator.overlay.TitleOverlay;
import org.endlesssource.mediarotator.schedule.Scheduler;
import org.endlesssource.mediarotator.schedule.TimerDispatcher;
import org.endlesssource.mediarotator.schedule.TimerHandle;
import org.endlesssource.mediarotator.schedule.TimerToken;
import org.endlesssource.mediarotator.selection.VideoSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Drives playback of the library on one host output.
 * <p>
 * {@link #tick()} is called on a fixed interval. It checks the host sinks and signals,
 * starts an item when the output is shown and nothing plays, and otherwise hands the
 * host-reported status to its {@link StatusHandler}. Timer callbacks scheduled by the
 * controller and its overlay arrive on the same thread as the ticks, and
 * {@link #setMode(PlaybackMode)} must be called there too.
 */
public final class PlaybackController implements TimerDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackController.class);

    private final MediaSourceAdapter media;
    private final OverlayAdapter overlayAdapter;
    private final HostSignals signals;
    private final LibraryStore library;
    private final Scheduler scheduler;
    private final RotatorOptions options;
    private final VideoSelector selector;
    private final TitleOverlay overlay;
    private final PlaybackProgressLogger progress = new PlaybackProgressLogger();
    private final StatusTransitions transitions = StatusTransitions.standard();
    private final OrchestratorState state = new OrchestratorState();
    private final PlayHistoryStore history;

    private PlaybackMode mode;
    private MediaStatus lastStatus;
    private TimerHandle restartHandle;
    private boolean lastVisible;
    private int lastLibrarySize;
    private boolean waitingForSinksLogged;
    private boolean waitingForLibraryLogged;
    private boolean shutdownRequested;
    private boolean shutdownHandled;

    public PlaybackController(HostBinding binding, LibraryStore library, Scheduler scheduler, RotatorOptions options) {
        this(binding.mediaSource(), binding.overlay(), binding.signals(), library, scheduler, options, new VideoSelector());
    }

    public PlaybackController(MediaSourceAdapter media,
                              OverlayAdapter overlayAdapter,
                              HostSignals signals,
                              LibraryStore library,
                              Scheduler scheduler,
                              RotatorOptions options,
                              VideoSelector selector) {
        this.media = Objects.requireNonNull(media, "media must not be null");
        this.overlayAdapter = Objects.requireNonNull(overlayAdapter, "overlayAdapter must not be null");
        this.signals = Objects.requireNonNull(signals, "signals must not be null");
        this.library = Objects.requireNonNull(library, "library must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.overlay = new TitleOverlay(overlayAdapter, media, scheduler, options);
        this.mode = options.getInitialMode();
        this.history = options.getPlayHistoryFile().map(PlayHistoryStore::new).orElse(null);
        if (history != null) {
            state.rotation().restorePlayed(history.load());
            logger.info("Loaded {} played item(s) from {}", state.rotation().playedIds().size(), history.getFile());
        }
    }

    /**
     * Run one controller step. Never throws.
     */
    public void tick() {
        try {
            doTick();
        } catch (RuntimeException e) {
            logger.error("Tick failed (mode={}, status={}, item={})", mode.id(), lastStatus,
                    state.currentItemId().orElse("none"), e);
        }
    }

    private void doTick() {
        if (shutdownRequested || signals.isShutdownRequested()) {
            handleShutdown();
            return;
        }

        if (!media.isAvailable() || !overlayAdapter.isAvailable()) {
            if (!waitingForSinksLogged) {
                logger.info("Waiting for media and overlay sinks");
                waitingForSinksLogged = true;
            }
            state.setReconciled(false);
            return;
        }
        if (waitingForSinksLogged) {
            logger.info("Media and overlay sinks available");
            waitingForSinksLogged = false;
        }

        boolean visible = signals.isOutputVisible();
        if (visible && !lastVisible) {
            onOutputShown();
        }
        lastVisible = visible;
        if (!visible && !keepsPlayingWhileHidden()) {
            if (state.isPlaying()) {
                logger.info("Output hidden, stopping {} playback", mode.id());
                fullStop();
                if (mode == PlaybackMode.LOOP) {
                    state.rotation().unpin();
                    state.setFirstItemPlayed(false);
                }
            }
            return;
        }

        int librarySize = library.size();
        if (librarySize == 0) {
            if (!waitingForLibraryLogged) {
                logger.info("Waiting for library items");
                waitingForLibraryLogged = true;
            }
            lastLibrarySize = 0;
            return;
        }
        waitingForLibraryLogged = false;
        if (librarySize > lastLibrarySize && state.isRetryExhausted()) {
            logger.info("Library grew to {} item(s), resuming", librarySize);
            state.setRetryExhausted(false);
        }
        lastLibrarySize = librarySize;

        refreshDisplayedTitle();

        MediaStatus status = media.getStatus();
        lastStatus = status;
        if (!state.isReconciled()) {
            state.setReconciled(true);
            if (status == MediaStatus.PLAYING && !state.isPlaying()) {
                transitions.handlerFor(MediaStatus.PLAYING).handle(this, visible);
                return;
            }
        }

        if (visible && !state.isPlaying() && mayAutoStart()) {
            if (mode == PlaybackMode.LOOP) {
                state.rotation().unpin();
            }
            startNext();
            return;
        }
        transitions.handlerFor(status).handle(this, visible);
    }

    public PlaybackMode getMode() {
        return mode;
    }

    /**
     * Change the playback mode, applying its entry effects at once.
     */
    public void setMode(PlaybackMode newMode) {
        Objects.requireNonNull(newMode, "mode must not be null");
        PlaybackMode previous = mode;
        if (previous == newMode) {
            return;
        }
        mode = newMode;
        state.setRetryExhausted(false);
        logger.info("Mode changed {} -> {}", previous.id(), newMode.id());

        state.setFirstItemPlayed(newMode == PlaybackMode.SINGLE && state.isPlaying());

        if (newMode == PlaybackMode.LOOP) {
            Optional<LibraryItem> current = state.isPlaying() ? identifyCurrentItem() : Optional.empty();
            if (current.isPresent()) {
                state.rotation().pin(current.get().id());
                logger.info("Pinned {} for loop playback", current.get().id());
            } else {
                state.rotation().unpin();
            }
        } else {
            state.rotation().unpin();
            cancelLoopRestart();
        }
    }

    /**
     * Stop at the next tick and stay idle.
     */
    public void requestShutdown() {
        shutdownRequested = true;
    }

    /**
     * Current controller state, for inspection.
     */
    public OrchestratorState state() {
        return state;
    }

    public TitleOverlay overlay() {
        return overlay;
    }

    @Override
    public void onTimer(TimerToken token) {
        if (token != TimerToken.LOOP_RESTART) {
            logger.debug("Ignoring timer {}", token);
            return;
        }
        restartHandle = null;
        Optional<String> restartId = state.restartItemId();
        Optional<LibraryItem> item = restartId.flatMap(library::get);
        if (item.isEmpty() || !library.containsValidFile(item.get().id())) {
            logger.warn("Loop item {} is gone, selecting another", restartId.orElse("?"));
            state.clearRestartPending();
            state.rotation().unpin();
            startNext();
            return;
        }
        logger.info("Restarting loop item {}", item.get().id());
        if (!startItem(item.get(), true)) {
            state.clearRestartPending();
        }
    }

    boolean startNext() {
        return startNext(false);
    }

    /**
     * @param retryCounted whether the caller already counted this attempt against the retry cap
     */
    boolean startNext(boolean retryCounted) {
        if (mode == PlaybackMode.SINGLE && state.isFirstItemPlayed()) {
            logger.debug("Single item already played, not starting another");
            return false;
        }
        int attempts = Math.max(1, library.size());
        for (int i = 0; i < attempts; i++) {
            Set<String> playedBefore = state.rotation().playedIds();
            Optional<String> next = selector.selectNext(mode, library.ids(), state.rotation());
            saveHistoryIfChanged(playedBefore);
            if (next.isEmpty()) {
                break;
            }
            String id = next.get();
            Optional<LibraryItem> item = library.get(id);
            if (item.isPresent() && library.containsValidFile(id)) {
                return startItem(item.get(), false, retryCounted);
            }
            logger.warn("Skipping {}: file is missing or not playable", id);
            discard(id);
        }
        logger.warn("No playable item found (mode={})", mode.id());
        if (state.isPlaying() || state.currentItemId().isPresent()) {
            fullStop();
        }
        return false;
    }

    boolean startItem(LibraryItem item, boolean forceReload) {
        return startItem(item, forceReload, false);
    }

    private boolean startItem(LibraryItem item, boolean forceReload, boolean retryCounted) {
        String path = item.localPath().toString();
        if (!media.setLocalFile(path, forceReload)) {
            int attempt = retryCounted ? state.getRetryCount() : state.incrementRetryCount();
            logger.warn("Host refused {} ({}), attempt {}/{}", item.id(), path, attempt, options.getMaxRetries());
            if (attempt > options.getMaxRetries()) {
                giveUp();
            } else {
                state.setPlaying(false);
            }
            return false;
        }

        state.setCurrentItemId(item.id());
        state.setPlaying(true);
        state.setStartedAtMillis(scheduler.nowMillis());
        state.setLastKnownPositionMs(0L);
        state.setTitleClearArmed(false);
        state.setDisplayedItem(item);
        if (mode == PlaybackMode.SINGLE) {
            state.setFirstItemPlayed(true);
        }
        library.markCurrent(item.id());
        progress.reset(item.id());
        overlay.showTitle(TitleCard.of(item));
        overlay.scheduleClearWhenDurationKnown();
        logger.info("Started {} in {} mode: {}", item.id(), mode.id(), path);
        return true;
    }

    /**
     * Stop the host, blank the overlay and cancel every pending timer.
     */
    void fullStop() {
        cancelLoopRestart();
        overlay.blank();
        media.stopAndClear();
        state.clearCurrent();
        library.markCurrent(null);
        logger.info("Playback stopped");
    }

    void giveUp() {
        fullStop();
        state.resetRetryCount();
        state.setRetryExhausted(true);
    }

    /**
     * Drop the belief that something plays without touching the host.
     */
    void releaseCurrent() {
        state.clearCurrent();
        library.markCurrent(null);
    }

    void adoptCurrent(LibraryItem item) {
        state.setCurrentItemId(item.id());
        state.setDisplayedItem(item);
        library.markCurrent(item.id());
        progress.reset(item.id());
    }

    void scheduleLoopRestart(String itemId) {
        cancelLoopRestart();
        state.markRestartPending(itemId);
        restartHandle = scheduler.schedule(TimerToken.LOOP_RESTART, options.getLoopRestartDelay(), this);
        logger.info("Loop item {} ended, restarting in {} ms", itemId, options.getLoopRestartDelay().toMillis());
    }

    /**
     * The item on air: the current id if known, else the library entry for the host's active path.
     */
    Optional<LibraryItem> identifyCurrentItem() {
        Optional<LibraryItem> current = state.currentItemId().flatMap(library::get);
        if (current.isPresent()) {
            return current;
        }
        return library.findByPath(media.getActiveLocalPath());
    }

    boolean mayAutoStart() {
        if (state.isRetryExhausted()) {
            return false;
        }
        return !(mode == PlaybackMode.SINGLE && state.isFirstItemPlayed());
    }

    PlaybackMode mode() {
        return mode;
    }

    MediaSourceAdapter media() {
        return media;
    }

    LibraryStore library() {
        return library;
    }

    PlaybackProgressLogger progress() {
        return progress;
    }

    long nowMillis() {
        return scheduler.nowMillis();
    }

    long seekThresholdMs() {
        return options.getSeekThreshold().toMillis();
    }

    long titleClearLeadMs() {
        return options.getTitleClearLead().toMillis();
    }

    long noneGracePeriodMs() {
        return options.getNoneGracePeriod().toMillis();
    }

    int maxRetries() {
        return options.getMaxRetries();
    }

    private boolean keepsPlayingWhileHidden() {
        return mode == PlaybackMode.CONTINUOUS && options.isContinuousPlaysWhileHidden();
    }

    private void onOutputShown() {
        if (state.isRetryExhausted()) {
            logger.info("Output shown again, resuming after earlier retries");
            state.setRetryExhausted(false);
        }
        if (mode == PlaybackMode.SINGLE && options.isRearmSingleOnShow()) {
            state.setFirstItemPlayed(false);
        }
    }

    private void handleShutdown() {
        if (shutdownHandled) {
            return;
        }
        shutdownHandled = true;
        if (state.isPlaying()) {
            fullStop();
        } else {
            cancelLoopRestart();
            overlay.cancelTimers();
        }
        logger.info("Shutdown requested, rotator idle");
    }

    private void cancelLoopRestart() {
        TimerHandle.cancel(restartHandle);
        restartHandle = null;
        state.clearRestartPending();
    }

    private void discard(String id) {
        library.remove(id);
        if (state.loopItemId().filter(id::equals).isPresent()) {
            state.rotation().unpin();
        }
    }

    private void refreshDisplayedTitle() {
        if (!state.isPlaying()) {
            return;
        }
        Optional<LibraryItem> shown = state.displayedItem();
        Optional<LibraryItem> latest = state.currentItemId().flatMap(library::get);
        if (shown.isEmpty() || latest.isEmpty() || latest.get().sameDisplay(shown.get())) {
            return;
        }
        state.setDisplayedItem(latest.get());
        if (state.isTitleClearArmed() && !overlay.isClearScheduled()) {
            return;
        }
        logger.info("Metadata of {} changed, refreshing title", latest.get().id());
        overlay.replaceTitle(TitleCard.of(latest.get()));
    }

    private void saveHistoryIfChanged(Set<String> before) {
        if (history == null) {
            return;
        }
        Set<String> after = state.rotation().playedIds();
        if (!after.equals(before)) {
            history.save(after);
        }
    }
}
