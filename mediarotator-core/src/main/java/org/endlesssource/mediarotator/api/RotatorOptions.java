package org.endlesssource.mediarotator.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration options for the playback orchestrator and host bindings.
 * Instances are immutable; every {@code withX} returns a modified copy.
 */
public final class RotatorOptions {
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_TITLE_SHOW_DELAY = Duration.ofMillis(1500);
    public static final Duration DEFAULT_TITLE_CLEAR_LEAD = Duration.ofMillis(3500);
    public static final Duration DEFAULT_FADE_DURATION = Duration.ofMillis(1000);
    public static final int DEFAULT_FADE_STEPS = 20;
    public static final Duration DEFAULT_DURATION_POLL_INTERVAL = Duration.ofMillis(500);
    public static final Duration DEFAULT_SEEK_THRESHOLD = Duration.ofSeconds(5);
    public static final Duration DEFAULT_LOOP_RESTART_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_NONE_GRACE_PERIOD = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_MINIMUM_FILE_SIZE = 1024L * 1024L;

    private PlaybackMode initialMode = PlaybackMode.CONTINUOUS;
    private Duration tickInterval = DEFAULT_TICK_INTERVAL;
    private Duration titleShowDelay = DEFAULT_TITLE_SHOW_DELAY;
    private Duration titleClearLead = DEFAULT_TITLE_CLEAR_LEAD;
    private Duration fadeDuration = DEFAULT_FADE_DURATION;
    private int fadeSteps = DEFAULT_FADE_STEPS;
    private Duration durationPollInterval = DEFAULT_DURATION_POLL_INTERVAL;
    private Duration seekThreshold = DEFAULT_SEEK_THRESHOLD;
    private Duration loopRestartDelay = DEFAULT_LOOP_RESTART_DELAY;
    private Duration noneGracePeriod = DEFAULT_NONE_GRACE_PERIOD;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private boolean continuousPlaysWhileHidden = true;
    private boolean rearmSingleOnShow;
    private long minimumFileSize = DEFAULT_MINIMUM_FILE_SIZE;
    private Path playHistoryFile;
    private String hostTarget;
    private Path overlayTextFile;

    private RotatorOptions() {
    }

    public static RotatorOptions defaults() {
        return new RotatorOptions();
    }

    public PlaybackMode getInitialMode() {
        return initialMode;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public Duration getTitleShowDelay() {
        return titleShowDelay;
    }

    public Duration getTitleClearLead() {
        return titleClearLead;
    }

    public Duration getFadeDuration() {
        return fadeDuration;
    }

    public int getFadeSteps() {
        return fadeSteps;
    }

    public Duration getDurationPollInterval() {
        return durationPollInterval;
    }

    public Duration getSeekThreshold() {
        return seekThreshold;
    }

    public Duration getLoopRestartDelay() {
        return loopRestartDelay;
    }

    public Duration getNoneGracePeriod() {
        return noneGracePeriod;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Whether continuous mode keeps rotating while the output is not shown.
     */
    public boolean isContinuousPlaysWhileHidden() {
        return continuousPlaysWhileHidden;
    }

    /**
     * Whether single mode may play one more item each time the output is shown again.
     */
    public boolean isRearmSingleOnShow() {
        return rearmSingleOnShow;
    }

    public long getMinimumFileSize() {
        return minimumFileSize;
    }

    public Optional<Path> getPlayHistoryFile() {
        return Optional.ofNullable(playHistoryFile);
    }

    /**
     * Host-specific playback target, e.g. an MPRIS bus name.
     */
    public Optional<String> getHostTarget() {
        return Optional.ofNullable(hostTarget);
    }

    public Optional<Path> getOverlayTextFile() {
        return Optional.ofNullable(overlayTextFile);
    }

    public RotatorOptions withInitialMode(PlaybackMode mode) {
        RotatorOptions copy = copy();
        copy.initialMode = Objects.requireNonNull(mode, "initialMode must not be null");
        return copy;
    }

    public RotatorOptions withTickInterval(Duration interval) {
        RotatorOptions copy = copy();
        copy.tickInterval = requirePositive("tickInterval", interval);
        return copy;
    }

    public RotatorOptions withTitleShowDelay(Duration delay) {
        RotatorOptions copy = copy();
        copy.titleShowDelay = requireNonNegative("titleShowDelay", delay);
        return copy;
    }

    public RotatorOptions withTitleClearLead(Duration lead) {
        RotatorOptions copy = copy();
        copy.titleClearLead = requireNonNegative("titleClearLead", lead);
        return copy;
    }

    public RotatorOptions withFade(Duration duration, int steps) {
        if (steps <= 0) {
            throw new IllegalArgumentException("fadeSteps must be positive");
        }
        Duration checked = requirePositive("fadeDuration", duration);
        if (checked.toMillis() < steps) {
            throw new IllegalArgumentException("fadeDuration must allow at least 1 ms per step");
        }
        RotatorOptions copy = copy();
        copy.fadeDuration = checked;
        copy.fadeSteps = steps;
        return copy;
    }

    public RotatorOptions withDurationPollInterval(Duration interval) {
        RotatorOptions copy = copy();
        copy.durationPollInterval = requirePositive("durationPollInterval", interval);
        return copy;
    }

    public RotatorOptions withSeekThreshold(Duration threshold) {
        RotatorOptions copy = copy();
        copy.seekThreshold = requirePositive("seekThreshold", threshold);
        return copy;
    }

    public RotatorOptions withLoopRestartDelay(Duration delay) {
        RotatorOptions copy = copy();
        copy.loopRestartDelay = requireNonNegative("loopRestartDelay", delay);
        return copy;
    }

    public RotatorOptions withNoneGracePeriod(Duration period) {
        RotatorOptions copy = copy();
        copy.noneGracePeriod = requireNonNegative("noneGracePeriod", period);
        return copy;
    }

    public RotatorOptions withMaxRetries(int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        RotatorOptions copy = copy();
        copy.maxRetries = retries;
        return copy;
    }

    public RotatorOptions withContinuousPlaysWhileHidden(boolean enabled) {
        RotatorOptions copy = copy();
        copy.continuousPlaysWhileHidden = enabled;
        return copy;
    }

    public RotatorOptions withRearmSingleOnShow(boolean enabled) {
        RotatorOptions copy = copy();
        copy.rearmSingleOnShow = enabled;
        return copy;
    }

    public RotatorOptions withMinimumFileSize(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("minimumFileSize must not be negative");
        }
        RotatorOptions copy = copy();
        copy.minimumFileSize = bytes;
        return copy;
    }

    public RotatorOptions withPlayHistoryFile(Path file) {
        RotatorOptions copy = copy();
        copy.playHistoryFile = file;
        return copy;
    }

    public RotatorOptions withHostTarget(String target) {
        RotatorOptions copy = copy();
        copy.hostTarget = target == null || target.isBlank() ? null : target.trim();
        return copy;
    }

    public RotatorOptions withOverlayTextFile(Path file) {
        RotatorOptions copy = copy();
        copy.overlayTextFile = file;
        return copy;
    }

    private RotatorOptions copy() {
        RotatorOptions copy = new RotatorOptions();
        copy.initialMode = initialMode;
        copy.tickInterval = tickInterval;
        copy.titleShowDelay = titleShowDelay;
        copy.titleClearLead = titleClearLead;
        copy.fadeDuration = fadeDuration;
        copy.fadeSteps = fadeSteps;
        copy.durationPollInterval = durationPollInterval;
        copy.seekThreshold = seekThreshold;
        copy.loopRestartDelay = loopRestartDelay;
        copy.noneGracePeriod = noneGracePeriod;
        copy.maxRetries = maxRetries;
        copy.continuousPlaysWhileHidden = continuousPlaysWhileHidden;
        copy.rearmSingleOnShow = rearmSingleOnShow;
        copy.minimumFileSize = minimumFileSize;
        copy.playHistoryFile = playHistoryFile;
        copy.hostTarget = hostTarget;
        copy.overlayTextFile = overlayTextFile;
        return copy;
    }

    private static Duration requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static Duration requireNonNegative(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }
}
