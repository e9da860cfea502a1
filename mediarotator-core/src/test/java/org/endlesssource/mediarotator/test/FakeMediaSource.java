package org.endlesssource.mediarotator.test;

import org.endlesssource.mediarotator.api.MediaSourceAdapter;
import org.endlesssource.mediarotator.api.MediaStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Scriptable media slot. A successful load reports PLAYING at position 0.
 */
public final class FakeMediaSource implements MediaSourceAdapter {
    private final List<String> loads = new ArrayList<>();
    private final List<Boolean> forceFlags = new ArrayList<>();
    private boolean available = true;
    private boolean acceptFiles = true;
    private MediaStatus status = MediaStatus.NONE;
    private long durationMs;
    private long positionMs;
    private String activePath = "";
    private int stopCount;
    private RuntimeException statusFailure;

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public MediaStatus getStatus() {
        if (statusFailure != null) {
            throw statusFailure;
        }
        return status;
    }

    @Override
    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public long getPositionMs() {
        return positionMs;
    }

    @Override
    public boolean setLocalFile(String path, boolean forceReload) {
        if (!acceptFiles) {
            return false;
        }
        loads.add(path);
        forceFlags.add(forceReload);
        activePath = path;
        status = MediaStatus.PLAYING;
        positionMs = 0L;
        return true;
    }

    @Override
    public void stopAndClear() {
        stopCount++;
        status = MediaStatus.NONE;
        activePath = "";
        positionMs = 0L;
    }

    @Override
    public String getActiveLocalPath() {
        return activePath;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void setAcceptFiles(boolean acceptFiles) {
        this.acceptFiles = acceptFiles;
    }

    public void failStatusWith(RuntimeException failure) {
        this.statusFailure = failure;
    }

    public void setStatus(MediaStatus status) {
        this.status = status;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public void setPositionMs(long positionMs) {
        this.positionMs = positionMs;
    }

    public void setActivePath(String activePath) {
        this.activePath = activePath;
    }

    public List<String> loads() {
        return loads;
    }

    public List<Boolean> forceFlags() {
        return forceFlags;
    }

    public String lastLoad() {
        return loads.isEmpty() ? null : loads.get(loads.size() - 1);
    }

    public int stopCount() {
        return stopCount;
    }
}
