package org.endlesssource.mediarotator.api;

/**
 * In-memory {@link HostSignals} for hosts without a scene concept.
 */
public final class MutableHostSignals implements HostSignals {
    private volatile boolean outputVisible;
    private volatile boolean shutdownRequested;

    public MutableHostSignals(boolean outputVisible) {
        this.outputVisible = outputVisible;
    }

    @Override
    public boolean isOutputVisible() {
        return outputVisible;
    }

    @Override
    public boolean isShutdownRequested() {
        return shutdownRequested;
    }

    public void setOutputVisible(boolean visible) {
        this.outputVisible = visible;
    }

    public void requestShutdown() {
        this.shutdownRequested = true;
    }
}
