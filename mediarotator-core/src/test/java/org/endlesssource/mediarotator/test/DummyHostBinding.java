package org.endlesssource.mediarotator.test;

import org.endlesssource.mediarotator.api.HostBinding;
import org.endlesssource.mediarotator.api.HostSignals;
import org.endlesssource.mediarotator.api.MediaSourceAdapter;
import org.endlesssource.mediarotator.api.MutableHostSignals;
import org.endlesssource.mediarotator.api.OverlayAdapter;

public final class DummyHostBinding implements HostBinding {
    private final FakeMediaSource media = new FakeMediaSource();
    private final RecordingOverlay overlay = new RecordingOverlay();
    private final MutableHostSignals signals = new MutableHostSignals(true);
    private boolean closed;

    @Override
    public MediaSourceAdapter mediaSource() {
        return media;
    }

    @Override
    public OverlayAdapter overlay() {
        return overlay;
    }

    @Override
    public HostSignals signals() {
        return signals;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
