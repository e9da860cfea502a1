package org.endlesssource.mediarotator.linux;

import org.endlesssource.mediarotator.api.HostBinding;
import org.endlesssource.mediarotator.api.HostSignals;
import org.endlesssource.mediarotator.api.MediaSourceAdapter;
import org.endlesssource.mediarotator.api.MutableHostSignals;
import org.endlesssource.mediarotator.api.OverlayAdapter;
import org.endlesssource.mediarotator.api.RotatorOptions;
import org.endlesssource.mediarotator.overlay.TextFileOverlayAdapter;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.exceptions.DBusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Linux host: an MPRIS player plays the media, a text file carries the title.
 * The output counts as visible until told otherwise through {@link #signals()}.
 */
public class MprisHostBinding implements HostBinding {
    private static final Logger logger = LoggerFactory.getLogger(MprisHostBinding.class);
    static final String DEFAULT_OVERLAY_FILE = "mediarotator-title.txt";

    private final DBusConnection connection;
    private final MprisMediaSourceAdapter mediaSource;
    private final TextFileOverlayAdapter overlay;
    private final MutableHostSignals signals = new MutableHostSignals(true);

    public MprisHostBinding(RotatorOptions options) throws DBusException {
        this.connection = DBusConnectionBuilder.forSessionBus().build();
        this.mediaSource = new MprisMediaSourceAdapter(connection, options.getHostTarget().orElse(null));
        Path overlayFile = options.getOverlayTextFile()
                .orElseGet(() -> Path.of(System.getProperty("java.io.tmpdir"), DEFAULT_OVERLAY_FILE));
        this.overlay = new TextFileOverlayAdapter(overlayFile);
        logger.info("Title overlay written to {}", overlay.getTextFile());
    }

    @Override
    public MediaSourceAdapter mediaSource() {
        return mediaSource;
    }

    @Override
    public OverlayAdapter overlay() {
        return overlay;
    }

    @Override
    public HostSignals signals() {
        return signals;
    }

    /**
     * Signals of this binding, writable by the operator.
     */
    public MutableHostSignals mutableSignals() {
        return signals;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (Exception e) {
            logger.error("Failed to close D-Bus connection", e);
        }
    }
}
