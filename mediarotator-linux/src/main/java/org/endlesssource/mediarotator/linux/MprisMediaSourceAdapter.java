package org.endlesssource.mediarotator.linux;

import org.endlesssource.mediarotator.api.MediaSourceAdapter;
import org.endlesssource.mediarotator.api.MediaStatus;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.interfaces.DBus;
import org.freedesktop.dbus.interfaces.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Media slot backed by an MPRIS player on the session bus.
 * <p>
 * The player is the configured bus name, or else the first {@code org.mpris.MediaPlayer2.*}
 * name found. D-Bus failures degrade to neutral values.
 */
class MprisMediaSourceAdapter implements MediaSourceAdapter {
    private static final Logger logger = LoggerFactory.getLogger(MprisMediaSourceAdapter.class);
    private static final String MPRIS_PREFIX = "org.mpris.MediaPlayer2.";
    private static final String OBJECT_PATH = "/org/mpris/MediaPlayer2";
    private static final String PLAYER_INTERFACE = "org.mpris.MediaPlayer2.Player";

    private final DBusConnection connection;
    private final String configuredBusName;

    private String busName;
    private MprisPlayer player;
    private Properties properties;
    private long lastPositionMs;
    private long lastLengthMs;

    MprisMediaSourceAdapter(DBusConnection connection, String configuredBusName) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.configuredBusName = configuredBusName;
    }

    @Override
    public boolean isAvailable() {
        return resolvePlayer();
    }

    @Override
    public MediaStatus getStatus() {
        if (!resolvePlayer()) {
            return MediaStatus.NONE;
        }
        try {
            String status = player.getPlaybackStatus();
            Optional<Map<String, Object>> metadata = readMetadata();
            boolean hasTrack = metadata.map(MprisMetadataUtils::hasTrack).orElse(false);
            metadata.ifPresent(map -> {
                long length = MprisMetadataUtils.lengthMs(map);
                if (length > 0) {
                    lastLengthMs = length;
                }
            });
            if ("Playing".equalsIgnoreCase(status) || "Paused".equalsIgnoreCase(status)) {
                lastPositionMs = Math.max(lastPositionMs, readPositionMs());
            }
            return MprisStatusInterpreter.interpret(status, hasTrack, lastPositionMs, lastLengthMs);
        } catch (Exception e) {
            logger.debug("Failed to read playback status from {}: {}", busName, e.getMessage());
            forgetPlayer();
            return MediaStatus.NONE;
        }
    }

    @Override
    public long getDurationMs() {
        if (!resolvePlayer()) {
            return 0L;
        }
        return readMetadata().map(MprisMetadataUtils::lengthMs).orElse(0L);
    }

    @Override
    public long getPositionMs() {
        if (!resolvePlayer()) {
            return 0L;
        }
        long position = readPositionMs();
        lastPositionMs = position;
        return position;
    }

    @Override
    public boolean setLocalFile(String path, boolean forceReload) {
        if (!resolvePlayer()) {
            return false;
        }
        try {
            String uri = Path.of(path).toUri().toString();
            if (forceReload || path.equals(getActiveLocalPath())) {
                logger.debug("Reloading {} on {}", path, busName);
                player.Stop();
            }
            lastPositionMs = 0L;
            lastLengthMs = 0L;
            player.OpenUri(uri);
            player.Play();
            return true;
        } catch (Exception e) {
            logger.warn("Failed to open {} on {}: {}", path, busName, e.getMessage());
            return false;
        }
    }

    @Override
    public void stopAndClear() {
        lastPositionMs = 0L;
        lastLengthMs = 0L;
        if (!resolvePlayer()) {
            return;
        }
        try {
            player.Stop();
        } catch (Exception e) {
            logger.debug("Failed to stop {}: {}", busName, e.getMessage());
        }
    }

    @Override
    public String getActiveLocalPath() {
        if (!resolvePlayer()) {
            return "";
        }
        return readMetadata().flatMap(MprisMetadataUtils::localPath).orElse("");
    }

    private Optional<Map<String, Object>> readMetadata() {
        try {
            Object metadata = properties.Get(PLAYER_INTERFACE, "Metadata");
            return MprisMetadataUtils.toMetadataMap(metadata);
        } catch (Exception e) {
            logger.debug("Failed to read metadata from {}: {}", busName, e.getMessage());
            return Optional.empty();
        }
    }

    private long readPositionMs() {
        try {
            Object position = properties.Get(PLAYER_INTERFACE, "Position");
            Optional<Long> micros = MprisMetadataUtils.toLong(position);
            if (micros.isPresent()) {
                return Math.max(0L, micros.get() / 1000L);
            }
        } catch (Exception e) {
            logger.debug("Position property unavailable on {}: {}", busName, e.getMessage());
        }
        try {
            return Math.max(0L, player.getPosition() / 1000L);
        } catch (Exception e) {
            return 0L;
        }
    }

    private boolean resolvePlayer() {
        try {
            DBus dbus = connection.getRemoteObject("org.freedesktop.DBus", "/org/freedesktop/DBus", DBus.class);
            if (busName != null && dbus.NameHasOwner(busName)) {
                return true;
            }
            forgetPlayer();
            Optional<String> candidate = findBusName(dbus);
            if (candidate.isEmpty()) {
                return false;
            }
            bind(candidate.get());
            return true;
        } catch (Exception e) {
            logger.debug("MPRIS player lookup failed: {}", e.getMessage());
            forgetPlayer();
            return false;
        }
    }

    private Optional<String> findBusName(DBus dbus) {
        if (configuredBusName != null) {
            String name = configuredBusName.startsWith(MPRIS_PREFIX) ? configuredBusName : MPRIS_PREFIX + configuredBusName;
            return dbus.NameHasOwner(name) ? Optional.of(name) : Optional.empty();
        }
        for (String name : dbus.ListNames()) {
            if (name.startsWith(MPRIS_PREFIX)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    private void bind(String name) throws DBusException {
        this.player = connection.getRemoteObject(name, OBJECT_PATH, MprisPlayer.class);
        this.properties = connection.getRemoteObject(name, OBJECT_PATH, Properties.class);
        this.busName = name;
        logger.info("Using MPRIS player {} ({})", name, identity(name));
    }

    private String identity(String name) {
        try {
            return connection.getRemoteObject(name, OBJECT_PATH, MprisMediaPlayer2.class).getIdentity();
        } catch (Exception e) {
            return name.substring(MPRIS_PREFIX.length());
        }
    }

    private void forgetPlayer() {
        busName = null;
        player = null;
        properties = null;
    }
}
