package org.endlesssource.mediarotator.linux;

import org.freedesktop.dbus.types.Variant;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MprisMetadataUtilsTest {

    @Test
    void readsLengthAndLocalPathFromVariants() {
        Path file = Path.of("/tmp/clips/a.mp4");
        Map<String, Object> raw = Map.of(
                "mpris:length", new Variant<>(240_000_000L),
                "xesam:url", new Variant<>(file.toUri().toString()));

        Map<String, Object> metadata = MprisMetadataUtils.toMetadataMap(raw).orElseThrow();

        assertEquals(240_000L, MprisMetadataUtils.lengthMs(metadata));
        assertEquals(file.toString(), MprisMetadataUtils.localPath(metadata).orElseThrow());
        assertTrue(MprisMetadataUtils.hasTrack(metadata));
    }

    @Test
    void remoteOrMissingEntries_degrade() {
        Map<String, Object> metadata = MprisMetadataUtils.toMetadataMap(
                Map.of("xesam:url", "https://example.org/a.mp4", "mpris:length", "oops")).orElseThrow();

        assertTrue(MprisMetadataUtils.localPath(metadata).isEmpty());
        assertEquals(0L, MprisMetadataUtils.lengthMs(metadata));
        assertFalse(MprisMetadataUtils.hasTrack(Map.of()));
        assertTrue(MprisMetadataUtils.toMetadataMap(null).isEmpty());
        assertTrue(MprisMetadataUtils.toMetadataMap(Map.of()).isEmpty());
    }
}
