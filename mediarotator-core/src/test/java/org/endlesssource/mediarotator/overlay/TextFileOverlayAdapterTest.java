package org.endlesssource.mediarotator.overlay;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextFileOverlayAdapterTest {

    @TempDir
    Path dir;

    @Test
    void writesTextAndOpacityFiles() throws Exception {
        TextFileOverlayAdapter adapter = new TextFileOverlayAdapter(dir.resolve("title.txt"));
        assertTrue(adapter.isAvailable());

        assertTrue(adapter.setText("Song - Artist"));
        adapter.setOpacity(140);

        assertEquals("Song - Artist", Files.readString(adapter.getTextFile(), StandardCharsets.UTF_8));
        assertEquals("100", Files.readString(adapter.getOpacityFile(), StandardCharsets.UTF_8));
        assertEquals(dir.resolve("title.txt.opacity").toAbsolutePath(), adapter.getOpacityFile());
    }

    @Test
    void missingDirectory_isUnavailable() {
        TextFileOverlayAdapter adapter = new TextFileOverlayAdapter(dir.resolve("nope").resolve("title.txt"));
        assertFalse(adapter.isAvailable());
        assertFalse(adapter.setText("x"));
    }

    @Test
    void failedWrite_leavesNoTempFile() throws Exception {
        Path blocked = Files.createDirectory(dir.resolve("title.txt"));
        Files.writeString(blocked.resolve("keep"), "x");
        TextFileOverlayAdapter adapter = new TextFileOverlayAdapter(blocked);

        assertFalse(adapter.setText("Song - Artist"));

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(0, files.filter(p -> p.getFileName().toString().endsWith(".tmp")).count());
        }
    }
}
