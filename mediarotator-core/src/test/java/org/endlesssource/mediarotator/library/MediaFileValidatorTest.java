package org.endlesssource.mediarotator.library;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MediaFileValidatorTest {

    @TempDir
    Path dir;

    @Test
    void acceptsVideoFileAboveMinimumSize() throws Exception {
        Path file = Files.write(dir.resolve("clip.MP4"), new byte[2048]);
        assertTrue(new MediaFileValidator(1024).isValid(file));
    }

    @Test
    void rejectsSmallMissingAndForeignFiles() throws Exception {
        MediaFileValidator validator = new MediaFileValidator(1024);
        Path small = Files.write(dir.resolve("small.webm"), new byte[10]);
        Path text = Files.write(dir.resolve("notes.txt"), new byte[2048]);

        assertFalse(validator.isValid(small));
        assertFalse(validator.isValid(text));
        assertFalse(validator.isValid(dir.resolve("gone.mkv")));
        assertFalse(validator.isValid(dir));
        assertFalse(validator.isValid(null));
    }

    @Test
    void extensionCheck_handlesEdgeNames() {
        assertTrue(MediaFileValidator.hasVideoExtension(Path.of("a.m4v")));
        assertFalse(MediaFileValidator.hasVideoExtension(Path.of("mp4")));
        assertFalse(MediaFileValidator.hasVideoExtension(Path.of("video.")));
    }

    @Test
    void negativeMinimum_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MediaFileValidator(-1));
    }
}
