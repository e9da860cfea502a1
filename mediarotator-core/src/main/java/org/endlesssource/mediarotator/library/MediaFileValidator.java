package org.endlesssource.mediarotator.library;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a cached media file is still usable for playback.
 */
public final class MediaFileValidator {
    private static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "webm", "mkv", "mov", "m4v");

    private final long minimumSize;

    public MediaFileValidator(long minimumSize) {
        if (minimumSize < 0) {
            throw new IllegalArgumentException("minimumSize must not be negative");
        }
        this.minimumSize = minimumSize;
    }

    public boolean isValid(Path file) {
        if (file == null) {
            return false;
        }
        try {
            if (!Files.isRegularFile(file) || !hasVideoExtension(file)) {
                return false;
            }
            return Files.size(file) >= minimumSize;
        } catch (IOException | SecurityException e) {
            return false;
        }
    }

    static boolean hasVideoExtension(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return false;
        }
        return VIDEO_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
