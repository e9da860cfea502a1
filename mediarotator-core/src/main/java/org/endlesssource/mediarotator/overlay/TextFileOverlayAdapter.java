package org.endlesssource.mediarotator.overlay;

import org.endlesssource.mediarotator.api.OverlayAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Overlay sink for hosts that render a text file (e.g. a "read from file" text source).
 * Opacity goes to a sibling {@code <name>.opacity} file as an integer percentage.
 */
public final class TextFileOverlayAdapter implements OverlayAdapter {
    private static final Logger logger = LoggerFactory.getLogger(TextFileOverlayAdapter.class);

    private final Path textFile;
    private final Path opacityFile;
    private int lastOpacity = -1;

    public TextFileOverlayAdapter(Path textFile) {
        this.textFile = Objects.requireNonNull(textFile, "textFile must not be null").toAbsolutePath();
        this.opacityFile = this.textFile.resolveSibling(this.textFile.getFileName() + ".opacity");
    }

    public Path getTextFile() {
        return textFile;
    }

    public Path getOpacityFile() {
        return opacityFile;
    }

    @Override
    public boolean isAvailable() {
        Path parent = textFile.getParent();
        return parent != null && Files.isDirectory(parent) && Files.isWritable(parent);
    }

    @Override
    public boolean setText(String text) {
        return writeAtomically(textFile, text == null ? "" : text);
    }

    @Override
    public void setOpacity(int percent) {
        int clamped = Math.max(0, Math.min(100, percent));
        if (clamped == lastOpacity) {
            return;
        }
        if (writeAtomically(opacityFile, Integer.toString(clamped))) {
            lastOpacity = clamped;
        }
    }

    private boolean writeAtomically(Path target, String content) {
        Path temp = null;
        try {
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            logger.warn("Failed to write overlay file {}: {}", target, e.getMessage());
            deleteQuietly(temp);
            return false;
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.debug("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
