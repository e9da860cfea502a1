package org.endlesssource.mediarotator.library;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Persists the played set of the rotation so a restart does not replay items early.
 * Format: {@code {"played_videos": ["id", ...]}}; a bare JSON array is read as well.
 */
public final class PlayHistoryStore {
    private static final Logger logger = LoggerFactory.getLogger(PlayHistoryStore.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
    static final String PLAYED_KEY = "played_videos";

    private final Path file;

    public PlayHistoryStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
    }

    public Path getFile() {
        return file;
    }

    /**
     * Load played ids
     * @return ids in stored order, empty if the file is missing or unreadable
     */
    public List<String> load() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (root.isJsonArray()) {
                return readIds(root.getAsJsonArray());
            }
            if (root.isJsonObject()) {
                JsonElement played = root.getAsJsonObject().get(PLAYED_KEY);
                if (played != null && played.isJsonArray()) {
                    return readIds(played.getAsJsonArray());
                }
            }
            return List.of();
        } catch (IOException | JsonParseException | IllegalStateException e) {
            logger.warn("Could not load play history from {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    /**
     * Save played ids
     * @return true on success
     */
    public boolean save(Collection<String> ids) {
        JsonObject root = new JsonObject();
        JsonArray played = new JsonArray();
        ids.forEach(played::add);
        root.add(PLAYED_KEY, played);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                GSON.toJson(root, writer);
            }
            return true;
        } catch (IOException e) {
            logger.error("Could not save play history to {}", file, e);
            return false;
        }
    }

    public boolean clear() {
        return save(List.of());
    }

    private static List<String> readIds(JsonArray array) {
        List<String> ids = new ArrayList<>(array.size());
        for (JsonElement element : array) {
            if (element.isJsonPrimitive()) {
                ids.add(element.getAsString());
            }
        }
        return ids;
    }
}
