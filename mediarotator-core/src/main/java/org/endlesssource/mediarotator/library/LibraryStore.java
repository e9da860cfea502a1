package org.endlesssource.mediarotator.library;

import org.endlesssource.mediarotator.api.LibraryItem;
import org.endlesssource.mediarotator.api.RotatorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Shared library of ready-to-play items. Written by ingestion workers, read by the
 * playback controller; every access takes the store lock and composite values are
 * returned as copies.
 * <p>
 * The item the controller marks as current is never removed: a removal request for
 * it is remembered and applied once the controller moves on.
 */
public final class LibraryStore {
    private static final Logger logger = LoggerFactory.getLogger(LibraryStore.class);

    private final Object lock = new Object();
    private final Map<String, LibraryItem> items = new LinkedHashMap<>();
    private final Set<String> targetedIds = new HashSet<>();
    private final Set<String> pendingRemovals = new HashSet<>();
    private final MediaFileValidator validator;
    private String currentItemId;

    public LibraryStore() {
        this(new MediaFileValidator(RotatorOptions.DEFAULT_MINIMUM_FILE_SIZE));
    }

    public LibraryStore(MediaFileValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    public static LibraryStore forOptions(RotatorOptions options) {
        return new LibraryStore(new MediaFileValidator(options.getMinimumFileSize()));
    }

    public MediaFileValidator getValidator() {
        return validator;
    }

    public void put(LibraryItem item) {
        Objects.requireNonNull(item, "item must not be null");
        synchronized (lock) {
            items.put(item.id(), item);
            pendingRemovals.remove(item.id());
        }
    }

    /**
     * Remove an item
     * @param id Item id
     * @return true if removed, false if absent or deferred because it is current
     */
    public boolean remove(String id) {
        synchronized (lock) {
            if (id == null || !items.containsKey(id)) {
                return false;
            }
            if (id.equals(currentItemId)) {
                pendingRemovals.add(id);
                logger.debug("Deferring removal of current item {}", id);
                return false;
            }
            items.remove(id);
            return true;
        }
    }

    public Optional<LibraryItem> get(String id) {
        synchronized (lock) {
            return Optional.ofNullable(items.get(id));
        }
    }

    public boolean contains(String id) {
        synchronized (lock) {
            return items.containsKey(id);
        }
    }

    public Map<String, LibraryItem> snapshot() {
        synchronized (lock) {
            return new LinkedHashMap<>(items);
        }
    }

    public Set<String> ids() {
        synchronized (lock) {
            return new HashSet<>(items.keySet());
        }
    }

    public int size() {
        synchronized (lock) {
            return items.size();
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return items.isEmpty();
        }
    }

    /**
     * Check that the entry exists and its file is still present and playable.
     */
    public boolean containsValidFile(String id) {
        Optional<LibraryItem> item = get(id);
        return item.isPresent() && validator.isValid(item.get().localPath());
    }

    /**
     * Find the entry whose file is {@code localPath}.
     */
    public Optional<LibraryItem> findByPath(String localPath) {
        if (localPath == null || localPath.isBlank()) {
            return Optional.empty();
        }
        Optional<Path> wanted = normalize(localPath);
        for (LibraryItem item : snapshot().values()) {
            if (item.localPath().toString().equals(localPath)) {
                return Optional.of(item);
            }
            if (wanted.isPresent() && wanted.get().equals(item.localPath().toAbsolutePath().normalize())) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    /**
     * Replace the set of ids belonging to the active playlist.
     */
    public void setTargetedIds(Collection<String> ids) {
        synchronized (lock) {
            targetedIds.clear();
            targetedIds.addAll(ids);
        }
    }

    public Set<String> getTargetedIds() {
        synchronized (lock) {
            return new HashSet<>(targetedIds);
        }
    }

    /**
     * Drop every entry that left the active playlist, deferring the current one.
     * @return ids removed right away
     */
    public List<String> retainTargeted() {
        synchronized (lock) {
            List<String> removed = new ArrayList<>();
            for (String id : new ArrayList<>(items.keySet())) {
                if (targetedIds.contains(id)) {
                    continue;
                }
                if (id.equals(currentItemId)) {
                    pendingRemovals.add(id);
                } else {
                    items.remove(id);
                    removed.add(id);
                }
            }
            if (!removed.isEmpty()) {
                logger.info("Removed {} item(s) no longer in the playlist", removed.size());
            }
            return removed;
        }
    }

    /**
     * Mark the item now on air. Deferred removals of any other item are applied.
     * @param id Current item id, or null when nothing plays
     */
    public void markCurrent(String id) {
        synchronized (lock) {
            currentItemId = id;
            pendingRemovals.removeIf(pending -> {
                if (pending.equals(id)) {
                    return false;
                }
                items.remove(pending);
                logger.debug("Applied deferred removal of {}", pending);
                return true;
            });
        }
    }

    public Optional<String> currentItemId() {
        synchronized (lock) {
            return Optional.ofNullable(currentItemId);
        }
    }

    public boolean isRemovalPending(String id) {
        synchronized (lock) {
            return pendingRemovals.contains(id);
        }
    }

    private static Optional<Path> normalize(String localPath) {
        try {
            return Optional.of(Path.of(localPath).toAbsolutePath().normalize());
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }
}
