package org.endlesssource.mediarotator.selection;

import org.endlesssource.mediarotator.api.PlaybackMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * Picks the next item to play.
 * <p>
 * Continuous and Single draw uniformly from the items not yet played in the current
 * rotation; Loop repeats its pinned item while it is still in the library. Candidates are
 * sorted before drawing so the result depends only on the random source.
 */
public final class VideoSelector {
    private static final Logger logger = LoggerFactory.getLogger(VideoSelector.class);

    private final Random random;

    public VideoSelector() {
        this(new Random());
    }

    public VideoSelector(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * @param mode Current playback mode
     * @param libraryIds Ids currently in the library
     * @param state Played set and loop pin, updated in place
     * @return The id to play next, or empty if the library is empty
     */
    public Optional<String> selectNext(PlaybackMode mode, Collection<String> libraryIds, RotationState state) {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(state, "state must not be null");
        if (libraryIds == null || libraryIds.isEmpty()) {
            return Optional.empty();
        }
        Set<String> library = new TreeSet<>(libraryIds);

        if (mode == PlaybackMode.LOOP) {
            Optional<String> pinned = state.loopItemId();
            if (pinned.isPresent() && library.contains(pinned.get())) {
                return pinned;
            }
            if (pinned.isPresent()) {
                logger.info("Loop item {} left the library, picking another", pinned.get());
                state.unpin();
            }
        }

        if (library.size() == 1) {
            String only = library.iterator().next();
            pinIfLooping(mode, state, only);
            return Optional.of(only);
        }

        Set<String> played = state.mutablePlayedIds();
        if (played.containsAll(library)) {
            logger.info("All {} items played, starting a new rotation", library.size());
            played.clear();
        }

        List<String> unplayed = new ArrayList<>();
        for (String id : library) {
            if (!played.contains(id)) {
                unplayed.add(id);
            }
        }
        if (unplayed.isEmpty()) {
            unplayed.addAll(library);
        }

        String chosen;
        if (unplayed.size() == 1) {
            chosen = unplayed.get(0);
            played.clear();
            logger.debug("Last unplayed item {}, rotation complete", chosen);
        } else {
            chosen = unplayed.get(random.nextInt(unplayed.size()));
            played.add(chosen);
        }
        played.retainAll(library);
        pinIfLooping(mode, state, chosen);
        return Optional.of(chosen);
    }

    private static void pinIfLooping(PlaybackMode mode, RotationState state, String id) {
        if (mode == PlaybackMode.LOOP && state.loopItemId().isEmpty()) {
            state.pin(id);
            logger.info("Pinned {} for loop playback", id);
        }
    }
}
