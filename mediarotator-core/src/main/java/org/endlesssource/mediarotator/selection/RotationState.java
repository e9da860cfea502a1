package org.endlesssource.mediarotator.selection;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * No-repeat bookkeeping and the loop pin, mutated by {@link VideoSelector}.
 * Confined to the controller thread.
 */
public final class RotationState {
    private final Set<String> playedIds = new LinkedHashSet<>();
    private String loopItemId;

    public Set<String> playedIds() {
        return Set.copyOf(playedIds);
    }

    public boolean hasPlayed(String id) {
        return playedIds.contains(id);
    }

    public void markPlayed(String id) {
        playedIds.add(id);
    }

    public void restorePlayed(Collection<String> ids) {
        playedIds.clear();
        playedIds.addAll(ids);
    }

    public void clearPlayed() {
        playedIds.clear();
    }

    Set<String> mutablePlayedIds() {
        return playedIds;
    }

    public Optional<String> loopItemId() {
        return Optional.ofNullable(loopItemId);
    }

    public void pin(String id) {
        this.loopItemId = id;
    }

    public void unpin() {
        this.loopItemId = null;
    }
}
