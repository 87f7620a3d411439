package com.streamhistory.insights;

import com.streamhistory.pipeline.StreamEvent;
import com.streamhistory.pipeline.Utils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts plays per item and produces ranked top lists.
 * <p>
 * Items are keyed by name plus owning artist, so two tracks that share a title but not an
 * artist stay separate. Ranking is plays descending, then earlier first play, then name.
 */
final class RankingCounter {

    private static final Comparator<Tally> RANKING = Comparator
        .comparingLong((Tally t) -> t.plays).reversed()
        .thenComparing(t -> t.firstPlayed)
        .thenComparing(t -> t.key.name)
        .thenComparing(t -> t.key.artist == null ? "" : t.key.artist);

    private record Key(String name, String artist) {}

    private static final class Tally {
        final Key key;
        long plays;
        long msPlayed;
        Instant firstPlayed;

        Tally(Key key) {
            this.key = key;
        }
    }

    private final Map<Key, Tally> tallies = new HashMap<>();

    /**
     * Counts one play. A null name is ignored.
     * @param name item name
     * @param artist owning artist, or null when the item is the artist itself
     * @param event the play
     */
    void add(String name, String artist, StreamEvent event) {
        if (name == null || name.isBlank()) return;
        Tally tally = tallies.computeIfAbsent(new Key(name, artist), Tally::new);
        tally.plays++;
        tally.msPlayed += event.msPlayed();
        if (tally.firstPlayed == null || event.timestamp().isBefore(tally.firstPlayed)) {
            tally.firstPlayed = event.timestamp();
        }
    }

    int size() {
        return tallies.size();
    }

    /**
     * @param limit maximum list length
     * @return ranked entries, best first
     */
    List<RankedItem> top(int limit) {
        List<Tally> sorted = new ArrayList<>(tallies.values());
        sorted.sort(RANKING);
        List<RankedItem> items = new ArrayList<>(Math.min(limit, sorted.size()));
        for (int i = 0; i < sorted.size() && i < limit; i++) {
            Tally t = sorted.get(i);
            items.add(new RankedItem(i + 1, t.key.name, t.key.artist, t.plays, Utils.msToMinutes(t.msPlayed), t.firstPlayed));
        }
        return items;
    }

    /**
     * Sum of the plays of the {@code n} highest ranked items.
     */
    long topPlays(int n) {
        return top(n).stream().mapToLong(RankedItem::plays).sum();
    }
}
