package com.streamhistory.insights;

import com.streamhistory.pipeline.StreamEvent;
import com.streamhistory.pipeline.Utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Single-pass running totals over a slice of the canonical log (the whole log, one year or one artist).
 * <p>
 * Not thread safe; each generator owns its accumulators.
 */
final class StatsAccumulator {
    static final String UNKNOWN = "Unknown";

    private long plays;
    private long totalMs;
    private long skips;
    private long completions;
    private long offlinePlays;
    private long shufflePlays;
    private long playsWithAlbum;

    private final RankingCounter artists = new RankingCounter();
    private final RankingCounter tracks = new RankingCounter();
    private final RankingCounter albums = new RankingCounter();
    private final Map<String, Long> platforms = new TreeMap<>();
    private final Map<String, Long> providers = new TreeMap<>();
    private final Map<String, Long> countries = new TreeMap<>();
    private final Map<Month, long[]> months = new EnumMap<>(Month.class);
    private final Set<LocalDate> days = new HashSet<>();

    private StreamEvent firstEvent;
    private StreamEvent lastEvent;
    private StreamEvent longestEvent;

    void add(StreamEvent e) {
        plays++;
        totalMs += e.msPlayed();
        if (e.skipped()) skips++;
        if (e.completed()) completions++;
        if (e.offline()) offlinePlays++;
        if (e.shuffle()) shufflePlays++;
        if (e.albumName() != null) playsWithAlbum++;

        artists.add(e.artistName(), null, e);
        tracks.add(e.trackName(), e.artistName(), e);
        albums.add(e.albumName(), e.artistName(), e);
        increment(platforms, e.platform());
        increment(providers, e.provider().displayName());
        increment(countries, e.country() == null ? UNKNOWN : e.country());

        ZonedDateTime at = e.timestamp().atZone(Calendars.ZONE);
        long[] month = months.computeIfAbsent(at.getMonth(), m -> new long[2]);
        month[0]++;
        month[1] += e.msPlayed();
        days.add(at.toLocalDate());

        // strict comparisons keep the earliest-seen event on ties
        if (firstEvent == null || e.timestamp().isBefore(firstEvent.timestamp())) firstEvent = e;
        if (lastEvent == null || e.timestamp().isAfter(lastEvent.timestamp())) lastEvent = e;
        if (longestEvent == null || e.msPlayed() > longestEvent.msPlayed()) longestEvent = e;
    }

    long plays() { return plays; }
    long totalMs() { return totalMs; }
    long skips() { return skips; }
    long completions() { return completions; }
    long offlinePlays() { return offlinePlays; }
    long shufflePlays() { return shufflePlays; }
    long playsWithAlbum() { return playsWithAlbum; }
    RankingCounter artists() { return artists; }
    RankingCounter tracks() { return tracks; }
    RankingCounter albums() { return albums; }
    Map<String, Long> platforms() { return Collections.unmodifiableMap(platforms); }
    Map<String, Long> providers() { return Collections.unmodifiableMap(providers); }
    Map<String, Long> countries() { return Collections.unmodifiableMap(countries); }
    int uniqueDays() { return days.size(); }
    StreamEvent firstEvent() { return firstEvent; }
    StreamEvent lastEvent() { return lastEvent; }
    StreamEvent longestEvent() { return longestEvent; }

    double minutes() {
        return Utils.msToMinutes(totalMs);
    }

    double hours() {
        return Utils.msToHours(totalMs);
    }

    double percentOfPlays(long count) {
        return Utils.percentage(count, plays);
    }

    /**
     * Summarizes the accumulated plays in the per-year shape.
     */
    YearStats toYearStats() {
        Map.Entry<Month, long[]> peak = null;
        Map<String, ListeningBucket> monthly = new LinkedHashMap<>();
        for (Map.Entry<Month, long[]> entry : months.entrySet()) {
            monthly.put(Calendars.monthName(entry.getKey()), ListeningBucket.of(entry.getValue()[0], entry.getValue()[1]));
            if (peak == null || entry.getValue()[0] > peak.getValue()[0]) peak = entry;
        }
        double minutes = minutes();
        return new YearStats(
            plays,
            totalMs,
            minutes,
            hours(),
            artists.size(),
            tracks.size(),
            albums.size(),
            days.size(),
            Utils.ratio(minutes, plays),
            Utils.ratio(minutes, days.size()),
            percentOfPlays(skips),
            percentOfPlays(completions),
            percentOfPlays(offlinePlays),
            percentOfPlays(shufflePlays),
            firstEvent == null ? null : firstEvent.timestamp(),
            lastEvent == null ? null : lastEvent.timestamp(),
            peak == null ? null : Calendars.monthName(peak.getKey()),
            peak == null ? 0 : peak.getValue()[0],
            topKey(platforms),
            topKey(providers),
            new TreeMap<>(providers),
            new TreeMap<>(platforms),
            monthly
        );
    }

    static void increment(Map<String, Long> counts, String key) {
        counts.merge(key, 1L, Long::sum);
    }

    /**
     * Key with the highest count; ties go to the key that sorts first.
     * @return the key, or null for an empty map
     */
    static String topKey(Map<String, Long> counts) {
        String best = null;
        long bestCount = -1;
        for (Map.Entry<String, Long> entry : new TreeMap<>(counts).entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Counts as a list ordered by count descending, then name.
     */
    static List<NamedCount> ranked(Map<String, Long> counts, int limit) {
        List<NamedCount> list = new ArrayList<>();
        counts.forEach((k, v) -> list.add(new NamedCount(k, v)));
        list.sort((a, b) -> a.plays() != b.plays() ? Long.compare(b.plays(), a.plays()) : a.name().compareTo(b.name()));
        return list.size() > limit ? new ArrayList<>(list.subList(0, limit)) : list;
    }
}
