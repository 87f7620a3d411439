package com.streamhistory.insights;

import com.streamhistory.pipeline.PipelineSettings;
import com.streamhistory.pipeline.StreamEvent;
import com.streamhistory.pipeline.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds one {@link ArtistSummary} per canonical artist name.
 * <p>
 * Entries are ordered by total streams descending, then earlier first play, then name.
 * Peak year ties go to the earlier year.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class ArtistSummaryGenerator implements InsightGeneratorInterface<Map<String, ArtistSummary>> {
    private static final Logger logger = LoggerFactory.getLogger(ArtistSummaryGenerator.class);

    static final int TOP_COUNTRIES = 5;

    private final int topListSize;

    public ArtistSummaryGenerator(int topListSize) {
        if (topListSize < 1) {
            throw new IllegalArgumentException("topListSize must be >= 1");
        }
        this.topListSize = topListSize;
    }

    public ArtistSummaryGenerator(PipelineSettings settings) {
        this(settings.artistTopListSize());
    }

    @Override
    public String name() {
        return "artist summary";
    }

    @Override
    public Map<String, ArtistSummary> generate(List<StreamEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("Event list cannot be null");
        }
        Map<String, ArtistAccumulator> artists = new HashMap<>();
        for (StreamEvent e : events) {
            artists.computeIfAbsent(e.artistName(), ArtistAccumulator::new).add(e);
        }

        List<ArtistAccumulator> ordered = new ArrayList<>(artists.values());
        ordered.sort(Comparator.comparingLong((ArtistAccumulator a) -> a.total.plays()).reversed()
            .thenComparing(a -> a.total.firstEvent().timestamp())
            .thenComparing(a -> a.name));

        Map<String, ArtistSummary> summary = new LinkedHashMap<>();
        for (ArtistAccumulator artist : ordered) {
            summary.put(artist.name, summarize(artist));
        }
        logger.info("Generated summaries for {} artists", summary.size());
        return Collections.unmodifiableMap(summary);
    }

    private ArtistSummary summarize(ArtistAccumulator artist) {
        StatsAccumulator total = artist.total;
        Map<String, YearStats> yearly = new LinkedHashMap<>();
        String peakYear = null;
        long peakStreams = 0;
        for (Map.Entry<Integer, StatsAccumulator> entry : artist.years.entrySet()) {
            String year = Integer.toString(entry.getKey());
            yearly.put(year, entry.getValue().toYearStats());
            if (entry.getValue().plays() > peakStreams) {
                peakYear = year;
                peakStreams = entry.getValue().plays();
            }
        }
        int yearsActive = artist.years.size();
        int daysActive = total.uniqueDays();
        double minutes = total.minutes();
        return new ArtistSummary(
            total.plays(),
            total.totalMs(),
            minutes,
            total.hours(),
            total.tracks().size(),
            total.albums().size(),
            yearsActive,
            daysActive,
            total.firstEvent().timestamp(),
            total.lastEvent().timestamp(),
            Utils.ratio(minutes, total.plays()),
            Utils.ratio(total.plays(), yearsActive),
            Utils.ratio(minutes, yearsActive),
            Utils.ratio(total.plays(), daysActive),
            Utils.ratio(minutes, daysActive),
            total.percentOfPlays(total.skips()),
            total.percentOfPlays(total.completions()),
            total.percentOfPlays(total.offlinePlays()),
            total.percentOfPlays(total.shufflePlays()),
            peakYear,
            peakStreams,
            total.tracks().top(topListSize),
            total.albums().top(topListSize),
            StatsAccumulator.topKey(total.platforms()),
            StatsAccumulator.topKey(total.providers()),
            total.countries().size(),
            StatsAccumulator.ranked(total.countries(), TOP_COUNTRIES),
            new TreeMap<>(total.platforms()),
            new TreeMap<>(total.providers()),
            yearly
        );
    }

    private static final class ArtistAccumulator {
        final String name;
        final StatsAccumulator total = new StatsAccumulator();
        final Map<Integer, StatsAccumulator> years = new TreeMap<>();

        ArtistAccumulator(String name) {
            this.name = name;
        }

        void add(StreamEvent e) {
            total.add(e);
            years.computeIfAbsent(e.timestamp().atZone(Calendars.ZONE).getYear(), y -> new StatsAccumulator()).add(e);
        }
    }
}
