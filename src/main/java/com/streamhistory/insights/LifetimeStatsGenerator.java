package com.streamhistory.insights;

import com.streamhistory.pipeline.PipelineSettings;
import com.streamhistory.pipeline.Provider;
import com.streamhistory.pipeline.StreamEvent;
import com.streamhistory.pipeline.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces the whole canonical log into a {@link LifetimeStats} document in one pass.
 * <p>
 * Completion rate counts plays that ended with {@code trackdone}; skip rate counts plays flagged
 * skipped. The artist diversity score is unique artists divided by total plays.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class LifetimeStatsGenerator implements InsightGeneratorInterface<LifetimeStats> {
    private static final Logger logger = LoggerFactory.getLogger(LifetimeStatsGenerator.class);

    static final int TOP_COUNTRIES = 10;
    private static final double DAYS_PER_MONTH = 30.44;
    private static final double DAYS_PER_YEAR = 365.25;

    private final int topListSize;
    private final Clock clock;

    public LifetimeStatsGenerator(int topListSize, Clock clock) {
        if (topListSize < 1) {
            throw new IllegalArgumentException("topListSize must be >= 1");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.topListSize = topListSize;
        this.clock = clock;
    }

    public LifetimeStatsGenerator(PipelineSettings settings, Clock clock) {
        this(settings.topListSize(), clock);
    }

    @Override
    public String name() {
        return "lifetime stats";
    }

    @Override
    public LifetimeStats generate(List<StreamEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("Event list cannot be null");
        }
        StatsAccumulator acc = new StatsAccumulator();
        Map<Integer, long[]> years = new TreeMap<>();
        Map<String, long[]> months = new TreeMap<>();
        Map<Integer, long[]> hours = new TreeMap<>();
        Map<DayOfWeek, long[]> weekdays = new EnumMap<>(DayOfWeek.class);
        Map<String, long[]> seasons = new LinkedHashMap<>();
        for (String season : List.of(Calendars.WINTER, Calendars.SPRING, Calendars.SUMMER, Calendars.FALL)) {
            seasons.put(season, new long[2]);
        }
        Map<Provider, Boolean> sources = new EnumMap<>(Provider.class);
        long withDuration = 0;

        for (StreamEvent e : events) {
            acc.add(e);
            sources.put(e.provider(), Boolean.TRUE);
            if (e.msPlayed() > 0) withDuration++;
            ZonedDateTime at = e.timestamp().atZone(Calendars.ZONE);
            bump(years.computeIfAbsent(at.getYear(), k -> new long[2]), e);
            bump(months.computeIfAbsent(String.format(Locale.ROOT, "%04d-%02d", at.getYear(), at.getMonthValue()), k -> new long[2]), e);
            bump(hours.computeIfAbsent(at.getHour(), k -> new long[2]), e);
            bump(weekdays.computeIfAbsent(at.getDayOfWeek(), k -> new long[2]), e);
            bump(seasons.get(Calendars.season(at.getMonth())), e);
        }
        seasons.values().removeIf(b -> b[0] == 0);

        long plays = acc.plays();
        long totalMs = acc.totalMs();
        Instant earliest = acc.firstEvent() == null ? null : acc.firstEvent().timestamp();
        Instant latest = acc.lastEvent() == null ? null : acc.lastEvent().timestamp();
        long spanDays = earliest == null ? 0 : Duration.between(earliest, latest).toDays();

        LifetimeStats.Metadata metadata = new LifetimeStats.Metadata(clock.instant(), plays, new ArrayList<>(sources.keySet()));

        double seconds = totalMs / 1000.0;
        double minutes = acc.minutes();
        double hoursTotal = acc.hours();
        double days = hoursTotal / 24;
        LifetimeStats.TimeStats timeStats = new LifetimeStats.TimeStats(totalMs, seconds, minutes, hoursTotal, days,
            days / 7, days / DAYS_PER_MONTH, days / DAYS_PER_YEAR,
            Utils.ratio(totalMs, plays), Utils.ratio(seconds, plays), Utils.ratio(minutes, plays),
            earliest, latest, spanDays);

        int uniqueArtists = acc.artists().size();
        int uniqueTracks = acc.tracks().size();
        int uniqueAlbums = acc.albums().size();
        LifetimeStats.ContentStats contentStats = new LifetimeStats.ContentStats(uniqueArtists, uniqueTracks, uniqueAlbums,
            plays, Utils.ratio(plays, uniqueArtists), Utils.ratio(plays, uniqueTracks), Utils.ratio(plays, uniqueAlbums));

        LifetimeStats.PlatformStats platformStats = new LifetimeStats.PlatformStats(
            new TreeMap<>(acc.platforms()), acc.platforms().size(), StatsAccumulator.topKey(acc.platforms()));

        Map<String, Long> providers = acc.providers();
        LifetimeStats.ProviderStats providerStats = new LifetimeStats.ProviderStats(new TreeMap<>(providers), providers.size(),
            acc.percentOfPlays(providers.getOrDefault(Provider.SPOTIFY.displayName(), 0L)),
            acc.percentOfPlays(providers.getOrDefault(Provider.APPLE_MUSIC.displayName(), 0L)));

        Map<String, ListeningBucket> weekdayBuckets = new LinkedHashMap<>();
        weekdays.forEach((day, b) -> weekdayBuckets.put(Calendars.weekdayName(day), ListeningBucket.of(b[0], b[1])));
        Map<String, ListeningBucket> yearBuckets = new LinkedHashMap<>();
        years.forEach((year, b) -> yearBuckets.put(Integer.toString(year), ListeningBucket.of(b[0], b[1])));
        DayOfWeek peakDay = peak(weekdays);
        LifetimeStats.TemporalPatterns temporal = new LifetimeStats.TemporalPatterns(
            yearBuckets, buckets(months), buckets(hours), weekdayBuckets, buckets(seasons),
            peak(hours), peakDay == null ? null : Calendars.weekdayName(peakDay), peak(seasons));

        LifetimeStats.ListeningBehavior behavior = new LifetimeStats.ListeningBehavior(
            acc.percentOfPlays(acc.skips()), acc.percentOfPlays(acc.completions()),
            acc.percentOfPlays(acc.offlinePlays()), acc.percentOfPlays(acc.shufflePlays()),
            acc.skips(), acc.completions(), acc.offlinePlays(), acc.shufflePlays());

        LifetimeStats.DiversityMetrics diversity = new LifetimeStats.DiversityMetrics(
            Utils.ratio(uniqueArtists, plays), uniqueArtists, uniqueTracks,
            acc.percentOfPlays(acc.artists().topPlays(1)),
            acc.percentOfPlays(acc.artists().topPlays(5)),
            acc.percentOfPlays(acc.artists().topPlays(10)),
            Utils.ratio(plays, uniqueArtists), Utils.ratio(plays, uniqueTracks));

        LifetimeStats.TopLists topLists = new LifetimeStats.TopLists(
            acc.artists().top(topListSize), acc.tracks().top(topListSize), acc.albums().top(topListSize),
            StatsAccumulator.ranked(acc.platforms(), Integer.MAX_VALUE),
            StatsAccumulator.ranked(acc.countries(), Integer.MAX_VALUE));

        int listeningDays = acc.uniqueDays();
        LifetimeStats.Milestones milestones = new LifetimeStats.Milestones(
            milestone(acc.firstEvent()), milestone(acc.lastEvent()), milestone(acc.longestEvent()),
            listeningDays, Utils.ratio(minutes, listeningDays));

        LifetimeStats.GeographicalStats geo = new LifetimeStats.GeographicalStats(acc.countries().size(),
            StatsAccumulator.ranked(acc.countries(), TOP_COUNTRIES), new TreeMap<>(acc.countries()));

        // every canonical event carries a timestamp, artist and track
        LifetimeStats.DataQuality quality = new LifetimeStats.DataQuality(plays, plays, plays, acc.playsWithAlbum(), withDuration);
        LifetimeStats.TechnicalStats technical = new LifetimeStats.TechnicalStats(quality,
            earliest == null ? 0.0 : Utils.ratio(plays, spanDays + 1), Utils.ratio(plays, hoursTotal));

        logger.info("Generated lifetime stats over {} plays ({} hours)", plays, String.format(Locale.ROOT, "%.1f", hoursTotal));
        return new LifetimeStats(metadata, timeStats, contentStats, platformStats, providerStats, temporal, behavior,
            diversity, topLists, milestones, geo, technical);
    }

    private static void bump(long[] bucket, StreamEvent e) {
        bucket[0]++;
        bucket[1] += e.msPlayed();
    }

    private static <K> Map<K, ListeningBucket> buckets(Map<K, long[]> raw) {
        Map<K, ListeningBucket> out = new LinkedHashMap<>();
        raw.forEach((k, b) -> out.put(k, ListeningBucket.of(b[0], b[1])));
        return out;
    }

    /**
     * Key with the most plays; ties keep the first key in iteration order.
     */
    private static <K> K peak(Map<K, long[]> raw) {
        K best = null;
        long bestPlays = 0;
        for (Map.Entry<K, long[]> entry : raw.entrySet()) {
            if (entry.getValue()[0] > bestPlays) {
                best = entry.getKey();
                bestPlays = entry.getValue()[0];
            }
        }
        return best;
    }

    private static LifetimeStats.Milestone milestone(StreamEvent e) {
        if (e == null) return null;
        return new LifetimeStats.Milestone(e.timestamp(), e.artistName(), e.trackName(), e.provider(), e.msPlayed());
    }
}
