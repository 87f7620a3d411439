package com.streamhistory.insights;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.streamhistory.pipeline.Provider;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * All-time statistics over the canonical log, one nested section per concern.
 * Apart from {@code metadata.generated_at} the document is a pure function of the log.
 */
public record LifetimeStats(
    Metadata metadata,
    TimeStats timeStats,
    ContentStats contentStats,
    PlatformStats platformStats,
    ProviderStats providerStats,
    TemporalPatterns temporalPatterns,
    ListeningBehavior listeningBehavior,
    DiversityMetrics diversityMetrics,
    TopLists topLists,
    Milestones milestones,
    GeographicalStats geographicalStats,
    TechnicalStats technicalStats
) {

    public record Metadata(Instant generatedAt, long totalRecords, List<Provider> dataSources) {}

    public record TimeStats(
        long totalMilliseconds,
        double totalSeconds,
        double totalMinutes,
        double totalHours,
        double totalDays,
        double totalWeeks,
        double totalMonths,
        double totalYears,
        double averageTrackLengthMs,
        double averageTrackLengthSeconds,
        double averageTrackLengthMinutes,
        Instant earliestPlay,
        Instant latestPlay,
        long trackingSpanDays
    ) {}

    public record ContentStats(
        int uniqueArtists,
        int uniqueTracks,
        int uniqueAlbums,
        long totalPlays,
        double averagePlaysPerArtist,
        double averagePlaysPerTrack,
        double averagePlaysPerAlbum
    ) {}

    public record PlatformStats(Map<String, Long> distribution, int totalPlatforms, String topPlatform) {}

    public record ProviderStats(
        Map<String, Long> distribution,
        int totalProviders,
        double spotifyPercentage,
        double appleMusicPercentage
    ) {}

    /**
     * Breakdowns by year, {@code yyyy-MM} month, hour of day (0-23), weekday and season, all in UTC.
     */
    public record TemporalPatterns(
        Map<String, ListeningBucket> yearlyBreakdown,
        Map<String, ListeningBucket> monthlyBreakdown,
        Map<Integer, ListeningBucket> hourlyBreakdown,
        Map<String, ListeningBucket> weekdayBreakdown,
        Map<String, ListeningBucket> seasonalBreakdown,
        Integer peakListeningHour,
        String peakListeningDay,
        String peakListeningSeason
    ) {}

    public record ListeningBehavior(
        double skipRatePercentage,
        double completionRatePercentage,
        double offlineListeningPercentage,
        double shuffleUsagePercentage,
        long totalSkips,
        long totalCompletions,
        long totalOfflinePlays,
        long totalShufflePlays
    ) {}

    /**
     * Concentrations are the share of all plays (0-100) going to the top 1, 5 and 10 artists.
     */
    public record DiversityMetrics(
        double artistDiversityScore,
        int uniqueArtists,
        int uniqueTracks,
        @JsonProperty("top_1_artist_concentration") double top1ArtistConcentration,
        @JsonProperty("top_5_artist_concentration") double top5ArtistConcentration,
        @JsonProperty("top_10_artist_concentration") double top10ArtistConcentration,
        double playsPerArtist,
        double playsPerTrack
    ) {}

    public record TopLists(
        List<RankedItem> topArtists,
        List<RankedItem> topTracks,
        List<RankedItem> topAlbums,
        List<NamedCount> topPlatforms,
        List<NamedCount> topCountries
    ) {}

    public record Milestone(Instant timestamp, String artist, String track, Provider provider, long msPlayed) {}

    public record Milestones(
        Milestone firstTrackPlayed,
        Milestone mostRecentTrack,
        Milestone longestTrackPlayed,
        int daysWithListening,
        double averageDailyListeningMinutes
    ) {}

    public record GeographicalStats(int countriesStreamedFrom, List<NamedCount> topCountries, Map<String, Long> distribution) {}

    public record DataQuality(
        long recordsWithTimestamps,
        long recordsWithArtists,
        long recordsWithTracks,
        long recordsWithAlbums,
        long recordsWithDuration
    ) {}

    public record TechnicalStats(DataQuality dataQuality, double averageDailyTracks, double tracksPerHourOfListening) {}
}
