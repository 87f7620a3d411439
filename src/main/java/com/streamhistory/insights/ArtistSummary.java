package com.streamhistory.insights;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Lifetime statistics of one canonical artist, with a per-year breakdown in the
 * same shape as the annual recap's year statistics.
 */
public record ArtistSummary(
    long totalStreams,
    long totalMsPlayed,
    double totalMinutes,
    double totalHours,
    int uniqueTracks,
    int uniqueAlbums,
    int yearsActive,
    int daysActive,
    Instant firstPlayed,
    Instant lastPlayed,
    double avgTrackLengthMinutes,
    double avgStreamsPerYear,
    double avgMinutesPerYear,
    double avgStreamsPerDay,
    double avgMinutesPerDay,
    double skipRatePercentage,
    double completionRatePercentage,
    double offlinePercentage,
    double shufflePercentage,
    String peakYear,
    long peakYearStreams,
    List<RankedItem> topTracks,
    List<RankedItem> topAlbums,
    String topPlatform,
    String topProvider,
    int countriesStreamedFrom,
    List<NamedCount> topCountries,
    Map<String, Long> platformBreakdown,
    Map<String, Long> providerBreakdown,
    Map<String, YearStats> yearlyBreakdown
) {}
