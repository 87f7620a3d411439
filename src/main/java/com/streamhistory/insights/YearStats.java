package com.streamhistory.insights;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics for one calendar year of plays. Shared by the annual recap and the
 * per-artist yearly breakdown.
 * <p>
 * Percentages are in the range 0 to 100. Peak and top fields are null when the year has no plays.
 */
public record YearStats(
    long totalPlays,
    long totalMsPlayed,
    double totalMinutes,
    double totalHours,
    int uniqueArtists,
    int uniqueTracks,
    int uniqueAlbums,
    int uniqueDaysWithListening,
    double averageTrackLengthMinutes,
    double averageDailyMinutes,
    double skipRatePercentage,
    double completionRatePercentage,
    double offlinePercentage,
    double shufflePercentage,
    Instant firstPlay,
    Instant lastPlay,
    String peakMonth,
    long peakMonthPlays,
    String topPlatform,
    String topProvider,
    Map<String, Long> providerBreakdown,
    Map<String, Long> platformBreakdown,
    Map<String, ListeningBucket> monthlyBreakdown
) {}
