package com.streamhistory.insights;

import com.streamhistory.pipeline.Provider;
import com.streamhistory.pipeline.StreamEvent;
import com.streamhistory.pipeline.TestEvents;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;

public class LifetimeStatsGeneratorTest {
    private final LifetimeStatsGenerator generator = new LifetimeStatsGenerator(50, TestEvents.FIXED_CLOCK);

    private static final List<StreamEvent> LOG = List.of(
        TestEvents.spotify("2020-01-06T08:00:00Z", "Fall Out Boy", "Centuries", 240_000),
        TestEvents.spotify("2020-07-06T08:30:00Z", "Fall Out Boy", "Centuries", 180_000),
        TestEvents.apple("2021-07-07T21:00:00Z", "Paramore", "Still Into You", 200_000),
        TestEvents.skipped("2021-10-10T21:15:00Z", "Paramore", "Hard Times", 35_000));

    @Test
    void testTimeStatsConserveTotalPlaytime() {
        LifetimeStats stats = generator.generate(LOG);
        long totalMs = LOG.stream().mapToLong(StreamEvent::msPlayed).sum();
        assertEquals(totalMs, stats.timeStats().totalMilliseconds());
        assertEquals(totalMs, stats.timeStats().totalHours() * 3_600_000, 1e-6);
        assertEquals(Instant.parse("2020-01-06T08:00:00Z"), stats.timeStats().earliestPlay());
        assertEquals(Instant.parse("2021-10-10T21:15:00Z"), stats.timeStats().latestPlay());
    }

    @Test
    void testContentAndBehavior() {
        LifetimeStats stats = generator.generate(LOG);
        assertEquals(4, stats.contentStats().totalPlays());
        assertEquals(2, stats.contentStats().uniqueArtists());
        assertEquals(3, stats.contentStats().uniqueTracks());
        assertEquals(25.0, stats.listeningBehavior().skipRatePercentage(), 1e-9);
        assertEquals(75.0, stats.listeningBehavior().completionRatePercentage(), 1e-9);
        assertEquals(1, stats.listeningBehavior().totalShufflePlays());
        assertEquals(0.5, stats.diversityMetrics().artistDiversityScore(), 1e-9);
        assertEquals(50.0, stats.diversityMetrics().top1ArtistConcentration(), 1e-9);
        assertEquals(100.0, stats.diversityMetrics().top5ArtistConcentration(), 1e-9);
    }

    @Test
    void testProviderAndPlatformStats() {
        LifetimeStats stats = generator.generate(LOG);
        assertEquals(75.0, stats.providerStats().spotifyPercentage(), 1e-9);
        assertEquals(25.0, stats.providerStats().appleMusicPercentage(), 1e-9);
        assertEquals(List.of(Provider.SPOTIFY, Provider.APPLE_MUSIC), stats.metadata().dataSources());
        assertEquals("iOS", stats.platformStats().topPlatform());
        assertEquals(2, stats.geographicalStats().countriesStreamedFrom());
        assertEquals("US", stats.geographicalStats().topCountries().get(0).name());
    }

    @Test
    void testTemporalPatterns() {
        LifetimeStats.TemporalPatterns t = generator.generate(LOG).temporalPatterns();
        assertEquals(2, t.yearlyBreakdown().get("2020").plays());
        assertEquals(1, t.monthlyBreakdown().get("2021-10").plays());
        assertEquals(2, t.hourlyBreakdown().get(8).plays());
        assertEquals(8, t.peakListeningHour());
        assertEquals("Monday", t.peakListeningDay());
        assertEquals("Summer", t.peakListeningSeason());
        assertFalse(t.seasonalBreakdown().containsKey("Spring"));
    }

    @Test
    void testMilestones() {
        LifetimeStats.Milestones m = generator.generate(LOG).milestones();
        assertEquals("Centuries", m.firstTrackPlayed().track());
        assertEquals("Hard Times", m.mostRecentTrack().track());
        assertEquals(240_000, m.longestTrackPlayed().msPlayed());
        assertEquals(4, m.daysWithListening());
    }

    @Test
    void testEmptyLogProducesZeroDocument() {
        LifetimeStats stats = generator.generate(List.of());
        assertEquals(TestEvents.NOW, stats.metadata().generatedAt());
        assertEquals(0, stats.metadata().totalRecords());
        assertEquals(0.0, stats.timeStats().totalHours());
        assertNull(stats.timeStats().earliestPlay());
        assertEquals(0, stats.contentStats().totalPlays());
        assertEquals(0.0, stats.diversityMetrics().artistDiversityScore());
        assertTrue(stats.topLists().topArtists().isEmpty());
        assertNull(stats.milestones().firstTrackPlayed());
        assertNull(stats.temporalPatterns().peakListeningHour());
        assertTrue(stats.temporalPatterns().seasonalBreakdown().isEmpty());
        assertEquals(0.0, stats.technicalStats().averageDailyTracks());
    }
}
