package com.streamhistory.insights;

import com.streamhistory.pipeline.StreamEvent;
import com.streamhistory.pipeline.TestEvents;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ArtistSummaryGeneratorTest {
    private final ArtistSummaryGenerator generator = new ArtistSummaryGenerator(20);

    @Test
    void testSummarizesArtistAcrossYearsAndProviders() {
        List<StreamEvent> log = List.of(
            TestEvents.spotify("2020-05-01T10:00:00Z", "Paramore", "Misery Business", 200_000),
            TestEvents.spotify("2021-05-01T10:00:00Z", "Paramore", "Misery Business", 200_000),
            TestEvents.apple("2021-05-01T18:00:00Z", "Paramore", "Still Into You", 100_000),
            TestEvents.skipped("2021-06-01T10:00:00Z", "Paramore", "Hard Times", 40_000));

        ArtistSummary s = generator.generate(log).get("Paramore");
        assertEquals(4, s.totalStreams());
        assertEquals(540_000, s.totalMsPlayed());
        assertEquals(2, s.yearsActive());
        assertEquals(3, s.daysActive());
        assertEquals(Instant.parse("2020-05-01T10:00:00Z"), s.firstPlayed());
        assertEquals(Instant.parse("2021-06-01T10:00:00Z"), s.lastPlayed());
        assertEquals("2021", s.peakYear());
        assertEquals(3, s.peakYearStreams());
        assertEquals(25.0, s.skipRatePercentage(), 1e-9);
        assertEquals(75.0, s.completionRatePercentage(), 1e-9);
        assertEquals(25.0, s.offlinePercentage(), 1e-9);
        assertEquals("Misery Business", s.topTracks().get(0).name());
        assertEquals(2, s.topTracks().get(0).plays());
        assertEquals(List.of("2020", "2021"), new ArrayList<>(s.yearlyBreakdown().keySet()));
        assertEquals(3, s.yearlyBreakdown().get("2021").totalPlays());
        assertEquals("iOS", s.topPlatform());
        assertEquals("Spotify", s.topProvider());
        assertEquals(2, s.countriesStreamedFrom());
    }

    @Test
    void testOrderedByStreamsThenFirstPlay() {
        List<StreamEvent> log = List.of(
            TestEvents.spotify("2021-01-01T10:00:00Z", "Late Starter", "x", 60_000),
            TestEvents.spotify("2020-01-01T10:00:00Z", "Early Starter", "y", 60_000),
            TestEvents.spotify("2021-02-01T10:00:00Z", "Most Played", "z", 60_000),
            TestEvents.spotify("2021-02-02T10:00:00Z", "Most Played", "z", 60_000));
        Map<String, ArtistSummary> summary = generator.generate(log);
        assertEquals(List.of("Most Played", "Early Starter", "Late Starter"), new ArrayList<>(summary.keySet()));
    }

    @Test
    void testTopTracksAreCapped() {
        List<StreamEvent> log = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            log.add(TestEvents.spotify(String.format("2021-01-%02dT10:00:00Z", i + 1), "Prolific", "Track " + i, 60_000));
        }
        assertEquals(20, generator.generate(log).get("Prolific").topTracks().size());
    }

    @Test
    void testEmptyLog() {
        assertTrue(generator.generate(List.of()).isEmpty());
    }
}
