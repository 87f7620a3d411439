package com.streamhistory.pipeline;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

public class ConsolidatorTest {
    private final Consolidator consolidator = new Consolidator();

    @Test
    void testMergesInTimestampOrder() {
        List<StreamEvent> spotify = List.of(
            TestEvents.spotify("2021-01-01T10:00:00Z", "A", "S1", 60_000),
            TestEvents.spotify("2021-01-03T10:00:00Z", "A", "S2", 60_000));
        List<StreamEvent> apple = List.of(
            TestEvents.apple("2021-01-02T10:00:00Z", "B", "A1", 60_000),
            TestEvents.apple("2020-12-31T10:00:00Z", "B", "A0", 60_000));

        List<StreamEvent> log = consolidator.consolidate(spotify, apple);
        assertEquals(List.of("A0", "S1", "A1", "S2"), log.stream().map(StreamEvent::trackName).toList());
    }

    @Test
    void testTiesKeepSpotifyFirstThenInputOrder() {
        String ts = "2021-01-01T10:00:00Z";
        List<StreamEvent> spotify = List.of(TestEvents.spotify(ts, "A", "S1", 60_000), TestEvents.spotify(ts, "A", "S2", 60_000));
        List<StreamEvent> apple = List.of(TestEvents.apple(ts, "B", "A1", 60_000), TestEvents.apple(ts, "B", "A2", 60_000));

        List<StreamEvent> log = consolidator.consolidate(spotify, apple);
        assertEquals(List.of("S1", "S2", "A1", "A2"), log.stream().map(StreamEvent::trackName).toList());
        assertEquals(Provider.APPLE_MUSIC, log.get(3).provider());
    }

    @Test
    void testSpotifyOnlyMode() {
        List<StreamEvent> spotify = List.of(TestEvents.spotify("2021-01-01T10:00:00Z", "A", "S1", 60_000));
        assertEquals(spotify, consolidator.consolidate(spotify, null));
    }

    @Test
    void testResultIsImmutable() {
        List<StreamEvent> log = consolidator.consolidate(List.of(), List.of());
        assertThrows(UnsupportedOperationException.class, () -> log.add(null));
    }
}
