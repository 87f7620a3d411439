package com.streamhistory.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamhistory.insights.AnnualRecap;
import com.streamhistory.insights.ArtistSummary;
import com.streamhistory.insights.RankedItem;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class StreamingHistoryPipelineTest {
    @TempDir
    Path tempDir;

    private final StreamingHistoryPipeline pipeline =
        new StreamingHistoryPipeline(PipelineSettings.defaults(), TestEvents.FIXED_CLOCK);

    private static Map<String, Object> spotifyJson(String ts, String artist, String track, long ms, boolean skipped) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ts", ts);
        m.put("platform", "Android OS 12");
        m.put("ms_played", ms);
        m.put("conn_country", "US");
        m.put("master_metadata_track_name", track);
        m.put("master_metadata_album_artist_name", artist);
        m.put("master_metadata_album_album_name", artist + " Greatest Hits");
        m.put("reason_start", "clickrow");
        m.put("reason_end", skipped ? "fwdbtn" : "trackdone");
        m.put("shuffle", false);
        m.put("skipped", skipped);
        m.put("offline", false);
        m.put("incognito_mode", false);
        return m;
    }

    private static String[] appleRow(String artist, String track, String date, int hour, long ms) {
        return new String[]{"US", artist + " - " + track, Integer.toString(hour), date, "AUDIO", Long.toString(ms),
            "IPHONE", "NATURAL_END_OF_TRACK", "0"};
    }

    private Path writeSpotify(String name, List<Map<String, Object>> records) throws IOException {
        Path file = tempDir.resolve(name);
        new ObjectMapper().writeValue(file.toFile(), records);
        return file;
    }

    private Path writeApple(List<String[]> rows) throws IOException {
        return AppleMusicHistoryReaderTest.writeCsv(tempDir.resolve("apple.csv"), AppleMusicHistoryReaderTest.HEADER, rows);
    }

    private List<Map<String, Object>> spotifyPlays(String artist, int count, int startDay) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int day = startDay + i;
            String ts = String.format("2022-%02d-%02dT%02d:00:00Z", (day / 28) % 12 + 1, day % 28 + 1, i % 24);
            records.add(spotifyJson(ts, artist, artist + " Song " + (i % 7), 200_000, false));
        }
        return records;
    }

    @Test
    void testExactMatchMergesIntoSpotifyArtist() throws IOException {
        Path spotify = writeSpotify("spotify.json", spotifyPlays("Fall Out Boy", 50, 0));
        List<String[]> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) rows.add(appleRow("fall out boy", "Centuries", "202303" + String.format("%02d", i + 1), 12, 220_000));
        Path apple = writeApple(rows);

        PipelineResult result = pipeline.run(new PipelineInput(List.of(spotify), apple));
        ArtistSummary summary = result.artistSummary().get("Fall Out Boy");
        assertNotNull(summary);
        assertEquals(60, summary.totalStreams());
        assertFalse(result.artistSummary().containsKey("fall out boy"));
        assertEquals(1, result.mappingReport().exactCount());
        assertTrue(result.summary().appleMusicSupplied());
        assertEquals(10, result.summary().countsFor(Provider.APPLE_MUSIC).kept());
    }

    @Test
    void testFuzzyAndUnmatchedArtists() throws IOException {
        List<Map<String, Object>> records = new ArrayList<>(spotifyPlays("Foo Fighters", 30, 0));
        records.addAll(spotifyPlays("Fall Out Boy", 10, 40));
        Path spotify = writeSpotify("spotify.json", records);
        Path apple = writeApple(List.of(
            appleRow("Foo Fighter", "Everlong", "20230301", 9, 250_000),
            appleRow("Foo Fighter", "My Hero", "20230302", 9, 250_000),
            appleRow("XYZ Band", "Unknown Song", "20230303", 9, 180_000)));

        PipelineResult result = pipeline.run(new PipelineInput(List.of(spotify), apple));
        assertEquals(32, result.artistSummary().get("Foo Fighters").totalStreams());
        assertFalse(result.artistSummary().containsKey("Foo Fighter"));
        assertEquals(1, result.artistSummary().get("XYZ Band").totalStreams());
        assertEquals(1, result.mappingReport().fuzzyCount());
        assertEquals(1, result.mappingReport().unmatchedCount());
    }

    @Test
    void testSpotifyOnlyRunOfOneHundredEvents() throws IOException {
        List<Map<String, Object>> records = new ArrayList<>(spotifyPlays("Artist One", 60, 0));
        records.addAll(spotifyPlays("Artist Two", 40, 100));
        Path spotify = writeSpotify("spotify.json", records);

        PipelineResult result = pipeline.run(PipelineInput.spotifyOnly(List.of(spotify)));
        assertEquals(100, result.canonicalLog().size());
        assertFalse(result.summary().appleMusicSupplied());
        PipelineSummary.ProviderCounts apple = result.summary().countsFor(Provider.APPLE_MUSIC);
        assertEquals(0, apple.recordsRead());
        assertEquals(0, apple.kept());
        assertEquals(0, result.mappingReport().fuzzyCount());
        assertTrue(result.mappingReport().mappings().isEmpty());
        assertEquals(2, result.artistSummary().size());
    }

    @Test
    void testMissingAppleFileDegradesToSpotifyOnly() throws IOException {
        Path spotify = writeSpotify("spotify.json", spotifyPlays("Artist One", 3, 0));
        PipelineResult result = pipeline.run(new PipelineInput(List.of(spotify), tempDir.resolve("absent.csv")));
        assertFalse(result.summary().appleMusicSupplied());
        assertTrue(result.summary().appleMusicSkipReason().contains("absent.csv"));
        assertEquals(3, result.canonicalLog().size());
    }

    @Test
    void testAppleFileWithoutRequiredColumnsDegradesToSpotifyOnly() throws IOException {
        Path spotify = writeSpotify("spotify.json", spotifyPlays("Artist One", 3, 0));
        Path apple = tempDir.resolve("apple.csv");
        Files.writeString(apple, "Song,Duration\nfoo,1\n");

        PipelineResult result = pipeline.run(new PipelineInput(List.of(spotify), apple));
        assertFalse(result.summary().appleMusicSupplied());
        assertTrue(result.summary().appleMusicSkipReason().contains("lacks required columns"));
        assertEquals(3, result.canonicalLog().size());
        assertEquals(0, result.summary().countsFor(Provider.APPLE_MUSIC).recordsRead());
        assertTrue(result.mappingReport().mappings().isEmpty());
    }

    @Test
    void testSuppliedAppleFileHasNoSkipReason() throws IOException {
        Path spotify = writeSpotify("spotify.json", spotifyPlays("Artist One", 3, 0));
        Path apple = writeApple(List.of(
            appleRow("Artist One", "Early", "20211231", 0, 100_000),
            appleRow("Artist One", "Late", "20221231", 23, 100_000)));

        PipelineResult result = pipeline.run(new PipelineInput(List.of(spotify), apple));
        assertTrue(result.summary().appleMusicSupplied());
        assertNull(result.summary().appleMusicSkipReason());
    }

    @Test
    void testFilterAndConservationProperties() throws IOException {
        List<Map<String, Object>> records = new ArrayList<>(spotifyPlays("Keeper", 20, 0));
        records.add(spotifyJson("2022-05-05T05:00:00Z", "Skipper", "Too Short", 10_000, true));
        records.add(spotifyJson("2022-05-05T06:00:00Z", "Skipper", "Long Enough", 45_000, true));
        records.add(spotifyJson("2030-01-01T00:00:00Z", "Future", "Not Yet", 100_000, false));
        Path spotify = writeSpotify("spotify.json", records);

        PipelineResult result = pipeline.run(PipelineInput.spotifyOnly(List.of(spotify)));
        assertTrue(result.canonicalLog().stream().noneMatch(e -> e.skipped() && e.msPlayed() < 30_000));
        assertEquals(21, result.canonicalLog().size());
        assertEquals(1, result.summary().dropsByRule().get("short_skip"));
        assertEquals(1, result.summary().dropsByRule().get("out_of_range_timestamp"));

        long totalMs = result.canonicalLog().stream().mapToLong(StreamEvent::msPlayed).sum();
        assertEquals(totalMs, result.lifetimeStats().timeStats().totalHours() * 3_600_000, 1e-6);

        long annualPlays = 0;
        for (AnnualRecap recap : result.annualRecaps().values()) {
            annualPlays += recap.yearStats().totalPlays();
            long topArtistPlays = recap.topArtists().stream().mapToLong(RankedItem::plays).sum();
            assertTrue(topArtistPlays <= recap.yearStats().totalPlays());
        }
        assertEquals(result.lifetimeStats().contentStats().totalPlays(), annualPlays);
    }

    @Test
    void testCanonicalLogIsTimeOrdered() throws IOException {
        Path spotify = writeSpotify("spotify.json", spotifyPlays("Artist One", 30, 0));
        Path apple = writeApple(List.of(
            appleRow("Artist One", "Early", "20211231", 0, 100_000),
            appleRow("Artist One", "Late", "20221231", 23, 100_000)));
        List<StreamEvent> log = pipeline.run(new PipelineInput(List.of(spotify), apple)).canonicalLog();
        for (int i = 1; i < log.size(); i++) {
            assertFalse(log.get(i).timestamp().isBefore(log.get(i - 1).timestamp()));
        }
        assertEquals("Early", log.get(0).trackName());
        assertEquals("Late", log.get(log.size() - 1).trackName());
    }

    @Test
    void testMissingSpotifyInputIsFatal() {
        Path out = tempDir.resolve("out");
        MissingInputException ex = assertThrows(MissingInputException.class,
            () -> pipeline.run(PipelineInput.spotifyOnly(List.of(tempDir.resolve("missing.json")))));
        assertTrue(ex.getMessage().contains("missing.json"));
        assertFalse(Files.exists(out));
    }

    @Test
    void testMalformedRecordsAreCountedNotFatal() throws IOException {
        List<Map<String, Object>> records = new ArrayList<>(spotifyPlays("Artist One", 5, 0));
        Map<String, Object> broken = spotifyJson("not-a-date", "Artist One", "Broken", 100_000, false);
        records.add(broken);
        Path spotify = writeSpotify("spotify.json", records);

        PipelineResult result = pipeline.run(PipelineInput.spotifyOnly(List.of(spotify)));
        PipelineSummary.ProviderCounts counts = result.summary().countsFor(Provider.SPOTIFY);
        assertEquals(6, counts.recordsRead());
        assertEquals(1, counts.parseFailures());
        assertEquals(5, counts.kept());
        assertEquals(1, result.summary().failureSamples().size());
    }
}
