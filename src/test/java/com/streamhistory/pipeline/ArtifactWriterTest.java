package com.streamhistory.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

public class ArtifactWriterTest {
    @TempDir
    Path tempDir;

    private static PipelineResult sampleResult() {
        List<SpotifyRawRecord> spotify = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            spotify.add(TestEvents.spotifyRaw(String.format("2022-0%d-10T1%d:00:00Z", i % 9 + 1, i % 10),
                i % 2 == 0 ? "Fall Out Boy" : "Paramore", "Song " + i, 180_000L + i));
        }
        StreamingHistoryPipeline pipeline = new StreamingHistoryPipeline(PipelineSettings.defaults(), TestEvents.FIXED_CLOCK);
        return pipeline.process(RawBatch.of(spotify), null);
    }

    private static List<String> listNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().toList();
        }
    }

    @Test
    void testWritesEveryArtifact() throws IOException {
        Path out = tempDir.resolve("output");
        List<Path> written = new ArtifactWriter().write(sampleResult(), out);
        assertEquals(6, written.size());
        assertEquals(List.of(ArtifactWriter.ANNUAL_RECAPS, ArtifactWriter.ARTIST_MAPPING, ArtifactWriter.ARTIST_SUMMARY,
            ArtifactWriter.CONSOLIDATED_LOG, ArtifactWriter.LIFETIME_STATS, ArtifactWriter.PIPELINE_SUMMARY), listNames(out));

        ObjectMapper mapper = ArtifactWriter.createObjectMapper();
        JsonNode log = mapper.readTree(out.resolve(ArtifactWriter.CONSOLIDATED_LOG).toFile());
        assertEquals(12, log.size());
        assertEquals("2022-01-10T10:00:00Z", log.get(0).get("ts").asText());
        assertEquals("Spotify", log.get(0).get("provider").asText());
        assertEquals("music", log.get(0).get("content_type").asText().toLowerCase());

        JsonNode lifetime = mapper.readTree(out.resolve(ArtifactWriter.LIFETIME_STATS).toFile());
        assertEquals(12, lifetime.at("/content_stats/total_plays").asLong());
        assertEquals("2024-06-01T00:00:00Z", lifetime.at("/metadata/generated_at").asText());
        assertTrue(lifetime.at("/diversity_metrics/top_1_artist_concentration").isNumber());

        JsonNode summary = mapper.readTree(out.resolve(ArtifactWriter.PIPELINE_SUMMARY).toFile());
        assertFalse(summary.get("apple_music_supplied").asBoolean());
        assertEquals(12, summary.get("canonical_event_count").asInt());
    }

    @Test
    void testOutputIsIdempotent() throws IOException {
        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");
        new ArtifactWriter().write(sampleResult(), first);
        new ArtifactWriter().write(sampleResult(), second);
        for (String name : listNames(first)) {
            assertArrayEquals(Files.readAllBytes(first.resolve(name)), Files.readAllBytes(second.resolve(name)), name);
        }
    }

    @Test
    void testFailedRunLeavesPreviousOutputUntouched() throws IOException {
        Path out = tempDir.resolve("output");
        Files.createDirectories(out);
        Path previous = out.resolve(ArtifactWriter.CONSOLIDATED_LOG);
        Files.writeString(previous, "[]");

        ObjectMapper failing = new ObjectMapper() {
            @Override
            public void writeValue(File resultFile, Object value) throws IOException {
                if (resultFile.getName().equals(ArtifactWriter.ARTIST_SUMMARY)) {
                    throw new IOException("disk full");
                }
                super.writeValue(resultFile, value);
            }
        };
        failing.registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

        assertThrows(IOException.class, () -> new ArtifactWriter(failing).write(sampleResult(), out));
        assertEquals("[]", Files.readString(previous));
        assertEquals(List.of(ArtifactWriter.CONSOLIDATED_LOG), listNames(out));
    }
}
