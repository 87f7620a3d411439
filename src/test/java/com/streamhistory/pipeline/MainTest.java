package com.streamhistory.pipeline;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class MainTest {
    @TempDir
    Path tempDir;

    @Test
    void testNoArgumentsIsAnError() {
        assertEquals(1, Main.run(new String[0]));
    }

    @Test
    void testMissingSpotifyFileExitsNonZeroWithoutOutput() {
        Path out = tempDir.resolve("out");
        int status = Main.run(new String[]{tempDir.resolve("missing.json").toString(), out.toString()});
        assertEquals(1, status);
        assertFalse(Files.exists(out));
    }

    private Path writeSpotify() throws IOException {
        Path spotify = tempDir.resolve("Streaming_History_Audio_2021.json");
        Files.writeString(spotify, "[{\"ts\":\"2021-06-01T08:00:00Z\",\"platform\":\"iOS 15\",\"ms_played\":200000,"
            + "\"master_metadata_track_name\":\"Everlong\",\"master_metadata_album_artist_name\":\"Foo Fighters\","
            + "\"reason_end\":\"trackdone\"}]");
        return spotify;
    }

    @Test
    void testEndToEndRun() throws IOException {
        Path spotify = writeSpotify();
        Path apple = tempDir.resolve("Apple Music Play Activity.csv");
        Files.writeString(apple, "Track Description,Media type,Play Duration Milliseconds,Date Played,Hours\n"
            + "Foo Fighter - My Hero,AUDIO,240000,20210602,9\n");
        Path out = tempDir.resolve("out");

        assertEquals(0, Main.run(new String[]{spotify.toString(), apple.toString(), out.toString()}));
        assertTrue(Files.exists(out.resolve(ArtifactWriter.ARTIST_SUMMARY)));
        String summary = Files.readString(out.resolve(ArtifactWriter.ARTIST_MAPPING));
        assertTrue(summary.contains("\"fuzzy\""));
    }

    @Test
    void testInvalidSettingExitsNonZeroWithoutOutput() throws IOException {
        Path spotify = writeSpotify();
        Path out = tempDir.resolve("out");
        System.setProperty("FUZZY_TOP_K", "abc");
        try {
            assertEquals(1, Main.run(new String[]{spotify.toString(), out.toString()}));
        } finally {
            System.clearProperty("FUZZY_TOP_K");
        }
        assertFalse(Files.exists(out));
    }

    @Test
    void testAppleExportWithOtherExtensionIsNotTakenAsOutputDirectory() throws IOException {
        Path spotify = writeSpotify();
        Path apple = tempDir.resolve("plays.txt");
        Files.writeString(apple, "Track Description,Media type,Play Duration Milliseconds,Date Played,Hours\n"
            + "Foo Fighter - My Hero,AUDIO,240000,20210602,9\n");
        Path out = tempDir.resolve("out");

        assertEquals(0, Main.run(new String[]{spotify.toString(), apple.toString(), out.toString()}));
        assertTrue(Files.isRegularFile(apple));
        String summary = Files.readString(out.resolve(ArtifactWriter.PIPELINE_SUMMARY));
        assertTrue(summary.contains("\"apple_music_supplied\" : true"));
    }

    @Test
    void testArgumentRoles() throws IOException {
        Path export = Files.writeString(tempDir.resolve("plays.txt"), "x");
        assertTrue(Main.looksLikeAppleMusicExport(export.toString(), 1, 2));
        assertTrue(Main.looksLikeAppleMusicExport("Apple Music Play Activity.csv", 1, 2));
        assertFalse(Main.looksLikeAppleMusicExport(tempDir.resolve("out").toString(), 1, 2));
        assertTrue(Main.looksLikeAppleMusicExport("anything", 1, 3));
        assertFalse(Main.looksLikeAppleMusicExport("out", 2, 3));
    }
}
