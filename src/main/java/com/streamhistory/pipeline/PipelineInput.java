package com.streamhistory.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Locations of the raw exports for one run.
 *
 * @param spotifyFiles Spotify extended streaming history JSON files, required
 * @param appleMusicFile Apple Music play history CSV, or null for a Spotify-only run
 */
public record PipelineInput(List<Path> spotifyFiles, Path appleMusicFile) {

    public PipelineInput {
        spotifyFiles = spotifyFiles == null ? List.of() : List.copyOf(spotifyFiles);
    }

    public static PipelineInput spotifyOnly(List<Path> spotifyFiles) {
        return new PipelineInput(spotifyFiles, null);
    }
}
