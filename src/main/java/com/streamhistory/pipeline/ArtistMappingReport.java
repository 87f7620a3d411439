package com.streamhistory.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Diagnostic summary of one identity-resolution pass, written as {@code artist_mapping_summary.json}.
 * Independent of the event stream; exists for observability only.
 */
@JsonPropertyOrder({"apple_music_supplied", "spotify_artists", "apple_music_artists", "exact_count", "fuzzy_count",
    "unmatched_count", "fuzzy_top_k", "similarity_threshold", "fuzzy_candidates_scored", "unmatched_high_volume", "mappings"})
public record ArtistMappingReport(
    @JsonProperty("apple_music_supplied") boolean appleMusicSupplied,
    @JsonProperty("spotify_artists") int spotifyArtists,
    @JsonProperty("apple_music_artists") int appleMusicArtists,
    @JsonProperty("exact_count") int exactCount,
    @JsonProperty("fuzzy_count") int fuzzyCount,
    @JsonProperty("unmatched_count") int unmatchedCount,
    @JsonProperty("fuzzy_top_k") int fuzzyTopK,
    @JsonProperty("similarity_threshold") double similarityThreshold,
    @JsonProperty("fuzzy_candidates_scored") int fuzzyCandidatesScored,
    @JsonProperty("unmatched_high_volume") List<String> unmatchedHighVolume,
    @JsonProperty("mappings") List<ArtistMapping> mappings
) {
    public ArtistMappingReport {
        unmatchedHighVolume = List.copyOf(unmatchedHighVolume);
        mappings = List.copyOf(mappings);
    }
}
