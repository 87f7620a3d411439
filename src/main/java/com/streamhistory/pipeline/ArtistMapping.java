package com.streamhistory.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resolution of one distinct Apple Music artist name.
 *
 * @param appleMusicName literal Apple Music spelling
 * @param resolvedName Spotify canonical name, or the literal spelling when unmatched
 * @param confidence 1.0 for exact, the similarity score for fuzzy, best score seen (or 0) for unmatched
 * @param method exact, fuzzy or unmatched
 * @param plays number of Apple Music plays under this spelling
 * @param msPlayed total Apple Music play time under this spelling
 */
public record ArtistMapping(
    @JsonProperty("apple_music_name") String appleMusicName,
    @JsonProperty("resolved_spotify_name") String resolvedName,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("method") MatchMethod method,
    @JsonProperty("plays") long plays,
    @JsonProperty("ms_played") long msPlayed
) {}
