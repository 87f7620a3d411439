package com.streamhistory.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One element of a Spotify extended streaming history export.
 * All fields are nullable; structural validation happens in {@link SpotifyAdapter}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyRawRecord(
    @JsonProperty("ts") String ts,
    @JsonProperty("platform") String platform,
    @JsonProperty("ms_played") Long msPlayed,
    @JsonProperty("conn_country") String connCountry,
    @JsonProperty("master_metadata_track_name") String trackName,
    @JsonProperty("master_metadata_album_artist_name") String artistName,
    @JsonProperty("master_metadata_album_album_name") String albumName,
    @JsonProperty("spotify_track_uri") String trackUri,
    @JsonProperty("episode_name") String episodeName,
    @JsonProperty("episode_show_name") String episodeShowName,
    @JsonProperty("spotify_episode_uri") String episodeUri,
    @JsonProperty("audiobook_title") String audiobookTitle,
    @JsonProperty("audiobook_uri") String audiobookUri,
    @JsonProperty("audiobook_chapter_title") String audiobookChapterTitle,
    @JsonProperty("reason_start") String reasonStart,
    @JsonProperty("reason_end") String reasonEnd,
    @JsonProperty("shuffle") Boolean shuffle,
    @JsonProperty("skipped") Boolean skipped,
    @JsonProperty("offline") Boolean offline,
    @JsonProperty("incognito_mode") Boolean incognitoMode
) implements RawPlayRecord {

    @Override
    public Provider provider() {
        return Provider.SPOTIFY;
    }

    @Override
    public String describe() {
        return "Spotify record at " + ts + " (" + (trackName != null ? trackName : episodeName) + ")";
    }

    /**
     * @return true if any podcast episode marker is present
     */
    public boolean hasEpisodeMarkers() {
        return episodeName != null || episodeUri != null;
    }

    /**
     * @return true if any audiobook marker is present
     */
    public boolean hasAudiobookMarkers() {
        return audiobookTitle != null || audiobookUri != null;
    }
}
