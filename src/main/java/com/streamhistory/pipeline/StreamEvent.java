package com.streamhistory.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record representing one play in the canonical event log.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>Created once per raw record by a provider adapter ({@link SpotifyAdapter}, {@link AppleMusicAdapter}).</li>
 *   <li>Possibly dropped by the {@link QualityFilter}.</li>
 *   <li>Apple Music events may have {@code artistName} rewritten by the {@link ArtistIdentityResolver}.</li>
 *   <li>Owned by the consolidated log afterwards; never mutated.</li>
 * </ul>
 * <p>
 * Invariants enforced at construction: {@code msPlayed >= 0}, {@code timestamp} and
 * {@code provider} present, {@code artistName} and {@code trackName} not blank.
 *
 * @author Streaming History Team
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record StreamEvent(
    @JsonProperty("ts") Instant timestamp,
    @JsonProperty("ms_played") long msPlayed,
    @JsonProperty("track_name") String trackName,
    @JsonProperty("album_name") String albumName,
    @JsonProperty("artist_name") String artistName,
    @JsonProperty("provider") Provider provider,
    @JsonProperty("platform") String platform,
    @JsonProperty("country") String country,
    @JsonProperty("skipped") boolean skipped,
    @JsonProperty("reason_start") String reasonStart,
    @JsonProperty("reason_end") String reasonEnd,
    @JsonProperty("shuffle") boolean shuffle,
    @JsonProperty("offline") boolean offline,
    @JsonProperty("incognito") boolean incognito,
    @JsonProperty("content_type") ContentType contentType,
    @JsonProperty("track_uri") String trackUri
) {
    public static final String REASON_TRACK_DONE = "trackdone";
    public static final String REASON_UNKNOWN = "unknown";

    public StreamEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(provider, "provider");
        if (msPlayed < 0) {
            throw new IllegalArgumentException("ms_played must be non-negative: " + msPlayed);
        }
        if (artistName == null || artistName.isBlank()) {
            throw new IllegalArgumentException("artist_name cannot be null or blank");
        }
        if (trackName == null || trackName.isBlank()) {
            throw new IllegalArgumentException("track_name cannot be null or blank");
        }
        if (platform == null || platform.isBlank()) platform = PlatformNormalizer.UNKNOWN;
        if (reasonStart == null || reasonStart.isBlank()) reasonStart = REASON_UNKNOWN;
        if (reasonEnd == null || reasonEnd.isBlank()) reasonEnd = REASON_UNKNOWN;
        if (contentType == null) contentType = ContentType.UNKNOWN;
    }

    /**
     * Returns a copy carrying a different artist name. Used only by identity resolution.
     * @param resolvedArtist canonical artist name
     * @return this event if the name is unchanged, otherwise a new event
     */
    public StreamEvent withArtistName(String resolvedArtist) {
        if (artistName.equals(resolvedArtist)) return this;
        return new StreamEvent(timestamp, msPlayed, trackName, albumName, resolvedArtist, provider, platform,
            country, skipped, reasonStart, reasonEnd, shuffle, offline, incognito, contentType, trackUri);
    }

    /**
     * @return true if playback ended because the track finished
     */
    public boolean completed() {
        return REASON_TRACK_DONE.equals(reasonEnd);
    }
}
