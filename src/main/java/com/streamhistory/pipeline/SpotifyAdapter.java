package com.streamhistory.pipeline;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Adapter for Spotify extended streaming history records.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Classifies the record as podcast, audiobook, or music from its metadata markers.</li>
 *   <li>Requires a track name, an artist (or show / audiobook title) and a play duration; anything missing is a parse failure.</li>
 *   <li>Parses {@code ts} into a UTC instant and normalizes the platform string to its OS family.</li>
 *   <li>Passes the remaining fields through; Spotify names are the reference namespace, so no artist resolution happens here.</li>
 * </ul>
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class SpotifyAdapter extends AbstractProviderAdapter<SpotifyRawRecord> {

    public SpotifyAdapter(int failureSampleSize) {
        super(failureSampleSize);
    }

    public SpotifyAdapter() {
        this(PipelineSettings.DEFAULT_FAILURE_SAMPLE_SIZE);
    }

    @Override
    public Provider provider() {
        return Provider.SPOTIFY;
    }

    @Override
    public StreamEvent adaptRecord(SpotifyRawRecord record) throws RecordParseException {
        if (record == null) {
            throw new RecordParseException("Spotify record", "Record is null");
        }
        String where = record.describe();

        ContentType contentType;
        String track;
        String artist;
        if (record.hasEpisodeMarkers()) {
            contentType = ContentType.PODCAST;
            track = Utils.trimToNull(record.episodeName());
            artist = Utils.trimToNull(record.episodeShowName());
        } else if (record.hasAudiobookMarkers()) {
            contentType = ContentType.AUDIOBOOK;
            track = Utils.trimToNull(record.audiobookChapterTitle() != null ? record.audiobookChapterTitle() : record.audiobookTitle());
            artist = Utils.trimToNull(record.audiobookTitle());
        } else {
            contentType = ContentType.MUSIC;
            track = Utils.trimToNull(record.trackName());
            artist = Utils.trimToNull(record.artistName());
        }
        if (track == null) throw new RecordParseException(where, "Missing track name");
        if (artist == null) throw new RecordParseException(where, "Missing artist name");
        if (record.msPlayed() == null) throw new RecordParseException(where, "Missing ms_played");
        if (record.msPlayed() < 0) throw new RecordParseException(where, "Negative ms_played: " + record.msPlayed());

        Instant parsed;
        try {
            parsed = Utils.parseTimestamp(record.ts());
        } catch (DateTimeParseException e) {
            throw new RecordParseException(where, "Unparseable timestamp '" + record.ts() + "'", e);
        }

        final Instant timestamp = parsed;
        final String trackName = track;
        final String artistName = artist;
        return build(record, () -> new StreamEvent(
            timestamp,
            record.msPlayed(),
            trackName,
            Utils.trimToNull(record.albumName()),
            artistName,
            Provider.SPOTIFY,
            PlatformNormalizer.normalize(record.platform()),
            CountryCodes.toIsoCode(record.connCountry()),
            Boolean.TRUE.equals(record.skipped()),
            record.reasonStart(),
            record.reasonEnd(),
            Boolean.TRUE.equals(record.shuffle()),
            Boolean.TRUE.equals(record.offline()),
            Boolean.TRUE.equals(record.incognitoMode()),
            contentType,
            Utils.trimToNull(record.trackUri())
        ));
    }
}
