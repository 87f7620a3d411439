package com.streamhistory.pipeline;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

/**
 * Adapter for Apple Music "Play History Daily Tracks" rows.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Splits {@code Track Description} ("Artist - Track") on the first delimiter into artist and track.</li>
 *   <li>Builds a UTC timestamp from {@code Date Played} (YYYYMMDD) and the first entry of {@code Hours}.</li>
 *   <li>Maps media type, source type, country and end reason onto the Spotify-equivalent vocabulary.</li>
 *   <li>Album, incognito, offline and shuffle are not part of the export and are always empty/false.</li>
 * </ul>
 * <p>
 * Artist names produced here are Apple Music spellings; the {@link ArtistIdentityResolver} maps them
 * onto Spotify names afterwards.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class AppleMusicAdapter extends AbstractProviderAdapter<AppleMusicRawRecord> {
    public static final String TRACK_DELIMITER = " - ";

    private static final DateTimeFormatter DATE_PLAYED = DateTimeFormatter.BASIC_ISO_DATE;

    private static final Map<String, String> END_REASONS = Map.of(
        "NATURAL_END_OF_TRACK", StreamEvent.REASON_TRACK_DONE,
        "MANUALLY_SELECTED_PLAYBACK_OF_A_DIFF_ITEM", "fwdbtn",
        "PLAYBACK_MANUALLY_PAUSED", "endplay",
        "SCRUBBING_BEGIN", "fwdbtn",
        "SCRUBBING_END", "endplay"
    );

    public AppleMusicAdapter(int failureSampleSize) {
        super(failureSampleSize);
    }

    public AppleMusicAdapter() {
        this(PipelineSettings.DEFAULT_FAILURE_SAMPLE_SIZE);
    }

    @Override
    public Provider provider() {
        return Provider.APPLE_MUSIC;
    }

    @Override
    public StreamEvent adaptRecord(AppleMusicRawRecord record) throws RecordParseException {
        if (record == null) {
            throw new RecordParseException("Apple Music row", "Record is null");
        }
        String where = record.describe();
        for (RecordField required : RecordFieldRegistry.getAppleMusicRequiredFields()) {
            if (record.value(required) == null) {
                throw new RecordParseException(where, "Missing required column '" + required.aliases().get(0) + "'");
            }
        }

        String[] artistAndTrack = splitTrackDescription(record.value(RecordFieldRegistry.TRACK_DESCRIPTION));
        if (artistAndTrack == null) {
            throw new RecordParseException(where, "Track Description has no artist/track delimiter");
        }

        long msPlayed;
        String duration = record.value(RecordFieldRegistry.PLAY_DURATION_MS);
        try {
            msPlayed = Long.parseLong(duration);
        } catch (NumberFormatException e) {
            throw new RecordParseException(where, "Invalid play duration '" + duration + "'", e);
        }
        if (msPlayed < 0) throw new RecordParseException(where, "Negative play duration: " + msPlayed);

        final long played = msPlayed;
        Instant timestamp = toTimestamp(where, record.value(RecordFieldRegistry.DATE_PLAYED), record.value(RecordFieldRegistry.HOURS));

        return build(record, () -> new StreamEvent(
            timestamp,
            played,
            artistAndTrack[1],
            null,
            artistAndTrack[0],
            Provider.APPLE_MUSIC,
            PlatformNormalizer.fromAppleSourceType(record.value(RecordFieldRegistry.SOURCE_TYPE)),
            CountryCodes.toIsoCode(record.value(RecordFieldRegistry.COUNTRY)),
            parseSkipped(record.value(RecordFieldRegistry.SKIP_COUNT)),
            StreamEvent.REASON_UNKNOWN,
            mapEndReason(record.value(RecordFieldRegistry.END_REASON)),
            false,
            false,
            false,
            mapMediaType(record.value(RecordFieldRegistry.MEDIA_TYPE)),
            null
        ));
    }

    /**
     * Splits "Artist - Track" on the first delimiter.
     * @param description raw track description
     * @return {artist, track}, or null if the description cannot yield both parts
     */
    static String[] splitTrackDescription(String description) {
        if (description == null || description.isBlank()) return null;
        String d = description.trim();
        if (d.chars().allMatch(Character::isDigit)) return null;
        int idx = d.indexOf(TRACK_DELIMITER);
        if (idx < 0) return null;
        String artist = d.substring(0, idx).trim();
        String track = d.substring(idx + TRACK_DELIMITER.length()).trim();
        if (artist.isEmpty() || track.isEmpty()) return null;
        return new String[]{artist, track};
    }

    /**
     * Combines the play date and hour into a UTC instant. A bad hour falls back to midnight.
     */
    static Instant toTimestamp(String where, String datePlayed, String hours) throws RecordParseException {
        LocalDate date;
        try {
            date = LocalDate.parse(datePlayed.trim(), DATE_PLAYED);
        } catch (DateTimeParseException e) {
            throw new RecordParseException(where, "Invalid Date Played '" + datePlayed + "'", e);
        }
        int hour = 0;
        if (hours != null && !hours.isBlank()) {
            String first = hours.split(",")[0].trim();
            try {
                hour = Integer.parseInt(first);
                if (hour < 0 || hour > 23) hour = 0;
            } catch (NumberFormatException e) {
                hour = 0;
            }
        }
        try {
            return date.atTime(hour, 0).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new RecordParseException(where, "Invalid timestamp", e);
        }
    }

    static ContentType mapMediaType(String mediaType) {
        if (mediaType == null) return ContentType.UNKNOWN;
        return switch (mediaType.trim().toUpperCase(Locale.ROOT)) {
            case "AUDIO" -> ContentType.MUSIC;
            case "VIDEO" -> ContentType.VIDEO;
            default -> ContentType.UNKNOWN;
        };
    }

    static String mapEndReason(String endReason) {
        if (endReason == null) return StreamEvent.REASON_UNKNOWN;
        return END_REASONS.getOrDefault(endReason.trim().toUpperCase(Locale.ROOT), StreamEvent.REASON_UNKNOWN);
    }

    static boolean parseSkipped(String skipCount) {
        if (skipCount == null) return false;
        try {
            return Integer.parseInt(skipCount.trim()) > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
