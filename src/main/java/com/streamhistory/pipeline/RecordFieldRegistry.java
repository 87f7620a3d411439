package com.streamhistory.pipeline;

import java.util.List;

/**
 * Central registry of the Apple Music export columns the pipeline reads.
 * Add new header aliases here and every consumer picks them up.
 */
public final class RecordFieldRegistry {
    private RecordFieldRegistry() {}

    public static final RecordField TRACK_DESCRIPTION = new RecordField("trackDescription",
        List.of("Track Description", "Track description"));
    public static final RecordField MEDIA_TYPE = new RecordField("mediaType",
        List.of("Media type", "Media Type"));
    public static final RecordField PLAY_DURATION_MS = new RecordField("playDurationMs",
        List.of("Play Duration Milliseconds", "Play duration milliseconds", "Play Duration (ms)"));
    public static final RecordField DATE_PLAYED = new RecordField("datePlayed",
        List.of("Date Played", "Date played"));
    public static final RecordField HOURS = new RecordField("hours",
        List.of("Hours", "Hour"));
    public static final RecordField SOURCE_TYPE = new RecordField("sourceType",
        List.of("Source Type", "Source type"));
    public static final RecordField COUNTRY = new RecordField("country",
        List.of("Country", "Country Code"));
    public static final RecordField END_REASON = new RecordField("endReason",
        List.of("End Reason Type", "End reason type"));
    public static final RecordField SKIP_COUNT = new RecordField("skipCount",
        List.of("Skip Count", "Skip count"));

    /**
     * Fields a row must carry for the Apple Music adapter to accept it.
     */
    private static final List<RecordField> APPLE_MUSIC_REQUIRED = List.of(
        TRACK_DESCRIPTION, PLAY_DURATION_MS, DATE_PLAYED
    );

    /**
     * Returns the Apple Music fields every row must carry.
     */
    public static List<RecordField> getAppleMusicRequiredFields() {
        return APPLE_MUSIC_REQUIRED;
    }
}
