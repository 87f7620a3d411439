package com.streamhistory.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How an Apple Music artist name was mapped onto the Spotify namespace.
 */
public enum MatchMethod {
    EXACT,
    FUZZY,
    UNMATCHED;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
