package com.streamhistory.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Streaming service a play record originated from.
 * Spotify is the reference namespace for artist names.
 */
public enum Provider {
    SPOTIFY("Spotify"),
    APPLE_MUSIC("Apple Music");

    private final String displayName;

    Provider(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
