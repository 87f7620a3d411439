package com.streamhistory.pipeline;

/**
 * Kind of media a play record refers to, as far as the provider's metadata reveals it.
 * Only {@link #MUSIC} survives the {@link QualityFilter}.
 */
public enum ContentType {
    MUSIC,
    PODCAST,
    VIDEO,
    AUDIOBOOK,
    UNKNOWN
}
