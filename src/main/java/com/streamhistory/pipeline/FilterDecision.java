package com.streamhistory.pipeline;

/**
 * Outcome of the {@link QualityFilter} for one event. Rules are checked in declaration order,
 * so an event is reported under the first rule it breaks.
 */
public enum FilterDecision {
    KEPT,
    NON_MUSIC,
    INCOGNITO,
    SHORT_SKIP,
    NO_PLAYTIME,
    OUT_OF_RANGE_TIMESTAMP;

    public boolean kept() {
        return this == KEPT;
    }
}
