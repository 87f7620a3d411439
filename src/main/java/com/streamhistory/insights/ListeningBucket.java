package com.streamhistory.insights;

import com.streamhistory.pipeline.Utils;

/**
 * Plays and play time that fell into one time bucket (a year, month, hour, weekday or season).
 */
public record ListeningBucket(long plays, long msPlayed, double minutes, double hours) {

    static ListeningBucket of(long plays, long msPlayed) {
        return new ListeningBucket(plays, msPlayed, Utils.msToMinutes(msPlayed), Utils.msToHours(msPlayed));
    }
}
