package com.streamhistory.insights;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One entry of a top list.
 *
 * @param rank 1-based position
 * @param name artist, track or album name
 * @param artist owning artist for tracks and albums, absent for artist lists
 * @param plays number of plays
 * @param minutes total minutes played
 * @param firstPlayed earliest play, used to break ties on plays
 */
public record RankedItem(
    int rank,
    String name,
    @JsonInclude(JsonInclude.Include.NON_NULL) String artist,
    long plays,
    double minutes,
    Instant firstPlayed
) {}
