package com.streamhistory.insights;

import java.util.List;

/**
 * Recap of one calendar year: the year's statistics plus ranked top lists.
 */
public record AnnualRecap(
    int year,
    YearStats yearStats,
    List<RankedItem> topArtists,
    List<RankedItem> topTracks,
    List<RankedItem> topAlbums
) {
    public AnnualRecap {
        topArtists = List.copyOf(topArtists);
        topTracks = List.copyOf(topTracks);
        topAlbums = List.copyOf(topAlbums);
    }
}
