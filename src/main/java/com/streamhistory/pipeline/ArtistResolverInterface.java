package com.streamhistory.pipeline;

import java.util.List;

/**
 * Interface for reconciling Apple Music artist names with the Spotify namespace.
 */
public interface ArtistResolverInterface {
    /**
     * Builds the Apple Music to Spotify artist mapping for one run and rewrites the Apple Music events.
     * @param spotifyEvents filtered Spotify events (the reference namespace)
     * @param appleMusicEvents filtered Apple Music events, possibly empty
     * @param appleMusicSupplied whether Apple Music input was given at all
     * @return rewritten events, the mapping table and its diagnostic report
     */
    ArtistIdentityResolver.Resolution resolve(List<StreamEvent> spotifyEvents, List<StreamEvent> appleMusicEvents,
                                              boolean appleMusicSupplied);
}
