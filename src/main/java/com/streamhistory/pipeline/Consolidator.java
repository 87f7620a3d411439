package com.streamhistory.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges the filtered, identity-resolved provider streams into one canonical, time-ascending log.
 * <p>
 * The sort is stable over the concatenation Spotify-then-Apple-Music, so equal timestamps keep
 * Spotify events first and each provider's own input order. Missing Apple Music input is a
 * supported Spotify-only mode.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class Consolidator {
    private static final Logger logger = LoggerFactory.getLogger(Consolidator.class);

    /**
     * @param spotifyEvents filtered Spotify events
     * @param appleMusicEvents filtered and resolved Apple Music events, or null when not supplied
     * @return immutable canonical event log
     */
    public List<StreamEvent> consolidate(List<StreamEvent> spotifyEvents, List<StreamEvent> appleMusicEvents) {
        if (spotifyEvents == null) {
            throw new IllegalArgumentException("Spotify event list cannot be null");
        }
        List<StreamEvent> apple = appleMusicEvents == null ? List.of() : appleMusicEvents;
        List<StreamEvent> merged = new ArrayList<>(spotifyEvents.size() + apple.size());
        merged.addAll(spotifyEvents);
        merged.addAll(apple);
        merged.sort(Comparator.comparing(StreamEvent::timestamp));
        if (appleMusicEvents == null || appleMusicEvents.isEmpty()) {
            logger.info("Consolidated {} events (Spotify only)", merged.size());
        } else {
            logger.info("Consolidated {} events ({} Spotify, {} Apple Music)", merged.size(), spotifyEvents.size(), apple.size());
        }
        return List.copyOf(merged);
    }
}
