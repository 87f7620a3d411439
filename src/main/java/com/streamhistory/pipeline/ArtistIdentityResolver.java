package com.streamhistory.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Maps Apple Music artist spellings onto Spotify canonical artist names.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Indexes every distinct Spotify artist by its normalized key (case and whitespace insensitive).
 *       When several spellings share a key, the most played one is the canonical target.</li>
 *   <li>Ranks distinct Apple Music names by play count, then play time, then name.</li>
 *   <li>Exact pass: a name whose key is in the Spotify index maps with {@code method = exact}.</li>
 *   <li>Fuzzy pass: only the first {@code fuzzyTopK} names without an exact hit are scored against every
 *       Spotify name, both as written and with any "feat." credit removed. The best score is accepted only
 *       if it is strictly above the threshold.</li>
 *   <li>Everything else is {@code unmatched} and keeps its literal Apple Music spelling.</li>
 * </ul>
 * <p>
 * Only Apple Music names are ever rewritten, so two distinct Spotify artists are never merged.
 * Resolution never fails: an ambiguous name is passed through unchanged.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class ArtistIdentityResolver implements ArtistResolverInterface {
    private static final Logger logger = LoggerFactory.getLogger(ArtistIdentityResolver.class);

    // "Artist feat. X", "Artist (ft. X)", "Artist [featuring X]"
    private static final Pattern FEATURE_CREDIT = Pattern.compile(
        "\\s*[(\\[]?\\s*\\b(feat\\.?|featuring|ft\\.)\\s+.*$", Pattern.CASE_INSENSITIVE);

    private final ArtistSimilarity similarity;
    private final double similarityThreshold;
    private final int fuzzyTopK;

    /**
     * Result of one resolution pass.
     */
    public static class Resolution {
        public final List<StreamEvent> appleMusicEvents;
        public final Map<String, ArtistMapping> mappings;
        public final ArtistMappingReport report;

        public Resolution(List<StreamEvent> appleMusicEvents, Map<String, ArtistMapping> mappings, ArtistMappingReport report) {
            this.appleMusicEvents = List.copyOf(appleMusicEvents);
            this.mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
            this.report = report;
        }
    }

    public ArtistIdentityResolver(ArtistSimilarity similarity, double similarityThreshold, int fuzzyTopK) {
        if (similarity == null) {
            throw new IllegalArgumentException("Similarity function cannot be null");
        }
        this.similarity = similarity;
        this.similarityThreshold = similarityThreshold;
        this.fuzzyTopK = Math.max(0, fuzzyTopK);
    }

    public ArtistIdentityResolver(PipelineSettings settings) {
        this(new SequenceMatcherSimilarity(), settings.similarityThreshold(), settings.fuzzyTopK());
    }

    @Override
    public Resolution resolve(List<StreamEvent> spotifyEvents, List<StreamEvent> appleMusicEvents, boolean appleMusicSupplied) {
        if (spotifyEvents == null || appleMusicEvents == null) {
            throw new IllegalArgumentException("Event lists cannot be null");
        }
        Map<String, String> spotifyIndex = indexSpotifyArtists(spotifyEvents);
        List<String> spotifyNames = new ArrayList<>(new TreeSet<>(spotifyIndex.values()));
        List<ArtistVolume> ranked = rankAppleMusicArtists(appleMusicEvents);

        Map<String, ArtistMapping> mappings = new LinkedHashMap<>();
        List<ArtistVolume> fuzzyCandidates = new ArrayList<>();
        for (ArtistVolume artist : ranked) {
            String target = spotifyIndex.get(Utils.normalizeKey(artist.name));
            if (target != null) {
                mappings.put(artist.name, new ArtistMapping(artist.name, target, 1.0, MatchMethod.EXACT, artist.plays, artist.msPlayed));
            } else if (fuzzyCandidates.size() < fuzzyTopK) {
                fuzzyCandidates.add(artist);
            } else {
                mappings.put(artist.name, new ArtistMapping(artist.name, artist.name, 0.0, MatchMethod.UNMATCHED, artist.plays, artist.msPlayed));
            }
        }

        List<String> unmatchedHighVolume = new ArrayList<>();
        for (ArtistVolume artist : fuzzyCandidates) {
            ArtistMapping mapping = fuzzyMatch(artist, spotifyNames);
            mappings.put(artist.name, mapping);
            if (mapping.method() == MatchMethod.UNMATCHED) {
                unmatchedHighVolume.add(artist.name);
            } else {
                logger.debug("Fuzzy matched '{}' -> '{}' ({})", artist.name, mapping.resolvedName(), mapping.confidence());
            }
        }

        // Rank order for the report
        List<ArtistMapping> ordered = new ArrayList<>(ranked.size());
        Map<String, ArtistMapping> orderedMap = new LinkedHashMap<>();
        for (ArtistVolume artist : ranked) {
            ArtistMapping m = mappings.get(artist.name);
            ordered.add(m);
            orderedMap.put(artist.name, m);
        }

        List<StreamEvent> rewritten = new ArrayList<>(appleMusicEvents.size());
        for (StreamEvent e : appleMusicEvents) {
            ArtistMapping m = orderedMap.get(e.artistName());
            rewritten.add(m == null ? e : e.withArtistName(m.resolvedName()));
        }

        int exact = 0, fuzzy = 0, unmatched = 0;
        for (ArtistMapping m : ordered) {
            switch (m.method()) {
                case EXACT -> exact++;
                case FUZZY -> fuzzy++;
                case UNMATCHED -> unmatched++;
            }
        }
        ArtistMappingReport report = new ArtistMappingReport(appleMusicSupplied, spotifyNames.size(), ordered.size(),
            exact, fuzzy, unmatched, fuzzyTopK, similarityThreshold, fuzzyCandidates.size(), unmatchedHighVolume, ordered);

        if (!appleMusicSupplied) {
            logger.warn("No Apple Music input supplied; identity resolution skipped (Spotify-only mode)");
        } else {
            logger.info("Artist resolution: {} Apple Music artists, {} exact, {} fuzzy, {} unmatched",
                ordered.size(), exact, fuzzy, unmatched);
        }
        if (!unmatchedHighVolume.isEmpty()) {
            logger.warn("{} high-volume Apple Music artists had no confident Spotify match: {}",
                unmatchedHighVolume.size(), unmatchedHighVolume);
        }
        return new Resolution(rewritten, orderedMap, report);
    }

    /**
     * Scores one Apple Music name against every Spotify name.
     * Ties on score keep the alphabetically first Spotify name.
     */
    ArtistMapping fuzzyMatch(ArtistVolume artist, List<String> spotifyNames) {
        String primary = stripFeatureCredit(artist.name);
        String best = null;
        double bestScore = 0.0;
        for (String candidate : spotifyNames) {
            double score = similarity.score(artist.name, candidate);
            if (!primary.equals(artist.name)) {
                score = Math.max(score, similarity.score(primary, candidate));
            }
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        if (best != null && bestScore > similarityThreshold) {
            return new ArtistMapping(artist.name, best, bestScore, MatchMethod.FUZZY, artist.plays, artist.msPlayed);
        }
        return new ArtistMapping(artist.name, artist.name, bestScore, MatchMethod.UNMATCHED, artist.plays, artist.msPlayed);
    }

    /**
     * Removes a trailing featured-artist credit.
     * @param artist artist name
     * @return primary artist, or the input unchanged when no credit is present
     */
    static String stripFeatureCredit(String artist) {
        if (artist == null) return "";
        String stripped = FEATURE_CREDIT.matcher(artist).replaceAll("").trim();
        return stripped.isEmpty() ? artist : stripped;
    }

    /**
     * Normalized key to canonical Spotify spelling; the most played spelling wins a shared key.
     */
    static Map<String, String> indexSpotifyArtists(List<StreamEvent> spotifyEvents) {
        Map<String, Long> playsByName = new HashMap<>();
        for (StreamEvent e : spotifyEvents) {
            playsByName.merge(e.artistName(), 1L, Long::sum);
        }
        Map<String, String> index = new HashMap<>();
        for (Map.Entry<String, Long> entry : playsByName.entrySet()) {
            String key = Utils.normalizeKey(entry.getKey());
            String current = index.get(key);
            if (current == null) {
                index.put(key, entry.getKey());
                continue;
            }
            long currentPlays = playsByName.get(current);
            long candidatePlays = entry.getValue();
            if (candidatePlays > currentPlays || (candidatePlays == currentPlays && entry.getKey().compareTo(current) < 0)) {
                index.put(key, entry.getKey());
            }
        }
        return index;
    }

    /**
     * Distinct Apple Music names ordered by play count, then play time, then name.
     */
    static List<ArtistVolume> rankAppleMusicArtists(List<StreamEvent> appleMusicEvents) {
        Map<String, ArtistVolume> volumes = new HashMap<>();
        for (StreamEvent e : appleMusicEvents) {
            volumes.computeIfAbsent(e.artistName(), ArtistVolume::new).add(e.msPlayed());
        }
        List<ArtistVolume> ranked = new ArrayList<>(volumes.values());
        ranked.sort(Comparator.comparingLong((ArtistVolume v) -> v.plays).reversed()
            .thenComparing(Comparator.comparingLong((ArtistVolume v) -> v.msPlayed).reversed())
            .thenComparing(v -> v.name));
        return ranked;
    }

    /**
     * Play volume of one Apple Music spelling.
     */
    static final class ArtistVolume {
        final String name;
        long plays;
        long msPlayed;

        ArtistVolume(String name) {
            this.name = name;
        }

        void add(long ms) {
            plays++;
            msPlayed += ms;
        }
    }
}
