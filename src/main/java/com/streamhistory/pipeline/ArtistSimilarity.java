package com.streamhistory.pipeline;

/**
 * Pluggable similarity score between two artist names, in {@code [0, 1]}.
 * Implementations must be symmetric and stateless.
 */
@FunctionalInterface
public interface ArtistSimilarity {
    /**
     * @param a first name
     * @param b second name
     * @return 1.0 for identical names, 0.0 for nothing in common
     */
    double score(String a, String b);
}
