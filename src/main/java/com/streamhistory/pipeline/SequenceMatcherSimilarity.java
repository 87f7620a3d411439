package com.streamhistory.pipeline;

import java.util.Locale;

/**
 * Character-sequence similarity ratio (Ratcliff/Obershelp "gestalt" matching).
 * <p>
 * Finds the longest common block, recurses on the unmatched text on either side, and
 * returns {@code 2 * matched / (len(a) + len(b))}. Comparison is case-insensitive.
 * For example {@code "Foo Fighter"} vs {@code "Foo Fighters"} scores 22/23.
 */
public class SequenceMatcherSimilarity implements ArtistSimilarity {

    @Override
    public double score(String a, String b) {
        if (a == null || b == null) return 0.0;
        String x = a.toLowerCase(Locale.ROOT);
        String y = b.toLowerCase(Locale.ROOT);
        int total = x.length() + y.length();
        if (total == 0) return 1.0;
        return 2.0 * matchingCharacters(x, 0, x.length(), y, 0, y.length()) / total;
    }

    private int matchingCharacters(String x, int xLo, int xHi, String y, int yLo, int yHi) {
        if (xLo >= xHi || yLo >= yHi) return 0;
        int[] block = longestMatch(x, xLo, xHi, y, yLo, yHi);
        int size = block[2];
        if (size == 0) return 0;
        return size
            + matchingCharacters(x, xLo, block[0], y, yLo, block[1])
            + matchingCharacters(x, block[0] + size, xHi, y, block[1] + size, yHi);
    }

    // Earliest longest common block as {startX, startY, size}.
    private int[] longestMatch(String x, int xLo, int xHi, String y, int yLo, int yHi) {
        int bestI = xLo, bestJ = yLo, bestSize = 0;
        int width = yHi - yLo;
        int[] prev = new int[width + 1];
        int[] curr = new int[width + 1];
        for (int i = xLo; i < xHi; i++) {
            for (int j = yLo; j < yHi; j++) {
                int k = j - yLo + 1;
                if (x.charAt(i) == y.charAt(j)) {
                    curr[k] = prev[k - 1] + 1;
                    if (curr[k] > bestSize) {
                        bestSize = curr[k];
                        bestI = i - bestSize + 1;
                        bestJ = j - bestSize + 1;
                    }
                } else {
                    curr[k] = 0;
                }
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
