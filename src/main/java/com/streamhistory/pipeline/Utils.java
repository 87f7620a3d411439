package com.streamhistory.pipeline;

import java.text.Normalizer;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Utility class for common helper methods used across the pipeline and the insight generators.
 *
 * @author Streaming History Team
 * @since 1.0
 */
public class Utils {
    public static final double MS_PER_MINUTE = 60_000.0;
    public static final double MS_PER_HOUR = 3_600_000.0;

    /**
     * Parses a provider timestamp into a UTC instant.
     * Accepts {@code 2023-01-01T12:00:00Z}, fractional seconds, explicit offsets, and
     * zone-less local date-times (read as UTC).
     * @param ts timestamp string
     * @return parsed instant
     * @throws DateTimeParseException if no supported format matches
     */
    public static Instant parseTimestamp(String ts) {
        if (ts == null || ts.isBlank()) {
            throw new DateTimeParseException("Timestamp is blank", ts == null ? "" : ts, 0);
        }
        String s = ts.trim();
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(s).toInstant();
            } catch (DateTimeParseException e2) {
                return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
            }
        }
    }

    /**
     * Normalizes a name for case- and whitespace-insensitive comparison.
     * @param name Input name (may be null)
     * @return NFKC-normalized, lower-cased, whitespace-collapsed and trimmed key
     */
    public static String normalizeKey(String name) {
        if (name == null) return "";
        String n = Normalizer.normalize(name, Normalizer.Form.NFKC);
        return n.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    /**
     * Returns {@code part / total * 100}, or 0 when total is zero.
     */
    public static double percentage(long part, long total) {
        return total > 0 ? (part * 100.0) / total : 0.0;
    }

    /**
     * Returns {@code numerator / denominator}, or 0 when the denominator is zero.
     */
    public static double ratio(double numerator, double denominator) {
        return denominator != 0 ? numerator / denominator : 0.0;
    }

    public static double msToMinutes(long ms) {
        return ms / MS_PER_MINUTE;
    }

    public static double msToHours(long ms) {
        return ms / MS_PER_HOUR;
    }

    /**
     * Returns null for null or blank strings, the trimmed string otherwise.
     */
    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
