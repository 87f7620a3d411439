package com.streamhistory.pipeline;

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes free-form device/OS strings into a small set of OS families.
 * <p>
 * Spotify reports strings like {@code "iOS 16.1 (iPhone14,2)"} or
 * {@code "Android OS 12 API 31 (samsung, SM-G991B)"}; Apple Music reports a
 * source type such as {@code IPHONE}. Both map onto the same vocabulary, so
 * version suffixes and device models are discarded.
 */
public final class PlatformNormalizer {
    public static final String UNKNOWN = "Unknown";
    public static final String OTHER = "Other";

    private static final Map<String, String> APPLE_SOURCE_TYPES = Map.of(
        "IPHONE", "iOS",
        "IPAD", "iOS",
        "MACOS", "macOS",
        "ITUNES", "Windows",
        "APPLE_TV", "tvOS",
        "APPLE_WATCH", "Watch"
    );

    private PlatformNormalizer() {}

    /**
     * Maps a provider platform string to its OS family.
     * @param platform raw platform string (may be null)
     * @return OS family, {@link #UNKNOWN} for blank input, {@link #OTHER} when unrecognised
     */
    public static String normalize(String platform) {
        if (platform == null || platform.isBlank()) return UNKNOWN;
        String p = platform.toLowerCase(Locale.ROOT);
        if (p.contains("ios") || p.contains("iphone") || p.contains("ipad")) return "iOS";
        if (p.contains("android")) return "Android";
        if (p.contains("osx") || p.contains("macos") || p.contains("macintosh")) return "macOS";
        if (p.contains("windows")) return "Windows";
        if (p.contains("tvos") || p.contains("apple_tv") || p.contains("apple tv")) return "tvOS";
        if (p.contains("web") || p.contains("websocket")) return "Web Player";
        if (p.contains("watch")) return "Watch";
        if (p.contains("garmin")) return "Garmin";
        if (p.contains("google") || p.contains("cast")) return "Google Cast";
        if (p.contains("partner")) return "Partner Device";
        return OTHER;
    }

    /**
     * Maps an Apple Music {@code Source Type} value to its OS family.
     * @param sourceType raw source type (may be null)
     * @return OS family
     */
    public static String fromAppleSourceType(String sourceType) {
        if (sourceType == null || sourceType.isBlank()) return UNKNOWN;
        String mapped = APPLE_SOURCE_TYPES.get(sourceType.trim().toUpperCase(Locale.ROOT));
        return mapped != null ? mapped : normalize(sourceType);
    }
}
