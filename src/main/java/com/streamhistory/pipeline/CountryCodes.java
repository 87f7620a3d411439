package com.streamhistory.pipeline;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps country names and codes to ISO 3166-1 alpha-2 codes.
 * Names are matched case-insensitively against the JDK's English country list
 * plus a few common aliases found in Apple Music exports.
 */
public final class CountryCodes {
    private static final Set<String> ISO_CODES = Set.of(Locale.getISOCountries());
    private static final Map<String, String> BY_NAME = buildNameIndex();

    private CountryCodes() {}

    private static Map<String, String> buildNameIndex() {
        Map<String, String> index = new HashMap<>();
        for (String code : ISO_CODES) {
            String name = new Locale("", code).getDisplayCountry(Locale.ENGLISH);
            if (name != null && !name.isBlank()) index.put(name.toLowerCase(Locale.ROOT), code);
        }
        index.put("united states of america", "US");
        index.put("usa", "US");
        index.put("uk", "GB");
        index.put("great britain", "GB");
        index.put("south korea", "KR");
        index.put("russia", "RU");
        index.put("czech republic", "CZ");
        index.put("vietnam", "VN");
        return index;
    }

    /**
     * Converts a country name or code to an ISO alpha-2 code.
     * @param country country name, alpha-2 code, or null
     * @return upper-case alpha-2 code, or null if it cannot be determined
     */
    public static String toIsoCode(String country) {
        if (country == null || country.isBlank()) return null;
        String trimmed = country.trim();
        if (trimmed.length() == 2) {
            String upper = trimmed.toUpperCase(Locale.ROOT);
            if (ISO_CODES.contains(upper)) return upper;
        }
        return BY_NAME.get(trimmed.toLowerCase(Locale.ROOT));
    }
}
