package com.footballtransfers.domain.model;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;

/**
 * Comparison key for club names, shared by name resolution and transfer pairing
 * so both agree on when two spellings mean the same club.
 */
public final class ClubNames {

    /** Legal-form tokens ignored when comparing club names. */
    private static final Set<String> AFFIXES = Set.of(
        "FC", "AFC", "CF", "SC", "CD", "SV", "AC", "AS", "SS", "FK", "SK", "BK", "IF", "CLUB", "DE", "THE"
    );

    private ClubNames() {
    }

    /**
     * Uppercase, accent-free, underscore-separated key without legal-form tokens,
     * so "Arsenal FC", "arsenal" and "ARSENAL" share one key. Falls back to the
     * full key when only affixes remain. Blank or null names give "".
     */
    public static String key(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String full = Normalizer.normalize(name, Normalizer.Form.NFD)
            .replaceAll("\\p{M}", "")
            .toUpperCase(Locale.ROOT)
            .replaceAll("[^A-Z0-9]+", "_")
            .replaceAll("^_+|_+$", "");
        if (full.isEmpty()) {
            return full;
        }
        StringBuilder stripped = new StringBuilder();
        for (String token : full.split("_")) {
            if (AFFIXES.contains(token)) {
                continue;
            }
            if (stripped.length() > 0) {
                stripped.append('_');
            }
            stripped.append(token);
        }
        return stripped.length() > 0 ? stripped.toString() : full;
    }
}
