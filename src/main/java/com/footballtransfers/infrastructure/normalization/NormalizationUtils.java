package com.footballtransfers.infrastructure.normalization;

import com.footballtransfers.domain.model.ClubNames;

import java.text.Normalizer;

/**
 * Text utilities shared by the normalizers.
 */
public class NormalizationUtils {

    /**
     * Normalizes text into a comparison key.
     *
     * Rules:
     * 1. Convert to uppercase
     * 2. Remove accents (Atlético -> ATLETICO)
     * 3. Replace non-alphanumeric with underscore
     * 4. Collapse multiple underscores
     * 5. Remove leading/trailing underscores
     */
    public static String normalizeText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return "";
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFD);
        normalized = normalized.replaceAll("\\p{M}", "");

        normalized = normalized.toUpperCase(java.util.Locale.ROOT);

        normalized = normalized.replaceAll("[^A-Z0-9]+", "_");

        normalized = normalized.replaceAll("_+", "_");

        normalized = normalized.replaceAll("^_+|_+$", "");

        return normalized;
    }

    /**
     * Comparison key for club names: {@link #normalizeText(String)} without
     * legal-form tokens, so "Arsenal FC" and "Arsenal" share a key.
     * Falls back to the full key when only affixes remain.
     */
    public static String clubKey(String name) {
        return ClubNames.key(name);
    }

    /**
     * Cleans display text: NFC form, non-breaking spaces to spaces, whitespace collapsed, trimmed.
     * Returns null for blank input.
     */
    public static String cleanDisplayText(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = Normalizer.normalize(text, Normalizer.Form.NFC)
            .replace('\u00A0', ' ')
            .replaceAll("\\s+", " ")
            .trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Turns text into a file-name-safe lowercase slug, e.g. "Arsenal FC" -> "arsenal-fc".
     */
    public static String fileSlug(String text) {
        return normalizeText(text).toLowerCase(java.util.Locale.ROOT).replace('_', '-');
    }
}
