package com.footballtransfers.domain.model;

/**
 * Transfer windows within a league season.
 */
public enum Window {
    SUMMER("summer", "s"),
    WINTER("winter", "w");

    private final String canonicalKey;
    private final String sourceCode;

    Window(String canonicalKey, String sourceCode) {
        this.canonicalKey = canonicalKey;
        this.sourceCode = sourceCode;
    }

    public String getCanonicalKey() {
        return canonicalKey;
    }

    /** Code used by the source site's query string ({@code s_w} / {@code w_s}). */
    public String getSourceCode() {
        return sourceCode;
    }

    /**
     * Accepts the canonical key, the source code or the enum name, case-insensitively.
     */
    public static Window fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("window must not be null");
        }
        String v = value.trim();
        for (Window window : values()) {
            if (window.canonicalKey.equalsIgnoreCase(v)
                || window.sourceCode.equalsIgnoreCase(v)
                || window.name().equalsIgnoreCase(v)) {
                return window;
            }
        }
        throw new IllegalArgumentException("Unknown transfer window: " + value);
    }

    @Override
    public String toString() {
        return canonicalKey;
    }
}
