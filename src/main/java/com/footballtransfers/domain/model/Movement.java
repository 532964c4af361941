package com.footballtransfers.domain.model;

/**
 * Direction of a transfer relative to the club whose page reported it.
 */
public enum Movement {
    IN("in"),
    OUT("out");

    private final String canonicalKey;

    Movement(String canonicalKey) {
        this.canonicalKey = canonicalKey;
    }

    public String getCanonicalKey() {
        return canonicalKey;
    }

    public Movement opposite() {
        return this == IN ? OUT : IN;
    }

    public static Movement fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("movement must not be null");
        }
        String v = value.trim();
        for (Movement movement : values()) {
            if (movement.canonicalKey.equalsIgnoreCase(v) || movement.name().equalsIgnoreCase(v)) {
                return movement;
            }
        }
        throw new IllegalArgumentException("Unknown movement: " + value);
    }

    @Override
    public String toString() {
        return canonicalKey;
    }
}
