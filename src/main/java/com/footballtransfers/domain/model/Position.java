package com.footballtransfers.domain.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical playing positions with their fixed abbreviations.
 * The abbreviation is a pure function of the full name and vice versa.
 */
public enum Position {
    GOALKEEPER("Goalkeeper", "GK"),
    SWEEPER("Sweeper", "SW"),
    CENTRE_BACK("Centre-Back", "CB"),
    LEFT_BACK("Left-Back", "LB"),
    RIGHT_BACK("Right-Back", "RB"),
    DEFENDER("Defender", "DEF"),
    DEFENSIVE_MIDFIELD("Defensive Midfield", "DM"),
    CENTRAL_MIDFIELD("Central Midfield", "CM"),
    RIGHT_MIDFIELD("Right Midfield", "RM"),
    LEFT_MIDFIELD("Left Midfield", "LM"),
    ATTACKING_MIDFIELD("Attacking Midfield", "AM"),
    MIDFIELD("Midfield", "MID"),
    LEFT_WINGER("Left Winger", "LW"),
    RIGHT_WINGER("Right Winger", "RW"),
    SECOND_STRIKER("Second Striker", "SS"),
    CENTRE_FORWARD("Centre-Forward", "CF"),
    ATTACK("Attack", "ATT");

    private static final Map<String, Position> BY_NAME = new HashMap<>();
    private static final Map<String, Position> BY_ABBREVIATION = new HashMap<>();

    static {
        for (Position position : values()) {
            BY_NAME.put(key(position.fullName), position);
            BY_ABBREVIATION.put(position.abbreviation, position);
        }
        // Spellings seen on older pages
        BY_NAME.put(key("Center-Back"), CENTRE_BACK);
        BY_NAME.put(key("Centre Back"), CENTRE_BACK);
        BY_NAME.put(key("Center-Forward"), CENTRE_FORWARD);
        BY_NAME.put(key("Centre Forward"), CENTRE_FORWARD);
        BY_NAME.put(key("Keeper"), GOALKEEPER);
        BY_NAME.put(key("Striker"), CENTRE_FORWARD);
    }

    private final String fullName;
    private final String abbreviation;

    Position(String fullName, String abbreviation) {
        this.fullName = fullName;
        this.abbreviation = abbreviation;
    }

    public String getFullName() {
        return fullName;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    public static Optional<Position> fromFullName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(key(name)));
    }

    public static Optional<Position> fromAbbreviation(String abbreviation) {
        if (abbreviation == null || abbreviation.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ABBREVIATION.get(abbreviation.trim().toUpperCase(Locale.ROOT)));
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", " ");
    }
}
