package com.footballtransfers.infrastructure.scraper.transfermarkt;

import com.footballtransfers.domain.model.RawCell;
import com.footballtransfers.domain.model.RawRow;

import java.util.List;
import java.util.Optional;

/**
 * Column labels used by the transfer tables across page layouts, grouped by
 * the dataset field they feed. New layouts only need new aliases here.
 */
public enum ColumnRole {
    PLAYER(List.of("In", "Out", "Arrivals", "Departures", "Player", "Incoming", "Outgoing")),
    AGE(List.of("Age")),
    NATIONALITY(List.of("Nat.", "Nationality", "Nation")),
    POSITION(List.of("Position")),
    POS(List.of("Pos", "Pos.")),
    MARKET_VALUE(List.of("Market value", "MV", "Mkt. value")),
    DEALING_CLUB(List.of("Left", "Joined", "From", "To", "Left club", "Joined club", "Club")),
    DEALING_COUNTRY(List.of("Country")),
    FEE(List.of("Fee", "Transfer fee"));

    private final List<String> aliases;

    ColumnRole(List<String> aliases) {
        this.aliases = aliases;
    }

    public List<String> getAliases() {
        return aliases;
    }

    /** Label the extractor gives to values it derives from nested markup. */
    public String primaryLabel() {
        return aliases.get(0);
    }

    public Optional<RawCell> in(RawRow row) {
        return row.find(aliases);
    }

    public boolean matches(String label) {
        if (label == null) {
            return false;
        }
        String trimmed = label.trim();
        return aliases.stream().anyMatch(alias -> alias.equalsIgnoreCase(trimmed));
    }
}
