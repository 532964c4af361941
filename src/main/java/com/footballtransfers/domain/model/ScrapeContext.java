package com.footballtransfers.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Identifies one club page fetch: (league, season, window, club).
 * Supplied by the caller to every stage so the row's own abbreviated
 * context fields are never trusted.
 *
 * @param knownClubs all clubs of the league season, used to canonicalize dealing-club names
 */
public record ScrapeContext(String league, int season, Window window, ClubRef club, List<ClubRef> knownClubs) {

    public ScrapeContext {
        Objects.requireNonNull(league, "league");
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(club, "club");
        knownClubs = knownClubs == null ? List.of() : List.copyOf(knownClubs);
    }

    public ScrapeContext(String league, int season, Window window, ClubRef club) {
        this(league, season, window, club, List.of());
    }

    public String describe() {
        return league + "/" + season + "/" + window + "/" + club.name();
    }
}
