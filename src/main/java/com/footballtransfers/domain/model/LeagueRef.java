package com.footballtransfers.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * A league as addressed by the source site.
 *
 * @param slug  URL slug and dataset directory name, e.g. {@code premier-league}
 * @param code  source competition code, e.g. {@code GB1}
 * @param clubs static club list; empty means the clubs are discovered per season
 */
public record LeagueRef(String slug, String code, List<ClubRef> clubs) {

    public LeagueRef {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(code, "code");
        clubs = clubs == null ? List.of() : List.copyOf(clubs);
    }

    public LeagueRef(String slug, String code) {
        this(slug, code, List.of());
    }
}
