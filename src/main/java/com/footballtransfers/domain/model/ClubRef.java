package com.footballtransfers.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * A club as addressed by the source site.
 *
 * @param slug    URL slug, e.g. {@code arsenal-fc}
 * @param id      source club id, e.g. {@code 11}
 * @param name    display name used in the dataset's {@code club} column
 * @param aliases other spellings of the name seen in dealing-club columns
 */
public record ClubRef(String slug, String id, String name, List<String> aliases) {

    public ClubRef {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public ClubRef(String slug, String id, String name) {
        this(slug, id, name, List.of());
    }
}
