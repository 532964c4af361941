package com.footballtransfers.infrastructure.normalization;

import com.footballtransfers.domain.model.ClubRef;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps club names as printed in dealing-club columns onto the league's own club
 * names, so both sides of a transfer spell the clubs the same way.
 * Names that match no known club, or more than one, are returned as printed.
 */
public class ClubNameResolver {

    private final Map<String, String> canonicalByKey = new HashMap<>();

    public ClubNameResolver(List<ClubRef> clubs) {
        Set<String> ambiguous = new HashSet<>();
        for (ClubRef club : clubs) {
            register(NormalizationUtils.normalizeText(club.name()), club.name(), ambiguous);
            register(NormalizationUtils.clubKey(club.name()), club.name(), ambiguous);
            for (String alias : club.aliases()) {
                register(NormalizationUtils.normalizeText(alias), club.name(), ambiguous);
                register(NormalizationUtils.clubKey(alias), club.name(), ambiguous);
            }
        }
        ambiguous.forEach(canonicalByKey::remove);
    }

    private void register(String key, String canonical, Set<String> ambiguous) {
        if (key.isEmpty()) {
            return;
        }
        String existing = canonicalByKey.putIfAbsent(key, canonical);
        if (existing != null && !existing.equals(canonical)) {
            ambiguous.add(key);
        }
    }

    /**
     * @param printed club name as printed on the page
     * @return the canonical club name, the cleaned printed name when unknown, or null when blank
     */
    public String resolve(String printed) {
        String cleaned = NormalizationUtils.cleanDisplayText(printed);
        if (cleaned == null) {
            return null;
        }
        String exact = canonicalByKey.get(NormalizationUtils.normalizeText(cleaned));
        if (exact != null) {
            return exact;
        }
        String loose = canonicalByKey.get(NormalizationUtils.clubKey(cleaned));
        return loose != null ? loose : cleaned;
    }
}
