package com.footballtransfers.domain.model;

/**
 * Groups the two club-side reports of one transfer. The club pair is stored
 * in sorted order so the key is the same from either side. Clubs are compared
 * by {@link ClubNames#key(String)}.
 */
public record TransferKey(String playerId, int season, Window window, String clubA, String clubB) {

    public static TransferKey of(TransferRecord record) {
        String club = ClubNames.key(record.getClub());
        String dealing = ClubNames.key(record.getDealingClub());
        boolean ordered = club.compareTo(dealing) <= 0;
        return new TransferKey(
            record.getPlayerId(),
            record.getSeason(),
            record.getWindow(),
            ordered ? club : dealing,
            ordered ? dealing : club
        );
    }
}
