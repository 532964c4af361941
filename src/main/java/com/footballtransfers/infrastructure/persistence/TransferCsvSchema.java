package com.footballtransfers.infrastructure.persistence;

import com.footballtransfers.domain.model.Movement;
import com.footballtransfers.domain.model.Position;
import com.footballtransfers.domain.model.TransferRecord;
import com.footballtransfers.domain.model.Window;
import org.apache.commons.csv.CSVRecord;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * The published 16-column schema, its encodings and the row order of a file.
 *
 * Nulls are written as empty strings, {@code is_loan} as 0/1, window and
 * movement as their lower-case keys.
 */
public final class TransferCsvSchema {

    public static final String[] HEADER = {
        "season", "league", "club", "window", "movement",
        "player_name", "player_id", "age", "nationality",
        "position", "pos", "market_value",
        "dealing_club", "dealing_country", "fee", "is_loan"
    };

    /**
     * Deterministic total order of rows within a file.
     */
    public static final Comparator<TransferRecord> ROW_ORDER = Comparator
        .comparing(TransferRecord::getClub, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
        .thenComparing(TransferRecord::getMovement, Comparator.nullsFirst(Comparator.<Movement>naturalOrder()))
        .thenComparing(TransferRecord::getWindow, Comparator.nullsFirst(Comparator.<Window>naturalOrder()))
        .thenComparing(TransferRecord::getPlayerName, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
        .thenComparing(TransferRecord::getPlayerId, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
        .thenComparing(TransferRecord::getDealingClub, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
        .thenComparing(TransferRecord::getFee, Comparator.nullsFirst(Comparator.<Long>naturalOrder()))
        .thenComparing(TransferRecord::isLoan)
        .thenComparing(TransferRecord::getMarketValue, Comparator.nullsFirst(Comparator.<Long>naturalOrder()))
        .thenComparing(TransferRecord::getAge, Comparator.nullsFirst(Comparator.<Integer>naturalOrder()))
        .thenComparing(TransferRecord::getNationality, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
        .thenComparing(TransferRecord::getPosition, Comparator.nullsFirst(Comparator.<Position>naturalOrder()))
        .thenComparing(TransferRecord::getDealingCountry, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    private TransferCsvSchema() {
    }

    public static List<String> toRow(TransferRecord record) {
        return Arrays.asList(
            String.valueOf(record.getSeason()),
            blank(record.getLeague()),
            blank(record.getClub()),
            record.getWindow() != null ? record.getWindow().getCanonicalKey() : "",
            record.getMovement() != null ? record.getMovement().getCanonicalKey() : "",
            blank(record.getPlayerName()),
            blank(record.getPlayerId()),
            number(record.getAge()),
            blank(record.getNationality()),
            blank(record.getPositionName()),
            blank(record.getPos()),
            number(record.getMarketValue()),
            blank(record.getDealingClub()),
            blank(record.getDealingCountry()),
            number(record.getFee()),
            record.isLoan() ? "1" : "0"
        );
    }

    /**
     * Re-reads a row written by {@link #toRow(TransferRecord)}.
     *
     * @throws IllegalArgumentException when a value does not follow the schema
     */
    public static TransferRecord fromRow(CSVRecord row) {
        TransferRecord record = new TransferRecord();
        record.setSeason(Integer.parseInt(row.get("season")));
        record.setLeague(nullable(row.get("league")));
        record.setClub(nullable(row.get("club")));
        record.setWindow(Window.fromString(row.get("window")));
        record.setMovement(Movement.fromString(row.get("movement")));
        record.setPlayerName(nullable(row.get("player_name")));
        record.setPlayerId(nullable(row.get("player_id")));
        String age = nullable(row.get("age"));
        record.setAge(age != null ? Integer.valueOf(age) : null);
        record.setNationality(nullable(row.get("nationality")));

        String position = nullable(row.get("position"));
        String pos = nullable(row.get("pos"));
        if ((position == null) != (pos == null)) {
            throw new IllegalArgumentException("position and pos must both be present or both empty: " + row);
        }
        if (position != null) {
            Position parsed = Position.fromFullName(position)
                .orElseThrow(() -> new IllegalArgumentException("Unknown position: " + position));
            if (!parsed.getAbbreviation().equals(pos)) {
                throw new IllegalArgumentException("pos '" + pos + "' does not match position '" + position + "'");
            }
            record.setPosition(parsed);
        }

        String marketValue = nullable(row.get("market_value"));
        record.setMarketValue(marketValue != null ? Long.valueOf(marketValue) : null);
        record.setDealingClub(nullable(row.get("dealing_club")));
        record.setDealingCountry(nullable(row.get("dealing_country")));
        String fee = nullable(row.get("fee"));
        record.setFee(fee != null ? Long.valueOf(fee) : null);

        String loan = row.get("is_loan");
        if (!loan.equals("0") && !loan.equals("1")) {
            throw new IllegalArgumentException("is_loan must be 0 or 1: '" + loan + "'");
        }
        record.setLoan(loan.equals("1"));
        return record;
    }

    private static String blank(String value) {
        return value == null ? "" : value;
    }

    private static String number(Number value) {
        return value == null ? "" : value.toString();
    }

    private static String nullable(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
