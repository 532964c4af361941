package com.footballtransfers.infrastructure.normalization;

import com.footballtransfers.domain.error.NormalizationException;
import com.footballtransfers.domain.model.ClubRef;
import com.footballtransfers.domain.model.Position;
import com.footballtransfers.domain.model.RawCell;
import com.footballtransfers.domain.model.RawRow;
import com.footballtransfers.domain.model.ScrapeContext;
import com.footballtransfers.domain.model.TransferRecord;
import com.footballtransfers.domain.ports.RowNormalizer;
import com.footballtransfers.infrastructure.scraper.transfermarkt.ColumnRole;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw transfer rows into typed {@link TransferRecord}s.
 * League, season, window and club come from the caller's context, never from the row.
 */
public class TransferRowNormalizer implements RowNormalizer {

    private static final Pattern PLAYER_ID = Pattern.compile("/spieler/(\\d+)");
    private static final Pattern TRANSFER_ID = Pattern.compile("transfer_id/(\\d+)");
    private static final Pattern CLUB_LINK = Pattern.compile("/verein/\\d+");
    private static final Pattern AGE = Pattern.compile("^(\\d{1,2})$");
    private static final Pattern AGE_IN_PARENTHESES = Pattern.compile("\\((\\d{1,2})\\)");

    /** One resolver per league season club list; every row of that season shares it. */
    private final Map<List<ClubRef>, ClubNameResolver> resolvers = new ConcurrentHashMap<>();

    @Override
    public TransferRecord normalize(RawRow row, ScrapeContext context) throws NormalizationException {
        TransferRecord record = new TransferRecord();
        record.setSeason(context.season());
        record.setLeague(context.league());
        record.setClub(context.club().name());
        record.setWindow(context.window());
        record.setMovement(row.getMovement());
        record.setSourceRowIndex(row.getRowIndex());

        RawCell player = ColumnRole.PLAYER.in(row)
            .orElseThrow(() -> new NormalizationException(ColumnRole.PLAYER.primaryLabel(), "", "Missing player column"));
        record.setPlayerName(parsePlayerName(player));
        record.setPlayerId(parsePlayerId(player));

        record.setAge(parseAge(text(row, ColumnRole.AGE)));
        record.setNationality(firstTitle(ColumnRole.NATIONALITY.in(row).orElse(RawCell.EMPTY)));
        record.setPosition(parsePosition(text(row, ColumnRole.POSITION), text(row, ColumnRole.POS)));
        record.setMarketValue(parseMoney(ColumnRole.MARKET_VALUE, text(row, ColumnRole.MARKET_VALUE)));

        RawCell dealing = ColumnRole.DEALING_CLUB.in(row).orElse(RawCell.EMPTY);
        record.setDealingClub(resolverFor(context).resolve(parseClubName(dealing)));
        record.setDealingCountry(parseDealingCountry(row, dealing));

        String feeText = text(row, ColumnRole.FEE);
        FeeInfo fee;
        try {
            fee = FeeParser.parse(feeText);
        } catch (IllegalArgumentException e) {
            throw new NormalizationException(ColumnRole.FEE.primaryLabel(), feeText, "Unparsable fee");
        }
        record.setFee(fee.fee());
        record.setLoan(fee.loan());
        record.setSourceTransferId(findTransferId(row));

        return record;
    }

    ClubNameResolver resolverFor(ScrapeContext context) {
        return resolvers.computeIfAbsent(context.knownClubs(), ClubNameResolver::new);
    }

    private static String text(RawRow row, ColumnRole role) {
        return role.in(row).map(RawCell::text).orElse("");
    }

    private static String parsePlayerName(RawCell cell) throws NormalizationException {
        String name = cell.links().stream()
            .filter(link -> PLAYER_ID.matcher(link.href()).find())
            .map(RawCell.Link::text)
            .map(NormalizationUtils::cleanDisplayText)
            .filter(t -> t != null)
            .findFirst()
            .orElse(NormalizationUtils.cleanDisplayText(cell.text()));
        if (name == null) {
            throw new NormalizationException(ColumnRole.PLAYER.primaryLabel(), cell.text(), "Missing player name");
        }
        return name;
    }

    private static String parsePlayerId(RawCell cell) throws NormalizationException {
        for (RawCell.Link link : cell.links()) {
            Matcher matcher = PLAYER_ID.matcher(link.href());
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        throw new NormalizationException(ColumnRole.PLAYER.primaryLabel(), cell.text(), "Missing player id link");
    }

    static Integer parseAge(String raw) throws NormalizationException {
        String text = raw == null ? "" : raw.trim();
        if (CurrencyParser.isMissing(text)) {
            return null;
        }
        Matcher plain = AGE.matcher(text);
        if (plain.matches()) {
            return Integer.valueOf(plain.group(1));
        }
        Matcher dated = AGE_IN_PARENTHESES.matcher(text);
        if (dated.find()) {
            return Integer.valueOf(dated.group(1));
        }
        throw new NormalizationException(ColumnRole.AGE.primaryLabel(), raw, "Non-numeric age");
    }

    static Position parsePosition(String fullName, String abbreviation) throws NormalizationException {
        String full = NormalizationUtils.cleanDisplayText(fullName);
        String abbr = NormalizationUtils.cleanDisplayText(abbreviation);

        Position byName = null;
        if (full != null) {
            byName = Position.fromFullName(full).orElseThrow(() ->
                new NormalizationException(ColumnRole.POSITION.primaryLabel(), fullName, "Unknown position"));
        }
        Position byAbbreviation = null;
        if (abbr != null) {
            byAbbreviation = Position.fromAbbreviation(abbr).orElseThrow(() ->
                new NormalizationException(ColumnRole.POS.primaryLabel(), abbreviation, "Unknown position abbreviation"));
        }

        if (byName != null && byAbbreviation != null && byName != byAbbreviation) {
            throw new NormalizationException(ColumnRole.POS.primaryLabel(), abbreviation,
                "Abbreviation does not match position " + full);
        }
        return byName != null ? byName : byAbbreviation;
    }

    private static Long parseMoney(ColumnRole role, String raw) throws NormalizationException {
        try {
            return CurrencyParser.parseEuros(raw);
        } catch (IllegalArgumentException e) {
            throw new NormalizationException(role.primaryLabel(), raw, "Unparsable amount");
        }
    }

    private static String parseClubName(RawCell cell) {
        Optional<String> linked = cell.links().stream()
            .filter(link -> CLUB_LINK.matcher(link.href()).find())
            .map(RawCell.Link::text)
            .map(NormalizationUtils::cleanDisplayText)
            .filter(t -> t != null)
            .findFirst();
        if (linked.isPresent()) {
            return linked.get();
        }
        String text = NormalizationUtils.cleanDisplayText(cell.text());
        if (text != null) {
            return text;
        }
        return cell.imageTitles().isEmpty() ? null : cell.imageTitles().get(0);
    }

    private static String parseDealingCountry(RawRow row, RawCell dealing) {
        Optional<RawCell> countryColumn = ColumnRole.DEALING_COUNTRY.in(row);
        if (countryColumn.isPresent()) {
            String country = firstTitle(countryColumn.get());
            if (country != null) {
                return country;
            }
        }
        return dealing.flagTitles().isEmpty()
            ? null
            : NormalizationUtils.cleanDisplayText(dealing.flagTitles().get(0));
    }

    /** Flag title first, then any image title, then the visible text. */
    private static String firstTitle(RawCell cell) {
        if (!cell.flagTitles().isEmpty()) {
            return NormalizationUtils.cleanDisplayText(cell.flagTitles().get(0));
        }
        if (!cell.imageTitles().isEmpty()) {
            return NormalizationUtils.cleanDisplayText(cell.imageTitles().get(0));
        }
        return NormalizationUtils.cleanDisplayText(cell.text());
    }

    private static String findTransferId(RawRow row) {
        RawCell fee = ColumnRole.FEE.in(row).orElse(RawCell.EMPTY);
        String id = transferIdIn(fee);
        if (id != null) {
            return id;
        }
        for (RawCell cell : row.cells().values()) {
            id = transferIdIn(cell);
            if (id != null) {
                return id;
            }
        }
        return null;
    }

    private static String transferIdIn(RawCell cell) {
        for (RawCell.Link link : cell.links()) {
            Matcher matcher = TRANSFER_ID.matcher(link.href());
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }
}
