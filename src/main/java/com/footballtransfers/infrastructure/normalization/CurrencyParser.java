package com.footballtransfers.infrastructure.normalization;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses money strings such as "€70.00m", "€500k", "€1,500,000" or "70,00 Mio. €"
 * into whole euros. Separators are interpreted explicitly, never through the
 * JVM default locale.
 */
public class CurrencyParser {

    private static final Pattern AMOUNT = Pattern.compile(
        "^(\\d[\\d.,' ]*)\\s*(bn|mrd|mio|m|th|tsd|k)?\\.?$");

    private static final Map<String, BigDecimal> MULTIPLIERS = Map.of(
        "bn", BigDecimal.valueOf(1_000_000_000L),
        "mrd", BigDecimal.valueOf(1_000_000_000L),
        "m", BigDecimal.valueOf(1_000_000L),
        "mio", BigDecimal.valueOf(1_000_000L),
        "k", BigDecimal.valueOf(1_000L),
        "th", BigDecimal.valueOf(1_000L),
        "tsd", BigDecimal.valueOf(1_000L)
    );

    /**
     * @param raw text as printed on the page
     * @return amount in euros, or null when the value is missing ("-", "?", blank)
     * @throws IllegalArgumentException when the text is not a money amount
     */
    public static Long parseEuros(String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.replace('\u00A0', ' ')
            .replace("€", "")
            .replaceAll("(?i)\\bEUR\\b", "")
            .trim()
            .toLowerCase(Locale.ROOT);
        if (isMissing(s)) {
            return null;
        }

        Matcher matcher = AMOUNT.matcher(s);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a money amount: '" + raw + "'");
        }
        String suffix = matcher.group(2);
        BigDecimal number = parseNumber(matcher.group(1).replaceAll("[ ']", ""), suffix != null, raw);
        BigDecimal multiplier = suffix != null ? MULTIPLIERS.get(suffix) : BigDecimal.ONE;

        try {
            return number.multiply(multiplier).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Money amount out of range: '" + raw + "'", e);
        }
    }

    static boolean isMissing(String s) {
        return s.isEmpty() || s.equals("-") || s.equals("?") || s.equals("\u2013") || s.equals("\u2014");
    }

    /**
     * Resolves which of '.' and ',' is the decimal separator.
     * Both present: the last one is decimal. One kind repeated: thousands.
     * A single one followed by exactly three digits and no multiplier: thousands.
     * Otherwise decimal.
     */
    private static BigDecimal parseNumber(String digits, boolean hasMultiplier, String raw) {
        int lastDot = digits.lastIndexOf('.');
        int lastComma = digits.lastIndexOf(',');
        String plain;

        if (lastDot >= 0 && lastComma >= 0) {
            char decimal = lastDot > lastComma ? '.' : ',';
            char grouping = decimal == '.' ? ',' : '.';
            plain = digits.replace(String.valueOf(grouping), "").replace(decimal, '.');
        } else if (lastDot >= 0 || lastComma >= 0) {
            char separator = lastDot >= 0 ? '.' : ',';
            int index = Math.max(lastDot, lastComma);
            long count = digits.chars().filter(c -> c == separator).count();
            int digitsAfter = digits.length() - index - 1;
            boolean grouping = count > 1 || (!hasMultiplier && digitsAfter == 3);
            plain = grouping
                ? digits.replace(String.valueOf(separator), "")
                : digits.replace(separator, '.');
        } else {
            plain = digits;
        }

        try {
            return new BigDecimal(plain);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a money amount: '" + raw + "'", e);
        }
    }
}
