package com.footballtransfers.infrastructure.normalization;

import java.util.Locale;

/**
 * Interprets the fee column. Loans are recognized from explicit markers in the
 * text, never from the amount, so a loan with a fee still counts as a loan.
 */
public class FeeParser {

    public static FeeInfo parse(String raw) {
        String text = raw == null ? "" : raw.replace('\u00A0', ' ').trim();
        String lower = text.toLowerCase(Locale.ROOT);

        if (CurrencyParser.isMissing(lower)) {
            return new FeeInfo(null, false, FeeInfo.Kind.UNKNOWN);
        }
        if (lower.equals("free transfer") || lower.equals("free") || lower.equals("ablösefrei")) {
            return new FeeInfo(null, false, FeeInfo.Kind.FREE_TRANSFER);
        }
        if (lower.startsWith("end of loan") || lower.startsWith("loan return")) {
            return new FeeInfo(null, true, FeeInfo.Kind.END_OF_LOAN);
        }
        if (lower.startsWith("loan fee")) {
            int colon = text.lastIndexOf(':');
            Long fee = colon >= 0 ? CurrencyParser.parseEuros(text.substring(colon + 1)) : null;
            return fee != null
                ? new FeeInfo(fee, true, FeeInfo.Kind.LOAN_WITH_FEE)
                : new FeeInfo(null, true, FeeInfo.Kind.LOAN);
        }
        if (lower.startsWith("loan")) {
            return new FeeInfo(null, true, FeeInfo.Kind.LOAN);
        }

        Long fee = CurrencyParser.parseEuros(text);
        return fee != null
            ? new FeeInfo(fee, false, FeeInfo.Kind.PAID)
            : new FeeInfo(null, false, FeeInfo.Kind.UNKNOWN);
    }
}
