package com.footballtransfers.infrastructure.normalization;

/**
 * Parsed fee column.
 *
 * @param fee  fee in euros, null when none was paid or reported
 * @param loan whether the page marked the move as a loan
 * @param kind what the fee text described
 */
public record FeeInfo(Long fee, boolean loan, Kind kind) {

    public enum Kind {
        UNKNOWN,
        FREE_TRANSFER,
        LOAN,
        LOAN_WITH_FEE,
        END_OF_LOAN,
        PAID
    }
}
