package com.footballtransfers.domain.service;

import com.footballtransfers.domain.error.ReconciliationConflict;
import com.footballtransfers.domain.model.Movement;
import com.footballtransfers.domain.model.ReconciliationStatus;
import com.footballtransfers.domain.model.TransferKey;
import com.footballtransfers.domain.model.TransferRecord;
import com.footballtransfers.domain.model.Window;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TransferReconciler.
 */
class TransferReconcilerTest {

    private TransferReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new TransferReconciler();
    }

    @Test
    void testPairsBothSidesAndResolvesFeeConflict() {
        TransferRecord in = record("Arsenal FC", Movement.IN, "1", "Real Sociedad", 32_000_000L, false, 0);
        TransferRecord out = record("Real Sociedad", Movement.OUT, "1", "Arsenal FC", 31_500_000L, false, 4);
        out.setMarketValue(null);

        TransferReconciler.Result result = reconciler.reconcile(new ArrayList<>(List.of(in, out)));

        assertEquals(1, result.pairedTransfers());
        assertEquals(0, result.unpairedRecords());
        assertEquals(2, result.records().size());
        assertEquals(ReconciliationStatus.PAIRED, in.getReconciliationStatus());
        assertEquals(ReconciliationStatus.PAIRED, out.getReconciliationStatus());

        assertEquals(32_000_000L, in.getFee());
        assertEquals(32_000_000L, out.getFee());
        assertEquals(50_000_000L, out.getMarketValue());

        assertEquals(2, result.conflicts().size());
        ReconciliationConflict fee = result.conflicts().get(0);
        assertEquals("fee", fee.field());
        assertEquals("32000000", fee.inValue());
        assertEquals("31500000", fee.outValue());
        assertEquals("32000000", fee.resolved());
        assertEquals("market_value", result.conflicts().get(1).field());
    }

    @Test
    void testNonNullFeeWinsOverMissing() {
        TransferRecord in = record("Arsenal FC", Movement.IN, "1", "Real Sociedad", null, false, 0);
        TransferRecord out = record("Real Sociedad", Movement.OUT, "1", "Arsenal FC", 32_000_000L, false, 0);

        reconciler.reconcile(List.of(in, out));

        assertEquals(32_000_000L, in.getFee());
        assertEquals(32_000_000L, out.getFee());
    }

    @Test
    void testLoanMarkerOnEitherSideWins() {
        TransferRecord in = record("Arsenal FC", Movement.IN, "2", "Chelsea FC", null, false, 0);
        TransferRecord out = record("Chelsea FC", Movement.OUT, "2", "Arsenal FC", null, true, 0);
        in.setSourceTransferId("77");
        out.setSourceTransferId("77");

        TransferReconciler.Result result = reconciler.reconcile(List.of(in, out));

        assertEquals(1, result.pairedTransfers());
        assertTrue(in.isLoan());
        assertTrue(out.isLoan());
        assertEquals("is_loan", result.conflicts().get(0).field());
    }

    @Test
    void testSingletonIsKeptUnchanged() {
        TransferRecord in = record("Arsenal FC", Movement.IN, "3", "Real Madrid", 47_000_000L, false, 0);

        TransferReconciler.Result result = reconciler.reconcile(List.of(in));

        assertEquals(List.of(in), result.records());
        assertEquals(0, result.pairedTransfers());
        assertEquals(1, result.unpairedRecords());
        assertEquals(ReconciliationStatus.UNPAIRED, in.getReconciliationStatus());
        assertEquals(47_000_000L, in.getFee());
        assertTrue(result.conflicts().isEmpty());
    }

    @Test
    void testSameClubSideIsNeverPaired() {
        TransferRecord a = record("Arsenal FC", Movement.IN, "4", "Chelsea FC", null, false, 0);
        TransferRecord b = record("Arsenal FC", Movement.IN, "4", "Chelsea FC", null, false, 1);

        TransferReconciler.Result result = reconciler.reconcile(List.of(a, b));

        assertEquals(0, result.pairedTransfers());
        assertEquals(2, result.unpairedRecords());
    }

    @Test
    void testLoanThenPermanentMoveAreSeparateTransfers() {
        // A -> B on loan, then B -> C permanently in the same window
        TransferRecord loanIn = record("Brentford FC", Movement.IN, "5", "Arsenal FC", null, true, 0);
        TransferRecord loanOut = record("Arsenal FC", Movement.OUT, "5", "Brentford FC", null, true, 2);
        TransferRecord permanentOut = record("Brentford FC", Movement.OUT, "5", "Fulham FC", 10_000_000L, false, 5);
        TransferRecord permanentIn = record("Fulham FC", Movement.IN, "5", "Brentford FC", 10_000_000L, false, 1);

        TransferReconciler.Result result = reconciler.reconcile(List.of(loanIn, loanOut, permanentOut, permanentIn));

        assertEquals(4, result.records().size());
        assertEquals(2, result.pairedTransfers());
        assertTrue(loanIn.isLoan());
        assertTrue(loanOut.isLoan());
        assertFalse(permanentIn.isLoan());
        assertEquals(10_000_000L, permanentOut.getFee());
    }

    @Test
    void testLoanAndRecallInSameWindowPairByTransferId() {
        // Loaned out and recalled: two transfers between the same clubs, opposite directions
        TransferRecord loanOut = record("Arsenal FC", Movement.OUT, "6", "Brentford FC", null, true, 0);
        TransferRecord recallIn = record("Arsenal FC", Movement.IN, "6", "Brentford FC", null, true, 1);
        TransferRecord loanIn = record("Brentford FC", Movement.IN, "6", "Arsenal FC", null, true, 0);
        TransferRecord recallOut = record("Brentford FC", Movement.OUT, "6", "Arsenal FC", null, true, 1);
        loanOut.setSourceTransferId("100");
        loanIn.setSourceTransferId("100");
        recallIn.setSourceTransferId("101");
        recallOut.setSourceTransferId("101");

        TransferReconciler.Result result = reconciler.reconcile(List.of(loanOut, recallIn, loanIn, recallOut));

        assertEquals(2, result.pairedTransfers());
        assertEquals(0, result.unpairedRecords());
        assertEquals(4, result.records().size());
    }

    @Test
    void testFallbackPairingInPageOrder() {
        TransferRecord in1 = record("Arsenal FC", Movement.IN, "7", "Chelsea FC", 5_000_000L, false, 0);
        TransferRecord in2 = record("Arsenal FC", Movement.IN, "7", "Chelsea FC", 9_000_000L, true, 1);
        TransferRecord out1 = record("Chelsea FC", Movement.OUT, "7", "Arsenal FC", 6_000_000L, true, 0);
        TransferRecord out2 = record("Chelsea FC", Movement.OUT, "7", "Arsenal FC", 7_000_000L, false, 1);

        TransferReconciler.Result result = reconciler.reconcile(List.of(in1, in2, out1, out2));

        assertEquals(2, result.pairedTransfers());
        // no transfer id and no compatible fee: remaining records pair in page order
        assertEquals(5_000_000L, in1.getFee());
        assertEquals(5_000_000L, out1.getFee());
        assertTrue(in1.isLoan());
        assertEquals(9_000_000L, out2.getFee());
        assertTrue(out2.isLoan());
    }

    @Test
    void testDifferentWindowsAreDifferentTransfers() {
        TransferRecord in = record("Arsenal FC", Movement.IN, "8", "Chelsea FC", null, false, 0);
        TransferRecord out = record("Chelsea FC", Movement.OUT, "8", "Arsenal FC", null, false, 0);
        out.setWindow(Window.WINTER);

        TransferReconciler.Result result = reconciler.reconcile(List.of(in, out));

        assertEquals(0, result.pairedTransfers());
        assertEquals(2, result.unpairedRecords());
    }

    @Test
    void testClubNamesCompareIgnoringCaseAndSpacing() {
        TransferRecord in = record("Arsenal FC", Movement.IN, "9", "Chelsea  FC", null, false, 0);
        TransferRecord out = record("chelsea fc", Movement.OUT, "9", "ARSENAL FC", null, false, 0);

        assertEquals(TransferKey.of(in), TransferKey.of(out));
        assertEquals(1, reconciler.reconcile(List.of(in, out)).pairedTransfers());
    }

    @Test
    void testDifferentTransferIdsAreNeverPaired() {
        TransferRecord in = record("Arsenal FC", Movement.IN, "10", "Chelsea FC", null, true, 0);
        in.setSourceTransferId("100");
        TransferRecord out = record("Chelsea FC", Movement.OUT, "10", "Arsenal FC", null, true, 0);
        out.setSourceTransferId("200");
        out.setMarketValue(45_000_000L);

        TransferReconciler.Result result = reconciler.reconcile(List.of(in, out));

        assertEquals(0, result.pairedTransfers());
        assertEquals(2, result.unpairedRecords());
        assertEquals(ReconciliationStatus.UNPAIRED, in.getReconciliationStatus());
        assertEquals(50_000_000L, in.getMarketValue());
        assertEquals(45_000_000L, out.getMarketValue());
        assertTrue(result.conflicts().isEmpty());
    }

    @Test
    void testMissingTransferIdOnOneSideStillPairs() {
        TransferRecord in = record("Arsenal FC", Movement.IN, "11", "Chelsea FC", 5_000_000L, false, 0);
        in.setSourceTransferId("100");
        TransferRecord out = record("Chelsea FC", Movement.OUT, "11", "Arsenal FC", 5_000_000L, false, 0);

        assertEquals(1, reconciler.reconcile(List.of(in, out)).pairedTransfers());
        assertEquals(ReconciliationStatus.PAIRED, out.getReconciliationStatus());
    }

    @Test
    void testLegalFormIsIgnoredWhenMatchingClubs() {
        TransferRecord in = record("Arsenal FC", Movement.IN, "12", "Chelsea", null, false, 0);
        TransferRecord out = record("Chelsea FC", Movement.OUT, "12", "Arsenal", null, false, 0);

        assertEquals(TransferKey.of(in), TransferKey.of(out));
        assertEquals(1, reconciler.reconcile(List.of(in, out)).pairedTransfers());
    }

    private static TransferRecord record(String club, Movement movement, String playerId, String dealingClub,
                                         Long fee, boolean loan, int rowIndex) {
        TransferRecord record = new TransferRecord();
        record.setSeason(2024);
        record.setLeague("premier-league");
        record.setClub(club);
        record.setWindow(Window.SUMMER);
        record.setMovement(movement);
        record.setPlayerName("Player " + playerId);
        record.setPlayerId(playerId);
        record.setMarketValue(50_000_000L);
        record.setDealingClub(dealingClub);
        record.setFee(fee);
        record.setLoan(loan);
        record.setSourceRowIndex(rowIndex);
        return record;
    }
}
