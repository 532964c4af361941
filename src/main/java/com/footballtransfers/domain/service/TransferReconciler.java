package com.footballtransfers.domain.service;

import com.footballtransfers.domain.error.ReconciliationConflict;
import com.footballtransfers.domain.model.ClubNames;
import com.footballtransfers.domain.model.Movement;
import com.footballtransfers.domain.model.ReconciliationStatus;
import com.footballtransfers.domain.model.TransferKey;
import com.footballtransfers.domain.model.TransferRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Merges the "in" and "out" reports of the same transfer for one (league, season).
 *
 * Records are grouped by {@link TransferKey}. Inside a group an "in" record is
 * paired with an "out" record only when their clubs are swapped and their source
 * transfer ids do not differ (one side missing an id is fine). Pairing order:
 * <ol>
 *     <li>equal source transfer id;</li>
 *     <li>equal loan flag and compatible fee (equal, or one side missing), in page order;</li>
 *     <li>whatever remains, in page order, when both sides have the same number left.</li>
 * </ol>
 * Anything still unmatched is kept unchanged as a singleton.
 *
 * Conflict resolution for a pair: a non-null fee or market value wins over null,
 * then the buying club's value wins. An explicit loan marker on either side wins.
 * Both records of a pair end up with identical fee, market value and loan flag.
 */
public class TransferReconciler {

    private static final Logger logger = LoggerFactory.getLogger(TransferReconciler.class);

    private static final Comparator<TransferRecord> PAGE_ORDER = Comparator
        .comparing(TransferRecord::getClub, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparingInt(TransferRecord::getSourceRowIndex);

    public record Result(
        List<TransferRecord> records,
        List<ReconciliationConflict> conflicts,
        int pairedTransfers,
        int unpairedRecords
    ) {}

    /**
     * Reconciles all records of one (league, season). Records are adjusted in
     * place and returned in input order; none are added or removed.
     */
    public Result reconcile(List<TransferRecord> records) {
        Map<TransferKey, List<TransferRecord>> groups = new LinkedHashMap<>();
        for (TransferRecord record : records) {
            groups.computeIfAbsent(TransferKey.of(record), k -> new ArrayList<>()).add(record);
        }

        List<ReconciliationConflict> conflicts = new ArrayList<>();
        int paired = 0;
        int unpaired = 0;

        for (Map.Entry<TransferKey, List<TransferRecord>> group : groups.entrySet()) {
            List<TransferRecord> ins = new ArrayList<>();
            List<TransferRecord> outs = new ArrayList<>();
            for (TransferRecord record : group.getValue()) {
                (record.getMovement() == Movement.IN ? ins : outs).add(record);
            }
            ins.sort(PAGE_ORDER);
            outs.sort(PAGE_ORDER);

            List<TransferRecord[]> pairs = pair(ins, outs);
            for (TransferRecord[] pair : pairs) {
                merge(group.getKey(), pair[0], pair[1], conflicts);
                paired++;
            }
            for (TransferRecord leftover : ins) {
                leftover.setReconciliationStatus(ReconciliationStatus.UNPAIRED);
                unpaired++;
            }
            for (TransferRecord leftover : outs) {
                leftover.setReconciliationStatus(ReconciliationStatus.UNPAIRED);
                unpaired++;
            }
        }

        logger.info("Reconciled {} records: {} paired transfers, {} unpaired records, {} conflicts",
            records.size(), paired, unpaired, conflicts.size());
        return new Result(records, conflicts, paired, unpaired);
    }

    /**
     * Removes matched records from {@code ins} and {@code outs} and returns them as (in, out) pairs.
     */
    private List<TransferRecord[]> pair(List<TransferRecord> ins, List<TransferRecord> outs) {
        List<TransferRecord[]> pairs = new ArrayList<>();

        matchWhere(ins, outs, pairs, (in, out) ->
            in.getSourceTransferId() != null && in.getSourceTransferId().equals(out.getSourceTransferId()));

        matchWhere(ins, outs, pairs, (in, out) ->
            in.isLoan() == out.isLoan() && feesCompatible(in.getFee(), out.getFee()));

        if (!ins.isEmpty() && ins.size() == countSwapped(ins, outs)) {
            matchWhere(ins, outs, pairs, (in, out) -> true);
        }
        return pairs;
    }

    private void matchWhere(List<TransferRecord> ins, List<TransferRecord> outs, List<TransferRecord[]> pairs,
                            PairCondition condition) {
        Iterator<TransferRecord> inIterator = ins.iterator();
        while (inIterator.hasNext()) {
            TransferRecord in = inIterator.next();
            Iterator<TransferRecord> outIterator = outs.iterator();
            while (outIterator.hasNext()) {
                TransferRecord out = outIterator.next();
                if (clubsSwapped(in, out) && transferIdsCompatible(in, out) && condition.matches(in, out)) {
                    pairs.add(new TransferRecord[]{in, out});
                    inIterator.remove();
                    outIterator.remove();
                    break;
                }
            }
        }
    }

    /** Number of remaining "out" records that could pair with the remaining "in" records. */
    private int countSwapped(List<TransferRecord> ins, List<TransferRecord> outs) {
        TransferRecord first = ins.get(0);
        boolean sameDirection = ins.stream().allMatch(in -> sameClub(in.getClub(), first.getClub()));
        if (!sameDirection) {
            return -1;
        }
        return (int) outs.stream()
            .filter(out -> clubsSwapped(first, out) && transferIdsCompatible(first, out))
            .count();
    }

    private void merge(TransferKey key, TransferRecord in, TransferRecord out, List<ReconciliationConflict> conflicts) {
        Long fee = resolveAmount(key, "fee", in, out, TransferRecord::getFee, conflicts);
        Long marketValue = resolveAmount(key, "market_value", in, out, TransferRecord::getMarketValue, conflicts);

        boolean loan = in.isLoan() || out.isLoan();
        if (in.isLoan() != out.isLoan()) {
            record(key, "is_loan", String.valueOf(in.isLoan()), String.valueOf(out.isLoan()),
                String.valueOf(loan), conflicts);
        }

        apply(in, out, TransferRecord::setFee, fee);
        apply(in, out, TransferRecord::setMarketValue, marketValue);
        in.setLoan(loan);
        out.setLoan(loan);
        in.setReconciliationStatus(ReconciliationStatus.PAIRED);
        out.setReconciliationStatus(ReconciliationStatus.PAIRED);
    }

    private Long resolveAmount(TransferKey key, String field, TransferRecord in, TransferRecord out,
                               Function<TransferRecord, Long> getter, List<ReconciliationConflict> conflicts) {
        Long inValue = getter.apply(in);
        Long outValue = getter.apply(out);
        if (Objects.equals(inValue, outValue)) {
            return inValue;
        }
        Long resolved = inValue != null ? inValue : outValue;
        record(key, field, String.valueOf(inValue), String.valueOf(outValue), String.valueOf(resolved), conflicts);
        return resolved;
    }

    private void record(TransferKey key, String field, String inValue, String outValue, String resolved,
                        List<ReconciliationConflict> conflicts) {
        ReconciliationConflict conflict = new ReconciliationConflict(key, field, inValue, outValue, resolved);
        conflicts.add(conflict);
        logger.warn("Conflicting {} for player {} between {} and {} ({}): in={}, out={}, using {}",
            field, key.playerId(), key.clubA(), key.clubB(), key.window(), inValue, outValue, resolved);
    }

    private static <T> void apply(TransferRecord in, TransferRecord out, BiConsumer<TransferRecord, T> setter, T value) {
        setter.accept(in, value);
        setter.accept(out, value);
    }

    private static boolean feesCompatible(Long a, Long b) {
        return a == null || b == null || a.equals(b);
    }

    private static boolean transferIdsCompatible(TransferRecord in, TransferRecord out) {
        return in.getSourceTransferId() == null
            || out.getSourceTransferId() == null
            || in.getSourceTransferId().equals(out.getSourceTransferId());
    }

    private static boolean clubsSwapped(TransferRecord in, TransferRecord out) {
        return sameClub(in.getClub(), out.getDealingClub()) && sameClub(in.getDealingClub(), out.getClub());
    }

    private static boolean sameClub(String a, String b) {
        return ClubNames.key(a).equals(ClubNames.key(b));
    }

    @FunctionalInterface
    private interface PairCondition {
        boolean matches(TransferRecord in, TransferRecord out);
    }
}
