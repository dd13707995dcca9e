package com.claimsledger.ledger;

import com.claimsledger.domain.ClaimTransaction.TransactionType;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Folds ledger lines into {@link LedgerTotals}.
 *
 * Categories are fixed:
 *   incurred  = RESERVE_SET, RESERVE_ADJUST, IMPORT_BALANCE
 *   paid      = PAYMENT, LEGAL_FEE, ADJUSTER_FEE
 *   recovered = RECOVERY
 *
 * The fold is a plain sum per category, so the result does not depend on the
 * order of the lines. Totals are always recomputed from the ledger and never
 * stored.
 */
public final class LedgerAggregator {

    public static final Set<TransactionType> INCURRED_TYPES = EnumSet.of(
        TransactionType.RESERVE_SET, TransactionType.RESERVE_ADJUST, TransactionType.IMPORT_BALANCE);

    public static final Set<TransactionType> PAID_TYPES = EnumSet.of(
        TransactionType.PAYMENT, TransactionType.LEGAL_FEE, TransactionType.ADJUSTER_FEE);

    public static final Set<TransactionType> RECOVERED_TYPES = EnumSet.of(TransactionType.RECOVERY);

    private LedgerAggregator() {
    }

    /**
     * @param lines ledger lines of one claim (or of several, for roll-ups), in any order
     * @return totals, all zero for an empty ledger
     */
    public static LedgerTotals aggregate(Collection<? extends LedgerLine> lines) {
        if (lines == null || lines.isEmpty()) {
            return LedgerTotals.ZERO;
        }

        BigDecimal incurredGross = BigDecimal.ZERO;
        BigDecimal incurredShare = BigDecimal.ZERO;
        BigDecimal paidGross = BigDecimal.ZERO;
        BigDecimal paidShare = BigDecimal.ZERO;
        BigDecimal recoveredGross = BigDecimal.ZERO;
        BigDecimal recoveredShare = BigDecimal.ZERO;

        for (LedgerLine line : lines) {
            TransactionType type = line.getType();
            if (INCURRED_TYPES.contains(type)) {
                incurredGross = incurredGross.add(line.getAmountGross());
                incurredShare = incurredShare.add(line.getAmountShare());
            } else if (PAID_TYPES.contains(type)) {
                paidGross = paidGross.add(line.getAmountGross());
                paidShare = paidShare.add(line.getAmountShare());
            } else if (RECOVERED_TYPES.contains(type)) {
                recoveredGross = recoveredGross.add(line.getAmountGross());
                recoveredShare = recoveredShare.add(line.getAmountShare());
            }
        }

        return LedgerTotals.of(incurredGross, incurredShare, paidGross, paidShare, recoveredGross, recoveredShare);
    }
}
