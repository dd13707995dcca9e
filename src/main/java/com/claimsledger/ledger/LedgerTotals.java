package com.claimsledger.ledger;

import java.math.BigDecimal;

/**
 * Aggregated figures for a ledger, at 100% (gross) and at participation share.
 *
 * outstanding = incurred - paid + recovered, independently for gross and share.
 * Outstanding may be negative (over-payment); it is never clamped.
 */
public record LedgerTotals(
        BigDecimal incurredGross,
        BigDecimal incurredShare,
        BigDecimal paidGross,
        BigDecimal paidShare,
        BigDecimal recoveredGross,
        BigDecimal recoveredShare,
        BigDecimal outstandingGross,
        BigDecimal outstandingShare) {

    public static final LedgerTotals ZERO = new LedgerTotals(
        BigDecimal.ZERO, BigDecimal.ZERO,
        BigDecimal.ZERO, BigDecimal.ZERO,
        BigDecimal.ZERO, BigDecimal.ZERO,
        BigDecimal.ZERO, BigDecimal.ZERO);

    /**
     * Build totals from the three category sums; outstanding is derived.
     */
    public static LedgerTotals of(BigDecimal incurredGross, BigDecimal incurredShare,
                                  BigDecimal paidGross, BigDecimal paidShare,
                                  BigDecimal recoveredGross, BigDecimal recoveredShare) {
        return new LedgerTotals(
            incurredGross, incurredShare,
            paidGross, paidShare,
            recoveredGross, recoveredShare,
            incurredGross.subtract(paidGross).add(recoveredGross),
            incurredShare.subtract(paidShare).add(recoveredShare));
    }

    /**
     * Roll two sets of totals together (page summaries, policy roll-ups).
     */
    public LedgerTotals plus(LedgerTotals other) {
        return of(
            incurredGross.add(other.incurredGross),
            incurredShare.add(other.incurredShare),
            paidGross.add(other.paidGross),
            paidShare.add(other.paidShare),
            recoveredGross.add(other.recoveredGross),
            recoveredShare.add(other.recoveredShare));
    }
}
