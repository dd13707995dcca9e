package com.claimsledger.repository;

import com.claimsledger.domain.ClaimTransaction.TransactionType;
import com.claimsledger.ledger.LedgerLine;

import java.math.BigDecimal;

/**
 * Per-claim, per-type sums from a grouped ledger query.
 *
 * Folding these through the LedgerAggregator gives the same totals as
 * folding the individual entries.
 */
public record LedgerTypeSum(Long claimId, TransactionType type, BigDecimal amountGross, BigDecimal amountShare)
        implements LedgerLine {

    @Override
    public TransactionType getType() {
        return type;
    }

    @Override
    public BigDecimal getAmountGross() {
        return amountGross;
    }

    @Override
    public BigDecimal getAmountShare() {
        return amountShare;
    }
}
