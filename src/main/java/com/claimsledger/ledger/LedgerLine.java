package com.claimsledger.ledger;

import com.claimsledger.domain.ClaimTransaction.TransactionType;

import java.math.BigDecimal;

/**
 * Anything the aggregator can fold: a single ledger entry or a pre-summed
 * group of entries of one type.
 */
public interface LedgerLine {

    TransactionType getType();

    BigDecimal getAmountGross();

    BigDecimal getAmountShare();
}
