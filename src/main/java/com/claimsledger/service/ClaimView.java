package com.claimsledger.service;

import com.claimsledger.domain.Claim;
import com.claimsledger.domain.ClaimTransaction;
import com.claimsledger.ledger.LedgerTotals;

import java.util.List;

/**
 * Point-in-time snapshot of a claim: the claim, its ledger (newest first) and
 * the totals aggregated from exactly that ledger.
 */
public record ClaimView(Claim claim, List<ClaimTransaction> transactions, LedgerTotals totals) {

    public ClaimView {
        transactions = List.copyOf(transactions);
    }
}
