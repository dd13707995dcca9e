package com.claimsledger.service;

import com.claimsledger.domain.ClaimTransaction.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Input for appending a ledger entry.
 *
 * @param sharePercent share as a percentage (0-100); null means the policy share
 * @param transactionDate null means today
 * @param currency null or blank means the policy currency
 * @param exchangeRate null means 1; recorded, never applied
 * @param referenceId caller-supplied idempotency key, required
 */
public record NewTransaction(
        TransactionType type,
        BigDecimal amountGross,
        BigDecimal sharePercent,
        LocalDate transactionDate,
        String currency,
        BigDecimal exchangeRate,
        String referenceId,
        String payee,
        String notes) {

    public static NewTransaction of(TransactionType type, BigDecimal amountGross, String referenceId) {
        return new NewTransaction(type, amountGross, null, null, null, null, referenceId, null, null);
    }

    public NewTransaction withSharePercent(BigDecimal percent) {
        return new NewTransaction(type, amountGross, percent, transactionDate, currency, exchangeRate,
            referenceId, payee, notes);
    }
}
