package com.claimsledger.dto;

import com.claimsledger.domain.ClaimTransaction.TransactionType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * DTO for appending a ledger entry to a claim.
 *
 * type is bound to the closed TransactionType enum, so an unknown type is
 * rejected as an unreadable body (400).
 */
public class TransactionRequest {

    @NotNull(message = "Transaction type is required")
    private TransactionType type;

    @NotNull(message = "Amount is required")
    private BigDecimal amount;

    /**
     * Percentage (0-100). Omit to use the policy share.
     */
    private BigDecimal sharePercent;

    private LocalDate transactionDate;

    @Size(min = 3, max = 10, message = "Currency must be 3-10 characters (e.g., USD, EUR)")
    private String currency;

    @DecimalMin(value = "0", inclusive = false, message = "Exchange rate must be positive")
    private BigDecimal exchangeRate;

    @NotBlank(message = "Reference ID is required")
    @Size(max = 255, message = "Reference ID must be at most 255 characters")
    private String referenceId;

    @Size(max = 255, message = "Payee must be at most 255 characters")
    private String payee;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    private String notes;

    public TransactionRequest() {
    }

    public TransactionRequest(TransactionType type, BigDecimal amount, String referenceId) {
        this.type = type;
        this.amount = amount;
        this.referenceId = referenceId;
    }

    public TransactionType getType() {
        return type;
    }

    public void setType(TransactionType type) {
        this.type = type;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public BigDecimal getSharePercent() {
        return sharePercent;
    }

    public void setSharePercent(BigDecimal sharePercent) {
        this.sharePercent = sharePercent;
    }

    public LocalDate getTransactionDate() {
        return transactionDate;
    }

    public void setTransactionDate(LocalDate transactionDate) {
        this.transactionDate = transactionDate;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public BigDecimal getExchangeRate() {
        return exchangeRate;
    }

    public void setExchangeRate(BigDecimal exchangeRate) {
        this.exchangeRate = exchangeRate;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public void setReferenceId(String referenceId) {
        this.referenceId = referenceId;
    }

    public String getPayee() {
        return payee;
    }

    public void setPayee(String payee) {
        this.payee = payee;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
