package com.claimsledger.domain;

import com.claimsledger.ledger.LedgerLine;
import com.claimsledger.ledger.ShareAllocator;
import com.claimsledger.ledger.SharePercent;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * ClaimTransaction entity - one financial movement on a claim's ledger.
 *
 * CRITICAL LEDGER RULES (NON-NEGOTIABLE):
 * 1. Entries are IMMUTABLE - once created, never modified
 * 2. Entries are APPEND-ONLY - never deleted or reordered
 * 3. sharePercent is copied at entry time, so later policy share changes
 *    do not rewrite history
 * 4. amountShare is derived once, at construction, from amountGross and sharePercent
 * 5. Only RESERVE_ADJUST may carry a negative gross amount
 * 6. Totals are never stored here; LedgerAggregator recomputes them on read
 *
 * Design decisions:
 * - referenceId is the caller's idempotency key (unique)
 * - exchangeRate is recorded as supplied and never applied; amounts stay in
 *   the transaction currency
 * - Ordering is transactionDate, then id (insertion order)
 */
@Entity
@Table(
    name = "claim_transactions",
    indexes = {
        @Index(name = "idx_claim_txn_claim", columnList = "claim_id"),
        @Index(name = "idx_claim_txn_reference_id", columnList = "reference_id", unique = true),
        @Index(name = "idx_claim_txn_claim_date", columnList = "claim_id,transaction_date")
    }
)
public class ClaimTransaction implements LedgerLine {

    public static final int MAX_CURRENCY_LENGTH = 10;
    public static final int MAX_TEXT_LENGTH = 255;
    public static final int MAX_NOTES_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "claim_id", nullable = false, updatable = false)
    private Claim claim;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 30, updatable = false)
    private TransactionType type;

    @Column(name = "transaction_date", nullable = false, updatable = false)
    private LocalDate transactionDate;

    /**
     * 100% (ground-up) amount, in the transaction currency.
     */
    @Column(name = "amount_gross", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amountGross;

    @Column(nullable = false, length = MAX_CURRENCY_LENGTH, updatable = false)
    private String currency;

    @Column(name = "exchange_rate", nullable = false, precision = 19, scale = 8, updatable = false)
    private BigDecimal exchangeRate;

    @Column(name = "share_percent", nullable = false, precision = 9, scale = 4, updatable = false)
    private BigDecimal sharePercent;

    @Column(name = "amount_share", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amountShare;

    @Column(name = "reference_id", nullable = false, unique = true, length = MAX_TEXT_LENGTH, updatable = false)
    private String referenceId;

    @Column(length = MAX_TEXT_LENGTH, updatable = false)
    private String payee;

    @Column(length = MAX_NOTES_LENGTH, updatable = false)
    private String notes;

    @Column(name = "created_by", nullable = false, length = MAX_TEXT_LENGTH, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Closed set of ledger movement types. Unknown types are rejected at the API boundary.
     */
    public enum TransactionType {
        RESERVE_SET,      // Initial or revised case reserve
        RESERVE_ADJUST,   // Signed correction to the reserve
        PAYMENT,          // Indemnity payment
        LEGAL_FEE,        // Legal expense payment
        ADJUSTER_FEE,     // Loss adjuster payment
        RECOVERY,         // Salvage / subrogation / reinsurance recovery
        IMPORT_BALANCE    // Opening balance brought in from a legacy book
    }

    private ClaimTransaction() {
    }

    /**
     * Create a ledger entry. This is the only way to create one.
     *
     * @param claim claim the entry belongs to
     * @param type movement type
     * @param transactionDate value date of the movement
     * @param amountGross 100% amount (negative only for RESERVE_ADJUST)
     * @param share participation share in force for this entry
     * @param currency currency the amount is stated in
     * @param exchangeRate rate as supplied by the caller, recorded only
     * @param referenceId unique idempotency key
     * @param actor who recorded the entry
     */
    public ClaimTransaction(Claim claim,
                            TransactionType type,
                            LocalDate transactionDate,
                            BigDecimal amountGross,
                            SharePercent share,
                            String currency,
                            BigDecimal exchangeRate,
                            String referenceId,
                            String payee,
                            String notes,
                            String actor) {
        if (claim == null) {
            throw new IllegalArgumentException("Claim cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("Transaction type cannot be null");
        }
        if (transactionDate == null) {
            throw new IllegalArgumentException("Transaction date cannot be null");
        }
        if (amountGross == null || amountGross.signum() == 0) {
            throw new IllegalArgumentException("Amount cannot be null or zero");
        }
        if (amountGross.signum() < 0 && type != TransactionType.RESERVE_ADJUST) {
            throw new IllegalArgumentException(
                "Only RESERVE_ADJUST may carry a negative amount. Got " + type + " " + amountGross);
        }
        if (share == null) {
            throw new IllegalArgumentException("Share percent cannot be null");
        }
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("Currency cannot be null or blank");
        }
        if (exchangeRate == null || exchangeRate.signum() <= 0) {
            throw new IllegalArgumentException("Exchange rate must be positive. Got: " + exchangeRate);
        }
        if (referenceId == null || referenceId.isBlank()) {
            throw new IllegalArgumentException("Reference ID cannot be null or blank");
        }
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Actor cannot be null or blank");
        }
        requireMaxLength("Currency", currency, MAX_CURRENCY_LENGTH);
        requireMaxLength("Reference ID", referenceId, MAX_TEXT_LENGTH);
        requireMaxLength("Payee", payee, MAX_TEXT_LENGTH);
        requireMaxLength("Notes", notes, MAX_NOTES_LENGTH);
        requireMaxLength("Actor", actor, MAX_TEXT_LENGTH);

        this.claim = claim;
        this.type = type;
        this.transactionDate = transactionDate;
        this.amountGross = amountGross;
        this.sharePercent = share.value();
        this.amountShare = ShareAllocator.shareAmount(amountGross, share.value());
        this.currency = currency.strip().toUpperCase(Locale.ROOT);
        this.exchangeRate = exchangeRate;
        this.referenceId = referenceId;
        this.payee = payee;
        this.notes = notes;
        this.createdBy = actor;
        this.createdAt = Instant.now();
    }

    private static void requireMaxLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new IllegalArgumentException(String.format(
                "%s must be at most %d characters. Got: %d", field, maxLength, value.length()));
        }
    }

    // Getters only - no setters (immutability)

    public Long getId() {
        return id;
    }

    public Claim getClaim() {
        return claim;
    }

    @Override
    public TransactionType getType() {
        return type;
    }

    public LocalDate getTransactionDate() {
        return transactionDate;
    }

    @Override
    public BigDecimal getAmountGross() {
        return amountGross;
    }

    public String getCurrency() {
        return currency;
    }

    public BigDecimal getExchangeRate() {
        return exchangeRate;
    }

    public BigDecimal getSharePercent() {
        return sharePercent;
    }

    @Override
    public BigDecimal getAmountShare() {
        return amountShare;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public String getPayee() {
        return payee;
    }

    public String getNotes() {
        return notes;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClaimTransaction that = (ClaimTransaction) o;
        return Objects.equals(referenceId, that.referenceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(referenceId);
    }

    @Override
    public String toString() {
        return "ClaimTransaction{" +
                "id=" + id +
                ", claimId=" + (claim != null ? claim.getId() : null) +
                ", type=" + type +
                ", transactionDate=" + transactionDate +
                ", amountGross=" + amountGross +
                ", sharePercent=" + sharePercent +
                ", amountShare=" + amountShare +
                ", currency='" + currency + '\'' +
                ", referenceId='" + referenceId + '\'' +
                '}';
    }
}
