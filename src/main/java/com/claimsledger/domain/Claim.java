package com.claimsledger.domain;

import com.claimsledger.exception.InvalidOperationException;
import com.claimsledger.ledger.ClaimLifecycle;
import com.claimsledger.ledger.LiabilityDecision;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Claim entity - one loss event reported against one policy.
 *
 * RULES:
 * 1. liabilityType is decided by the CoverageEvaluator at registration and never changes
 * 2. status only moves through ClaimLifecycle (close, deny, reopen)
 * 3. closedDate is set iff status is CLOSED or DENIED, cleared on reopen
 * 4. Claims are never deleted here
 * 5. Imported totals are only held by INFORMATIONAL claims (no itemized ledger)
 *
 * Design decisions:
 * - (policy_id, claim_number) is unique at the database level; a collision on
 *   insert is how duplicate claim numbers are detected
 * - No @Version: concurrent writers serialize on a row lock (ClaimRepository.findByIdForUpdate)
 * - createdBy / updatedBy come from the caller's actor, never from ambient state
 */
@Entity
@Table(
    name = "claims",
    uniqueConstraints = {
        @UniqueConstraint(name = Claim.CLAIM_NUMBER_CONSTRAINT, columnNames = {"policy_id", "claim_number"})
    },
    indexes = {
        @Index(name = "idx_claims_policy", columnList = "policy_id"),
        @Index(name = "idx_claims_loss_date", columnList = "loss_date"),
        @Index(name = "idx_claims_liability_type", columnList = "liability_type"),
        @Index(name = "idx_claims_status", columnList = "status")
    }
)
public class Claim {

    public static final String CLAIM_NUMBER_CONSTRAINT = "uk_claims_policy_claim_number";

    public static final int MAX_CLAIM_NUMBER_LENGTH = 64;
    public static final int MAX_DESCRIPTION_LENGTH = 2000;
    public static final int MAX_NAME_LENGTH = 255;
    public static final int MAX_COUNTRY_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "policy_id", nullable = false, updatable = false)
    private PolicyCoverage policy;

    @Column(name = "claim_number", nullable = false, length = MAX_CLAIM_NUMBER_LENGTH, updatable = false)
    private String claimNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "liability_type", nullable = false, length = 20, updatable = false)
    private LiabilityType liabilityType;

    @Column(name = "liability_reason", length = 255, updatable = false)
    private String liabilityReason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ClaimStatus status;

    /**
     * Null when the reported loss date could not be read.
     */
    @Column(name = "loss_date", updatable = false)
    private LocalDate lossDate;

    @Column(name = "report_date", nullable = false, updatable = false)
    private LocalDate reportDate;

    @Column(name = "closed_date")
    private LocalDate closedDate;

    @Column(length = MAX_DESCRIPTION_LENGTH, updatable = false)
    private String description;

    @Column(name = "claimant_name", length = MAX_NAME_LENGTH, updatable = false)
    private String claimantName;

    @Column(name = "location_country", length = MAX_COUNTRY_LENGTH, updatable = false)
    private String locationCountry;

    @Column(name = "imported_total_incurred", nullable = false, precision = 19, scale = 4)
    private BigDecimal importedTotalIncurred;

    @Column(name = "imported_total_paid", nullable = false, precision = 19, scale = 4)
    private BigDecimal importedTotalPaid;

    @Column(name = "created_by", nullable = false, length = MAX_NAME_LENGTH, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_by", nullable = false, length = MAX_NAME_LENGTH)
    private String updatedBy;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Whether the claim creates a payable obligation.
     */
    public enum LiabilityType {
        ACTIVE,         // Loss covered - itemized ledger
        INFORMATIONAL   // Tracked for record / burning cost only
    }

    /**
     * Claim lifecycle status. Allowed moves live in ClaimLifecycle.
     */
    public enum ClaimStatus {
        OPEN,
        CLOSED,
        DENIED,
        REOPENED
    }

    protected Claim() {
    }

    /**
     * Register a new claim. Status starts at OPEN.
     *
     * @param policy policy the loss is reported against
     * @param claimNumber caller-assigned number, unique per policy
     * @param decision liability decision from the CoverageEvaluator
     * @param lossDate loss date, null if it could not be parsed
     * @param reportDate date the loss was reported
     * @param actor who registers the claim
     */
    public Claim(PolicyCoverage policy,
                 String claimNumber,
                 LiabilityDecision decision,
                 LocalDate lossDate,
                 LocalDate reportDate,
                 String description,
                 String claimantName,
                 String locationCountry,
                 String actor) {
        if (policy == null) {
            throw new IllegalArgumentException("Policy cannot be null");
        }
        if (claimNumber == null || claimNumber.isBlank()) {
            throw new IllegalArgumentException("Claim number cannot be null or blank");
        }
        if (decision == null) {
            throw new IllegalArgumentException("Liability decision cannot be null");
        }
        if (reportDate == null) {
            throw new IllegalArgumentException("Report date cannot be null");
        }
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Actor cannot be null or blank");
        }
        requireMaxLength("Claim number", claimNumber, MAX_CLAIM_NUMBER_LENGTH);
        requireMaxLength("Description", description, MAX_DESCRIPTION_LENGTH);
        requireMaxLength("Claimant name", claimantName, MAX_NAME_LENGTH);
        requireMaxLength("Location country", locationCountry, MAX_COUNTRY_LENGTH);
        requireMaxLength("Actor", actor, MAX_NAME_LENGTH);

        this.policy = policy;
        this.claimNumber = claimNumber;
        this.liabilityType = decision.type();
        this.liabilityReason = decision.reason();
        this.status = ClaimStatus.OPEN;
        this.lossDate = lossDate;
        this.reportDate = reportDate;
        this.description = description;
        this.claimantName = claimantName;
        this.locationCountry = locationCountry;
        this.importedTotalIncurred = BigDecimal.ZERO;
        this.importedTotalPaid = BigDecimal.ZERO;
        this.createdBy = actor;
        this.createdAt = Instant.now();
        this.updatedBy = actor;
        this.updatedAt = this.createdAt;
    }

    // Getters

    public Long getId() {
        return id;
    }

    public PolicyCoverage getPolicy() {
        return policy;
    }

    public String getClaimNumber() {
        return claimNumber;
    }

    public LiabilityType getLiabilityType() {
        return liabilityType;
    }

    public String getLiabilityReason() {
        return liabilityReason;
    }

    public ClaimStatus getStatus() {
        return status;
    }

    public LocalDate getLossDate() {
        return lossDate;
    }

    public LocalDate getReportDate() {
        return reportDate;
    }

    public LocalDate getClosedDate() {
        return closedDate;
    }

    public String getDescription() {
        return description;
    }

    public String getClaimantName() {
        return claimantName;
    }

    public String getLocationCountry() {
        return locationCountry;
    }

    public BigDecimal getImportedTotalIncurred() {
        return importedTotalIncurred;
    }

    public BigDecimal getImportedTotalPaid() {
        return importedTotalPaid;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isActive() {
        return liabilityType == LiabilityType.ACTIVE;
    }

    // Business methods (controlled mutations)

    /**
     * Move the claim to the requested status.
     *
     * Requesting the status the claim already has changes nothing, so a
     * retried request is harmless.
     *
     * @param target requested status
     * @param today date recorded as closed date on CLOSED / DENIED
     * @param actor who requested the change
     * @return true if the status changed
     * @throws com.claimsledger.exception.InvalidTransitionException if the move is not in the transition table
     */
    public boolean transitionTo(ClaimStatus target, LocalDate today, String actor) {
        if (target == status) {
            return false;
        }
        ClaimLifecycle.requireTransition(status, target);

        switch (target) {
            case CLOSED, DENIED -> this.closedDate = today;
            case REOPENED -> this.closedDate = null;
            default -> {
                // requireTransition never lets OPEN through as a target
            }
        }
        this.status = target;
        touch(actor);
        return true;
    }

    /**
     * Check that a ledger entry of the given type may be appended now.
     *
     * @throws InvalidOperationException if the claim is not open or is informational-only
     */
    public void assertAcceptsTransaction(ClaimTransaction.TransactionType type) {
        ClaimLifecycle.requireTransactionAllowed(status, liabilityType, type);
    }

    /**
     * Record a ledger append against this claim (audit columns only).
     */
    public void recordLedgerActivity(String actor) {
        touch(actor);
    }

    /**
     * Replace the lump-sum figures held by an INFORMATIONAL claim.
     *
     * @throws InvalidOperationException if the claim is ACTIVE (its figures come from the ledger)
     * @throws IllegalArgumentException if either figure is null or negative
     */
    public void recordImportedTotals(BigDecimal incurred, BigDecimal paid, String actor) {
        if (isActive()) {
            throw new InvalidOperationException(
                "Claim " + claimNumber + " is ACTIVE; its figures come from the ledger, not from an import");
        }
        if (incurred == null || incurred.signum() < 0 || paid == null || paid.signum() < 0) {
            throw new IllegalArgumentException(
                String.format("Imported totals must be zero or positive. Got incurred=%s, paid=%s", incurred, paid));
        }
        this.importedTotalIncurred = incurred;
        this.importedTotalPaid = paid;
        touch(actor);
    }

    private void touch(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Actor cannot be null or blank");
        }
        requireMaxLength("Actor", actor, MAX_NAME_LENGTH);
        this.updatedBy = actor;
        this.updatedAt = Instant.now();
    }

    private static void requireMaxLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new IllegalArgumentException(String.format(
                "%s must be at most %d characters. Got: %d", field, maxLength, value.length()));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Claim claim = (Claim) o;
        return Objects.equals(policy, claim.policy) && Objects.equals(claimNumber, claim.claimNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(policy, claimNumber);
    }

    @Override
    public String toString() {
        return "Claim{" +
                "id=" + id +
                ", claimNumber='" + claimNumber + '\'' +
                ", policyId=" + (policy != null ? policy.getId() : null) +
                ", liabilityType=" + liabilityType +
                ", status=" + status +
                ", lossDate=" + lossDate +
                ", reportDate=" + reportDate +
                ", closedDate=" + closedDate +
                '}';
    }
}
