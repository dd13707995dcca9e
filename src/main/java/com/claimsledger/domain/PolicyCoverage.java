package com.claimsledger.domain;

import com.claimsledger.ledger.SharePercent;
import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Read-only projection of a policy, as far as claims are concerned.
 *
 * The policy subsystem owns this row. The claims engine only reads it to
 * classify liability and to default the currency and participation share of
 * new ledger entries.
 *
 * Notes:
 * - ourShare is stored as received from upstream. Sources encode it either as
 *   a fraction (0.95) or as a percentage (95), so it is normalized exactly once,
 *   in getParticipationShare().
 * - coverageBasis is kept as the raw upstream code. An unknown code must still
 *   reach the CoverageEvaluator, which falls back to INFORMATIONAL.
 */
@Entity
@Immutable
@Table(
    name = "policy_coverages",
    indexes = {
        @Index(name = "idx_policy_coverages_number", columnList = "policy_number", unique = true)
    }
)
public class PolicyCoverage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "policy_number", nullable = false, unique = true, length = 64)
    private String policyNumber;

    @Column(name = "insured_name", length = 255)
    private String insuredName;

    @Column(name = "inception_date", nullable = false)
    private LocalDate inceptionDate;

    @Column(name = "expiry_date", nullable = false)
    private LocalDate expiryDate;

    @Column(nullable = false, length = 10)
    private String currency;

    @Column(name = "our_share", nullable = false, precision = 19, scale = 8)
    private BigDecimal ourShare;

    @Column(name = "coverage_basis", length = 20)
    private String coverageBasis;

    @Column(name = "retroactive_date")
    private LocalDate retroactiveDate;

    @Column(name = "gross_premium", precision = 19, scale = 4)
    private BigDecimal grossPremium;

    protected PolicyCoverage() {
    }

    public PolicyCoverage(String policyNumber,
                          String insuredName,
                          LocalDate inceptionDate,
                          LocalDate expiryDate,
                          String currency,
                          BigDecimal ourShare,
                          String coverageBasis,
                          LocalDate retroactiveDate,
                          BigDecimal grossPremium) {
        if (policyNumber == null || policyNumber.isBlank()) {
            throw new IllegalArgumentException("Policy number cannot be null or blank");
        }
        if (inceptionDate == null || expiryDate == null) {
            throw new IllegalArgumentException("Policy period requires both inception and expiry dates");
        }
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("Policy currency cannot be null or blank");
        }
        if (ourShare == null) {
            throw new IllegalArgumentException("Policy share cannot be null");
        }
        this.policyNumber = policyNumber;
        this.insuredName = insuredName;
        this.inceptionDate = inceptionDate;
        this.expiryDate = expiryDate;
        this.currency = currency.strip().toUpperCase(Locale.ROOT);
        this.ourShare = ourShare;
        this.coverageBasis = coverageBasis;
        this.retroactiveDate = retroactiveDate;
        this.grossPremium = grossPremium;
    }

    public Long getId() {
        return id;
    }

    public String getPolicyNumber() {
        return policyNumber;
    }

    public String getInsuredName() {
        return insuredName;
    }

    public LocalDate getInceptionDate() {
        return inceptionDate;
    }

    public LocalDate getExpiryDate() {
        return expiryDate;
    }

    public String getCurrency() {
        return currency;
    }

    /**
     * Participation share, normalized to a percentage.
     */
    public SharePercent getParticipationShare() {
        return SharePercent.fromRaw(ourShare);
    }

    public String getCoverageBasis() {
        return coverageBasis;
    }

    public LocalDate getRetroactiveDate() {
        return retroactiveDate;
    }

    public BigDecimal getGrossPremium() {
        return grossPremium;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PolicyCoverage that = (PolicyCoverage) o;
        return Objects.equals(policyNumber, that.policyNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(policyNumber);
    }

    @Override
    public String toString() {
        return "PolicyCoverage{" +
                "id=" + id +
                ", policyNumber='" + policyNumber + '\'' +
                ", period=" + inceptionDate + ".." + expiryDate +
                ", currency='" + currency + '\'' +
                ", ourShare=" + ourShare +
                ", coverageBasis='" + coverageBasis + '\'' +
                '}';
    }
}
