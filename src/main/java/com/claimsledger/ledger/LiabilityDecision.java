package com.claimsledger.ledger;

import com.claimsledger.domain.Claim.LiabilityType;

/**
 * Outcome of a coverage evaluation.
 *
 * @param type ACTIVE or INFORMATIONAL
 * @param reason human-readable explanation, stored on the claim
 * @param dataQualityIssue true when INFORMATIONAL only because an input date
 *                         could not be read, not because the loss is uncovered
 */
public record LiabilityDecision(LiabilityType type, String reason, boolean dataQualityIssue) {

    public LiabilityDecision {
        if (type == null) {
            throw new IllegalArgumentException("Liability type cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Liability reason cannot be null or blank");
        }
        if (dataQualityIssue && type == LiabilityType.ACTIVE) {
            throw new IllegalArgumentException("An ACTIVE decision cannot carry a data quality issue");
        }
    }

    static LiabilityDecision active(String reason) {
        return new LiabilityDecision(LiabilityType.ACTIVE, reason, false);
    }

    static LiabilityDecision informational(String reason) {
        return new LiabilityDecision(LiabilityType.INFORMATIONAL, reason, false);
    }

    static LiabilityDecision invalidInput(String reason) {
        return new LiabilityDecision(LiabilityType.INFORMATIONAL, reason, true);
    }

    public boolean isActive() {
        return type == LiabilityType.ACTIVE;
    }
}
