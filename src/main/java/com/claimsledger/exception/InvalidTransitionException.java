package com.claimsledger.exception;

import com.claimsledger.domain.Claim.ClaimStatus;

/**
 * Status change that is not in the claim transition table.
 */
public class InvalidTransitionException extends IllegalStateException {

    private final ClaimStatus from;
    private final ClaimStatus to;

    public InvalidTransitionException(ClaimStatus from, ClaimStatus to) {
        super(String.format("Cannot change claim status from %s to %s", from, to));
        this.from = from;
        this.to = to;
    }

    public ClaimStatus getFrom() {
        return from;
    }

    public ClaimStatus getTo() {
        return to;
    }
}
