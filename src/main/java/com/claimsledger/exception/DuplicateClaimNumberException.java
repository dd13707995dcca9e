package com.claimsledger.exception;

/**
 * Claim number already registered for the policy.
 */
public class DuplicateClaimNumberException extends IllegalStateException {

    public DuplicateClaimNumberException(Long policyId, String claimNumber, Throwable cause) {
        super(String.format("Claim number %s is already registered on policy %d", claimNumber, policyId), cause);
    }
}
