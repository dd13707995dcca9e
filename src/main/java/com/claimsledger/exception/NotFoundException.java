package com.claimsledger.exception;

import java.util.NoSuchElementException;

/**
 * Unknown claim or policy id. Mapped to 404.
 */
public class NotFoundException extends NoSuchElementException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException claim(Long claimId) {
        return new NotFoundException("Claim not found: " + claimId);
    }

    public static NotFoundException policy(Long policyId) {
        return new NotFoundException("Policy not found: " + policyId);
    }
}
