package com.claimsledger.exception;

/**
 * Lifecycle guard violation: the claim's current state does not allow the
 * requested operation. Nothing has been written when this is thrown.
 */
public class InvalidOperationException extends IllegalStateException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
