package com.claimsledger.ledger;

import com.claimsledger.domain.Claim.ClaimStatus;
import com.claimsledger.domain.Claim.LiabilityType;
import com.claimsledger.domain.ClaimTransaction.TransactionType;
import com.claimsledger.exception.InvalidOperationException;
import com.claimsledger.exception.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Claim status state machine and the ledger guard that depends on it.
 *
 * TRANSITIONS:
 *   OPEN, REOPENED  → CLOSED, DENIED
 *   CLOSED, DENIED  → REOPENED
 *
 * There is no terminal state. OPEN is only ever the initial state.
 *
 * LEDGER GUARD:
 *   An entry of any type may be appended only while the claim is OPEN or
 *   REOPENED and its liability is ACTIVE. Informational claims carry a lump
 *   sum (imported totals), not an itemized ledger.
 */
public final class ClaimLifecycle {

    private static final Map<ClaimStatus, Set<ClaimStatus>> TRANSITIONS = new EnumMap<>(ClaimStatus.class);

    static {
        TRANSITIONS.put(ClaimStatus.OPEN, EnumSet.of(ClaimStatus.CLOSED, ClaimStatus.DENIED));
        TRANSITIONS.put(ClaimStatus.REOPENED, EnumSet.of(ClaimStatus.CLOSED, ClaimStatus.DENIED));
        TRANSITIONS.put(ClaimStatus.CLOSED, EnumSet.of(ClaimStatus.REOPENED));
        TRANSITIONS.put(ClaimStatus.DENIED, EnumSet.of(ClaimStatus.REOPENED));
    }

    private static final Set<ClaimStatus> LEDGER_OPEN_STATES = EnumSet.of(ClaimStatus.OPEN, ClaimStatus.REOPENED);

    private ClaimLifecycle() {
    }

    public static Set<ClaimStatus> allowedTargets(ClaimStatus from) {
        Set<ClaimStatus> targets = TRANSITIONS.get(from);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
    }

    public static boolean canTransition(ClaimStatus from, ClaimStatus to) {
        return allowedTargets(from).contains(to);
    }

    /**
     * @throws InvalidTransitionException if the move is not in the transition table
     */
    public static void requireTransition(ClaimStatus from, ClaimStatus to) {
        if (to == null) {
            throw new IllegalArgumentException("Target status cannot be null");
        }
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException(from, to);
        }
    }

    public static boolean acceptsLedgerEntries(ClaimStatus status) {
        return LEDGER_OPEN_STATES.contains(status);
    }

    /**
     * Check the ledger guard. Status is checked before liability.
     *
     * @throws InvalidOperationException "claim is not open" or "claim is informational-only"
     */
    public static void requireTransactionAllowed(ClaimStatus status, LiabilityType liability, TransactionType type) {
        if (type == null) {
            throw new IllegalArgumentException("Transaction type cannot be null");
        }
        if (!acceptsLedgerEntries(status)) {
            throw new InvalidOperationException(
                String.format("claim is not open (status %s); %s cannot be recorded", status, type));
        }
        if (liability != LiabilityType.ACTIVE) {
            throw new InvalidOperationException(
                String.format("claim is informational-only; %s cannot be recorded", type));
        }
    }
}
