package com.claimsledger.ledger;

import java.util.Locale;
import java.util.Optional;

/**
 * Coverage trigger of a policy.
 */
public enum CoverageBasis {

    /** Triggered by when the loss happened. */
    OCCURRENCE("occurrence"),

    /** Triggered by when the claim is reported, optionally bounded by a retroactive date. */
    CLAIMS_MADE("claims_made");

    private final String code;

    CoverageBasis(String code) {
        this.code = code;
    }

    /**
     * Look up a basis by its upstream code, ignoring case and surrounding blanks.
     *
     * @return the basis, or empty if the code is not one of ours
     */
    public static Optional<CoverageBasis> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.strip().toLowerCase(Locale.ROOT);
        for (CoverageBasis basis : values()) {
            if (basis.code.equals(normalized)) {
                return Optional.of(basis);
            }
        }
        return Optional.empty();
    }
}
