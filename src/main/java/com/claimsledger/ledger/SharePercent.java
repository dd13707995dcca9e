package com.claimsledger.ledger;

import java.math.BigDecimal;

/**
 * A participation share that is known to be a percentage in [0, 100].
 *
 * Holding a SharePercent instead of a BigDecimal marks the value as already
 * normalized, so it cannot be run through normalization a second time.
 */
public record SharePercent(BigDecimal value) {

    public static final SharePercent FULL = new SharePercent(ShareAllocator.HUNDRED);

    public SharePercent {
        ShareAllocator.requireValidPercent(value);
    }

    /**
     * Share from an upstream value that may be a fraction or a percentage.
     */
    public static SharePercent fromRaw(BigDecimal raw) {
        return new SharePercent(ShareAllocator.normalizeSharePercent(raw));
    }

    /**
     * Share from a value the caller already states as a percentage.
     */
    public static SharePercent ofPercent(BigDecimal percent) {
        return new SharePercent(percent);
    }

    public BigDecimal applyTo(BigDecimal gross) {
        return ShareAllocator.shareAmount(gross, value);
    }

    @Override
    public String toString() {
        return value.stripTrailingZeros().toPlainString() + "%";
    }
}
