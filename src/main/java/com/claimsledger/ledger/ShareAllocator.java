package com.claimsledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Share arithmetic for participation (line) shares.
 *
 * RULES:
 * - shareAmount = gross × sharePercent / 100, rounded HALF_EVEN to 4 decimals
 * - A raw share is normalized exactly once, at the point it is ingested
 * - A normalized share must lie in [0, 100]
 */
public final class ShareAllocator {

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Scale used for every monetary amount held in the ledger.
     */
    public static final int AMOUNT_SCALE = 4;

    private ShareAllocator() {
    }

    /**
     * Share of a gross (100%) amount.
     *
     * @param gross 100% amount, may be negative
     * @param sharePercent participation share expressed as a percentage
     * @return the participation-share amount
     */
    public static BigDecimal shareAmount(BigDecimal gross, BigDecimal sharePercent) {
        if (gross == null) {
            throw new IllegalArgumentException("Gross amount cannot be null");
        }
        if (sharePercent == null) {
            throw new IllegalArgumentException("Share percent cannot be null");
        }
        return gross.multiply(sharePercent).divide(HUNDRED, AMOUNT_SCALE, RoundingMode.HALF_EVEN);
    }

    /**
     * Resolve the two upstream encodings of a share to a percentage.
     *
     * A value up to and including 1 is a fraction (0.95 means 95%), anything
     * above 1 is already a percentage. Not idempotent for fractions below 0.01:
     * 0.005 becomes 0.5 and then 50. Callers must normalize a raw value once.
     *
     * @param value raw share as received
     * @return share as a percentage
     */
    public static BigDecimal normalizeSharePercent(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("Share value cannot be null");
        }
        if (value.compareTo(BigDecimal.ONE) <= 0) {
            return value.multiply(HUNDRED);
        }
        return value;
    }

    /**
     * @throws IllegalArgumentException if the percentage is null, negative or above 100
     */
    public static BigDecimal requireValidPercent(BigDecimal percent) {
        if (percent == null) {
            throw new IllegalArgumentException("Share percent cannot be null");
        }
        if (percent.signum() < 0 || percent.compareTo(HUNDRED) > 0) {
            throw new IllegalArgumentException(
                "Share percent must be between 0 and 100. Got: " + percent.toPlainString() +
                " (was a share normalized twice?)");
        }
        return percent;
    }
}
