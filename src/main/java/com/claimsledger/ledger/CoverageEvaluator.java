package com.claimsledger.ledger;

import com.claimsledger.domain.PolicyCoverage;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Decides whether a reported loss creates a payable liability under a policy.
 *
 * RULES:
 * - Never throws on bad dates; an unreadable date degrades to INFORMATIONAL
 *   with dataQualityIssue = true
 * - occurrence (default for a blank basis): ACTIVE iff inception ≤ loss ≤ expiry
 * - claims_made: ACTIVE iff inception ≤ report ≤ expiry and the loss is not
 *   before the retroactive date (when one is set)
 * - Unknown basis: INFORMATIONAL, never ACTIVE
 *
 * Pure and deterministic: same inputs, same decision.
 */
public final class CoverageEvaluator {

    public static final String REASON_INVALID_LOSS_DATE = "Invalid Loss Date";
    public static final String REASON_INVALID_REPORT_DATE = "Invalid Report Date";
    public static final String REASON_INVALID_RETROACTIVE_DATE = "Invalid Retroactive Date";
    public static final String REASON_MISSING_PERIOD = "Policy period incomplete";
    public static final String REASON_WITHIN_PERIOD = "Loss occurred within policy period";
    public static final String REASON_REPORTED_OUTSIDE = "Reported outside policy period";
    public static final String REASON_BEFORE_RETRO = "Loss occurred before retroactive date";
    public static final String REASON_CLAIMS_MADE_MET = "Claims-made criteria met";
    public static final String REASON_DEFAULT_FALLBACK = "Default fallback";

    private CoverageEvaluator() {
    }

    /**
     * Evaluate a loss against a stored policy, using its basis and retroactive date.
     */
    public static LiabilityDecision evaluate(PolicyCoverage policy, String lossDate, String reportDate) {
        if (policy == null) {
            throw new IllegalArgumentException("Policy cannot be null");
        }
        String retro = policy.getRetroactiveDate() != null ? policy.getRetroactiveDate().toString() : null;
        return evaluate(
            policy.getInceptionDate(),
            policy.getExpiryDate(),
            lossDate,
            reportDate,
            policy.getCoverageBasis(),
            retro
        );
    }

    /**
     * Evaluate a loss against a coverage window.
     *
     * @param inception first covered day
     * @param expiry last covered day
     * @param lossDate ISO date of the loss, as received
     * @param reportDate ISO date the loss was reported, as received
     * @param basis coverage basis code; null or blank means occurrence
     * @param retroactiveDate ISO retroactive date for claims-made cover, optional
     * @return the decision, never null
     */
    public static LiabilityDecision evaluate(LocalDate inception,
                                             LocalDate expiry,
                                             String lossDate,
                                             String reportDate,
                                             String basis,
                                             String retroactiveDate) {
        Optional<LocalDate> loss = parseDate(lossDate);
        if (loss.isEmpty()) {
            return LiabilityDecision.invalidInput(REASON_INVALID_LOSS_DATE);
        }
        if (inception == null || expiry == null) {
            return LiabilityDecision.invalidInput(REASON_MISSING_PERIOD);
        }

        Optional<CoverageBasis> coverageBasis = (basis == null || basis.isBlank())
            ? Optional.of(CoverageBasis.OCCURRENCE)
            : CoverageBasis.fromCode(basis);
        if (coverageBasis.isEmpty()) {
            return LiabilityDecision.informational(REASON_DEFAULT_FALLBACK);
        }

        switch (coverageBasis.get()) {
            case OCCURRENCE:
                if (within(loss.get(), inception, expiry)) {
                    return LiabilityDecision.active(REASON_WITHIN_PERIOD);
                }
                return LiabilityDecision.informational(
                    String.format("Loss date outside period (%s to %s)", inception, expiry));

            case CLAIMS_MADE:
                Optional<LocalDate> report = parseDate(reportDate);
                if (report.isEmpty()) {
                    return LiabilityDecision.invalidInput(REASON_INVALID_REPORT_DATE);
                }
                if (!within(report.get(), inception, expiry)) {
                    return LiabilityDecision.informational(REASON_REPORTED_OUTSIDE);
                }
                if (retroactiveDate != null && !retroactiveDate.isBlank()) {
                    Optional<LocalDate> retro = parseDate(retroactiveDate);
                    if (retro.isEmpty()) {
                        return LiabilityDecision.invalidInput(REASON_INVALID_RETROACTIVE_DATE);
                    }
                    if (loss.get().isBefore(retro.get())) {
                        return LiabilityDecision.informational(REASON_BEFORE_RETRO);
                    }
                }
                return LiabilityDecision.active(REASON_CLAIMS_MADE_MET);

            default:
                return LiabilityDecision.informational(REASON_DEFAULT_FALLBACK);
        }
    }

    /**
     * Read an ISO calendar date ("2024-06-15"). A full ISO timestamp with an
     * offset is accepted and reduced to its local date.
     *
     * @return the date, or empty if the value is blank or not a real calendar date
     */
    public static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.strip();
        try {
            return Optional.of(LocalDate.parse(trimmed));
        } catch (DateTimeParseException notADate) {
            try {
                return Optional.of(OffsetDateTime.parse(trimmed).toLocalDate());
            } catch (DateTimeParseException notATimestamp) {
                return Optional.empty();
            }
        }
    }

    private static boolean within(LocalDate date, LocalDate from, LocalDate to) {
        return !date.isBefore(from) && !date.isAfter(to);
    }
}
