package com.claimsledger.service;

import java.math.BigDecimal;

/**
 * Input for registering a claim.
 *
 * Dates are ISO strings as received. An unreadable loss date does not fail
 * registration; the claim is registered INFORMATIONAL with no loss date.
 *
 * @param reportDate null or blank means today
 * @param initialReserve optional 100% reserve, booked as RESERVE_SET for ACTIVE claims only
 * @param importedTotalIncurred optional lump sum, INFORMATIONAL claims only
 * @param importedTotalPaid optional lump sum, INFORMATIONAL claims only
 */
public record ClaimRegistration(
        Long policyId,
        String claimNumber,
        String lossDate,
        String reportDate,
        String description,
        String claimantName,
        String locationCountry,
        BigDecimal initialReserve,
        BigDecimal importedTotalIncurred,
        BigDecimal importedTotalPaid) {

    public static ClaimRegistration of(Long policyId, String claimNumber, String lossDate, String reportDate) {
        return new ClaimRegistration(policyId, claimNumber, lossDate, reportDate,
            null, null, null, null, null, null);
    }
}
