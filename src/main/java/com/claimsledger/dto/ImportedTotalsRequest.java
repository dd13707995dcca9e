package com.claimsledger.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * DTO for the lump-sum figures of an informational claim.
 */
public class ImportedTotalsRequest {

    @NotNull(message = "Incurred is required")
    @DecimalMin(value = "0", message = "Incurred cannot be negative")
    private BigDecimal incurred;

    @NotNull(message = "Paid is required")
    @DecimalMin(value = "0", message = "Paid cannot be negative")
    private BigDecimal paid;

    public ImportedTotalsRequest() {
    }

    public ImportedTotalsRequest(BigDecimal incurred, BigDecimal paid) {
        this.incurred = incurred;
        this.paid = paid;
    }

    public BigDecimal getIncurred() {
        return incurred;
    }

    public void setIncurred(BigDecimal incurred) {
        this.incurred = incurred;
    }

    public BigDecimal getPaid() {
        return paid;
    }

    public void setPaid(BigDecimal paid) {
        this.paid = paid;
    }
}
