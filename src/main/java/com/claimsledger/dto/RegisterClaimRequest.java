package com.claimsledger.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * DTO for claim registration.
 *
 * Dates are taken as strings: an unreadable loss date still registers the
 * claim (as INFORMATIONAL) instead of failing the request.
 */
public class RegisterClaimRequest {

    @NotNull(message = "Policy ID is required")
    private Long policyId;

    @NotBlank(message = "Claim number is required")
    @Size(max = 64, message = "Claim number must be at most 64 characters")
    private String claimNumber;

    @NotBlank(message = "Loss date is required")
    private String lossDate;

    private String reportDate;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    @Size(max = 255, message = "Claimant name must be at most 255 characters")
    private String claimantName;

    @Size(max = 100, message = "Location country must be at most 100 characters")
    private String locationCountry;

    @DecimalMin(value = "0", message = "Initial reserve cannot be negative")
    private BigDecimal initialReserve;

    @DecimalMin(value = "0", message = "Imported incurred cannot be negative")
    private BigDecimal importedTotalIncurred;

    @DecimalMin(value = "0", message = "Imported paid cannot be negative")
    private BigDecimal importedTotalPaid;

    public RegisterClaimRequest() {
    }

    public RegisterClaimRequest(Long policyId, String claimNumber, String lossDate, String reportDate) {
        this.policyId = policyId;
        this.claimNumber = claimNumber;
        this.lossDate = lossDate;
        this.reportDate = reportDate;
    }

    public Long getPolicyId() {
        return policyId;
    }

    public void setPolicyId(Long policyId) {
        this.policyId = policyId;
    }

    public String getClaimNumber() {
        return claimNumber;
    }

    public void setClaimNumber(String claimNumber) {
        this.claimNumber = claimNumber;
    }

    public String getLossDate() {
        return lossDate;
    }

    public void setLossDate(String lossDate) {
        this.lossDate = lossDate;
    }

    public String getReportDate() {
        return reportDate;
    }

    public void setReportDate(String reportDate) {
        this.reportDate = reportDate;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getClaimantName() {
        return claimantName;
    }

    public void setClaimantName(String claimantName) {
        this.claimantName = claimantName;
    }

    public String getLocationCountry() {
        return locationCountry;
    }

    public void setLocationCountry(String locationCountry) {
        this.locationCountry = locationCountry;
    }

    public BigDecimal getInitialReserve() {
        return initialReserve;
    }

    public void setInitialReserve(BigDecimal initialReserve) {
        this.initialReserve = initialReserve;
    }

    public BigDecimal getImportedTotalIncurred() {
        return importedTotalIncurred;
    }

    public void setImportedTotalIncurred(BigDecimal importedTotalIncurred) {
        this.importedTotalIncurred = importedTotalIncurred;
    }

    public BigDecimal getImportedTotalPaid() {
        return importedTotalPaid;
    }

    public void setImportedTotalPaid(BigDecimal importedTotalPaid) {
        this.importedTotalPaid = importedTotalPaid;
    }
}
