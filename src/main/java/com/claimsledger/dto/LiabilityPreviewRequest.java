package com.claimsledger.dto;

import jakarta.validation.constraints.NotNull;

/**
 * DTO for previewing the liability decision before registering a claim.
 */
public class LiabilityPreviewRequest {

    @NotNull(message = "Policy ID is required")
    private Long policyId;

    private String lossDate;

    private String reportDate;

    public LiabilityPreviewRequest() {
    }

    public LiabilityPreviewRequest(Long policyId, String lossDate, String reportDate) {
        this.policyId = policyId;
        this.lossDate = lossDate;
        this.reportDate = reportDate;
    }

    public Long getPolicyId() {
        return policyId;
    }

    public void setPolicyId(Long policyId) {
        this.policyId = policyId;
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
}
