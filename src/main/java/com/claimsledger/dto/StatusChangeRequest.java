package com.claimsledger.dto;

import com.claimsledger.domain.Claim.ClaimStatus;
import jakarta.validation.constraints.NotNull;

/**
 * DTO for a claim status change. confirmed must be true for the change to apply.
 */
public class StatusChangeRequest {

    @NotNull(message = "Status is required")
    private ClaimStatus status;

    private boolean confirmed;

    public StatusChangeRequest() {
    }

    public StatusChangeRequest(ClaimStatus status, boolean confirmed) {
        this.status = status;
        this.confirmed = confirmed;
    }

    public ClaimStatus getStatus() {
        return status;
    }

    public void setStatus(ClaimStatus status) {
        this.status = status;
    }

    public boolean isConfirmed() {
        return confirmed;
    }

    public void setConfirmed(boolean confirmed) {
        this.confirmed = confirmed;
    }
}
