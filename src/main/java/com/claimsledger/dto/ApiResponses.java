package com.claimsledger.dto;

import com.claimsledger.domain.Claim;
import com.claimsledger.domain.ClaimTransaction;
import com.claimsledger.ledger.LedgerTotals;
import com.claimsledger.ledger.LiabilityDecision;
import com.claimsledger.service.ClaimQueryService;
import com.claimsledger.service.ClaimView;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTOs for API endpoints.
 */
public class ApiResponses {

    /**
     * Claim header (no ledger).
     */
    public static class ClaimResponse {
        private Long claimId;
        private Long policyId;
        private String policyNumber;
        private String claimNumber;
        private String liabilityType;
        private String liabilityReason;
        private String status;
        private LocalDate lossDate;
        private LocalDate reportDate;
        private LocalDate closedDate;
        private String description;
        private String claimantName;
        private String locationCountry;
        private String currency;
        private BigDecimal importedTotalIncurred;
        private BigDecimal importedTotalPaid;
        private String createdBy;
        private Instant createdAt;
        private String updatedBy;
        private Instant updatedAt;

        public ClaimResponse(Claim claim) {
            this.claimId = claim.getId();
            this.policyId = claim.getPolicy().getId();
            this.policyNumber = claim.getPolicy().getPolicyNumber();
            this.claimNumber = claim.getClaimNumber();
            this.liabilityType = claim.getLiabilityType().toString();
            this.liabilityReason = claim.getLiabilityReason();
            this.status = claim.getStatus().toString();
            this.lossDate = claim.getLossDate();
            this.reportDate = claim.getReportDate();
            this.closedDate = claim.getClosedDate();
            this.description = claim.getDescription();
            this.claimantName = claim.getClaimantName();
            this.locationCountry = claim.getLocationCountry();
            this.currency = claim.getPolicy().getCurrency();
            this.importedTotalIncurred = claim.getImportedTotalIncurred();
            this.importedTotalPaid = claim.getImportedTotalPaid();
            this.createdBy = claim.getCreatedBy();
            this.createdAt = claim.getCreatedAt();
            this.updatedBy = claim.getUpdatedBy();
            this.updatedAt = claim.getUpdatedAt();
        }

        // Getters
        public Long getClaimId() { return claimId; }
        public Long getPolicyId() { return policyId; }
        public String getPolicyNumber() { return policyNumber; }
        public String getClaimNumber() { return claimNumber; }
        public String getLiabilityType() { return liabilityType; }
        public String getLiabilityReason() { return liabilityReason; }
        public String getStatus() { return status; }
        public LocalDate getLossDate() { return lossDate; }
        public LocalDate getReportDate() { return reportDate; }
        public LocalDate getClosedDate() { return closedDate; }
        public String getDescription() { return description; }
        public String getClaimantName() { return claimantName; }
        public String getLocationCountry() { return locationCountry; }
        public String getCurrency() { return currency; }
        public BigDecimal getImportedTotalIncurred() { return importedTotalIncurred; }
        public BigDecimal getImportedTotalPaid() { return importedTotalPaid; }
        public String getCreatedBy() { return createdBy; }
        public Instant getCreatedAt() { return createdAt; }
        public String getUpdatedBy() { return updatedBy; }
        public Instant getUpdatedAt() { return updatedAt; }
    }

    /**
     * Ledger entry response.
     */
    public static class TransactionResponse {
        private Long transactionId;
        private Long claimId;
        private String type;
        private LocalDate transactionDate;
        private BigDecimal amountGross;
        private BigDecimal sharePercent;
        private BigDecimal amountShare;
        private String currency;
        private BigDecimal exchangeRate;
        private String referenceId;
        private String payee;
        private String notes;
        private String createdBy;
        private Instant createdAt;

        public TransactionResponse(ClaimTransaction entry) {
            this.transactionId = entry.getId();
            this.claimId = entry.getClaim().getId();
            this.type = entry.getType().toString();
            this.transactionDate = entry.getTransactionDate();
            this.amountGross = entry.getAmountGross();
            this.sharePercent = entry.getSharePercent();
            this.amountShare = entry.getAmountShare();
            this.currency = entry.getCurrency();
            this.exchangeRate = entry.getExchangeRate();
            this.referenceId = entry.getReferenceId();
            this.payee = entry.getPayee();
            this.notes = entry.getNotes();
            this.createdBy = entry.getCreatedBy();
            this.createdAt = entry.getCreatedAt();
        }

        // Getters
        public Long getTransactionId() { return transactionId; }
        public Long getClaimId() { return claimId; }
        public String getType() { return type; }
        public LocalDate getTransactionDate() { return transactionDate; }
        public BigDecimal getAmountGross() { return amountGross; }
        public BigDecimal getSharePercent() { return sharePercent; }
        public BigDecimal getAmountShare() { return amountShare; }
        public String getCurrency() { return currency; }
        public BigDecimal getExchangeRate() { return exchangeRate; }
        public String getReferenceId() { return referenceId; }
        public String getPayee() { return payee; }
        public String getNotes() { return notes; }
        public String getCreatedBy() { return createdBy; }
        public Instant getCreatedAt() { return createdAt; }
    }

    /**
     * Aggregated ledger figures, gross (100%) and at share.
     */
    public static class TotalsResponse {
        private BigDecimal incurredGross;
        private BigDecimal incurredShare;
        private BigDecimal paidGross;
        private BigDecimal paidShare;
        private BigDecimal recoveredGross;
        private BigDecimal recoveredShare;
        private BigDecimal outstandingGross;
        private BigDecimal outstandingShare;

        public TotalsResponse(LedgerTotals totals) {
            this.incurredGross = totals.incurredGross();
            this.incurredShare = totals.incurredShare();
            this.paidGross = totals.paidGross();
            this.paidShare = totals.paidShare();
            this.recoveredGross = totals.recoveredGross();
            this.recoveredShare = totals.recoveredShare();
            this.outstandingGross = totals.outstandingGross();
            this.outstandingShare = totals.outstandingShare();
        }

        // Getters
        public BigDecimal getIncurredGross() { return incurredGross; }
        public BigDecimal getIncurredShare() { return incurredShare; }
        public BigDecimal getPaidGross() { return paidGross; }
        public BigDecimal getPaidShare() { return paidShare; }
        public BigDecimal getRecoveredGross() { return recoveredGross; }
        public BigDecimal getRecoveredShare() { return recoveredShare; }
        public BigDecimal getOutstandingGross() { return outstandingGross; }
        public BigDecimal getOutstandingShare() { return outstandingShare; }
    }

    /**
     * Claim + ledger + totals, as returned by every mutation.
     */
    public static class ClaimViewResponse {
        private ClaimResponse claim;
        private List<TransactionResponse> transactions;
        private TotalsResponse totals;

        public ClaimViewResponse(ClaimView view) {
            this.claim = new ClaimResponse(view.claim());
            this.transactions = view.transactions().stream()
                    .map(TransactionResponse::new)
                    .collect(Collectors.toList());
            this.totals = new TotalsResponse(view.totals());
        }

        // Getters
        public ClaimResponse getClaim() { return claim; }
        public List<TransactionResponse> getTransactions() { return transactions; }
        public TotalsResponse getTotals() { return totals; }
    }

    /**
     * One row of the claim register.
     */
    public static class ClaimRowResponse {
        private ClaimResponse claim;
        private TotalsResponse totals;

        public ClaimRowResponse(ClaimQueryService.ClaimSummary row) {
            this.claim = new ClaimResponse(row.claim());
            this.totals = new TotalsResponse(row.totals());
        }

        // Getters
        public ClaimResponse getClaim() { return claim; }
        public TotalsResponse getTotals() { return totals; }
    }

    /**
     * Claim register page with the page's share summary.
     */
    public static class ClaimPageResponse {
        private List<ClaimRowResponse> content;
        private int page;
        private int size;
        private long totalElements;
        private int totalPages;
        private TotalsResponse pageTotals;

        public ClaimPageResponse(ClaimQueryService.ClaimPage page) {
            this.content = page.rows().stream()
                    .map(ClaimRowResponse::new)
                    .collect(Collectors.toList());
            this.page = page.page();
            this.size = page.size();
            this.totalElements = page.totalElements();
            this.totalPages = page.totalPages();
            this.pageTotals = new TotalsResponse(page.pageTotals());
        }

        // Getters
        public List<ClaimRowResponse> getContent() { return content; }
        public int getPage() { return page; }
        public int getSize() { return size; }
        public long getTotalElements() { return totalElements; }
        public int getTotalPages() { return totalPages; }
        public TotalsResponse getPageTotals() { return pageTotals; }
    }

    /**
     * Policy claims summary.
     */
    public static class PolicySummaryResponse {
        private Long policyId;
        private String policyNumber;
        private String insuredName;
        private String currency;
        private long activeClaims;
        private long informationalClaims;
        private TotalsResponse activeTotals;
        private BigDecimal importedIncurred;
        private BigDecimal importedPaid;
        private BigDecimal burningCost;
        private BigDecimal grossPremium;
        private BigDecimal lossRatio;

        public PolicySummaryResponse(ClaimQueryService.PolicyClaimsSummary summary) {
            this.policyId = summary.policyId();
            this.policyNumber = summary.policyNumber();
            this.insuredName = summary.insuredName();
            this.currency = summary.currency();
            this.activeClaims = summary.activeClaims();
            this.informationalClaims = summary.informationalClaims();
            this.activeTotals = new TotalsResponse(summary.activeTotals());
            this.importedIncurred = summary.importedIncurred();
            this.importedPaid = summary.importedPaid();
            this.burningCost = summary.burningCost();
            this.grossPremium = summary.grossPremium();
            this.lossRatio = summary.lossRatio();
        }

        // Getters
        public Long getPolicyId() { return policyId; }
        public String getPolicyNumber() { return policyNumber; }
        public String getInsuredName() { return insuredName; }
        public String getCurrency() { return currency; }
        public long getActiveClaims() { return activeClaims; }
        public long getInformationalClaims() { return informationalClaims; }
        public TotalsResponse getActiveTotals() { return activeTotals; }
        public BigDecimal getImportedIncurred() { return importedIncurred; }
        public BigDecimal getImportedPaid() { return importedPaid; }
        public BigDecimal getBurningCost() { return burningCost; }
        public BigDecimal getGrossPremium() { return grossPremium; }
        public BigDecimal getLossRatio() { return lossRatio; }
    }

    /**
     * Liability preview.
     */
    public static class LiabilityResponse {
        private String liabilityType;
        private String reason;
        private boolean dataQualityIssue;

        public LiabilityResponse(LiabilityDecision decision) {
            this.liabilityType = decision.type().toString();
            this.reason = decision.reason();
            this.dataQualityIssue = decision.dataQualityIssue();
        }

        // Getters
        public String getLiabilityType() { return liabilityType; }
        public String getReason() { return reason; }
        public boolean isDataQualityIssue() { return dataQualityIssue; }
    }

    /**
     * Error response.
     */
    public static class ErrorResponse {
        private String error;
        private String message;
        private Instant timestamp;

        public ErrorResponse(String error, String message) {
            this.error = error;
            this.message = message;
            this.timestamp = Instant.now();
        }

        // Getters
        public String getError() { return error; }
        public String getMessage() { return message; }
        public Instant getTimestamp() { return timestamp; }
    }
}
