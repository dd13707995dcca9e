package com.claimsledger.controller;

import com.claimsledger.domain.Claim;
import com.claimsledger.dto.ApiResponses;
import com.claimsledger.dto.ImportedTotalsRequest;
import com.claimsledger.dto.LiabilityPreviewRequest;
import com.claimsledger.dto.RegisterClaimRequest;
import com.claimsledger.dto.StatusChangeRequest;
import com.claimsledger.dto.TransactionRequest;
import com.claimsledger.service.ClaimQueryService;
import com.claimsledger.service.ClaimRegistration;
import com.claimsledger.service.ClaimService;
import com.claimsledger.service.ClaimView;
import com.claimsledger.service.NewTransaction;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for claims and their ledgers.
 *
 * RULES:
 * - No business logic: pure delegation to ClaimService / ClaimQueryService
 * - The actor is the authenticated principal's name, passed explicitly
 * - Every mutation answers with the full ClaimView (claim + ledger + totals)
 *
 * HTTP CONTRACT SUMMARY:
 * POST   /claims                          → 201 | 400 | 404 | 409 DUPLICATE_KEY
 * POST   /claims/liability-preview        → 200 | 404
 * GET    /claims                          → 200 (page)
 * GET    /claims/{claimId}                → 200 | 404
 * GET    /claims/{claimId}/transactions   → 200 | 404
 * POST   /claims/{claimId}/transactions   → 200 (new or idempotent repeat) | 400 | 404 | 409
 * POST   /claims/{claimId}/status         → 200 | 400 | 404 | 409 INVALID_TRANSITION
 * POST   /claims/{claimId}/imported-totals → 200 | 400 | 404 | 409
 */
@RestController
@RequestMapping("/claims")
@Tag(name = "Claims", description = "Claim registration, ledger and lifecycle")
public class ClaimController {

    private final ClaimService claimService;
    private final ClaimQueryService claimQueryService;

    public ClaimController(ClaimService claimService, ClaimQueryService claimQueryService) {
        this.claimService = claimService;
        this.claimQueryService = claimQueryService;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // READ
    // ─────────────────────────────────────────────────────────────────────────

    @GetMapping
    @Operation(
        summary = "List claims",
        description = "Claim register, newest report date first, with share totals per row and for the page"
    )
    public ResponseEntity<ApiResponses.ClaimPageResponse> listClaims(
            @Parameter(description = "Only claims of this policy") @RequestParam(required = false) Long policyId,
            @Parameter(description = "ACTIVE or INFORMATIONAL") @RequestParam(required = false) Claim.LiabilityType liabilityType,
            @Parameter(description = "OPEN, CLOSED, DENIED or REOPENED") @RequestParam(required = false) Claim.ClaimStatus status,
            @Parameter(description = "Matches claim number or claimant, case-insensitive") @RequestParam(required = false) String search,
            @Parameter(description = "Zero-based page") @RequestParam(required = false) Integer page,
            @Parameter(description = "Page size") @RequestParam(required = false) Integer size) {

        ClaimQueryService.ClaimPage result = claimQueryService.listClaims(
                new ClaimQueryService.ClaimFilter(policyId, liabilityType, status, search), page, size);

        return ResponseEntity.ok(new ApiResponses.ClaimPageResponse(result));
    }

    /**
     * HTTP Contract:
     * - 200 OK         → claim, ledger (newest first) and totals
     * - 404 Not Found  → no claim with this ID
     */
    @GetMapping("/{claimId}")
    @Operation(summary = "Get claim", description = "Claim with its ledger and aggregated totals")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Claim found"),
        @ApiResponse(responseCode = "404", description = "Claim not found")
    })
    public ResponseEntity<ApiResponses.ClaimViewResponse> getClaim(
            @Parameter(description = "Claim ID") @PathVariable Long claimId) {

        return ResponseEntity.ok(new ApiResponses.ClaimViewResponse(claimService.getClaimView(claimId)));
    }

    @GetMapping("/{claimId}/transactions")
    @Operation(summary = "Get claim ledger", description = "All ledger entries of a claim, newest first")
    public ResponseEntity<List<ApiResponses.TransactionResponse>> getLedger(
            @Parameter(description = "Claim ID") @PathVariable Long claimId) {

        List<ApiResponses.TransactionResponse> responses = claimService.getLedger(claimId)
                .stream()
                .map(ApiResponses.TransactionResponse::new)
                .collect(Collectors.toList());

        return ResponseEntity.ok(responses);
    }

    @PostMapping("/liability-preview")
    @Operation(
        summary = "Preview liability",
        description = "Evaluate coverage for a loss without registering a claim"
    )
    public ResponseEntity<ApiResponses.LiabilityResponse> previewLiability(
            @Valid @RequestBody LiabilityPreviewRequest request) {

        return ResponseEntity.ok(new ApiResponses.LiabilityResponse(
                claimService.previewLiability(request.getPolicyId(), request.getLossDate(), request.getReportDate())));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // MUTATIONS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Register a claim.
     *
     * HTTP Contract:
     * - 201 Created     → claim registered (ACTIVE or INFORMATIONAL)
     * - 400 Bad Request → missing claim number, unreadable report date
     * - 404 Not Found   → unknown policy
     * - 409 Conflict    → claim number already used on the policy (DUPLICATE_KEY)
     */
    @PostMapping
    @Operation(
        summary = "Register claim",
        description = "Register a loss against a policy. Liability is decided once, at registration."
    )
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Claim registered"),
        @ApiResponse(responseCode = "400", description = "Invalid input"),
        @ApiResponse(responseCode = "404", description = "Policy not found"),
        @ApiResponse(responseCode = "409", description = "Duplicate claim number")
    })
    public ResponseEntity<ApiResponses.ClaimViewResponse> registerClaim(
            @Valid @RequestBody RegisterClaimRequest request,
            Authentication authentication) {

        ClaimView view = claimService.registerClaim(
                new ClaimRegistration(
                        request.getPolicyId(),
                        request.getClaimNumber(),
                        request.getLossDate(),
                        request.getReportDate(),
                        request.getDescription(),
                        request.getClaimantName(),
                        request.getLocationCountry(),
                        request.getInitialReserve(),
                        request.getImportedTotalIncurred(),
                        request.getImportedTotalPaid()),
                authentication.getName());

        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.ClaimViewResponse(view));
    }

    /**
     * Append a ledger entry.
     *
     * IDEMPOTENCY: the same referenceId on the same claim appends nothing and
     * returns the current view. Safe to retry on network failure.
     *
     * HTTP Contract:
     * - 200 OK          → entry appended or already recorded
     * - 400 Bad Request → zero amount, negative non-adjustment, share outside 0-100, unknown type
     * - 409 Conflict    → claim not open or informational-only (INVALID_OPERATION)
     */
    @PostMapping("/{claimId}/transactions")
    @Operation(
        summary = "Add ledger entry",
        description = "Append a reserve, payment, fee or recovery. Idempotent on referenceId."
    )
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Entry recorded or already processed"),
        @ApiResponse(responseCode = "400", description = "Invalid amount, share or referenceId"),
        @ApiResponse(responseCode = "404", description = "Claim not found"),
        @ApiResponse(responseCode = "409", description = "Claim not open or informational-only")
    })
    public ResponseEntity<ApiResponses.ClaimViewResponse> addTransaction(
            @Parameter(description = "Claim ID") @PathVariable Long claimId,
            @Valid @RequestBody TransactionRequest request,
            Authentication authentication) {

        ClaimView view = claimService.addTransaction(
                claimId,
                new NewTransaction(
                        request.getType(),
                        request.getAmount(),
                        request.getSharePercent(),
                        request.getTransactionDate(),
                        request.getCurrency(),
                        request.getExchangeRate(),
                        request.getReferenceId(),
                        request.getPayee(),
                        request.getNotes()),
                authentication.getName());

        return ResponseEntity.ok(new ApiResponses.ClaimViewResponse(view));
    }

    /**
     * Close, deny or reopen a claim. Requires confirmed=true.
     *
     * HTTP Contract:
     * - 200 OK          → status changed, or already in the requested status
     * - 400 Bad Request → not confirmed
     * - 409 Conflict    → transition not allowed (INVALID_TRANSITION)
     */
    @PostMapping("/{claimId}/status")
    @Operation(summary = "Change claim status", description = "Close, deny or reopen. Must be confirmed.")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Status applied"),
        @ApiResponse(responseCode = "400", description = "Change not confirmed"),
        @ApiResponse(responseCode = "404", description = "Claim not found"),
        @ApiResponse(responseCode = "409", description = "Transition not allowed")
    })
    public ResponseEntity<ApiResponses.ClaimViewResponse> changeStatus(
            @Parameter(description = "Claim ID") @PathVariable Long claimId,
            @Valid @RequestBody StatusChangeRequest request,
            Authentication authentication) {

        ClaimView view = claimService.changeStatus(
                claimId, request.getStatus(), request.isConfirmed(), authentication.getName());

        return ResponseEntity.ok(new ApiResponses.ClaimViewResponse(view));
    }

    @PostMapping("/{claimId}/imported-totals")
    @Operation(
        summary = "Record imported totals",
        description = "Set the lump-sum incurred/paid of an INFORMATIONAL claim (bulk import path)"
    )
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Totals recorded"),
        @ApiResponse(responseCode = "404", description = "Claim not found"),
        @ApiResponse(responseCode = "409", description = "Claim is ACTIVE")
    })
    public ResponseEntity<ApiResponses.ClaimViewResponse> recordImportedTotals(
            @Parameter(description = "Claim ID") @PathVariable Long claimId,
            @Valid @RequestBody ImportedTotalsRequest request,
            Authentication authentication) {

        ClaimView view = claimService.recordImportedTotals(
                claimId, request.getIncurred(), request.getPaid(), authentication.getName());

        return ResponseEntity.ok(new ApiResponses.ClaimViewResponse(view));
    }
}
