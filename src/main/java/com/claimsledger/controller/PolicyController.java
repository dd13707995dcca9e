package com.claimsledger.controller;

import com.claimsledger.dto.ApiResponses;
import com.claimsledger.service.ClaimQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Claims figures per policy.
 *
 * CONTRACT:
 * - GET /policies/{policyId}/claims-summary → 200 OK | 404 Not Found
 */
@RestController
@RequestMapping("/policies")
@Tag(name = "Policies", description = "Claims position of a policy")
public class PolicyController {

    private final ClaimQueryService claimQueryService;

    public PolicyController(ClaimQueryService claimQueryService) {
        this.claimQueryService = claimQueryService;
    }

    @GetMapping("/{policyId}/claims-summary")
    @Operation(
        summary = "Policy claims summary",
        description = "Claim counts, ACTIVE ledger totals, imported informational figures, burning cost and loss ratio"
    )
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Summary computed"),
        @ApiResponse(responseCode = "404", description = "Policy not found")
    })
    public ResponseEntity<ApiResponses.PolicySummaryResponse> claimsSummary(
            @Parameter(description = "Policy ID") @PathVariable Long policyId) {

        return ResponseEntity.ok(new ApiResponses.PolicySummaryResponse(claimQueryService.policySummary(policyId)));
    }
}
