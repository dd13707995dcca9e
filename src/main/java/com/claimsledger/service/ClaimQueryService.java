package com.claimsledger.service;

import com.claimsledger.domain.Claim;
import com.claimsledger.domain.PolicyCoverage;
import com.claimsledger.exception.NotFoundException;
import com.claimsledger.ledger.LedgerAggregator;
import com.claimsledger.ledger.LedgerTotals;
import com.claimsledger.repository.ClaimRepository;
import com.claimsledger.repository.ClaimTransactionRepository;
import com.claimsledger.repository.LedgerTypeSum;
import com.claimsledger.repository.PolicyCoverageRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read models over the claim register: paged claim list with share totals,
 * and per-policy claims summary.
 *
 * Totals are always folded from the ledger through LedgerAggregator (via one
 * grouped query per page), never read from stored columns.
 */
@Service
@Transactional(readOnly = true)
public class ClaimQueryService {

    static final int LOSS_RATIO_SCALE = 4;

    private final ClaimRepository claimRepository;
    private final ClaimTransactionRepository transactionRepository;
    private final PolicyCoverageRepository policyRepository;
    private final int defaultPageSize;
    private final int maxPageSize;

    public ClaimQueryService(
            ClaimRepository claimRepository,
            ClaimTransactionRepository transactionRepository,
            PolicyCoverageRepository policyRepository,
            @Value("${claimsledger.claims.default-page-size:25}") int defaultPageSize,
            @Value("${claimsledger.claims.max-page-size:200}") int maxPageSize) {
        this.claimRepository = claimRepository;
        this.transactionRepository = transactionRepository;
        this.policyRepository = policyRepository;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    /**
     * Register filter. Null fields match everything.
     */
    public record ClaimFilter(Long policyId, Claim.LiabilityType liabilityType, Claim.ClaimStatus status, String search) {

        public static ClaimFilter none() {
            return new ClaimFilter(null, null, null, null);
        }
    }

    public record ClaimSummary(Claim claim, LedgerTotals totals) {
    }

    /**
     * One page of the register. pageTotals rolls up the rows of this page only.
     */
    public record ClaimPage(
            List<ClaimSummary> rows,
            int page,
            int size,
            long totalElements,
            int totalPages,
            LedgerTotals pageTotals) {
    }

    /**
     * Claims position of one policy.
     *
     * @param burningCost ACTIVE incurred (gross) plus INFORMATIONAL imported incurred
     * @param lossRatio ACTIVE incurred (share) / gross premium; null without a premium
     */
    public record PolicyClaimsSummary(
            Long policyId,
            String policyNumber,
            String insuredName,
            String currency,
            long activeClaims,
            long informationalClaims,
            LedgerTotals activeTotals,
            BigDecimal importedIncurred,
            BigDecimal importedPaid,
            BigDecimal burningCost,
            BigDecimal grossPremium,
            BigDecimal lossRatio) {
    }

    /**
     * Filtered, paged claim register, newest report date first.
     *
     * @param page zero-based page number, null means 0
     * @param size page size, null means the configured default; capped at the configured maximum
     * @throws IllegalArgumentException on a negative page or a size below 1
     */
    public ClaimPage listClaims(ClaimFilter filter, Integer page, Integer size) {
        ClaimFilter effective = filter != null ? filter : ClaimFilter.none();
        int pageNumber = page != null ? page : 0;
        int pageSize = size != null ? size : defaultPageSize;
        if (pageNumber < 0) {
            throw new IllegalArgumentException("Page must be zero or positive. Got: " + pageNumber);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be at least 1. Got: " + pageSize);
        }
        pageSize = Math.min(pageSize, maxPageSize);

        Pageable pageable = PageRequest.of(pageNumber, pageSize,
            Sort.by(Sort.Order.desc("reportDate"), Sort.Order.desc("id")));

        Page<Claim> result = claimRepository.search(
            effective.policyId(),
            effective.liabilityType(),
            effective.status(),
            searchPattern(effective.search()),
            pageable);

        Map<Long, LedgerTotals> totalsByClaim = totalsByClaim(
            result.getContent().stream().map(Claim::getId).collect(Collectors.toList()));

        List<ClaimSummary> rows = new ArrayList<>();
        LedgerTotals pageTotals = LedgerTotals.ZERO;
        for (Claim claim : result.getContent()) {
            LedgerTotals totals = totalsByClaim.getOrDefault(claim.getId(), LedgerTotals.ZERO);
            rows.add(new ClaimSummary(claim, totals));
            pageTotals = pageTotals.plus(totals);
        }

        return new ClaimPage(rows, pageNumber, pageSize, result.getTotalElements(), result.getTotalPages(), pageTotals);
    }

    /**
     * Claims summary of one policy.
     *
     * @throws NotFoundException if the policy does not exist
     */
    public PolicyClaimsSummary policySummary(Long policyId) {
        PolicyCoverage policy = policyRepository.findById(policyId)
            .orElseThrow(() -> NotFoundException.policy(policyId));

        List<Claim> claims = claimRepository.findByPolicyIdOrderByReportDateDescIdDesc(policyId);

        List<Long> activeIds = new ArrayList<>();
        BigDecimal importedIncurred = BigDecimal.ZERO;
        BigDecimal importedPaid = BigDecimal.ZERO;
        long informational = 0;
        for (Claim claim : claims) {
            if (claim.isActive()) {
                activeIds.add(claim.getId());
            } else {
                informational++;
                importedIncurred = importedIncurred.add(claim.getImportedTotalIncurred());
                importedPaid = importedPaid.add(claim.getImportedTotalPaid());
            }
        }

        LedgerTotals activeTotals = activeIds.isEmpty()
            ? LedgerTotals.ZERO
            : LedgerAggregator.aggregate(transactionRepository.sumByClaimAndType(activeIds));

        BigDecimal burningCost = activeTotals.incurredGross().add(importedIncurred);

        return new PolicyClaimsSummary(
            policy.getId(),
            policy.getPolicyNumber(),
            policy.getInsuredName(),
            policy.getCurrency(),
            activeIds.size(),
            informational,
            activeTotals,
            importedIncurred,
            importedPaid,
            burningCost,
            policy.getGrossPremium(),
            lossRatio(activeTotals.incurredShare(), policy.getGrossPremium()));
    }

    static BigDecimal lossRatio(BigDecimal incurredShare, BigDecimal grossPremium) {
        if (grossPremium == null || grossPremium.signum() == 0) {
            return null;
        }
        return incurredShare.divide(grossPremium, LOSS_RATIO_SCALE, RoundingMode.HALF_EVEN);
    }

    private Map<Long, LedgerTotals> totalsByClaim(Collection<Long> claimIds) {
        if (claimIds.isEmpty()) {
            return Map.of();
        }
        Map<Long, List<LedgerTypeSum>> grouped = transactionRepository.sumByClaimAndType(claimIds).stream()
            .collect(Collectors.groupingBy(LedgerTypeSum::claimId));
        return grouped.entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> LedgerAggregator.aggregate(e.getValue())));
    }

    static String searchPattern(String search) {
        if (search == null || search.isBlank()) {
            return "%";
        }
        String literal = search.strip().toLowerCase(Locale.ROOT)
            .replace("!", "!!")
            .replace("%", "!%")
            .replace("_", "!_");
        return "%" + literal + "%";
    }
}
