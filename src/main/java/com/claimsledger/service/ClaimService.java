package com.claimsledger.service;

import com.claimsledger.domain.Claim;
import com.claimsledger.domain.ClaimTransaction;
import com.claimsledger.domain.PolicyCoverage;
import com.claimsledger.exception.DuplicateClaimNumberException;
import com.claimsledger.exception.InvalidOperationException;
import com.claimsledger.exception.NotFoundException;
import com.claimsledger.ledger.CoverageEvaluator;
import com.claimsledger.ledger.LedgerAggregator;
import com.claimsledger.ledger.LiabilityDecision;
import com.claimsledger.ledger.SharePercent;
import com.claimsledger.repository.ClaimRepository;
import com.claimsledger.repository.ClaimTransactionRepository;
import com.claimsledger.repository.PolicyCoverageRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Claim orchestration: registration, ledger appends, status changes.
 *
 * CRITICAL: every method that writes to a claim or its ledger MUST:
 * 1. Validate input before touching the store
 * 2. Check idempotency (findByReferenceId) for ledger appends
 * 3. Lock the claim (findByIdForUpdate)
 * 4. Run the lifecycle guard BEFORE any write
 * 5. Return the authoritative ClaimView, so callers never re-read
 *
 * The actor is always an explicit parameter. Nothing here reads the
 * security context.
 */
@Service
@Transactional
public class ClaimService {

    private static final Logger log = LoggerFactory.getLogger(ClaimService.class);

    static final String INITIAL_RESERVE_PREFIX = "INIT-";

    private final PolicyCoverageRepository policyRepository;
    private final ClaimRepository claimRepository;
    private final ClaimTransactionRepository transactionRepository;
    private final Clock clock;

    public ClaimService(
            PolicyCoverageRepository policyRepository,
            ClaimRepository claimRepository,
            ClaimTransactionRepository transactionRepository,
            Clock clock) {
        this.policyRepository = policyRepository;
        this.claimRepository = claimRepository;
        this.transactionRepository = transactionRepository;
        this.clock = clock;
    }

    /**
     * Register a claim against a policy.
     *
     * Liability is decided once, here, by the CoverageEvaluator and never
     * changes afterwards. Status starts at OPEN.
     *
     * @param registration claim details
     * @param actor who registers the claim
     * @return snapshot of the new claim
     * @throws NotFoundException if the policy does not exist
     * @throws IllegalArgumentException if the claim number is missing, a field exceeds its column length
     *                                  or the report date is unreadable
     * @throws DuplicateClaimNumberException if the claim number is already used on the policy
     */
    public ClaimView registerClaim(ClaimRegistration registration, String actor) {
        validateActor(actor);
        if (registration == null) {
            throw new IllegalArgumentException("Claim registration cannot be null");
        }
        if (registration.policyId() == null) {
            throw new IllegalArgumentException("Policy ID is required");
        }
        if (registration.claimNumber() == null || registration.claimNumber().isBlank()) {
            throw new IllegalArgumentException("Claim number is required and must not be blank");
        }
        if (registration.initialReserve() != null && registration.initialReserve().signum() < 0) {
            throw new IllegalArgumentException("Initial reserve cannot be negative. Got: " + registration.initialReserve());
        }

        PolicyCoverage policy = policyRepository.findById(registration.policyId())
            .orElseThrow(() -> NotFoundException.policy(registration.policyId()));

        LocalDate today = LocalDate.now(clock);
        LocalDate reportDate = resolveReportDate(registration.reportDate(), today);
        LiabilityDecision decision = CoverageEvaluator.evaluate(policy, registration.lossDate(), reportDate.toString());
        LocalDate lossDate = CoverageEvaluator.parseDate(registration.lossDate()).orElse(null);

        if (decision.dataQualityIssue()) {
            log.warn("Claim {} on policy {} registered INFORMATIONAL because of bad input: {} (lossDate='{}')",
                registration.claimNumber(), policy.getPolicyNumber(), decision.reason(), registration.lossDate());
        }

        String claimNumber = registration.claimNumber().strip();
        Claim claim = new Claim(
            policy,
            claimNumber,
            decision,
            lossDate,
            reportDate,
            registration.description(),
            registration.claimantName(),
            registration.locationCountry(),
            actor
        );

        // (policy_id, claim_number) unique constraint decides duplicates
        try {
            claim = claimRepository.saveAndFlush(claim);
        } catch (DataIntegrityViolationException e) {
            if (!violatesClaimNumberKey(e)) {
                throw e;
            }
            log.warn("Duplicate claim number {} on policy {}", claimNumber, policy.getPolicyNumber());
            throw new DuplicateClaimNumberException(policy.getId(), claimNumber, e);
        }

        log.info("Claim registered - claimId={}, claimNumber={}, policy={}, liability={}, reason='{}'",
            claim.getId(), claimNumber, policy.getPolicyNumber(), claim.getLiabilityType(), claim.getLiabilityReason());

        applyInitialReserve(claim, registration.initialReserve(), today, actor);
        applyImportedTotals(claim, registration.importedTotalIncurred(), registration.importedTotalPaid(), actor);

        return snapshot(claim);
    }

    /**
     * Whether an insert failure comes from the (policy_id, claim_number) key
     * and not from some other column constraint.
     */
    static boolean violatesClaimNumberKey(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String name = ((ConstraintViolationException) cause).getConstraintName();
                if (name != null && name.toLowerCase(Locale.ROOT).contains(Claim.CLAIM_NUMBER_CONSTRAINT)) {
                    return true;
                }
            }
            String message = cause.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(Claim.CLAIM_NUMBER_CONSTRAINT)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Run the coverage evaluation for a policy without registering anything.
     *
     * @throws NotFoundException if the policy does not exist
     */
    @Transactional(readOnly = true)
    public LiabilityDecision previewLiability(Long policyId, String lossDate, String reportDate) {
        PolicyCoverage policy = policyRepository.findById(policyId)
            .orElseThrow(() -> NotFoundException.policy(policyId));
        String report = (reportDate == null || reportDate.isBlank())
            ? LocalDate.now(clock).toString()
            : reportDate;
        return CoverageEvaluator.evaluate(policy, lossDate, report);
    }

    /**
     * Append a ledger entry to a claim.
     *
     * Idempotent: a repeated referenceId on the same claim appends nothing and
     * returns the current snapshot.
     *
     * @param claimId claim to append to
     * @param request entry details
     * @param actor who records the entry
     * @return snapshot including the new entry
     * @throws IllegalArgumentException on bad amount, share, reference or actor,
     *                                  or a referenceId already used on another claim
     * @throws NotFoundException if the claim does not exist
     * @throws InvalidOperationException if the claim is not open or is informational-only
     */
    public ClaimView addTransaction(Long claimId, NewTransaction request, String actor) {
        validateActor(actor);
        if (request == null) {
            throw new IllegalArgumentException("Transaction request cannot be null");
        }
        validateReferenceId(request.referenceId());
        if (request.type() == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        validateAmount(request.type(), request.amountGross());

        Optional<ClaimTransaction> existing = transactionRepository.findByReferenceId(request.referenceId());
        if (existing.isPresent()) {
            Claim owner = existing.get().getClaim();
            if (!owner.getId().equals(claimId)) {
                throw new IllegalArgumentException(String.format(
                    "referenceId %s is already used on claim %s", request.referenceId(), owner.getClaimNumber()));
            }
            log.info("Idempotent repeat - referenceId={} already recorded on claimId={}", request.referenceId(), claimId);
            return snapshot(owner);
        }

        Claim claim = claimRepository.findByIdForUpdate(claimId)
            .orElseThrow(() -> NotFoundException.claim(claimId));

        try {
            claim.assertAcceptsTransaction(request.type());
        } catch (InvalidOperationException e) {
            log.warn("Ledger append rejected - claimId={}, status={}, liability={}, type={}: {}",
                claimId, claim.getStatus(), claim.getLiabilityType(), request.type(), e.getMessage());
            throw e;
        }

        PolicyCoverage policy = claim.getPolicy();
        SharePercent share = request.sharePercent() != null
            ? SharePercent.ofPercent(request.sharePercent())
            : policy.getParticipationShare();
        String currency = (request.currency() == null || request.currency().isBlank())
            ? policy.getCurrency()
            : request.currency();
        LocalDate transactionDate = request.transactionDate() != null
            ? request.transactionDate()
            : LocalDate.now(clock);
        BigDecimal exchangeRate = request.exchangeRate() != null ? request.exchangeRate() : BigDecimal.ONE;

        ClaimTransaction entry = new ClaimTransaction(
            claim,
            request.type(),
            transactionDate,
            request.amountGross(),
            share,
            currency,
            exchangeRate,
            request.referenceId(),
            request.payee(),
            request.notes(),
            actor
        );
        entry = transactionRepository.save(entry);
        claim.recordLedgerActivity(actor);

        log.info("Ledger entry appended - claimId={}, type={}, gross={}, share={}, shareAmount={}, referenceId={}",
            claimId, entry.getType(), entry.getAmountGross(), share, entry.getAmountShare(), entry.getReferenceId());

        return snapshot(claim);
    }

    /**
     * Consistent snapshot of a claim and its totals.
     *
     * @throws NotFoundException if the claim does not exist
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ClaimView getClaimView(Long claimId) {
        Claim claim = claimRepository.findById(claimId)
            .orElseThrow(() -> NotFoundException.claim(claimId));
        return snapshot(claim);
    }

    /**
     * Ledger of a claim, newest first.
     *
     * @throws NotFoundException if the claim does not exist
     */
    @Transactional(readOnly = true)
    public List<ClaimTransaction> getLedger(Long claimId) {
        if (!claimRepository.existsById(claimId)) {
            throw NotFoundException.claim(claimId);
        }
        return transactionRepository.findByClaimIdOrderByTransactionDateDescIdDesc(claimId);
    }

    /**
     * Change a claim's status. The caller must confirm the change explicitly.
     *
     * Requesting the current status changes nothing and returns the snapshot.
     *
     * @throws IllegalArgumentException if not confirmed or no status given
     * @throws NotFoundException if the claim does not exist
     * @throws com.claimsledger.exception.InvalidTransitionException if the move is not allowed
     */
    public ClaimView changeStatus(Long claimId, Claim.ClaimStatus newStatus, boolean confirmed, String actor) {
        validateActor(actor);
        if (newStatus == null) {
            throw new IllegalArgumentException("Target status is required");
        }
        if (!confirmed) {
            throw new IllegalArgumentException(
                "Status change to " + newStatus + " must be explicitly confirmed (confirmed=true)");
        }

        Claim claim = claimRepository.findByIdForUpdate(claimId)
            .orElseThrow(() -> NotFoundException.claim(claimId));

        Claim.ClaimStatus previous = claim.getStatus();
        boolean changed = claim.transitionTo(newStatus, LocalDate.now(clock), actor);
        if (changed) {
            claimRepository.save(claim);
            log.info("Claim status changed - claimId={}, {} -> {}, closedDate={}, actor={}",
                claimId, previous, newStatus, claim.getClosedDate(), actor);
        } else {
            log.info("Claim status unchanged - claimId={} already {}", claimId, newStatus);
        }
        return snapshot(claim);
    }

    /**
     * Replace the lump-sum figures of an INFORMATIONAL claim (bulk import path).
     *
     * @throws InvalidOperationException if the claim is ACTIVE
     * @throws NotFoundException if the claim does not exist
     */
    public ClaimView recordImportedTotals(Long claimId, BigDecimal incurred, BigDecimal paid, String actor) {
        validateActor(actor);
        Claim claim = claimRepository.findByIdForUpdate(claimId)
            .orElseThrow(() -> NotFoundException.claim(claimId));
        claim.recordImportedTotals(incurred, paid, actor);
        claimRepository.save(claim);
        log.info("Imported totals recorded - claimId={}, incurred={}, paid={}", claimId, incurred, paid);
        return snapshot(claim);
    }

    private void applyInitialReserve(Claim claim, BigDecimal initialReserve, LocalDate today, String actor) {
        if (initialReserve == null || initialReserve.signum() == 0) {
            return;
        }
        if (!claim.isActive()) {
            log.warn("Initial reserve {} ignored - claim {} is INFORMATIONAL", initialReserve, claim.getClaimNumber());
            return;
        }
        PolicyCoverage policy = claim.getPolicy();
        ClaimTransaction reserve = new ClaimTransaction(
            claim,
            ClaimTransaction.TransactionType.RESERVE_SET,
            today,
            initialReserve,
            policy.getParticipationShare(),
            policy.getCurrency(),
            BigDecimal.ONE,
            INITIAL_RESERVE_PREFIX + claim.getId(),
            null,
            "Initial reserve",
            actor
        );
        transactionRepository.save(reserve);
        log.info("Initial reserve booked - claimId={}, gross={}, shareAmount={}",
            claim.getId(), reserve.getAmountGross(), reserve.getAmountShare());
    }

    private void applyImportedTotals(Claim claim, BigDecimal incurred, BigDecimal paid, String actor) {
        if (incurred == null && paid == null) {
            return;
        }
        if (claim.isActive()) {
            log.warn("Imported totals ignored - claim {} is ACTIVE and keeps an itemized ledger",
                claim.getClaimNumber());
            return;
        }
        claim.recordImportedTotals(
            incurred != null ? incurred : BigDecimal.ZERO,
            paid != null ? paid : BigDecimal.ZERO,
            actor);
    }

    private ClaimView snapshot(Claim claim) {
        List<ClaimTransaction> ledger = transactionRepository.findByClaimIdOrderByTransactionDateDescIdDesc(claim.getId());
        return new ClaimView(claim, ledger, LedgerAggregator.aggregate(ledger));
    }

    private LocalDate resolveReportDate(String reportDate, LocalDate today) {
        if (reportDate == null || reportDate.isBlank()) {
            return today;
        }
        return CoverageEvaluator.parseDate(reportDate)
            .orElseThrow(() -> new IllegalArgumentException(
                "Report date must be an ISO date (yyyy-MM-dd). Got: " + reportDate));
    }

    private void validateActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Actor is required for every change");
        }
    }

    private void validateReferenceId(String referenceId) {
        if (referenceId == null || referenceId.isBlank()) {
            throw new IllegalArgumentException(
                "referenceId is required and must not be blank. Got: " + referenceId);
        }
    }

    /**
     * Amounts are non-zero; only RESERVE_ADJUST may be negative.
     */
    private void validateAmount(ClaimTransaction.TransactionType type, BigDecimal amount) {
        if (amount == null || amount.signum() == 0) {
            throw new IllegalArgumentException("Transaction amount must be non-zero. Got: " + amount);
        }
        if (amount.signum() < 0 && type != ClaimTransaction.TransactionType.RESERVE_ADJUST) {
            throw new IllegalArgumentException(String.format(
                "Only RESERVE_ADJUST may be negative. Got %s %s", type, amount));
        }
    }
}
