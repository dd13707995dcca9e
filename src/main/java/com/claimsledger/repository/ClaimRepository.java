package com.claimsledger.repository;

import com.claimsledger.domain.Claim;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Claim.
 *
 * Custom Queries Explained:
 *
 * 1. findByIdForUpdate(Long claimId)
 *    WHY: a status change and a ledger append on the same claim must not interleave.
 *    LOCKING: PESSIMISTIC_WRITE (SELECT ... FOR UPDATE), held until commit.
 *    EXAMPLE SCENARIO:
 *      - Transaction A locks claim (status OPEN) to close it
 *      - Transaction B wants to append a PAYMENT → WAITS for the lock
 *      - A commits CLOSED
 *      - B acquires the lock, sees CLOSED, guard rejects the payment
 *
 * 2. search(...)
 *    Claim register with optional filters. A null filter matches everything.
 *    term is a lower-case LIKE pattern matched against claim number and claimant,
 *    with '!' as escape character; pass "%" for no search.
 *
 * Design Notes:
 * - No @Transactional here (service layer owns transaction boundaries)
 * - (policy_id, claim_number) uniqueness is enforced by the table, not by a lookup
 */
@Repository
public interface ClaimRepository extends JpaRepository<Claim, Long> {

    /**
     * Find claim by ID with PESSIMISTIC_WRITE lock.
     *
     * MUST be used before a status change or a ledger append.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Claim c WHERE c.id = :claimId")
    Optional<Claim> findByIdForUpdate(@Param("claimId") Long claimId);

    @Query(
        value = "SELECT c FROM Claim c " +
                "WHERE (:policyId IS NULL OR c.policy.id = :policyId) " +
                "AND (:liabilityType IS NULL OR c.liabilityType = :liabilityType) " +
                "AND (:status IS NULL OR c.status = :status) " +
                "AND (LOWER(c.claimNumber) LIKE :term ESCAPE '!' OR LOWER(c.claimantName) LIKE :term ESCAPE '!')",
        countQuery = "SELECT COUNT(c) FROM Claim c " +
                "WHERE (:policyId IS NULL OR c.policy.id = :policyId) " +
                "AND (:liabilityType IS NULL OR c.liabilityType = :liabilityType) " +
                "AND (:status IS NULL OR c.status = :status) " +
                "AND (LOWER(c.claimNumber) LIKE :term ESCAPE '!' OR LOWER(c.claimantName) LIKE :term ESCAPE '!')"
    )
    Page<Claim> search(@Param("policyId") Long policyId,
                       @Param("liabilityType") Claim.LiabilityType liabilityType,
                       @Param("status") Claim.ClaimStatus status,
                       @Param("term") String term,
                       Pageable pageable);

    List<Claim> findByPolicyIdOrderByReportDateDescIdDesc(Long policyId);
}
