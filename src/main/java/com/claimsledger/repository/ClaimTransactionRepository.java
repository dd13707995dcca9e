package com.claimsledger.repository;

import com.claimsledger.domain.ClaimTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the claim ledger.
 *
 * CRITICAL: entries are append-only. Only save() of NEW entries is allowed;
 * delete methods inherited from JpaRepository must never be called.
 */
@Repository
public interface ClaimTransactionRepository extends JpaRepository<ClaimTransaction, Long> {

    /**
     * Ledger of one claim, newest first (ties: latest insert first).
     */
    List<ClaimTransaction> findByClaimIdOrderByTransactionDateDescIdDesc(Long claimId);

    /**
     * Idempotency lookup.
     */
    Optional<ClaimTransaction> findByReferenceId(String referenceId);

    long countByClaimId(Long claimId);

    /**
     * Ledger sums grouped by claim and type, for register pages and policy roll-ups.
     * Callers must not pass an empty collection.
     */
    @Query("SELECT new com.claimsledger.repository.LedgerTypeSum(" +
           "t.claim.id, t.type, SUM(t.amountGross), SUM(t.amountShare)) " +
           "FROM ClaimTransaction t " +
           "WHERE t.claim.id IN :claimIds " +
           "GROUP BY t.claim.id, t.type")
    List<LedgerTypeSum> sumByClaimAndType(@Param("claimIds") Collection<Long> claimIds);
}
