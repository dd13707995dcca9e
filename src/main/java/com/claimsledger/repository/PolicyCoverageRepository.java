package com.claimsledger.repository;

import com.claimsledger.domain.PolicyCoverage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Read access to the policy coverage projection.
 *
 * The policy subsystem owns these rows; the entity is @Immutable, so nothing
 * saved through this repository is ever flushed as an update.
 */
@Repository
public interface PolicyCoverageRepository extends JpaRepository<PolicyCoverage, Long> {

    Optional<PolicyCoverage> findByPolicyNumber(String policyNumber);
}
