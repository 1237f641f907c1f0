package com.flagship.pawnshop.application;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Aggregates are computed in {@link LoanApplicationService} over specification results,
 * since every statistic takes the same optional branch and date filters.
 */
@Repository
public interface LoanApplicationRepository
        extends JpaRepository<LoanApplicationEntity, UUID>, JpaSpecificationExecutor<LoanApplicationEntity> {
}
