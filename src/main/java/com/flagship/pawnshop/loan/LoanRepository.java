package com.flagship.pawnshop.loan;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LoanRepository extends JpaRepository<LoanEntity, UUID>, JpaSpecificationExecutor<LoanEntity> {

    /**
     * Loads a loan with a row lock held until the surrounding transaction ends.
     * Every lifecycle mutation goes through here so concurrent payments on one
     * loan serialize their balance recomputation.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LoanEntity l WHERE l.id = :id")
    Optional<LoanEntity> findByIdForUpdate(@Param("id") UUID id);

    long countByCustomerIdAndStatusIn(UUID customerId, Collection<LoanStatus> statuses);

    long countByItemIdAndStatusIn(UUID itemId, Collection<LoanStatus> statuses);

    long countByStatus(LoanStatus status);

    long countByStatusIn(Collection<LoanStatus> statuses);

    long countByDueDateBeforeAndStatusIn(LocalDate date, Collection<LoanStatus> statuses);

    @Query("SELECT COUNT(DISTINCT l.customerId) FROM LoanEntity l WHERE l.status IN :statuses")
    long countDistinctCustomersWithStatusIn(@Param("statuses") Collection<LoanStatus> statuses);

    /**
     * Per-customer loan count and principal as {@code [customerId, count, sum]} rows, most loans first.
     */
    @Query("SELECT l.customerId, COUNT(l), SUM(l.principal) FROM LoanEntity l "
        + "GROUP BY l.customerId ORDER BY COUNT(l) DESC")
    List<Object[]> topCustomersByLoanCount(Pageable pageable);

    /**
     * Same rows as {@link #topCustomersByLoanCount}, largest total principal first.
     */
    @Query("SELECT l.customerId, COUNT(l), SUM(l.principal) FROM LoanEntity l "
        + "GROUP BY l.customerId ORDER BY SUM(l.principal) DESC")
    List<Object[]> topCustomersByPrincipal(Pageable pageable);

    // Aggregates over a created_at window [from, to)

    @Query("SELECT l.status, COUNT(l) FROM LoanEntity l "
        + "WHERE l.createdAt >= :from AND l.createdAt < :to GROUP BY l.status")
    List<Object[]> countByStatusCreatedBetween(@Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT COUNT(l) FROM LoanEntity l WHERE l.createdAt >= :from AND l.createdAt < :to")
    long countCreatedBetween(@Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT COUNT(l) FROM LoanEntity l WHERE l.createdAt >= :from AND l.createdAt < :to "
        + "AND l.dueDate < :today AND l.status IN :statuses")
    long countOverdueCreatedBetween(@Param("from") Instant from, @Param("to") Instant to,
                                    @Param("today") LocalDate today,
                                    @Param("statuses") Collection<LoanStatus> statuses);

    @Query("SELECT COALESCE(SUM(l.principal), 0) FROM LoanEntity l "
        + "WHERE l.createdAt >= :from AND l.createdAt < :to")
    BigDecimal sumPrincipalCreatedBetween(@Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT AVG(l.termDays) FROM LoanEntity l WHERE l.createdAt >= :from AND l.createdAt < :to")
    Double averageTermDaysCreatedBetween(@Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM PaymentEntity p, LoanEntity l "
        + "WHERE p.loanId = l.id AND l.createdAt >= :from AND l.createdAt < :to")
    BigDecimal sumPaymentsForLoansCreatedBetween(@Param("from") Instant from, @Param("to") Instant to);
}
