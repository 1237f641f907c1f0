package com.flagship.pawnshop.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID>,
        JpaSpecificationExecutor<TransactionEntity> {

    long countByTransactionDateGreaterThanEqualAndTransactionDateLessThan(Instant from, Instant to);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM TransactionEntity t WHERE t.status = :status")
    BigDecimal sumAmountByStatus(@Param("status") TransactionStatus status);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM TransactionEntity t WHERE t.status = :status "
        + "AND t.transactionDate >= :from AND t.transactionDate < :to")
    BigDecimal sumAmountByStatusBetween(@Param("status") TransactionStatus status,
                                        @Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM TransactionEntity t WHERE t.type = :type "
        + "AND t.status = :status AND t.transactionDate >= :from AND t.transactionDate < :to")
    BigDecimal sumAmountByTypeAndStatusBetween(@Param("type") TransactionType type,
                                               @Param("status") TransactionStatus status,
                                               @Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT t.type, COUNT(t) FROM TransactionEntity t GROUP BY t.type")
    List<Object[]> countGroupedByType();

    @Query("SELECT t.status, COUNT(t) FROM TransactionEntity t GROUP BY t.status")
    List<Object[]> countGroupedByStatus();

    @Query("SELECT t.paymentMethod, COUNT(t) FROM TransactionEntity t GROUP BY t.paymentMethod")
    List<Object[]> countGroupedByPaymentMethod();

    /**
     * Rows with the given status dated in [from, to), for day and month buckets computed by the caller.
     */
    List<TransactionEntity> findByStatusAndTransactionDateGreaterThanEqualAndTransactionDateLessThan(
        TransactionStatus status, Instant from, Instant to);
}
