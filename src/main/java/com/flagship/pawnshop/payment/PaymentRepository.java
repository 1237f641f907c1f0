package com.flagship.pawnshop.payment;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    List<PaymentEntity> findByLoanIdOrderByPaymentDateAscCreatedAtAsc(UUID loanId);

    List<PaymentEntity> findByLoanId(UUID loanId, Pageable pageable);

    /**
     * Used for idempotency checking when Redis has no entry.
     */
    Optional<PaymentEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Sum of all payments on a loan; zero when there are none.
     */
    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM PaymentEntity p WHERE p.loanId = :loanId")
    BigDecimal sumAmountByLoanId(@Param("loanId") UUID loanId);

    /**
     * Per-loan payment sums as {@code [loanId, sum]} rows; loans without payments are absent.
     */
    @Query("SELECT p.loanId, SUM(p.amount) FROM PaymentEntity p WHERE p.loanId IN :loanIds GROUP BY p.loanId")
    List<Object[]> sumAmountsByLoanIds(@Param("loanIds") Collection<UUID> loanIds);

    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM PaymentEntity p")
    BigDecimal sumAllAmounts();

    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM PaymentEntity p WHERE p.paymentDate = :day")
    BigDecimal sumAmountOn(@Param("day") LocalDate day);

    @Query("SELECT p.paymentDate, COALESCE(SUM(p.amount), 0) FROM PaymentEntity p "
        + "WHERE p.paymentDate >= :from AND p.paymentDate <= :to GROUP BY p.paymentDate")
    List<Object[]> sumAmountsByDayBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
