package com.flagship.pawnshop.payment;

import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.loan.LoanLifecycleService;
import com.flagship.pawnshop.payment.dto.UpdatePaymentRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Reads and corrections of recorded payments. New payments are posted through
 * {@link LoanLifecycleService#addPayment}.
 *
 * A correction or deletion is refused once the loan is COMPLETED or DEFAULTED,
 * and the loan's stored totals are recomputed afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final LoanLifecycleService lifecycleService;

    @Transactional(readOnly = true)
    public List<PaymentEntity> list(UUID loanId, Pageable pageable) {
        if (loanId != null) {
            return paymentRepository.findByLoanId(loanId, pageable);
        }
        return paymentRepository.findAll(pageable).getContent();
    }

    @Transactional(readOnly = true)
    public PaymentEntity get(UUID id) {
        return paymentRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("Payment", id));
    }

    /**
     * @throws ConflictException if the loan is COMPLETED or DEFAULTED
     */
    @Transactional
    public PaymentEntity update(UUID id, UpdatePaymentRequest request) {
        PaymentEntity payment = get(id);
        lifecycleService.lockForPaymentCorrection(payment.getLoanId());

        payment.correct(request.getAmount(), request.getPaymentDate(), request.getPaymentMethod(),
            request.getReferenceNumber(), request.getNotes());
        PaymentEntity saved = paymentRepository.save(payment);
        lifecycleService.refreshTotals(payment.getLoanId());
        log.info("Payment corrected: paymentNumber={}, loanId={}, amount={}",
            saved.getPaymentNumber(), saved.getLoanId(), saved.getAmount());
        return saved;
    }

    /**
     * @throws ConflictException if the loan is COMPLETED or DEFAULTED
     */
    @Transactional
    public void delete(UUID id) {
        PaymentEntity payment = get(id);
        lifecycleService.lockForPaymentCorrection(payment.getLoanId());

        paymentRepository.delete(payment);
        lifecycleService.refreshTotals(payment.getLoanId());
        log.info("Payment deleted: paymentNumber={}, loanId={}", payment.getPaymentNumber(), payment.getLoanId());
    }
}
