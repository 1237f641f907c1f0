package com.flagship.pawnshop.payment;

import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.loan.LoanLifecycleService;
import com.flagship.pawnshop.payment.dto.UpdatePaymentRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Payment corrections: the loan is locked first, a closed loan refuses the change,
 * and the loan totals are recomputed after every accepted change.
 */
@ExtendWith(MockitoExtension.class)
class PaymentServiceTest {

    private static final LocalDate PAID_ON = LocalDate.of(2024, 6, 14);

    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private LoanLifecycleService lifecycleService;

    private PaymentService service;
    private UUID loanId;
    private PaymentEntity payment;

    @BeforeEach
    void setUp() {
        service = new PaymentService(paymentRepository, lifecycleService);
        loanId = UUID.randomUUID();
        payment = PaymentEntity.record(loanId, new BigDecimal("200"), PAID_ON, PaymentMethod.CASH, null, null, null);
        lenient().when(paymentRepository.findById(payment.getId())).thenReturn(Optional.of(payment));
        lenient().when(paymentRepository.save(any(PaymentEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("Correcting a payment refreshes the loan totals after saving")
    void correctionRefreshesTotals() {
        PaymentEntity corrected = service.update(payment.getId(),
            new UpdatePaymentRequest(new BigDecimal("150"), null, null, null, "typo"));

        assertEquals(0, new BigDecimal("150").compareTo(corrected.getAmount()));
        assertEquals(PaymentMethod.CASH, corrected.getPaymentMethod());
        InOrder order = inOrder(lifecycleService, paymentRepository);
        order.verify(lifecycleService).lockForPaymentCorrection(loanId);
        order.verify(paymentRepository).save(payment);
        order.verify(lifecycleService).refreshTotals(loanId);
    }

    @Test
    @DisplayName("A payment of a closed loan cannot be corrected")
    void correctionOnClosedLoanIsRefused() {
        doThrow(new ConflictException("Cannot modify payments of a loan in COMPLETED status"))
            .when(lifecycleService).lockForPaymentCorrection(loanId);

        assertThrows(ConflictException.class, () -> service.update(payment.getId(),
            new UpdatePaymentRequest(new BigDecimal("150"), null, null, null, null)));

        assertEquals(0, new BigDecimal("200").compareTo(payment.getAmount()));
        verify(paymentRepository, never()).save(any());
        verify(lifecycleService, never()).refreshTotals(any());
    }

    @Test
    @DisplayName("Deleting a payment refreshes the loan totals")
    void deletionRefreshesTotals() {
        service.delete(payment.getId());

        InOrder order = inOrder(lifecycleService, paymentRepository);
        order.verify(lifecycleService).lockForPaymentCorrection(loanId);
        order.verify(paymentRepository).delete(payment);
        order.verify(lifecycleService).refreshTotals(loanId);
    }

    @Test
    @DisplayName("A payment of a defaulted loan cannot be deleted")
    void deletionOnDefaultedLoanIsRefused() {
        doThrow(new ConflictException("Cannot modify payments of a loan in DEFAULTED status"))
            .when(lifecycleService).lockForPaymentCorrection(loanId);

        ConflictException e = assertThrows(ConflictException.class, () -> service.delete(payment.getId()));

        assertTrue(e.getMessage().contains("DEFAULTED"));
        verify(paymentRepository, never()).delete(any(PaymentEntity.class));
        verify(lifecycleService, never()).refreshTotals(any());
    }

    @Test
    void unknownPaymentIsNotFound() {
        UUID id = UUID.randomUUID();
        when(paymentRepository.findById(id)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.delete(id));
        verify(lifecycleService, never()).lockForPaymentCorrection(any());
    }
}
