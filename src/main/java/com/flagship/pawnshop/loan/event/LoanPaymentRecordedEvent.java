package com.flagship.pawnshop.loan.event;

import com.flagship.pawnshop.loan.Loan;
import com.flagship.pawnshop.loan.LoanStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A payment was posted. {@code status} is the loan status after the payment,
 * COMPLETED when it paid the loan off.
 */
@Value
public class LoanPaymentRecordedEvent implements LoanEvent {
    UUID eventId;
    UUID loanId;
    String loanCode;
    UUID paymentId;
    String paymentNumber;
    BigDecimal amount;
    BigDecimal totalPaid;
    BigDecimal remainingBalance;
    LoanStatus status;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanPaymentRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanPaymentRecordedEvent from(Loan loan, UUID paymentId, String paymentNumber, BigDecimal amount) {
        return new LoanPaymentRecordedEvent(
            UUID.randomUUID(),
            loan.getId(),
            loan.getLoanCode(),
            paymentId,
            paymentNumber,
            amount,
            loan.getTotalPaid(),
            loan.getRemainingBalance(),
            loan.getStatus(),
            Instant.now()
        );
    }
}
