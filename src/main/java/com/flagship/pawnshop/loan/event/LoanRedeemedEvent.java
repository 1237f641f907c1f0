package com.flagship.pawnshop.loan.event;

import com.flagship.pawnshop.loan.Loan;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class LoanRedeemedEvent implements LoanEvent {
    UUID eventId;
    UUID loanId;
    String loanCode;
    UUID itemId;
    BigDecimal totalPaid;
    LocalDate redeemedOn;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanRedeemed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanRedeemedEvent from(Loan loan) {
        return new LoanRedeemedEvent(
            UUID.randomUUID(),
            loan.getId(),
            loan.getLoanCode(),
            loan.getItemId(),
            loan.getTotalPaid(),
            loan.getActualEndDate(),
            Instant.now()
        );
    }
}
