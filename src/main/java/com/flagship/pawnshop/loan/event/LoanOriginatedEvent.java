package com.flagship.pawnshop.loan.event;

import com.flagship.pawnshop.loan.Loan;
import com.flagship.pawnshop.loan.LoanStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class LoanOriginatedEvent implements LoanEvent {
    UUID eventId;
    UUID loanId;
    String loanCode;
    UUID customerId;
    UUID itemId;
    BigDecimal principal;
    BigDecimal interestRate;
    LocalDate startDate;
    LocalDate dueDate;
    LoanStatus status;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanOriginated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanOriginatedEvent from(Loan loan) {
        return new LoanOriginatedEvent(
            UUID.randomUUID(),
            loan.getId(),
            loan.getLoanCode(),
            loan.getCustomerId(),
            loan.getItemId(),
            loan.getPrincipal(),
            loan.getInterestRate(),
            loan.getStartDate(),
            loan.getDueDate(),
            loan.getStatus(),
            Instant.now()
        );
    }
}
