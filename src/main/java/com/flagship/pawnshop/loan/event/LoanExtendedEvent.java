package com.flagship.pawnshop.loan.event;

import com.flagship.pawnshop.loan.Loan;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class LoanExtendedEvent implements LoanEvent {
    UUID eventId;
    UUID loanId;
    String loanCode;
    int additionalDays;
    LocalDate newDueDate;
    int extensionCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanExtended";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanExtendedEvent from(Loan loan, int additionalDays) {
        return new LoanExtendedEvent(
            UUID.randomUUID(),
            loan.getId(),
            loan.getLoanCode(),
            additionalDays,
            loan.getDueDate(),
            loan.getExtensionCount(),
            Instant.now()
        );
    }
}
