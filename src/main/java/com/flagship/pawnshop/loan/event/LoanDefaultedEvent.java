package com.flagship.pawnshop.loan.event;

import com.flagship.pawnshop.loan.Loan;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * The loan was forfeited and its collateral passed to the shop.
 */
@Value
public class LoanDefaultedEvent implements LoanEvent {
    UUID eventId;
    UUID loanId;
    String loanCode;
    UUID itemId;
    BigDecimal remainingBalance;
    LocalDate defaultDate;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LoanDefaulted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanDefaultedEvent from(Loan loan, String reason) {
        return new LoanDefaultedEvent(
            UUID.randomUUID(),
            loan.getId(),
            loan.getLoanCode(),
            loan.getItemId(),
            loan.getRemainingBalance(),
            loan.getDefaultDate(),
            reason,
            Instant.now()
        );
    }
}
