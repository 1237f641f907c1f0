package com.flagship.pawnshop.loan;

import com.flagship.pawnshop.payment.PaymentEntity;
import lombok.Value;

/**
 * Outcome of posting a payment: the payment and the loan as it stands afterwards.
 * {@code replayed} is true when the Idempotency-Key matched an earlier payment and
 * nothing new was written.
 */
@Value
public class PaymentPosting {
    PaymentEntity payment;
    LoanView loan;
    boolean replayed;

    public LoanStatus getLoanStatus() {
        return loan.getLoan().getStatus();
    }
}
