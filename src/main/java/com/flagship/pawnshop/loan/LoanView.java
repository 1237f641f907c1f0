package com.flagship.pawnshop.loan;

import lombok.Value;

/**
 * A loan together with its figures as of the day it was read.
 */
@Value
public class LoanView {
    Loan loan;
    LoanDetails details;
}
