package com.flagship.pawnshop.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.pawnshop.customer.CustomerEntity;
import com.flagship.pawnshop.inventory.ItemEntity;
import com.flagship.pawnshop.loan.Loan;
import com.flagship.pawnshop.loan.LoanView;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One CSV line of the loan report. Customer and item columns read N/A when the row is gone.
 */
@Value
@JsonPropertyOrder({
    "Loan Code", "Created Date", "Start Date", "Due Date", "Loan Amount", "Interest Rate (%)",
    "Status", "Customer", "Item", "Category", "Total Paid", "Remaining Balance"
})
public class LoanExportRow {

    private static final String NOT_AVAILABLE = "N/A";

    @JsonProperty("Loan Code")
    String loanCode;

    @JsonProperty("Created Date")
    LocalDate createdDate;

    @JsonProperty("Start Date")
    LocalDate startDate;

    @JsonProperty("Due Date")
    LocalDate dueDate;

    @JsonProperty("Loan Amount")
    BigDecimal loanAmount;

    @JsonProperty("Interest Rate (%)")
    BigDecimal interestRate;

    @JsonProperty("Status")
    String status;

    @JsonProperty("Customer")
    String customer;

    @JsonProperty("Item")
    String item;

    @JsonProperty("Category")
    String category;

    @JsonProperty("Total Paid")
    BigDecimal totalPaid;

    @JsonProperty("Remaining Balance")
    BigDecimal remainingBalance;

    public static LoanExportRow from(LoanView view, LocalDate createdDate, CustomerEntity customer, ItemEntity item) {
        Loan loan = view.getLoan();
        return new LoanExportRow(
            loan.getLoanCode(),
            createdDate,
            loan.getStartDate(),
            loan.getDueDate(),
            loan.getPrincipal(),
            loan.getInterestRate(),
            loan.getStatus().name(),
            customer != null ? customer.getFullName() : NOT_AVAILABLE,
            item != null ? item.getName() : NOT_AVAILABLE,
            item != null ? item.getCategory().name() : NOT_AVAILABLE,
            view.getDetails().getTotalPaid(),
            view.getDetails().getRemainingBalance()
        );
    }
}
