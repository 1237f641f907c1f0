package com.flagship.pawnshop.loan.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.customer.CustomerEntity;
import com.flagship.pawnshop.inventory.ItemEntity;
import com.flagship.pawnshop.loan.Loan;
import com.flagship.pawnshop.loan.LoanDetails;
import com.flagship.pawnshop.loan.LoanStatus;
import com.flagship.pawnshop.payment.dto.PaymentResponse;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A loan with its figures computed for today. The detail view adds the
 * customer, the item and the payment history; list views leave them out.
 */
@Value
@Builder(toBuilder = true)
public class LoanResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("loan_code")
    String loanCode;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("application_id")
    UUID applicationId;

    @JsonProperty("loan_amount")
    BigDecimal principal;

    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @JsonProperty("term_days")
    int termDays;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("extended_due_date")
    LocalDate extendedDueDate;

    @JsonProperty("status")
    LoanStatus status;

    @JsonProperty("extension_count")
    int extensionCount;

    @JsonProperty("collateral_description")
    String collateralDescription;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("interest_amount")
    BigDecimal interestAmount;

    @JsonProperty("total_paid")
    BigDecimal totalPaid;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    @JsonProperty("is_overdue")
    boolean overdue;

    @JsonProperty("days_remaining")
    long daysRemaining;

    @JsonProperty("days_overdue")
    long daysOverdue;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("customer_name")
    String customerName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("customer_phone")
    String customerPhone;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("item_name")
    String itemName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("item_category")
    String itemCategory;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("payments")
    List<PaymentResponse> payments;

    /**
     * The payment just posted, on responses to a payment request.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("payment")
    PaymentResponse payment;

    public static LoanResponse from(Loan loan, LoanDetails details) {
        return LoanResponse.builder()
            .id(loan.getId())
            .loanCode(loan.getLoanCode())
            .customerId(loan.getCustomerId())
            .itemId(loan.getItemId())
            .applicationId(loan.getApplicationId())
            .principal(loan.getPrincipal())
            .interestRate(loan.getInterestRate())
            .termDays(loan.getTermDays())
            .startDate(loan.getStartDate())
            .dueDate(loan.getDueDate())
            .extendedDueDate(loan.getExtendedDueDate())
            .status(loan.getStatus())
            .extensionCount(loan.getExtensionCount())
            .collateralDescription(loan.getCollateralDescription())
            .notes(loan.getNotes())
            .interestAmount(details.getInterestAmount())
            .totalPaid(details.getTotalPaid())
            .remainingBalance(details.getRemainingBalance())
            .overdue(details.isOverdue())
            .daysRemaining(details.getDaysRemaining())
            .daysOverdue(details.getDaysOverdue())
            .createdAt(loan.getCreatedAt())
            .updatedAt(loan.getUpdatedAt())
            .build();
    }

    public LoanResponse withDetail(CustomerEntity customer, ItemEntity item, List<PaymentResponse> paymentHistory) {
        return toBuilder()
            .customerName(customer != null ? customer.getFullName() : null)
            .customerPhone(customer != null ? customer.getPhone() : null)
            .itemName(item != null ? item.getName() : null)
            .itemCategory(item != null ? item.getCategory().name() : null)
            .payments(paymentHistory)
            .build();
    }

    public LoanResponse withPayment(PaymentResponse posted) {
        return toBuilder().payment(posted).build();
    }
}
