package com.flagship.pawnshop.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.pawnshop.customer.CustomerEntity;
import com.flagship.pawnshop.inventory.ItemEntity;
import com.flagship.pawnshop.transaction.TransactionEntity;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@JsonPropertyOrder({
    "Transaction Code", "Date", "Type", "Status", "Amount", "Payment Method",
    "Reference Number", "Customer", "Item", "Category"
})
public class TransactionExportRow {

    private static final String NOT_AVAILABLE = "N/A";

    @JsonProperty("Transaction Code")
    String transactionCode;

    @JsonProperty("Date")
    Instant date;

    @JsonProperty("Type")
    String type;

    @JsonProperty("Status")
    String status;

    @JsonProperty("Amount")
    BigDecimal amount;

    @JsonProperty("Payment Method")
    String paymentMethod;

    @JsonProperty("Reference Number")
    String referenceNumber;

    @JsonProperty("Customer")
    String customer;

    @JsonProperty("Item")
    String item;

    @JsonProperty("Category")
    String category;

    public static TransactionExportRow from(TransactionEntity transaction, CustomerEntity customer, ItemEntity item) {
        return new TransactionExportRow(
            transaction.getTransactionCode(),
            transaction.getTransactionDate(),
            transaction.getType().name(),
            transaction.getStatus().name(),
            transaction.getAmount(),
            transaction.getPaymentMethod().name(),
            transaction.getReferenceNumber(),
            customer != null ? customer.getFullName() : NOT_AVAILABLE,
            item != null ? item.getName() : NOT_AVAILABLE,
            item != null ? item.getCategory().name() : NOT_AVAILABLE
        );
    }
}
