package com.flagship.pawnshop.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.pawnshop.customer.CustomerEntity;
import com.flagship.pawnshop.inventory.ItemEntity;
import com.flagship.pawnshop.organization.BranchEntity;
import com.flagship.pawnshop.transaction.TransactionEntity;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@JsonPropertyOrder({"Transaction Code", "Date", "Amount", "Branch", "Customer", "Item", "Category"})
public class SalesExportRow {

    private static final String NOT_AVAILABLE = "N/A";

    @JsonProperty("Transaction Code")
    String transactionCode;

    @JsonProperty("Date")
    LocalDate date;

    @JsonProperty("Amount")
    BigDecimal amount;

    @JsonProperty("Branch")
    String branch;

    @JsonProperty("Customer")
    String customer;

    @JsonProperty("Item")
    String item;

    @JsonProperty("Category")
    String category;

    public static SalesExportRow from(TransactionEntity sale, LocalDate date, BranchEntity branch,
                                      CustomerEntity customer, ItemEntity item) {
        return new SalesExportRow(
            sale.getTransactionCode(),
            date,
            sale.getAmount(),
            branch != null ? branch.getName() : NOT_AVAILABLE,
            customer != null ? customer.getFullName() : NOT_AVAILABLE,
            item != null ? item.getName() : NOT_AVAILABLE,
            item != null ? item.getCategory().name() : NOT_AVAILABLE
        );
    }
}
