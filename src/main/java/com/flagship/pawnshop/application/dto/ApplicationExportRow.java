package com.flagship.pawnshop.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.pawnshop.application.LoanApplicationEntity;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One CSV line of the application export.
 */
@Value
@JsonPropertyOrder({
    "Application Number", "Customer ID", "Branch ID", "Item Category", "Item Description",
    "Estimated Value", "Loan Amount", "Interest Rate", "Term Months", "Status", "Notes",
    "Processed By", "Processed At", "Created At", "Updated At"
})
public class ApplicationExportRow {

    @JsonProperty("Application Number")
    String applicationNumber;

    @JsonProperty("Customer ID")
    UUID customerId;

    @JsonProperty("Branch ID")
    UUID branchId;

    @JsonProperty("Item Category")
    String itemCategory;

    @JsonProperty("Item Description")
    String itemDescription;

    @JsonProperty("Estimated Value")
    BigDecimal estimatedValue;

    @JsonProperty("Loan Amount")
    BigDecimal loanAmount;

    @JsonProperty("Interest Rate")
    BigDecimal interestRate;

    @JsonProperty("Term Months")
    int termMonths;

    @JsonProperty("Status")
    String status;

    @JsonProperty("Notes")
    String notes;

    @JsonProperty("Processed By")
    UUID processedBy;

    @JsonProperty("Processed At")
    Instant processedAt;

    @JsonProperty("Created At")
    Instant createdAt;

    @JsonProperty("Updated At")
    Instant updatedAt;

    public static ApplicationExportRow from(LoanApplicationEntity application) {
        return new ApplicationExportRow(
            application.getApplicationNumber(),
            application.getCustomerId(),
            application.getBranchId(),
            application.getItemCategory().name(),
            application.getItemDescription(),
            application.getEstimatedValue(),
            application.getLoanAmount(),
            application.getInterestRate(),
            application.getTermMonths(),
            application.getStatus().name(),
            application.getNotes(),
            application.getProcessedBy(),
            application.getProcessedAt(),
            application.getCreatedAt(),
            application.getUpdatedAt()
        );
    }
}
