package com.flagship.pawnshop.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.application.ApplicationStatus;
import com.flagship.pawnshop.application.LoanApplicationEntity;
import com.flagship.pawnshop.inventory.ItemCategory;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ApplicationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("application_number")
    String applicationNumber;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("branch_id")
    UUID branchId;

    @JsonProperty("item_category")
    ItemCategory itemCategory;

    @JsonProperty("item_description")
    String itemDescription;

    @JsonProperty("estimated_value")
    BigDecimal estimatedValue;

    @JsonProperty("loan_amount")
    BigDecimal loanAmount;

    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @JsonProperty("term_months")
    int termMonths;

    @JsonProperty("status")
    ApplicationStatus status;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("processed_by")
    UUID processedBy;

    @JsonProperty("processed_at")
    Instant processedAt;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ApplicationResponse from(LoanApplicationEntity application) {
        return ApplicationResponse.builder()
            .id(application.getId())
            .applicationNumber(application.getApplicationNumber())
            .customerId(application.getCustomerId())
            .branchId(application.getBranchId())
            .itemCategory(application.getItemCategory())
            .itemDescription(application.getItemDescription())
            .estimatedValue(application.getEstimatedValue())
            .loanAmount(application.getLoanAmount())
            .interestRate(application.getInterestRate())
            .termMonths(application.getTermMonths())
            .status(application.getStatus())
            .notes(application.getNotes())
            .processedBy(application.getProcessedBy())
            .processedAt(application.getProcessedAt())
            .rejectionReason(application.getRejectionReason())
            .createdAt(application.getCreatedAt())
            .updatedAt(application.getUpdatedAt())
            .build();
    }
}
