package com.flagship.pawnshop.application.dto;

import com.flagship.pawnshop.application.ApplicationStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Optional filters shared by the list, statistics and export endpoints.
 * Dates bound created_at and are both inclusive.
 */
@Value
@Builder
public class ApplicationFilter {
    ApplicationStatus status;
    UUID branchId;
    UUID customerId;
    BigDecimal minValue;
    BigDecimal maxValue;
    BigDecimal minLoan;
    BigDecimal maxLoan;
    LocalDate startDate;
    LocalDate endDate;
    String search;

    public static ApplicationFilter none() {
        return ApplicationFilter.builder().build();
    }
}
