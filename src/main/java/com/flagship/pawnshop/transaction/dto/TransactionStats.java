package com.flagship.pawnshop.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.payment.PaymentMethod;
import com.flagship.pawnshop.transaction.TransactionStatus;
import com.flagship.pawnshop.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Totals and the daily/monthly series count COMPLETED transactions only;
 * the grouped counts cover every status.
 */
@Value
@Builder
public class TransactionStats {

    @JsonProperty("total_transactions")
    long totalTransactions;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("transactions_by_type")
    Map<TransactionType, Long> transactionsByType;

    @JsonProperty("transactions_by_status")
    Map<TransactionStatus, Long> transactionsByStatus;

    @JsonProperty("transactions_by_payment_method")
    Map<PaymentMethod, Long> transactionsByPaymentMethod;

    @JsonProperty("daily_transactions")
    List<Daily> dailyTransactions;

    @JsonProperty("monthly_transactions")
    List<Monthly> monthlyTransactions;

    @Value
    public static class Daily {

        @JsonProperty("date")
        LocalDate date;

        @JsonProperty("count")
        long count;

        @JsonProperty("amount")
        BigDecimal amount;
    }

    @Value
    public static class Monthly {

        /**
         * {@code YYYY-MM}.
         */
        @JsonProperty("month")
        String month;

        @JsonProperty("count")
        long count;

        @JsonProperty("amount")
        BigDecimal amount;
    }
}
