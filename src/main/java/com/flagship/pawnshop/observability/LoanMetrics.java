package com.flagship.pawnshop.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Micrometer meters for the loan lifecycle.
 *
 * <ul>
 *   <li>{@code loans.originated} / {@code loans.completed} / {@code loans.extended} / {@code loans.defaulted}</li>
 *   <li>{@code loans.payments} tagged by payment method, {@code loans.payments.amount} summary</li>
 *   <li>{@code loans.rejections} tagged by operation and reason</li>
 *   <li>{@code loans.operation.duration} tagged by operation</li>
 *   <li>{@code idempotency.cache} hit/miss</li>
 * </ul>
 */
@Component
public class LoanMetrics {

    private final MeterRegistry registry;

    private final Counter loansOriginated;
    private final Counter loansCompleted;
    private final Counter loansExtended;
    private final Counter loansDefaulted;

    public LoanMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.loansOriginated = Counter.builder("loans.originated")
                .description("Number of loans created")
                .register(registry);

        this.loansCompleted = Counter.builder("loans.completed")
                .description("Number of loans paid off or redeemed")
                .register(registry);

        this.loansExtended = Counter.builder("loans.extended")
                .description("Number of due date extensions")
                .register(registry);

        this.loansDefaulted = Counter.builder("loans.defaulted")
                .description("Number of loans forfeited")
                .register(registry);
    }

    public void incrementOriginated() {
        loansOriginated.increment();
    }

    public void incrementCompleted() {
        loansCompleted.increment();
    }

    public void incrementExtended() {
        loansExtended.increment();
    }

    public void incrementDefaulted() {
        loansDefaulted.increment();
    }

    public void recordPayment(String method, double amount) {
        registry.counter("loans.payments", "method", sanitizeTag(method)).increment();
        registry.summary("loans.payments.amount").record(amount);
    }

    /**
     * Counts an operation refused by a state or business rule.
     */
    public void recordRejection(String operation, String reason) {
        registry.counter("loans.rejections",
                "operation", sanitizeTag(operation),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public <T> T time(String operation, Supplier<T> action) {
        return Timer.builder("loans.operation.duration")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(action);
    }

    // Bounded tag values keep cardinality in check
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
