package com.flagship.pawnshop.loan.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about a loan, written to the outbox by the lifecycle engine.
 * The loan id is the Kafka key.
 */
public interface LoanEvent {

    String AGGREGATE_TYPE = "Loan";

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getLoanId();

    String getLoanCode();

    Instant getOccurredAt();

    String getEventType();
}
