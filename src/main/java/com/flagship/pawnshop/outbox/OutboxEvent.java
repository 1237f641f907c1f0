package com.flagship.pawnshop.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in (or already sent from) the outbox table.
 *
 * Written in the same transaction as the ledger change it describes, so an
 * event exists if and only if the change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent pending(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * True once publishing has failed often enough that the publisher stops trying.
     */
    public boolean isDeadLetter(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
