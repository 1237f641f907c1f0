package com.flagship.pawnshop.outbox;

import com.flagship.pawnshop.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Polls the outbox and sends loan events to Kafka, keyed by loan id so that one
 * loan's events stay ordered within a partition.
 *
 * Sends are synchronous. A failed send increments the row's retry count; rows at
 * {@code outbox.publisher.max-retries} are left for manual inspection.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.loans:pawnshop.loans}")
    private String loansTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPublishable(maxRetries, batchSize);
        } catch (RuntimeException e) {
            log.error("Outbox poll failed", e);
            return;
        }
        if (!events.isEmpty()) {
            log.debug("Publishing {} outbox events", events.size());
        }
        for (OutboxEvent event : events) {
            publish(event);
        }
    }

    void publish(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(loansTopic, event.getAggregateId().toString(), event.getPayload())
                .get();
            log.debug("Published event: eventId={}, type={}, partition={}, offset={}",
                event.getId(), event.getEventType(),
                result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (ExecutionException | RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Failed to publish event: eventId={}, type={}, error={}",
                event.getId(), event.getEventType(), error);
            outboxService.markFailed(event.getId(), error);
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached {} attempts and will no longer be retried", event.getId(), maxRetries);
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }
}
