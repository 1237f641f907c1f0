package com.flagship.pawnshop.outbox;

import com.flagship.pawnshop.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher behaviour against a mocked Kafka template: success marks the row published,
 * a failed send counts a retry and the last allowed attempt is reported as dead-lettered.
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "pawnshop.loans";

    @Mock
    private OutboxService outboxService;
    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;
    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "loansTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    private static OutboxEvent event(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "Loan", UUID.randomUUID(), "LoanOriginated",
            "{\"loan_code\":\"L-TEST0001\"}", Instant.now(), null, retryCount, null, 1L);
    }

    private static CompletableFuture<SendResult<String, String>> sent(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(TOPIC, event.getAggregateId().toString(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 42L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("A sent event is keyed by loan id and marked published")
    void successfulSendMarksPublished() {
        OutboxEvent event = event(0);
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
            .thenReturn(sent(event));

        publisher.publish(event);

        verify(outboxService).markPublished(event.getId());
        verify(outboxService, never()).markFailed(any(), anyString());
        verify(outboxMetrics).recordEventPublished("LoanOriginated");
    }

    @Test
    @DisplayName("A failed send records the error and leaves the event for retry")
    void failedSendMarksFailed() {
        OutboxEvent event = event(0);
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publish(event);

        verify(outboxService, never()).markPublished(any());
        verify(outboxService).markFailed(eq(event.getId()), eq("java.lang.IllegalStateException: broker down"));
        verify(outboxMetrics).recordEventPublishFailed("LoanOriginated");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    void lastAttemptIsDeadLettered() {
        OutboxEvent event = event(2);
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publish(event);

        verify(outboxMetrics).recordEventDeadLettered("LoanOriginated");
    }

    @Test
    void pollPublishesEveryEventInTheBatch() {
        OutboxEvent first = event(0);
        OutboxEvent second = event(1);
        when(outboxService.findPublishable(3, 100)).thenReturn(List.of(first, second));
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
            .thenReturn(sent(first), sent(second));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(first.getId());
        verify(outboxService).markPublished(second.getId());
    }

    @Test
    void failedPollPublishesNothing() {
        when(outboxService.findPublishable(3, 100)).thenThrow(new IllegalStateException("database down"));

        assertDoesNotThrow(() -> publisher.publishPendingEvents());
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    void deadLetterThreshold() {
        assertFalse(event(2).isDeadLetter(3));
        assertTrue(event(3).isDeadLetter(3));
    }
}
