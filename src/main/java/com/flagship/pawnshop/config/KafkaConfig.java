package com.flagship.pawnshop.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration for the loan event feed.
 *
 * Declares the topic that lifecycle events from the outbox are published to.
 * The KafkaTemplate itself comes from Spring Boot auto-configuration.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.loans:pawnshop.loans}")
    private String loansTopic;

    /**
     * Creates the loans topic if it doesn't exist.
     * Events are keyed by loan id, so partitions keep per-loan ordering.
     */
    @Bean
    public NewTopic loansTopic() {
        return TopicBuilder.name(loansTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
