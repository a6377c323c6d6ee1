package com.flagship.invoice_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for ledger events relayed from the outbox.
 *
 * Events are keyed by aggregate id, so all events of one invoice land on the
 * same partition and keep their order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:ledger.events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
