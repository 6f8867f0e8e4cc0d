package com.flagship.accounting_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.time.Duration;

/**
 * Ledger events topic. Records are keyed by company id, so a company's
 * events are read back in the order its transactions committed.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic ledgerEventsTopic(@Value("${kafka.topic.ledger-events:ledger-events}") String name,
                                      @Value("${kafka.topic.partitions:6}") int partitions,
                                      @Value("${kafka.topic.replicas:1}") short replicas) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(replicas)
                .config("retention.ms", String.valueOf(Duration.ofDays(30).toMillis()))
                .build();
    }
}
