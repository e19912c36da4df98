package com.flagship.admissions_payment.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic that payment lifecycle events are published to.
 * Events are keyed by payment id, so one payment's events stay ordered
 * within a partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.payments:admissions-payments}")
    private String paymentsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic paymentsTopic() {
        return TopicBuilder.name(paymentsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
