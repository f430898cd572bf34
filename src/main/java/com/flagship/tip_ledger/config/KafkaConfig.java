package com.flagship.tip_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by this service. The payment events topic belongs to the
 * payment subsystem and is only consumed here.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.tip-events:tip-events}")
    private String tipEventsTopic;

    /**
     * Keyed by aggregate id, three partitions.
     */
    @Bean
    public NewTopic tipEventsTopic() {
        return TopicBuilder.name(tipEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
