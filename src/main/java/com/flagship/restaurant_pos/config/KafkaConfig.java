package com.flagship.restaurant_pos.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topic for low-stock and price-change notifications relayed by the outbox
 * publisher. Keyed by product id, so one product's events stay ordered.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.notifications:pos-notifications}")
    private String notificationsTopic;

    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
