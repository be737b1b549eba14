package com.flagship.wager_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.wagers:wagers}")
    private String wagersTopic;

    /**
     * Wager events are keyed by wager id, so three partitions keep per-wager ordering
     * while letting notices for different wagers go out in parallel.
     */
    @Bean
    public NewTopic wagersTopic() {
        return TopicBuilder.name(wagersTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
