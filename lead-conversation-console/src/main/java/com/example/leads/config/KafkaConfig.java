package com.example.leads.config;

import com.example.leads.event.LeadLifecycleEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, LeadLifecycleEvent> leadEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties());
    }

    @Bean
    public KafkaTemplate<String, LeadLifecycleEvent> leadEventKafkaTemplate(
            ProducerFactory<String, LeadLifecycleEvent> leadEventProducerFactory) {
        return new KafkaTemplate<>(leadEventProducerFactory);
    }

    @Bean
    public NewTopic lifecycleTopic(LeadConsoleProperties properties) {
        return TopicBuilder.name(properties.getKafka().getLifecycleTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
