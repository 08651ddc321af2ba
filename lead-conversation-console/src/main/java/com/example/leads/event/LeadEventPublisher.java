package com.example.leads.event;

import com.example.leads.config.LeadConsoleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LeadEventPublisher {

    // resolved per event; listeners may themselves depend on services that publish
    private final ObjectProvider<LeadEventListener> listeners;
    private final KafkaTemplate<String, LeadLifecycleEvent> leadEventKafkaTemplate;
    private final LeadConsoleProperties properties;

    public void publish(LeadLifecycleEvent event) {
        listeners.orderedStream().forEach(listener -> {
            try {
                listener.onLifecycleEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Lifecycle listener {} failed for event {}", listener.getClass().getSimpleName(), event.getEventId(), ex);
            }
        });
        try {
            leadEventKafkaTemplate
                    .send(properties.getKafka().getLifecycleTopic(), event.getOrganizationId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish {} event {} to Kafka", event.getType(), event.getEventId(), ex);
                        }
                    });
        } catch (RuntimeException ex) {
            log.warn("Failed to hand {} event {} to the Kafka producer", event.getType(), event.getEventId(), ex);
        }
    }
}
