package com.spatialflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spatialflow.dto.AutomationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for graph events published by the canvas.
 *
 * FLOW:
 *   Canvas publishes a graph event → topic "spatialflow.events"
 *                                        ↓
 *                          AutomationEventListener reads it
 *                                        ↓
 *                          Deserializes JSON → AutomationEvent
 *                                        ↓
 *                          AutomationEngine.handleEvent()
 *
 * Messages that cannot be read, or that lack a type or source node, go to
 * the dead-letter topic instead of the engine.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AutomationEventListener {

    static final String CONSUMER_GROUP = "spatialflow-engine";

    private final AutomationEngine engine;
    private final ObjectMapper objectMapper;
    private final DeadLetterQueueService deadLetterQueueService;

    @KafkaListener(topics = "${spatialflow.topics.events:spatialflow.events}", groupId = CONSUMER_GROUP)
    public void onEvent(String message) {
        AutomationEvent event;
        try {
            event = objectMapper.readValue(message, AutomationEvent.class);
        } catch (Exception e) {
            log.error("Failed to read event: {}", e.getMessage(), e);
            deadLetterQueueService.park(message, e.getMessage());
            return;
        }

        if (event.getType() == null || event.getSourceNodeId() == null || event.getSourceNodeId().isBlank()) {
            log.error("Event without type or source node: {}", message);
            deadLetterQueueService.park(message, "type and sourceNodeId are required");
            return;
        }
        engine.handleEvent(event);
    }
}
