package com.spatialflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spatialflow.config.AutomationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parks inbound graph-event messages the engine could not accept.
 *
 * Graph events describe a canvas state that has moved on by the time anyone
 * looks, so nothing here is retried. The envelope keeps what is needed to
 * trace the message back:
 * {
 *   "sourceTopic": "spatialflow.events",
 *   "consumerGroup": "spatialflow-engine",
 *   "reason": "type and sourceNodeId are required",
 *   "rawMessage": "{\"type\": \"node-created\"}",
 *   "parkedAt": "2024-05-01T10:15:30Z"
 * }
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final AutomationProperties properties;
    private final Clock clock;

    public void park(String rawMessage, String reason) {
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("sourceTopic", properties.getTopics().getEvents());
            envelope.put("consumerGroup", AutomationEventListener.CONSUMER_GROUP);
            envelope.put("reason", reason);
            envelope.put("rawMessage", rawMessage);
            envelope.put("parkedAt", clock.instant().toString());

            kafkaTemplate.send(properties.getTopics().getDlq(), objectMapper.writeValueAsString(envelope));
            log.info("Graph event parked on {}: reason={}", properties.getTopics().getDlq(), reason);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to park graph event: {}", e.getMessage(), e);
        }
    }
}
